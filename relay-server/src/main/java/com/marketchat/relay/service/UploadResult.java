package com.marketchat.relay.service;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Reference and metadata of a stored attachment, as returned by
 * {@code POST /upload}.
 */
public class UploadResult {

  @JsonProperty("success")
  private boolean success = true;

  @JsonProperty("fileUrl")
  private String fileUrl;

  @JsonProperty("publicId")
  private String publicId;

  @JsonProperty("fileName")
  private String fileName;

  @JsonProperty("fileSize")
  private long fileSize;

  @JsonProperty("mimeType")
  private String mimeType;

  @JsonProperty("resourceType")
  private String resourceType;

  @JsonProperty("thumbnailUrl")
  private String thumbnailUrl;

  @JsonProperty("duration")
  private Double duration;

  public boolean isSuccess() { return success; }
  public void setSuccess(boolean success) { this.success = success; }

  public String getFileUrl() { return fileUrl; }
  public void setFileUrl(String fileUrl) { this.fileUrl = fileUrl; }

  public String getPublicId() { return publicId; }
  public void setPublicId(String publicId) { this.publicId = publicId; }

  public String getFileName() { return fileName; }
  public void setFileName(String fileName) { this.fileName = fileName; }

  public long getFileSize() { return fileSize; }
  public void setFileSize(long fileSize) { this.fileSize = fileSize; }

  public String getMimeType() { return mimeType; }
  public void setMimeType(String mimeType) { this.mimeType = mimeType; }

  public String getResourceType() { return resourceType; }
  public void setResourceType(String resourceType) { this.resourceType = resourceType; }

  public String getThumbnailUrl() { return thumbnailUrl; }
  public void setThumbnailUrl(String thumbnailUrl) { this.thumbnailUrl = thumbnailUrl; }

  public Double getDuration() { return duration; }
  public void setDuration(Double duration) { this.duration = duration; }
}
