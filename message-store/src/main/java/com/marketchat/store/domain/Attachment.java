package com.marketchat.store.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Reference to an uploaded file. The blob itself lives in external storage.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Attachment {

  @JsonProperty("fileUrl")
  private String url;

  @JsonProperty("fileName")
  private String name;

  @JsonProperty("fileSize")
  private Long size;

  @JsonProperty("mimeType")
  private String mimeType;

  @JsonProperty("thumbnailUrl")
  private String thumbnailUrl;

  @JsonProperty("duration")
  private Double durationSeconds;

  public Attachment() {
  }

  public Attachment(String url, String name, Long size, String mimeType) {
    this.url = url;
    this.name = name;
    this.size = size;
    this.mimeType = mimeType;
  }

  public Attachment copy() {
    Attachment copy = new Attachment(url, name, size, mimeType);
    copy.setThumbnailUrl(thumbnailUrl);
    copy.setDurationSeconds(durationSeconds);
    return copy;
  }

  public String getUrl() { return url; }
  public void setUrl(String url) { this.url = url; }

  public String getName() { return name; }
  public void setName(String name) { this.name = name; }

  public Long getSize() { return size; }
  public void setSize(Long size) { this.size = size; }

  public String getMimeType() { return mimeType; }
  public void setMimeType(String mimeType) { this.mimeType = mimeType; }

  public String getThumbnailUrl() { return thumbnailUrl; }
  public void setThumbnailUrl(String thumbnailUrl) { this.thumbnailUrl = thumbnailUrl; }

  public Double getDurationSeconds() { return durationSeconds; }
  public void setDurationSeconds(Double durationSeconds) { this.durationSeconds = durationSeconds; }
}
