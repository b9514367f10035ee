package com.marketchat.relay.service;

import com.marketchat.relay.helpers.AttachmentPolicy;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.UUID;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Keeps attachments on the local file system under
 * {@code <upload dir>/<images|voice|documents>/} and serves them from
 * {@code <base url>/files/...}.
 */
@Service
public class LocalAttachmentStorage implements AttachmentStorage {

  private static final Logger logger = LoggerFactory.getLogger(LocalAttachmentStorage.class);

  private final Path root;
  private final String baseUrl;

  public LocalAttachmentStorage(@Value("${relay.upload.dir:uploads}") String uploadDir,
      @Value("${relay.upload.base-url:http://localhost:8005}") String baseUrl) {
    this.root = Paths.get(uploadDir).toAbsolutePath().normalize();
    this.baseUrl = StringUtils.removeEnd(baseUrl, "/");
  }

  @Override
  public UploadResult store(String originalName, String mimeType, long size, InputStream content)
      throws IOException {
    String folder = AttachmentPolicy.folderFor(mimeType);
    String storedName = UUID.randomUUID() + "-" + sanitize(originalName);
    Path directory = root.resolve(folder);
    Files.createDirectories(directory);
    Path target = directory.resolve(storedName);
    Files.copy(content, target, StandardCopyOption.REPLACE_EXISTING);

    String publicId = folder + "/" + storedName;
    String fileUrl = baseUrl + "/files/" + publicId;
    logger.info("Stored attachment {} ({} bytes, {}) as {}", originalName, size, mimeType, publicId);

    UploadResult result = new UploadResult();
    result.setFileUrl(fileUrl);
    result.setPublicId(publicId);
    result.setFileName(originalName);
    result.setFileSize(size);
    result.setMimeType(mimeType);
    result.setResourceType(AttachmentPolicy.resourceTypeFor(mimeType));
    if ("image".equals(result.getResourceType())) {
      result.setThumbnailUrl(fileUrl);
    }
    return result;
  }

  static String sanitize(String originalName) {
    String name = StringUtils.substringAfterLast(
        StringUtils.replaceChars(StringUtils.defaultString(originalName), '\\', '/'), "/");
    if (name.isEmpty()) {
      name = StringUtils.defaultString(originalName);
    }
    name = StringUtils.defaultIfBlank(name.replaceAll("[^A-Za-z0-9._-]", "_"), "file");
    return name.startsWith(".") ? "_" + name : name;
  }
}
