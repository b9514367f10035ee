package com.marketchat.relay.endpoints;

import com.marketchat.relay.helpers.AttachmentPolicy;
import com.marketchat.relay.service.AttachmentStorage;
import com.marketchat.relay.service.AttachmentTooLargeException;
import com.marketchat.relay.service.UploadResult;
import com.marketchat.store.common.StoreUnavailableException;
import com.marketchat.store.common.ValidationException;
import java.io.IOException;
import java.io.InputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
public class UploadController {

  private static final Logger logger = LoggerFactory.getLogger(UploadController.class);

  private final AttachmentStorage storage;
  private final long maxBytes;

  public UploadController(AttachmentStorage storage,
      @Value("${relay.upload.max-bytes:10485760}") long maxBytes) {
    this.storage = storage;
    this.maxBytes = maxBytes;
  }

  @PostMapping("/upload")
  public UploadResult upload(@RequestParam(value = "file", required = false) MultipartFile file) {
    if (file == null || file.isEmpty()) {
      throw new ValidationException("No file uploaded");
    }
    if (file.getSize() > maxBytes) {
      throw new AttachmentTooLargeException(maxBytes);
    }
    String problem = AttachmentPolicy.validate(file.getContentType(), file.getSize());
    if (problem != null) {
      throw new ValidationException(problem);
    }

    logger.debug("Uploading file: {}, size: {}, type: {}",
        file.getOriginalFilename(), file.getSize(), file.getContentType());
    try (InputStream content = file.getInputStream()) {
      return storage.store(file.getOriginalFilename(), file.getContentType(), file.getSize(), content);
    } catch (IOException e) {
      throw new StoreUnavailableException("Upload failed: " + e.getMessage(), e);
    }
  }
}
