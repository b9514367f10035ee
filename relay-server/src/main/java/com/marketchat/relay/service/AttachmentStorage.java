package com.marketchat.relay.service;

import java.io.IOException;
import java.io.InputStream;

/**
 * Blob storage for message attachments.
 */
public interface AttachmentStorage {

  /**
   * Stores the content and returns a reference clients can put into a
   * message's {@code file} field.
   */
  UploadResult store(String originalName, String mimeType, long size, InputStream content)
      throws IOException;
}
