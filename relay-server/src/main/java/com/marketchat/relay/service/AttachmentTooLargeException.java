package com.marketchat.relay.service;

import com.marketchat.store.common.ValidationException;

/**
 * Upload rejected because of its size; reported as 413.
 */
public class AttachmentTooLargeException extends ValidationException {

  public AttachmentTooLargeException(long maxBytes) {
    super(String.format("File too large. Maximum size is %dMB.", maxBytes / (1024 * 1024)));
  }
}
