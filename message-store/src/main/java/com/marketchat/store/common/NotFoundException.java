package com.marketchat.store.common;

public class NotFoundException extends RelayException {

  private static final long serialVersionUID = 1L;

  private final String resourceType;
  private final String resourceId;

  public NotFoundException(String resourceType, String resourceId) {
    super(ErrorKind.NOT_FOUND, String.format("%s not found with ID: %s", resourceType, resourceId));
    this.resourceType = resourceType;
    this.resourceId = resourceId;
  }

  public static NotFoundException conversation(String id) {
    return new NotFoundException("Conversation", id);
  }

  public static NotFoundException message(String id) {
    return new NotFoundException("Message", id);
  }

  public String getResourceType() {
    return resourceType;
  }

  public String getResourceId() {
    return resourceId;
  }
}
