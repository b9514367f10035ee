package com.marketchat.store.common;

/**
 * The caller acted on a conversation or message it does not own.
 */
public class PermissionDeniedException extends RelayException {

  private static final long serialVersionUID = 1L;

  public PermissionDeniedException(String message) {
    super(ErrorKind.PERMISSION_DENIED, message);
  }

  public static PermissionDeniedException notParticipant(String userId, String conversationId) {
    return new PermissionDeniedException(
        String.format("User %s is not a participant of conversation %s", userId, conversationId));
  }
}
