package com.marketchat.store.helpers;

import com.marketchat.store.domain.Attachment;
import com.marketchat.store.domain.MessageKind;
import com.marketchat.store.domain.SendCommand;
import org.apache.commons.lang3.StringUtils;


/**
 * Validation logic for SendCommand payloads.
 * Returns null if OK, otherwise an error message string describing the problem.
 */
public class MessageValidator {

  public static final int DEFAULT_MAX_TEXT_LENGTH = 5000;

  public static String validate(SendCommand command) {
    return validate(command, DEFAULT_MAX_TEXT_LENGTH);
  }

  public static String validate(SendCommand command, int maxTextLength) {
    if (command == null) return "payload missing";

    // identities
    if (StringUtils.isBlank(command.getConversationId())) return "conversationId missing";
    if (StringUtils.isBlank(command.getSenderId())) return "senderId missing";
    if (StringUtils.isBlank(command.getReceiverId())) return "receiverId missing";
    if (command.getSenderId().equals(command.getReceiverId()))
      return "senderId and receiverId must differ";

    // type
    MessageKind kind = command.resolveKind();
    if (kind == null) return "type invalid (must be text|image|document|voice)";

    // body: inline text or an attachment reference, never neither
    Attachment file = command.getFile();
    boolean hasText = StringUtils.isNotBlank(command.getText());
    boolean hasFile = file != null && StringUtils.isNotBlank(file.getUrl());
    if (!hasText && !hasFile) return "message body missing (text or file required)";
    if (kind.requiresAttachment() && !hasFile) return "file missing for type " + kind.wireName();
    if (kind == MessageKind.TEXT && !hasText) return "text missing";
    if (hasText && command.getText().length() > maxTextLength)
      return "text too long (max " + maxTextLength + " chars)";

    if (hasFile) {
      if (StringUtils.isBlank(file.getName())) return "file name missing";
      if (file.getSize() != null && file.getSize() < 0) return "file size invalid";
    }

    return null; // OK
  }

  private MessageValidator() {
  }
}
