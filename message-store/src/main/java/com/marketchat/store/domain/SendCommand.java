package com.marketchat.store.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A request to send one message, as received from a client.
 * {@code type} is kept as the raw wire string so validation can report it.
 */
public class SendCommand {

  @JsonProperty("senderId")
  private String senderId;

  @JsonProperty("receiverId")
  private String receiverId;

  @JsonProperty("conversationId")
  private String conversationId;

  @JsonProperty("text")
  private String text;

  @JsonProperty("type")
  private String type;

  @JsonProperty("file")
  private Attachment file;

  public SendCommand() {
  }

  public SendCommand(String senderId, String receiverId, String conversationId, String text) {
    this.senderId = senderId;
    this.receiverId = receiverId;
    this.conversationId = conversationId;
    this.text = text;
  }

  /**
   * Kind to persist: the declared type; without one, inferred from the
   * attachment's mime type, else TEXT. Null for an unknown declared type.
   */
  public MessageKind resolveKind() {
    if (type != null && !type.isBlank()) {
      return MessageKind.fromWire(type);
    }
    if (file != null && file.getUrl() != null) {
      return MessageKind.fromMimeType(file.getMimeType());
    }
    return MessageKind.TEXT;
  }

  public String getSenderId() { return senderId; }
  public void setSenderId(String senderId) { this.senderId = senderId; }

  public String getReceiverId() { return receiverId; }
  public void setReceiverId(String receiverId) { this.receiverId = receiverId; }

  public String getConversationId() { return conversationId; }
  public void setConversationId(String conversationId) { this.conversationId = conversationId; }

  public String getText() { return text; }
  public void setText(String text) { this.text = text; }

  public String getType() { return type; }
  public void setType(String type) { this.type = type; }

  public Attachment getFile() { return file; }
  public void setFile(Attachment file) { this.file = file; }
}
