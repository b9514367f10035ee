package com.marketchat.store.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * A persisted message. Content is immutable once sent; only {@code status}
 * and {@code readAt} change afterwards, and only on behalf of the receiver.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Message {

  @JsonProperty("id")
  private String id;

  @JsonProperty("conversationId")
  private String conversationId;

  @JsonProperty("senderId")
  private String senderId;

  @JsonProperty("receiverId")
  private String receiverId;

  @JsonProperty("text")
  private String text;

  @JsonProperty("file")
  private Attachment attachment;

  @JsonProperty("type")
  private MessageKind kind;

  @JsonProperty("status")
  private MessageStatus status;

  @JsonProperty("createdAt")
  private Instant createdAt;

  @JsonProperty("readAt")
  private Instant readAt;

  public Message() {
  }

  @JsonIgnore
  public boolean isAddressedTo(String userId) {
    return userId != null && userId.equals(receiverId);
  }

  @JsonIgnore
  public Message copy() {
    Message copy = new Message();
    copy.id = id;
    copy.conversationId = conversationId;
    copy.senderId = senderId;
    copy.receiverId = receiverId;
    copy.text = text;
    copy.attachment = attachment == null ? null : attachment.copy();
    copy.kind = kind;
    copy.status = status;
    copy.createdAt = createdAt;
    copy.readAt = readAt;
    return copy;
  }

  public String getId() { return id; }
  public void setId(String id) { this.id = id; }

  public String getConversationId() { return conversationId; }
  public void setConversationId(String conversationId) { this.conversationId = conversationId; }

  public String getSenderId() { return senderId; }
  public void setSenderId(String senderId) { this.senderId = senderId; }

  public String getReceiverId() { return receiverId; }
  public void setReceiverId(String receiverId) { this.receiverId = receiverId; }

  public String getText() { return text; }
  public void setText(String text) { this.text = text; }

  public Attachment getAttachment() { return attachment; }
  public void setAttachment(Attachment attachment) { this.attachment = attachment; }

  public MessageKind getKind() { return kind; }
  public void setKind(MessageKind kind) { this.kind = kind; }

  public MessageStatus getStatus() { return status; }
  public void setStatus(MessageStatus status) { this.status = status; }

  public Instant getCreatedAt() { return createdAt; }
  public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

  public Instant getReadAt() { return readAt; }
  public void setReadAt(Instant readAt) { this.readAt = readAt; }
}
