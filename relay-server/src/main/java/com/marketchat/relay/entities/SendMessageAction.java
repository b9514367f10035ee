package com.marketchat.relay.entities;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.marketchat.store.domain.Attachment;
import com.marketchat.store.domain.SendCommand;

public class SendMessageAction extends ClientAction {

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

  @Override
  public void accept(ClientActionVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public String name() {
    return "sendMessage";
  }

  public SendCommand toCommand() {
    SendCommand command = new SendCommand(senderId, receiverId, conversationId, text);
    command.setType(type);
    command.setFile(file);
    return command;
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
