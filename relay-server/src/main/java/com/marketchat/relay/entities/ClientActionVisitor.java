package com.marketchat.relay.entities;

/**
 * One method per inbound action kind, so every kind is handled explicitly.
 */
public interface ClientActionVisitor {

  void visit(RegisterUserAction action);

  void visit(JoinRoomAction action);

  void visit(JoinAllConversationsAction action);

  void visit(SendMessageAction action);

  void visit(StartTypingAction action);

  void visit(StopTypingAction action);

  void visit(MarkMessagesAsReadAction action);
}
