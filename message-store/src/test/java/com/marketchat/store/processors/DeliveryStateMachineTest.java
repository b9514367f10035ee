package com.marketchat.store.processors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.marketchat.store.common.ErrorKind;
import com.marketchat.store.common.PermissionDeniedException;
import com.marketchat.store.domain.Attachment;
import com.marketchat.store.domain.Conversation;
import com.marketchat.store.domain.Message;
import com.marketchat.store.domain.MessageKind;
import com.marketchat.store.domain.MessageStatus;
import com.marketchat.store.domain.SendCommand;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DeliveryStateMachineTest {

  private static final Instant NOW = Instant.parse("2026-03-01T10:15:30Z");

  private DeliveryStateMachine stateMachine;
  private Conversation conversation;

  @BeforeEach
  void setUp() {
    stateMachine = new DeliveryStateMachine(Clock.fixed(NOW, ZoneOffset.UTC));
    conversation = new Conversation("conv-1", "alice", "bob", NOW.minusSeconds(60));
  }

  @Test
  void createStartsAtSentAndCountsUnreadForReceiver() {
    Message message = stateMachine.create(conversation, new SendCommand("alice", "bob", "conv-1", "hi"));

    assertThat(message.getId()).isNotBlank();
    assertThat(message.getStatus()).isEqualTo(MessageStatus.SENT);
    assertThat(message.getKind()).isEqualTo(MessageKind.TEXT);
    assertThat(message.getReadAt()).isNull();
    assertThat(message.getCreatedAt()).isEqualTo(NOW);
    assertThat(conversation.unreadFor("bob")).isEqualTo(1);
    assertThat(conversation.unreadFor("alice")).isZero();
    assertThat(conversation.getLastMessage()).isEqualTo("hi");
    assertThat(conversation.getLastMessageId()).isEqualTo(message.getId());
    assertThat(conversation.getUpdatedAt()).isEqualTo(NOW);
  }

  @Test
  void createRejectsOutsiderAndWrongReceiver() {
    assertThatThrownBy(() -> stateMachine.create(conversation, new SendCommand("mallory", "bob", "conv-1", "x")))
        .isInstanceOf(PermissionDeniedException.class)
        .extracting(e -> ((PermissionDeniedException) e).getKind())
        .isEqualTo(ErrorKind.PERMISSION_DENIED);

    assertThatThrownBy(() -> stateMachine.create(conversation, new SendCommand("alice", "mallory", "conv-1", "x")))
        .isInstanceOf(PermissionDeniedException.class);
    assertThat(conversation.unreadFor("bob")).isZero();
  }

  @Test
  void attachmentPreviewDependsOnKind() {
    SendCommand command = new SendCommand("alice", "bob", "conv-1", null);
    command.setType("document");
    command.setFile(new Attachment("https://files/x.pdf", "contract.pdf", 2048L, "application/pdf"));

    Message message = stateMachine.create(conversation, command);

    assertThat(message.getKind()).isEqualTo(MessageKind.DOCUMENT);
    assertThat(message.getAttachment().getName()).isEqualTo("contract.pdf");
    assertThat(conversation.getLastMessage()).isEqualTo("Sent a document: contract.pdf");
  }

  @Test
  void markDeliveredOnlyTouchesSentMessagesOfReceiver() {
    List<Message> history = new ArrayList<>();
    history.add(stateMachine.create(conversation, new SendCommand("alice", "bob", "conv-1", "one")));
    history.add(stateMachine.create(conversation, new SendCommand("bob", "alice", "conv-1", "two")));

    List<Message> changed = stateMachine.markDelivered(conversation, history, "bob");

    assertThat(changed).extracting(Message::getText).containsExactly("one");
    assertThat(history.get(0).getStatus()).isEqualTo(MessageStatus.DELIVERED);
    assertThat(history.get(1).getStatus()).isEqualTo(MessageStatus.SENT);
    assertThat(conversation.unreadFor("bob")).isEqualTo(1);
  }

  @Test
  void markReadResetsCounterAndIsIdempotent() {
    List<Message> history = new ArrayList<>();
    for (int i = 0; i < 3; i++) {
      history.add(stateMachine.create(conversation, new SendCommand("alice", "bob", "conv-1", "m" + i)));
    }
    stateMachine.markDelivered(conversation, history.subList(0, 1), "bob");

    ReadOutcome first = stateMachine.markRead(conversation, history, "bob");

    assertThat(first.isNoOp()).isFalse();
    assertThat(first.getChangedMessages()).hasSize(3);
    assertThat(history).allSatisfy(m -> {
      assertThat(m.getStatus()).isEqualTo(MessageStatus.READ);
      assertThat(m.getReadAt()).isEqualTo(NOW);
    });
    assertThat(conversation.unreadFor("bob")).isZero();

    ReadOutcome second = stateMachine.markRead(conversation, history, "bob");
    assertThat(second.isNoOp()).isTrue();
  }

  @Test
  void readMessagesNeverRegress() {
    List<Message> history = new ArrayList<>();
    history.add(stateMachine.create(conversation, new SendCommand("alice", "bob", "conv-1", "hi")));
    stateMachine.markRead(conversation, history, "bob");

    List<Message> delivered = stateMachine.markDelivered(conversation, history, "bob");

    assertThat(delivered).isEmpty();
    assertThat(history.get(0).getStatus()).isEqualTo(MessageStatus.READ);
    assertThat(history.get(0).getReadAt()).isNotNull();
  }

  @Test
  void markReadOnEmptyConversationIsNoOp() {
    ReadOutcome outcome = stateMachine.markRead(conversation, List.of(), "alice");

    assertThat(outcome.isNoOp()).isTrue();
  }

  @Test
  void markReadByOutsiderIsDenied() {
    assertThatThrownBy(() -> stateMachine.markRead(conversation, List.of(), "mallory"))
        .isInstanceOf(PermissionDeniedException.class);
  }

  @Test
  void singleMessageReadRequiresReceiver() {
    Message message = stateMachine.create(conversation, new SendCommand("alice", "bob", "conv-1", "hi"));
    stateMachine.create(conversation, new SendCommand("alice", "bob", "conv-1", "there"));

    assertThatThrownBy(() -> stateMachine.markMessageRead(conversation, message, "alice"))
        .isInstanceOf(PermissionDeniedException.class);

    assertThat(stateMachine.markMessageRead(conversation, message, "bob")).isTrue();
    assertThat(conversation.unreadFor("bob")).isEqualTo(1);
    assertThat(stateMachine.markMessageRead(conversation, message, "bob")).isFalse();
    assertThat(conversation.unreadFor("bob")).isEqualTo(1);
  }
}
