package com.marketchat.relay.processors;

import static com.marketchat.relay.RelayFixture.text;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.marketchat.relay.RecordingConnection;
import com.marketchat.relay.RelayFixture;
import com.marketchat.store.common.ValidationException;
import com.marketchat.store.domain.Conversation;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ReconnectionHandlerTest {

  private final RelayFixture fixture = new RelayFixture();

  @AfterEach
  void tearDown() {
    fixture.close();
  }

  @Test
  void connectingTwiceDoesNotDuplicateAnything() {
    Conversation conversation = fixture.conversation("alice", "bob");
    RecordingConnection alice = fixture.connect("alice", "a1");
    fixture.reconnection.onConnect("alice", "a1");

    assertThat(fixture.sessions.connectionsFor("alice")).containsExactly("a1");
    assertThat(fixture.rooms.membersOf(conversation.getId())).containsExactly("a1");

    fixture.relay.send(text(conversation, "bob", "once"));
    assertThat(alice.events("receiveMessage")).hasSize(1);
  }

  @Test
  void reconnectRestoresTheSameMemberships() {
    fixture.conversation("alice", "bob");
    fixture.conversation("alice", "carol");
    RecordingConnection first = fixture.connect("alice", "a1");
    Set<String> before = fixture.rooms.roomsOf("a1");

    fixture.disconnect(first);
    assertThat(fixture.rooms.roomsOf("a1")).isEmpty();
    assertThat(fixture.sessions.isOnline("alice")).isFalse();

    fixture.connect("alice", "a1");
    assertThat(fixture.rooms.roomsOf("a1")).isEqualTo(before);
    assertThat(fixture.sessions.connectionsFor("alice")).containsExactly("a1");
  }

  @Test
  void disconnectOfNeverRegisteredConnectionIsSafe() {
    RecordingConnection anonymous = fixture.open("x1");

    fixture.disconnect(anonymous);
    fixture.reconnection.onDisconnect("x1");
    fixture.reconnection.onDisconnect("never-opened");

    assertThat(fixture.directory.size()).isZero();
    assertThat(fixture.sessions.connectionCount()).isZero();
  }

  @Test
  void registrationRacingAClosedTransportLeavesNoEntries() {
    fixture.conversation("alice", "bob");
    RecordingConnection connection = fixture.open("a1");
    connection.close();

    fixture.reconnection.onConnect("alice", "a1");

    assertThat(fixture.sessions.userOf("a1")).isEmpty();
    assertThat(fixture.sessions.isOnline("alice")).isFalse();
    assertThat(fixture.rooms.roomsOf("a1")).isEmpty();
  }

  @Test
  void blankUserIsRejected() {
    fixture.open("a1");

    assertThatThrownBy(() -> fixture.reconnection.registerUser(" ", "a1"))
        .isInstanceOf(ValidationException.class);
    assertThatThrownBy(() -> fixture.reconnection.joinAllConversations(null, "a1"))
        .isInstanceOf(ValidationException.class);
  }

  @Test
  void disconnectStopsTypingAndUpdatesActiveUsers() {
    Conversation conversation = fixture.conversation("alice", "bob");
    RecordingConnection alice = fixture.open("a1");
    fixture.reconnection.registerUser("alice", "a1");
    fixture.relay.joinRoom("a1", conversation.getId());
    RecordingConnection bob = fixture.open("b1");
    fixture.reconnection.registerUser("bob", "b1");
    fixture.relay.joinRoom("b1", conversation.getId());
    fixture.relay.startTyping(conversation.getId(), "alice", "a1");
    bob.clear();

    fixture.disconnect(alice);

    assertThat(bob.eventNames()).containsExactly("userTyping", "activeUsersUpdate");
    assertThat(bob.events("userTyping").get(0).path("isTyping").asBoolean()).isFalse();
    List<JsonNode> active = RecordingConnection.elements(
        bob.events("activeUsersUpdate").get(0).path("activeUsers"));
    assertThat(active).extracting(JsonNode::asText).containsExactly("bob");
    assertThat(fixture.typing.isTyping(conversation.getId(), "alice")).isFalse();
  }
}
