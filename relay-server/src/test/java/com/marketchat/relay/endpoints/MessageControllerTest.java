package com.marketchat.relay.endpoints;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest(properties = "relay.upload.dir=target/test-uploads")
@AutoConfigureMockMvc
class MessageControllerTest {

  @Autowired
  private MockMvc mockMvc;

  @Autowired
  private ObjectMapper mapper;

  @Test
  void openingTheSameConversationTwiceReturnsOneConversation() throws Exception {
    String alice = uniqueUser("alice");
    String bob = uniqueUser("bob");

    JsonNode first = openConversation(alice, bob);
    JsonNode second = openConversation(bob, alice);

    assertThat(second.path("id").asText()).isEqualTo(first.path("id").asText());
    assertThat(first.path("lastMessage").asText()).isEmpty();
    assertThat(first.path("unreadCount").path(bob).asInt()).isZero();

    mockMvc.perform(get("/conversations/user/{userId}", alice))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$", hasSize(1)))
        .andExpect(jsonPath("$[0].id").value(first.path("id").asText()));
    mockMvc.perform(get("/conversations/details/{id}", first.path("id").asText()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.participantA").value(alice));
  }

  @Test
  void unknownConversationIsNotFound() throws Exception {
    mockMvc.perform(get("/conversations/details/{id}", "missing"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.status").value("ERROR"))
        .andExpect(jsonPath("$.errorCode").value("NOT_FOUND"));
  }

  @Test
  void conversationWithYourselfIsRejected() throws Exception {
    String alice = uniqueUser("alice");

    mockMvc.perform(post("/conversations")
            .contentType(MediaType.APPLICATION_JSON)
            .content(mapper.writeValueAsString(Map.of("participantA", alice, "participantB", alice))))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errorCode").value("VALIDATION_ERROR"));
  }

  @Test
  void postedMessageIsStoredAndReturnedInHistory() throws Exception {
    String alice = uniqueUser("alice");
    String bob = uniqueUser("bob");
    String conversationId = openConversation(alice, bob).path("id").asText();

    JsonNode message = postMessage(conversationId, alice, bob, "over http");

    assertThat(message.path("status").asText()).isEqualTo("sent");
    assertThat(message.path("type").asText()).isEqualTo("text");
    mockMvc.perform(get("/message/conversation/{id}", conversationId).param("viewerId", bob))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$", hasSize(1)))
        .andExpect(jsonPath("$[0].id").value(message.path("id").asText()))
        .andExpect(jsonPath("$[0].status").value("delivered"));
    mockMvc.perform(get("/message/between/{u1}/{u2}", bob, alice))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].text").value("over http"));
  }

  @Test
  void emptyMessageIsABadRequest() throws Exception {
    String alice = uniqueUser("alice");
    String bob = uniqueUser("bob");
    String conversationId = openConversation(alice, bob).path("id").asText();

    mockMvc.perform(post("/message/")
            .contentType(MediaType.APPLICATION_JSON)
            .content(mapper.writeValueAsString(sendBody(conversationId, alice, bob, ""))))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errorCode").value("VALIDATION_ERROR"));
  }

  @Test
  void onlyTheReceiverCanMarkAMessageRead() throws Exception {
    String alice = uniqueUser("alice");
    String bob = uniqueUser("bob");
    String conversationId = openConversation(alice, bob).path("id").asText();
    String messageId = postMessage(conversationId, alice, bob, "read me").path("id").asText();

    mockMvc.perform(patch("/message/{id}/read", messageId).param("userId", alice))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.errorCode").value("PERMISSION_DENIED"));
    mockMvc.perform(patch("/message/{id}/read", messageId).param("userId", bob))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("read"))
        .andExpect(jsonPath("$.readAt").isNotEmpty());
    mockMvc.perform(get("/conversations/details/{id}", conversationId))
        .andExpect(jsonPath("$.unreadCount." + bob).value(0));
  }

  @Test
  void conversationCanBeMarkedReadOverHttp() throws Exception {
    String alice = uniqueUser("alice");
    String bob = uniqueUser("bob");
    String conversationId = openConversation(alice, bob).path("id").asText();
    postMessage(conversationId, alice, bob, "one");
    postMessage(conversationId, alice, bob, "two");

    mockMvc.perform(patch("/message/conversation/{id}/read", conversationId).param("userId", bob))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.updated").value(2));
    mockMvc.perform(patch("/message/conversation/{id}/read", conversationId).param("userId", bob))
        .andExpect(jsonPath("$.updated").value(0));
  }

  @Test
  void healthAndStatsAreServed() throws Exception {
    mockMvc.perform(get("/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("UP"));
    mockMvc.perform(get("/stats"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.connections").isNumber())
        .andExpect(jsonPath("$.rooms").isNumber())
        .andExpect(jsonPath("$.storeStats").value(startsWith("Conversations: ")));
  }

  private JsonNode openConversation(String participantA, String participantB) throws Exception {
    String body = mockMvc.perform(post("/conversations")
            .contentType(MediaType.APPLICATION_JSON)
            .content(mapper.writeValueAsString(
                Map.of("participantA", participantA, "participantB", participantB))))
        .andExpect(status().isOk())
        .andReturn().getResponse().getContentAsString();
    return mapper.readTree(body);
  }

  private JsonNode postMessage(String conversationId, String senderId, String receiverId, String text)
      throws Exception {
    String body = mockMvc.perform(post("/message/")
            .contentType(MediaType.APPLICATION_JSON)
            .content(mapper.writeValueAsString(sendBody(conversationId, senderId, receiverId, text))))
        .andExpect(status().isCreated())
        .andReturn().getResponse().getContentAsString();
    return mapper.readTree(body);
  }

  private static Map<String, Object> sendBody(String conversationId, String senderId,
      String receiverId, String text) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("conversationId", conversationId);
    body.put("senderId", senderId);
    body.put("receiverId", receiverId);
    body.put("text", text);
    return body;
  }

  private static String uniqueUser(String prefix) {
    return prefix + UUID.randomUUID().toString().replace("-", "");
  }
}
