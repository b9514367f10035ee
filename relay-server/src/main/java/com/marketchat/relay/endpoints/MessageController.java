package com.marketchat.relay.endpoints;

import com.marketchat.relay.processors.EventRelay;
import com.marketchat.store.domain.Message;
import com.marketchat.store.domain.SendCommand;
import com.marketchat.store.processors.ReadOutcome;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * HTTP access to message history and the same send/read paths the WebSocket
 * actions use, live fan-out included.
 */
@RestController
@RequestMapping("/message")
public class MessageController {

  private final EventRelay relay;

  public MessageController(EventRelay relay) {
    this.relay = relay;
  }

  @PostMapping("/")
  @ResponseStatus(HttpStatus.CREATED)
  public Message send(@RequestBody SendCommand command) {
    return relay.send(command);
  }

  @GetMapping("/conversation/{id}")
  public List<Message> history(@PathVariable String id,
      @RequestParam(value = "viewerId", required = false) String viewerId) {
    return relay.history(id, viewerId);
  }

  @GetMapping("/between/{userId1}/{userId2}")
  public List<Message> between(@PathVariable String userId1, @PathVariable String userId2) {
    return relay.historyBetween(userId1, userId2);
  }

  @PatchMapping("/{id}/read")
  public Message markMessageRead(@PathVariable String id, @RequestParam("userId") String userId) {
    return relay.markMessageRead(id, userId);
  }

  @PatchMapping("/conversation/{id}/read")
  public Map<String, Object> markConversationRead(@PathVariable String id,
      @RequestParam("userId") String userId) {
    ReadOutcome outcome = relay.markRead(id, userId);
    Map<String, Object> response = new HashMap<>();
    response.put("conversationId", id);
    response.put("readBy", userId);
    response.put("updated", outcome.getChangedMessages().size());
    return response;
  }
}
