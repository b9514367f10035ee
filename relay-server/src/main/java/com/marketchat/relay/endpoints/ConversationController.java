package com.marketchat.relay.endpoints;

import com.marketchat.relay.processors.EventRelay;
import com.marketchat.store.common.NotFoundException;
import com.marketchat.store.domain.Conversation;
import com.marketchat.store.service.MessageStore;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/conversations")
public class ConversationController {

  private final MessageStore messageStore;
  private final EventRelay relay;

  public ConversationController(MessageStore messageStore, EventRelay relay) {
    this.messageStore = messageStore;
    this.relay = relay;
  }

  @GetMapping("/user/{userId}")
  public List<Conversation> userConversations(@PathVariable String userId) {
    return messageStore.conversationsFor(userId);
  }

  /**
   * Find-or-create: the same pair always gets the same conversation back.
   */
  @PostMapping
  public Conversation open(@RequestBody OpenConversationRequest request) {
    return relay.openConversation(request.getParticipantA(), request.getParticipantB());
  }

  @GetMapping("/details/{id}")
  public Conversation details(@PathVariable String id) {
    return messageStore.findConversation(id).orElseThrow(() -> NotFoundException.conversation(id));
  }
}
