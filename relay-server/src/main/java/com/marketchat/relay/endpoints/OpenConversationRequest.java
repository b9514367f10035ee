package com.marketchat.relay.endpoints;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code POST /conversations}.
 */
public class OpenConversationRequest {

  @JsonProperty("participantA")
  @JsonAlias("senderId")
  private String participantA;

  @JsonProperty("participantB")
  @JsonAlias("receiverId")
  private String participantB;

  public String getParticipantA() { return participantA; }
  public void setParticipantA(String participantA) { this.participantA = participantA; }

  public String getParticipantB() { return participantB; }
  public void setParticipantB(String participantB) { this.participantB = participantB; }
}
