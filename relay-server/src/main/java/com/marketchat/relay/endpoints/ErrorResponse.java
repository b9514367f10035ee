package com.marketchat.relay.endpoints;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * Body of every failed REST call.
 */
public class ErrorResponse {

  @JsonProperty("status")
  private final String status = "ERROR";

  @JsonProperty("errorCode")
  private final String errorCode;

  @JsonProperty("errorMessage")
  private final String errorMessage;

  @JsonProperty("timestamp")
  private final String timestamp = Instant.now().toString();

  public ErrorResponse(String errorCode, String errorMessage) {
    this.errorCode = errorCode;
    this.errorMessage = errorMessage;
  }

  public String getStatus() { return status; }

  public String getErrorCode() { return errorCode; }

  public String getErrorMessage() { return errorMessage; }

  public String getTimestamp() { return timestamp; }
}
