package com.marketchat.relay;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketchat.relay.connection.ClientConnection;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * In-memory connection that keeps every payload written to it.
 */
public class RecordingConnection implements ClientConnection {

  private final String id;
  private final ObjectMapper mapper;
  private final List<String> payloads = new ArrayList<>();

  private volatile boolean open = true;
  private volatile boolean failing;

  public RecordingConnection(String id, ObjectMapper mapper) {
    this.id = id;
    this.mapper = mapper;
  }

  @Override
  public String getId() {
    return id;
  }

  @Override
  public boolean isOpen() {
    return open;
  }

  @Override
  public synchronized void send(String payload) throws IOException {
    if (failing) {
      throw new IOException("Broken pipe");
    }
    payloads.add(payload);
  }

  @Override
  public void close() {
    open = false;
  }

  public void failWrites() {
    failing = true;
  }

  public synchronized void clear() {
    payloads.clear();
  }

  public synchronized List<JsonNode> events() {
    return payloads.stream().map(this::parse).collect(Collectors.toList());
  }

  public List<JsonNode> events(String name) {
    return events().stream()
        .filter(node -> name.equals(node.path("event").asText()))
        .collect(Collectors.toList());
  }

  public List<String> eventNames() {
    return events().stream().map(node -> node.path("event").asText()).collect(Collectors.toList());
  }

  /**
   * Elements of a JSON array node as a list.
   */
  public static List<JsonNode> elements(JsonNode array) {
    List<JsonNode> elements = new ArrayList<>();
    array.forEach(elements::add);
    return elements;
  }

  private JsonNode parse(String payload) {
    try {
      return mapper.readTree(payload);
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException(e);
    }
  }
}
