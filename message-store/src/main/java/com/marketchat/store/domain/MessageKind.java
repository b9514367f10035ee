package com.marketchat.store.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Locale;

/**
 * Content kind of a message. Everything except TEXT carries an attachment.
 */
public enum MessageKind {
  @JsonProperty("text") TEXT,
  @JsonProperty("image") IMAGE,
  @JsonProperty("document") DOCUMENT,
  @JsonProperty("voice") VOICE;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public boolean requiresAttachment() {
    return this != TEXT;
  }

  /**
   * Resolves the lowercase wire name, or returns null when unknown.
   */
  public static MessageKind fromWire(String value) {
    if (value == null) {
      return null;
    }
    for (MessageKind kind : values()) {
      if (kind.wireName().equalsIgnoreCase(value.trim())) {
        return kind;
      }
    }
    return null;
  }

  /**
   * Kind implied by an attachment's mime type; anything that is neither an
   * image nor audio is a document.
   */
  public static MessageKind fromMimeType(String mimeType) {
    if (mimeType == null) {
      return DOCUMENT;
    }
    String normalized = mimeType.toLowerCase(Locale.ROOT);
    if (normalized.startsWith("image/")) {
      return IMAGE;
    }
    if (normalized.startsWith("audio/")) {
      return VOICE;
    }
    return DOCUMENT;
  }
}
