package com.marketchat.relay.helpers;

import java.util.Locale;
import java.util.Set;
import org.apache.commons.lang3.StringUtils;

/**
 * Which uploads are accepted and where they are filed.
 */
public final class AttachmentPolicy {

  private static final Set<String> IMAGE_TYPES = Set.of("image/jpeg", "image/jpg", "image/png");

  private static final Set<String> DOCUMENT_TYPES = Set.of(
      "application/pdf",
      "application/msword",
      "application/vnd.openxmlformats-officedocument.wordprocessingml.document");

  private static final Set<String> VOICE_TYPES = Set.of(
      "audio/mpeg", "audio/mp3", "audio/wav", "audio/ogg", "audio/mp4", "audio/x-m4a", "audio/webm");

  private AttachmentPolicy() {
  }

  /**
   * Validates an upload before it is stored.
   *
   * @return null if acceptable, otherwise a problem description
   */
  public static String validate(String mimeType, long size) {
    if (StringUtils.isBlank(mimeType) || !isAllowed(mimeType)) {
      return "Invalid file type. Allowed: images (jpg, png), documents (pdf, doc, docx), "
          + "voice (mp3, wav, ogg, m4a, webm)";
    }
    if (size <= 0) {
      return "file is empty";
    }
    return null;
  }

  public static boolean isAllowed(String mimeType) {
    String type = normalize(mimeType);
    return IMAGE_TYPES.contains(type) || DOCUMENT_TYPES.contains(type) || VOICE_TYPES.contains(type);
  }

  public static String folderFor(String mimeType) {
    String type = normalize(mimeType);
    if (type.startsWith("image/")) {
      return "images";
    }
    if (type.startsWith("audio/")) {
      return "voice";
    }
    return "documents";
  }

  public static String resourceTypeFor(String mimeType) {
    String type = normalize(mimeType);
    if (type.startsWith("image/")) {
      return "image";
    }
    if (type.startsWith("audio/")) {
      return "audio";
    }
    return "raw";
  }

  private static String normalize(String mimeType) {
    return StringUtils.defaultString(mimeType).trim().toLowerCase(Locale.ROOT);
  }
}
