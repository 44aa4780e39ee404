package com.shopfloor.backend.util;

import java.net.URI;

/**
 * Photo references are stored as {@code /uploads/<name>} whenever they point into the uploads
 * directory, whatever host or relative form the client sent. Anything else is kept verbatim.
 */
public final class UploadRefNormalizer {
  private static final String PREFIX = "/uploads/";

  private UploadRefNormalizer() {}

  public static String normalize(String ref) {
    String s = ref == null ? "" : ref.trim().replace('\\', '/');
    if (s.isEmpty()) {
      return null;
    }
    if (s.startsWith(PREFIX)) {
      return s;
    }
    if (s.startsWith(PREFIX.substring(1))) {
      return "/" + s;
    }
    if (s.startsWith("http://") || s.startsWith("https://")) {
      String path = pathOf(s);
      if (path != null && path.startsWith(PREFIX)) {
        return path;
      }
    }
    return s;
  }

  private static String pathOf(String url) {
    try {
      return URI.create(url).getPath();
    } catch (IllegalArgumentException e) {
      return null;
    }
  }
}
