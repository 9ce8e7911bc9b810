package com.gentoro.lightdocs.document;

import java.nio.file.Path;
import java.util.Locale;

/**
 * URL-safe identifiers. Lowercase; letters and digits kept (any script); every other character
 * becomes a dash; dash runs collapse; leading and trailing dashes are trimmed. Idempotent.
 */
public final class Slugs {
  private Slugs() {}

  public static String slugify(String text) {
    if (text == null) return "";
    String lower = text.toLowerCase(Locale.ROOT);
    StringBuilder sb = new StringBuilder(lower.length());
    boolean pendingDash = false;
    for (int i = 0; i < lower.length(); ) {
      int cp = lower.codePointAt(i);
      i += Character.charCount(cp);
      if (Character.isLetterOrDigit(cp)) {
        if (pendingDash && sb.length() > 0) sb.append('-');
        pendingDash = false;
        sb.appendCodePoint(cp);
      } else {
        pendingDash = true;
      }
    }
    return sb.toString();
  }

  /** Slug of a file: its base name without the last extension. */
  public static String fromPath(Path path) {
    String name = path.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return slugify(dot > 0 ? name.substring(0, dot) : name);
  }
}
