package com.gentoro.lightdocs.search;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/** Text helpers for the search index: word tokens and the stored result excerpt. */
public final class Tokenizer {
  static final int MIN_TOKEN_LENGTH = 3;
  static final int EXCERPT_LINES = 3;
  static final int EXCERPT_MAX_CHARS = 150;

  private Tokenizer() {}

  /**
   * Split on anything that is not a letter or digit, lowercase, and drop tokens shorter than three
   * code points. Order and duplicates are preserved.
   */
  public static List<String> tokenize(String text) {
    List<String> tokens = new ArrayList<>();
    if (text == null || text.isEmpty()) return tokens;
    StringBuilder current = new StringBuilder();
    for (int i = 0; i < text.length(); ) {
      int cp = text.codePointAt(i);
      i += Character.charCount(cp);
      if (Character.isLetterOrDigit(cp)) {
        current.appendCodePoint(cp);
      } else {
        flush(current, tokens);
      }
    }
    flush(current, tokens);
    return tokens;
  }

  public static Set<String> distinctTokens(String text) {
    return new LinkedHashSet<>(tokenize(text));
  }

  /**
   * Short plain-text preview: the first three lines that do not start with {@code #}, blank lines
   * included, joined by spaces and cut at 150 characters with a trailing "...".
   */
  public static String excerpt(String content) {
    if (content == null) return "";
    List<String> lines = new ArrayList<>();
    for (String line : content.split("\\R")) {
      if (line.startsWith("#")) continue;
      lines.add(line);
      if (lines.size() == EXCERPT_LINES) break;
    }
    String clean = String.join(" ", lines);
    if (clean.length() <= EXCERPT_MAX_CHARS) return clean;
    int cut = EXCERPT_MAX_CHARS;
    if (Character.isHighSurrogate(clean.charAt(cut - 1))) cut--;
    return clean.substring(0, cut) + "...";
  }

  private static void flush(StringBuilder current, List<String> tokens) {
    if (current.length() == 0) return;
    String token = current.toString();
    current.setLength(0);
    if (token.codePointCount(0, token.length()) >= MIN_TOKEN_LENGTH) {
      tokens.add(token.toLowerCase(Locale.ROOT));
    }
  }
}
