package com.gentoro.lightdocs.document;

import com.gentoro.lightdocs.exception.DocumentParseException;
import com.gentoro.lightdocs.utility.JacksonUtility;
import java.nio.file.Path;

/**
 * Splits a source file into its frontmatter block and body, and writes them back.
 *
 * <p>A block starts when the first line of the file is {@code ---} and ends at the next line that
 * is exactly {@code ---}. Trailing whitespace and CRLF endings on delimiter lines are tolerated.
 */
public final class FrontmatterParser {
  public static final String DELIMITER = "---";

  private FrontmatterParser() {}

  public record Parsed(Frontmatter frontmatter, String body) {}

  public static Parsed parse(String raw, Path source) {
    String text = raw.startsWith("\uFEFF") ? raw.substring(1) : raw;

    int firstEnd = lineEnd(text, 0);
    if (!text.substring(0, firstEnd).strip().equals(DELIMITER)) {
      return new Parsed(Frontmatter.untitled(), raw);
    }

    int blockStart = nextLine(text, firstEnd);
    int pos = blockStart;
    while (pos < text.length()) {
      int end = lineEnd(text, pos);
      if (text.substring(pos, end).stripTrailing().equals(DELIMITER)) {
        String yaml = text.substring(blockStart, pos);
        String body = text.substring(nextLine(text, end)).stripLeading();
        return new Parsed(readFrontmatter(yaml, source), body);
      }
      pos = nextLine(text, end);
    }
    throw new DocumentParseException(source, "Invalid frontmatter: missing closing " + DELIMITER);
  }

  /** Frontmatter block, closing delimiter, one blank line, then the body. */
  public static String write(Frontmatter frontmatter, String body) {
    String yaml = JacksonUtility.toYaml(frontmatter);
    if (!yaml.endsWith("\n")) yaml = yaml + "\n";
    return DELIMITER + "\n" + yaml + DELIMITER + "\n\n" + (body == null ? "" : body);
  }

  private static Frontmatter readFrontmatter(String yaml, Path source) {
    if (yaml.isBlank()) {
      throw new DocumentParseException(source, "Frontmatter is empty: 'title' is required");
    }
    Frontmatter fm;
    try {
      fm = JacksonUtility.getYamlMapper().readValue(yaml, Frontmatter.class);
    } catch (Exception e) {
      throw new DocumentParseException(
          source, "Failed to parse frontmatter YAML: " + e.getMessage(), e);
    }
    if (fm == null || fm.title() == null || fm.title().isBlank()) {
      throw new DocumentParseException(source, "Frontmatter is missing required 'title'");
    }
    return fm;
  }

  // index of the line terminator (or end of text), excluding a preceding '\r'
  private static int lineEnd(String text, int from) {
    int nl = text.indexOf('\n', from);
    int end = nl < 0 ? text.length() : nl;
    if (end > from && text.charAt(end - 1) == '\r') end--;
    return end;
  }

  private static int nextLine(String text, int lineEnd) {
    int i = lineEnd;
    if (i < text.length() && text.charAt(i) == '\r') i++;
    if (i < text.length() && text.charAt(i) == '\n') i++;
    return i;
  }
}
