package com.gentoro.lightdocs.exception;

import java.nio.file.Path;
import java.util.Map;

/**
 * A source document is structurally invalid: unterminated frontmatter block, malformed YAML, or a
 * missing {@code title}. Aborts the document load and any build walking over it.
 */
public class DocumentParseException extends LightDocsException {
  public DocumentParseException(Path source, String message) {
    super(LightDocsErrorCode.PARSE_ERROR, message, sourceContext(source));
  }

  public DocumentParseException(Path source, String message, Throwable cause) {
    super(LightDocsErrorCode.PARSE_ERROR, message, sourceContext(source), cause);
  }

  private static Map<String, ?> sourceContext(Path source) {
    return source == null ? Map.of() : Map.of("source", source.toString());
  }
}
