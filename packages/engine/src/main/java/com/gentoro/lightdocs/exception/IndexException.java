package com.gentoro.lightdocs.exception;

/** Search index could not be opened, read or written. */
public class IndexException extends LightDocsException {
  public IndexException(String message) {
    super(LightDocsErrorCode.INDEX_ERROR, message);
  }

  public IndexException(String message, Throwable cause) {
    super(LightDocsErrorCode.INDEX_ERROR, message, cause);
  }
}
