package com.gentoro.lightdocs.exception;

/** I/O operation failed (document tree, output tree, index store, classpath). */
public class IoException extends LightDocsException {
  public IoException(String message) {
    super(LightDocsErrorCode.IO_ERROR, message);
  }

  public IoException(String message, Throwable cause) {
    super(LightDocsErrorCode.IO_ERROR, message, cause);
  }
}
