package com.gentoro.lightdocs.exception;

/** The document set or an argument violates a structural rule. */
public class ValidationException extends LightDocsException {
  public ValidationException(String message) {
    super(LightDocsErrorCode.INVALID_ARGUMENT, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(LightDocsErrorCode.INVALID_ARGUMENT, message, cause);
  }

  public ValidationException(String message, java.util.Map<String, ?> context) {
    super(LightDocsErrorCode.INVALID_ARGUMENT, message, context);
  }
}
