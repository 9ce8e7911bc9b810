package com.gentoro.lightdocs.exception;

/** JSON/YAML serialization or deserialization error. */
public class SerializationException extends LightDocsException {
  public SerializationException(String message) {
    super(LightDocsErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(LightDocsErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
