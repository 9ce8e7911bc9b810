package com.gentoro.lightdocs.exception;

/** Configuration could not be loaded or holds an invalid value. */
public class ConfigException extends LightDocsException {
  public ConfigException(String message) {
    super(LightDocsErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(LightDocsErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
