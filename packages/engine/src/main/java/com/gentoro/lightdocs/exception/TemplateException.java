package com.gentoro.lightdocs.exception;

/** A page template could not be compiled or evaluated. */
public class TemplateException extends LightDocsException {
  public TemplateException(String message) {
    super(LightDocsErrorCode.TEMPLATE_ERROR, message);
  }

  public TemplateException(String message, Throwable cause) {
    super(LightDocsErrorCode.TEMPLATE_ERROR, message, cause);
  }
}
