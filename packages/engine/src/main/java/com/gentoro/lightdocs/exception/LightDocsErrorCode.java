package com.gentoro.lightdocs.exception;

/**
 * Canonical error codes for LightDocs. Codes are stable and suitable for log lines and for the
 * collaborators that surface build or search failures to users. Prefer the most specific code that
 * reflects the failure origin.
 */
public enum LightDocsErrorCode {
  // Generic
  UNKNOWN,
  INVALID_ARGUMENT,

  // I/O and configuration
  CONFIGURATION_ERROR,
  IO_ERROR,
  SERIALIZATION_ERROR,

  // Domain specific
  PARSE_ERROR,
  TEMPLATE_ERROR,
  INDEX_ERROR,
}
