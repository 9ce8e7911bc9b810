package com.gentoro.lightdocs.document;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Publication status. Only {@link #PUBLIC} documents are rendered and exposed. */
public enum DocumentStatus {
  DRAFT,
  PUBLIC;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static DocumentStatus fromValue(String value) {
    if (value == null || value.isBlank()) return DRAFT;
    for (DocumentStatus s : values()) {
      if (s.name().equalsIgnoreCase(value.trim())) return s;
    }
    throw new IllegalArgumentException(
        "Unknown status '" + value + "', expected one of: draft, public");
  }
}
