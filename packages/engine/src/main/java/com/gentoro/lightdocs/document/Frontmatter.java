package com.gentoro.lightdocs.document;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.LocalDate;
import java.util.List;

/** YAML metadata block at the top of a document. Only {@code title} is required. */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"title", "status", "tags", "created", "updated", "aliases"})
public record Frontmatter(
    @JsonProperty(value = "title", required = true) String title,
    @JsonProperty("status") DocumentStatus status,
    @JsonProperty("tags") List<String> tags,
    @JsonProperty("created") LocalDate created,
    @JsonProperty("updated") LocalDate updated,
    @JsonProperty("aliases") List<String> aliases) {

  public Frontmatter {
    if (status == null) status = DocumentStatus.DRAFT;
    tags = tags == null ? List.of() : List.copyOf(tags);
    aliases = aliases == null ? List.of() : List.copyOf(aliases);
  }

  /** Metadata synthesized for files without a frontmatter block. */
  public static Frontmatter untitled() {
    return new Frontmatter("Untitled", DocumentStatus.DRAFT, List.of(), null, null, List.of());
  }
}
