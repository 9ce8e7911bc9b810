package com.gentoro.lightdocs.document;

import com.gentoro.lightdocs.utility.FileUtility;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A knowledge-base document: one source file, its frontmatter metadata and its Markdown body.
 *
 * <p>Documents are transient. They are materialized from disk by {@link #load(Path)} on every
 * build or listing and written back only through {@link #save()}.
 */
public class Document {
  private static final org.slf4j.Logger log =
      com.gentoro.lightdocs.logging.LoggingService.getLogger(Document.class);

  private final Path path;
  private String title;
  private DocumentStatus status;
  private List<String> tags;
  private LocalDate created;
  private LocalDate updated;
  private List<String> aliases;
  private String content;
  private final String rawContent;

  public Document(Path path, Frontmatter frontmatter, String content, String rawContent) {
    this.path = Objects.requireNonNull(path, "path");
    this.title = frontmatter.title();
    this.status = frontmatter.status();
    this.tags = frontmatter.tags();
    this.created = frontmatter.created();
    this.updated = frontmatter.updated();
    this.aliases = frontmatter.aliases();
    this.content = content == null ? "" : content;
    this.rawContent = rawContent == null ? "" : rawContent;
  }

  /**
   * Read and parse a document.
   *
   * @throws com.gentoro.lightdocs.exception.IoException if the file cannot be read
   * @throws com.gentoro.lightdocs.exception.DocumentParseException if the frontmatter is invalid
   */
  public static Document load(Path path) {
    String raw = FileUtility.readString(path);
    FrontmatterParser.Parsed parsed = FrontmatterParser.parse(raw, path);
    log.trace("Loaded {} ({})", path, parsed.frontmatter().title());
    return new Document(path, parsed.frontmatter(), parsed.body(), raw);
  }

  /** Overwrite the source file with the current metadata and body. */
  public void save() {
    FileUtility.writeString(path, FrontmatterParser.write(frontmatter(), content));
    log.debug("Saved {}", path);
  }

  public String slug() {
    return Slugs.fromPath(path);
  }

  /** Case-insensitive substring match on title, body or any tag. */
  public boolean matches(String query) {
    String q = query == null ? "" : query.toLowerCase(Locale.ROOT);
    return title.toLowerCase(Locale.ROOT).contains(q)
        || content.toLowerCase(Locale.ROOT).contains(q)
        || tags.stream().anyMatch(t -> t.toLowerCase(Locale.ROOT).contains(q));
  }

  public boolean isPublic() {
    return status == DocumentStatus.PUBLIC;
  }

  public Frontmatter frontmatter() {
    return new Frontmatter(title, status, tags, created, updated, aliases);
  }

  public Path getPath() {
    return path;
  }

  public String getTitle() {
    return title;
  }

  public void setTitle(String title) {
    this.title = Objects.requireNonNull(title, "title");
  }

  public DocumentStatus getStatus() {
    return status;
  }

  public void setStatus(DocumentStatus status) {
    this.status = status == null ? DocumentStatus.DRAFT : status;
  }

  public List<String> getTags() {
    return tags;
  }

  public void setTags(List<String> tags) {
    this.tags = tags == null ? List.of() : List.copyOf(tags);
  }

  public LocalDate getCreated() {
    return created;
  }

  public void setCreated(LocalDate created) {
    this.created = created;
  }

  public LocalDate getUpdated() {
    return updated;
  }

  public void setUpdated(LocalDate updated) {
    this.updated = updated;
  }

  public List<String> getAliases() {
    return aliases;
  }

  public void setAliases(List<String> aliases) {
    this.aliases = aliases == null ? List.of() : List.copyOf(aliases);
  }

  /** Body text after the frontmatter block. */
  public String getContent() {
    return content;
  }

  public void setContent(String content) {
    this.content = content == null ? "" : content;
  }

  /** Full file text as read from disk. */
  public String getRawContent() {
    return rawContent;
  }

  @Override
  public String toString() {
    return "Document{path=" + path + ", title='" + title + "', status=" + status.value() + '}';
  }
}
