package com.gentoro.lightdocs.wikilink;

import com.gentoro.lightdocs.document.Document;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable lookup from lowercased title or alias to document slug.
 *
 * <p>Built once from the complete document set, before any page is rendered, so that a wikilink
 * resolves the same way regardless of where its target sits in the walk order. When two documents
 * claim the same title or alias, the first one registered keeps it.
 */
public final class LinkRegistry {
  private static final org.slf4j.Logger log =
      com.gentoro.lightdocs.logging.LoggingService.getLogger(LinkRegistry.class);

  private static final LinkRegistry EMPTY = new LinkRegistry(Map.of());

  private final Map<String, String> slugsByKey;

  private LinkRegistry(Map<String, String> slugsByKey) {
    this.slugsByKey = Collections.unmodifiableMap(slugsByKey);
  }

  public static LinkRegistry empty() {
    return EMPTY;
  }

  /** Register every document's title and aliases, Draft documents included. */
  public static LinkRegistry of(Collection<Document> documents) {
    Builder builder = builder();
    for (Document doc : documents) {
      builder.register(doc.getTitle(), doc.getAliases(), doc.slug());
    }
    return builder.build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public Optional<String> resolve(String target) {
    if (target == null) return Optional.empty();
    return Optional.ofNullable(slugsByKey.get(key(target)));
  }

  public boolean contains(String target) {
    return resolve(target).isPresent();
  }

  public int size() {
    return slugsByKey.size();
  }

  private static String key(String text) {
    return text.trim().toLowerCase(Locale.ROOT);
  }

  public static final class Builder {
    private final Map<String, String> entries = new LinkedHashMap<>();

    private Builder() {}

    public Builder register(String title, String slug) {
      return register(title, List.of(), slug);
    }

    public Builder register(String title, List<String> aliases, String slug) {
      put(title, slug);
      if (aliases != null) {
        aliases.forEach(alias -> put(alias, slug));
      }
      return this;
    }

    private void put(String text, String slug) {
      if (text == null || text.isBlank()) return;
      String k = key(text);
      String existing = entries.putIfAbsent(k, slug);
      if (existing != null && !existing.equals(slug)) {
        log.warn(
            "Link target '{}' is claimed by both '{}' and '{}'; keeping '{}'",
            text,
            existing,
            slug,
            existing);
      }
    }

    public LinkRegistry build() {
      return new LinkRegistry(new LinkedHashMap<>(entries));
    }
  }
}
