package com.gentoro.lightdocs.wikilink;

import com.gentoro.lightdocs.document.Slugs;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites {@code [[Target]]} and {@code [[Target|Display]]} into Markdown links of the form
 * {@code [Display](./slug.html)}.
 *
 * <p>Targets are looked up case-insensitively in the {@link LinkRegistry}. Unknown targets fall
 * back to the slug of the target text itself, so the link may point at a page that does not exist;
 * {@link #findBrokenLinks(String)} reports those.
 */
public class WikilinkTransformer {
  static final Pattern WIKILINK = Pattern.compile("\\[\\[([^\\]|]+)(?:\\|([^\\]]+))?\\]\\]");

  private final LinkRegistry registry;

  public WikilinkTransformer(LinkRegistry registry) {
    this.registry = Objects.requireNonNull(registry, "registry");
  }

  public String transform(String text) {
    if (text == null || text.isEmpty()) return "";
    Matcher m = WIKILINK.matcher(text);
    StringBuilder out = new StringBuilder(text.length());
    while (m.find()) {
      String target = m.group(1).trim();
      String display = m.group(2) == null ? target : m.group(2).trim();
      String slug = registry.resolve(target).orElseGet(() -> Slugs.slugify(target));
      m.appendReplacement(out, Matcher.quoteReplacement("[" + display + "](./" + slug + ".html)"));
    }
    m.appendTail(out);
    return out.toString();
  }

  /** Every link target in order of appearance, unresolved. */
  public static List<String> extractLinks(String text) {
    List<String> links = new ArrayList<>();
    if (text == null) return links;
    Matcher m = WIKILINK.matcher(text);
    while (m.find()) {
      links.add(m.group(1).trim());
    }
    return links;
  }

  /** Targets that are not registered and will render through the fallback slug. */
  public List<String> findBrokenLinks(String text) {
    return extractLinks(text).stream().filter(t -> !registry.contains(t)).toList();
  }

  public LinkRegistry registry() {
    return registry;
  }
}
