package com.gentoro.lightdocs.build;

import com.gentoro.lightdocs.document.Document;
import com.gentoro.lightdocs.exception.ExceptionUtil;
import com.gentoro.lightdocs.exception.IoException;
import com.gentoro.lightdocs.exception.ValidationException;
import com.gentoro.lightdocs.render.PageRenderer;
import com.gentoro.lightdocs.render.PageTemplates;
import com.gentoro.lightdocs.utility.FileUtility;
import com.gentoro.lightdocs.wikilink.LinkRegistry;
import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Full static-site build.
 *
 * <p>The build runs in two passes. The first loads every document under the docs root (Draft and
 * Public) and derives the {@link LinkRegistry}; the second renders Public documents against that
 * registry and writes them to the mirrored path in the output tree, then writes {@code index.html}.
 * Any load failure or output conflict aborts the build before a single page is written.
 */
public class SiteBuilder {
  private static final org.slf4j.Logger log =
      com.gentoro.lightdocs.logging.LoggingService.getLogger(SiteBuilder.class);

  public static final String INDEX_FILE = "index.html";

  private final String siteTitle;
  private final String extension;

  public SiteBuilder(String siteTitle, String extension) {
    this.siteTitle = siteTitle;
    this.extension = extension;
  }

  /**
   * Build the site. Pages from an earlier build that this one no longer produces (deleted or
   * unpublished documents) are removed from {@code outputRoot}.
   *
   * @return every loaded document, Draft and Public, in walk order
   */
  public List<Document> build(Path docsRoot, Path outputRoot) {
    long start = System.currentTimeMillis();
    List<Document> documents = listDocuments(docsRoot);
    ensureUniqueSlugs(documents);
    List<Page> pages = planPages(docsRoot, outputRoot, documents);

    LinkRegistry registry = LinkRegistry.of(documents);
    PageRenderer renderer = new PageRenderer(registry, siteTitle);
    log.debug("Link registry holds {} titles and aliases", registry.size());

    removeStalePages(outputRoot, pages);
    for (Page page : pages) {
      Document doc = page.document();
      List<String> broken = renderer.wikilinks().findBrokenLinks(doc.getContent());
      if (!broken.isEmpty()) {
        log.warn("{} links to unknown documents: {}", page.relative(), broken);
      }
      FileUtility.writeString(page.target(), renderer.render(doc, indexHref(page.relative())));
      log.info("Built: {} -> {}", doc.getPath(), page.target());
    }

    writeIndex(outputRoot, pages);
    log.info(
        "Built {} public documents (of {} total) in {} ms",
        pages.size(),
        documents.size(),
        System.currentTimeMillis() - start);
    return documents;
  }

  /** Load every document under {@code docsRoot} without rendering anything. */
  public List<Document> listDocuments(Path docsRoot) {
    List<Document> documents = new ArrayList<>();
    for (Path file : FileUtility.findFiles(docsRoot, extension)) {
      try {
        documents.add(Document.load(file));
      } catch (Exception e) {
        throw ExceptionUtil.rethrowIfUnchecked(
            e, t -> new IoException("Failed to load document: " + file, t));
      }
    }
    return documents;
  }

  // Output location of every Public document, checked before anything is written
  private static List<Page> planPages(Path docsRoot, Path outputRoot, List<Document> documents) {
    Path index = outputRoot.resolve(INDEX_FILE).normalize();
    List<Page> pages = new ArrayList<>();
    for (Document doc : documents) {
      if (!doc.isPublic()) {
        log.debug("Skipping draft {}", doc.getPath());
        continue;
      }
      Path relative = docsRoot.relativize(doc.getPath());
      Path target = outputRoot.resolve(withHtmlExtension(relative)).normalize();
      if (target.equals(index)) {
        throw new ValidationException(
            "Document would overwrite the site index: " + doc.getPath(),
            Map.of("source", doc.getPath().toString(), "target", target.toString()));
      }
      pages.add(new Page(doc, relative, target));
    }
    return pages;
  }

  private static void removeStalePages(Path outputRoot, List<Page> pages) {
    if (!Files.isDirectory(outputRoot)) return;
    Set<Path> keep = new HashSet<>();
    keep.add(outputRoot.resolve(INDEX_FILE).normalize());
    pages.forEach(page -> keep.add(page.target()));
    for (Path html : FileUtility.findFiles(outputRoot, "html")) {
      if (keep.contains(html.normalize())) continue;
      try {
        Files.delete(html);
        log.info("Removed stale page {}", html);
      } catch (IOException e) {
        throw new IoException("Failed to remove stale page: " + html, e);
      }
    }
  }

  private void writeIndex(Path outputRoot, List<Page> pages) {
    List<Map<String, Object>> rows = new ArrayList<>();
    for (Page page : pages) {
      Document doc = page.document();
      Map<String, Object> row = new HashMap<>();
      row.put("title", doc.getTitle());
      row.put("href", href(withHtmlExtension(page.relative())));
      row.put("created", PageRenderer.formatDate(doc.getCreated()));
      row.put("filterKey", doc.getTitle().toLowerCase(Locale.ROOT));
      rows.add(row);
    }
    Map<String, Object> ctx = new HashMap<>();
    ctx.put("siteTitle", siteTitle);
    ctx.put("documents", rows);
    FileUtility.writeString(
        outputRoot.resolve(INDEX_FILE), PageTemplates.render(PageTemplates.INDEX_PAGE, ctx));
  }

  private static void ensureUniqueSlugs(List<Document> documents) {
    Map<String, Path> seen = new LinkedHashMap<>();
    for (Document doc : documents) {
      Path previous = seen.putIfAbsent(doc.slug(), doc.getPath());
      if (previous != null) {
        throw new ValidationException(
            "Duplicate slug '" + doc.slug() + "': " + previous + " and " + doc.getPath(),
            Map.of("slug", doc.slug(), "first", previous.toString(), "second", doc.getPath().toString()));
      }
    }
  }

  private static Path withHtmlExtension(Path relative) {
    String name = relative.getFileName().toString();
    int dot = name.lastIndexOf('.');
    String html = (dot > 0 ? name.substring(0, dot) : name) + ".html";
    Path parent = relative.getParent();
    return parent == null ? Path.of(html) : parent.resolve(html);
  }

  // "../" once per directory level between the page and the output root
  static String indexHref(Path relative) {
    int depth = relative.getNameCount() - 1;
    return "../".repeat(Math.max(0, depth)) + INDEX_FILE;
  }

  static String href(Path relative) {
    List<String> segments = new ArrayList<>();
    for (Path part : relative) {
      segments.add(URLEncoder.encode(part.toString(), StandardCharsets.UTF_8).replace("+", "%20"));
    }
    return String.join("/", segments);
  }

  private record Page(Document document, Path relative, Path target) {}
}
