package com.gentoro.lightdocs.render;

import com.gentoro.lightdocs.document.Document;
import com.gentoro.lightdocs.wikilink.LinkRegistry;
import com.gentoro.lightdocs.wikilink.WikilinkTransformer;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.Map;

/**
 * Renders one document to a complete HTML page: wikilinks are rewritten against a prepared {@link
 * LinkRegistry}, the body is converted with {@link MarkdownRenderer}, and the fragment is wrapped
 * in the {@code page} template. Performs no file I/O.
 */
public class PageRenderer {
  public static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("dd.MM.yyyy");

  private final WikilinkTransformer wikilinks;
  private final MarkdownRenderer markdown;
  private final String siteTitle;

  public PageRenderer(LinkRegistry registry, String siteTitle) {
    this(new WikilinkTransformer(registry), new MarkdownRenderer(), siteTitle);
  }

  public PageRenderer(WikilinkTransformer wikilinks, MarkdownRenderer markdown, String siteTitle) {
    this.wikilinks = wikilinks;
    this.markdown = markdown;
    this.siteTitle = siteTitle;
  }

  /** Render a page that sits at the output root. */
  public String render(Document doc) {
    return render(doc, "index.html");
  }

  /**
   * @param indexHref link back to the site index, relative to where the page is written
   */
  public String render(Document doc, String indexHref) {
    Map<String, Object> ctx = new HashMap<>();
    ctx.put("siteTitle", siteTitle);
    ctx.put("indexHref", indexHref);
    ctx.put("title", doc.getTitle());
    ctx.put("created", formatDate(doc.getCreated()));
    ctx.put("tags", doc.getTags());
    ctx.put("content", renderContent(doc.getContent()));
    return PageTemplates.render(PageTemplates.DOCUMENT_PAGE, ctx);
  }

  /** Body only: wikilink rewrite followed by Markdown conversion. */
  public String renderContent(String body) {
    return markdown.toHtml(wikilinks.transform(body));
  }

  public WikilinkTransformer wikilinks() {
    return wikilinks;
  }

  public static String formatDate(LocalDate date) {
    return date == null ? "" : DATE_FORMAT.format(date);
  }
}
