package com.gentoro.lightdocs.render;

import com.gentoro.lightdocs.exception.TemplateException;
import io.pebbletemplates.pebble.PebbleEngine;
import io.pebbletemplates.pebble.loader.ClasspathLoader;
import io.pebbletemplates.pebble.template.PebbleTemplate;
import java.io.StringWriter;
import java.io.Writer;
import java.util.Map;

/**
 * Pebble templates shipped on the classpath under {@code templates/*.peb}. Output is HTML-escaped
 * unless a template marks a value {@code raw}.
 */
public final class PageTemplates {
  public static final String DOCUMENT_PAGE = "page";
  public static final String INDEX_PAGE = "index";

  private static final PebbleEngine ENGINE = buildEngine();

  private PageTemplates() {}

  private static PebbleEngine buildEngine() {
    ClasspathLoader loader = new ClasspathLoader(PageTemplates.class.getClassLoader());
    loader.setPrefix("templates");
    loader.setSuffix(".peb");
    return new PebbleEngine.Builder().loader(loader).strictVariables(true).build();
  }

  public static String render(String templateName, Map<String, Object> context) {
    try {
      PebbleTemplate template = ENGINE.getTemplate(templateName);
      Writer writer = new StringWriter();
      template.evaluate(writer, context);
      return writer.toString();
    } catch (Exception e) {
      throw new TemplateException("Failed to render template '" + templateName + "'", e);
    }
  }
}
