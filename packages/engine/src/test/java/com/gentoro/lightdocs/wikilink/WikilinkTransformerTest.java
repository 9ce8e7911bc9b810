package com.gentoro.lightdocs.wikilink;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class WikilinkTransformerTest {

  private final WikilinkTransformer transformer =
      new WikilinkTransformer(
          LinkRegistry.builder()
              .register("FAQ", "faq")
              .register("Getting Started", List.of("Intro"), "getting-started")
              .build());

  @Test
  @DisplayName("plain and display-text wikilinks resolve through the registry")
  void resolvesRegisteredTargets() {
    assertEquals("See [FAQ](./faq.html)", transformer.transform("See [[FAQ]]"));
    assertEquals(
        "See [questions](./faq.html)", transformer.transform("See [[faq|questions]]"));
    assertEquals(
        "[Intro](./getting-started.html) and [start](./getting-started.html)",
        transformer.transform("[[Intro]] and [[ Getting Started | start ]]"));
  }

  @Test
  @DisplayName("unknown targets fall back to their own slug")
  void fallbackSlug() {
    assertEquals("[Missing](./missing.html)", transformer.transform("[[Missing]]"));
    assertEquals(
        "[later](./some-future-page.html)", transformer.transform("[[Some Future Page|later]]"));
  }

  @Test
  @DisplayName("text without wikilinks is returned unchanged")
  void noLinks() {
    String text = "Regular [markdown](link.html) and [single] brackets, $1 and \\ kept.";
    assertEquals(text, transformer.transform(text));
    assertEquals("", transformer.transform(null));
  }

  @Test
  @DisplayName("extractLinks lists targets in order without resolving them")
  void extractLinks() {
    assertEquals(
        List.of("FAQ", "Missing", "Intro"),
        WikilinkTransformer.extractLinks("[[FAQ]] then [[Missing|x]] then [[Intro]]"));
    assertTrue(WikilinkTransformer.extractLinks(null).isEmpty());
  }

  @Test
  @DisplayName("findBrokenLinks reports only unregistered targets")
  void brokenLinks() {
    assertEquals(
        List.of("Missing", "Other"),
        transformer.findBrokenLinks("[[FAQ]] [[Missing]] [[intro|i]] [[Other]]"));
  }
}
