package com.gentoro.lightdocs.document;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SlugsTest {

  @Test
  @DisplayName("file names become lowercase dash-separated slugs")
  void slugFromFileName() {
    assertEquals("hello-world", Slugs.fromPath(Path.of("Hello World.md")));
    assertEquals("test-page", Slugs.fromPath(Path.of("Test -- Page.md")));
    assertEquals("snake-case-name", Slugs.fromPath(Path.of("dir", "snake_case_name.md")));
    assertEquals("v1-2-notes", Slugs.fromPath(Path.of("v1.2 notes.md")));
  }

  @Test
  @DisplayName("leading and trailing separators are trimmed")
  void trimsSeparators() {
    assertEquals("draft", Slugs.slugify("  --Draft!!  "));
    assertEquals("", Slugs.slugify("---"));
    assertEquals("", Slugs.slugify(null));
  }

  @Test
  @DisplayName("non-ASCII letters and digits are preserved")
  void keepsUnicodeLetters() {
    assertEquals("привет-мир", Slugs.slugify("Привет Мир"));
    assertEquals("café-2024", Slugs.slugify("Café 2024"));
  }

  @Test
  @DisplayName("slugify is idempotent")
  void idempotent() {
    for (String s : new String[] {"Hello World", "Test -- Page", "Привет Мир", "a_b-c d"}) {
      String once = Slugs.slugify(s);
      assertEquals(once, Slugs.slugify(once), s);
    }
  }
}
