package com.gentoro.lightdocs;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.lightdocs.exception.ConfigException;
import com.gentoro.lightdocs.utility.FileUtility;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class LightDocsConfigTest {

  private Path root;

  @BeforeEach
  void setUp() throws Exception {
    root = Files.createTempDirectory("cfg_");
  }

  @AfterEach
  void tearDown() {
    FileUtility.deleteDir(root, true);
    System.clearProperty("LIGHTDOCS_TEST_TITLE");
  }

  @Test
  @DisplayName("without a site file the bundled defaults apply")
  void defaults() {
    LightDocsConfig config = LightDocsConfig.load(root);

    assertEquals(LightDocsConfig.defaults(root), config);
    assertEquals(root.resolve("knowledge").toAbsolutePath().normalize(), config.docsRoot());
    assertEquals(root.resolve("_site").toAbsolutePath().normalize(), config.outputDir());
    assertEquals(root.resolve(".lightdocs_search").toAbsolutePath().normalize(), config.indexDir());
    assertEquals("LightDocs", config.title());
    assertTrue(config.liveReload());
    assertEquals(100, config.debounceMillis());
    assertEquals("md", config.extension());
  }

  @Test
  @DisplayName("lightdocs.yaml in the root overrides individual keys")
  void siteFileOverrides() {
    FileUtility.writeString(
        root.resolve(LightDocsConfig.SITE_CONFIG_FILE),
        "lightdocs:\n"
            + "  title: My KB\n"
            + "  docs-root: notes\n"
            + "  debounce-ms: 250\n"
            + "  live-reload: false\n"
            + "  extension: .markdown\n");

    LightDocsConfig config = LightDocsConfig.load(root);

    assertEquals("My KB", config.title());
    assertEquals(root.resolve("notes").toAbsolutePath().normalize(), config.docsRoot());
    assertEquals(250, config.debounceMillis());
    assertFalse(config.liveReload());
    assertEquals("markdown", config.extension());
    assertEquals(root.resolve("_site").toAbsolutePath().normalize(), config.outputDir());
  }

  @Test
  @DisplayName("values may reference environment variables or system properties")
  void interpolation() {
    System.setProperty("LIGHTDOCS_TEST_TITLE", "From Property");
    FileUtility.writeString(
        root.resolve(LightDocsConfig.SITE_CONFIG_FILE),
        "lightdocs:\n  title: ${env:LIGHTDOCS_TEST_TITLE}\n");

    assertEquals("From Property", LightDocsConfig.load(root).title());
  }

  @Test
  @DisplayName("a negative debounce is rejected")
  void negativeDebounce() {
    FileUtility.writeString(
        root.resolve(LightDocsConfig.SITE_CONFIG_FILE), "lightdocs:\n  debounce-ms: -5\n");

    assertThrows(ConfigException.class, () -> LightDocsConfig.load(root));
  }

  @Test
  @DisplayName("a saved configuration loads back unchanged with relative paths on disk")
  void saveAndLoad() throws Exception {
    LightDocsConfig config =
        new LightDocsConfig(
            root.resolve("docs").toAbsolutePath().normalize(),
            root.resolve("public").toAbsolutePath().normalize(),
            root.resolve("idx").toAbsolutePath().normalize(),
            "Saved Site",
            false,
            300,
            "md");

    config.save(root);

    String yaml = Files.readString(root.resolve(LightDocsConfig.SITE_CONFIG_FILE));
    assertTrue(yaml.contains("docs-root: docs"), yaml);
    assertEquals(config, LightDocsConfig.load(root));
  }
}
