package com.gentoro.lightdocs;

import com.gentoro.lightdocs.exception.ConfigException;
import com.gentoro.lightdocs.utility.FileUtility;
import com.gentoro.lightdocs.utility.JacksonUtility;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.configuration2.Configuration;

/**
 * Resolved site configuration. Paths are absolute; relative values from configuration are
 * resolved against the knowledge root.
 *
 * <p>Keys (all under {@code lightdocs.}): {@code docs-root}, {@code output-dir}, {@code
 * index-dir}, {@code title}, {@code live-reload}, {@code debounce-ms}, {@code extension}.
 */
public record LightDocsConfig(
    Path docsRoot,
    Path outputDir,
    Path indexDir,
    String title,
    boolean liveReload,
    long debounceMillis,
    String extension) {

  /** Per-site override file, looked up in the knowledge root. */
  public static final String SITE_CONFIG_FILE = "lightdocs.yaml";

  public static final String DEFAULT_DOCS_ROOT = "knowledge";
  public static final String DEFAULT_OUTPUT_DIR = "_site";
  public static final String DEFAULT_INDEX_DIR = ".lightdocs_search";
  public static final String DEFAULT_TITLE = "LightDocs";
  public static final long DEFAULT_DEBOUNCE_MS = 100;
  public static final String DEFAULT_EXTENSION = "md";

  public LightDocsConfig {
    Objects.requireNonNull(docsRoot, "docsRoot");
    Objects.requireNonNull(outputDir, "outputDir");
    Objects.requireNonNull(indexDir, "indexDir");
    if (title == null || title.isBlank()) title = DEFAULT_TITLE;
    if (debounceMillis < 0) {
      throw new ConfigException("lightdocs.debounce-ms must not be negative: " + debounceMillis);
    }
    if (extension == null || extension.isBlank()) extension = DEFAULT_EXTENSION;
    if (extension.startsWith(".")) extension = extension.substring(1);
  }

  public static LightDocsConfig defaults(Path root) {
    return new LightDocsConfig(
        root.resolve(DEFAULT_DOCS_ROOT).toAbsolutePath().normalize(),
        root.resolve(DEFAULT_OUTPUT_DIR).toAbsolutePath().normalize(),
        root.resolve(DEFAULT_INDEX_DIR).toAbsolutePath().normalize(),
        DEFAULT_TITLE,
        true,
        DEFAULT_DEBOUNCE_MS,
        DEFAULT_EXTENSION);
  }

  /**
   * Layered configuration for a knowledge root: {@code <root>/lightdocs.yaml} when present, then
   * {@code classpath:application.yaml}. Earlier layers win.
   */
  public static Configuration loadConfiguration(Path root) {
    CompositeConfiguration layered = new CompositeConfiguration();
    Path siteFile = root.resolve(SITE_CONFIG_FILE);
    if (Files.isRegularFile(siteFile)) {
      layered.addConfiguration(new ConfigurationProvider(siteFile.toString()).config());
    }
    layered.addConfiguration(
        new ConfigurationProvider(ConfigurationProvider.DEFAULT_LOCATION).config());
    return ConfigurationProvider.addOns(layered);
  }

  public static LightDocsConfig load(Path root) {
    return from(loadConfiguration(root), root);
  }

  public static LightDocsConfig from(Configuration cfg, Path root) {
    try {
      return new LightDocsConfig(
          resolve(root, cfg.getString("lightdocs.docs-root", DEFAULT_DOCS_ROOT)),
          resolve(root, cfg.getString("lightdocs.output-dir", DEFAULT_OUTPUT_DIR)),
          resolve(root, cfg.getString("lightdocs.index-dir", DEFAULT_INDEX_DIR)),
          cfg.getString("lightdocs.title", DEFAULT_TITLE),
          cfg.getBoolean("lightdocs.live-reload", true),
          cfg.getLong("lightdocs.debounce-ms", DEFAULT_DEBOUNCE_MS),
          cfg.getString("lightdocs.extension", DEFAULT_EXTENSION));
    } catch (ConfigException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new ConfigException("Invalid lightdocs configuration: " + e.getMessage(), e);
    }
  }

  /**
   * Write this configuration to {@code <root>/lightdocs.yaml}. Paths under {@code root} are stored
   * relative to it so the knowledge root stays relocatable.
   */
  public void save(Path root) {
    Map<String, Object> values = new LinkedHashMap<>();
    values.put("docs-root", relativize(root, docsRoot));
    values.put("output-dir", relativize(root, outputDir));
    values.put("index-dir", relativize(root, indexDir));
    values.put("title", title);
    values.put("live-reload", liveReload);
    values.put("debounce-ms", debounceMillis);
    values.put("extension", extension);
    FileUtility.writeString(
        root.resolve(SITE_CONFIG_FILE), JacksonUtility.toYaml(Map.of("lightdocs", values)));
  }

  private static Path resolve(Path root, String value) {
    Path p = Path.of(value.trim());
    return (p.isAbsolute() ? p : root.resolve(p)).toAbsolutePath().normalize();
  }

  private static String relativize(Path root, Path path) {
    Path base = root.toAbsolutePath().normalize();
    if (path.startsWith(base)) {
      return base.relativize(path).toString().replace('\\', '/');
    }
    return path.toString();
  }
}
