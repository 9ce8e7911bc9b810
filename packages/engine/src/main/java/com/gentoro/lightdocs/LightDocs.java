package com.gentoro.lightdocs;

import com.gentoro.lightdocs.build.SiteBuilder;
import com.gentoro.lightdocs.document.Document;
import com.gentoro.lightdocs.document.DocumentStatus;
import com.gentoro.lightdocs.document.Frontmatter;
import com.gentoro.lightdocs.exception.IoException;
import com.gentoro.lightdocs.logging.LoggingService;
import com.gentoro.lightdocs.search.SearchIndex;
import com.gentoro.lightdocs.search.SearchResult;
import com.gentoro.lightdocs.utility.FileUtility;
import com.gentoro.lightdocs.watch.DirectoryWatcher;
import com.gentoro.lightdocs.watch.RebuildCoordinator;
import com.gentoro.lightdocs.watch.RebuildListener;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import org.apache.commons.configuration2.Configuration;

/**
 * Entry point of the engine. Wires the build pipeline, the search index and the rebuild loop for
 * one knowledge root.
 *
 * <p>The search index is opened lazily on first use and held until {@link #close()}. {@link
 * #search(String)} may be called from any thread, including while a watch-triggered rebuild runs.
 */
public class LightDocs implements AutoCloseable {

  private static final org.slf4j.Logger log = LoggingService.getLogger(LightDocs.class);

  /** File written by {@link #init()} into an empty docs directory. */
  public static final String SAMPLE_DOCUMENT = "welcome.md";

  private final Path root;
  private final LightDocsConfig config;
  private final SiteBuilder siteBuilder;
  private final AtomicBoolean closed = new AtomicBoolean(false);
  // Guards searchIndex only, so the rebuild thread never waits on watch()/stopWatching()
  private final Object indexLock = new Object();
  private SearchIndex searchIndex;
  private RebuildCoordinator coordinator;
  private DirectoryWatcher watcher;

  /** Load configuration for {@code root} and apply its logging levels. */
  public LightDocs(Path root) {
    this(root, configure(root));
  }

  public LightDocs(Path root, LightDocsConfig config) {
    this.root = root.toAbsolutePath().normalize();
    this.config = config;
    this.siteBuilder = new SiteBuilder(config.title(), config.extension());
  }

  private static LightDocsConfig configure(Path root) {
    Configuration cfg = LightDocsConfig.loadConfiguration(root);
    // Apply logging levels as early as possible
    LoggingService.applyConfiguration(cfg);
    return LightDocsConfig.from(cfg, root);
  }

  public Path root() {
    return root;
  }

  public LightDocsConfig config() {
    return config;
  }

  /**
   * Prepare the knowledge root: create the docs and output directories, write a sample public
   * document when the docs directory holds none, and write {@code lightdocs.yaml} when missing.
   * Existing files are never overwritten.
   */
  public void init() {
    try {
      Files.createDirectories(config.docsRoot());
      Files.createDirectories(config.outputDir());
    } catch (IOException e) {
      throw new IoException("Failed to create directories under " + root, e);
    }

    if (FileUtility.findFiles(config.docsRoot(), config.extension()).isEmpty()) {
      Path sample = config.docsRoot().resolve(SAMPLE_DOCUMENT);
      Document welcome =
          new Document(
              sample,
              new Frontmatter(
                  "Welcome",
                  DocumentStatus.PUBLIC,
                  List.of("getting-started"),
                  LocalDate.now(),
                  null,
                  List.of("Home")),
              "# Welcome to "
                  + config.title()
                  + "\n\nEvery Markdown file in this folder becomes a page."
                  + " Set `status: public` in the frontmatter to publish it.\n\n"
                  + "Link between pages by title, e.g. [[Welcome]].\n",
              null);
      welcome.save();
      log.info("Created sample document {}", sample);
    }

    if (!Files.exists(root.resolve(LightDocsConfig.SITE_CONFIG_FILE))) {
      config.save(root);
      log.info("Wrote {}", root.resolve(LightDocsConfig.SITE_CONFIG_FILE));
    }
  }

  /** Build the static site. Failures propagate. */
  public List<Document> build() {
    return siteBuilder.build(config.docsRoot(), config.outputDir());
  }

  public List<Document> listDocuments() {
    return siteBuilder.listDocuments(config.docsRoot());
  }

  /** Make the search index mirror the Public subset of {@code documents}. */
  public void reindex(Collection<Document> documents) {
    List<Document> published =
        documents.stream().filter(Document::isPublic).collect(Collectors.toList());
    searchIndex().reindex(published);
  }

  /** One full cycle: build, then re-index. Used by the rebuild loop. */
  public List<Document> rebuild() {
    List<Document> documents = build();
    reindex(documents);
    return documents;
  }

  public List<SearchResult> search(String query) {
    return searchIndex().search(query);
  }

  public SearchIndex searchIndex() {
    synchronized (indexLock) {
      if (closed.get()) {
        throw new IllegalStateException("LightDocs is closed");
      }
      if (searchIndex == null) {
        searchIndex = SearchIndex.open(config.indexDir());
      }
      return searchIndex;
    }
  }

  /**
   * Start watching the docs directory. Each burst of changes triggers one {@link #rebuild()} on the
   * coordinator thread; outcomes are reported to {@code listener}.
   */
  public synchronized void watch(RebuildListener listener) {
    if (coordinator != null) {
      throw new IllegalStateException("Already watching " + config.docsRoot());
    }
    coordinator =
        new RebuildCoordinator(this::rebuild, listener, Duration.ofMillis(config.debounceMillis()));
    coordinator.start();
    watcher = new DirectoryWatcher(config.docsRoot(), coordinator::submit);
    try {
      watcher.start();
    } catch (RuntimeException e) {
      coordinator.stop();
      coordinator = null;
      watcher = null;
      throw e;
    }
  }

  public synchronized boolean isWatching() {
    return coordinator != null && coordinator.isRunning();
  }

  public synchronized void stopWatching() {
    closeQuietly(watcher);
    closeQuietly(coordinator);
    watcher = null;
    coordinator = null;
  }

  /** Stop watching and close the search index. Safe to call multiple times. */
  @Override
  public synchronized void close() {
    if (closed.compareAndSet(false, true)) {
      stopWatching();
      synchronized (indexLock) {
        closeQuietly(searchIndex);
        searchIndex = null;
      }
    }
  }

  private void closeQuietly(AutoCloseable closeable) {
    if (closeable != null) {
      try {
        closeable.close();
      } catch (Exception e) {
        log.debug("Error while closing {}", closeable, e);
      }
    }
  }
}
