package com.gentoro.lightdocs;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.lightdocs.document.Document;
import com.gentoro.lightdocs.search.SearchResult;
import com.gentoro.lightdocs.utility.FileUtility;
import com.gentoro.lightdocs.watch.RebuildEvent;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class LightDocsTest {

  private Path root;
  private LightDocs lightDocs;

  @BeforeEach
  void setUp() throws Exception {
    root = Files.createTempDirectory("lightdocs_");
    lightDocs = new LightDocs(root);
  }

  @AfterEach
  void tearDown() {
    lightDocs.close();
    FileUtility.deleteDir(root, true);
  }

  private Path docs() {
    return lightDocs.config().docsRoot();
  }

  private static String doc(String title, String status, String body) {
    return "---\ntitle: " + title + "\nstatus: " + status + "\n---\n" + body;
  }

  @Test
  @DisplayName("init creates the workspace with a sample page and a site file")
  void init() throws Exception {
    lightDocs.init();

    Path sample = docs().resolve(LightDocs.SAMPLE_DOCUMENT);
    assertTrue(Files.isRegularFile(sample));
    assertTrue(Document.load(sample).isPublic());
    assertTrue(Files.isDirectory(lightDocs.config().outputDir()));
    assertTrue(Files.isRegularFile(root.resolve(LightDocsConfig.SITE_CONFIG_FILE)));

    Files.writeString(sample, doc("Edited", "draft", "mine\n"));
    lightDocs.init();
    assertEquals("Edited", Document.load(sample).getTitle());
  }

  @Test
  @DisplayName("rebuild renders public pages and indexes only them")
  void rebuildAndSearch() throws Exception {
    lightDocs.init();
    FileUtility.writeString(
        docs().resolve("Rust Notes.md"), doc("Rust Notes", "public", "Ownership in Rust.\n"));
    FileUtility.writeString(
        docs().resolve("secret.md"), doc("Secret", "draft", "Unreleased Rust plans.\n"));

    List<Document> documents = lightDocs.rebuild();

    assertEquals(3, documents.size());
    Path out = lightDocs.config().outputDir();
    assertTrue(Files.isRegularFile(out.resolve("index.html")));
    assertTrue(Files.isRegularFile(out.resolve("welcome.html")));
    assertTrue(Files.isRegularFile(out.resolve("Rust Notes.html")));
    assertFalse(Files.exists(out.resolve("secret.html")));

    List<SearchResult> results = lightDocs.search("rust");
    assertEquals(List.of("rust-notes"), results.stream().map(SearchResult::slug).toList());
    assertEquals("Rust Notes", results.get(0).title());

    Files.delete(docs().resolve("Rust Notes.md"));
    lightDocs.rebuild();
    assertTrue(lightDocs.search("ownership").isEmpty());
  }

  @Test
  @DisplayName("a document change under watch is rebuilt and becomes searchable")
  void watchRebuilds() throws Exception {
    lightDocs.init();
    lightDocs.rebuild();
    BlockingQueue<RebuildEvent> events = new LinkedBlockingQueue<>();
    lightDocs.watch(events::add);
    assertTrue(lightDocs.isWatching());
    assertThrows(IllegalStateException.class, () -> lightDocs.watch(events::add));

    // written elsewhere and moved in, so the watcher never sees a half-written file
    Path staged = root.resolve("staged.md");
    Files.writeString(staged, doc("Kotlin Tips", "public", "Coroutines explained.\n"));
    Files.move(staged, docs().resolve("kotlin.md"), StandardCopyOption.ATOMIC_MOVE);

    RebuildEvent event = events.poll(20, TimeUnit.SECONDS);
    assertNotNull(event, "expected a rebuild after the change");
    assertTrue(event.succeeded(), String.valueOf(event.error()));
    assertEquals(2, event.documentCount());
    assertEquals(1, lightDocs.search("coroutines").size());
    assertTrue(Files.isRegularFile(lightDocs.config().outputDir().resolve("kotlin.html")));

    lightDocs.stopWatching();
    assertFalse(lightDocs.isWatching());
  }

  @Test
  @DisplayName("close is idempotent and the index is unavailable afterwards")
  void close() {
    lightDocs.close();
    lightDocs.close();

    assertThrows(IllegalStateException.class, () -> lightDocs.search("anything"));
  }
}
