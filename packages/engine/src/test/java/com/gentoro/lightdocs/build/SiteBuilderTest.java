package com.gentoro.lightdocs.build;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.lightdocs.document.Document;
import com.gentoro.lightdocs.exception.DocumentParseException;
import com.gentoro.lightdocs.exception.IoException;
import com.gentoro.lightdocs.exception.ValidationException;
import com.gentoro.lightdocs.utility.FileUtility;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SiteBuilderTest {

  private Path tmp;
  private Path docs;
  private Path out;
  private final SiteBuilder builder = new SiteBuilder("Test Site", "md");

  @BeforeEach
  void setUp() throws Exception {
    tmp = Files.createTempDirectory("site_");
    docs = Files.createDirectories(tmp.resolve("docs"));
    out = tmp.resolve("out");
  }

  @AfterEach
  void tearDown() {
    FileUtility.deleteDir(tmp, true);
  }

  private void write(String relative, String content) {
    FileUtility.writeString(docs.resolve(relative), content);
  }

  private static String doc(String title, String status, String body) {
    return "---\ntitle: " + title + "\nstatus: " + status + "\n---\n" + body;
  }

  @Test
  @DisplayName("only public documents are rendered and listed in the index")
  void rendersPublicOnly() throws Exception {
    write("Hello World.md", doc("Hello", "public", "See [[Draft Note]] and [[Nowhere]].\n"));
    write("draft.md", doc("Draft Note", "draft", "secret\n"));

    List<Document> documents = builder.build(docs, out);

    assertEquals(2, documents.size());
    assertTrue(Files.isRegularFile(out.resolve("Hello World.html")));
    assertFalse(Files.exists(out.resolve("draft.html")));

    String page = Files.readString(out.resolve("Hello World.html"));
    // drafts still take part in link resolution
    assertTrue(page.contains("href=\"./draft.html\""), page);
    assertTrue(page.contains("href=\"./nowhere.html\""), page);

    String index = Files.readString(out.resolve(SiteBuilder.INDEX_FILE));
    assertTrue(index.contains("<h1>Test Site</h1>"), index);
    assertTrue(index.contains("href=\"Hello%20World.html\""), index);
    assertTrue(index.contains(">Hello</a>"), index);
    assertFalse(index.contains("Draft Note"), index);
  }

  @Test
  @DisplayName("nested documents mirror the source tree and link back to the root index")
  void nestedOutput() throws Exception {
    write("guides/setup/Install.md", doc("Install", "public", "steps\n"));

    builder.build(docs, out);

    Path page = out.resolve("guides/setup/Install.html");
    assertTrue(Files.isRegularFile(page));
    assertTrue(Files.readString(page).contains("href=\"../../index.html\""));
    assertTrue(
        Files.readString(out.resolve("index.html")).contains("href=\"guides/setup/Install.html\""));
  }

  @Test
  @DisplayName("index lists creation dates when present")
  void indexShowsCreated() throws Exception {
    write("a.md", "---\ntitle: Dated\nstatus: public\ncreated: 2024-02-01\n---\nx\n");

    builder.build(docs, out);

    assertTrue(Files.readString(out.resolve("index.html")).contains("01.02.2024"));
  }

  @Test
  @DisplayName("one invalid document aborts the build before anything is written")
  void failFast() {
    write("good.md", doc("Good", "public", "ok\n"));
    write("zz-bad.md", "---\ntitle: Bad\nno closing delimiter\n");

    assertThrows(DocumentParseException.class, () -> builder.build(docs, out));
    assertFalse(Files.exists(out.resolve("good.html")));
    assertFalse(Files.exists(out.resolve("index.html")));
  }

  @Test
  @DisplayName("two documents with the same slug are rejected")
  void duplicateSlugs() {
    write("a/Release Notes.md", doc("One", "public", "1\n"));
    write("b/release_notes.md", doc("Two", "draft", "2\n"));

    ValidationException ex =
        assertThrows(ValidationException.class, () -> builder.build(docs, out));
    assertEquals("release-notes", ex.getContext().get("slug"));
  }

  @Test
  @DisplayName("a public document may not overwrite the site index, and nothing is written")
  void indexCollision() {
    write("a.md", doc("Alpha", "public", "first in walk order\n"));
    write("index.md", doc("Home", "public", "home\n"));

    assertThrows(ValidationException.class, () -> builder.build(docs, out));
    assertFalse(Files.exists(out.resolve("a.html")));
    assertFalse(Files.exists(out.resolve("index.html")));
  }

  @Test
  @DisplayName("a page whose document became a draft is removed on the next build")
  void unpublishedPageRemoved() throws Exception {
    write("public.md", doc("Public", "public", "stays\n"));
    write("secret.md", doc("Secret", "public", "was public\n"));
    builder.build(docs, out);
    assertTrue(Files.exists(out.resolve("secret.html")));

    write("secret.md", doc("Secret", "draft", "now hidden\n"));
    builder.build(docs, out);

    assertFalse(Files.exists(out.resolve("secret.html")));
    assertTrue(Files.exists(out.resolve("public.html")));
    assertFalse(Files.readString(out.resolve("index.html")).contains("Secret"));
  }

  @Test
  @DisplayName("pages of deleted documents are removed, other output files are kept")
  void deletedPageRemoved() throws Exception {
    write("a.md", doc("A", "public", "a\n"));
    write("nested/b.md", doc("B", "public", "b\n"));
    builder.build(docs, out);
    FileUtility.writeString(out.resolve("style.css"), "body {}");
    assertTrue(Files.exists(out.resolve("nested/b.html")));

    Files.delete(docs.resolve("nested/b.md"));
    builder.build(docs, out);

    assertFalse(Files.exists(out.resolve("nested/b.html")));
    assertTrue(Files.exists(out.resolve("a.html")));
    assertTrue(Files.exists(out.resolve("index.html")));
    assertTrue(Files.exists(out.resolve("style.css")));
  }

  @Test
  @DisplayName("a missing docs root is an I/O error")
  void missingRoot() {
    assertThrows(IoException.class, () -> builder.build(tmp.resolve("absent"), out));
  }

  @Test
  @DisplayName("listDocuments loads in path order and ignores other extensions")
  void listDocuments() {
    write("b.md", doc("B", "draft", ""));
    write("a.md", doc("A", "public", ""));
    write("notes.txt", "not a document");

    List<Document> documents = builder.listDocuments(docs);

    assertEquals(List.of("A", "B"), documents.stream().map(Document::getTitle).toList());
  }

  @Test
  @DisplayName("relative links are computed from the page depth")
  void linkHelpers() {
    assertEquals("index.html", SiteBuilder.indexHref(Path.of("a.md")));
    assertEquals("../../index.html", SiteBuilder.indexHref(Path.of("x", "y", "a.md")));
    assertEquals("dir/My%20Page.html", SiteBuilder.href(Path.of("dir", "My Page.html")));
  }
}
