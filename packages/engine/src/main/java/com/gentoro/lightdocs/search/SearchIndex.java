package com.gentoro.lightdocs.search;

import com.fasterxml.jackson.core.type.TypeReference;
import com.gentoro.lightdocs.document.Document;
import com.gentoro.lightdocs.exception.IndexException;
import com.gentoro.lightdocs.utility.JacksonUtility;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.h2.mvstore.MVMap;
import org.h2.mvstore.MVStore;

/**
 * Persistent inverted index backed by an H2 {@link MVStore} file.
 *
 * <p>Three maps live in the store: {@code postings} (token to JSON list of slugs), {@code
 * documents} (slug to title and excerpt) and {@code doc_terms} (slug to the tokens it was last
 * indexed under). The last one lets a re-index remove a document from postings of words it no
 * longer contains.
 *
 * <p>Reads are lock-free and may run from any thread. Writes are serialized on this instance and
 * each write operation commits before returning. MVStore locks the file, so a second process
 * cannot open the same index while this one holds it.
 */
public class SearchIndex implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.lightdocs.logging.LoggingService.getLogger(SearchIndex.class);

  static final String STORE_FILE = "index.mv.db";
  static final String POSTINGS = "postings";
  static final String DOCUMENTS = "documents";
  static final String DOC_TERMS = "doc_terms";

  private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

  private final Path location;
  private final MVStore store;
  private final MVMap<String, String> postings;
  private final MVMap<String, String> documents;
  private final MVMap<String, String> docTerms;

  private SearchIndex(Path location, MVStore store) {
    this.location = location;
    this.store = store;
    this.postings = store.openMap(POSTINGS);
    this.documents = store.openMap(DOCUMENTS);
    this.docTerms = store.openMap(DOC_TERMS);
  }

  /**
   * Open or create the index stored in {@code directory}.
   *
   * @throws IndexException if the store cannot be opened, including when another process holds it
   */
  public static SearchIndex open(Path directory) {
    try {
      Files.createDirectories(directory);
      Path file = directory.resolve(STORE_FILE);
      MVStore store = new MVStore.Builder().fileName(file.toString()).autoCommitDisabled().open();
      log.debug("Opened search index at {}", file);
      return new SearchIndex(directory, store);
    } catch (Exception e) {
      throw new IndexException("Failed to open search index at " + directory, e);
    }
  }

  /** Index (or re-index) one document and commit. */
  public synchronized void indexDocument(String slug, String title, String content) {
    try {
      put(slug, title, content);
      store.commit();
    } catch (IndexException e) {
      throw e;
    } catch (Exception e) {
      rollbackQuietly(e);
      throw new IndexException("Failed to index document '" + slug + "'", e);
    }
  }

  /**
   * Make the index mirror {@code docs}: every document is (re-)indexed and slugs that are no longer
   * present are removed everywhere. One commit for the whole pass.
   */
  public synchronized void reindex(Collection<Document> docs) {
    try {
      Set<String> live = new HashSet<>();
      for (Document doc : docs) {
        put(doc.slug(), doc.getTitle(), doc.getContent());
        live.add(doc.slug());
      }
      List<String> removed = new ArrayList<>();
      for (String slug : new ArrayList<>(documents.keySet())) {
        if (!live.contains(slug)) {
          remove(slug);
          removed.add(slug);
        }
      }
      store.commit();
      log.info("Indexed {} documents, removed {} stale entries", live.size(), removed.size());
      if (!removed.isEmpty()) log.debug("Removed from index: {}", removed);
    } catch (IndexException e) {
      throw e;
    } catch (Exception e) {
      rollbackQuietly(e);
      throw new IndexException("Failed to reindex documents", e);
    }
  }

  /**
   * Score every document that contains at least one query token. Results are ordered by score
   * descending, then by slug; a query without any usable token returns nothing.
   */
  public List<SearchResult> search(String query) {
    Set<String> tokens = Tokenizer.distinctTokens(query);
    if (tokens.isEmpty()) return List.of();

    Map<String, Integer> matches = new HashMap<>();
    try {
      for (String token : tokens) {
        for (String slug : readList(postings.get(token))) {
          matches.merge(slug, 1, Integer::sum);
        }
      }

      List<SearchResult> results = new ArrayList<>();
      for (Map.Entry<String, Integer> e : matches.entrySet()) {
        String json = documents.get(e.getKey());
        if (json == null) continue;
        DocumentEntry entry = JacksonUtility.getJsonMapper().readValue(json, DocumentEntry.class);
        double score = (double) e.getValue() / tokens.size();
        results.add(new SearchResult(e.getKey(), entry.title(), entry.excerpt(), score));
      }
      results.sort(
          Comparator.comparingDouble(SearchResult::score)
              .reversed()
              .thenComparing(SearchResult::slug));
      log.debug("Query '{}' -> {} results", query, results.size());
      return results;
    } catch (Exception e) {
      throw new IndexException("Search failed for query '" + query + "'", e);
    }
  }

  /** Remove every entry and commit. */
  public synchronized void clear() {
    try {
      postings.clear();
      documents.clear();
      docTerms.clear();
      store.commit();
      log.info("Cleared search index at {}", location);
    } catch (Exception e) {
      throw new IndexException("Failed to clear search index", e);
    }
  }

  public int documentCount() {
    return documents.size();
  }

  public Path location() {
    return location;
  }

  @Override
  public synchronized void close() {
    if (!store.isClosed()) {
      store.close();
      log.debug("Closed search index at {}", location);
    }
  }

  private void put(String slug, String title, String content) throws Exception {
    documents.put(
        slug, JacksonUtility.toJson(new DocumentEntry(title, Tokenizer.excerpt(content))));

    Set<String> terms = Tokenizer.distinctTokens(content);
    for (String old : readList(docTerms.get(slug))) {
      if (!terms.contains(old)) {
        removePosting(old, slug);
      }
    }
    for (String term : terms) {
      List<String> slugs = readList(postings.get(term));
      if (!slugs.contains(slug)) {
        slugs.add(slug);
        postings.put(term, JacksonUtility.toJson(slugs));
      }
    }
    docTerms.put(slug, JacksonUtility.toJson(new ArrayList<>(terms)));
  }

  private void remove(String slug) throws Exception {
    for (String term : readList(docTerms.get(slug))) {
      removePosting(term, slug);
    }
    docTerms.remove(slug);
    documents.remove(slug);
  }

  private void removePosting(String term, String slug) throws Exception {
    List<String> slugs = readList(postings.get(term));
    if (slugs.remove(slug)) {
      if (slugs.isEmpty()) {
        postings.remove(term);
      } else {
        postings.put(term, JacksonUtility.toJson(slugs));
      }
    }
  }

  private static List<String> readList(String json) throws Exception {
    if (json == null) return new ArrayList<>();
    return new ArrayList<>(
        new LinkedHashSet<>(JacksonUtility.getJsonMapper().readValue(json, STRING_LIST)));
  }

  private void rollbackQuietly(Exception cause) {
    try {
      store.rollback();
    } catch (Exception e) {
      // a panicked store rethrows the exception that caused the failure
      if (e != cause) cause.addSuppressed(e);
    }
  }
}
