package com.gentoro.lightdocs.watch;

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_DELETE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_MODIFY;
import static java.nio.file.StandardWatchEventKinds.OVERFLOW;

import com.gentoro.lightdocs.exception.IoException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Recursive directory watch on top of {@link WatchService}. Directories created after start are
 * registered as they appear. Every notification is forwarded to the sink as a {@link ChangeEvent};
 * the sink is normally {@link RebuildCoordinator#submit(ChangeEvent)}.
 */
public class DirectoryWatcher implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.lightdocs.logging.LoggingService.getLogger(DirectoryWatcher.class);

  private final Path root;
  private final Consumer<ChangeEvent> sink;
  private final Map<WatchKey, Path> directories = new ConcurrentHashMap<>();
  private WatchService watchService;
  private Thread thread;

  public DirectoryWatcher(Path root, Consumer<ChangeEvent> sink) {
    this.root = Objects.requireNonNull(root, "root");
    this.sink = Objects.requireNonNull(sink, "sink");
  }

  public synchronized void start() {
    if (thread != null) {
      throw new IllegalStateException("Watcher already started for " + root);
    }
    try {
      watchService = root.getFileSystem().newWatchService();
      registerTree(root);
    } catch (IOException | UncheckedIOException e) {
      closeWatchService();
      throw new IoException("Failed to watch " + root, e);
    }
    thread = new Thread(this::pollLoop, "lightdocs-watch");
    thread.setDaemon(true);
    thread.start();
    log.info("Watching for changes in: {}", root);
  }

  @Override
  public synchronized void close() {
    if (thread == null) return;
    closeWatchService();
    thread.interrupt();
    thread = null;
  }

  private void closeWatchService() {
    if (watchService == null) return;
    try {
      watchService.close();
    } catch (IOException e) {
      log.warn("Failed to close watch service for {}", root, e);
    }
  }

  private void registerTree(Path start) throws IOException {
    try (Stream<Path> dirs = Files.walk(start)) {
      for (Path dir : (Iterable<Path>) dirs.filter(Files::isDirectory)::iterator) {
        WatchKey key = dir.register(watchService, ENTRY_CREATE, ENTRY_MODIFY, ENTRY_DELETE);
        directories.put(key, dir);
      }
    }
  }

  private void pollLoop() {
    try {
      while (true) {
        WatchKey key = watchService.take();
        Path dir = directories.get(key);
        for (WatchEvent<?> event : key.pollEvents()) {
          dispatch(dir, event);
        }
        if (!key.reset()) {
          directories.remove(key);
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } catch (ClosedWatchServiceException e) {
      log.debug("Watch service for {} closed", root);
    }
  }

  private void dispatch(Path dir, WatchEvent<?> event) {
    WatchEvent.Kind<?> kind = event.kind();
    if (kind == OVERFLOW || dir == null) {
      sink.accept(ChangeEvent.other(dir == null ? root : dir));
      return;
    }
    Path child = dir.resolve((Path) event.context());
    if (kind == ENTRY_CREATE) {
      if (Files.isDirectory(child)) {
        try {
          registerTree(child);
        } catch (IOException | UncheckedIOException e) {
          log.warn("Could not watch new directory {}", child, e);
        }
      }
      sink.accept(ChangeEvent.created(child));
    } else if (kind == ENTRY_MODIFY) {
      sink.accept(ChangeEvent.modified(child));
    } else if (kind == ENTRY_DELETE) {
      sink.accept(ChangeEvent.deleted(child));
    }
  }
}
