package com.gentoro.lightdocs.watch;

import com.gentoro.lightdocs.document.Document;
import com.gentoro.lightdocs.exception.ErrorDetails;
import com.gentoro.lightdocs.exception.ExceptionUtil;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Debounced rebuild loop.
 *
 * <p>Owns one daemon thread for its whole lifetime. Change events arrive through {@link
 * #submit(ChangeEvent)}; rebuild outcomes leave through the {@link RebuildListener}. The thread
 * waits for a relevant event, sleeps for the debounce window, drains whatever else queued up in the
 * meantime, and runs the {@link RebuildTask} synchronously. Events submitted while a rebuild runs
 * stay queued and start the next window, so rebuilds never overlap and no change is lost.
 *
 * <p>A failing rebuild is logged and reported; the loop keeps running until {@link #stop()}. The
 * thread is never interrupted; NIO channels used by the build and the search index close on
 * interrupt.
 */
public class RebuildCoordinator implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.lightdocs.logging.LoggingService.getLogger(RebuildCoordinator.class);

  public enum State {
    IDLE,
    REBUILDING
  }

  private final RebuildTask task;
  private final RebuildListener listener;
  private final Duration debounce;
  private final BlockingQueue<ChangeEvent> inbox = new LinkedBlockingQueue<>();
  private final AtomicLong rebuilds = new AtomicLong();
  private final CountDownLatch stopSignal = new CountDownLatch(1);
  // wakes a loop blocked in take(); compared by identity
  private final ChangeEvent stopMarker = ChangeEvent.other(Path.of(""));
  private volatile boolean running = true;
  private volatile State state = State.IDLE;
  private volatile Thread thread;

  public RebuildCoordinator(RebuildTask task, RebuildListener listener, Duration debounce) {
    this.task = Objects.requireNonNull(task, "task");
    this.listener = listener == null ? RebuildListener.NONE : listener;
    this.debounce = Objects.requireNonNull(debounce, "debounce");
  }

  public synchronized void start() {
    if (thread != null) {
      throw new IllegalStateException("Rebuild coordinator already started");
    }
    Thread t = new Thread(this::runLoop, "lightdocs-rebuild");
    t.setDaemon(true);
    thread = t;
    t.start();
    log.debug("Rebuild coordinator started (debounce {} ms)", debounce.toMillis());
  }

  /** Queue a change notification. Safe to call from any thread. */
  public void submit(ChangeEvent event) {
    inbox.offer(Objects.requireNonNull(event, "event"));
  }

  public State state() {
    return state;
  }

  public long rebuildCount() {
    return rebuilds.get();
  }

  public boolean isRunning() {
    Thread t = thread;
    return t != null && t.isAlive();
  }

  /**
   * Ask the loop to exit and wait for it. A rebuild in progress runs to completion; a pending
   * debounce window is abandoned without rebuilding.
   */
  public synchronized void stop() {
    Thread t = thread;
    if (t == null || !running) return;
    running = false;
    stopSignal.countDown();
    inbox.offer(stopMarker);
    try {
      t.join(5_000);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    log.debug("Rebuild coordinator stopped after {} rebuilds", rebuilds.get());
  }

  @Override
  public void close() {
    stop();
  }

  private void runLoop() {
    try {
      while (running) {
        ChangeEvent first = inbox.take();
        if (first == stopMarker) break;
        if (!first.isRelevant()) {
          log.trace("Ignoring {}", first);
          continue;
        }
        if (stopSignal.await(debounce.toMillis(), TimeUnit.MILLISECONDS)) break;
        List<ChangeEvent> burst = new ArrayList<>();
        burst.add(first);
        inbox.drainTo(burst);
        if (!running) break;
        rebuild(burst);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private void rebuild(List<ChangeEvent> burst) {
    long sequence = rebuilds.incrementAndGet();
    state = State.REBUILDING;
    long start = System.nanoTime();
    RebuildEvent event;
    log.info("Change detected ({} events, first: {}), rebuilding...", burst.size(), burst.get(0).path());
    try {
      List<Document> docs = task.rebuild();
      Duration took = Duration.ofNanos(System.nanoTime() - start);
      event = new RebuildEvent(sequence, burst.size(), docs == null ? 0 : docs.size(), took, null);
      log.info("Rebuild #{} finished in {} ms", sequence, took.toMillis());
    } catch (Exception e) {
      Duration took = Duration.ofNanos(System.nanoTime() - start);
      ErrorDetails details = ExceptionUtil.toErrorDetails(e);
      event = new RebuildEvent(sequence, burst.size(), 0, took, details);
      log.error(
          "Rebuild #{} failed: {} at {}",
          sequence,
          details,
          ExceptionUtil.formatCompactStackTrace(e));
    } finally {
      state = State.IDLE;
    }
    try {
      listener.onRebuild(event);
    } catch (Exception e) {
      log.warn("Rebuild listener failed for rebuild #{}", sequence, e);
    }
  }
}
