package com.gentoro.lightdocs.watch;

import com.gentoro.lightdocs.exception.ErrorDetails;
import java.time.Duration;

/**
 * Outcome of one rebuild cycle.
 *
 * @param sequence 1-based rebuild counter for the coordinator's lifetime
 * @param coalescedEvents number of change events folded into this rebuild
 * @param documentCount documents returned by the build, 0 on failure
 * @param error failure details, {@code null} on success
 */
public record RebuildEvent(
    long sequence,
    int coalescedEvents,
    int documentCount,
    Duration duration,
    ErrorDetails error) {

  public boolean succeeded() {
    return error == null;
  }
}
