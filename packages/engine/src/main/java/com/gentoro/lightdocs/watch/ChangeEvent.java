package com.gentoro.lightdocs.watch;

import java.nio.file.Path;

/** A filesystem notification delivered to the {@link RebuildCoordinator} inbox. */
public record ChangeEvent(Kind kind, Path path) {

  public enum Kind {
    CREATED,
    MODIFIED,
    DELETED,
    /** Anything else, e.g. an overflow notice; never triggers a rebuild. */
    OTHER
  }

  public boolean isRelevant() {
    return kind != Kind.OTHER;
  }

  public static ChangeEvent created(Path path) {
    return new ChangeEvent(Kind.CREATED, path);
  }

  public static ChangeEvent modified(Path path) {
    return new ChangeEvent(Kind.MODIFIED, path);
  }

  public static ChangeEvent deleted(Path path) {
    return new ChangeEvent(Kind.DELETED, path);
  }

  public static ChangeEvent other(Path path) {
    return new ChangeEvent(Kind.OTHER, path);
  }
}
