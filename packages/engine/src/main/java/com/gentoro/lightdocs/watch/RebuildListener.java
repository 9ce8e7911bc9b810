package com.gentoro.lightdocs.watch;

/** Receives the outcome of every rebuild, on the coordinator thread. */
@FunctionalInterface
public interface RebuildListener {
  RebuildListener NONE = event -> {};

  void onRebuild(RebuildEvent event);
}
