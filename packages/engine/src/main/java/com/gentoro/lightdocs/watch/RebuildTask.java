package com.gentoro.lightdocs.watch;

import com.gentoro.lightdocs.document.Document;
import java.util.List;

/** One full build followed by a re-index. Runs on the coordinator thread. */
@FunctionalInterface
public interface RebuildTask {
  List<Document> rebuild();
}
