package com.gentoro.lightdocs.utility;

import com.gentoro.lightdocs.exception.IoException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

public class FileUtility {

  public static void deleteDir(Path dir, boolean quietly) {
    try {
      if (Files.exists(dir)) {
        try (var paths = Files.walk(dir)) {
          paths
              .sorted(Comparator.reverseOrder()) // delete children first
              .forEach(
                  path -> {
                    try {
                      Files.delete(path);
                    } catch (IOException e) {
                      throw new IoException("Failed to delete file: " + path, e);
                    }
                  });
        }
      }
    } catch (Exception e) {
      if (!quietly) {
        throw new IoException("Failed to delete directory: " + dir, e);
      }
    }
  }

  /** Write UTF-8 text, creating parent directories as needed. Overwrites an existing file. */
  public static void writeString(Path file, String content) {
    try {
      Path parent = file.toAbsolutePath().getParent();
      if (parent != null) Files.createDirectories(parent);
      Files.writeString(file, content, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IoException("Failed to write file: " + file, e);
    }
  }

  public static String readString(Path file) {
    try {
      return Files.readString(file, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IoException("Failed to read: " + file, e);
    }
  }

  /**
   * All regular files under {@code root} whose name ends with {@code .extension}, sorted by path so
   * the walk order is stable across platforms.
   */
  public static List<Path> findFiles(Path root, String extension) {
    if (!Files.isDirectory(root)) {
      throw new IoException("Directory does not exist: " + root);
    }
    String suffix = "." + extension.toLowerCase();
    try (Stream<Path> stream = Files.walk(root)) {
      return stream
          .filter(Files::isRegularFile)
          .filter(p -> p.getFileName().toString().toLowerCase().endsWith(suffix))
          .sorted()
          .collect(Collectors.toList());
    } catch (IOException | UncheckedIOException e) {
      throw new IoException("Failed to walk directory: " + root, e);
    }
  }
}
