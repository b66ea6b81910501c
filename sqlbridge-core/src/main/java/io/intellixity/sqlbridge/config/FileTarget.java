package io.intellixity.sqlbridge.config;

import java.nio.file.Path;
import java.util.UUID;

/**
 * Location of an embedded database.\n
 *
 * In-memory targets carry a unique name so that every handle opened for the same target sees the
 * same database.\n
 */
public record FileTarget(Path path, String memoryName) implements BackendTarget {
  public FileTarget {
    if ((path == null) == (memoryName == null)) {
      throw new IllegalArgumentException("exactly one of path or memoryName must be set");
    }
  }

  public static FileTarget of(Path path) {
    return new FileTarget(path, null);
  }

  public static FileTarget inMemory() {
    return new FileTarget(null, "mem-" + UUID.randomUUID());
  }

  public static FileTarget inMemory(String name) {
    return new FileTarget(null, name);
  }

  public boolean isInMemory() {
    return memoryName != null;
  }

  @Override
  public String describe() {
    return isInMemory() ? ":memory:" + memoryName : path.toString();
  }
}
