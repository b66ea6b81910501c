package io.intellixity.sqlbridge.config;

/** Where a backend lives: a network address or a local file. */
public sealed interface BackendTarget permits NetworkTarget, FileTarget {
  /** Human-readable description without credentials. */
  String describe();
}
