package io.intellixity.sqlbridge.exec;

/** The two execution models unified by this library. */
public enum BackendKind {
  /** Multi-client server reached over the network; pooled, asynchronous. */
  NETWORKED,
  /** In-process single-writer engine; one handle, blocking work isolated on its own thread. */
  EMBEDDED
}
