package io.intellixity.sqlbridge.spi.backend;

import io.intellixity.sqlbridge.error.FailureClass;

import java.sql.SQLException;

/** Maps a backend-native failure onto the shared {@link FailureClass} taxonomy. */
@FunctionalInterface
public interface ErrorClassifier {
  FailureClass classify(SQLException e);
}
