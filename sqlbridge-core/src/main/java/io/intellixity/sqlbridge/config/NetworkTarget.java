package io.intellixity.sqlbridge.config;

import java.util.Map;
import java.util.Objects;

/** Server address and credentials for a networked backend. */
public record NetworkTarget(String host,
                            int port,
                            String database,
                            String user,
                            String password,
                            Map<String, String> properties) implements BackendTarget {
  public NetworkTarget {
    Objects.requireNonNull(host, "host");
    if (host.isBlank()) throw new IllegalArgumentException("host is blank");
    if (port <= 0 || port > 65535) throw new IllegalArgumentException("port out of range: " + port);
    properties = (properties == null) ? Map.of() : Map.copyOf(properties);
  }

  public NetworkTarget(String host, int port, String database, String user, String password) {
    this(host, port, database, user, password, Map.of());
  }

  @Override
  public String describe() {
    return host + ":" + port + (database == null ? "" : "/" + database);
  }

  @Override
  public String toString() {
    return "NetworkTarget[" + (user == null ? "" : user + "@") + describe() + ", properties=" + properties.keySet() + "]";
  }
}
