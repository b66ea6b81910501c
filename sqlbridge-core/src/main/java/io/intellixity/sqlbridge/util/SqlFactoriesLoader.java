package io.intellixity.sqlbridge.util;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.*;
import java.util.function.Function;

/**
 * Discovers plug-in implementations registered in {@code META-INF/sqlbridge.factories}.\n
 *
 * Every resource with that name on the classpath is read as a Java Properties file keyed by the
 * plug-in interface name; the value is a comma-separated list of implementation classes:\n
 *
 * <pre>
 * io.intellixity.sqlbridge.spi.backend.BackendProvider=\
 *   io.intellixity.sqlbridge.jdbc.sqlite.SqliteBackendProvider
 * </pre>
 *
 * A class listed by several jars is instantiated once. {@link #loadById} additionally indexes the
 * instances by a case-insensitive id and refuses two implementations claiming the same id.\n
 */
public final class SqlFactoriesLoader {
  public static final String RESOURCE = "META-INF/sqlbridge.factories";

  private SqlFactoriesLoader() {}

  public static <T> List<T> load(Class<T> spiType) {
    return load(spiType, Thread.currentThread().getContextClassLoader());
  }

  public static <T> List<T> load(Class<T> spiType, ClassLoader cl) {
    Objects.requireNonNull(spiType, "spiType");
    ClassLoader loader = (cl != null) ? cl : SqlFactoriesLoader.class.getClassLoader();
    List<T> out = new ArrayList<>();
    for (Registration r : registrations(spiType, loader)) {
      out.add(r.instantiate(spiType, loader));
    }
    return out;
  }

  public static <T> Map<String, T> loadById(Class<T> spiType, Function<? super T, String> id) {
    return loadById(spiType, id, Thread.currentThread().getContextClassLoader());
  }

  /**
   * Instances keyed by {@code id} lower-cased, in registration order.\n
   *
   * @throws IllegalStateException if an id is blank or two implementations share one
   */
  public static <T> Map<String, T> loadById(Class<T> spiType, Function<? super T, String> id, ClassLoader cl) {
    Objects.requireNonNull(id, "id");
    Map<String, T> byId = new LinkedHashMap<>();
    for (T impl : load(spiType, cl)) {
      String raw = id.apply(impl);
      if (raw == null || raw.isBlank()) {
        throw new IllegalStateException(impl.getClass().getName() + " registered for " + spiType.getName()
            + " has no id");
      }
      String key = raw.trim().toLowerCase(Locale.ROOT);
      T clash = byId.putIfAbsent(key, impl);
      if (clash != null) {
        throw new IllegalStateException("Duplicate " + spiType.getSimpleName() + " id '" + key + "': "
            + clash.getClass().getName() + " and " + impl.getClass().getName());
      }
    }
    return byId;
  }

  private static List<Registration> registrations(Class<?> spiType, ClassLoader loader) {
    Enumeration<URL> resources;
    try {
      resources = loader.getResources(RESOURCE);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to enumerate " + RESOURCE, e);
    }
    Map<String, Registration> byClass = new LinkedHashMap<>();
    for (URL url : Collections.list(resources)) {
      String listed = read(url).getProperty(spiType.getName(), "");
      for (String part : listed.split(",")) {
        String className = part.trim();
        if (!className.isEmpty()) byClass.putIfAbsent(className, new Registration(className, url));
      }
    }
    return new ArrayList<>(byClass.values());
  }

  private static Properties read(URL url) {
    Properties p = new Properties();
    try (InputStream in = url.openStream()) {
      p.load(in);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to read " + url, e);
    }
    return p;
  }

  private record Registration(String className, URL source) {
    <T> T instantiate(Class<T> spiType, ClassLoader loader) {
      Class<?> raw;
      try {
        raw = Class.forName(className, true, loader);
      } catch (ClassNotFoundException e) {
        throw new IllegalStateException(className + " listed in " + source + " is not on the classpath", e);
      }
      if (!spiType.isAssignableFrom(raw)) {
        throw new IllegalStateException(className + " listed in " + source + " does not implement "
            + spiType.getName());
      }
      try {
        return spiType.cast(raw.getDeclaredConstructor().newInstance());
      } catch (ReflectiveOperationException e) {
        throw new IllegalStateException("Failed to instantiate " + className + " listed in " + source, e);
      }
    }
  }
}
