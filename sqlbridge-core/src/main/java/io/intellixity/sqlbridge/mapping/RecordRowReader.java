package io.intellixity.sqlbridge.mapping;

import io.intellixity.sqlbridge.error.MappingException;
import io.intellixity.sqlbridge.result.Row;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.RecordComponent;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reflective positional reader for Java records.\n
 *
 * Record component {@code i} is bound to result column {@code i}; the SELECT list must follow
 * component declaration order. Column names are ignored.\n
 */
public final class RecordRowReader<R extends Record> implements RowReader<R> {
  private static final Map<Class<?>, RecordRowReader<?>> CACHE = new ConcurrentHashMap<>();

  private final Class<R> type;
  private final Class<?>[] componentTypes;
  private final Constructor<R> ctor;

  private RecordRowReader(Class<R> type) {
    this.type = type;
    RecordComponent[] rc = type.getRecordComponents();
    this.componentTypes = new Class<?>[rc.length];
    for (int i = 0; i < rc.length; i++) componentTypes[i] = rc[i].getType();
    try {
      this.ctor = type.getDeclaredConstructor(componentTypes);
      this.ctor.setAccessible(true);
    } catch (NoSuchMethodException e) {
      throw new IllegalArgumentException("No canonical constructor on " + type.getName(), e);
    }
  }

  @SuppressWarnings("unchecked")
  public static <R extends Record> RecordRowReader<R> of(Class<R> type) {
    Objects.requireNonNull(type, "type");
    if (!type.isRecord()) throw new IllegalArgumentException(type.getName() + " is not a record");
    return (RecordRowReader<R>) CACHE.computeIfAbsent(type, t -> new RecordRowReader<>(type));
  }

  public Class<R> type() { return type; }
  public int arity() { return componentTypes.length; }

  @Override
  public R read(Row row) {
    int n = componentTypes.length;
    if (row.arity() != n) {
      throw new MappingException(Math.min(row.arity(), n),
          type.getSimpleName() + " has " + n + " components but row has " + row.arity() + " columns");
    }
    Object[] args = new Object[n];
    for (int i = 0; i < n; i++) {
      args[i] = ValueConversions.convert(row.get(i), componentTypes[i], i);
    }
    try {
      return ctor.newInstance(args);
    } catch (InvocationTargetException e) {
      // compact constructor validation spans the whole row
      throw new MappingException(-1, "constructor of " + type.getSimpleName() + " rejected row", e.getCause());
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Cannot instantiate " + type.getName(), e);
    }
  }
}
