package io.intellixity.sqlbridge.value;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * A single decoded cell or bind parameter.\n
 *
 * Exactly five variants exist; every cell produced by any backend maps to one of them:\n
 * - {@link Null}\n
 * - {@link Int} (64-bit signed)\n
 * - {@link Real} (64-bit IEEE 754)\n
 * - {@link Text} (UTF-8 text)\n
 * - {@link Blob} (raw bytes)\n
 */
public sealed interface Value permits Value.Null, Value.Int, Value.Real, Value.Text, Value.Blob {

  Null NULL = new Null();

  static Value of(long v) { return new Int(v); }
  static Value of(double v) { return new Real(v); }
  static Value of(String v) { return v == null ? NULL : new Text(v); }
  static Value of(byte[] v) { return v == null ? NULL : new Blob(v); }

  /**
   * Lift a plain Java object into a Value. Narrow integral types widen to {@link Int},
   * {@code float} widens to {@link Real}, booleans become 0/1.
   */
  static Value ofNullable(Object o) {
    if (o == null) return NULL;
    if (o instanceof Value v) return v;
    if (o instanceof Long l) return new Int(l);
    if (o instanceof Integer i) return new Int(i);
    if (o instanceof Short s) return new Int(s);
    if (o instanceof Byte b) return new Int(b);
    if (o instanceof Double d) return new Real(d);
    if (o instanceof Float f) return new Real(f);
    if (o instanceof Boolean b) return new Int(b ? 1 : 0);
    if (o instanceof CharSequence cs) return new Text(cs.toString());
    if (o instanceof byte[] bytes) return new Blob(bytes);
    throw new IllegalArgumentException("Cannot convert " + o.getClass().getName() + " to a SQL value");
  }

  ColumnType type();

  default boolean isNull() { return this instanceof Null; }

  default long asLong() {
    if (this instanceof Int i) return i.value();
    throw new IllegalStateException("Not an integer value: " + this);
  }

  default double asDouble() {
    if (this instanceof Real r) return r.value();
    if (this instanceof Int i) return i.value();
    throw new IllegalStateException("Not a numeric value: " + this);
  }

  default String asText() {
    if (this instanceof Text t) return t.value();
    throw new IllegalStateException("Not a text value: " + this);
  }

  default byte[] asBytes() {
    if (this instanceof Blob b) return b.value();
    if (this instanceof Text t) return t.value().getBytes(StandardCharsets.UTF_8);
    throw new IllegalStateException("Not a blob value: " + this);
  }

  record Null() implements Value {
    @Override public ColumnType type() { return ColumnType.NULL; }
    @Override public String toString() { return "NULL"; }
  }

  record Int(long value) implements Value {
    @Override public ColumnType type() { return ColumnType.INTEGER; }
    @Override public String toString() { return Long.toString(value); }
  }

  record Real(double value) implements Value {
    @Override public ColumnType type() { return ColumnType.REAL; }
    @Override public String toString() { return Double.toString(value); }
  }

  record Text(String value) implements Value {
    public Text {
      Objects.requireNonNull(value, "value");
    }

    @Override public ColumnType type() { return ColumnType.TEXT; }
    @Override public String toString() { return "'" + value + "'"; }
  }

  /** Byte content is copied in and out; equality is content equality. */
  record Blob(byte[] value) implements Value {
    public Blob {
      Objects.requireNonNull(value, "value");
      value = value.clone();
    }

    @Override public byte[] value() { return value.clone(); }

    public int length() { return value.length; }

    @Override public ColumnType type() { return ColumnType.BLOB; }

    @Override
    public boolean equals(Object o) {
      return o instanceof Blob b && Arrays.equals(value, b.value);
    }

    @Override
    public int hashCode() { return Arrays.hashCode(value); }

    @Override
    public String toString() { return "Blob[len=" + value.length + "]"; }
  }
}
