package io.intellixity.sqlbridge.mapping;

import io.intellixity.sqlbridge.error.MappingException;
import io.intellixity.sqlbridge.value.Value;

/**
 * Value to Java field conversion used by the stock readers.\n
 *
 * Conversions never truncate: narrowing integers are range-checked, a number that a floating-point
 * target cannot hold exactly is rejected, and a mismatched variant fails.\n
 */
final class ValueConversions {
  private ValueConversions() {}

  @SuppressWarnings("unchecked")
  static <T> T convert(Value v, Class<T> target, int index) {
    if (target == Value.class) return (T) v;

    if (v.isNull()) {
      if (target.isPrimitive()) {
        throw new MappingException(index, "NULL cannot be assigned to primitive " + target.getName());
      }
      return null;
    }

    if (target == long.class || target == Long.class) return (T) (Long) requireInt(v, target, index);
    if (target == int.class || target == Integer.class) {
      long l = requireInt(v, target, index);
      if (l < Integer.MIN_VALUE || l > Integer.MAX_VALUE) throw outOfRange(l, target, index);
      return (T) (Integer) (int) l;
    }
    if (target == short.class || target == Short.class) {
      long l = requireInt(v, target, index);
      if (l < Short.MIN_VALUE || l > Short.MAX_VALUE) throw outOfRange(l, target, index);
      return (T) (Short) (short) l;
    }
    if (target == double.class || target == Double.class) {
      if (v instanceof Value.Real r) return (T) (Double) r.value();
      long l = requireInt(v, target, index);
      double d = l;
      // 2^63 saturates back to Long.MAX_VALUE
      if (d == 0x1p63 || (long) d != l) throw inexact(Long.toString(l), target, index);
      return (T) (Double) d;
    }
    if (target == float.class || target == Float.class) {
      if (v instanceof Value.Real r) {
        float f = (float) r.value();
        if ((double) f != r.value() && !Double.isNaN(r.value())) throw inexact(Double.toString(r.value()), target, index);
        return (T) (Float) f;
      }
      long l = requireInt(v, target, index);
      float f = l;
      if (f == 0x1p63f || (long) f != l) throw inexact(Long.toString(l), target, index);
      return (T) (Float) f;
    }
    if (target == boolean.class || target == Boolean.class) {
      long l = requireInt(v, target, index);
      if (l != 0 && l != 1) throw new MappingException(index, "integer " + l + " is not a boolean (0/1)");
      return (T) Boolean.valueOf(l == 1);
    }
    if (target == String.class) {
      if (v instanceof Value.Text t) return (T) t.value();
      throw mismatch(v, target, index);
    }
    if (target == byte[].class) {
      if (v instanceof Value.Blob b) return (T) b.value();
      throw mismatch(v, target, index);
    }
    throw new MappingException(index, "unsupported target type " + target.getName());
  }

  private static long requireInt(Value v, Class<?> target, int index) {
    if (v instanceof Value.Int i) return i.value();
    throw mismatch(v, target, index);
  }

  private static MappingException mismatch(Value v, Class<?> target, int index) {
    return new MappingException(index, v.type() + " value cannot be assigned to " + target.getName());
  }

  private static MappingException inexact(String number, Class<?> target, int index) {
    return new MappingException(index, number + " is not exactly representable as " + target.getName());
  }

  private static MappingException outOfRange(long l, Class<?> target, int index) {
    return new MappingException(index, "integer " + l + " out of range for " + target.getName());
  }
}
