/*
 * Copyright 2026 Yellowbrick Data, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.floedb.snapcat.types;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed-width scalar kinds that map one-to-one onto a columnar scalar type.
 *
 * <p>Unsigned kinds carry their value in the next wider (or same width, for {@link #U64}) signed
 * Java type: {@code U32} values are {@link Long}s in {@code [0, 2^32)}, {@code U64} values are
 * {@link Long}s holding the unsigned bit pattern. {@link #ENTITY} is a reference to another entity
 * and is carried as the entity's 64-bit id; it accepts a raw {@code long} or any {@link
 * EntityReference}.
 *
 * <p>Coercion never narrows: integral kinds reject fractional values and values outside their
 * range, and {@link #F32} rejects finite values beyond the float range.
 */
public enum ScalarKind {
  F32,
  F64,
  I32,
  I64,
  U32,
  U64,
  BOOL,
  ENTITY;

  private static final Map<String, ScalarKind> ALIASES;

  static {
    Map<String, ScalarKind> m = new HashMap<>();

    m.put("f32", F32);
    m.put("float", F32);
    m.put("java.lang.float", F32);

    m.put("f64", F64);
    m.put("double", F64);
    m.put("java.lang.double", F64);

    m.put("i32", I32);
    m.put("int", I32);
    m.put("java.lang.integer", I32);

    m.put("i64", I64);
    m.put("long", I64);
    m.put("java.lang.long", I64);

    m.put("u32", U32);
    m.put("u64", U64);

    m.put("bool", BOOL);
    m.put("boolean", BOOL);
    m.put("java.lang.boolean", BOOL);

    m.put("entity", ENTITY);

    ALIASES = Map.copyOf(m);
  }

  /**
   * Resolves a scalar type path ({@code "f32"}, {@code "java.lang.Long"}, {@code "u64"}, ...).
   *
   * <p>Lookup is case-insensitive. Unknown paths (strings, decimals, user value types) return
   * empty; callers treat those as opaque values.
   */
  public static Optional<ScalarKind> fromTypePath(String typePath) {
    if (typePath == null) {
      return Optional.empty();
    }
    String normalized = typePath.trim().toLowerCase(Locale.ROOT);
    return Optional.ofNullable(ALIASES.get(normalized));
  }

  /** Canonical type path, as used in generated descriptors. */
  public String typePath() {
    return name().toLowerCase(Locale.ROOT);
  }

  public boolean isFloatingPoint() {
    return this == F32 || this == F64;
  }

  public boolean isUnsigned() {
    return this == U32 || this == U64 || this == ENTITY;
  }

  /** Same kind with unsigned representation, for {@code i32} and {@code i64}; others unchanged. */
  public ScalarKind toUnsigned() {
    return switch (this) {
      case I32 -> U32;
      case I64 -> U64;
      default -> this;
    };
  }

  /**
   * Coerces a boxed Java value into the canonical carrier for this kind.
   *
   * @throws ReflectionException if the value is not a number (or boolean for {@link #BOOL}, or
   *     entity reference for {@link #ENTITY}) or does not fit this kind without loss
   */
  public Object coerce(Object value) {
    if (this == BOOL) {
      if (value instanceof Boolean b) {
        return b;
      }
      throw new ReflectionException(
          "expected boolean for " + typePath() + ", got " + describe(value));
    }
    if (this == ENTITY && value instanceof EntityReference ref) {
      return Long.valueOf(ref.bits());
    }
    if (!(value instanceof Number n)) {
      throw new ReflectionException(
          "expected number for " + typePath() + ", got " + describe(value));
    }
    if (isFloatingPoint()) {
      double d = n.doubleValue();
      if (this == F64) {
        return Double.valueOf(d);
      }
      if (Double.isFinite(d) && Math.abs(d) > Float.MAX_VALUE) {
        throw new ReflectionException("f32 value out of range: " + d);
      }
      return Float.valueOf((float) d);
    }
    if (this == U64 && n instanceof BigInteger big && big.signum() >= 0 && big.bitLength() <= 64) {
      return Long.valueOf(big.longValue());
    }
    long v = integral(n);
    return switch (this) {
      case I32 -> {
        if (v < Integer.MIN_VALUE || v > Integer.MAX_VALUE) {
          throw new ReflectionException("i32 value out of range: " + v);
        }
        yield Integer.valueOf((int) v);
      }
      case U32 -> {
        if (v < 0 || v > 0xFFFF_FFFFL) {
          throw new ReflectionException("u32 value out of range: " + v);
        }
        yield Long.valueOf(v);
      }
      default -> Long.valueOf(v);
    };
  }

  private long integral(Number n) {
    if (n instanceof Byte || n instanceof Short || n instanceof Integer || n instanceof Long) {
      return n.longValue();
    }
    try {
      if (n instanceof BigInteger big) {
        return big.longValueExact();
      }
      if (n instanceof BigDecimal dec) {
        return dec.longValueExact();
      }
    } catch (ArithmeticException e) {
      throw new ReflectionException(typePath() + " value does not fit 64 bits: " + n, e);
    }
    double d = n.doubleValue();
    if (!Double.isFinite(d) || d != Math.rint(d) || d < -0x1p63 || d >= 0x1p63) {
      throw new ReflectionException("expected an integral value for " + typePath() + ", got " + n);
    }
    return (long) d;
  }

  private static String describe(Object value) {
    return value == null ? "null" : value.getClass().getName();
  }
}
