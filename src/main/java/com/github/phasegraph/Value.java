package com.github.phasegraph;

/**
 * Immutable scalar held in node params, vars, properties and edge actions. A value is exactly one
 * of a 64-bit integer, a double, a boolean or a string. There is no implicit promotion between
 * the variants other than {@link #toDouble()} for the two numeric ones.
 */
public final class Value {
  private final Type type;
  private final long longValue;
  private final double doubleValue;
  private final boolean booleanValue;
  private final String stringValue;

  public static Value of(final long value) {
    return new Value(Type.INT64, value, 0.0, false, null);
  }

  public static Value of(final double value) {
    return new Value(Type.FLOAT64, 0L, value, false, null);
  }

  public static Value of(final boolean value) {
    return new Value(Type.BOOL, 0L, 0.0, value, null);
  }

  public static Value of(final String value) {
    if (value == null) {
      throw new IllegalArgumentException("String value cannot be null");
    }
    return new Value(Type.STRING, 0L, 0.0, false, value);
  }

  public Type getType() {
    return type;
  }

  public boolean isNumeric() {
    return type == Type.INT64 || type == Type.FLOAT64;
  }

  /**
   * Numeric promotion used by comparisons: INT64 and FLOAT64 both widen to double.
   */
  public double toDouble() {
    switch (type) {
      case INT64:
        return (double) longValue;
      case FLOAT64:
        return doubleValue;
      default:
        throw new IllegalStateException("Value is not numeric: " + this);
    }
  }

  public long asLong() {
    expect(Type.INT64);
    return longValue;
  }

  public double asDouble() {
    expect(Type.FLOAT64);
    return doubleValue;
  }

  public boolean asBoolean() {
    expect(Type.BOOL);
    return booleanValue;
  }

  public String asString() {
    expect(Type.STRING);
    return stringValue;
  }

  /**
   * Truthiness in boolean context: BOOL is itself, numbers are true when nonzero and strings are
   * true when nonempty.
   */
  public boolean isTruthy() {
    switch (type) {
      case BOOL:
        return booleanValue;
      case INT64:
        return longValue != 0L;
      case FLOAT64:
        return doubleValue != 0.0;
      case STRING:
        return !stringValue.isEmpty();
      default:
        return false;
    }
  }

  private void expect(final Type expected) {
    if (type != expected) {
      throw new IllegalStateException("Value " + this + " is not of type " + expected);
    }
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + type.hashCode();
    result = prime * result + Long.hashCode(longValue);
    result = prime * result + Double.hashCode(doubleValue);
    result = prime * result + (booleanValue ? 1231 : 1237);
    result = prime * result + ((stringValue == null) ? 0 : stringValue.hashCode());
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null) {
      return false;
    }
    if (getClass() != obj.getClass()) {
      return false;
    }
    Value other = (Value) obj;
    if (type != other.type) {
      return false;
    }
    switch (type) {
      case INT64:
        return longValue == other.longValue;
      case FLOAT64:
        return Double.compare(doubleValue, other.doubleValue) == 0;
      case BOOL:
        return booleanValue == other.booleanValue;
      default:
        return stringValue.equals(other.stringValue);
    }
  }

  @Override
  public String toString() {
    switch (type) {
      case INT64:
        return Long.toString(longValue);
      case FLOAT64:
        return Double.toString(doubleValue);
      case BOOL:
        return booleanValue ? "true" : "false";
      default:
        return "\"" + stringValue + "\"";
    }
  }

  public static enum Type {
    INT64, FLOAT64, BOOL, STRING
  }

  private Value(final Type type, final long longValue, final double doubleValue,
      final boolean booleanValue, final String stringValue) {
    this.type = type;
    this.longValue = longValue;
    this.doubleValue = doubleValue;
    this.booleanValue = booleanValue;
    this.stringValue = stringValue;
  }
}
