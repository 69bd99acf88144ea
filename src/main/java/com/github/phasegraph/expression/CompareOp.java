package com.github.phasegraph.expression;

/**
 * Comparison operators, non-chaining, at most one per subexpression.
 */
public enum CompareOp {
  EQ("=="), NE("!="), LT("<"), LE("<="), GT(">"), GE(">=");

  private final String symbol;

  private CompareOp(final String symbol) {
    this.symbol = symbol;
  }

  public String getSymbol() {
    return symbol;
  }

  public boolean isOrdering() {
    return this != EQ && this != NE;
  }

  /**
   * Returns null when the symbol is not a comparison operator.
   */
  static CompareOp fromSymbol(final String symbol) {
    for (final CompareOp op : values()) {
      if (op.symbol.equals(symbol)) {
        return op;
      }
    }
    return null;
  }
}
