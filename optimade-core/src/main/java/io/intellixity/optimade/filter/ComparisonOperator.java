package io.intellixity.optimade.filter;

public enum ComparisonOperator {
  EQ("="),
  NE("!="),
  LT("<"),
  LE("<="),
  GT(">"),
  GE(">=");

  private final String symbol;

  ComparisonOperator(String symbol) {
    this.symbol = symbol;
  }

  public String symbol() { return symbol; }

  /** Operator to use when the operands are swapped ({@code 1 < a} becomes {@code a > 1}). */
  public ComparisonOperator mirrored() {
    return switch (this) {
      case LT -> GT;
      case LE -> GE;
      case GT -> LT;
      case GE -> LE;
      default -> this;
    };
  }

  public static ComparisonOperator fromSymbol(String symbol) {
    for (ComparisonOperator op : values()) {
      if (op.symbol.equals(symbol)) return op;
    }
    throw new IllegalArgumentException("Unknown comparison operator: " + symbol);
  }
}
