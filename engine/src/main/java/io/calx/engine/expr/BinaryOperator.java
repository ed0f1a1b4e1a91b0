package io.calx.engine.expr;

/** Binary arithmetic operators with their display symbol and binding precedence. */
public enum BinaryOperator {
  ADD("+", 6, false),
  SUBTRACT("-", 6, false),
  MULTIPLY("*", 7, false),
  DIVIDE("/", 7, false),
  MODULO("%", 7, false),
  POWER("^", 9, true);

  private final String symbol;
  private final int precedence;
  private final boolean rightAssociative;

  BinaryOperator(String symbol, int precedence, boolean rightAssociative) {
    this.symbol = symbol;
    this.precedence = precedence;
    this.rightAssociative = rightAssociative;
  }

  public String symbol() {
    return symbol;
  }

  public int precedence() {
    return precedence;
  }

  public boolean isRightAssociative() {
    return rightAssociative;
  }

  public boolean isCommutative() {
    return this == ADD || this == MULTIPLY;
  }
}
