package io.calx.engine.expr;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Unary operators. Everything except {@link #NEGATE}, {@link #PLUS} and {@link #FACTORIAL} prints
 * in function style, e.g. {@code sin(x)}, and can be looked up by that name.
 */
public enum UnaryOperator {
  NEGATE("-"),
  PLUS("+"),
  SQRT("sqrt"),
  ABS("abs"),
  SIN("sin"),
  COS("cos"),
  TAN("tan"),
  ASIN("asin"),
  ACOS("acos"),
  ATAN("atan"),
  SINH("sinh"),
  COSH("cosh"),
  TANH("tanh"),
  LN("ln"),
  LOG10("log10"),
  LOG2("log2"),
  EXP("exp"),
  FACTORIAL("!"),
  GAMMA("gamma"),
  REAL("re"),
  IMAGINARY("im"),
  CONJUGATE("conj"),
  ARGUMENT("arg");

  private static final Map<String, UnaryOperator> BY_FUNCTION_NAME = new HashMap<>();

  static {
    for (UnaryOperator op : values()) {
      if (op.isFunctionStyle()) {
        BY_FUNCTION_NAME.put(op.symbol, op);
      }
    }
    BY_FUNCTION_NAME.put("log", LN);
    BY_FUNCTION_NAME.put("arcsin", ASIN);
    BY_FUNCTION_NAME.put("arccos", ACOS);
    BY_FUNCTION_NAME.put("arctan", ATAN);
  }

  private final String symbol;

  UnaryOperator(String symbol) {
    this.symbol = symbol;
  }

  public String symbol() {
    return symbol;
  }

  public boolean isFunctionStyle() {
    return this != NEGATE && this != PLUS && this != FACTORIAL;
  }

  public boolean isTrigonometric() {
    return this == SIN || this == COS || this == TAN;
  }

  /**
   * Looks up a function-style operator by name ({@code sin}, {@code sqrt}, {@code ln}...).
   *
   * @param name the function name
   * @return the operator, or empty when the name is not a unary built-in
   */
  public static Optional<UnaryOperator> fromFunctionName(String name) {
    return Optional.ofNullable(BY_FUNCTION_NAME.get(name));
  }
}
