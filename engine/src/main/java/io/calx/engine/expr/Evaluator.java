package io.calx.engine.expr;

import io.calx.numeric.Arithmetic;
import io.calx.numeric.ComplexValue;
import io.calx.numeric.ComputeException;
import io.calx.numeric.IntegerValue;
import io.calx.numeric.NumberValue;
import io.calx.numeric.SymbolicValue;
import java.math.BigInteger;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Evaluates expressions to numbers under a set of variable bindings.
 *
 * <p>{@link #evaluate} stays exact: results that have no exact closed form come back as {@link
 * SymbolicValue} with reason {@link SymbolicValue.Reason#UNEVALUATED}, and division by zero
 * follows the numeric tower (symbolic, not an error). {@link #approximate} computes a double.
 *
 * <p>Errors:
 *
 * <ul>
 *   <li>a free variable without binding raises {@code UNDEFINED_VARIABLE};
 *   <li>modulo by zero raises {@code DIVISION_BY_ZERO}, as does any division by zero when
 *       approximating;
 *   <li>negative factorials, logarithms of zero and, unless complex results are allowed, square
 *       roots of negative numbers raise {@code DOMAIN_ERROR};
 *   <li>an approximation that overflows from finite inputs raises {@code OVERFLOW}.
 * </ul>
 */
public final class Evaluator {
  /** Factorials above this bound stay symbolic. */
  static final int MAX_FACTORIAL = 1000;

  private final boolean allowComplexResults;

  public Evaluator() {
    this(false);
  }

  /**
   * @param allowComplexResults whether the square root of a negative number evaluates to an
   *     imaginary value instead of raising a domain error
   */
  public Evaluator(boolean allowComplexResults) {
    this.allowComplexResults = allowComplexResults;
  }

  public boolean allowsComplexResults() {
    return allowComplexResults;
  }

  public NumberValue evaluate(Expression expression) {
    return evaluate(expression, Collections.emptyMap());
  }

  public NumberValue evaluate(Expression expression, Map<String, ? extends NumberValue> bindings) {
    return Expressions.<NumberValue>fold(
        expression, (node, args) -> evaluateNode(node, args, bindings));
  }

  private NumberValue evaluateNode(
      Expression node, List<NumberValue> args, Map<String, ? extends NumberValue> bindings) {
    switch (node.kind()) {
      case NUMBER:
        return ((Expression.NumberLiteral) node).value();
      case VARIABLE:
        {
          String name = ((Expression.Variable) node).name();
          NumberValue value = bindings.get(name);
          if (value == null) {
            throw ComputeException.undefinedVariable(name);
          }
          return value;
        }
      case CONSTANT:
        {
          MathConstant constant = ((Expression.Constant) node).constant();
          if (constant == MathConstant.I) {
            return NumberValue.imaginaryUnit();
          }
          return unevaluated(constant.symbol());
        }
      case UNARY:
        return evaluateUnary(((Expression.Unary) node).op(), args.get(0));
      case BINARY:
        return evaluateBinary(((Expression.Binary) node).op(), args.get(0), args.get(1));
      case FUNCTION:
        return evaluateFunction(((Expression.Function) node).name(), args);
      default:
        throw new IllegalStateException("Unknown expression kind: " + node.kind());
    }
  }

  private NumberValue evaluateBinary(BinaryOperator op, NumberValue a, NumberValue b) {
    switch (op) {
      case ADD:
        return a.add(b);
      case SUBTRACT:
        return a.subtract(b);
      case MULTIPLY:
        return a.multiply(b);
      case DIVIDE:
        return a.divide(b);
      case POWER:
        return a.pow(b);
      case MODULO:
        if (b.isZero()) {
          throw ComputeException.divisionByZero(a + " % " + b);
        }
        return Arithmetic.modulo(a, b);
      default:
        throw new IllegalStateException("Unknown operator: " + op);
    }
  }

  private NumberValue evaluateUnary(UnaryOperator op, NumberValue v) {
    switch (op) {
      case NEGATE:
        return v.negate();
      case PLUS:
        return v;
      case ABS:
        return v.abs();
      case SQRT:
        return sqrt(v);
      case FACTORIAL:
        return factorial(v);
      case REAL:
        if (v instanceof ComplexValue) {
          return ((ComplexValue) v).real();
        }
        return v.isReal() ? v : call(op, v);
      case IMAGINARY:
        if (v instanceof ComplexValue) {
          return ((ComplexValue) v).imaginary();
        }
        return v.isReal() ? NumberValue.zero() : call(op, v);
      case CONJUGATE:
        if (v instanceof ComplexValue) {
          return ((ComplexValue) v).conjugate();
        }
        return v;
      case LN:
        if (v.isZero()) {
          throw ComputeException.domainError("ln(" + v + ")", "logarithm of zero");
        }
        if (v.isNegative() && !allowComplexResults) {
          throw ComputeException.domainError("ln(" + v + ")", "logarithm of a negative number");
        }
        return v.isOne() ? NumberValue.zero() : call(op, v);
      case EXP:
        return v.isZero() && v.isExact() ? NumberValue.one() : call(op, v);
      case SIN:
      case TAN:
      case ASIN:
      case ATAN:
      case SINH:
      case TANH:
        return v.isZero() && v.isExact() ? NumberValue.zero() : call(op, v);
      case COS:
      case COSH:
        return v.isZero() && v.isExact() ? NumberValue.one() : call(op, v);
      default:
        return call(op, v);
    }
  }

  private NumberValue sqrt(NumberValue v) {
    if (v.isSymbolic()) {
      return call(UnaryOperator.SQRT, v);
    }
    if (v.isNegative()) {
      if (!allowComplexResults) {
        throw ComputeException.domainError("sqrt(" + v + ")", "square root of a negative number");
      }
      NumberValue root = sqrt(v.negate());
      return root.isSymbolic() ? call(UnaryOperator.SQRT, v) : NumberValue.complex(zeroLike(root), root);
    }
    if (!v.isExact()) {
      return NumberValue.floating(Math.sqrt(v.approximate()));
    }
    Optional<NumberValue> root = Arithmetic.exactSqrt(v);
    return root.orElseGet(() -> call(UnaryOperator.SQRT, v));
  }

  private static NumberValue zeroLike(NumberValue v) {
    return v.isExact() ? NumberValue.zero() : NumberValue.floating(0.0);
  }

  private static NumberValue factorial(NumberValue v) {
    if (v.isSymbolic()) {
      return call(UnaryOperator.FACTORIAL, v);
    }
    if (!(v instanceof IntegerValue)) {
      throw ComputeException.domainError(v + "!", "factorial of a non-integer");
    }
    BigInteger n = ((IntegerValue) v).value();
    if (n.signum() < 0) {
      throw ComputeException.domainError(v + "!", "factorial of a negative number");
    }
    if (n.compareTo(BigInteger.valueOf(MAX_FACTORIAL)) > 0) {
      return unevaluated(v + "!");
    }
    BigInteger result = BigInteger.ONE;
    for (int k = 2; k <= n.intValue(); k++) {
      result = result.multiply(BigInteger.valueOf(k));
    }
    return NumberValue.integer(result);
  }

  private NumberValue evaluateFunction(String name, List<NumberValue> args) {
    Optional<UnaryOperator> unary = UnaryOperator.fromFunctionName(name);
    if (unary.isPresent() && args.size() == 1) {
      return evaluateUnary(unary.get(), args.get(0));
    }
    if (!args.isEmpty() && args.stream().allMatch(a -> a.isReal() && a.isExact())) {
      switch (name) {
        case "max":
          return args.stream().reduce((a, b) -> a.subtract(b).isNegative() ? b : a).get();
        case "min":
          return args.stream().reduce((a, b) -> b.subtract(a).isNegative() ? b : a).get();
        case "gcd":
          if (args.stream().allMatch(a -> a instanceof IntegerValue)) {
            return args.stream().reduce(Evaluator::gcd).get();
          }
          break;
        case "lcm":
          if (args.stream().allMatch(a -> a instanceof IntegerValue)) {
            return args.stream().reduce(Evaluator::lcm).get();
          }
          break;
        default:
          break;
      }
    }
    return unevaluated(
        name + args.stream().map(Object::toString).collect(Collectors.joining(", ", "(", ")")));
  }

  private static NumberValue gcd(NumberValue a, NumberValue b) {
    return NumberValue.integer(((IntegerValue) a).value().gcd(((IntegerValue) b).value()));
  }

  private static NumberValue lcm(NumberValue a, NumberValue b) {
    BigInteger x = ((IntegerValue) a).value();
    BigInteger y = ((IntegerValue) b).value();
    if (x.signum() == 0 || y.signum() == 0) {
      return NumberValue.zero();
    }
    return NumberValue.integer(x.multiply(y).abs().divide(x.gcd(y)));
  }

  private static NumberValue call(UnaryOperator op, NumberValue v) {
    String text = op.isFunctionStyle() ? op.symbol() + "(" + v + ")" : op.symbol() + v;
    if (v instanceof SymbolicValue) {
      return new SymbolicValue(((SymbolicValue) v).reason(), text);
    }
    return unevaluated(text);
  }

  private static NumberValue unevaluated(String text) {
    return new SymbolicValue(SymbolicValue.Reason.UNEVALUATED, text);
  }

  /**
   * Floating-point approximation with constants replaced by their double values.
   *
   * @throws ComputeException {@code UNDEFINED_VARIABLE} for unbound variables, {@code
   *     DIVISION_BY_ZERO} for a zero divisor, {@code OVERFLOW} when a finite computation overflows
   */
  public double approximate(Expression expression, Map<String, Double> bindings) {
    return Expressions.<Double>fold(
        expression, (node, args) -> approximateNode(node, args, bindings));
  }

  public double approximate(Expression expression) {
    return approximate(expression, Collections.emptyMap());
  }

  private static double approximateNode(
      Expression node, List<Double> args, Map<String, Double> bindings) {
    switch (node.kind()) {
      case NUMBER:
        return ((Expression.NumberLiteral) node).value().approximate();
      case VARIABLE:
        {
          String name = ((Expression.Variable) node).name();
          Double value = bindings.get(name);
          if (value == null) {
            throw ComputeException.undefinedVariable(name);
          }
          return value;
        }
      case CONSTANT:
        return ((Expression.Constant) node).constant().approximation();
      case UNARY:
        {
          UnaryOperator op = ((Expression.Unary) node).op();
          double x = args.get(0);
          if (x == 0.0
              && (op == UnaryOperator.LN || op == UnaryOperator.LOG10 || op == UnaryOperator.LOG2)) {
            throw ComputeException.domainError(op.symbol() + "(0)", "logarithm of zero");
          }
          return checked(applyUnary(op, x), op.symbol(), x);
        }
      case BINARY:
        {
          BinaryOperator op = ((Expression.Binary) node).op();
          double x = args.get(0);
          double y = args.get(1);
          if ((op == BinaryOperator.DIVIDE || op == BinaryOperator.MODULO) && y == 0.0) {
            throw ComputeException.divisionByZero(Double.toString(x));
          }
          return checked(applyBinary(op, x, y), op.symbol(), x, y);
        }
      case FUNCTION:
        {
          Expression.Function f = (Expression.Function) node;
          Optional<UnaryOperator> unary = UnaryOperator.fromFunctionName(f.name());
          if (unary.isPresent() && args.size() == 1) {
            return checked(applyUnary(unary.get(), args.get(0)), f.name(), args.get(0));
          }
          switch (f.name()) {
            case "max":
              return args.stream().mapToDouble(Double::doubleValue).max().orElse(Double.NaN);
            case "min":
              return args.stream().mapToDouble(Double::doubleValue).min().orElse(Double.NaN);
            default:
              return Double.NaN;
          }
        }
      default:
        throw new IllegalStateException("Unknown expression kind: " + node.kind());
    }
  }

  private static double applyBinary(BinaryOperator op, double x, double y) {
    switch (op) {
      case ADD:
        return x + y;
      case SUBTRACT:
        return x - y;
      case MULTIPLY:
        return x * y;
      case DIVIDE:
        return x / y;
      case MODULO:
        return x % y;
      case POWER:
        return Math.pow(x, y);
      default:
        return Double.NaN;
    }
  }

  private static double applyUnary(UnaryOperator op, double x) {
    switch (op) {
      case NEGATE:
        return -x;
      case PLUS:
        return x;
      case SQRT:
        return Math.sqrt(x);
      case ABS:
        return Math.abs(x);
      case SIN:
        return Math.sin(x);
      case COS:
        return Math.cos(x);
      case TAN:
        return Math.tan(x);
      case ASIN:
        return Math.asin(x);
      case ACOS:
        return Math.acos(x);
      case ATAN:
        return Math.atan(x);
      case SINH:
        return Math.sinh(x);
      case COSH:
        return Math.cosh(x);
      case TANH:
        return Math.tanh(x);
      case LN:
        return Math.log(x);
      case LOG10:
        return Math.log10(x);
      case LOG2:
        return Math.log(x) / Math.log(2.0);
      case EXP:
        return Math.exp(x);
      case FACTORIAL:
      case GAMMA:
        {
          double n = op == UnaryOperator.GAMMA ? x - 1 : x;
          if (n < 0 || n != Math.rint(n)) {
            return Double.NaN;
          }
          double result = 1.0;
          for (int k = 2; k <= n && Double.isFinite(result); k++) {
            result *= k;
          }
          return result;
        }
      case REAL:
      case CONJUGATE:
        return x;
      case IMAGINARY:
        return 0.0;
      default:
        return Double.NaN;
    }
  }

  private static double checked(double result, String op, double... inputs) {
    if (Double.isInfinite(result)) {
      for (double input : inputs) {
        if (!Double.isFinite(input)) {
          return result;
        }
      }
      throw ComputeException.overflow(op);
    }
    return result;
  }
}
