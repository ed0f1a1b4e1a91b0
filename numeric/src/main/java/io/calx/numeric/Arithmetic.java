package io.calx.numeric;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * Operations of the numeric tower.
 *
 * <p>Binary operations first {@link #promote promote} both operands to a common kind. Exact kinds
 * follow Integer &lt; Rational &lt; Real &lt; Complex. Float only combines with Float (and with a
 * Complex whose components are Float); any other mix produces a {@link SymbolicValue} with reason
 * {@link SymbolicValue.Reason#INEXACT_MIX}. A symbolic operand makes the result symbolic.
 *
 * <p>Division by zero never throws. The only exception raised here is {@link
 * ComputeError#OVERFLOW} when Float arithmetic on finite operands yields an infinity.
 */
public final class Arithmetic {
  /** System property overriding the number of significant digits used for Real division. */
  public static final String PRECISION_PROPERTY = "calx.numeric.precision";

  public static final MathContext CONTEXT =
      new MathContext(Integer.getInteger(PRECISION_PROPERTY, 50), RoundingMode.HALF_EVEN);

  /** Integral exponents beyond this stay symbolic. */
  static final int MAX_EXPONENT = 100_000;

  /** Operands lifted to a common kind. */
  public record Promoted(NumberValue left, NumberValue right) {
    public boolean sameKind() {
      return left.kind() == right.kind();
    }
  }

  private Arithmetic() {}

  /**
   * Lifts {@code a} and {@code b} to a common kind.
   *
   * <p>A real operand paired with a Complex becomes {@code Complex{x, 0}} where the zero has the
   * kind of {@code x}. Pairs that cannot be promoted (Float with an exact kind, symbolic values)
   * are returned unchanged; check {@link Promoted#sameKind()}.
   */
  public static Promoted promote(NumberValue a, NumberValue b) {
    if (a.isSymbolic() || b.isSymbolic()) {
      return new Promoted(a, b);
    }
    if (a.kind() == NumericKind.COMPLEX || b.kind() == NumericKind.COMPLEX) {
      return new Promoted(asComplex(a), asComplex(b));
    }
    if (a.kind() == NumericKind.FLOAT || b.kind() == NumericKind.FLOAT) {
      return new Promoted(a, b);
    }
    int ra = a.kind().rank();
    int rb = b.kind().rank();
    if (ra == rb) {
      return new Promoted(a, b);
    }
    return ra < rb ? new Promoted(lift(a, b.kind()), b) : new Promoted(a, lift(b, a.kind()));
  }

  private static ComplexValue asComplex(NumberValue value) {
    if (value instanceof ComplexValue) {
      return (ComplexValue) value;
    }
    NumberValue zero =
        value.kind() == NumericKind.FLOAT
            ? new FloatValue(0.0)
            : value.kind() == NumericKind.REAL ? new RealValue(BigDecimal.ZERO) : IntegerValue.ZERO;
    return new ComplexValue(value, zero);
  }

  private static NumberValue lift(NumberValue value, NumericKind target) {
    if (value instanceof IntegerValue) {
      BigInteger v = ((IntegerValue) value).value();
      return target == NumericKind.RATIONAL
          ? new RationalValue(BigRational.of(v))
          : new RealValue(new BigDecimal(v));
    }
    if (value instanceof RationalValue && target == NumericKind.REAL) {
      BigRational q = ((RationalValue) value).value();
      return new RealValue(
          q.hasTerminatingDecimal() ? q.toBigDecimalExact() : q.toBigDecimal(CONTEXT));
    }
    return value;
  }

  public static NumberValue add(NumberValue a, NumberValue b) {
    return combine(Op.ADD, a, b);
  }

  public static NumberValue subtract(NumberValue a, NumberValue b) {
    return combine(Op.SUBTRACT, a, b);
  }

  public static NumberValue multiply(NumberValue a, NumberValue b) {
    return combine(Op.MULTIPLY, a, b);
  }

  private enum Op {
    ADD("+"),
    SUBTRACT("-"),
    MULTIPLY("*");

    final String symbol;

    Op(String symbol) {
      this.symbol = symbol;
    }
  }

  private static NumberValue combine(Op op, NumberValue a, NumberValue b) {
    if (a.isSymbolic() || b.isSymbolic()) {
      return unresolved(op.symbol, a, b);
    }
    Promoted p = promote(a, b);
    if (!p.sameKind()) {
      return inexactMix(op.symbol, a, b);
    }
    NumberValue l = p.left();
    NumberValue r = p.right();
    switch (l.kind()) {
      case INTEGER:
        {
          BigInteger x = ((IntegerValue) l).value();
          BigInteger y = ((IntegerValue) r).value();
          switch (op) {
            case ADD:
              return IntegerValue.of(x.add(y));
            case SUBTRACT:
              return IntegerValue.of(x.subtract(y));
            default:
              return IntegerValue.of(x.multiply(y));
          }
        }
      case RATIONAL:
        {
          BigRational x = ((RationalValue) l).value();
          BigRational y = ((RationalValue) r).value();
          switch (op) {
            case ADD:
              return RationalValue.normalize(x.add(y));
            case SUBTRACT:
              return RationalValue.normalize(x.subtract(y));
            default:
              return RationalValue.normalize(x.multiply(y));
          }
        }
      case REAL:
        {
          BigDecimal x = ((RealValue) l).value();
          BigDecimal y = ((RealValue) r).value();
          switch (op) {
            case ADD:
              return new RealValue(x.add(y));
            case SUBTRACT:
              return new RealValue(x.subtract(y));
            default:
              return new RealValue(x.multiply(y));
          }
        }
      case COMPLEX:
        return combineComplex(op, (ComplexValue) l, (ComplexValue) r);
      case FLOAT:
        {
          double x = ((FloatValue) l).value();
          double y = ((FloatValue) r).value();
          double result;
          switch (op) {
            case ADD:
              result = x + y;
              break;
            case SUBTRACT:
              result = x - y;
              break;
            default:
              result = x * y;
              break;
          }
          return new FloatValue(checkFinite(result, x, y, op.symbol));
        }
      default:
        return unresolved(op.symbol, a, b);
    }
  }

  private static NumberValue combineComplex(Op op, ComplexValue l, ComplexValue r) {
    NumberValue a = l.real();
    NumberValue b = l.imaginary();
    NumberValue c = r.real();
    NumberValue d = r.imaginary();
    switch (op) {
      case ADD:
        return ComplexValue.normalize(add(a, c), add(b, d));
      case SUBTRACT:
        return ComplexValue.normalize(subtract(a, c), subtract(b, d));
      default:
        // (a+bi)(c+di) = (ac-bd) + (ad+bc)i
        return ComplexValue.normalize(
            subtract(multiply(a, c), multiply(b, d)), add(multiply(a, d), multiply(b, c)));
    }
  }

  /**
   * Division. {@code x/0} yields a {@link SymbolicValue.Reason#DIVISION_BY_ZERO} value and {@code
   * 0/0} an {@link SymbolicValue.Reason#INDETERMINATE} one, for every kind.
   */
  public static NumberValue divide(NumberValue a, NumberValue b) {
    if (a.isSymbolic() || b.isSymbolic()) {
      return unresolved("/", a, b);
    }
    if (b.isZero()) {
      return a.isZero()
          ? new SymbolicValue(SymbolicValue.Reason.INDETERMINATE, a + "/" + b)
          : new SymbolicValue(SymbolicValue.Reason.DIVISION_BY_ZERO, a + "/" + b);
    }
    Promoted p = promote(a, b);
    if (!p.sameKind()) {
      return inexactMix("/", a, b);
    }
    NumberValue l = p.left();
    NumberValue r = p.right();
    switch (l.kind()) {
      case INTEGER:
        {
          BigInteger x = ((IntegerValue) l).value();
          BigInteger y = ((IntegerValue) r).value();
          BigInteger[] qr = x.divideAndRemainder(y);
          if (qr[1].signum() == 0) {
            return IntegerValue.of(qr[0]);
          }
          return RationalValue.normalize(BigRational.of(x, y));
        }
      case RATIONAL:
        return RationalValue.normalize(
            ((RationalValue) l).value().divide(((RationalValue) r).value()));
      case REAL:
        return new RealValue(((RealValue) l).value().divide(((RealValue) r).value(), CONTEXT));
      case COMPLEX:
        {
          ComplexValue x = (ComplexValue) l;
          ComplexValue y = (ComplexValue) r;
          // (a+bi)/(c+di) = ((ac+bd) + (bc-ad)i) / (c^2+d^2)
          NumberValue a1 = x.real();
          NumberValue b1 = x.imaginary();
          NumberValue c1 = y.real();
          NumberValue d1 = y.imaginary();
          NumberValue denominator = add(multiply(c1, c1), multiply(d1, d1));
          NumberValue re = divide(add(multiply(a1, c1), multiply(b1, d1)), denominator);
          NumberValue im = divide(subtract(multiply(b1, c1), multiply(a1, d1)), denominator);
          return ComplexValue.normalize(re, im);
        }
      case FLOAT:
        {
          double x = ((FloatValue) l).value();
          double y = ((FloatValue) r).value();
          return new FloatValue(checkFinite(x / y, x, y, "/"));
        }
      default:
        return unresolved("/", a, b);
    }
  }

  public static NumberValue negate(NumberValue value) {
    switch (value.kind()) {
      case INTEGER:
        return IntegerValue.of(((IntegerValue) value).value().negate());
      case RATIONAL:
        return new RationalValue(((RationalValue) value).value().negate());
      case REAL:
        return new RealValue(((RealValue) value).value().negate());
      case COMPLEX:
        {
          ComplexValue c = (ComplexValue) value;
          return ComplexValue.normalize(negate(c.real()), negate(c.imaginary()));
        }
      case FLOAT:
        return new FloatValue(-((FloatValue) value).value());
      default:
        {
          SymbolicValue s = (SymbolicValue) value;
          return new SymbolicValue(s.reason(), "-(" + s.text() + ")");
        }
    }
  }

  /**
   * Absolute value. The modulus of a complex number is exact when the sum of squares is a perfect
   * square and symbolic otherwise (Float components give a Float).
   */
  public static NumberValue abs(NumberValue value) {
    switch (value.kind()) {
      case INTEGER:
        return IntegerValue.of(((IntegerValue) value).value().abs());
      case RATIONAL:
        return new RationalValue(((RationalValue) value).value().abs());
      case REAL:
        return new RealValue(((RealValue) value).value().abs());
      case FLOAT:
        return new FloatValue(Math.abs(((FloatValue) value).value()));
      case COMPLEX:
        {
          ComplexValue c = (ComplexValue) value;
          if (c.real().kind() == NumericKind.FLOAT && c.imaginary().kind() == NumericKind.FLOAT) {
            return new FloatValue(c.approximate());
          }
          NumberValue squares = add(multiply(c.real(), c.real()), multiply(c.imaginary(), c.imaginary()));
          return exactSqrt(squares)
              .orElseGet(
                  () -> new SymbolicValue(SymbolicValue.Reason.UNEVALUATED, "sqrt(" + squares + ")"));
        }
      default:
        {
          SymbolicValue s = (SymbolicValue) value;
          return new SymbolicValue(s.reason(), "|" + s.text() + "|");
        }
    }
  }

  /**
   * Power. Integral exponents are computed exactly for every exact kind (a negative exponent goes
   * through the reciprocal); a rational exponent with denominator two is exact when the base is a
   * perfect square. Everything else stays symbolic.
   */
  public static NumberValue pow(NumberValue base, NumberValue exponent) {
    if (base.isSymbolic() || exponent.isSymbolic()) {
      return unresolved("^", base, exponent);
    }
    if (base.isZero() && exponent.isReal()) {
      if (exponent.isZero()) {
        return new SymbolicValue(SymbolicValue.Reason.INDETERMINATE, base + "^" + exponent);
      }
      if (exponent.isNegative()) {
        return new SymbolicValue(SymbolicValue.Reason.DIVISION_BY_ZERO, base + "^" + exponent);
      }
    }
    if (exponent instanceof IntegerValue) {
      BigInteger n = ((IntegerValue) exponent).value();
      if (n.abs().compareTo(BigInteger.valueOf(MAX_EXPONENT)) > 0) {
        return new SymbolicValue(SymbolicValue.Reason.UNEVALUATED, base + "^" + exponent);
      }
      return integerPower(base, n.intValueExact());
    }
    if (exponent instanceof RationalValue && base.isRational() && !base.isNegative()) {
      BigRational q = ((RationalValue) exponent).value();
      if (q.denominator().equals(BigInteger.TWO)
          && q.numerator().abs().compareTo(BigInteger.valueOf(MAX_EXPONENT)) <= 0) {
        Optional<NumberValue> root = exactSqrt(base);
        if (root.isPresent()) {
          return integerPower(root.get(), q.numerator().intValueExact());
        }
      }
      return new SymbolicValue(SymbolicValue.Reason.UNEVALUATED, base + "^(" + exponent + ")");
    }
    if (base instanceof FloatValue && exponent instanceof FloatValue) {
      double x = ((FloatValue) base).value();
      double y = ((FloatValue) exponent).value();
      double result = Math.pow(x, y);
      if (Double.isNaN(result)) {
        return new SymbolicValue(SymbolicValue.Reason.UNEVALUATED, base + "^" + exponent);
      }
      return new FloatValue(checkFinite(result, x, y, "^"));
    }
    if (base.kind() == NumericKind.FLOAT || exponent.kind() == NumericKind.FLOAT) {
      return inexactMix("^", base, exponent);
    }
    return new SymbolicValue(SymbolicValue.Reason.UNEVALUATED, base + "^(" + exponent + ")");
  }

  private static NumberValue integerPower(NumberValue base, int n) {
    if (n == 0) {
      switch (base.kind()) {
        case FLOAT:
          return new FloatValue(1.0);
        case REAL:
          return new RealValue(BigDecimal.ONE);
        default:
          return IntegerValue.ONE;
      }
    }
    switch (base.kind()) {
      case INTEGER:
        {
          BigInteger b = ((IntegerValue) base).value();
          if (n > 0) {
            return IntegerValue.of(b.pow(n));
          }
          return RationalValue.normalize(BigRational.of(BigInteger.ONE, b.pow(-n)));
        }
      case RATIONAL:
        return RationalValue.normalize(((RationalValue) base).value().pow(n));
      case REAL:
        {
          BigDecimal b = ((RealValue) base).value();
          if (n > 0) {
            return new RealValue(b.pow(n));
          }
          return new RealValue(BigDecimal.ONE.divide(b.pow(-n), CONTEXT));
        }
      case FLOAT:
        {
          double b = ((FloatValue) base).value();
          return new FloatValue(checkFinite(Math.pow(b, n), b, n, "^"));
        }
      case COMPLEX:
        {
          NumberValue result = IntegerValue.ONE;
          NumberValue square = base;
          int e = Math.abs(n);
          while (e > 0) {
            if ((e & 1) == 1) {
              result = multiply(result, square);
            }
            e >>= 1;
            if (e > 0) {
              square = multiply(square, square);
            }
          }
          return n > 0 ? result : divide(IntegerValue.ONE, result);
        }
      default:
        return new SymbolicValue(SymbolicValue.Reason.UNEVALUATED, base + "^" + n);
    }
  }

  /**
   * Truncating remainder of two integers, or of two floats. A zero divisor gives a symbolic
   * division-by-zero value; other operands stay symbolic.
   */
  public static NumberValue modulo(NumberValue a, NumberValue b) {
    if (a instanceof IntegerValue && b instanceof IntegerValue) {
      if (b.isZero()) {
        return new SymbolicValue(SymbolicValue.Reason.DIVISION_BY_ZERO, a + " % " + b);
      }
      return IntegerValue.of(((IntegerValue) a).value().remainder(((IntegerValue) b).value()));
    }
    if (a instanceof FloatValue && b instanceof FloatValue) {
      if (b.isZero()) {
        return new SymbolicValue(SymbolicValue.Reason.DIVISION_BY_ZERO, a + " % " + b);
      }
      return new FloatValue(((FloatValue) a).value() % ((FloatValue) b).value());
    }
    if (a.isSymbolic() || b.isSymbolic()) {
      return unresolved("%", a, b);
    }
    return new SymbolicValue(SymbolicValue.Reason.UNEVALUATED, "(" + a + " % " + b + ")");
  }

  /**
   * Exact square root of a non-negative Integer, Rational or Real, present only when the value is
   * a perfect square.
   */
  public static Optional<NumberValue> exactSqrt(NumberValue value) {
    if (value.isNegative()) {
      return Optional.empty();
    }
    if (value instanceof IntegerValue) {
      return integerSqrt(((IntegerValue) value).value()).map(IntegerValue::of);
    }
    if (value instanceof RationalValue) {
      BigRational q = ((RationalValue) value).value();
      Optional<BigInteger> num = integerSqrt(q.numerator());
      Optional<BigInteger> den = integerSqrt(q.denominator());
      if (num.isPresent() && den.isPresent()) {
        return Optional.of(RationalValue.normalize(BigRational.of(num.get(), den.get())));
      }
      return Optional.empty();
    }
    if (value instanceof RealValue) {
      BigDecimal v = ((RealValue) value).value();
      BigDecimal root = v.sqrt(CONTEXT);
      if (root.multiply(root).compareTo(v) == 0) {
        return Optional.of(new RealValue(root.stripTrailingZeros()));
      }
    }
    return Optional.empty();
  }

  /** Root of a perfect square, empty otherwise. */
  public static Optional<BigInteger> integerSqrt(BigInteger value) {
    if (value.signum() < 0) {
      return Optional.empty();
    }
    BigInteger root = value.sqrt();
    return root.multiply(root).equals(value) ? Optional.of(root) : Optional.empty();
  }

  private static double checkFinite(double result, double a, double b, String op) {
    if (Double.isInfinite(result) && Double.isFinite(a) && Double.isFinite(b)) {
      throw ComputeException.overflow(a + " " + op + " " + b);
    }
    return result;
  }

  private static SymbolicValue unresolved(String op, NumberValue a, NumberValue b) {
    SymbolicValue.Reason reason =
        a instanceof SymbolicValue
            ? ((SymbolicValue) a).reason()
            : ((SymbolicValue) b).reason();
    return new SymbolicValue(reason, "(" + a + " " + op + " " + b + ")");
  }

  private static SymbolicValue inexactMix(String op, NumberValue a, NumberValue b) {
    return new SymbolicValue(SymbolicValue.Reason.INEXACT_MIX, "(" + a + " " + op + " " + b + ")");
  }
}
