package io.calx.engine.expr;

import io.calx.numeric.BigRational;
import io.calx.numeric.ComplexValue;
import io.calx.numeric.FloatValue;
import io.calx.numeric.IntegerValue;
import io.calx.numeric.NumberValue;
import io.calx.numeric.RationalValue;
import io.calx.numeric.RealValue;
import io.calx.numeric.SymbolicValue;
import java.math.BigDecimal;
import java.util.List;

/**
 * 64-bit structural hashing of expression nodes.
 *
 * <p>A node hash is derived from its kind, its label (operator ordinal, name or numeric value) and
 * the already cached hashes of its children, in operand order. Only ordinals and content hashes
 * are used, so the value is stable across runs.
 */
final class StructuralHash {
  private static final long PHI_MIX = 0x9E3779B97F4A7C15L;

  private StructuralHash() {}

  static long number(NumberValue value) {
    return combine(seed(Expression.Kind.NUMBER), ofNumber(value));
  }

  static long variable(String name) {
    return combine(seed(Expression.Kind.VARIABLE), name.hashCode());
  }

  static long constant(MathConstant constant) {
    return combine(seed(Expression.Kind.CONSTANT), constant.ordinal());
  }

  static long unary(UnaryOperator op, Expression operand) {
    return combine(combine(seed(Expression.Kind.UNARY), op.ordinal()), operand.structuralHash());
  }

  static long binary(BinaryOperator op, Expression left, Expression right) {
    long h = combine(seed(Expression.Kind.BINARY), op.ordinal());
    h = combine(h, left.structuralHash());
    return combine(h, right.structuralHash());
  }

  static long function(String name, List<Expression> args) {
    long h = combine(seed(Expression.Kind.FUNCTION), name.hashCode());
    h = combine(h, args.size());
    for (Expression arg : args) {
      h = combine(h, arg.structuralHash());
    }
    return h;
  }

  private static long seed(Expression.Kind kind) {
    return mix((kind.ordinal() + 1L) * PHI_MIX);
  }

  private static long ofNumber(NumberValue value) {
    long h = value.kind().ordinal();
    if (value instanceof IntegerValue) {
      return combine(h, ((IntegerValue) value).value().hashCode());
    }
    if (value instanceof RationalValue) {
      BigRational q = ((RationalValue) value).value();
      return combine(combine(h, q.numerator().hashCode()), q.denominator().hashCode());
    }
    if (value instanceof RealValue) {
      BigDecimal d = ((RealValue) value).value();
      return combine(h, d.signum() == 0 ? 0 : d.stripTrailingZeros().hashCode());
    }
    if (value instanceof ComplexValue) {
      ComplexValue c = (ComplexValue) value;
      return combine(combine(h, ofNumber(c.real())), ofNumber(c.imaginary()));
    }
    if (value instanceof FloatValue) {
      return combine(h, Double.doubleToLongBits(((FloatValue) value).value()));
    }
    SymbolicValue s = (SymbolicValue) value;
    return combine(combine(h, s.reason().ordinal()), s.text().hashCode());
  }

  static long combine(long h, long value) {
    return mix(h ^ (value + PHI_MIX + (h << 6) + (h >>> 2)));
  }

  private static long mix(long z) {
    z = (z ^ (z >>> 33)) * 0xff51afd7ed558ccdL;
    z = (z ^ (z >>> 33)) * 0xc4ceb9fe1a85ec53L;
    return z ^ (z >>> 33);
  }
}
