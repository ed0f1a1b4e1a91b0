package io.calx.engine.expr;

import io.calx.numeric.NumberValue;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable node of the expression graph.
 *
 * <p>Every node caches, at construction time, a 64-bit {@link #structuralHash() structural hash},
 * its {@link #nodeCount() node count}, {@link #depth() depth} and an {@link #estimatedBytes()
 * estimated footprint}. All four are derived from the cached values of the children, so no
 * operation needs to walk the whole tree to obtain them.
 *
 * <p>Children are plain references: two parents built from the same child share it, which makes
 * the graph a DAG. Equality is structural and is decided iteratively, see {@link
 * Expressions#structurallyEqual(Expression, Expression)}.
 */
public abstract sealed class Expression
    permits Expression.NumberLiteral,
        Expression.Variable,
        Expression.Constant,
        Expression.Unary,
        Expression.Binary,
        Expression.Function {

  /** Variant tag. */
  public enum Kind {
    NUMBER,
    VARIABLE,
    CONSTANT,
    UNARY,
    BINARY,
    FUNCTION
  }

  private final long structuralHash;
  private final long nodeCount;
  private final int depth;
  private final long estimatedBytes;

  private Expression(long structuralHash, long nodeCount, int depth, long estimatedBytes) {
    this.structuralHash = structuralHash;
    this.nodeCount = nodeCount;
    this.depth = depth;
    this.estimatedBytes = estimatedBytes;
  }

  public abstract Kind kind();

  /** @return direct children in operand order, empty for leaves */
  public abstract List<Expression> children();

  /**
   * Returns a node with the same label and the given children, or {@code this} when every child
   * is identical to the current one.
   */
  public abstract Expression withChildren(List<Expression> children);

  public final long structuralHash() {
    return structuralHash;
  }

  /** Number of nodes of the tree view (shared subtrees counted once per occurrence). */
  public final long nodeCount() {
    return nodeCount;
  }

  public final int depth() {
    return depth;
  }

  /** Heuristic heap footprint of the tree view, in bytes. */
  public final long estimatedBytes() {
    return estimatedBytes;
  }

  public final boolean isNumber() {
    return kind() == Kind.NUMBER;
  }

  @Override
  public final boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof Expression && Expressions.structurallyEqual(this, (Expression) o);
  }

  @Override
  public final int hashCode() {
    return Long.hashCode(structuralHash);
  }

  @Override
  public String toString() {
    return ExpressionPrinter.print(this);
  }

  // --- factories ---

  public static NumberLiteral number(NumberValue value) {
    return new NumberLiteral(value);
  }

  public static NumberLiteral integer(long value) {
    return new NumberLiteral(NumberValue.integer(value));
  }

  public static NumberLiteral rational(long numerator, long denominator) {
    return new NumberLiteral(NumberValue.rational(numerator, denominator));
  }

  public static Variable variable(String name) {
    return new Variable(name);
  }

  public static Constant constant(MathConstant constant) {
    return new Constant(constant);
  }

  public static Constant pi() {
    return new Constant(MathConstant.PI);
  }

  public static Unary unary(UnaryOperator op, Expression operand) {
    return new Unary(op, operand);
  }

  public static Binary binary(BinaryOperator op, Expression left, Expression right) {
    return new Binary(op, left, right);
  }

  public static Function function(String name, Expression... args) {
    return new Function(name, Arrays.asList(args));
  }

  public static Function function(String name, List<Expression> args) {
    return new Function(name, args);
  }

  public static Binary add(Expression left, Expression right) {
    return new Binary(BinaryOperator.ADD, left, right);
  }

  public static Binary subtract(Expression left, Expression right) {
    return new Binary(BinaryOperator.SUBTRACT, left, right);
  }

  public static Binary multiply(Expression left, Expression right) {
    return new Binary(BinaryOperator.MULTIPLY, left, right);
  }

  public static Binary divide(Expression left, Expression right) {
    return new Binary(BinaryOperator.DIVIDE, left, right);
  }

  public static Binary power(Expression base, Expression exponent) {
    return new Binary(BinaryOperator.POWER, base, exponent);
  }

  public static Unary negate(Expression operand) {
    return new Unary(UnaryOperator.NEGATE, operand);
  }

  public static Unary sqrt(Expression operand) {
    return new Unary(UnaryOperator.SQRT, operand);
  }

  public static Unary sin(Expression operand) {
    return new Unary(UnaryOperator.SIN, operand);
  }

  public static Unary cos(Expression operand) {
    return new Unary(UnaryOperator.COS, operand);
  }

  public static Unary tan(Expression operand) {
    return new Unary(UnaryOperator.TAN, operand);
  }

  private static long saturatedAdd(long a, long b) {
    long r = a + b;
    return ((a ^ r) & (b ^ r)) < 0 ? Long.MAX_VALUE : r;
  }

  // --- variants ---

  /** Numeric literal. */
  public static final class NumberLiteral extends Expression {
    private final NumberValue value;

    NumberLiteral(NumberValue value) {
      super(StructuralHash.number(Objects.requireNonNull(value, "value")), 1, 1, 48);
      this.value = value;
    }

    public NumberValue value() {
      return value;
    }

    @Override
    public Kind kind() {
      return Kind.NUMBER;
    }

    @Override
    public List<Expression> children() {
      return Collections.emptyList();
    }

    @Override
    public Expression withChildren(List<Expression> children) {
      return this;
    }
  }

  /** Free variable. */
  public static final class Variable extends Expression {
    private final String name;

    Variable(String name) {
      super(StructuralHash.variable(checkName(name)), 1, 1, 40 + 2L * name.length());
      this.name = name;
    }

    private static String checkName(String name) {
      Objects.requireNonNull(name, "name");
      if (name.isEmpty()) {
        throw new IllegalArgumentException("Variable name must not be empty");
      }
      return name;
    }

    public String name() {
      return name;
    }

    @Override
    public Kind kind() {
      return Kind.VARIABLE;
    }

    @Override
    public List<Expression> children() {
      return Collections.emptyList();
    }

    @Override
    public Expression withChildren(List<Expression> children) {
      return this;
    }
  }

  /** Named constant such as π. */
  public static final class Constant extends Expression {
    private final MathConstant constant;

    Constant(MathConstant constant) {
      super(StructuralHash.constant(Objects.requireNonNull(constant, "constant")), 1, 1, 16);
      this.constant = constant;
    }

    public MathConstant constant() {
      return constant;
    }

    @Override
    public Kind kind() {
      return Kind.CONSTANT;
    }

    @Override
    public List<Expression> children() {
      return Collections.emptyList();
    }

    @Override
    public Expression withChildren(List<Expression> children) {
      return this;
    }
  }

  /** Unary operator application. */
  public static final class Unary extends Expression {
    private final UnaryOperator op;
    private final Expression operand;

    Unary(UnaryOperator op, Expression operand) {
      super(
          StructuralHash.unary(Objects.requireNonNull(op, "op"), Objects.requireNonNull(operand, "operand")),
          saturatedAdd(operand.nodeCount(), 1),
          operand.depth() + 1,
          saturatedAdd(operand.estimatedBytes(), 32));
      this.op = op;
      this.operand = operand;
    }

    public UnaryOperator op() {
      return op;
    }

    public Expression operand() {
      return operand;
    }

    @Override
    public Kind kind() {
      return Kind.UNARY;
    }

    @Override
    public List<Expression> children() {
      return List.of(operand);
    }

    @Override
    public Expression withChildren(List<Expression> children) {
      Expression child = children.get(0);
      return child == operand ? this : new Unary(op, child);
    }
  }

  /** Binary operator application. */
  public static final class Binary extends Expression {
    private final BinaryOperator op;
    private final Expression left;
    private final Expression right;

    Binary(BinaryOperator op, Expression left, Expression right) {
      super(
          StructuralHash.binary(
              Objects.requireNonNull(op, "op"),
              Objects.requireNonNull(left, "left"),
              Objects.requireNonNull(right, "right")),
          saturatedAdd(saturatedAdd(left.nodeCount(), right.nodeCount()), 1),
          Math.max(left.depth(), right.depth()) + 1,
          saturatedAdd(saturatedAdd(left.estimatedBytes(), right.estimatedBytes()), 40));
      this.op = op;
      this.left = left;
      this.right = right;
    }

    public BinaryOperator op() {
      return op;
    }

    public Expression left() {
      return left;
    }

    public Expression right() {
      return right;
    }

    @Override
    public Kind kind() {
      return Kind.BINARY;
    }

    @Override
    public List<Expression> children() {
      return List.of(left, right);
    }

    @Override
    public Expression withChildren(List<Expression> children) {
      Expression l = children.get(0);
      Expression r = children.get(1);
      return l == left && r == right ? this : new Binary(op, l, r);
    }
  }

  /** Call of a named function with any number of arguments. */
  public static final class Function extends Expression {
    private final String name;
    private final List<Expression> args;

    Function(String name, List<Expression> args) {
      super(
          StructuralHash.function(Objects.requireNonNull(name, "name"), args),
          count(args),
          depth(args),
          bytes(name, args));
      this.name = name;
      this.args = List.copyOf(args);
    }

    private static long count(List<Expression> args) {
      long n = 1;
      for (Expression arg : args) {
        n = saturatedAdd(n, arg.nodeCount());
      }
      return n;
    }

    private static int depth(List<Expression> args) {
      int d = 0;
      for (Expression arg : args) {
        d = Math.max(d, arg.depth());
      }
      return d + 1;
    }

    private static long bytes(String name, List<Expression> args) {
      long b = 48 + 2L * name.length() + 8L * args.size();
      for (Expression arg : args) {
        b = saturatedAdd(b, arg.estimatedBytes());
      }
      return b;
    }

    public String name() {
      return name;
    }

    public List<Expression> args() {
      return args;
    }

    @Override
    public Kind kind() {
      return Kind.FUNCTION;
    }

    @Override
    public List<Expression> children() {
      return args;
    }

    @Override
    public Expression withChildren(List<Expression> children) {
      boolean same = children.size() == args.size();
      for (int i = 0; same && i < args.size(); i++) {
        same = children.get(i) == args.get(i);
      }
      return same ? this : new Function(name, new ArrayList<>(children));
    }
  }
}
