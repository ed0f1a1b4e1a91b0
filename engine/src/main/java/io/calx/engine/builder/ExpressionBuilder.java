package io.calx.engine.builder;

import io.calx.engine.expr.BinaryOperator;
import io.calx.engine.expr.Expression;
import io.calx.engine.expr.MathConstant;
import io.calx.engine.expr.UnaryOperator;
import io.calx.engine.memory.MemoryManager;
import io.calx.engine.memory.MemoryStats;
import io.calx.engine.memory.SharedExpression;
import io.calx.numeric.IntegerValue;
import io.calx.numeric.NumberValue;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Construction façade over a {@link MemoryManager}.
 *
 * <p>Small integers, the common variables {@code x y z t n} and the constants π, e and i are
 * interned: asking for them twice yields handles to the same node. Every construction call goes
 * through the pool, so its hit and miss counters reflect all requests.
 *
 * <p>A few unconditional identities are applied while building, e.g. {@code x + 0} returns a
 * handle to {@code x} and {@code x - x} returns zero. Anything that depends on the value of a
 * subexpression is left to the simplifier.
 *
 * <p>Operand handles are not consumed; the caller keeps ownership of them. Every returned handle
 * is new and must be released by the caller.
 */
public final class ExpressionBuilder {
  private static final Logger log = LoggerFactory.getLogger(ExpressionBuilder.class);

  static final int INTERN_MIN = -16;
  static final int INTERN_MAX = 256;
  private static final long[] PRELOADED_NUMBERS = {0, 1, -1, 2, -2, 10};
  private static final String[] PRELOADED_VARIABLES = {"x", "y", "z", "t", "n"};
  private static final MathConstant[] PRELOADED_CONSTANTS = {
    MathConstant.PI, MathConstant.E, MathConstant.I
  };

  private final MemoryManager memory;
  private final Map<Long, SharedExpression> integers = new HashMap<>();
  private final Map<String, SharedExpression> variables = new HashMap<>();
  private final Map<MathConstant, SharedExpression> constants = new HashMap<>();

  public ExpressionBuilder() {
    this(MemoryManager.create());
  }

  public ExpressionBuilder(MemoryManager memory) {
    this.memory = Objects.requireNonNull(memory, "memory");
    for (long value : PRELOADED_NUMBERS) {
      integers.put(value, memory.createShared(Expression.integer(value)));
    }
    for (String name : PRELOADED_VARIABLES) {
      variables.put(name, memory.createShared(Expression.variable(name)));
    }
    for (MathConstant constant : PRELOADED_CONSTANTS) {
      constants.put(constant, memory.createShared(Expression.constant(constant)));
    }
  }

  public MemoryManager memory() {
    return memory;
  }

  public MemoryStats memoryStats() {
    return memory.getStats();
  }

  // --- leaves ---

  public SharedExpression integer(long value) {
    if (value < INTERN_MIN || value > INTERN_MAX) {
      return memory.createShared(Expression.integer(value));
    }
    SharedExpression interned = integers.get(value);
    if (interned != null) {
      memory.recordHit();
      return interned.cloneShared();
    }
    interned = memory.createShared(Expression.integer(value));
    integers.put(value, interned);
    return interned.cloneShared();
  }

  public SharedExpression number(NumberValue value) {
    if (value instanceof IntegerValue) {
      BigInteger v = ((IntegerValue) value).value();
      if (v.bitLength() < 32) {
        return integer(v.longValue());
      }
    }
    return memory.createShared(Expression.number(value));
  }

  public SharedExpression rational(long numerator, long denominator) {
    return number(NumberValue.rational(numerator, denominator));
  }

  public SharedExpression real(String value) {
    return number(NumberValue.real(new BigDecimal(value)));
  }

  public SharedExpression floating(double value) {
    return number(NumberValue.floating(value));
  }

  public SharedExpression variable(String name) {
    SharedExpression interned = variables.get(name);
    if (interned != null) {
      memory.recordHit();
      return interned.cloneShared();
    }
    SharedExpression created = memory.createShared(Expression.variable(name));
    if (variables.size() < memory.config().internCapacity()) {
      variables.put(name, created.cloneShared());
    }
    return created;
  }

  public SharedExpression constant(MathConstant constant) {
    SharedExpression interned = constants.get(constant);
    if (interned != null) {
      memory.recordHit();
      return interned.cloneShared();
    }
    interned = memory.createShared(Expression.constant(constant));
    constants.put(constant, interned);
    return interned.cloneShared();
  }

  public SharedExpression pi() {
    return constant(MathConstant.PI);
  }

  // --- binary ---

  public SharedExpression add(SharedExpression left, SharedExpression right) {
    Expression l = left.get();
    Expression r = right.get();
    if (isZero(r)) {
      return reuse(left);
    }
    if (isZero(l)) {
      return reuse(right);
    }
    return node(Expression.add(l, r));
  }

  public SharedExpression subtract(SharedExpression left, SharedExpression right) {
    Expression l = left.get();
    Expression r = right.get();
    if (isZero(r)) {
      return reuse(left);
    }
    if (left.fastEquals(right)) {
      return integer(0);
    }
    return node(Expression.subtract(l, r));
  }

  public SharedExpression multiply(SharedExpression left, SharedExpression right) {
    Expression l = left.get();
    Expression r = right.get();
    if (isZero(l) || isZero(r)) {
      return integer(0);
    }
    if (isOne(l)) {
      return reuse(right);
    }
    if (isOne(r)) {
      return reuse(left);
    }
    if (isMinusOne(l)) {
      return node(Expression.negate(r));
    }
    if (isMinusOne(r)) {
      return node(Expression.negate(l));
    }
    return node(Expression.multiply(l, r));
  }

  public SharedExpression divide(SharedExpression left, SharedExpression right) {
    if (isOne(right.get())) {
      return reuse(left);
    }
    return node(Expression.divide(left.get(), right.get()));
  }

  public SharedExpression power(SharedExpression base, SharedExpression exponent) {
    if (isOne(exponent.get())) {
      return reuse(base);
    }
    if (isOne(base.get())) {
      return reuse(base);
    }
    return node(Expression.power(base.get(), exponent.get()));
  }

  public SharedExpression modulo(SharedExpression left, SharedExpression right) {
    return node(Expression.binary(BinaryOperator.MODULO, left.get(), right.get()));
  }

  // --- unary and calls ---

  public SharedExpression negate(SharedExpression operand) {
    Expression e = operand.get();
    if (isZero(e)) {
      return reuse(operand);
    }
    if (e instanceof Expression.Unary && ((Expression.Unary) e).op() == UnaryOperator.NEGATE) {
      return node(((Expression.Unary) e).operand());
    }
    return node(Expression.negate(e));
  }

  public SharedExpression unary(UnaryOperator op, SharedExpression operand) {
    switch (op) {
      case NEGATE:
        return negate(operand);
      case PLUS:
        return reuse(operand);
      case ABS:
        if (isZero(operand.get())) {
          return reuse(operand);
        }
        return node(Expression.unary(op, operand.get()));
      default:
        return node(Expression.unary(op, operand.get()));
    }
  }

  public SharedExpression sqrt(SharedExpression operand) {
    return unary(UnaryOperator.SQRT, operand);
  }

  public SharedExpression sin(SharedExpression operand) {
    return unary(UnaryOperator.SIN, operand);
  }

  public SharedExpression cos(SharedExpression operand) {
    return unary(UnaryOperator.COS, operand);
  }

  public SharedExpression tan(SharedExpression operand) {
    return unary(UnaryOperator.TAN, operand);
  }

  public SharedExpression ln(SharedExpression operand) {
    return unary(UnaryOperator.LN, operand);
  }

  public SharedExpression exp(SharedExpression operand) {
    return unary(UnaryOperator.EXP, operand);
  }

  /** A named call; arguments are not normalised to operators here. */
  public SharedExpression function(String name, List<SharedExpression> args) {
    List<Expression> values = new ArrayList<>(args.size());
    for (SharedExpression arg : args) {
      values.add(arg.get());
    }
    return node(Expression.function(name, values));
  }

  /** Pools an already built expression. */
  public SharedExpression share(Expression expression) {
    return node(expression);
  }

  /**
   * Cleans the pool and releases interned handles that nobody outside this builder holds.
   *
   * @return number of pool entries and interned handles removed
   */
  public int cleanup() {
    int removed = prune(variables) + prune(integers) + prune(constants);
    removed += memory.cleanup();
    log.debug("Builder cleanup removed {} entries", removed);
    return removed;
  }

  private static int prune(Map<?, SharedExpression> interned) {
    int removed = 0;
    for (Iterator<SharedExpression> it = interned.values().iterator(); it.hasNext(); ) {
      SharedExpression handle = it.next();
      if (handle.refCount() <= 1) {
        handle.release();
        it.remove();
        removed++;
      }
    }
    return removed;
  }

  private SharedExpression node(Expression expression) {
    return memory.createShared(expression);
  }

  private SharedExpression reuse(SharedExpression handle) {
    memory.recordHit();
    return handle.cloneShared();
  }

  private static boolean isZero(Expression e) {
    return e instanceof Expression.NumberLiteral
        && ((Expression.NumberLiteral) e).value().isExact()
        && ((Expression.NumberLiteral) e).value().isZero();
  }

  private static boolean isOne(Expression e) {
    return e instanceof Expression.NumberLiteral
        && ((Expression.NumberLiteral) e).value().isExact()
        && ((Expression.NumberLiteral) e).value().isOne();
  }

  private static boolean isMinusOne(Expression e) {
    return e instanceof Expression.NumberLiteral
        && ((Expression.NumberLiteral) e).value().isExact()
        && ((Expression.NumberLiteral) e).value().negate().isOne();
  }
}
