package io.calx.engine.simplify;

import static org.junit.jupiter.api.Assertions.*;

import io.calx.engine.EngineConfig;
import io.calx.engine.expr.BinaryOperator;
import io.calx.engine.expr.Evaluator;
import io.calx.engine.expr.Expression;
import io.calx.engine.expr.UnaryOperator;
import java.util.Map;
import net.jqwik.api.*;

/**
 * Properties of the simplifier over a small grammar of polynomial and trigonometric expressions in
 * {@code x}, {@code y} and {@code π}.
 */
@PropertyDefaults(tries = 300, shrinking = ShrinkingMode.FULL)
public class SimplifierPropertiesTest {
  private static final Map<String, Double> BINDINGS = Map.of("x", 0.7, "y", 1.3);

  private final Evaluator evaluator = new Evaluator();

  private static Simplifier uncached() {
    return Simplifier.create(
        new EngineConfig(64, 0, RuleFamily.all(), false, EngineConfig.defaults().memory()));
  }

  @Property
  void simplifiedFormIsAFixedPoint(@ForAll("expressions") Expression e) {
    Expression once = uncached().simplify(e);
    Simplifier again = uncached();
    assertEquals(once, again.simplify(once));
    assertEquals(1, again.stats().passes());
  }

  @Property
  void simplificationIsDeterministic(@ForAll("expressions") Expression e) {
    assertEquals(uncached().simplify(e), uncached().simplify(e));
  }

  @Property
  void simplificationPreservesValue(@ForAll("expressions") Expression e) {
    double before = evaluator.approximate(e, BINDINGS);
    double after = evaluator.approximate(uncached().simplify(e), BINDINGS);
    double tolerance = 1e-6 * Math.max(1.0, Math.max(Math.abs(before), Math.abs(after)));
    assertEquals(before, after, tolerance, () -> "simplifying " + e);
  }

  @Property
  void pythagoreanIdentityHoldsForAnyArgument(@ForAll("expressions") Expression u) {
    Expression sum =
        Expression.add(
            Expression.power(Expression.sin(u), Expression.integer(2)),
            Expression.power(Expression.cos(u), Expression.integer(2)));
    assertEquals(Expression.integer(1), uncached().simplify(sum), () -> "argument " + u);
  }

  // ==================== Arbitrary Providers ====================

  @Provide
  Arbitrary<Expression> expressions() {
    return expression(3);
  }

  private Arbitrary<Expression> expression(int depth) {
    Arbitrary<Expression> leaves =
        Arbitraries.oneOf(
            Arbitraries.of("x", "y").map(Expression::variable),
            Arbitraries.integers().between(-2, 2).map(i -> Expression.integer(i)),
            Arbitraries.just(Expression.pi()));
    if (depth == 0) {
      return leaves;
    }
    Arbitrary<Expression> sub = expression(depth - 1);
    return Arbitraries.oneOf(
        leaves,
        binary(sub, BinaryOperator.ADD),
        binary(sub, BinaryOperator.SUBTRACT),
        binary(sub, BinaryOperator.MULTIPLY),
        unary(sub, UnaryOperator.NEGATE),
        unary(sub, UnaryOperator.SIN),
        unary(sub, UnaryOperator.COS),
        sub.map(base -> Expression.power(base, Expression.integer(2))));
  }

  private static Arbitrary<Expression> binary(Arbitrary<Expression> sub, BinaryOperator op) {
    return Combinators.combine(sub, sub).as((l, r) -> Expression.binary(op, l, r));
  }

  private static Arbitrary<Expression> unary(Arbitrary<Expression> sub, UnaryOperator op) {
    return sub.map(operand -> Expression.unary(op, operand));
  }
}
