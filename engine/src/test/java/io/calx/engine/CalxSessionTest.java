package io.calx.engine;

import static org.junit.jupiter.api.Assertions.*;

import io.calx.engine.builder.ExpressionBuilder;
import io.calx.engine.expr.Expression;
import io.calx.engine.memory.SharedExpression;
import io.calx.engine.simplify.RewriteBudgetExceededException;
import io.calx.numeric.NumberValue;
import java.util.Map;
import org.junit.jupiter.api.Test;

public class CalxSessionTest {

  @Test
  public void testBuildSimplifyEvaluate() {
    try (CalxSession session = CalxSession.create()) {
      ExpressionBuilder b = session.builder();
      SharedExpression x = b.variable("x");
      SharedExpression sin2 = b.power(b.sin(x), b.integer(2));
      SharedExpression cos2 = b.power(b.cos(x), b.integer(2));
      SharedExpression sum = b.add(b.multiply(b.integer(3), x), b.add(sin2, cos2));

      SharedExpression simplified = session.simplifier().simplify(sum);
      assertEquals("3 * x + 1", simplified.toString());

      NumberValue value =
          session.evaluator().evaluate(simplified.get(), Map.of("x", NumberValue.integer(2)));
      assertEquals(NumberValue.integer(7), value);
    }
  }

  @Test
  public void testSessionsDoNotSharePools() {
    try (CalxSession a = CalxSession.create();
        CalxSession b = CalxSession.create()) {
      SharedExpression fromA = a.builder().share(Expression.sin(Expression.variable("x")));
      SharedExpression fromB = b.builder().share(Expression.sin(Expression.variable("x")));
      assertFalse(fromA.sharesNodeWith(fromB));
      assertNotSame(a.memory(), b.memory());
      assertNotSame(a.simplifier(), b.simplifier());
    }
  }

  @Test
  public void testConfigurationIsApplied() {
    EngineConfig config =
        EngineConfig.defaults()
            .withMaxRewritePasses(1)
            .withMemory(EngineConfig.defaults().memory().withSharing(false));
    try (CalxSession session = CalxSession.create(config)) {
      assertSame(config, session.config());
      assertFalse(session.memory().config().enableSharing());
      assertFalse(session.evaluator().allowsComplexResults());
      Expression e = Expression.add(Expression.variable("x"), Expression.integer(0));
      assertThrows(RewriteBudgetExceededException.class, () -> session.simplifier().simplify(e));
    }
  }

  @Test
  public void testCloseClearsState() {
    CalxSession session = CalxSession.create();
    SharedExpression kept = session.builder().share(Expression.variable("w"));
    session.simplifier().simplify(Expression.add(Expression.variable("w"), Expression.integer(0)));
    assertTrue(session.monitor().isEnabled());

    session.close();
    session.close();

    assertTrue(session.isClosed());
    assertFalse(session.monitor().isEnabled());
    assertEquals("w", kept.toString());
    assertThrows(IllegalStateException.class, session::builder);
    assertThrows(IllegalStateException.class, session::simplifier);
    assertThrows(IllegalStateException.class, session::memory);
    assertNotNull(session.evaluator());
    assertFalse(session.uptime().isNegative());
  }
}
