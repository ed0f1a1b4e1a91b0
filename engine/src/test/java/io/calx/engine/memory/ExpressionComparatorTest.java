package io.calx.engine.memory;

import static org.junit.jupiter.api.Assertions.*;

import io.calx.engine.expr.Expression;
import org.junit.jupiter.api.Test;

public class ExpressionComparatorTest {
  private final ExpressionComparator comparator = new ExpressionComparator();

  @Test
  public void testCountsWhichShortcutDecided() {
    Expression a = Expression.add(Expression.variable("x"), Expression.integer(1));
    Expression b = Expression.add(Expression.variable("x"), Expression.integer(1));
    Expression c = Expression.add(Expression.variable("x"), Expression.integer(2));

    assertTrue(comparator.fastEquals(a, a));
    assertTrue(comparator.fastEquals(a, b));
    assertFalse(comparator.fastEquals(a, c));

    assertEquals(1, comparator.identityHits());
    assertEquals(1, comparator.deepComparisons());
    assertEquals(1, comparator.hashRejections());
  }

  @Test
  public void testSharedHandles() {
    SharedExpression s1 = SharedExpression.of(Expression.variable("x"));
    SharedExpression s2 = s1.cloneShared();
    SharedExpression s3 = SharedExpression.of(Expression.variable("x"));

    assertTrue(comparator.fastEquals(s1, s2));
    assertTrue(comparator.fastEquals(s1, s3));
    assertEquals(1, comparator.identityHits());
    assertEquals(1, comparator.deepComparisons());

    comparator.reset();
    assertEquals(0, comparator.identityHits());
  }
}
