package io.calx.engine.memory;

import static org.junit.jupiter.api.Assertions.*;

import io.calx.engine.expr.Expression;
import org.junit.jupiter.api.Test;

public class SharedExpressionTest {
  private final Expression x = Expression.variable("x");

  @Test
  public void testCloneSharesTheNode() {
    SharedExpression s1 = SharedExpression.of(x);
    assertEquals(1, s1.refCount());
    assertTrue(s1.isUnique());

    SharedExpression s2 = s1.cloneShared();
    assertEquals(2, s1.refCount());
    assertEquals(2, s2.refCount());
    assertFalse(s1.isUnique());
    assertTrue(s1.sharesNodeWith(s2));

    s2.release();
    assertEquals(1, s1.refCount());
    assertTrue(s1.isUnique());
  }

  @Test
  public void testReleaseIsIdempotent() {
    SharedExpression s1 = SharedExpression.of(x);
    SharedExpression s2 = s1.cloneShared();
    s2.release();
    s2.release();
    assertEquals(1, s1.refCount());
    assertTrue(s2.isReleased());
  }

  @Test
  public void testReleasedHandleRejectsUse() {
    SharedExpression s = SharedExpression.of(x);
    s.close();
    assertThrows(IllegalStateException.class, s::get);
    assertThrows(IllegalStateException.class, s::cloneShared);
    assertEquals("<released>", s.toString());
  }

  @Test
  public void testMakeMutCopiesAliasedNode() {
    SharedExpression s1 = SharedExpression.of(x);
    SharedExpression s2 = s1.cloneShared();

    ExpressionCell cell = s1.makeMut();
    cell.set(Expression.variable("y"));

    assertEquals(Expression.variable("y"), s1.get());
    assertEquals(x, s2.get());
    assertTrue(s1.isUnique());
    assertTrue(s2.isUnique());
    assertFalse(s1.sharesNodeWith(s2));
  }

  @Test
  public void testMakeMutOnUniqueHandleWritesInPlace() {
    SharedExpression s = SharedExpression.of(x);
    ExpressionCell cell = s.makeMut();
    cell.update(e -> Expression.add(e, Expression.integer(1)));
    assertEquals(Expression.add(x, Expression.integer(1)), s.get());
    assertEquals(1, s.refCount());
  }

  @Test
  public void testCellRechecksUniquenessOnEveryWrite() {
    SharedExpression s1 = SharedExpression.of(x);
    ExpressionCell cell = s1.makeMut();
    SharedExpression s2 = s1.cloneShared();

    cell.set(Expression.variable("z"));
    assertEquals(x, s2.get());
    assertEquals(Expression.variable("z"), s1.get());
  }

  @Test
  public void testEqualityIgnoresSharing() {
    SharedExpression a = SharedExpression.of(Expression.sin(x));
    SharedExpression b = SharedExpression.of(Expression.sin(Expression.variable("x")));
    assertFalse(a.sharesNodeWith(b));
    assertTrue(a.fastEquals(b));
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertEquals(a.structuralHash(), b.structuralHash());
    assertNotEquals(a, SharedExpression.of(Expression.cos(x)));
  }

  @Test
  public void testIntoOwnedReleases() {
    SharedExpression s1 = SharedExpression.of(x);
    SharedExpression s2 = s1.cloneShared();
    assertEquals(x, s2.intoOwned());
    assertTrue(s2.isReleased());
    assertTrue(s1.isUnique());
  }

  @Test
  public void testTryWithResources() {
    SharedExpression outer = SharedExpression.of(x);
    try (SharedExpression inner = outer.cloneShared()) {
      assertEquals(2, inner.refCount());
    }
    assertEquals(1, outer.refCount());
  }
}
