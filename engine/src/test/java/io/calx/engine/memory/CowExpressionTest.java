package io.calx.engine.memory;

import static org.junit.jupiter.api.Assertions.*;

import io.calx.engine.expr.Expression;
import org.junit.jupiter.api.Test;

public class CowExpressionTest {
  private final Expression x = Expression.variable("x");

  @Test
  public void testWriteThroughOneViewLeavesTheOtherUntouched() {
    SharedExpression shared = SharedExpression.of(Expression.sin(x));
    CowExpression cow1 = CowExpression.from(shared.cloneShared());
    CowExpression cow2 = CowExpression.from(shared.cloneShared());

    cow1.asMut().set(Expression.cos(x));

    assertEquals(Expression.cos(x), cow1.asRef());
    assertEquals(Expression.sin(x), cow2.asRef());
    assertTrue(cow1.isModified());
    assertFalse(cow2.isModified());
    assertEquals(Expression.sin(x), shared.get());
  }

  @Test
  public void testFirstWriteCopiesLaterWritesAreFree() {
    SharedExpression shared = SharedExpression.of(x);
    CowExpression cow = CowExpression.from(shared.cloneShared());
    assertEquals(2, cow.refCount());

    cow.asMut().set(Expression.variable("a"));
    assertEquals(1, cow.refCount());
    assertEquals(1, shared.refCount());

    cow.asMut().set(Expression.variable("b"));
    assertEquals(1, cow.refCount());
    assertEquals(Expression.variable("b"), cow.asRef());
  }

  @Test
  public void testAsRefDoesNotMarkModified() {
    CowExpression cow = CowExpression.of(x);
    assertEquals(x, cow.asRef());
    assertFalse(cow.isModified());
  }

  @Test
  public void testFork() {
    CowExpression original = CowExpression.of(x);
    CowExpression fork = original.fork();
    assertEquals(2, original.refCount());
    assertEquals(original, fork);

    fork.asMut().update(e -> Expression.negate(e));
    assertNotEquals(original, fork);
    assertFalse(original.isModified());
    assertEquals(1, original.refCount());
  }

  @Test
  public void testCloseReleasesHandle() {
    SharedExpression shared = SharedExpression.of(x);
    try (CowExpression cow = CowExpression.from(shared.cloneShared())) {
      assertEquals(2, shared.refCount());
      assertEquals("x", cow.toString());
    }
    assertEquals(1, shared.refCount());
  }

  @Test
  public void testIntoShared() {
    CowExpression cow = CowExpression.of(x);
    SharedExpression handle = cow.intoShared();
    assertEquals(x, handle.get());
    assertTrue(handle.isUnique());
  }
}
