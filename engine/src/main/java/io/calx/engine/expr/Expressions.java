package io.calx.engine.expr;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.BiFunction;
import java.util.function.Predicate;

/**
 * Traversal and structural utilities over expression graphs.
 *
 * <p>Nothing here recurses on the Java call stack: arbitrarily deep trees are handled with explicit
 * work stacks. Shared subtrees are visited once per traversal.
 */
public final class Expressions {
  private Expressions() {}

  /**
   * Structural equality.
   *
   * <p>Pairs are compared with an explicit stack: identical references are accepted immediately,
   * differing cached hashes reject immediately, anything else compares node labels and pushes the
   * child pairs.
   */
  public static boolean structurallyEqual(Expression a, Expression b) {
    Deque<Expression> left = new ArrayDeque<>();
    Deque<Expression> right = new ArrayDeque<>();
    left.push(a);
    right.push(b);
    while (!left.isEmpty()) {
      Expression x = left.pop();
      Expression y = right.pop();
      if (x == y) {
        continue;
      }
      if (x.structuralHash() != y.structuralHash() || !sameLabel(x, y)) {
        return false;
      }
      List<Expression> xs = x.children();
      List<Expression> ys = y.children();
      for (int i = xs.size() - 1; i >= 0; i--) {
        left.push(xs.get(i));
        right.push(ys.get(i));
      }
    }
    return true;
  }

  /** Compares the node-local part of two expressions: kind, operator, name, value and arity. */
  public static boolean sameLabel(Expression x, Expression y) {
    if (x.kind() != y.kind()) {
      return false;
    }
    switch (x.kind()) {
      case NUMBER:
        return ((Expression.NumberLiteral) x).value().equals(((Expression.NumberLiteral) y).value());
      case VARIABLE:
        return ((Expression.Variable) x).name().equals(((Expression.Variable) y).name());
      case CONSTANT:
        return ((Expression.Constant) x).constant() == ((Expression.Constant) y).constant();
      case UNARY:
        return ((Expression.Unary) x).op() == ((Expression.Unary) y).op();
      case BINARY:
        return ((Expression.Binary) x).op() == ((Expression.Binary) y).op();
      case FUNCTION:
        {
          Expression.Function fx = (Expression.Function) x;
          Expression.Function fy = (Expression.Function) y;
          return fx.name().equals(fy.name()) && fx.args().size() == fy.args().size();
        }
      default:
        return false;
    }
  }

  /**
   * Post-order fold. The combiner receives each node with the results already computed for its
   * children, in operand order. A subtree shared by several parents is folded once.
   *
   * @param root the expression to fold
   * @param combiner computes a node result from the node and its children's results
   * @return the result computed for {@code root}
   */
  public static <R> R fold(Expression root, BiFunction<Expression, List<R>, R> combiner) {
    Objects.requireNonNull(combiner, "combiner");
    Map<Expression, R> done = new IdentityHashMap<>();
    Deque<Frame> stack = new ArrayDeque<>();
    stack.push(new Frame(root));
    while (!stack.isEmpty()) {
      Frame frame = stack.peek();
      if (frame.next < frame.children.size()) {
        Expression child = frame.children.get(frame.next++);
        if (!done.containsKey(child)) {
          stack.push(new Frame(child));
        }
        continue;
      }
      stack.pop();
      if (done.containsKey(frame.node)) {
        continue;
      }
      List<R> childResults;
      if (frame.children.isEmpty()) {
        childResults = Collections.emptyList();
      } else {
        childResults = new ArrayList<>(frame.children.size());
        for (Expression child : frame.children) {
          childResults.add(done.get(child));
        }
      }
      done.put(frame.node, combiner.apply(frame.node, childResults));
    }
    return done.get(root);
  }

  private static final class Frame {
    final Expression node;
    final List<Expression> children;
    int next;

    Frame(Expression node) {
      this.node = node;
      this.children = node.children();
    }
  }

  /** @return {@code true} if any node of {@code root} satisfies {@code predicate} */
  public static boolean anyMatch(Expression root, Predicate<Expression> predicate) {
    Set<Expression> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    Deque<Expression> stack = new ArrayDeque<>();
    stack.push(root);
    while (!stack.isEmpty()) {
      Expression node = stack.pop();
      if (!seen.add(node)) {
        continue;
      }
      if (predicate.test(node)) {
        return true;
      }
      for (Expression child : node.children()) {
        stack.push(child);
      }
    }
    return false;
  }

  /** Names of all free variables, sorted. */
  public static SortedSet<String> variables(Expression root) {
    SortedSet<String> names = new TreeSet<>();
    anyMatch(
        root,
        node -> {
          if (node instanceof Expression.Variable) {
            names.add(((Expression.Variable) node).name());
          }
          return false;
        });
    return names;
  }

  /** An expression is constant when it has no free variables. */
  public static boolean isConstant(Expression root) {
    return !anyMatch(root, node -> node.kind() == Expression.Kind.VARIABLE);
  }

  /** Size measure used to compare alternative forms; the node count of the tree view. */
  public static long complexity(Expression root) {
    return root.nodeCount();
  }

  /**
   * Replaces free variables by the given expressions. Unbound variables are kept. Unchanged
   * subtrees are returned as the same instances.
   */
  public static Expression substitute(Expression root, Map<String, ? extends Expression> bindings) {
    if (bindings.isEmpty()) {
      return root;
    }
    return fold(
        root,
        (node, children) -> {
          if (node instanceof Expression.Variable) {
            Expression replacement = bindings.get(((Expression.Variable) node).name());
            return replacement != null ? replacement : node;
          }
          return children.isEmpty() ? node : node.withChildren(children);
        });
  }
}
