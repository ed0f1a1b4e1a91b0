package io.calx.engine.expr;

import io.calx.numeric.ComplexValue;
import io.calx.numeric.NumberValue;
import io.calx.numeric.RationalValue;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Canonical text form of an expression.
 *
 * <p>Infix operators are spaced ({@code x + 1}, {@code 2 * x}) except for powers ({@code x^2});
 * function-style operators print as calls ({@code sqrt(2)}, {@code sin(x)}). Parentheses are added
 * only where precedence or associativity requires them. The printer works on an explicit stack and
 * handles arbitrarily deep trees.
 */
public final class ExpressionPrinter {
  private static final int PREFIX = 8;
  private static final int ATOM = 10;

  private ExpressionPrinter() {}

  public static String print(Expression root) {
    StringBuilder sb = new StringBuilder();
    Deque<Object> work = new ArrayDeque<>();
    work.push(root);
    while (!work.isEmpty()) {
      Object item = work.pop();
      if (item instanceof String) {
        sb.append((String) item);
        continue;
      }
      List<Object> parts = parts((Expression) item);
      for (int i = parts.size() - 1; i >= 0; i--) {
        work.push(parts.get(i));
      }
    }
    return sb.toString();
  }

  private static List<Object> parts(Expression node) {
    List<Object> parts = new ArrayList<>(7);
    switch (node.kind()) {
      case NUMBER:
        parts.add(((Expression.NumberLiteral) node).value().toString());
        break;
      case VARIABLE:
        parts.add(((Expression.Variable) node).name());
        break;
      case CONSTANT:
        parts.add(((Expression.Constant) node).constant().symbol());
        break;
      case UNARY:
        {
          Expression.Unary u = (Expression.Unary) node;
          switch (u.op()) {
            case NEGATE:
            case PLUS:
              parts.add(u.op().symbol());
              operand(parts, u.operand(), precedence(u.operand()) <= PREFIX);
              break;
            case FACTORIAL:
              operand(parts, u.operand(), precedence(u.operand()) < ATOM);
              parts.add("!");
              break;
            default:
              parts.add(u.op().symbol());
              parts.add("(");
              parts.add(u.operand());
              parts.add(")");
              break;
          }
          break;
        }
      case BINARY:
        {
          Expression.Binary b = (Expression.Binary) node;
          BinaryOperator op = b.op();
          int p = op.precedence();
          int lp = precedence(b.left());
          int rp = precedence(b.right());
          operand(parts, b.left(), lp < p || (lp == p && op.isRightAssociative()));
          parts.add(op == BinaryOperator.POWER ? op.symbol() : " " + op.symbol() + " ");
          operand(parts, b.right(), rp < p || (rp == p && !op.isRightAssociative()));
          break;
        }
      case FUNCTION:
        {
          Expression.Function f = (Expression.Function) node;
          parts.add(f.name());
          parts.add("(");
          for (int i = 0; i < f.args().size(); i++) {
            if (i > 0) {
              parts.add(", ");
            }
            parts.add(f.args().get(i));
          }
          parts.add(")");
          break;
        }
      default:
        parts.add(node.kind().name());
        break;
    }
    return parts;
  }

  private static void operand(List<Object> parts, Expression operand, boolean parenthesize) {
    if (parenthesize) {
      parts.add("(");
      parts.add(operand);
      parts.add(")");
    } else {
      parts.add(operand);
    }
  }

  private static int precedence(Expression e) {
    switch (e.kind()) {
      case NUMBER:
        {
          NumberValue v = ((Expression.NumberLiteral) e).value();
          if (v instanceof ComplexValue && !((ComplexValue) v).real().isZero()) {
            return BinaryOperator.ADD.precedence();
          }
          if (v.isNegative() || v.toString().startsWith("-")) {
            return PREFIX;
          }
          if (v instanceof RationalValue && !v.isInteger()) {
            return BinaryOperator.DIVIDE.precedence();
          }
          return ATOM;
        }
      case UNARY:
        {
          UnaryOperator op = ((Expression.Unary) e).op();
          return op == UnaryOperator.NEGATE || op == UnaryOperator.PLUS ? PREFIX : ATOM;
        }
      case BINARY:
        return ((Expression.Binary) e).op().precedence();
      default:
        return ATOM;
    }
  }
}
