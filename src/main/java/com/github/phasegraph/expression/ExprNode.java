package com.github.phasegraph.expression;

import java.util.Optional;

import com.github.phasegraph.GraphException;
import com.github.phasegraph.GraphException.Code;
import com.github.phasegraph.Value;

/**
 * Node of a compiled guard tree. Each subclass is one variant; children are owned by their
 * parent and never shared or mutated after parsing.
 */
abstract class ExprNode {
  static final String propertiesPrefix = "properties.";

  /**
   * Boolean-context evaluation.
   */
  abstract boolean evaluate(final EvaluationContext context) throws GraphException;

  /**
   * Value-context evaluation, used for comparison operands. Non-leaf subexpressions resolve to
   * the boolean value of their own evaluation.
   */
  Value resolve(final EvaluationContext context) throws GraphException {
    return Value.of(evaluate(context));
  }

  static final class Literal extends ExprNode {
    private final Value value;

    Literal(final Value value) {
      this.value = value;
    }

    @Override
    boolean evaluate(final EvaluationContext context) {
      return value.isTruthy();
    }

    @Override
    Value resolve(final EvaluationContext context) {
      return value;
    }

    @Override
    public String toString() {
      return value.toString();
    }
  }

  static final class Identifier extends ExprNode {
    private final String path;

    Identifier(final String path) {
      this.path = path;
    }

    // unknown identifiers are simply false here
    @Override
    boolean evaluate(final EvaluationContext context) {
      final Optional<Value> value = lookup(context);
      return value.isPresent() && value.get().isTruthy();
    }

    @Override
    Value resolve(final EvaluationContext context) throws GraphException {
      final Optional<Value> value = lookup(context);
      if (!value.isPresent()) {
        if (path.startsWith(propertiesPrefix)) {
          throw new GraphException(Code.UNKNOWN_IDENTIFIER,
              "Unknown property: " + path.substring(propertiesPrefix.length()));
        }
        throw new GraphException(Code.UNKNOWN_IDENTIFIER, "Unknown var: " + path);
      }
      return value.get();
    }

    private Optional<Value> lookup(final EvaluationContext context) {
      if (path.startsWith(propertiesPrefix)) {
        return context.lookupProperty(path.substring(propertiesPrefix.length()));
      }
      return context.lookupVariable(path);
    }

    @Override
    public String toString() {
      return path;
    }
  }

  static final class Not extends ExprNode {
    private final ExprNode operand;

    Not(final ExprNode operand) {
      this.operand = operand;
    }

    @Override
    boolean evaluate(final EvaluationContext context) throws GraphException {
      return !operand.evaluate(context);
    }

    @Override
    public String toString() {
      return "!" + operand;
    }
  }

  static final class And extends ExprNode {
    private final ExprNode left;
    private final ExprNode right;

    And(final ExprNode left, final ExprNode right) {
      this.left = left;
      this.right = right;
    }

    @Override
    boolean evaluate(final EvaluationContext context) throws GraphException {
      return left.evaluate(context) && right.evaluate(context);
    }

    @Override
    public String toString() {
      return "(" + left + " && " + right + ")";
    }
  }

  static final class Or extends ExprNode {
    private final ExprNode left;
    private final ExprNode right;

    Or(final ExprNode left, final ExprNode right) {
      this.left = left;
      this.right = right;
    }

    @Override
    boolean evaluate(final EvaluationContext context) throws GraphException {
      return left.evaluate(context) || right.evaluate(context);
    }

    @Override
    public String toString() {
      return "(" + left + " || " + right + ")";
    }
  }

  static final class Cmp extends ExprNode {
    private final CompareOp op;
    private final ExprNode left;
    private final ExprNode right;

    Cmp(final CompareOp op, final ExprNode left, final ExprNode right) {
      this.op = op;
      this.left = left;
      this.right = right;
    }

    @Override
    boolean evaluate(final EvaluationContext context) throws GraphException {
      final Value leftValue = left.resolve(context);
      final Value rightValue = right.resolve(context);
      switch (op) {
        case EQ:
          return matches(leftValue, rightValue);
        case NE:
          return !matches(leftValue, rightValue);
        default:
          return order(leftValue, rightValue);
      }
    }

    private boolean order(final Value leftValue, final Value rightValue) throws GraphException {
      if (!leftValue.isNumeric() || !rightValue.isNumeric()) {
        throw new GraphException(Code.NON_NUMERIC_OPERAND,
            String.format("Non-numeric operand in %s %s %s", leftValue, op.getSymbol(), rightValue));
      }
      final int comparison;
      if (leftValue.getType() == Value.Type.INT64 && rightValue.getType() == Value.Type.INT64) {
        comparison = Long.compare(leftValue.asLong(), rightValue.asLong());
      } else {
        final double l = leftValue.toDouble();
        final double r = rightValue.toDouble();
        // NaN never orders
        if (l < r) {
          comparison = -1;
        } else if (l > r) {
          comparison = 1;
        } else if (l == r) {
          comparison = 0;
        } else {
          return false;
        }
      }
      switch (op) {
        case LT:
          return comparison < 0;
        case LE:
          return comparison <= 0;
        case GT:
          return comparison > 0;
        default:
          return comparison >= 0;
      }
    }

    /**
     * Same variants compare by equality; INT64 and FLOAT64 compare after promotion to double; any
     * other mix is unequal.
     */
    private static boolean matches(final Value leftValue, final Value rightValue) {
      if (leftValue.getType() != rightValue.getType()) {
        if (leftValue.isNumeric() && rightValue.isNumeric()) {
          return leftValue.toDouble() == rightValue.toDouble();
        }
        return false;
      }
      if (leftValue.getType() == Value.Type.FLOAT64) {
        return leftValue.asDouble() == rightValue.asDouble();
      }
      return leftValue.equals(rightValue);
    }

    @Override
    public String toString() {
      return "(" + left + " " + op.getSymbol() + " " + right + ")";
    }
  }
}
