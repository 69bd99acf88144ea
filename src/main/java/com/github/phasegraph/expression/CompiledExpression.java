package com.github.phasegraph.expression;

import com.github.phasegraph.GraphException;

/**
 * A guard condition compiled once and evaluated many times. Instances are immutable and may be
 * evaluated from several threads at once as long as the contexts they read are not being mutated.
 */
public final class CompiledExpression {
  private final String source;
  private final ExprNode root;

  CompiledExpression(final String source, final ExprNode root) {
    this.source = source;
    this.root = root;
  }

  /**
   * Evaluates the guard against the given context. Raises
   * {@link com.github.phasegraph.GraphException.Code#UNKNOWN_IDENTIFIER} when a comparison operand
   * names a missing variable or property and
   * {@link com.github.phasegraph.GraphException.Code#NON_NUMERIC_OPERAND} when an ordering
   * operator meets a boolean or string.
   */
  public boolean evaluate(final EvaluationContext context) throws GraphException {
    return root.evaluate(context);
  }

  public String getSource() {
    return source;
  }

  @Override
  public String toString() {
    return "CompiledExpression [source=" + source + ", tree=" + root + "]";
  }
}
