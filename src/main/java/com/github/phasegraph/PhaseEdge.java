package com.github.phasegraph;

import com.github.phasegraph.GraphException.Code;
import com.github.phasegraph.expression.CompiledExpression;
import com.github.phasegraph.expression.ExpressionCompiler;

/**
 * A guarded transition between two phases of a {@link PhaseGraph}. The guard is evaluated
 * against the current node of the source phase. Phase edges carry no actions.
 * 
 * Unlike {@link Edge}, a phase edge without a compiled condition never fires.
 */
public final class PhaseEdge implements GuardedTransition<Node> {
  private final String fromId;
  private final String toId;
  private final CompiledExpression condition;

  public PhaseEdge(final String fromId, final String toId, final String conditionText)
      throws GraphException {
    this(fromId, toId, ExpressionCompiler.compile(conditionText));
  }

  public PhaseEdge(final String fromId, final String toId, final CompiledExpression condition)
      throws GraphException {
    if (fromId == null || toId == null) {
      throw new GraphException(Code.UNKNOWN_ENDPOINT, "Phase edge endpoints cannot be null");
    }
    this.fromId = fromId;
    this.toId = toId;
    this.condition = condition;
  }

  @Override
  public String getFromId() {
    return fromId;
  }

  @Override
  public String getToId() {
    return toId;
  }

  public CompiledExpression getCondition() {
    return condition;
  }

  @Override
  public boolean evaluate(final Node currentNode) throws GraphException {
    return condition != null && condition.evaluate(currentNode);
  }

  @Override
  public String toString() {
    return "PhaseEdge [fromId=" + fromId + ", toId=" + toId + ", condition="
        + (condition == null ? null : condition.getSource()) + "]";
  }
}
