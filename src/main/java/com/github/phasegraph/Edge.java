package com.github.phasegraph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.github.phasegraph.GraphException.Code;
import com.github.phasegraph.expression.CompiledExpression;
import com.github.phasegraph.expression.ExpressionCompiler;

/**
 * A guarded transition between two nodes of the same {@link StateGraph}. When it fires, every
 * action is written as a variable on the destination node.
 * 
 * Edges are immutable once built. An edge constructed without a compiled condition always fires.
 */
public final class Edge implements ActionTransition<Node> {
  private final String fromId;
  private final String toId;
  private final CompiledExpression condition;
  private final Map<String, Value> actions;

  public Edge(final String fromId, final String toId, final String conditionText,
      final Map<String, Value> actions) throws GraphException {
    this(fromId, toId, ExpressionCompiler.compile(conditionText), actions);
  }

  public Edge(final String fromId, final String toId, final CompiledExpression condition,
      final Map<String, Value> actions) throws GraphException {
    if (fromId == null || toId == null) {
      throw new GraphException(Code.UNKNOWN_ENDPOINT, "Edge endpoints cannot be null");
    }
    this.fromId = fromId;
    this.toId = toId;
    this.condition = condition;
    this.actions = actions == null ? Collections.<String, Value>emptyMap()
        : Collections.unmodifiableMap(new LinkedHashMap<>(actions));
  }

  @Override
  public String getFromId() {
    return fromId;
  }

  @Override
  public String getToId() {
    return toId;
  }

  /**
   * Null when the edge was built without a guard.
   */
  public CompiledExpression getCondition() {
    return condition;
  }

  public Map<String, Value> getActions() {
    return actions;
  }

  @Override
  public boolean evaluate(final Node source) throws GraphException {
    return condition == null || condition.evaluate(source);
  }

  @Override
  public void applyActions(final Node destination) {
    for (Map.Entry<String, Value> action : actions.entrySet()) {
      destination.setVar(action.getKey(), action.getValue());
    }
  }

  @Override
  public String toString() {
    return "Edge [fromId=" + fromId + ", toId=" + toId + ", condition="
        + (condition == null ? null : condition.getSource()) + ", actions=" + actions + "]";
  }
}
