package com.github.phasegraph;

/**
 * A directed, guarded transition. The guard is evaluated against a state of type N; where the
 * endpoints live depends on the tier: node ids inside a {@link StateGraph}, phase ids inside a
 * {@link PhaseGraph}.
 */
public interface GuardedTransition<N extends IdentifiedState> {

  String getFromId();

  String getToId();

  /**
   * Returns true iff this transition may fire given the current state. Evaluation is read-only.
   */
  boolean evaluate(final N source) throws GraphException;

}
