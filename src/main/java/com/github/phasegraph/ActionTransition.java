package com.github.phasegraph;

/**
 * A node-level transition that, once selected, applies its side effects to the state it lands
 * on.
 */
public interface ActionTransition<N extends IdentifiedState> extends GuardedTransition<N> {

  void applyActions(final N destination);

}
