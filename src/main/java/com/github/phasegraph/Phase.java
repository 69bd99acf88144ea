package com.github.phasegraph;

import java.util.Optional;

/**
 * A named single-tier graph acting as one state of a {@link PhaseGraph}. The optional initial
 * state seeds the graph's current node the first time the phase becomes current; a phase switch
 * afterwards resumes wherever it was left, while an explicit
 * {@link PhaseGraph#setInitialPhase(String)} restarts it.
 */
public final class Phase<N extends IdentifiedState, E extends ActionTransition<N>> {
  private final String id;
  private final StateGraph<N, E> graph;
  private final Optional<String> initialState;

  Phase(final String id, final StateGraph<N, E> graph, final Optional<String> initialState) {
    this.id = id;
    this.graph = graph;
    this.initialState = initialState;
  }

  public String getId() {
    return id;
  }

  public StateGraph<N, E> getGraph() {
    return graph;
  }

  public Optional<String> getInitialState() {
    return initialState;
  }

  /**
   * Seed the graph from the initial state if the graph has no current node yet. Returns true iff
   * the current node was set by this call.
   */
  boolean seedIfUnset() {
    if (graph.hasCurrentState() || !initialState.isPresent()) {
      return false;
    }
    return graph.setInitialState(initialState.get());
  }

  /**
   * Put the graph back on the initial state, whatever its current node. Without an initial state
   * the graph is left as it is.
   */
  boolean reseed() {
    if (!initialState.isPresent()) {
      return false;
    }
    return graph.setInitialState(initialState.get());
  }

  @Override
  public String toString() {
    return "Phase [id=" + id + ", initialState=" + initialState.orElse(null) + ", graph=" + graph
        + "]";
  }
}
