package com.github.phasegraph;

/**
 * Anything a {@link StateGraph} can hold as a state. Ids are unique within their owning graph.
 */
public interface IdentifiedState {

  String getId();

}
