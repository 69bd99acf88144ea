package com.github.phasegraph;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Turns the elements of an already-parsed graph document into the node, edge and phase edge
 * shapes a graph is built over. {@link GraphLoader} walks the document structure and hands each
 * element to the factory; referential checks stay with the graphs themselves.
 */
public interface ElementFactory<N extends IdentifiedState, E extends ActionTransition<N>, P extends GuardedTransition<N>> {

  N createNode(final JsonNode element) throws GraphException;

  E createEdge(final JsonNode element) throws GraphException;

  P createPhaseEdge(final JsonNode element) throws GraphException;

}
