package com.github.phasegraph;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.phasegraph.GraphException.Code;

/**
 * Maps an already-parsed document tree onto graphs. Element shapes are delegated to an
 * {@link ElementFactory}; this class walks the document and enforces its structure:<br>
 * 1. single-tier documents need both a "nodes" and an "edges" array<br>
 * 2. phase documents need a "phases" array; "nodes", "edges" and "initial_state" of a phase and
 * the top-level "phase_edges" are optional<br>
 * 3. all nodes of a graph are added before its first edge, so an edge may name any node of the
 * same graph but never an undeclared one<br>
 *
 * Every violation is raised. Callers are responsible for clearing the target graph on failure.
 */
final class GraphLoader<N extends IdentifiedState, E extends ActionTransition<N>, P extends GuardedTransition<N>> {
  private final ElementFactory<N, E, P> factory;

  GraphLoader(final ElementFactory<N, E, P> factory) {
    this.factory = factory;
  }

  void populate(final JsonNode document, final StateGraph<N, E> graph) throws GraphException {
    expectObject(document, "graph document");
    final JsonNode nodes = array(document, "nodes", true);
    final JsonNode edges = array(document, "edges", true);
    addElements(nodes, edges, graph);
  }

  void populate(final JsonNode document, final PhaseGraph<N, E, P> phaseGraph)
      throws GraphException {
    expectObject(document, "phase document");
    for (final JsonNode phaseElement : array(document, "phases", true)) {
      final String phaseId = DefaultElementFactory.requiredText(phaseElement, "id", "phase");
      if (phaseGraph.findPhase(phaseId).isPresent()) {
        throw new GraphException(Code.DUPLICATE_PHASE, "Duplicate phase id: " + phaseId);
      }
      final StateGraph<N, E> graph = new StateGraph<>(phaseId, phaseGraph.getConfiguration());
      addElements(array(phaseElement, "nodes", false), array(phaseElement, "edges", false), graph);
      String initialState = null;
      if (phaseElement.has("initial_state")) {
        initialState =
            DefaultElementFactory.requiredText(phaseElement, "initial_state", "phase " + phaseId);
      }
      phaseGraph.addPhase(phaseId, graph, initialState);
    }
    final JsonNode phaseEdges = array(document, "phase_edges", false);
    if (phaseEdges != null) {
      for (final JsonNode phaseEdgeElement : phaseEdges) {
        phaseGraph.addPhaseEdge(factory.createPhaseEdge(phaseEdgeElement));
      }
    }
  }

  private void addElements(final JsonNode nodes, final JsonNode edges,
      final StateGraph<N, E> graph) throws GraphException {
    if (nodes != null) {
      for (final JsonNode nodeElement : nodes) {
        graph.addNode(factory.createNode(nodeElement));
      }
    }
    if (edges != null) {
      for (final JsonNode edgeElement : edges) {
        graph.addEdge(factory.createEdge(edgeElement));
      }
    }
  }

  /**
   * Returns null when an optional array is absent.
   */
  private static JsonNode array(final JsonNode parent, final String field, final boolean required)
      throws GraphException {
    final JsonNode array = parent.get(field);
    if (array == null) {
      if (required) {
        throw new GraphException(Code.MISSING_FIELD, "Missing '" + field + "' array");
      }
      return null;
    }
    if (!array.isArray()) {
      throw new GraphException(Code.MALFORMED_DOCUMENT, "'" + field + "' must be an array");
    }
    return array;
  }

  private static void expectObject(final JsonNode document, final String what)
      throws GraphException {
    if (document == null || !document.isObject()) {
      throw new GraphException(Code.MALFORMED_DOCUMENT, what + " must be an object");
    }
  }
}
