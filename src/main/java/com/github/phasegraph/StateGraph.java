package com.github.phasegraph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.phasegraph.GraphException.Code;

/**
 * A single-tier automaton: a set of uniquely named nodes, guarded edges between them and at most
 * one current node.
 *
 * Notes for users:<br>
 * 1. this graph is not thread-safe. If it has to be stepped from several threads, callers must
 * serialize access themselves, eg. by holding a lock around every {@link #step()}<br>
 *
 * 2. transition priority is the order in which edges were added. Out of all edges leaving the
 * current node, the first one whose guard holds fires, so overlapping guards are resolved
 * deterministically<br>
 *
 * 3. both endpoints of an edge are validated when the edge is added, never later<br>
 *
 * 4. nodes are mutated in place by edge actions and live as long as the graph, until
 * {@link #clear()}<br>
 */
public final class StateGraph<N extends IdentifiedState, E extends ActionTransition<N>> {
  private static final Logger logger = LogManager.getLogger(StateGraph.class.getSimpleName());

  private final String graphId;
  private final GraphConfiguration config;

  // K=node.id, V=position in nodes; both always change together
  private final Map<String, Integer> nodeIndex = new HashMap<>();
  private final List<N> nodes = new ArrayList<>();
  private final List<E> edges = new ArrayList<>();

  // K=from node id, V=outgoing edges in insertion order
  private final Map<String, List<E>> adjacency = new LinkedHashMap<>();

  private Optional<N> current = Optional.empty();

  public StateGraph(final String graphId) {
    this(graphId, GraphConfiguration.defaults());
  }

  public StateGraph(final String graphId, final GraphConfiguration config) {
    this.graphId = graphId;
    this.config = config == null ? GraphConfiguration.defaults() : config;
  }

  public static StateGraph<Node, Edge> newDefault(final String graphId) {
    return new StateGraph<>(graphId);
  }

  public String getId() {
    return graphId;
  }

  public GraphConfiguration getConfiguration() {
    return config;
  }

  public void addNode(final N node) throws GraphException {
    if (node == null || node.getId() == null) {
      throw new GraphException(Code.INVALID_NODE);
    }
    if (nodeIndex.containsKey(node.getId())) {
      throw new GraphException(Code.DUPLICATE_NODE, "Duplicate node id: " + node.getId());
    }
    nodeIndex.put(node.getId(), nodes.size());
    nodes.add(node);
    adjacency.put(node.getId(), new ArrayList<E>());
  }

  public void addEdge(final E edge) throws GraphException {
    if (edge == null) {
      throw new GraphException(Code.INVALID_TRANSITION);
    }
    if (!nodeIndex.containsKey(edge.getFromId()) || !nodeIndex.containsKey(edge.getToId())) {
      throw new GraphException(Code.UNKNOWN_ENDPOINT, String.format(
          "Edge references unknown node: %s->%s", edge.getFromId(), edge.getToId()));
    }
    edges.add(edge);
    adjacency.get(edge.getFromId()).add(edge);
  }

  /**
   * Make the named node current. Returns false, leaving the current node untouched, if no such
   * node exists.
   */
  public boolean setInitialState(final String nodeId) {
    final Optional<N> node = findNode(nodeId);
    if (!node.isPresent()) {
      logWarning(graphId, null, "Cannot set initial state to unknown node " + nodeId);
      return false;
    }
    current = node;
    return true;
  }

  public boolean hasCurrentState() {
    return current.isPresent();
  }

  public N currentNode() throws GraphException {
    if (!current.isPresent()) {
      throw new GraphException(Code.NO_CURRENT_STATE, "Graph " + graphId + " has no current state");
    }
    return current.get();
  }

  public String currentStateId() throws GraphException {
    return currentNode().getId();
  }

  /**
   * Advance by at most one transition. The outgoing edges of the current node are evaluated in
   * insertion order and the first one whose guard holds fires: the destination becomes current
   * and then receives the edge's actions.
   *
   * Returns the destination id, or empty if there is no current node or no guard held. In the
   * latter case the current node is unchanged, so repeated calls keep returning empty until the
   * node's data changes.
   *
   * Guard evaluation errors propagate untouched and leave the graph as it was.
   */
  public Optional<String> step() throws GraphException {
    if (!current.isPresent()) {
      return Optional.empty();
    }
    final N source = current.get();
    for (final E edge : adjacency.get(source.getId())) {
      final boolean fire;
      try {
        fire = edge.evaluate(source);
      } catch (GraphException evaluationFailure) {
        logError(graphId, source.getId(), "Failed to evaluate guard of " + edge, evaluationFailure);
        throw evaluationFailure;
      }
      if (fire) {
        final N destination = nodes.get(nodeIndex.get(edge.getToId()));
        current = Optional.of(destination);
        edge.applyActions(destination);
        logDebug(graphId, source.getId(), "Transitioned to " + destination.getId());
        return Optional.of(destination.getId());
      }
    }
    logDebug(graphId, source.getId(), "No outgoing guard held");
    return Optional.empty();
  }

  public Optional<N> findNode(final String nodeId) {
    final Integer index = nodeIndex.get(nodeId);
    return index == null ? Optional.<N>empty() : Optional.of(nodes.get(index));
  }

  public List<N> getNodes() {
    return Collections.unmodifiableList(nodes);
  }

  public List<E> getEdges() {
    return Collections.unmodifiableList(edges);
  }

  /**
   * Outgoing edges of a node in priority order; empty for unknown nodes.
   */
  public List<E> outgoingEdges(final String nodeId) {
    final List<E> outgoing = adjacency.get(nodeId);
    return outgoing == null ? Collections.<E>emptyList() : Collections.unmodifiableList(outgoing);
  }

  public void clear() {
    nodeIndex.clear();
    nodes.clear();
    edges.clear();
    adjacency.clear();
    current = Optional.empty();
  }

  /**
   * Replace the contents of this graph with a single-tier document:
   *
   * <pre>
   * { "nodes": [ {"id": .., "params"?: {..}, "vars"?: {..}, "properties"?: {..}} ],
   *   "edges": [ {"from": .., "to": .., "condition": .., "actions"?: {..}} ] }
   * </pre>
   *
   * Returns true iff the document was loaded. Any structural problem is raised and leaves the
   * graph cleared.
   */
  public boolean load(final JsonNode document, final ElementFactory<N, E, ?> factory)
      throws GraphException {
    clear();
    try {
      new GraphLoader<>(factory).populate(document, this);
    } catch (GraphException loadFailure) {
      clear();
      logError(graphId, null, "Failed to load graph document", loadFailure);
      throw loadFailure;
    }
    if (config.getSeedFirstNodeOnLoad() && !nodes.isEmpty()) {
      current = Optional.of(nodes.get(0));
    }
    logInfo(graphId, current.isPresent() ? current.get().getId() : null, String
        .format("Successfully loaded graph with %d nodes, %d edges", nodes.size(), edges.size()));
    return true;
  }

  @Override
  public String toString() {
    return "StateGraph [graphId=" + graphId + ", nodes=" + nodes.size() + ", edges=" + edges.size()
        + ", current=" + (current.isPresent() ? current.get().getId() : null) + "]";
  }

  private static void logError(final String graphId, final String stateId, final String message,
      final Throwable error) {
    logger.error(new StringBuilder().append("[g:").append(graphId).append("][s:").append(stateId)
        .append("] ").append(message).toString(), error);
  }

  private static void logWarning(final String graphId, final String stateId,
      final String message) {
    logger.warn(new StringBuilder().append("[g:").append(graphId).append("][s:").append(stateId)
        .append("] ").append(message).toString());
  }

  private static void logInfo(final String graphId, final String stateId, final String message) {
    logger.info(new StringBuilder().append("[g:").append(graphId).append("][s:").append(stateId)
        .append("] ").append(message).toString());
  }

  private static void logDebug(final String graphId, final String stateId, final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[g:").append(graphId).append("][s:").append(stateId)
          .append("] ").append(message).toString());
    }
  }
}
