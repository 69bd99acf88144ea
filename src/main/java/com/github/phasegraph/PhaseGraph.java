package com.github.phasegraph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.phasegraph.GraphException.Code;

/**
 * A two-tier automaton. The outer tier is an ordered set of named phases, each one a
 * {@link StateGraph}, linked by guarded phase edges; the inner tier is the current node of the
 * current phase.
 *
 * Notes for users:<br>
 * 0. determinism is the most important virtue of this graph: given the same document and the same
 * host writes, the same sequence of steps always produces the same transcript<br>
 *
 * 1. this graph is not thread-safe and holds no lock. Hosts stepping it from several threads must
 * serialize every {@link #step()} themselves. Compiled guards are immutable and safe to share<br>
 *
 * 2. a compound step first steps the current phase's graph, which may apply edge actions, and
 * only then scans the phase edges against the node it landed on. Phase guards therefore always
 * see the actions applied within the same step<br>
 *
 * 3. at most one phase edge fires per step, there is no chaining<br>
 *
 * 4. phases keep their current node across phase switches. A switch seeds a phase from its
 * initial state only while its graph has no current node; {@link #setInitialPhase(String)}
 * always reseeds<br>
 *
 * 5. load failures are raised, never reported through a false return, and always leave the graph
 * cleared<br>
 */
public final class PhaseGraph<N extends IdentifiedState, E extends ActionTransition<N>, P extends GuardedTransition<N>> {
  private static final Logger logger = LogManager.getLogger(PhaseGraph.class.getSimpleName());

  private final String graphId = UUID.randomUUID().toString();
  private final GraphConfiguration config;
  private final GraphLoader<N, E, P> loader;
  private final GraphStatistics statistics;

  // K=phase.id, V=position in phases
  private final Map<String, Integer> phaseIndex = new HashMap<>();
  private final List<Phase<N, E>> phases = new ArrayList<>();
  private final List<P> phaseEdges = new ArrayList<>();

  // K=from phase id, V=outgoing phase edges in insertion order
  private final Map<String, List<P>> phaseAdjacency = new LinkedHashMap<>();

  private Optional<Phase<N, E>> currentPhase = Optional.empty();

  public PhaseGraph(final GraphConfiguration config, final ElementFactory<N, E, P> factory) {
    this.config = config == null ? GraphConfiguration.defaults() : config;
    this.loader = new GraphLoader<>(factory);
    this.statistics = new GraphStatistics(graphId, this.config.getRouteCapacity());
  }

  public static PhaseGraph<Node, Edge, PhaseEdge> newDefault() {
    return newDefault(GraphConfiguration.defaults());
  }

  public static PhaseGraph<Node, Edge, PhaseEdge> newDefault(final GraphConfiguration config) {
    return new PhaseGraph<>(config, DefaultElementFactory.getInstance());
  }

  public String getId() {
    return graphId;
  }

  public GraphConfiguration getConfiguration() {
    return config;
  }

  public GraphStatistics getStatistics() {
    return statistics;
  }

  /**
   * Register a phase. The initial state is optional but, when given, must name a node of the
   * phase's graph. Adding a phase never makes it current.
   */
  public void addPhase(final String phaseId, final StateGraph<N, E> graph,
      final String initialState) throws GraphException {
    if (phaseId == null || graph == null) {
      throw new GraphException(Code.INVALID_PHASE);
    }
    if (phaseIndex.containsKey(phaseId)) {
      throw new GraphException(Code.DUPLICATE_PHASE, "Duplicate phase id: " + phaseId);
    }
    if (initialState != null && !graph.findNode(initialState).isPresent()) {
      throw new GraphException(Code.UNKNOWN_ENDPOINT,
          "Initial state " + initialState + " of phase " + phaseId + " is not a declared node");
    }
    phaseIndex.put(phaseId, phases.size());
    phases.add(new Phase<>(phaseId, graph, Optional.ofNullable(initialState)));
    phaseAdjacency.put(phaseId, new ArrayList<P>());
  }

  public void addPhaseEdge(final P phaseEdge) throws GraphException {
    if (phaseEdge == null) {
      throw new GraphException(Code.INVALID_TRANSITION);
    }
    if (!phaseIndex.containsKey(phaseEdge.getFromId())
        || !phaseIndex.containsKey(phaseEdge.getToId())) {
      throw new GraphException(Code.UNKNOWN_ENDPOINT, String.format(
          "Phase edge references unknown phase: %s->%s", phaseEdge.getFromId(),
          phaseEdge.getToId()));
    }
    phaseEdges.add(phaseEdge);
    phaseAdjacency.get(phaseEdge.getFromId()).add(phaseEdge);
  }

  /**
   * Replace the contents of this graph with a phase document:
   *
   * <pre>
   * { "phases": [ {"id": .., "initial_state"?: .., "nodes"?: [..], "edges"?: [..]} ],
   *   "phase_edges"?: [ {"from": .., "to": .., "condition": ..} ] }
   * </pre>
   *
   * The first declared phase becomes current. Returns true iff the document was loaded; every
   * failure is raised and leaves this graph cleared.
   */
  public boolean load(final JsonNode document) throws GraphException {
    clear();
    try {
      loader.populate(document, this);
    } catch (GraphException loadFailure) {
      clear();
      logError(graphId, null, "Failed to load phase document", loadFailure);
      throw loadFailure;
    }
    if (!phases.isEmpty()) {
      final Phase<N, E> first = phases.get(0);
      currentPhase = Optional.of(first);
      first.seedIfUnset();
    }
    logInfo(graphId, currentPhase.isPresent() ? currentPhase.get().getId() : null,
        String.format("Successfully loaded %d phases, %d phase edges", phases.size(),
            phaseEdges.size()));
    return true;
  }

  /**
   * Make the named phase current and restart it from its initial state, even if it was visited
   * before. A phase without an initial state keeps its current node. Returns false if no such
   * phase exists.
   */
  public boolean setInitialPhase(final String phaseId) {
    final Optional<Phase<N, E>> phase = findPhase(phaseId);
    if (!phase.isPresent()) {
      logWarning(graphId, null, "Cannot select unknown phase " + phaseId);
      return false;
    }
    currentPhase = phase;
    phase.get().reseed();
    logInfo(graphId, phaseId, "Selected initial phase");
    return true;
  }

  /**
   * One compound step:<br>
   * 1. step the current phase's graph, possibly moving to another node and applying actions<br>
   * 2. scan the current phase's outgoing phase edges in insertion order against the node the
   * graph is now on<br>
   * 3. on the first guard that holds, switch to the target phase, seed it if it has no current
   * node, and stop scanning<br>
   *
   * Returns empty only when there is no current phase. A step where nothing moved still returns a
   * result with both flags false. Guard evaluation errors propagate to the caller.
   */
  public Optional<StepResult> step() throws GraphException {
    if (!currentPhase.isPresent()) {
      return Optional.empty();
    }
    final Phase<N, E> phase = currentPhase.get();
    final StateGraph<N, E> graph = phase.getGraph();
    boolean phaseChanged = false;
    final boolean stateChanged;
    try {
      stateChanged = graph.step().isPresent();
      if (graph.hasCurrentState()) {
        phaseChanged = scanPhaseEdges(phase, graph.currentNode());
      }
    } catch (GraphException evaluationFailure) {
      statistics.evaluationFailures++;
      throw evaluationFailure;
    }
    final Phase<N, E> landed = currentPhase.get();
    final StepResult result = new StepResult(phaseChanged, stateChanged, landed.getId(),
        landed.getGraph().hasCurrentState() ? landed.getGraph().currentStateId() : null);
    statistics.record(result);
    logDebug(graphId, landed.getId(), result.toString());
    return Optional.of(result);
  }

  private boolean scanPhaseEdges(final Phase<N, E> phase, final N node) throws GraphException {
    for (final P phaseEdge : phaseAdjacency.get(phase.getId())) {
      final boolean fire;
      try {
        fire = phaseEdge.evaluate(node);
      } catch (GraphException evaluationFailure) {
        logError(graphId, phase.getId(),
            "Failed to evaluate phase guard of " + phaseEdge + " on node " + node.getId(),
            evaluationFailure);
        throw evaluationFailure;
      }
      if (fire) {
        final Phase<N, E> target = phases.get(phaseIndex.get(phaseEdge.getToId()));
        currentPhase = Optional.of(target);
        target.seedIfUnset();
        logInfo(graphId, target.getId(),
            String.format("Switched phase %s->%s", phase.getId(), target.getId()));
        return true;
      }
    }
    return false;
  }

  public boolean hasCurrentPhase() {
    return currentPhase.isPresent();
  }

  public String currentPhaseId() throws GraphException {
    return current().getId();
  }

  public String currentStateId() throws GraphException {
    return current().getGraph().currentStateId();
  }

  public N currentNode() throws GraphException {
    return current().getGraph().currentNode();
  }

  public Optional<Phase<N, E>> findPhase(final String phaseId) {
    final Integer index = phaseIndex.get(phaseId);
    return index == null ? Optional.<Phase<N, E>>empty() : Optional.of(phases.get(index));
  }

  public List<Phase<N, E>> getPhases() {
    return Collections.unmodifiableList(phases);
  }

  public List<P> getPhaseEdges() {
    return Collections.unmodifiableList(phaseEdges);
  }

  public List<P> outgoingPhaseEdges(final String phaseId) {
    final List<P> outgoing = phaseAdjacency.get(phaseId);
    return outgoing == null ? Collections.<P>emptyList() : Collections.unmodifiableList(outgoing);
  }

  public void clear() {
    phaseIndex.clear();
    phases.clear();
    phaseEdges.clear();
    phaseAdjacency.clear();
    currentPhase = Optional.empty();
    statistics.reset();
  }

  private Phase<N, E> current() throws GraphException {
    if (!currentPhase.isPresent()) {
      throw new GraphException(Code.NO_CURRENT_PHASE);
    }
    return currentPhase.get();
  }

  @Override
  public String toString() {
    return "PhaseGraph [graphId=" + graphId + ", phases=" + phases.size() + ", phaseEdges="
        + phaseEdges.size() + ", currentPhase="
        + (currentPhase.isPresent() ? currentPhase.get().getId() : null) + "]";
  }

  private static void logError(final String graphId, final String phaseId, final String message,
      final Throwable error) {
    logger.error(new StringBuilder().append("[g:").append(graphId).append("][p:").append(phaseId)
        .append("] ").append(message).toString(), error);
  }

  private static void logWarning(final String graphId, final String phaseId,
      final String message) {
    logger.warn(new StringBuilder().append("[g:").append(graphId).append("][p:").append(phaseId)
        .append("] ").append(message).toString());
  }

  private static void logInfo(final String graphId, final String phaseId, final String message) {
    logger.info(new StringBuilder().append("[g:").append(graphId).append("][p:").append(phaseId)
        .append("] ").append(message).toString());
  }

  private static void logDebug(final String graphId, final String phaseId, final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[g:").append(graphId).append("][p:").append(phaseId)
          .append("] ").append(message).toString());
    }
  }
}
