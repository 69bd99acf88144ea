package com.github.phasegraph;

import static com.github.phasegraph.StateGraphTest.resource;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

import org.junit.Test;

import com.github.phasegraph.GraphException.Code;
import com.github.phasegraph.GraphStatistics.RouteEntry;
import com.github.phasegraph.expression.CompiledExpression;

/**
 * Tests to maintain the sanity and correctness of compound (phase + node) stepping.
 */
public class PhaseGraphTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  @Test
  public void testLoadSelectsFirstPhaseAndSeedsOnlyIt() throws Exception {
    final PhaseGraph<Node, Edge, PhaseEdge> graph = PhaseGraph.newDefault();
    assertTrue(graph.load(resource("score-phases.json")));
    assertEquals("phase1", graph.currentPhaseId());
    assertEquals("start", graph.currentStateId());
    assertEquals(2, graph.getPhases().size());
    assertEquals(1, graph.getPhaseEdges().size());
    // other phases are seeded when they become current
    assertFalse(graph.findPhase("phase2").get().getGraph().hasCurrentState());
    assertEquals(Optional.of("begin"), graph.findPhase("phase2").get().getInitialState());
  }

  @Test
  public void testActionsAreVisibleToThePhaseScanOfTheSameStep() throws Exception {
    final PhaseGraph<Node, Edge, PhaseEdge> graph = PhaseGraph.newDefault();
    graph.load(resource("score-phases.json"));

    // start->middle writes score=50 on middle, the phase guard score >= 50 then sees it
    final StepResult first = graph.step().get();
    assertTrue(first.isStateChanged());
    assertTrue(first.isPhaseChanged());
    assertEquals("phase2", first.getPhaseId());
    assertEquals(Optional.of("begin"), first.getStateId());
    assertEquals(Value.of(50L),
        graph.findPhase("phase1").get().getGraph().currentNode().getVar("score").get());

    final StepResult second = graph.step().get();
    assertTrue(second.isStateChanged());
    assertFalse(second.isPhaseChanged());
    assertEquals("phase2", second.getPhaseId());
    assertEquals(Optional.of("finish"), second.getStateId());
  }

  @Test
  public void testEdgeActionsOverwriteEarlierHostWrites() throws Exception {
    final PhaseGraph<Node, Edge, PhaseEdge> graph = PhaseGraph.newDefault();
    graph.load(resource("score-phases.json"));
    graph.findPhase("phase1").get().getGraph().findNode("middle").get().setVar("score",
        Value.of(49L));
    final StepResult result = graph.step().get();
    // the edge action overwrites the host value before the phase scan runs
    assertTrue(result.isPhaseChanged());
    assertEquals("phase2", result.getPhaseId());
  }

  @Test
  public void testNoMovementStillReportsAResult() throws Exception {
    final PhaseGraph<Node, Edge, PhaseEdge> graph = PhaseGraph.newDefault();
    graph.load(resource("score-phases.json"));
    graph.step();
    graph.step();
    for (int i = 0; i < 3; i++) {
      final Optional<StepResult> idle = graph.step();
      assertTrue(idle.isPresent());
      assertFalse(idle.get().isPhaseChanged());
      assertFalse(idle.get().isStateChanged());
      assertEquals("phase2", idle.get().getPhaseId());
      assertEquals(Optional.of("finish"), idle.get().getStateId());
    }
  }

  @Test
  public void testGameScenarioResumesPhasesOnReentry() throws Exception {
    final PhaseGraph<Node, Edge, PhaseEdge> graph = PhaseGraph.newDefault();
    graph.load(resource("game-phases.json"));
    assertEquals("menu", graph.currentPhaseId());
    assertEquals("main_menu", graph.currentStateId());

    assertStep(graph.step(), false, false, "menu", "main_menu");

    graph.currentNode().setVar("selection", Value.of(2L));
    assertStep(graph.step(), true, true, "game", "playing");
    assertEquals(Value.of(3L), graph.currentNode().getVar("lives").get());
    assertEquals(Value.of("arena"), graph.currentNode().getProperty("kind").get());

    assertStep(graph.step(), false, false, "game", "playing");

    graph.currentNode().setVar("lives", Value.of(0L));
    assertStep(graph.step(), true, true, "end", "results");

    // restart is compared before anyone declared it
    try {
      graph.step();
      fail("Expected evaluation failure");
    } catch (GraphException expected) {
      assertEquals(Code.UNKNOWN_IDENTIFIER, expected.getCode());
    }
    assertEquals("end", graph.currentPhaseId());
    assertEquals("results", graph.currentStateId());

    graph.currentNode().setVar("restart", Value.of(true));
    // menu is resumed where it was left, not reseeded to main_menu
    assertStep(graph.step(), true, false, "menu", "start_game");
    assertStep(graph.step(), true, false, "game", "game_over");
    assertStep(graph.step(), true, false, "end", "results");

    final GraphStatistics statistics = graph.getStatistics();
    assertEquals(7L, statistics.getTotalSteps());
    assertEquals(5L, statistics.getPhaseSwitches());
    assertEquals(2L, statistics.getStateTransitions());
    assertEquals(2L, statistics.getIdleSteps());
    assertEquals(1L, statistics.getEvaluationFailures());
  }

  @Test
  public void testFirstPhaseEdgeWinsAndTransitionsDoNotChain() throws GraphException {
    final PhaseGraph<Node, Edge, PhaseEdge> graph = PhaseGraph.newDefault();
    graph.addPhase("a", singleNodeGraph("a", "a0"), "a0");
    graph.addPhase("b", singleNodeGraph("b", "b0"), "b0");
    graph.addPhase("c", singleNodeGraph("c", "c0"), "c0");
    graph.addPhaseEdge(new PhaseEdge("a", "c", "false"));
    graph.addPhaseEdge(new PhaseEdge("a", "b", "true"));
    graph.addPhaseEdge(new PhaseEdge("a", "c", "true"));
    graph.addPhaseEdge(new PhaseEdge("b", "c", "true"));
    assertFalse(graph.hasCurrentPhase());
    assertTrue(graph.setInitialPhase("a"));

    assertStep(graph.step(), true, false, "b", "b0");
    assertStep(graph.step(), true, false, "c", "c0");
    assertStep(graph.step(), false, false, "c", "c0");
    assertEquals(3, graph.outgoingPhaseEdges("a").size());
    assertTrue(graph.outgoingPhaseEdges("ghost").isEmpty());
  }

  @Test
  public void testPhaseEdgeWithoutConditionNeverFires() throws GraphException {
    final PhaseGraph<Node, Edge, PhaseEdge> graph = PhaseGraph.newDefault();
    graph.addPhase("a", singleNodeGraph("a", "a0"), "a0");
    graph.addPhase("b", singleNodeGraph("b", "b0"), "b0");
    graph.addPhaseEdge(new PhaseEdge("a", "b", (CompiledExpression) null));
    graph.setInitialPhase("a");
    assertStep(graph.step(), false, false, "a", "a0");
  }

  @Test
  public void testSetInitialPhaseRestartsVisitedPhases() throws Exception {
    final PhaseGraph<Node, Edge, PhaseEdge> graph = PhaseGraph.newDefault();
    graph.load(resource("score-phases.json"));

    // phase1 leaves start behind and the switch seeds phase2
    assertStep(graph.step(), true, true, "phase2", "begin");
    assertEquals("middle", graph.findPhase("phase1").get().getGraph().currentStateId());

    assertTrue(graph.setInitialPhase("phase1"));
    assertEquals("phase1", graph.currentPhaseId());
    assertEquals("start", graph.currentStateId());

    assertTrue(graph.setInitialPhase("phase2"));
    assertEquals("begin", graph.currentStateId());
    graph.step();
    assertEquals("finish", graph.currentStateId());
    assertTrue(graph.setInitialPhase("phase1"));
    assertTrue(graph.setInitialPhase("phase2"));
    assertEquals("begin", graph.currentStateId());

    assertFalse(graph.setInitialPhase("nonexistent"));
    assertEquals("phase2", graph.currentPhaseId());
    assertEquals("begin", graph.currentStateId());
  }

  @Test
  public void testSetInitialPhaseWithoutInitialStateKeepsCurrentNode() throws GraphException {
    final PhaseGraph<Node, Edge, PhaseEdge> graph = PhaseGraph.newDefault();
    final StateGraph<Node, Edge> free = StateGraph.newDefault("free");
    free.addNode(Node.NodeBuilder.newBuilder("x0").build());
    free.addNode(Node.NodeBuilder.newBuilder("x1").build());
    free.addEdge(new Edge("x0", "x1", "true", null));
    graph.addPhase("free", free, null);
    graph.addPhase("idle", new StateGraph<Node, Edge>("idle"), null);

    assertTrue(graph.setInitialPhase("free"));
    assertFalse(free.hasCurrentState());
    free.setInitialState("x0");
    assertStep(graph.step(), false, true, "free", "x1");

    assertTrue(graph.setInitialPhase("idle"));
    assertTrue(graph.setInitialPhase("free"));
    assertEquals("x1", graph.currentStateId());
  }

  @Test
  public void testPhaseWithoutCurrentNodeSkipsThePhaseScan() throws GraphException {
    final PhaseGraph<Node, Edge, PhaseEdge> graph = PhaseGraph.newDefault();
    graph.addPhase("void", new StateGraph<Node, Edge>("void"), null);
    graph.addPhase("next", singleNodeGraph("next", "n0"), "n0");
    graph.addPhaseEdge(new PhaseEdge("void", "next", "true"));
    graph.setInitialPhase("void");

    final StepResult result = graph.step().get();
    assertFalse(result.isPhaseChanged());
    assertFalse(result.isStateChanged());
    assertEquals("void", result.getPhaseId());
    assertFalse(result.getStateId().isPresent());
    try {
      graph.currentNode();
      fail("Expected no current state");
    } catch (GraphException expected) {
      assertEquals(Code.NO_CURRENT_STATE, expected.getCode());
    }
  }

  @Test
  public void testNoCurrentPhase() throws GraphException {
    final PhaseGraph<Node, Edge, PhaseEdge> graph = PhaseGraph.newDefault();
    assertFalse(graph.step().isPresent());
    try {
      graph.currentPhaseId();
      fail("Expected no current phase");
    } catch (GraphException expected) {
      assertEquals(Code.NO_CURRENT_PHASE, expected.getCode());
    }
    try {
      graph.currentStateId();
      fail("Expected no current phase");
    } catch (GraphException expected) {
      assertEquals(Code.NO_CURRENT_PHASE, expected.getCode());
    }
  }

  @Test
  public void testProgrammaticReferentialIntegrity() throws GraphException {
    final PhaseGraph<Node, Edge, PhaseEdge> graph = PhaseGraph.newDefault();
    graph.addPhase("a", singleNodeGraph("a", "a0"), null);
    try {
      graph.addPhase("a", singleNodeGraph("a", "a1"), null);
      fail("Expected duplicate phase failure");
    } catch (GraphException expected) {
      assertEquals(Code.DUPLICATE_PHASE, expected.getCode());
    }
    try {
      graph.addPhase("b", singleNodeGraph("b", "b0"), "nowhere");
      fail("Expected unknown initial state failure");
    } catch (GraphException expected) {
      assertEquals(Code.UNKNOWN_ENDPOINT, expected.getCode());
    }
    try {
      graph.addPhaseEdge(new PhaseEdge("a", "b", "true"));
      fail("Expected unknown phase failure");
    } catch (GraphException expected) {
      assertEquals(Code.UNKNOWN_ENDPOINT, expected.getCode());
    }
    try {
      graph.addPhase(null, singleNodeGraph("c", "c0"), null);
      fail("Expected invalid phase failure");
    } catch (GraphException expected) {
      assertEquals(Code.INVALID_PHASE, expected.getCode());
    }
    try {
      graph.addPhase("c", null, null);
      fail("Expected invalid phase failure");
    } catch (GraphException expected) {
      assertEquals(Code.INVALID_PHASE, expected.getCode());
    }
    try {
      graph.addPhaseEdge(null);
      fail("Expected invalid transition failure");
    } catch (GraphException expected) {
      assertEquals(Code.INVALID_TRANSITION, expected.getCode());
    }
    assertEquals(1, graph.getPhases().size());
    assertTrue(graph.getPhaseEdges().isEmpty());
  }

  @Test
  public void testRouteIsBounded() throws Exception {
    final GraphConfiguration config =
        GraphConfiguration.GraphConfigurationBuilder.newBuilder().routeCapacity(2).build();
    final PhaseGraph<Node, Edge, PhaseEdge> graph = PhaseGraph.newDefault(config);
    graph.load(resource("score-phases.json"));
    graph.step();
    graph.step();
    graph.step();

    final List<RouteEntry> route = graph.getStatistics().getRoute();
    assertEquals(2, route.size());
    assertEquals("finish", route.get(0).getStateId());
    assertTrue(route.get(0).isStateChanged());
    assertEquals("finish", route.get(1).getStateId());
    assertFalse(route.get(1).isStateChanged());
    assertEquals(3L, graph.getStatistics().getTotalSteps());

    // reloading starts a fresh transcript
    graph.load(resource("score-phases.json"));
    assertTrue(graph.getStatistics().getRoute().isEmpty());
    assertEquals(0L, graph.getStatistics().getTotalSteps());
  }

  private static StateGraph<Node, Edge> singleNodeGraph(final String graphId, final String nodeId)
      throws GraphException {
    final StateGraph<Node, Edge> graph = StateGraph.newDefault(graphId);
    graph.addNode(Node.NodeBuilder.newBuilder(nodeId).build());
    graph.addEdge(new Edge(nodeId, nodeId, "false", Collections.<String, Value>emptyMap()));
    return graph;
  }

  private static void assertStep(final Optional<StepResult> step, final boolean phaseChanged,
      final boolean stateChanged, final String phaseId, final String stateId) {
    assertTrue(step.isPresent());
    final StepResult result = step.get();
    assertEquals("phaseChanged of " + result, phaseChanged, result.isPhaseChanged());
    assertEquals("stateChanged of " + result, stateChanged, result.isStateChanged());
    assertEquals(phaseId, result.getPhaseId());
    assertEquals(Optional.of(stateId), result.getStateId());
  }

}
