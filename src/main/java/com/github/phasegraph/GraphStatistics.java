package com.github.phasegraph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Simple statistics holder for a {@link PhaseGraph}. Besides counters it keeps a bounded route
 * of the most recent compound steps; once the capacity is reached the oldest entry is dropped.
 * Nothing here outlives the graph.
 */
public final class GraphStatistics {
  private final String graphId;
  private final int routeCapacity;
  private final long startMillis = System.currentTimeMillis();

  long totalSteps;
  long stateTransitions;
  long phaseSwitches;
  long idleSteps;
  long evaluationFailures;
  private final Deque<RouteEntry> boundedRoute = new ArrayDeque<>();

  GraphStatistics(final String graphId, final int routeCapacity) {
    this.graphId = graphId;
    this.routeCapacity = routeCapacity;
  }

  void record(final StepResult result) {
    totalSteps++;
    if (result.isStateChanged()) {
      stateTransitions++;
    }
    if (result.isPhaseChanged()) {
      phaseSwitches++;
    }
    if (!result.isStateChanged() && !result.isPhaseChanged()) {
      idleSteps++;
    }
    if (boundedRoute.size() >= routeCapacity) {
      boundedRoute.removeFirst();
    }
    final RouteEntry entry = new RouteEntry();
    entry.phaseId = result.getPhaseId();
    entry.stateId = result.getStateId().orElse(null);
    entry.phaseChanged = result.isPhaseChanged();
    entry.stateChanged = result.isStateChanged();
    entry.stepMillis = System.currentTimeMillis();
    boundedRoute.addLast(entry);
  }

  void reset() {
    totalSteps = 0L;
    stateTransitions = 0L;
    phaseSwitches = 0L;
    idleSteps = 0L;
    evaluationFailures = 0L;
    boundedRoute.clear();
  }

  public String getGraphId() {
    return graphId;
  }

  public long getTotalSteps() {
    return totalSteps;
  }

  public long getStateTransitions() {
    return stateTransitions;
  }

  public long getPhaseSwitches() {
    return phaseSwitches;
  }

  public long getIdleSteps() {
    return idleSteps;
  }

  public long getEvaluationFailures() {
    return evaluationFailures;
  }

  public long getAliveTimeMillis() {
    return System.currentTimeMillis() - startMillis;
  }

  /**
   * Recent steps, oldest first.
   */
  public List<RouteEntry> getRoute() {
    return Collections.unmodifiableList(new ArrayList<>(boundedRoute));
  }

  @Override
  public String toString() {
    return "GraphStatistics [graphId=" + graphId + ", totalSteps=" + totalSteps
        + ", stateTransitions=" + stateTransitions + ", phaseSwitches=" + phaseSwitches
        + ", idleSteps=" + idleSteps + ", evaluationFailures=" + evaluationFailures
        + ", aliveTimeMillis=" + getAliveTimeMillis() + "]";
  }

  public final static class RouteEntry {
    String phaseId;
    String stateId;
    boolean phaseChanged;
    boolean stateChanged;
    long stepMillis;

    public String getPhaseId() {
      return phaseId;
    }

    public String getStateId() {
      return stateId;
    }

    public boolean isPhaseChanged() {
      return phaseChanged;
    }

    public boolean isStateChanged() {
      return stateChanged;
    }

    public long getStepMillis() {
      return stepMillis;
    }

    @Override
    public String toString() {
      return "RouteEntry [phaseId=" + phaseId + ", stateId=" + stateId + ", phaseChanged="
          + phaseChanged + ", stateChanged=" + stateChanged + "]";
    }
  }

}
