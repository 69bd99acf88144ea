package com.github.phasegraph;

/**
 * This class encapsulates all the configuration parameters for a {@link StateGraph} or
 * {@link PhaseGraph}. Use the {@code GraphConfigurationBuilder} to build it.
 *
 * Notes:<br>
 * 1. seedFirstNodeOnLoad makes the first declared node of a single-tier document current once
 * it is loaded. It defaults to true. Phases are never seeded this way, they only use their
 * initial_state.<br>
 * 2. routeCapacity bounds the in-memory transcript of recent steps kept in
 * {@link GraphStatistics}. If it is not set, or set to a non-positive value, a default of 100
 * entries is used. Anything above {@link #maxRouteCapacity} is rejected.<br>
 */
public final class GraphConfiguration {
  static final int defaultRouteCapacity = 100;
  static final int maxRouteCapacity = 10_000;

  private final boolean seedFirstNodeOnLoad;
  private final int routeCapacity;

  public static GraphConfiguration defaults() {
    return new GraphConfiguration(true, defaultRouteCapacity);
  }

  public boolean getSeedFirstNodeOnLoad() {
    return seedFirstNodeOnLoad;
  }

  public int getRouteCapacity() {
    return routeCapacity;
  }

  public final static class GraphConfigurationBuilder {
    private boolean seedFirstNodeOnLoad = true;
    private int routeCapacity;

    public static GraphConfigurationBuilder newBuilder() {
      return new GraphConfigurationBuilder();
    }

    public GraphConfigurationBuilder seedFirstNodeOnLoad(final boolean seedFirstNodeOnLoad) {
      this.seedFirstNodeOnLoad = seedFirstNodeOnLoad;
      return this;
    }

    public GraphConfigurationBuilder routeCapacity(final int routeCapacity) {
      this.routeCapacity = routeCapacity;
      return this;
    }

    public GraphConfiguration build() throws GraphException {
      final GraphConfiguration config = new GraphConfiguration(seedFirstNodeOnLoad, routeCapacity);
      config.validate();
      return config;
    }

    private GraphConfigurationBuilder() {}
  }

  private void validate() throws GraphException {
    if (routeCapacity > maxRouteCapacity) {
      throw new GraphException(GraphException.Code.INVALID_GRAPH_CONFIG,
          "routeCapacity cannot exceed " + maxRouteCapacity + ", was " + routeCapacity);
    }
  }

  @Override
  public String toString() {
    return "GraphConfiguration [seedFirstNodeOnLoad=" + seedFirstNodeOnLoad + ", routeCapacity="
        + routeCapacity + "]";
  }

  private GraphConfiguration(final boolean seedFirstNodeOnLoad, final int routeCapacity) {
    this.seedFirstNodeOnLoad = seedFirstNodeOnLoad;
    if (routeCapacity <= 0) {
      this.routeCapacity = defaultRouteCapacity;
    } else {
      this.routeCapacity = routeCapacity;
    }
  }

}
