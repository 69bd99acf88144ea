package com.github.phasegraph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.github.phasegraph.GraphException.Code;
import com.github.phasegraph.expression.EvaluationContext;

/**
 * A named state of a {@link StateGraph}. A node carries three independent namespaces:<br>
 * 1. params: descriptive configuration, set when the node is built and never touched again<br>
 * 2. vars: runtime variables, written by edge actions or by the host via
 * {@link #setVar(String, Value)}<br>
 * 3. properties: static identity or classification facts, readable by guards as
 * {@code properties.<name>}<br>
 */
public final class Node implements IdentifiedState, EvaluationContext {
  private final String id;
  private final Map<String, Value> params;
  private final Map<String, Value> vars;
  private final Map<String, Value> properties;

  @Override
  public String getId() {
    return id;
  }

  public boolean hasParam(final String key) {
    return params.containsKey(key);
  }

  public Optional<Value> getParam(final String key) {
    return Optional.ofNullable(params.get(key));
  }

  public Map<String, Value> getParams() {
    return Collections.unmodifiableMap(params);
  }

  public boolean hasVar(final String key) {
    return vars.containsKey(key);
  }

  public Optional<Value> getVar(final String key) {
    return Optional.ofNullable(vars.get(key));
  }

  public Map<String, Value> getVars() {
    return Collections.unmodifiableMap(vars);
  }

  public void setVar(final String key, final Value value) {
    if (key == null || value == null) {
      throw new IllegalArgumentException("Variable key and value cannot be null");
    }
    vars.put(key, value);
  }

  public boolean hasProperty(final String key) {
    return properties.containsKey(key);
  }

  public Optional<Value> getProperty(final String key) {
    return Optional.ofNullable(properties.get(key));
  }

  public Map<String, Value> getProperties() {
    return Collections.unmodifiableMap(properties);
  }

  @Override
  public Optional<Value> lookupVariable(final String name) {
    return getVar(name);
  }

  @Override
  public Optional<Value> lookupProperty(final String name) {
    return getProperty(name);
  }

  @Override
  public String toString() {
    return "Node [id=" + id + ", params=" + params + ", vars=" + vars + ", properties="
        + properties + "]";
  }

  /**
   * A simple builder to let users use fluent APIs to build nodes.
   */
  public final static class NodeBuilder {
    private final String id;
    private final Map<String, Value> params = new LinkedHashMap<>();
    private final Map<String, Value> vars = new LinkedHashMap<>();
    private final Map<String, Value> properties = new LinkedHashMap<>();

    public static NodeBuilder newBuilder(final String id) {
      return new NodeBuilder(id);
    }

    public NodeBuilder param(final String key, final Value value) {
      params.put(key, value);
      return this;
    }

    public NodeBuilder params(final Map<String, Value> params) {
      this.params.putAll(params);
      return this;
    }

    public NodeBuilder var(final String key, final Value value) {
      vars.put(key, value);
      return this;
    }

    public NodeBuilder vars(final Map<String, Value> vars) {
      this.vars.putAll(vars);
      return this;
    }

    public NodeBuilder property(final String key, final Value value) {
      properties.put(key, value);
      return this;
    }

    public NodeBuilder properties(final Map<String, Value> properties) {
      this.properties.putAll(properties);
      return this;
    }

    public Node build() throws GraphException {
      if (id == null || id.trim().isEmpty()) {
        throw new GraphException(Code.INVALID_NODE);
      }
      return new Node(id, params, vars, properties);
    }

    private NodeBuilder(final String id) {
      this.id = id;
    }
  }

  private Node(final String id, final Map<String, Value> params, final Map<String, Value> vars,
      final Map<String, Value> properties) {
    this.id = id;
    this.params = new LinkedHashMap<>(params);
    this.vars = new LinkedHashMap<>(vars);
    this.properties = new LinkedHashMap<>(properties);
  }
}
