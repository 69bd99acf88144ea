package com.github.phasegraph;

/**
 * Unified single exception that's thrown and handled by the graph engine. The code enum
 * encapsulates the various failure conditions: guard compilation, guard evaluation, document
 * loading and state lookups. Stack traces and causes, where available, are not kept from users.
 */
public final class GraphException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;

  public GraphException(final Code code) {
    super(code.getDescription());
    this.code = code;
  }

  public GraphException(final Code code, final String message) {
    super(message);
    this.code = code;
  }

  public GraphException(final Code code, final String message, final Throwable throwable) {
    super(message, throwable);
    this.code = code;
  }

  public Code getCode() {
    return code;
  }

  public static enum Code {
    // 1.
    COMPILE_FAILURE("Guard expression failed to compile"),
    // 2.
    UNKNOWN_IDENTIFIER("Comparison operand references an unknown variable or property"),
    // 3.
    NON_NUMERIC_OPERAND("Ordering comparison requires numeric operands"),
    // 4.
    INVALID_NODE("Node id cannot be null or blank"),
    // 5.
    DUPLICATE_NODE("Node id is already declared in this graph"),
    // 6.
    DUPLICATE_PHASE("Phase id is already declared in this phase graph"),
    // 7.
    UNKNOWN_ENDPOINT("Transition or initial state references an undeclared node or phase"),
    // 8.
    MISSING_FIELD("Document element is missing a required field"),
    // 9.
    UNSUPPORTED_VALUE_TYPE("Value maps only accept integer, float, boolean or string scalars"),
    // 10.
    MALFORMED_DOCUMENT("Document element has an unexpected shape"),
    // 11.
    NO_CURRENT_STATE("Graph has no current state"),
    // 12.
    NO_CURRENT_PHASE("Phase graph has no current phase"),
    // 13.
    INVALID_GRAPH_CONFIG("Graph configuration is invalid"),
    // 14.
    INVALID_TRANSITION("Edge or phase edge cannot be null"),
    // 15.
    INVALID_PHASE("Phase id and graph cannot be null");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
