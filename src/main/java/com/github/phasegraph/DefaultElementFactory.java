package com.github.phasegraph;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.phasegraph.GraphException.Code;

/**
 * Builds {@link Node}, {@link Edge} and {@link PhaseEdge} from document elements. Value maps
 * accept JSON-native scalars only: integers in the 64-bit range, floats, booleans and strings.
 */
public final class DefaultElementFactory implements ElementFactory<Node, Edge, PhaseEdge> {
  private static final DefaultElementFactory instance = new DefaultElementFactory();

  public static DefaultElementFactory getInstance() {
    return instance;
  }

  @Override
  public Node createNode(final JsonNode element) throws GraphException {
    return Node.NodeBuilder.newBuilder(requiredText(element, "id", "node"))
        .params(valueMap(element, "params")).vars(valueMap(element, "vars"))
        .properties(valueMap(element, "properties")).build();
  }

  @Override
  public Edge createEdge(final JsonNode element) throws GraphException {
    return new Edge(requiredText(element, "from", "edge"), requiredText(element, "to", "edge"),
        requiredText(element, "condition", "edge"), valueMap(element, "actions"));
  }

  @Override
  public PhaseEdge createPhaseEdge(final JsonNode element) throws GraphException {
    return new PhaseEdge(requiredText(element, "from", "phase edge"),
        requiredText(element, "to", "phase edge"), requiredText(element, "condition", "phase edge"));
  }

  static String requiredText(final JsonNode element, final String field, final String what)
      throws GraphException {
    if (element == null || !element.isObject()) {
      throw new GraphException(Code.MALFORMED_DOCUMENT, what + " must be an object: " + element);
    }
    final JsonNode text = element.get(field);
    if (text == null || text.isNull()) {
      throw new GraphException(Code.MISSING_FIELD, what + " is missing '" + field + "': " + element);
    }
    if (!text.isTextual()) {
      throw new GraphException(Code.MALFORMED_DOCUMENT,
          what + " field '" + field + "' must be a string: " + element);
    }
    return text.asText();
  }

  /**
   * Reads an optional object of scalars. Absent means empty.
   */
  static Map<String, Value> valueMap(final JsonNode element, final String field)
      throws GraphException {
    final Map<String, Value> values = new LinkedHashMap<>();
    final JsonNode map = element.get(field);
    if (map == null) {
      return values;
    }
    if (!map.isObject()) {
      throw new GraphException(Code.MALFORMED_DOCUMENT, "'" + field + "' must be an object: " + map);
    }
    final Iterator<Map.Entry<String, JsonNode>> entries = map.fields();
    while (entries.hasNext()) {
      final Map.Entry<String, JsonNode> entry = entries.next();
      values.put(entry.getKey(), toValue(entry.getKey(), entry.getValue()));
    }
    return values;
  }

  static Value toValue(final String key, final JsonNode scalar) throws GraphException {
    if (scalar.isIntegralNumber()) {
      if (!scalar.canConvertToLong()) {
        throw new GraphException(Code.UNSUPPORTED_VALUE_TYPE,
            "Integer out of 64-bit range for '" + key + "': " + scalar);
      }
      return Value.of(scalar.longValue());
    }
    if (scalar.isFloatingPointNumber()) {
      return Value.of(scalar.doubleValue());
    }
    if (scalar.isBoolean()) {
      return Value.of(scalar.booleanValue());
    }
    if (scalar.isTextual()) {
      return Value.of(scalar.textValue());
    }
    throw new GraphException(Code.UNSUPPORTED_VALUE_TYPE,
        "Unsupported value type " + scalar.getNodeType() + " for '" + key + "'");
  }

  private DefaultElementFactory() {}
}
