package com.github.phasegraph.expression;

import com.github.phasegraph.GraphException;
import com.github.phasegraph.GraphException.Code;

/**
 * Entry point of the guard language. Compilation fails fast: any malformed input raises
 * {@link Code#COMPILE_FAILURE} and nothing partially compiled is ever returned.
 */
public final class ExpressionCompiler {

  public static CompiledExpression compile(final String conditionText) throws GraphException {
    if (conditionText == null) {
      throw new GraphException(Code.COMPILE_FAILURE, "Null expression");
    }
    return new CompiledExpression(conditionText, new Parser(conditionText).parse());
  }

  private ExpressionCompiler() {}
}
