package com.github.phasegraph.expression;

import java.util.Optional;

import com.github.phasegraph.Value;

/**
 * The data a compiled guard reads from. Bare identifiers resolve through
 * {@link #lookupVariable(String)}, {@code properties.<name>} identifiers through
 * {@link #lookupProperty(String)}.
 */
public interface EvaluationContext {

  Optional<Value> lookupVariable(final String name);

  Optional<Value> lookupProperty(final String name);

}
