package io.github.fiserro.mep;

import java.util.function.Function;

/**
 * Generic calculator interface for the MEP modules.
 * Extends Function to allow use in functional pipelines.
 *
 * @param <I> the input record type
 * @param <R> the result record type
 */
public interface Calculator<I, R> extends Function<I, R> {

  R calculate(I input);

  @Override
  default R apply(I input) {
    return calculate(input);
  }
}
