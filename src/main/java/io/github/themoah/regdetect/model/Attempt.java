package io.github.themoah.regdetect.model;

import java.util.List;

/**
 * One repeated run of a benchmark at a given change.
 *
 * @param completed whether the run has finished
 * @param failed whether the run ended with an exception
 * @param resultValues values measured by the run, empty if none
 */
public record Attempt(
  boolean completed,
  boolean failed,
  List<Double> resultValues
) {

  public Attempt {
    resultValues = resultValues == null ? List.of() : List.copyOf(resultValues);
  }

  public static Attempt succeeded(List<Double> resultValues) {
    return new Attempt(true, false, resultValues);
  }

  public static Attempt failedRun() {
    return new Attempt(true, true, List.of());
  }

  public static Attempt running() {
    return new Attempt(false, false, List.of());
  }
}
