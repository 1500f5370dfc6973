package io.github.themoah.regdetect.model;

/**
 * One point of a benchmark series: the revision it was measured at and the value.
 */
public record DataPoint(
  long revision,
  double value
) {}
