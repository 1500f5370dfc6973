package io.github.themoah.regdetect.changepoint;

/**
 * Thrown when an {@link AnomalyConfig} holds out-of-range or wrongly typed values.
 */
public class InvalidConfigException extends RuntimeException {

  public InvalidConfigException(String message) {
    super(message);
  }
}
