package io.github.themoah.regdetect.stats;

/**
 * Thrown when a computation receives fewer values than it needs to produce
 * a meaningful result.
 */
public class InsufficientDataException extends RuntimeException {

  public InsufficientDataException(String message) {
    super(message);
  }
}
