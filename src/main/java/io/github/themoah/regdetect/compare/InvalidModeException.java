package io.github.themoah.regdetect.compare;

/**
 * Thrown when a comparison is requested with an unrecognized mode name.
 */
public class InvalidModeException extends IllegalArgumentException {

  public InvalidModeException(String mode) {
    super("Unrecognized comparison mode: '" + mode + "', expected 'functional' or 'performance'");
  }
}
