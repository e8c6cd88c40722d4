package de.ialistannen.rex.oci;

/**
 * Thrown when a digest, reference or other identifier does not follow its grammar.
 */
public class ValidationException extends IllegalArgumentException {

  public ValidationException(String message) {
    super(message);
  }

  public ValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
