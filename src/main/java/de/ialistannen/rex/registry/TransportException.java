package de.ialistannen.rex.registry;

/**
 * Connection failures, timeouts and server side errors.
 */
public class TransportException extends RegistryException {

  public TransportException(String message) {
    super(message);
  }

  public TransportException(String message, Throwable cause) {
    super(message, cause);
  }
}
