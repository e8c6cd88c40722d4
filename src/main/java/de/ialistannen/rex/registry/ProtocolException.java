package de.ialistannen.rex.registry;

/**
 * The registry answered, but with something that is not valid for the distribution API.
 */
public class ProtocolException extends RegistryException {

  public ProtocolException(String message) {
    super(message);
  }

  public ProtocolException(String message, Throwable cause) {
    super(message, cause);
  }
}
