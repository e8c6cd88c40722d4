package de.ialistannen.rex.registry;

/**
 * Base class for everything that can go wrong talking to a registry.
 */
public abstract class RegistryException extends RuntimeException {

  protected RegistryException(String message) {
    super(message);
  }

  protected RegistryException(String message, Throwable cause) {
    super(message, cause);
  }
}
