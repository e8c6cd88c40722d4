package de.ialistannen.rex.registry;

public class NotFoundException extends RegistryException {

  public NotFoundException(String message) {
    super(message);
  }
}
