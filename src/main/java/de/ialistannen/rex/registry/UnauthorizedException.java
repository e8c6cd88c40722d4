package de.ialistannen.rex.registry;

public class UnauthorizedException extends RegistryException {

  private final int statusCode;

  public UnauthorizedException(String resource, int statusCode) {
    super("Access to '" + resource + "' was denied with status " + statusCode);
    this.statusCode = statusCode;
  }

  public int statusCode() {
    return statusCode;
  }
}
