package de.ialistannen.rex.registry;

import java.time.Duration;
import java.util.Optional;

public class RateLimitedException extends RegistryException {

  private final Optional<Duration> retryAfter;

  public RateLimitedException(String resource, Optional<Duration> retryAfter) {
    super(
      "Rate limited while fetching '" + resource + "'"
        + retryAfter.map(it -> ", retry after " + it.toSeconds() + "s").orElse("")
    );
    this.retryAfter = retryAfter;
  }

  /**
   * @return how long the registry asked us to wait, if it told us
   */
  public Optional<Duration> retryAfter() {
    return retryAfter;
  }
}
