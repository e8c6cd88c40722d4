package de.ialistannen.rex.fetch;

/**
 * Recorded for tasks that never ran.
 */
public class SkippedTaskException extends RuntimeException {

  private final Reason reason;

  public SkippedTaskException(Reason reason, String item) {
    super(describe(reason, item));
    this.reason = reason;
  }

  private static String describe(Reason reason, String item) {
    return switch (reason) {
      case CANCELLED -> "Skipped '" + item + "' as the batch was cancelled";
      case UNAUTHORIZED -> "Skipped '" + item + "' as access to a sibling was denied";
    };
  }

  public Reason reason() {
    return reason;
  }

  public enum Reason {
    CANCELLED,
    UNAUTHORIZED
  }
}
