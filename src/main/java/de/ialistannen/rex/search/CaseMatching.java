package de.ialistannen.rex.search;

/**
 * How letter case is treated when matching.
 */
public enum CaseMatching {
  IGNORE,
  /**
   * Ignores case unless the query contains an upper case letter.
   */
  SMART,
  RESPECT;

  boolean ignoresCase(String query) {
    return switch (this) {
      case IGNORE -> true;
      case RESPECT -> false;
      case SMART -> query.chars().noneMatch(Character::isUpperCase);
    };
  }
}
