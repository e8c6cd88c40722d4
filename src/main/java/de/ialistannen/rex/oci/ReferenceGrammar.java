package de.ialistannen.rex.oci;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * The distribution reference grammar, composed from its named parts.
 */
final class ReferenceGrammar {

  static final int MAX_NAME_LENGTH = 255;

  private static final String ALPHA_NUMERIC = "[a-z0-9]+";
  private static final String SEPARATOR = "(?:[._]|__|[-]+)";
  private static final String PATH_COMPONENT = ALPHA_NUMERIC + "(?:" + SEPARATOR + ALPHA_NUMERIC + ")*";

  private static final String DOMAIN_NAME_COMPONENT = "(?:[a-zA-Z0-9]|[a-zA-Z0-9][a-zA-Z0-9-]*[a-zA-Z0-9])";
  private static final String DOMAIN_NAME = DOMAIN_NAME_COMPONENT + "(?:\\." + DOMAIN_NAME_COMPONENT + ")*";
  private static final String IPV6_ADDRESS = "\\[[a-fA-F0-9:]+\\]";
  private static final String HOST = "(?:" + DOMAIN_NAME + "|" + IPV6_ADDRESS + ")";
  private static final String DOMAIN = HOST + "(?::[0-9]+)?";

  private static final String TAG = "[\\w][\\w.-]{0,127}";

  static final Pattern PATH_COMPONENT_PATTERN = Pattern.compile(PATH_COMPONENT);
  static final Pattern DOMAIN_PATTERN = Pattern.compile(DOMAIN);
  static final Pattern TAG_PATTERN = Pattern.compile(TAG);

  private ReferenceGrammar() {
    throw new UnsupportedOperationException("No instantiation");
  }

  /**
   * Docker treats the first path component as a registry if it could not possibly be a repository path.
   *
   * @param component the first slash-separated component of a name
   * @return true if it should be read as a registry host
   */
  static boolean looksLikeDomain(String component) {
    return component.contains(".")
      || component.contains(":")
      || component.equals("localhost")
      || !component.equals(component.toLowerCase(Locale.ROOT));
  }
}
