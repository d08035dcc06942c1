package dev.courier.urlfilter;

import com.google.re2j.Pattern;
import java.util.Optional;

/**
 * Translates a single lower-cased token into an anchored, case-insensitive {@link UrlRule}.
 *
 * <p>Wildcards: {@code *} matches any run of characters and {@code ?} exactly one character. In a
 * host position {@code ?} is restricted to {@code [A-Za-z0-9_-]}; in a path position it is any
 * character except {@code /}. Everything else is matched literally. Within a URL token the host
 * {@code *} never crosses a {@code :} or {@code /}, so a rule without a port cannot match a ported
 * candidate.
 *
 * <p>Patterns are compiled with RE2/J, which matches in time linear in the candidate length
 * however many wildcards a rule carries. Case folding covers all of Unicode and {@code .} also
 * matches line terminators.
 *
 * <p>Path suffix handling for URL tokens:
 *
 * <ul>
 *   <li>none or {@code /} - any path, or none
 *   <li>ends with {@code *} - the prefix followed by exactly one more segment and an optional
 *       trailing slash
 *   <li>ends with {@code /} - the path with or without the slash, plus anything below it
 *   <li>otherwise - the exact path, or the path followed by {@code /} and anything below it
 * </ul>
 */
public final class WildcardCompiler {

  private static final Pattern PORT = Pattern.compile("\\d{1,5}");

  private static final String HOST_CHAR = "[A-Za-z0-9_-]";

  /** Where a wildcard appears; decides what {@code *} and {@code ?} expand to. */
  enum Position {
    HOST(".*", HOST_CHAR),
    URL_HOST("[^/:]*", HOST_CHAR),
    PATH(".*", "[^/]");

    private final String many;
    private final String one;

    Position(String many, String one) {
      this.many = many;
      this.one = one;
    }
  }

  private WildcardCompiler() {
    // utility class
  }

  /**
   * Compile a host-scoped token such as {@code localhost}, {@code 127.0.*} or {@code
   * myserver:3000}. The pattern is matched against the candidate's netloc, so a token without a
   * port only matches port-less candidates (unless a {@code *} absorbs the port).
   *
   * @param token lower-cased token without scheme or path
   * @return the rule, or empty if the host part is missing
   */
  public static Optional<UrlRule> compileHost(String token) {
    if (token.isEmpty() || token.startsWith(":")) {
      return Optional.empty();
    }
    String regex = "^" + translate(token, Position.HOST) + "$";
    return Optional.of(
        new UrlRule(token, compile(regex), RuleScope.HOST, null, token.indexOf(':') >= 0));
  }

  /**
   * Compile a URL-scoped token.
   *
   * @param token the full lower-cased token, kept on the rule
   * @param scheme the scheme the rule is restricted to
   * @param remainder the token with any {@code scheme://} prefix removed
   * @return the rule, or empty if the host is missing or the port is not numeric
   */
  public static Optional<UrlRule> compileUrl(String token, Scheme scheme, String remainder) {
    int slash = remainder.indexOf('/');
    String netloc = slash < 0 ? remainder : remainder.substring(0, slash);
    String path = slash < 0 ? "" : remainder.substring(slash);

    String host = netloc;
    String port = null;
    int colon = netloc.indexOf(':');
    if (colon >= 0) {
      host = netloc.substring(0, colon);
      port = netloc.substring(colon + 1);
    }
    if (host.isEmpty() || (port != null && !PORT.matcher(port).matches())) {
      return Optional.empty();
    }

    StringBuilder regex = new StringBuilder("^");
    regex.append(scheme.regex()).append("://");
    regex.append(translate(host, Position.URL_HOST));
    if (port != null) {
      regex.append(':').append(port);
    }
    regex.append(pathRegex(path)).append('$');

    return Optional.of(
        new UrlRule(token, compile(regex.toString()), RuleScope.URL, scheme, port != null));
  }

  static String pathRegex(String path) {
    if (path.isEmpty() || path.equals("/")) {
      return "(/.*)?";
    }
    if (path.endsWith("*")) {
      return translate(path.substring(0, path.length() - 1), Position.PATH) + "[^/]+/?";
    }
    if (path.endsWith("/")) {
      return translate(stripTrailingSlashes(path), Position.PATH) + "(/.*)?";
    }
    return translate(path, Position.PATH) + "(/.*)?";
  }

  static String translate(String text, Position position) {
    StringBuilder regex = new StringBuilder(text.length() * 2);
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      switch (c) {
        case '*' -> regex.append(position.many);
        case '?' -> regex.append(position.one);
        default -> appendLiteral(regex, c);
      }
    }
    return regex.toString();
  }

  private static void appendLiteral(StringBuilder regex, char c) {
    // All regex metacharacters are ASCII punctuation.
    if (c < 0x80 && !Character.isLetterOrDigit(c)) {
      regex.append('\\');
    }
    regex.append(c);
  }

  private static String stripTrailingSlashes(String path) {
    int end = path.length();
    while (end > 0 && path.charAt(end - 1) == '/') {
      end--;
    }
    return path.substring(0, end);
  }

  private static Pattern compile(String regex) {
    return Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
  }
}
