package dev.courier.urlfilter;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * Lenient-in-form, strict-in-content URL parser used to derive the netloc of filter candidates.
 *
 * <p>Accepts full URLs, bare host names and {@code host:port} pairs (scheme defaults to {@code
 * http}). Fails on empty input, invalid host names, whitespace in the authority and any port that
 * is not a number in 1..65535.
 */
public final class UrlParser {

  private static final String DEFAULT_SCHEME = "http";

  private static final Pattern SCHEME =
      Pattern.compile("^([a-z][a-z0-9+.-]*)://(.*)$", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

  private static final Pattern LABEL =
      Pattern.compile("[a-z0-9_]([a-z0-9_-]{0,61}[a-z0-9_])?", Pattern.CASE_INSENSITIVE);

  private static final Pattern IPV6 =
      Pattern.compile("\\[[0-9a-f:.]{2,45}\\]", Pattern.CASE_INSENSITIVE);

  private static final Pattern PORT = Pattern.compile("\\d{1,5}");

  private static final int MAX_HOSTNAME_LENGTH = 253;

  private UrlParser() {
    // utility class
  }

  /**
   * Parse a candidate string.
   *
   * @param input the raw candidate, may be null
   * @return the parsed URL, or empty if the input is not a usable URL
   */
  public static Optional<ParsedUrl> parse(@Nullable String input) {
    if (input == null) {
      return Optional.empty();
    }
    String url = input.strip();
    if (url.isEmpty()) {
      return Optional.empty();
    }

    String scheme = DEFAULT_SCHEME;
    String rest = url;
    Matcher schemeMatcher = SCHEME.matcher(url);
    if (schemeMatcher.matches()) {
      scheme = schemeMatcher.group(1).toLowerCase(Locale.ROOT);
      rest = schemeMatcher.group(2);
    }

    int authorityEnd = indexOfAny(rest, "/?#");
    String authority = authorityEnd < 0 ? rest : rest.substring(0, authorityEnd);
    String remainder = authorityEnd < 0 ? "" : rest.substring(authorityEnd);

    int at = authority.lastIndexOf('@');
    if (at >= 0) {
      authority = authority.substring(at + 1);
    }
    if (authority.isEmpty() || containsWhitespaceOrControl(authority)) {
      return Optional.empty();
    }

    String host;
    String portText = null;
    if (authority.startsWith("[")) {
      int close = authority.indexOf(']');
      if (close < 0) {
        return Optional.empty();
      }
      host = authority.substring(0, close + 1);
      String tail = authority.substring(close + 1);
      if (!tail.isEmpty()) {
        if (!tail.startsWith(":")) {
          return Optional.empty();
        }
        portText = tail.substring(1);
      }
      if (!IPV6.matcher(host).matches()) {
        return Optional.empty();
      }
    } else {
      int colon = authority.indexOf(':');
      host = colon < 0 ? authority : authority.substring(0, colon);
      portText = colon < 0 ? null : authority.substring(colon + 1);
      if (!isHostname(host)) {
        return Optional.empty();
      }
    }

    Integer port = null;
    if (portText != null) {
      if (!PORT.matcher(portText).matches()) {
        return Optional.empty();
      }
      port = Integer.valueOf(portText);
      if (port < 1 || port > 65535) {
        return Optional.empty();
      }
    }

    int pathEnd = indexOfAny(remainder, "?#");
    String path = pathEnd < 0 ? remainder : remainder.substring(0, pathEnd);

    return Optional.of(new ParsedUrl(scheme, host, port, path));
  }

  /**
   * Check a host name: dot-separated labels of {@code [A-Za-z0-9_-]}, 1-63 characters each, not
   * starting or ending with a dash. A single trailing dot is tolerated. Dotted IPv4 addresses pass
   * as host names.
   */
  static boolean isHostname(String host) {
    String name = host.endsWith(".") ? host.substring(0, host.length() - 1) : host;
    if (name.isEmpty() || name.length() > MAX_HOSTNAME_LENGTH) {
      return false;
    }
    for (String label : name.split("\\.", -1)) {
      if (!LABEL.matcher(label).matches()) {
        return false;
      }
    }
    return true;
  }

  private static boolean containsWhitespaceOrControl(String text) {
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (Character.isWhitespace(c) || Character.isISOControl(c)) {
        return true;
      }
    }
    return false;
  }

  private static int indexOfAny(String text, String chars) {
    for (int i = 0; i < text.length(); i++) {
      if (chars.indexOf(text.charAt(i)) >= 0) {
        return i;
      }
    }
    return -1;
  }
}
