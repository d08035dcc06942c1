package dev.courier.urlfilter;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * Splits a specification string into tokens and routes each one to the {@link WildcardCompiler}.
 *
 * <p>Tokens are separated by any run of commas and/or whitespace and lower-cased. A token is
 * URL-scoped when it starts with {@code http://} or {@code https://} (explicit scheme) or contains a
 * {@code /} (either scheme); everything else is a host-scoped {@code host} or {@code host:port}.
 */
public final class TokenClassifier {

  private static final Pattern SEPARATORS =
      Pattern.compile("[\\s,]+", Pattern.UNICODE_CHARACTER_CLASS);

  private static final String HTTP_PREFIX = "http://";
  private static final String HTTPS_PREFIX = "https://";

  private TokenClassifier() {
    // utility class
  }

  /**
   * Compile every token of a specification. Never throws; malformed tokens end up in {@link
   * RuleSet#rejectedTokens()}.
   *
   * @param specification comma/whitespace separated tokens, may be null or blank
   * @return the compiled rules, empty for an empty specification
   */
  public static RuleSet compile(@Nullable String specification) {
    if (specification == null || specification.isBlank()) {
      return RuleSet.empty();
    }
    List<UrlRule> rules = new ArrayList<>();
    List<String> rejected = new ArrayList<>();
    for (String token : SEPARATORS.split(specification.strip().toLowerCase(Locale.ROOT))) {
      if (token.isEmpty()) {
        continue;
      }
      Optional<UrlRule> rule = compileToken(token);
      if (rule.isPresent()) {
        rules.add(rule.get());
      } else {
        rejected.add(token);
      }
    }
    return new RuleSet(rules, rejected);
  }

  static Optional<UrlRule> compileToken(String token) {
    if (token.startsWith(HTTP_PREFIX)) {
      return WildcardCompiler.compileUrl(token, Scheme.HTTP, token.substring(HTTP_PREFIX.length()));
    }
    if (token.startsWith(HTTPS_PREFIX)) {
      return WildcardCompiler.compileUrl(
          token, Scheme.HTTPS, token.substring(HTTPS_PREFIX.length()));
    }
    if (token.indexOf('/') >= 0) {
      return WildcardCompiler.compileUrl(token, Scheme.EITHER, token);
    }
    return WildcardCompiler.compileHost(token);
  }
}
