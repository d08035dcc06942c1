package dev.courier.urlfilter;

import com.google.re2j.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * One compiled allow or deny entry.
 *
 * @param token the lower-cased source token, kept for diagnostics
 * @param pattern anchored, case-insensitive pattern
 * @param scope whether the pattern targets the netloc or the full URL
 * @param scheme the scheme constraint; {@code null} for {@link RuleScope#HOST} rules
 * @param portConstrained {@code true} if the token named an explicit port
 */
public record UrlRule(
    String token,
    Pattern pattern,
    RuleScope scope,
    @Nullable Scheme scheme,
    boolean portConstrained) {

  /**
   * Test this rule against a candidate.
   *
   * @param url the original candidate string, used by URL-scoped rules
   * @param netloc {@code host} or {@code host:port}, used by host-scoped rules
   * @return true if the rule matches
   */
  public boolean matches(String url, String netloc) {
    String subject = scope == RuleScope.URL ? url : netloc;
    return pattern.matcher(subject).matches();
  }
}
