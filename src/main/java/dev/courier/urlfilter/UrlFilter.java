package dev.courier.urlfilter;

import java.util.Optional;
import org.jspecify.annotations.Nullable;

/**
 * Decides whether a remote URL may be fetched, from an allow list and a deny list.
 *
 * <p>Both lists are compiled once by {@link TokenClassifier} and never change afterwards; build a
 * new filter to apply a new configuration. Evaluation:
 *
 * <ol>
 *   <li>Reject anything that is not a parseable URL, exceeds the length bound, or contains
 *       whitespace or control characters
 *   <li>Reject if any deny rule matches (deny always wins)
 *   <li>Accept if any allow rule matches
 *   <li>Reject otherwise
 * </ol>
 *
 * <p>URL-scoped rules are matched against the candidate exactly as given, host-scoped rules against
 * its netloc. Instances are immutable and safe to share between threads.
 */
public final class UrlFilter {

  /** Candidates longer than this are rejected before any pattern runs. */
  public static final int DEFAULT_MAX_CANDIDATE_LENGTH = 4096;

  private final RuleSet allowRules;
  private final RuleSet denyRules;
  private final int maxCandidateLength;

  /**
   * @param allowSpec allow-list tokens, may be null or empty (allows nothing)
   * @param denySpec deny-list tokens, may be null or empty
   */
  public UrlFilter(@Nullable String allowSpec, @Nullable String denySpec) {
    this(allowSpec, denySpec, DEFAULT_MAX_CANDIDATE_LENGTH);
  }

  public UrlFilter(
      @Nullable String allowSpec, @Nullable String denySpec, int maxCandidateLength) {
    if (maxCandidateLength < 1) {
      throw new IllegalArgumentException(
          "maxCandidateLength must be positive, got: " + maxCandidateLength);
    }
    this.allowRules = TokenClassifier.compile(allowSpec);
    this.denyRules = TokenClassifier.compile(denySpec);
    this.maxCandidateLength = maxCandidateLength;
  }

  /**
   * Check an untyped value, typically an entry taken from a JSON payload. Anything that is not a
   * {@link String} is rejected.
   *
   * @param candidate the value to check
   * @return true only for a string URL accepted by {@link #isAllowed(String)}
   */
  public boolean isAllowed(@Nullable Object candidate) {
    return candidate instanceof String url && isAllowed(url);
  }

  /**
   * Check a candidate URL against the deny rules, then the allow rules.
   *
   * @param url the candidate, e.g. {@code https://example.com/a.png} or {@code example.com:8080}
   * @return true if the URL is explicitly allowed and not denied
   */
  public boolean isAllowed(@Nullable String url) {
    if (url == null
        || url.isEmpty()
        || url.length() > maxCandidateLength
        || containsSpaceOrControl(url)) {
      return false;
    }
    Optional<ParsedUrl> parsed = UrlParser.parse(url);
    if (parsed.isEmpty()) {
      return false;
    }
    String netloc = parsed.get().netloc();

    if (denyRules.anyMatch(url, netloc)) {
      return false;
    }
    return allowRules.anyMatch(url, netloc);
  }

  // URL rules see the raw candidate, so it must already be what the parser reads.
  private static boolean containsSpaceOrControl(String url) {
    return url.codePoints()
        .anyMatch(
            c ->
                Character.isWhitespace(c)
                    || Character.isSpaceChar(c)
                    || Character.isISOControl(c)
                    || Character.getType(c) == Character.FORMAT);
  }

  public RuleSet allowRules() {
    return allowRules;
  }

  public RuleSet denyRules() {
    return denyRules;
  }

  public int maxCandidateLength() {
    return maxCandidateLength;
  }

  @Override
  public String toString() {
    return "UrlFilter[allow=" + allowRules.size() + " rules, deny=" + denyRules.size() + " rules]";
  }
}
