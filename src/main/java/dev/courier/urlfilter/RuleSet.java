package dev.courier.urlfilter;

import java.util.List;

/**
 * Ordered rules compiled from one specification string.
 *
 * <p>Order only affects how early a match short-circuits, never the outcome. Tokens that could not
 * be compiled are kept in {@link #rejectedTokens()} so the owner can report them.
 */
public record RuleSet(List<UrlRule> rules, List<String> rejectedTokens) {

  public RuleSet {
    rules = rules == null ? List.of() : List.copyOf(rules);
    rejectedTokens = rejectedTokens == null ? List.of() : List.copyOf(rejectedTokens);
  }

  /** A rule set that matches nothing. */
  public static RuleSet empty() {
    return new RuleSet(List.of(), List.of());
  }

  /** Returns true if any rule matches the candidate URL or its netloc. */
  public boolean anyMatch(String url, String netloc) {
    for (UrlRule rule : rules) {
      if (rule.matches(url, netloc)) {
        return true;
      }
    }
    return false;
  }

  public boolean isEmpty() {
    return rules.isEmpty();
  }

  public int size() {
    return rules.size();
  }
}
