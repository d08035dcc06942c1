package dev.courier.urlfilter;

/** Scheme constraint carried by a {@link RuleScope#URL} rule. */
public enum Scheme {
  HTTP("http"),
  HTTPS("https"),

  /** The token had a path but no explicit scheme; both http and https match. */
  EITHER("https?");

  private final String regex;

  Scheme(String regex) {
    this.regex = regex;
  }

  String regex() {
    return regex;
  }
}
