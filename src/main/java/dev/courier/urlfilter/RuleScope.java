package dev.courier.urlfilter;

/** What part of a candidate URL a compiled rule is matched against. */
public enum RuleScope {

  /** Matched against the candidate's netloc ({@code host} or {@code host:port}); any scheme. */
  HOST,

  /** Matched against the full candidate string; always carries a {@link Scheme} constraint. */
  URL
}
