package dev.courier.urlfilter;

import org.jspecify.annotations.Nullable;

/**
 * Structured view of a candidate URL, produced per call by {@link UrlParser} and never stored.
 *
 * @param scheme lower-cased scheme, {@code http} when the input had none
 * @param host host name or IP literal as written
 * @param port explicit port, or {@code null} when the input had none
 * @param path path component without query or fragment, possibly empty
 */
public record ParsedUrl(String scheme, String host, @Nullable Integer port, String path) {

  /** {@code host:port} when a port was given, otherwise {@code host}. */
  public String netloc() {
    return port != null ? host + ":" + port : host;
  }
}
