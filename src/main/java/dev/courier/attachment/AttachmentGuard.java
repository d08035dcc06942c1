package dev.courier.attachment;

import dev.courier.urlfilter.UrlFilter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Gate that every attachment reference from a notification payload passes before any outbound
 * fetch is issued.
 *
 * <p>Only {@code http://} and {@code https://} references are accepted, and only when the
 * configured {@link UrlFilter} allows them. A denied reference aborts the request with {@link
 * AttachmentRejectedException}; the fetch is never attempted.
 */
@Service
public class AttachmentGuard {

  private static final Logger log = LoggerFactory.getLogger(AttachmentGuard.class);

  private final UrlFilter urlFilter;

  public AttachmentGuard(UrlFilter urlFilter) {
    this.urlFilter = urlFilter;
  }

  /**
   * Verify a single attachment reference.
   *
   * @param attachment the raw payload value
   * @return the trimmed URL, safe to fetch
   * @throws IllegalArgumentException if the value is not a non-blank http(s) URL string
   * @throws AttachmentRejectedException if the URL filter refuses the URL
   */
  public String verify(@Nullable Object attachment) {
    if (!(attachment instanceof String raw) || raw.isBlank()) {
      throw new IllegalArgumentException("Bad attachment");
    }
    String url = raw.strip();
    if (!isRemote(url)) {
      throw new IllegalArgumentException(
          "Attachments must be referenced by an http:// or https:// URL");
    }
    if (!urlFilter.isAllowed(url)) {
      log.warn("Rejected attachment URL: {}", url);
      throw new AttachmentRejectedException(url);
    }
    return url;
  }

  /**
   * Verify every attachment reference, in order, stopping at the first failure.
   *
   * @param attachments raw payload values, may be null
   * @return the verified URLs in payload order
   */
  public List<String> verifyAll(@Nullable List<?> attachments) {
    if (attachments == null) {
      return List.of();
    }
    List<String> verified = new ArrayList<>(attachments.size());
    for (Object attachment : attachments) {
      verified.add(verify(attachment));
    }
    return List.copyOf(verified);
  }

  private static boolean isRemote(String url) {
    String lower = url.toLowerCase(Locale.ROOT);
    return lower.startsWith("http://") || lower.startsWith("https://");
  }
}
