package dev.courier.attachment;

import dev.courier.urlfilter.RuleSet;
import dev.courier.urlfilter.UrlFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the {@link UrlFilter} that guards remote attachments.
 *
 * <p>The filter is compiled once at startup from {@link AttachmentProperties}; a configuration
 * change takes effect on restart, which compiles a fresh filter.
 */
@Configuration
public class AttachmentConfig {

  private static final Logger log = LoggerFactory.getLogger(AttachmentConfig.class);

  @Bean
  public UrlFilter attachmentUrlFilter(AttachmentProperties properties) {
    UrlFilter filter =
        new UrlFilter(
            properties.getAllowUrls(), properties.getDenyUrls(), properties.getMaxUrlLength());

    logRejected("allow", filter.allowRules());
    logRejected("deny", filter.denyRules());
    log.info(
        "Attachment URL filter compiled: {} allow rule(s), {} deny rule(s)",
        filter.allowRules().size(),
        filter.denyRules().size());
    if (filter.allowRules().isEmpty()) {
      log.warn("Attachment allow list is empty; every remote attachment will be rejected");
    }
    return filter;
  }

  private static void logRejected(String list, RuleSet rules) {
    for (String token : rules.rejectedTokens()) {
      log.warn("Ignoring malformed attachment {} entry: {}", list, token);
    }
  }
}
