package dev.courier.attachment;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for remote attachment access control.
 *
 * <p>Properties are bound from {@code courier.attach.*} in application.yml, or from the environment
 * ({@code ATTACH_ALLOW_URL} / {@code ATTACH_DENY_URL} are mapped in application.yml).
 *
 * <ul>
 *   <li>{@code allow-urls} - allow-list tokens separated by commas and/or whitespace (default
 *       {@code *})
 *   <li>{@code deny-urls} - deny-list tokens, checked before the allow list (default {@code 127.0.*
 *       localhost*})
 *   <li>{@code max-url-length} - longest candidate URL that is evaluated at all (default 4096,
 *       bounded [64, 65536])
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}.
 */
@Configuration
@ConfigurationProperties(prefix = "courier.attach")
public class AttachmentProperties {

  private String allowUrls = "*";
  private String denyUrls = "127.0.* localhost*";
  private int maxUrlLength = 4096;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (maxUrlLength < 64 || maxUrlLength > 65536) {
      throw new IllegalStateException(
          "courier.attach.max-url-length must be in [64, 65536], got: " + maxUrlLength);
    }
  }

  public String getAllowUrls() {
    return allowUrls;
  }

  public void setAllowUrls(String allowUrls) {
    this.allowUrls = allowUrls;
  }

  public String getDenyUrls() {
    return denyUrls;
  }

  public void setDenyUrls(String denyUrls) {
    this.denyUrls = denyUrls;
  }

  public int getMaxUrlLength() {
    return maxUrlLength;
  }

  public void setMaxUrlLength(int maxUrlLength) {
    this.maxUrlLength = maxUrlLength;
  }
}
