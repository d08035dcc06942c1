package dev.courier.attachment;

/** Thrown when a remote attachment URL is refused by the attachment URL filter. */
public class AttachmentRejectedException extends RuntimeException {

  private final String url;

  public AttachmentRejectedException(String url) {
    super("The attachment URL is not permitted by this server: " + url);
    this.url = url;
  }

  public String getUrl() {
    return url;
  }
}
