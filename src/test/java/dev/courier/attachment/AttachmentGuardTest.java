package dev.courier.attachment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;

import dev.courier.urlfilter.UrlFilter;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class AttachmentGuardTest {

  private final AttachmentGuard guard =
      new AttachmentGuard(new UrlFilter("*", "127.0.* localhost*"));

  @Test
  void allowedUrlIsReturnedTrimmed() {
    String url = guard.verify("  https://cdn.example.com/report.pdf \n");

    assertThat(url).isEqualTo("https://cdn.example.com/report.pdf");
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "http://localhost/secret",
        "http://localhost:8080/admin",
        "http://127.0.0.1/metadata",
        "HTTP://127.0.0.1:9000/"
      })
  void deniedUrlIsRejectedBeforeAnyFetch(String url) {
    Throwable thrown = catchThrowable(() -> guard.verify(url));

    assertThat(thrown).isInstanceOf(AttachmentRejectedException.class).hasMessageContaining(url);
    assertThat(((AttachmentRejectedException) thrown).getUrl()).isEqualTo(url);
  }

  @Test
  void controlCharacterInsideUrlIsRejected() {
    assertThatThrownBy(() -> guard.verify("https://cdn.example.com/a\nb.pdf"))
        .isInstanceOf(AttachmentRejectedException.class);
    assertThatThrownBy(() -> guard.verify("https://cdn.example.com/a\u0000"))
        .isInstanceOf(AttachmentRejectedException.class);
  }

  @Test
  void unparseableRemoteUrlIsRejected() {
    assertThatThrownBy(() -> guard.verify("https://bad host/x"))
        .isInstanceOf(AttachmentRejectedException.class);
  }

  @Test
  void nonStringAttachmentIsMalformed() {
    assertThatThrownBy(() -> guard.verify(42))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Bad attachment");
  }

  @Test
  void nullAttachmentIsMalformed() {
    assertThatThrownBy(() -> guard.verify(null))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Bad attachment");
  }

  @Test
  void blankAttachmentIsMalformed() {
    assertThatThrownBy(() -> guard.verify("   "))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Bad attachment");
  }

  @ParameterizedTest
  @ValueSource(
      strings = {"file:///etc/passwd", "cdn.example.com/report.pdf", "ftp://cdn.example.com/a"})
  void nonHttpReferenceIsMalformed(String attachment) {
    assertThatThrownBy(() -> guard.verify(attachment))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("http://");
  }

  @Test
  void verifyAllKeepsPayloadOrder() {
    List<String> urls =
        guard.verifyAll(List.of("https://b.example.com/2.png", "https://a.example.com/1.png"));

    assertThat(urls).containsExactly("https://b.example.com/2.png", "https://a.example.com/1.png");
  }

  @Test
  void verifyAllStopsAtFirstRejectedEntry() {
    List<Object> attachments =
        Arrays.asList("https://a.example.com/1.png", "http://localhost/2.png", 42);

    assertThatThrownBy(() -> guard.verifyAll(attachments))
        .isInstanceOf(AttachmentRejectedException.class);
  }

  @Test
  void verifyAllOfNullIsEmpty() {
    assertThat(guard.verifyAll(null)).isEmpty();
  }
}
