package dev.courier.api;

import dev.courier.attachment.AttachmentGuard;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST adapter for attachment checks.
 *
 * <p>Callers submit the attachment references of a notification before dispatching it. The whole
 * request fails with a 400 Problem Detail on the first malformed or refused reference (see {@link
 * dev.courier.config.GlobalExceptionHandler}).
 */
@RestController
@RequestMapping("/api/attachments")
public class AttachmentController {

  private final AttachmentGuard attachmentGuard;

  public AttachmentController(AttachmentGuard attachmentGuard) {
    this.attachmentGuard = attachmentGuard;
  }

  @PostMapping("/verify")
  public AttachmentVerifyResponse verify(@Valid @RequestBody AttachmentVerifyRequest request) {
    return new AttachmentVerifyResponse(attachmentGuard.verifyAll(request.attachments()));
  }
}
