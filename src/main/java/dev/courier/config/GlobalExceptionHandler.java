package dev.courier.config;

import dev.courier.attachment.AttachmentRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global REST error handler that maps application exceptions to RFC 9457 Problem Detail responses.
 *
 * <p>Both malformed input ({@link IllegalArgumentException}) and refused attachments ({@link
 * AttachmentRejectedException}) are client errors and map to HTTP 400.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  static final String REJECTED_DETAIL = "The attachment URL is not permitted by this server.";

  /**
   * Maps {@link IllegalArgumentException} to a 400 Bad Request Problem Detail.
   *
   * @param ex the exception thrown by validation logic
   * @return a Problem Detail with HTTP 400 status and the exception message
   */
  @ExceptionHandler(IllegalArgumentException.class)
  ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
    return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
  }

  /**
   * Maps {@link AttachmentRejectedException} to a 400 Bad Request Problem Detail titled "Attachment
   * rejected". The detail is the same for every refusal and does not echo the URL.
   *
   * @param ex the rejection raised by the attachment guard
   * @return a Problem Detail with HTTP 400 status
   */
  @ExceptionHandler(AttachmentRejectedException.class)
  ProblemDetail handleAttachmentRejected(AttachmentRejectedException ex) {
    ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, REJECTED_DETAIL);
    problem.setTitle("Attachment rejected");
    return problem;
  }
}
