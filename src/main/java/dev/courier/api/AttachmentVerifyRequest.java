package dev.courier.api;

import jakarta.validation.constraints.NotEmpty;
import java.util.List;

/**
 * Request body for {@code POST /api/attachments/verify}.
 *
 * @param attachments attachment references as they appear in a notification payload; entries are
 *     left untyped so that non-string values can be reported as malformed
 */
public record AttachmentVerifyRequest(@NotEmpty List<Object> attachments) {}
