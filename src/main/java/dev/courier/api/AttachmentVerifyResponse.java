package dev.courier.api;

import java.util.List;

/**
 * Response body for a successful attachment verification.
 *
 * @param accepted the verified URLs, trimmed, in request order
 */
public record AttachmentVerifyResponse(List<String> accepted) {}
