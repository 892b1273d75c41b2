package com.flamingo.richtext.service.concurrency;

/**
 * Optimistic-lock token and idempotency key carried by every mutating call.
 *
 * @param docId document identity the caller believes is current
 * @param baseVersion version the caller last observed
 * @param clientOpId caller-chosen id, unique per logical operation and reused on retry
 */
public record VersionedRequest(String docId, long baseVersion, String clientOpId) {}
