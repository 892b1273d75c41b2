package com.flamingo.richtext.service.concurrency;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;

/**
 * Identity, version and idempotent-response cache of one document.
 *
 * <p>The version grows by one per applied mutation and restarts at zero whenever the identity is
 * replaced. Responses are cached first-write-wins under the request's own key, in insertion order,
 * and the oldest entry is evicted once the cache exceeds its capacity.
 *
 * <p>Not thread-safe; the owning editor session serializes access.
 *
 * @param <R> cached response type
 */
@Slf4j
public class ConcurrencyController<R> {

  private final int cacheCapacity;
  private final Map<OpCacheKey, R> responses;

  private String docId;
  private long version;

  public ConcurrencyController(int cacheCapacity) {
    if (cacheCapacity < 1) {
      throw new IllegalArgumentException("Cache capacity must be positive: " + cacheCapacity);
    }
    this.cacheCapacity = cacheCapacity;
    this.responses =
        new LinkedHashMap<>() {
          @Override
          protected boolean removeEldestEntry(Map.Entry<OpCacheKey, R> eldest) {
            return size() > ConcurrencyController.this.cacheCapacity;
          }
        };
    this.docId = newDocId();
  }

  public String docId() {
    return docId;
  }

  public long version() {
    return version;
  }

  public VersionCheck validate(String requestDocId, long baseVersion) {
    if (!Objects.equals(docId, requestDocId)) {
      return VersionCheck.DOC_CONFLICT;
    }
    if (baseVersion != version) {
      return VersionCheck.VERSION_CONFLICT;
    }
    return VersionCheck.OK;
  }

  public Optional<R> lookupCached(OpCacheKey key) {
    return Optional.ofNullable(responses.get(key));
  }

  /** Caches {@code response} unless the key already holds one. */
  public void cacheResponse(OpCacheKey key, R response) {
    responses.putIfAbsent(key, response);
  }

  public long bumpVersion() {
    return ++version;
  }

  /** Assigns a fresh document identity and restarts the version at zero. */
  public String resetIdentity() {
    docId = newDocId();
    version = 0;
    log.debug("Document identity reset to {}", docId);
    return docId;
  }

  public int cachedResponses() {
    return responses.size();
  }

  private static String newDocId() {
    return UUID.randomUUID().toString();
  }
}
