package com.flamingo.richtext.service.concurrency;

/** Key of a cached mutation response. */
public record OpCacheKey(String docId, long baseVersion, String clientOpId, int page) {

  public static OpCacheKey of(VersionedRequest request, int page) {
    return new OpCacheKey(request.docId(), request.baseVersion(), request.clientOpId(), page);
  }
}
