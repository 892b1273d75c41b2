package com.flamingo.richtext.api.dto.request;

import com.flamingo.richtext.service.concurrency.VersionedRequest;

/** Common triple carried by every mutating request. */
public interface VersionedEditRequest {

  String getDocId();

  Long getBaseVersion();

  String getClientOpId();

  default VersionedRequest toVersionedRequest() {
    return new VersionedRequest(getDocId(), getBaseVersion(), getClientOpId());
  }
}
