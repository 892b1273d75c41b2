package com.flamingo.richtext.exception;

import com.flamingo.richtext.api.dto.response.EditorResponse;
import com.flamingo.richtext.service.concurrency.VersionCheck;

/**
 * Exception thrown when a mutation names a stale document identity or version. Carries the current
 * state so the client can resynchronise from the error body alone.
 */
public class DocumentConflictException extends RuntimeException {

  private final VersionCheck check;
  private final EditorResponse currentState;

  public DocumentConflictException(VersionCheck check, EditorResponse currentState) {
    super(
        check.errorCode()
            + ": document "
            + currentState.getDocId()
            + " is at version "
            + currentState.getVersion());
    this.check = check;
    this.currentState = currentState;
  }

  public VersionCheck getCheck() {
    return check;
  }

  public EditorResponse getCurrentState() {
    return currentState;
  }
}
