package com.flamingo.richtext.service.concurrency;

/** Result of validating a request against the current document identity and version. */
public enum VersionCheck {
  OK(null),

  /** The request targets a document identity that has since been replaced. */
  DOC_CONFLICT("doc_conflict"),

  /** The request was built against an older (or unknown) version. */
  VERSION_CONFLICT("version_conflict");

  private final String errorCode;

  VersionCheck(String errorCode) {
    this.errorCode = errorCode;
  }

  public String errorCode() {
    return errorCode;
  }
}
