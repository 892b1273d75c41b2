package com.flamingo.richtext.service.history;

import java.util.Arrays;

/** Self-contained serialized capture of an editor's document state. Immutable. */
public final class HistorySnapshot {

  private final byte[] payload;

  public HistorySnapshot(byte[] payload) {
    this.payload = Arrays.copyOf(payload, payload.length);
  }

  public byte[] payload() {
    return Arrays.copyOf(payload, payload.length);
  }

  public int size() {
    return payload.length;
  }
}
