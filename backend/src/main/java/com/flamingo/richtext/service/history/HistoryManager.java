package com.flamingo.richtext.service.history;

import com.flamingo.richtext.domain.enums.ChangeKind;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Bounded linear undo/redo over full snapshots.
 *
 * <p>Both stacks hold at most {@code capacity} entries; pushing past that drops the oldest. A new
 * change clears the redo stack. Consecutive {@link ChangeKind#INSERT} changes arriving within the
 * coalescing window of each other share the snapshot taken before the first of them, so a burst
 * of typing undoes as one step.
 *
 * <p>Not thread-safe; the owning editor session serializes access.
 */
@Slf4j
public class HistoryManager {

  private final int capacity;
  private final Duration coalesceWindow;
  private final Clock clock;

  private final Deque<HistorySnapshot> undoStack = new ArrayDeque<>();
  private final Deque<HistorySnapshot> redoStack = new ArrayDeque<>();

  private ChangeKind lastKind;
  private Instant lastChangeAt;

  public HistoryManager(int capacity, Duration coalesceWindow, Clock clock) {
    if (capacity < 1) {
      throw new IllegalArgumentException("History capacity must be positive: " + capacity);
    }
    this.capacity = capacity;
    this.coalesceWindow = coalesceWindow;
    this.clock = clock;
  }

  /**
   * Records that the state captured by {@code current} is about to change.
   *
   * @return {@code true} if a new undo entry was pushed, {@code false} if the change was coalesced
   */
  public boolean recordChange(ChangeKind kind, Supplier<HistorySnapshot> current) {
    Instant now = clock.instant();
    if (kind == ChangeKind.INSERT && lastKind == ChangeKind.INSERT && withinWindow(now)) {
      lastChangeAt = now;
      return false;
    }
    push(undoStack, current.get());
    redoStack.clear();
    lastKind = kind;
    lastChangeAt = now;
    return true;
  }

  /**
   * Steps back one entry.
   *
   * @param current supplies the state being left, which becomes the newest redo entry
   * @return the snapshot to restore, or empty if there is nothing to undo
   */
  public Optional<HistorySnapshot> undo(Supplier<HistorySnapshot> current) {
    if (undoStack.isEmpty()) {
      return Optional.empty();
    }
    push(redoStack, current.get());
    resetCoalescing();
    return Optional.of(undoStack.removeLast());
  }

  /** Symmetric to {@link #undo}. */
  public Optional<HistorySnapshot> redo(Supplier<HistorySnapshot> current) {
    if (redoStack.isEmpty()) {
      return Optional.empty();
    }
    push(undoStack, current.get());
    resetCoalescing();
    return Optional.of(redoStack.removeLast());
  }

  /** Forgets all history, as after loading a new document. */
  public void clear() {
    undoStack.clear();
    redoStack.clear();
    resetCoalescing();
  }

  /** Forgets all history except {@code preserved}, which becomes the only undo entry. */
  public void resetTo(HistorySnapshot preserved) {
    clear();
    push(undoStack, preserved);
    log.debug("History reset with one preserved entry ({} bytes)", preserved.size());
  }

  public HistoryState state() {
    return new HistoryState(
        !undoStack.isEmpty(), !redoStack.isEmpty(), undoStack.size(), redoStack.size());
  }

  private boolean withinWindow(Instant now) {
    return lastChangeAt != null
        && Duration.between(lastChangeAt, now).compareTo(coalesceWindow) < 0;
  }

  private void resetCoalescing() {
    lastKind = null;
    lastChangeAt = null;
  }

  private void push(Deque<HistorySnapshot> stack, HistorySnapshot snapshot) {
    stack.addLast(snapshot);
    while (stack.size() > capacity) {
      stack.removeFirst();
    }
  }
}
