package com.consullo.castedit.session;

import com.consullo.castedit.timeline.Timeline;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.apache.commons.lang3.Validate;

/**
 * Bounded, linear undo history of immutable timeline snapshots.
 *
 * <p>
 * {@link #record(Timeline)} discards any redo suffix before appending; a snapshot equal to the current one
 * is not appended. When the depth is exceeded the oldest snapshot is dropped.
 * </p>
 */
public final class EditHistory {

  private final int depth;
  private final List<Timeline> snapshots = new ArrayList<>();
  private int index = -1;

  public EditHistory(int depth) {
    Validate.isTrue(depth >= 1, "depth must be at least 1");
    this.depth = depth;
  }

  /**
   * Clears the history and makes {@code initial} the only snapshot.
   *
   * @param initial state right after a load
   */
  public void reset(Timeline initial) {
    Validate.notNull(initial, "initial must not be null");
    snapshots.clear();
    snapshots.add(initial);
    index = 0;
  }

  /**
   * Appends a snapshot after the current position.
   *
   * @param snapshot new state
   * @return false when the snapshot equals the current one and nothing was recorded
   */
  public boolean record(Timeline snapshot) {
    Validate.notNull(snapshot, "snapshot must not be null");
    if (index >= 0 && snapshots.get(index).equals(snapshot)) {
      return false;
    }
    while (snapshots.size() > index + 1) {
      snapshots.remove(snapshots.size() - 1);
    }
    snapshots.add(snapshot);
    if (snapshots.size() > depth) {
      snapshots.remove(0);
    }
    index = snapshots.size() - 1;
    return true;
  }

  public boolean canUndo() {
    return index > 0;
  }

  public boolean canRedo() {
    return index >= 0 && index < snapshots.size() - 1;
  }

  public Optional<Timeline> undo() {
    if (!canUndo()) {
      return Optional.empty();
    }
    index--;
    return Optional.of(snapshots.get(index));
  }

  public Optional<Timeline> redo() {
    if (!canRedo()) {
      return Optional.empty();
    }
    index++;
    return Optional.of(snapshots.get(index));
  }

  public Optional<Timeline> current() {
    return index < 0 ? Optional.empty() : Optional.of(snapshots.get(index));
  }

  public int size() {
    return snapshots.size();
  }

  public int depth() {
    return depth;
  }
}
