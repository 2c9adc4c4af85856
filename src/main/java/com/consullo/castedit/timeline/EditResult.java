package com.consullo.castedit.timeline;

import java.util.Optional;
import org.apache.commons.lang3.Validate;

/**
 * Outcome of a timeline edit: either a complete new timeline, or a decline with the reason the edit was
 * refused. A declined edit leaves the input timeline untouched.
 */
public final class EditResult {

  public enum Status {
    ACCEPTED,
    DECLINED
  }

  private final Status status;
  private final Timeline timeline;
  private final String message;

  private EditResult(Status status, Timeline timeline, String message) {
    this.status = status;
    this.timeline = timeline;
    this.message = message;
  }

  public static EditResult accepted(Timeline timeline, String message) {
    Validate.notNull(timeline, "timeline must not be null");
    Validate.notNull(message, "message must not be null");
    return new EditResult(Status.ACCEPTED, timeline, message);
  }

  public static EditResult declined(String reason) {
    Validate.notBlank(reason, "reason must not be blank");
    return new EditResult(Status.DECLINED, null, reason);
  }

  public Status status() {
    return status;
  }

  public boolean isAccepted() {
    return status == Status.ACCEPTED;
  }

  public boolean isDeclined() {
    return status == Status.DECLINED;
  }

  /**
   * New timeline for accepted edits.
   *
   * @return timeline, empty when declined
   */
  public Optional<Timeline> timeline() {
    return Optional.ofNullable(timeline);
  }

  /**
   * Returns the new timeline of an accepted edit.
   *
   * @return timeline
   * @throws IllegalStateException if the edit was declined
   */
  public Timeline requireTimeline() {
    if (timeline == null) {
      throw new IllegalStateException("Edit was declined: " + message);
    }
    return timeline;
  }

  /**
   * Status message for accepted edits, or the decline reason.
   *
   * @return message
   */
  public String message() {
    return message;
  }

  @Override
  public String toString() {
    return "EditResult{" + status + ": " + message + "}";
  }
}
