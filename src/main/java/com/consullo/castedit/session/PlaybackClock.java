package com.consullo.castedit.session;

/**
 * Cooperative playback state: advances a playhead by real elapsed time times a speed multiplier.
 *
 * <p>
 * The clock holds no timer of its own; the caller drives it with {@link #tick(double, double, double)}.
 * Reaching the end of the timeline clamps the playhead and stops playback. {@link #play()} and
 * {@link #pause()} are idempotent.
 * </p>
 */
public final class PlaybackClock {

  private boolean playing;
  private double speed = 1;

  public void play() {
    playing = true;
  }

  public void pause() {
    playing = false;
  }

  /**
   * Flips between playing and paused.
   *
   * @return true if the clock is now playing
   */
  public boolean toggle() {
    playing = !playing;
    return playing;
  }

  public boolean isPlaying() {
    return playing;
  }

  public double speed() {
    return speed;
  }

  /**
   * Sets the speed multiplier. Non-finite or non-positive values fall back to 1.
   *
   * @param speed multiplier
   */
  public void setSpeed(double speed) {
    this.speed = Double.isFinite(speed) && speed > 0 ? speed : 1;
  }

  /**
   * Computes the next playhead.
   *
   * @param elapsedSeconds real time since the previous tick, negative treated as 0
   * @param playhead current playhead
   * @param composedDuration upper bound of the timeline
   * @return next playhead in {@code [0, composedDuration]}; unchanged while paused
   */
  public double tick(double elapsedSeconds, double playhead, double composedDuration) {
    double upper = Math.max(0, composedDuration);
    double current = Math.max(0, Math.min(upper, playhead));
    if (!playing) {
      return current;
    }
    double delta = Double.isFinite(elapsedSeconds) ? Math.max(0, elapsedSeconds) : 0;
    double next = current + delta * speed;
    if (next >= upper) {
      playing = false;
      return upper;
    }
    return next;
  }
}
