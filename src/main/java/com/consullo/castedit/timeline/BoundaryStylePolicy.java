package com.consullo.castedit.timeline;

/**
 * What happens to the current text style where one segment's output ends and the next one's begins during
 * preview replay.
 *
 * @since 1.0
 */
public enum BoundaryStylePolicy {
  /** Reset to the default style at every segment boundary. */
  RESET,
  /** Let style set by an earlier segment carry into the next one. */
  CARRY
}
