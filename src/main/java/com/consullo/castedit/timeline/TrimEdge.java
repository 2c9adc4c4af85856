package com.consullo.castedit.timeline;

/**
 * Which end of a segment a trim moves.
 *
 * @since 1.0
 */
public enum TrimEdge {
  /** Moves the source start. */
  LEFT,
  /** Moves the source end. */
  RIGHT
}
