package com.consullo.castedit.session;

import com.consullo.castedit.timeline.BoundaryStylePolicy;
import org.apache.commons.lang3.Validate;

/**
 * Editing session configuration values.
 *
 * @param historyDepth maximum number of timeline snapshots kept for undo, oldest dropped first
 * @param boundaryStylePolicy style handling between segments when previewing
 * @param previewLeadIn seconds after the first output event where the playhead starts after a load
 * @since 1.0
 */
public record EditorSessionConfig(
    int historyDepth,
    BoundaryStylePolicy boundaryStylePolicy,
    double previewLeadIn) {

  public static final int DEFAULT_HISTORY_DEPTH = 200;
  public static final double DEFAULT_PREVIEW_LEAD_IN = 0.2;

  public EditorSessionConfig {
    Validate.isTrue(historyDepth >= 1, "historyDepth must be at least 1");
    Validate.notNull(boundaryStylePolicy, "boundaryStylePolicy must not be null");
    Validate.isTrue(Double.isFinite(previewLeadIn) && previewLeadIn >= 0, "previewLeadIn must be >= 0");
  }

  public static EditorSessionConfig defaults() {
    return new EditorSessionConfig(DEFAULT_HISTORY_DEPTH, BoundaryStylePolicy.RESET, DEFAULT_PREVIEW_LEAD_IN);
  }
}
