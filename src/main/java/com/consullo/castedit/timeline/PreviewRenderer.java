package com.consullo.castedit.timeline;

import com.consullo.castedit.core.TerminalCore;
import com.consullo.castedit.core.TerminalCoreFactory;
import com.consullo.castedit.core.TerminalSnapshot;
import com.consullo.castedit.core.Theme;
import com.consullo.castedit.core.replay.ReplayTerminalCore;
import com.consullo.castedit.recording.OutputEvent;
import com.consullo.castedit.recording.Recording;
import com.consullo.castedit.recording.SourceRegistry;
import java.util.List;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Answers "what does the screen look like at timeline time T".
 *
 * <p>
 * The visible events from {@link PreviewExtractor} are replayed into a single fresh {@link TerminalCore}.
 * With {@link BoundaryStylePolicy#RESET} the core's style is reset before every segment after the first,
 * so one clip cannot inherit colors left behind by an unrelated earlier clip.
 * </p>
 */
public final class PreviewRenderer {

  private static final Logger LOGGER = LoggerFactory.getLogger(PreviewRenderer.class);

  private final BoundaryStylePolicy boundaryStylePolicy;
  private final TerminalCoreFactory coreFactory;

  public PreviewRenderer(BoundaryStylePolicy boundaryStylePolicy) {
    this(boundaryStylePolicy, ReplayTerminalCore::new);
  }

  /**
   * Creates a renderer with a custom core factory.
   *
   * @param boundaryStylePolicy style handling at segment boundaries
   * @param coreFactory builds one core per render
   */
  public PreviewRenderer(BoundaryStylePolicy boundaryStylePolicy, TerminalCoreFactory coreFactory) {
    Validate.notNull(boundaryStylePolicy, "boundaryStylePolicy must not be null");
    Validate.notNull(coreFactory, "coreFactory must not be null");
    this.boundaryStylePolicy = boundaryStylePolicy;
    this.coreFactory = coreFactory;
  }

  public BoundaryStylePolicy boundaryStylePolicy() {
    return boundaryStylePolicy;
  }

  /**
   * Renders the screen at {@code t} using the first registered recording's size and theme.
   *
   * @param timeline timeline
   * @param sources registry
   * @param t timeline time
   * @return screen snapshot
   */
  public TerminalSnapshot render(Timeline timeline, SourceRegistry sources, double t) {
    Validate.notNull(sources, "sources must not be null");
    Recording primary = sources.first()
        .orElseThrow(() -> new IllegalStateException("No recording loaded."));
    return render(timeline, sources, t, primary.rows(), primary.cols());
  }

  /**
   * Renders the screen at {@code t} with an explicit grid size.
   */
  public TerminalSnapshot render(Timeline timeline, SourceRegistry sources, double t, int rows, int cols) {
    Recording primary = sources.first()
        .orElseThrow(() -> new IllegalStateException("No recording loaded."));
    List<PreviewSlice> slices = PreviewExtractor.slicesUpTo(timeline, sources, t);
    TerminalCore core = coreFactory.create(cols, rows, primary.theme());
    int fed = 0;
    for (int i = 0; i < slices.size(); i++) {
      if (i > 0 && boundaryStylePolicy == BoundaryStylePolicy.RESET) {
        core.resetStyle();
      }
      for (OutputEvent ev : slices.get(i).events()) {
        core.feed(ev.text());
        fed++;
      }
    }
    LOGGER.debug("render: t={} slices={} events={}", t, slices.size(), fed);
    return core.snapshot();
  }

  /**
   * Theme used for previews: the first registered recording's.
   */
  public static Theme previewTheme(SourceRegistry sources) {
    return sources.first().map(Recording::theme).orElse(Theme.DEFAULT);
  }
}
