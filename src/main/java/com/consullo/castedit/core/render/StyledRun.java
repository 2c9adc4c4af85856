package com.consullo.castedit.core.render;

/**
 * Maximal stretch of adjacent cells in one row sharing a resolved style.
 *
 * @param text cell characters, unescaped
 * @param style shared style
 * @since 1.0
 */
public record StyledRun(String text, ResolvedStyle style) {
}
