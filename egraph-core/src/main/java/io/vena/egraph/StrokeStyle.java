package io.vena.egraph;

/**
 * How a renderer should stroke an element's outline.
 * Highlighting takes precedence over selection.
 */
public enum StrokeStyle {
	NORMAL,
	SELECTED,
	HIGHLIGHTED,
	;

	public static StrokeStyle of(boolean isSelected, boolean isHighlighted) {
		if (isHighlighted) {
			return HIGHLIGHTED;
		} else if (isSelected) {
			return SELECTED;
		} else {
			return NORMAL;
		}
	}
}
