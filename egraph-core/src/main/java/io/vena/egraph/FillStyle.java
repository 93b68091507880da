package io.vena.egraph;

/**
 * How a renderer should fill the interior of a {@link Cut}.
 */
public enum FillStyle {
	CLEAR,

	/**
	 * A translucent tint indicating the cut is selected.
	 */
	SELECTED,
	;

	public static FillStyle of(boolean isSelected) {
		return isSelected ? SELECTED : CLEAR;
	}
}
