package io.vena.egraph;

import io.vena.egraph.geometry.Rect;

/**
 * Something whose representation fits in a rectangle in 2D space.
 */
public interface Bounded {
	Rect frame();

	/**
	 * A broad-phase check that compares raw frames. Transforms are ignored.
	 */
	default boolean intersectsGeometrically(Bounded other) {
		return frame().intersects(other.frame());
	}
}
