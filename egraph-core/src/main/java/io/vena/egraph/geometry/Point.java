package io.vena.egraph.geometry;

import java.awt.geom.AffineTransform;
import java.awt.geom.Point2D;

/**
 * An immutable point, or displacement, in 2D space.
 */
public record Point(double x, double y) {
	public static final Point ZERO = new Point(0, 0);

	public Point plus(Point other) {
		return new Point(x + other.x, y + other.y);
	}

	public Point minus(Point other) {
		return new Point(x - other.x, y - other.y);
	}

	public Point applying(AffineTransform transform) {
		Point2D result = transform.transform(toPoint2D(), null);
		return new Point(result.getX(), result.getY());
	}

	public Point2D toPoint2D() {
		return new Point2D.Double(x, y);
	}
}
