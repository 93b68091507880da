package io.vena.egraph.geometry;

import java.awt.geom.AffineTransform;
import java.awt.geom.Rectangle2D;
import java.util.List;
import java.util.function.Predicate;

import static java.lang.Math.max;
import static java.lang.Math.min;

/**
 * An immutable axis-aligned rectangle with its origin at the minimum corner.
 *
 * <p>
 * Width and height are expected to be non-negative.
 */
public record Rect(double x, double y, double width, double height) {
	/**
	 * A rectangle that contains every finite point.
	 */
	public static final Rect INFINITE = new Rect(-Double.MAX_VALUE / 2, -Double.MAX_VALUE / 2, Double.MAX_VALUE, Double.MAX_VALUE);

	public static Rect centeredOn(Point center, double width, double height) {
		return new Rect(center.x() - width / 2, center.y() - height / 2, width, height);
	}

	public double minX() { return x; }
	public double minY() { return y; }
	public double maxX() { return x + width; }
	public double maxY() { return y + height; }

	public Point origin() {
		return new Point(x, y);
	}

	public Point center() {
		return new Point(x + width / 2, y + height / 2);
	}

	public Rect withCenter(Point newCenter) {
		return centeredOn(newCenter, width, height);
	}

	public boolean contains(Point point) {
		return point.x() >= minX() && point.x() < maxX()
			&& point.y() >= minY() && point.y() < maxY();
	}

	public boolean intersects(Rect other) {
		return width > 0 && height > 0 && other.width > 0 && other.height > 0
			&& other.minX() < maxX() && minX() < other.maxX()
			&& other.minY() < maxY() && minY() < other.maxY();
	}

	/**
	 * @return the corners in the order (minX, minY), (minX, maxY), (maxX, minY), (maxX, maxY).
	 */
	public List<Point> vertices() {
		return List.of(
			new Point(minX(), minY()),
			new Point(minX(), maxY()),
			new Point(maxX(), minY()),
			new Point(maxX(), maxY()));
	}

	public boolean allVerticesSatisfy(Predicate<Point> predicate) {
		return vertices().stream().allMatch(predicate);
	}

	/**
	 * @return the smallest rectangle containing this one after it is mapped through <code>transform</code>.
	 */
	public Rect applying(AffineTransform transform) {
		if (transform.isIdentity()) {
			return this;
		}
		double minX = Double.POSITIVE_INFINITY, minY = Double.POSITIVE_INFINITY;
		double maxX = Double.NEGATIVE_INFINITY, maxY = Double.NEGATIVE_INFINITY;
		for (Point vertex: vertices()) {
			Point mapped = vertex.applying(transform);
			minX = min(minX, mapped.x());
			minY = min(minY, mapped.y());
			maxX = max(maxX, mapped.x());
			maxY = max(maxY, mapped.y());
		}
		return new Rect(minX, minY, maxX - minX, maxY - minY);
	}

	public Rectangle2D toRectangle2D() {
		return new Rectangle2D.Double(x, y, width, height);
	}
}
