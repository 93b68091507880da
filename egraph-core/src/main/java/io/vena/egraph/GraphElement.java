package io.vena.egraph;

import io.vena.egraph.geometry.Point;
import java.awt.Shape;
import java.awt.geom.AffineTransform;
import java.util.function.Function;
import org.jetbrains.annotations.Nullable;

/**
 * A graph object that can be placed inside a {@link GraphElementContainer}:
 * either a {@link Literal} or a {@link Cut}.
 *
 * <p>
 * Use {@link #match} to act on the specific variant.
 */
public sealed interface GraphElement extends Bounded permits Literal, Cut {
	Identifier id();

	Point position();

	/**
	 * Moves this element. Ancestors are re-synchronized.
	 */
	void setPosition(Point newPosition);

	/**
	 * @return the container that holds this element, or null if it hasn't been inserted anywhere.
	 */
	@Nullable GraphElementContainer parent();

	/**
	 * The meaning of "selected" is up to the caller.
	 */
	boolean isSelected();

	void setSelected(boolean selected);

	/**
	 * The meaning of "highlighted" is up to the caller.
	 */
	boolean isHighlighted();

	void setHighlighted(boolean highlighted);

	/**
	 * @return a copy of the transform applied to this element's geometric representation.
	 */
	AffineTransform transform();

	boolean containsGeometrically(Point point);

	TransformationTransaction<? extends GraphElement, Point> positionTransaction();

	<R> R match(Function<? super Literal, ? extends R> ifLiteral, Function<? super Cut, ? extends R> ifCut);

	default StrokeStyle strokeStyle() {
		return StrokeStyle.of(isSelected(), isHighlighted());
	}

	/**
	 * @return false if this element has no parent; otherwise, the result of
	 * {@link GraphElementContainer#remove} on the parent.
	 */
	default boolean removeFromParent() {
		GraphElementContainer parent = parent();
		return parent != null && parent.remove(this);
	}

	/**
	 * Checks whether this element lies within <code>path</code>.
	 *
	 * <p>
	 * Only the four corners of the element's transformed frame are sampled,
	 * so this is an approximation: a corner-inside, edge-outside element counts as inside.
	 */
	default boolean isGeometricallyIn(Shape path) {
		return frame()
			.applying(transform())
			.allVerticesSatisfy(vertex -> path.contains(vertex.x(), vertex.y()));
	}
}
