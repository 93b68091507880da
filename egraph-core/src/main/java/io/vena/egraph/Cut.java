package io.vena.egraph;

import io.vena.egraph.geometry.Point;
import io.vena.egraph.geometry.Rect;
import java.awt.Shape;
import java.awt.geom.AffineTransform;
import java.awt.geom.Ellipse2D;
import java.util.List;
import java.util.function.Function;
import lombok.NonNull;
import org.jetbrains.annotations.Nullable;

import static java.util.Collections.emptyList;

/**
 * A cut in an existential graph: a boundary, drawn as an ellipse, that encloses
 * literals and other cuts.
 *
 * <p>
 * The {@link #frame()} is whatever the author supplies. It is not derived from
 * the children, and nesting doesn't resize it.
 * Any change to a cut synchronizes it, which in turn synchronizes its ancestors.
 */
public final class Cut extends ElementContainer implements GraphElement {
	private final AffineTransform transform;
	private final TransformationTransaction<Cut, Point> positionTransaction =
		TransformationTransaction.over(this, Cut::position, Cut::setPosition, Point::plus);

	private Rect frame;
	private boolean isSelected = false;
	private boolean isHighlighted = false;

	public Cut(Rect frame) {
		this(emptyList(), emptyList(), frame, new AffineTransform());
	}

	/**
	 * The given children are adopted as though each were {@link #insert inserted},
	 * including being removed from any container they're already in.
	 */
	public Cut(List<Literal> childLiterals, List<Cut> childCuts, Rect frame) {
		this(childLiterals, childCuts, frame, new AffineTransform());
	}

	public Cut(@NonNull List<Literal> childLiterals, @NonNull List<Cut> childCuts, @NonNull Rect frame, @NonNull AffineTransform transform) {
		this.frame = frame;
		this.transform = new AffineTransform(transform);
		adoptAll(childLiterals, childCuts);
	}

	@Override
	public Rect frame() {
		return frame;
	}

	/**
	 * @return the center of the {@link #frame()}.
	 */
	@Override
	public Point position() {
		return frame.center();
	}

	/**
	 * Moves the {@link #frame()} so it's centered on <code>newPosition</code>.
	 * The children stay where they are.
	 */
	@Override
	public void setPosition(@NonNull Point newPosition) {
		this.frame = frame.withCenter(newPosition);
		synchronize();
	}

	@Override
	public @Nullable GraphElementContainer parent() {
		return parent;
	}

	@Override
	public boolean isSelected() {
		return isSelected;
	}

	@Override
	public void setSelected(boolean selected) {
		this.isSelected = selected;
		synchronize();
	}

	@Override
	public boolean isHighlighted() {
		return isHighlighted;
	}

	@Override
	public void setHighlighted(boolean highlighted) {
		this.isHighlighted = highlighted;
		synchronize();
	}

	@Override
	public AffineTransform transform() {
		return new AffineTransform(transform);
	}

	public FillStyle fillStyle() {
		return FillStyle.of(isSelected);
	}

	/**
	 * @return the ellipse inscribed in the {@link #frame()}. The cut's transform is not applied.
	 */
	public Shape path() {
		return new Ellipse2D.Double(frame.x(), frame.y(), frame.width(), frame.height());
	}

	@Override
	public boolean containsGeometrically(Point point) {
		return path().contains(point.x(), point.y());
	}

	@Override
	public boolean containsGeometrically(GraphElement element) {
		return element.isGeometricallyIn(path());
	}

	@Override
	public TransformationTransaction<Cut, Point> positionTransaction() {
		return positionTransaction;
	}

	@Override
	public <R> R match(Function<? super Literal, ? extends R> ifLiteral, Function<? super Cut, ? extends R> ifCut) {
		return ifCut.apply(this);
	}

	@Override
	void afterSynchronize() {
		if (parent != null) {
			parent.synchronize();
		}
	}

	@Override
	boolean isWithin(Cut cut) {
		return this.equals(cut) || cut.contains(this);
	}
}
