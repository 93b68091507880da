package io.vena.egraph;

import io.vena.egraph.geometry.Point;
import io.vena.egraph.geometry.Rect;
import java.awt.geom.AffineTransform;
import java.util.function.Function;
import lombok.NonNull;
import org.jetbrains.annotations.Nullable;

/**
 * A single formal-logic symbol in an existential graph.
 *
 * <p>
 * A literal is a fixed-size box centered on its {@link #position()}.
 * It is never itself transformed: {@link #transform()} is always the identity.
 */
public final class Literal extends GraphObject implements GraphElement {
	public static final double DEFAULT_WIDTH = 40;
	public static final double DEFAULT_HEIGHT = 40;

	private final String character;
	private final double width;
	private final double height;
	private final TransformationTransaction<Literal, Point> positionTransaction =
		TransformationTransaction.over(this, Literal::position, Literal::setPosition, Point::plus);

	private Point position;
	private boolean isSelected = false;
	private boolean isHighlighted = false;

	public Literal(String character, Point position) {
		this(character, position, DEFAULT_WIDTH, DEFAULT_HEIGHT);
	}

	public Literal(String character, Point position, GraphSettings settings) {
		this(character, position, settings.literalWidth(), settings.literalHeight());
	}

	/**
	 * @param character a single Unicode code point representing the symbol
	 */
	public Literal(@NonNull String character, @NonNull Point position, double width, double height) {
		if (character.codePointCount(0, character.length()) != 1) {
			throw new IllegalArgumentException("Literal character must be exactly one code point: \"" + character + "\"");
		} else if (!(width > 0 && height > 0)) {
			throw new IllegalArgumentException("Literal size must be positive: " + width + "x" + height);
		}
		this.character = character;
		this.position = position;
		this.width = width;
		this.height = height;
	}

	public String character() {
		return character;
	}

	public double width() {
		return width;
	}

	public double height() {
		return height;
	}

	@Override
	public Point position() {
		return position;
	}

	@Override
	public void setPosition(@NonNull Point newPosition) {
		this.position = newPosition;
		synchronizeParent();
	}

	@Override
	public Rect frame() {
		return Rect.centeredOn(position, width, height);
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
		synchronizeParent();
	}

	@Override
	public boolean isHighlighted() {
		return isHighlighted;
	}

	@Override
	public void setHighlighted(boolean highlighted) {
		this.isHighlighted = highlighted;
		synchronizeParent();
	}

	@Override
	public AffineTransform transform() {
		return new AffineTransform();
	}

	@Override
	public boolean containsGeometrically(Point point) {
		return frame().contains(point);
	}

	@Override
	public TransformationTransaction<Literal, Point> positionTransaction() {
		return positionTransaction;
	}

	@Override
	public <R> R match(Function<? super Literal, ? extends R> ifLiteral, Function<? super Cut, ? extends R> ifCut) {
		return ifLiteral.apply(this);
	}

	private void synchronizeParent() {
		if (parent != null) {
			parent.synchronize();
		}
	}

	@Override
	public String toString() {
		return "Literal(" + character + "@" + position.x() + "," + position.y() + ")";
	}
}
