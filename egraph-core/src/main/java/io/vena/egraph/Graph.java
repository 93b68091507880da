package io.vena.egraph;

import io.vena.egraph.geometry.Point;
import io.vena.egraph.geometry.Rect;
import java.util.List;
import lombok.NonNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Collections.emptyList;

/**
 * The root of an existential graph: the "sheet of assertion" on which all cuts and literals sit.
 *
 * <p>
 * A graph has no parent and an infinite frame, so it geometrically contains everything.
 * Whenever anything in the tree changes, the change cascades up to the graph,
 * which then calls its {@link SynchronizationHandler}, if one is set.
 * This is the hook that persistence and UI layers use to learn about changes.
 */
public final class Graph extends ElementContainer {
	private final boolean isLoading;
	private @Nullable SynchronizationHandler synchronizationHandler = null;

	public Graph() {
		this(false);
	}

	/**
	 * @param isLoading indicates that the graph is still being populated from storage,
	 * so collaborators shouldn't expect it to be complete yet.
	 */
	public Graph(boolean isLoading) {
		this(emptyList(), emptyList(), isLoading);
	}

	/**
	 * The given children are adopted as though each were {@link #insert inserted}.
	 */
	public Graph(@NonNull List<Literal> childLiterals, @NonNull List<Cut> childCuts, boolean isLoading) {
		this.isLoading = isLoading;
		adoptAll(childLiterals, childCuts);
	}

	public boolean isLoading() {
		return isLoading;
	}

	public @Nullable SynchronizationHandler synchronizationHandler() {
		return synchronizationHandler;
	}

	public void setSynchronizationHandler(@Nullable SynchronizationHandler synchronizationHandler) {
		this.synchronizationHandler = synchronizationHandler;
	}

	/**
	 * @throws UnsupportedOperationException always: the root has no parent.
	 */
	@Override
	public GraphElementContainer parent() {
		throw new UnsupportedOperationException("A graph has no parent");
	}

	@Override
	public Rect frame() {
		return Rect.INFINITE;
	}

	public boolean containsGeometrically(Point point) {
		return true;
	}

	@Override
	public boolean containsGeometrically(GraphElement element) {
		return true;
	}

	/**
	 * Un-highlights every element in the graph, at every depth.
	 */
	public void clearAllHighlighting() {
		for (GraphElement element: this) {
			if (element.isHighlighted()) {
				element.setHighlighted(false);
			}
		}
	}

	/**
	 * Deselects every element in the graph, at every depth.
	 */
	public void clearAllSelection() {
		for (GraphElement element: this) {
			if (element.isSelected()) {
				element.setSelected(false);
			}
		}
	}

	/**
	 * Resets every parent reference in the tree to the container that actually lists the element,
	 * rebuilds every flattened set from the bottom up, and then synchronizes the graph.
	 *
	 * <p>
	 * Meant for deserializers and other bulk loaders that assemble a tree without
	 * going through {@link #insert}.
	 */
	public void reattachParents() {
		reattachChildren();
		synchronize();
	}

	@Override
	void afterSynchronize() {
		SynchronizationHandler handler = synchronizationHandler;
		if (handler != null) {
			try {
				handler.onSynchronized(this);
			} catch (RuntimeException e) {
				LOGGER.error("Synchronization handler aborted due to exception: {}", e.getMessage(), e);
			}
		}
	}

	@Override
	boolean isWithin(Cut cut) {
		return false;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Graph.class);
}
