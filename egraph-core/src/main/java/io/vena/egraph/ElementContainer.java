package io.vena.egraph;

import io.vena.egraph.exceptions.CyclicContainmentException;
import io.vena.egraph.exceptions.InvariantViolationException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Collections.emptySet;
import static java.util.Collections.unmodifiableList;

/**
 * The tree-maintenance machinery shared by {@link Cut} and {@link Graph}.
 *
 * <p>
 * Every change to the direct children goes through {@link #insert} or {@link #remove},
 * which call {@link #synchronize()} themselves. Synchronizing recomputes the flattened
 * descendant sets with {@link Flattener} and then hands off to {@link #afterSynchronize()},
 * which for a cut means synchronizing its parent, and for the graph means notifying its handler.
 * A change anywhere therefore cascades all the way to the root.
 *
 * <p>
 * Iterating a container visits its flattened descendants: all of {@link #allLiterals()},
 * then all of {@link #allCuts()}. Use {@link #shallow()} for the direct children only.
 */
public abstract sealed class ElementContainer extends GraphObject implements GraphElementContainer, Iterable<GraphElement> permits Cut, Graph {
	private final List<Literal> childLiterals = new ArrayList<>();
	private final List<Cut> childCuts = new ArrayList<>();

	// Derived
	private Set<Literal> allLiterals = emptySet();
	private Set<Cut> allCuts = emptySet();

	@Override
	public final List<Literal> childLiterals() {
		return unmodifiableList(childLiterals);
	}

	@Override
	public final List<Cut> childCuts() {
		return unmodifiableList(childCuts);
	}

	@Override
	public final Set<Literal> allLiterals() {
		return allLiterals;
	}

	@Override
	public final Set<Cut> allCuts() {
		return allCuts;
	}

	@Override
	public final List<GraphElement> children() {
		List<GraphElement> result = new ArrayList<>(childLiterals.size() + childCuts.size());
		result.addAll(childLiterals);
		result.addAll(childCuts);
		return unmodifiableList(result);
	}

	@Override
	public final void synchronize() {
		recomputeClosure();
		afterSynchronize();
	}

	/**
	 * Called at the end of every {@link #synchronize()}, once the flattened sets are current.
	 */
	abstract void afterSynchronize();

	/**
	 * @return true if this container is <code>cut</code> or is nested somewhere inside it.
	 */
	abstract boolean isWithin(Cut cut);

	@Override
	public final void insert(@NonNull GraphElement child) {
		attach(child);
		LOGGER.debug("Inserted {} {} into {}", child.getClass().getSimpleName(), child.id(), this);
		synchronize();
	}

	@Override
	public final boolean remove(@NonNull GraphElement child) {
		boolean removed = child.match(
			literal -> detach(literal, childLiterals),
			cut -> detach(cut, childCuts));
		if (!removed) {
			LOGGER.debug("Not removing {} {} from {}: it isn't a direct child", child.getClass().getSimpleName(), child.id(), this);
			return false;
		}
		LOGGER.debug("Removed {} {} from {}", child.getClass().getSimpleName(), child.id(), this);
		synchronize();
		return true;
	}

	@Override
	public final boolean contains(@NonNull GraphElement child) {
		boolean isDirectChild = child.match(childLiterals::contains, childCuts::contains);
		if (isDirectChild) {
			return true;
		}
		for (Cut cut: childCuts) {
			if (cut.contains(child)) {
				return true;
			}
		}
		return false;
	}

	@Override
	public final GraphElementView shallow() {
		return new GraphElementView(childLiterals, childCuts);
	}

	/**
	 * @return an iterator over a snapshot of {@link #allLiterals()} followed by {@link #allCuts()}.
	 */
	@Override
	public final Iterator<GraphElement> iterator() {
		return new GraphElementView(allLiterals, allCuts).iterator();
	}

	/**
	 * For constructors: adopts the given elements as if each were {@link #insert inserted},
	 * but computes the flattened sets just once and doesn't propagate upward.
	 */
	final void adoptAll(List<Literal> literals, List<Cut> cuts) {
		literals.forEach(this::attach);
		cuts.forEach(this::attach);
		recomputeClosure();
	}

	/**
	 * Walks the tree below this container, pointing every child's parent reference
	 * at the container that lists it, and recomputing every nested cut's flattened sets
	 * from the bottom up. Does not recompute this container's own sets.
	 */
	final void reattachChildren() {
		for (Literal literal: childLiterals) {
			literal.parent = this;
		}
		for (Cut cut: childCuts) {
			cut.parent = this;
			cut.reattachChildren();
			cut.recomputeClosure();
		}
	}

	final void recomputeClosure() {
		Flattener.Result flattened = Flattener.flatten(childLiterals, childCuts);
		allLiterals = flattened.literals();
		allCuts = flattened.cuts();
		LOGGER.trace("Synchronized {}: {} literals, {} cuts", this, allLiterals.size(), allCuts.size());
	}

	private void attach(@NonNull GraphElement child) {
		boolean wouldFormCycle = child.match(literal -> false, this::isWithin);
		if (wouldFormCycle) {
			throw new CyclicContainmentException("Can't insert cut " + child.id() + " into itself or its own descendant " + id());
		}
		GraphElementContainer oldParent = child.parent();
		if (oldParent != null && !oldParent.remove(child)) {
			throw new InvariantViolationException("Element " + child.id() + " has parent " + oldParent.id() + " but isn't one of its direct children");
		}
		child.match(
			literal -> adopt(literal, childLiterals),
			cut -> adopt(cut, childCuts));
	}

	private <E extends GraphObject> boolean adopt(E child, List<E> siblings) {
		child.parent = this;
		return siblings.add(child);
	}

	private <E extends GraphObject> boolean detach(E child, List<E> siblings) {
		if (siblings.remove(child)) {
			child.parent = null;
			return true;
		} else {
			return false;
		}
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "(" + id() + ")";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ElementContainer.class);
}
