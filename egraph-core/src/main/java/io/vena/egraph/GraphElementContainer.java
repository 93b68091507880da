package io.vena.egraph;

import java.util.List;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * Something that holds {@link Literal}s and {@link Cut}s as direct children,
 * and keeps an up-to-date flattened view of everything nested inside it.
 */
public interface GraphElementContainer extends Bounded {
	Identifier id();

	@Nullable GraphElementContainer parent();

	/**
	 * @return the direct child literals, in insertion order. Not modifiable.
	 */
	List<Literal> childLiterals();

	/**
	 * @return the direct child cuts, in insertion order. Not modifiable.
	 */
	List<Cut> childCuts();

	/**
	 * @return every literal nested at any depth inside this container.
	 */
	Set<Literal> allLiterals();

	/**
	 * @return every cut nested at any depth inside this container.
	 */
	Set<Cut> allCuts();

	/**
	 * Recomputes {@link #allLiterals()} and {@link #allCuts()} and propagates the change upward.
	 */
	void synchronize();

	/**
	 * Makes <code>child</code> a direct child of this container, first removing it from
	 * its current parent if it has one.
	 */
	void insert(GraphElement child);

	/**
	 * Removes <code>child</code> if it is a <em>direct</em> child of this container.
	 * Nested cuts are not searched.
	 *
	 * @return true if the child was removed; false if it wasn't a direct child.
	 */
	boolean remove(GraphElement child);

	/**
	 * Checks whether <code>child</code> appears anywhere in this container's tree.
	 * Purely structural; no geometry is involved.
	 */
	boolean contains(GraphElement child);

	boolean containsGeometrically(GraphElement element);

	/**
	 * @return a snapshot of just the direct children.
	 */
	GraphElementView shallow();
}
