package io.vena.egraph;

import java.util.List;
import org.jetbrains.annotations.Nullable;

import static java.util.Collections.emptyList;

/**
 * The base of everything that can appear in an existential graph:
 * the {@link Graph} itself, {@link Cut}s and {@link Literal}s.
 *
 * <p>
 * A graph object's identity is its {@link #id()}, minted when the object is created.
 * {@link #equals} and {@link #hashCode} look at nothing else, so two objects
 * with identical attributes are still distinct, and mutating an object never
 * changes its hash. This makes graph objects safe to keep in hash-based
 * collections while they move around the tree.
 */
public abstract sealed class GraphObject permits Literal, ElementContainer {
	private final Identifier id = Identifier.mint(this);

	/**
	 * The container that holds this object, if any. Only {@link GraphElement}s ever have one.
	 * Not an owning reference: the container owns its children, never the other way around.
	 */
	@Nullable ElementContainer parent;

	public final Identifier id() {
		return id;
	}

	/**
	 * @return the direct children of this object, literals first, then cuts.
	 * Empty for objects that can't contain anything.
	 */
	public List<GraphElement> children() {
		return emptyList();
	}

	@Override
	public final boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		return obj instanceof GraphObject other && id.equals(other.id);
	}

	@Override
	public final int hashCode() {
		return id.hashCode();
	}
}
