package io.vena.egraph;

import java.lang.ref.WeakReference;
import java.util.UUID;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.jetbrains.annotations.Nullable;

import static java.util.UUID.randomUUID;

/**
 * Uniquely identifies one {@link GraphObject} for its whole lifetime,
 * regardless of where it sits in the tree or what its attributes are.
 *
 * <p>
 * Two identifiers are equal only if they were produced by the same call to {@link #mint}.
 */
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public final class Identifier {
	@EqualsAndHashCode.Include
	@NonNull final UUID value;

	@NonNull final WeakReference<GraphObject> owner;

	public static Identifier mint(@NonNull GraphObject owner) {
		return new Identifier(randomUUID(), new WeakReference<>(owner));
	}

	/**
	 * @return the object this identifier was minted for, or null if it has already
	 * been garbage-collected. For diagnostics only; the identifier does not keep its owner alive.
	 */
	public @Nullable GraphObject owner() {
		return owner.get();
	}

	@Override public String toString() { return value.toString(); }
}
