package io.vena.egraph;

import io.vena.egraph.exceptions.NoCurrentTransactionException;
import java.util.function.BiConsumer;
import java.util.function.BinaryOperator;
import java.util.function.Function;
import lombok.AccessLevel;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.jetbrains.annotations.Nullable;

/**
 * Provisional, revertible changes to one attribute of a <code>parent</code> object,
 * expressed as deltas from a baseline captured by {@link #begin()}.
 *
 * <p>
 * Typical use is dragging: call {@link #begin()} when the drag starts,
 * {@link #apply} with the total offset so far on every move,
 * then {@link #end()} on drop or {@link #cancel()} on escape.
 * Each {@link #apply} is relative to the baseline, not to the previous <code>apply</code>.
 *
 * @param <P> the type of the object that owns the attribute
 * @param <V> the attribute's type; must be closed under <code>addition</code>
 */
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class TransformationTransaction<P, V> {
	private final P parent;
	private final Function<? super P, ? extends V> getter;
	private final BiConsumer<? super P, ? super V> setter;
	private final BinaryOperator<V> addition;

	private @Nullable V baseValue = null;

	public static <PP, VV> TransformationTransaction<PP, VV> over(
		@NonNull PP parent,
		@NonNull Function<? super PP, ? extends VV> getter,
		@NonNull BiConsumer<? super PP, ? super VV> setter,
		@NonNull BinaryOperator<VV> addition
	) {
		return new TransformationTransaction<>(parent, getter, setter, addition);
	}

	/**
	 * Captures the attribute's current value as the baseline.
	 * If a transaction is already active, its baseline is replaced.
	 */
	public void begin() {
		baseValue = getter.apply(parent);
	}

	/**
	 * Sets the attribute to the baseline plus <code>delta</code>.
	 */
	public void apply(@NonNull V delta) throws NoCurrentTransactionException {
		V base = requireActive();
		setter.accept(parent, addition.apply(base, delta));
	}

	/**
	 * Keeps whatever the last {@link #apply} produced and forgets the baseline.
	 */
	public void end() {
		baseValue = null;
	}

	/**
	 * Restores the attribute to its baseline and forgets the baseline.
	 */
	public void cancel() throws NoCurrentTransactionException {
		V base = requireActive();
		setter.accept(parent, base);
		baseValue = null;
	}

	public boolean isActive() {
		return baseValue != null;
	}

	private V requireActive() throws NoCurrentTransactionException {
		V base = baseValue;
		if (base == null) {
			throw new NoCurrentTransactionException("No transaction in progress on " + parent);
		}
		return base;
	}
}
