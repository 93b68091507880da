package io.vena.egraph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import static java.util.Collections.unmodifiableSet;

/**
 * Computes the transitive closure of the containment tree below a set of direct children.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
final class Flattener {
	record Result(Set<Literal> literals, Set<Cut> cuts) { }

	/**
	 * Starts from the given direct children and repeatedly folds in the direct children
	 * of every known cut until a pass discovers no new cut.
	 *
	 * <p>
	 * Only {@link Cut#childLiterals()} and {@link Cut#childCuts()} are consulted, so the
	 * result is correct even if the nested cuts' own cached sets are stale.
	 */
	static Result flatten(Collection<Literal> literals, Collection<Cut> cuts) {
		Set<Literal> allLiterals = new LinkedHashSet<>(literals);
		Set<Cut> allCuts = new LinkedHashSet<>(cuts);
		int cutCountBefore;
		do {
			cutCountBefore = allCuts.size();
			for (Cut cut: new ArrayList<>(allCuts)) {
				allLiterals.addAll(cut.childLiterals());
				allCuts.addAll(cut.childCuts());
			}
		} while (allCuts.size() > cutCountBefore);
		return new Result(unmodifiableSet(allLiterals), unmodifiableSet(allCuts));
	}
}
