package io.vena.egraph;

import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * An immutable snapshot of some literals and cuts that can be iterated any number of times.
 * Literals come first, then cuts; beyond that, order follows the collections it was built from.
 *
 * <p>
 * Because it's a snapshot, it's safe to modify the tree while iterating.
 */
public final class GraphElementView implements Iterable<GraphElement> {
	private final List<Literal> literals;
	private final List<Cut> cuts;

	GraphElementView(Collection<Literal> literals, Collection<Cut> cuts) {
		this.literals = List.copyOf(literals);
		this.cuts = List.copyOf(cuts);
	}

	public int size() {
		return literals.size() + cuts.size();
	}

	public boolean isEmpty() {
		return size() == 0;
	}

	public List<Literal> literals() {
		return literals;
	}

	public List<Cut> cuts() {
		return cuts;
	}

	@Override
	public Iterator<GraphElement> iterator() {
		return new GraphElementIterator(literals, cuts);
	}

	public Stream<GraphElement> stream() {
		return StreamSupport.stream(spliterator(), false);
	}

	@Override
	public String toString() {
		return "GraphElementView(literals=" + literals + ", cuts=" + cuts + ")";
	}

	private static final class GraphElementIterator implements Iterator<GraphElement> {
		private final List<Literal> literals;
		private final List<Cut> cuts;
		private int offset = 0;

		GraphElementIterator(List<Literal> literals, List<Cut> cuts) {
			this.literals = literals;
			this.cuts = cuts;
		}

		@Override
		public boolean hasNext() {
			return offset < literals.size() + cuts.size();
		}

		@Override
		public GraphElement next() {
			if (!hasNext()) {
				throw new NoSuchElementException();
			}
			GraphElement result = (offset < literals.size())
				? literals.get(offset)
				: cuts.get(offset - literals.size());
			offset++;
			return result;
		}
	}
}
