package io.vena.egraph;

/**
 * Called every time a {@link Graph} synchronizes, which happens after any change anywhere in its tree.
 */
@FunctionalInterface
public interface SynchronizationHandler {
	/**
	 * @param graph the graph that synchronized; its flattened sets are already current.
	 */
	void onSynchronized(Graph graph);
}
