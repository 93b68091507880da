package io.vena.egraph;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;

@Value
@Builder
public class GraphSettings {
	/**
	 * Literal dimensions aren't persisted, so loaders use these.
	 */
	@Default double literalWidth = Literal.DEFAULT_WIDTH;
	@Default double literalHeight = Literal.DEFAULT_HEIGHT;

	/**
	 * If true, a loader calls {@link Graph#reattachParents()} once the whole graph is assembled.
	 * Turn this off when the caller intends to keep adding content and will reattach on its own.
	 */
	@Default boolean synchronizeOnLoad = true;

	public static GraphSettings defaults() {
		return builder().build();
	}

	public void validate() {
		if (!(literalWidth > 0 && literalHeight > 0)) {
			throw new IllegalArgumentException("Literal dimensions must be positive: " + literalWidth + "x" + literalHeight);
		}
	}
}
