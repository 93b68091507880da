package io.vena.egraph.jackson;

import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import io.vena.egraph.Cut;
import io.vena.egraph.Graph;
import io.vena.egraph.GraphSettings;
import io.vena.egraph.Literal;
import io.vena.egraph.geometry.Point;
import io.vena.egraph.geometry.Rect;
import java.awt.geom.AffineTransform;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.vena.egraph.jackson.JacksonPlugin.CHARACTER;
import static io.vena.egraph.jackson.JacksonPlugin.CHILD_CUTS;
import static io.vena.egraph.jackson.JacksonPlugin.CHILD_LITERALS;
import static io.vena.egraph.jackson.JacksonPlugin.FRAME;
import static io.vena.egraph.jackson.JacksonPlugin.POSITION;
import static io.vena.egraph.jackson.JacksonPlugin.TRANSFORM;

/**
 * Builds graph objects from already-parsed JSON trees.
 * Children are built before their containers, so the tree is assembled bottom-up.
 */
@RequiredArgsConstructor
final class GraphTreeReader {
	/**
	 * In the order used by {@link AffineTransform#getMatrix(double[])}.
	 */
	static final List<String> TRANSFORM_COMPONENTS = List.of("a", "b", "c", "d", "tx", "ty");

	private final GraphSettings settings;

	@FunctionalInterface
	interface NodeReader<T> {
		T read(JsonNode node, DeserializationContext ctxt) throws IOException;
	}

	Graph readGraph(JsonNode node, DeserializationContext ctxt) throws IOException {
		requireObject(node, Graph.class, ctxt);
		List<Literal> literals = readLiterals(node, ctxt);
		List<Cut> cuts = readCuts(node, ctxt);
		Graph graph = new Graph(literals, cuts, !settings.synchronizeOnLoad());
		if (settings.synchronizeOnLoad()) {
			graph.reattachParents();
		}
		LOGGER.debug("Loaded graph with {} literals and {} cuts", graph.allLiterals().size(), graph.allCuts().size());
		return graph;
	}

	Cut readCut(JsonNode node, DeserializationContext ctxt) throws IOException {
		requireObject(node, Cut.class, ctxt);
		List<Literal> literals = readLiterals(node, ctxt);
		List<Cut> cuts = readCuts(node, ctxt);
		Rect frame = readRect(requiredField(node, FRAME, Cut.class, ctxt), ctxt);
		AffineTransform transform = readTransform(requiredField(node, TRANSFORM, Cut.class, ctxt), ctxt);
		return new Cut(literals, cuts, frame, transform);
	}

	Literal readLiteral(JsonNode node, DeserializationContext ctxt) throws IOException {
		requireObject(node, Literal.class, ctxt);
		JsonNode characterNode = requiredField(node, CHARACTER, Literal.class, ctxt);
		if (!characterNode.isTextual()) {
			return ctxt.reportInputMismatch(Literal.class, "Field \"%s\" must be a string", CHARACTER);
		}
		Point position = readPoint(requiredField(node, POSITION, Literal.class, ctxt), ctxt);
		try {
			return new Literal(characterNode.textValue(), position, settings);
		} catch (IllegalArgumentException e) {
			return ctxt.reportInputMismatch(Literal.class, "Invalid literal: %s", e.getMessage());
		}
	}

	Point readPoint(JsonNode node, DeserializationContext ctxt) throws IOException {
		requireObject(node, Point.class, ctxt);
		return new Point(
			requiredDouble(node, "x", Point.class, ctxt),
			requiredDouble(node, "y", Point.class, ctxt));
	}

	Rect readRect(JsonNode node, DeserializationContext ctxt) throws IOException {
		requireObject(node, Rect.class, ctxt);
		double width = requiredDouble(node, "width", Rect.class, ctxt);
		double height = requiredDouble(node, "height", Rect.class, ctxt);
		if (width < 0 || height < 0) {
			return ctxt.reportInputMismatch(Rect.class, "Rect dimensions can't be negative: %sx%s", width, height);
		}
		return new Rect(
			requiredDouble(node, "x", Rect.class, ctxt),
			requiredDouble(node, "y", Rect.class, ctxt),
			width,
			height);
	}

	AffineTransform readTransform(JsonNode node, DeserializationContext ctxt) throws IOException {
		requireObject(node, AffineTransform.class, ctxt);
		double[] matrix = new double[TRANSFORM_COMPONENTS.size()];
		for (int i = 0; i < matrix.length; i++) {
			matrix[i] = requiredDouble(node, TRANSFORM_COMPONENTS.get(i), AffineTransform.class, ctxt);
		}
		return new AffineTransform(matrix);
	}

	private List<Literal> readLiterals(JsonNode containerNode, DeserializationContext ctxt) throws IOException {
		List<Literal> result = new ArrayList<>();
		for (JsonNode literalNode: requiredArray(containerNode, CHILD_LITERALS, ctxt)) {
			result.add(readLiteral(literalNode, ctxt));
		}
		return result;
	}

	private List<Cut> readCuts(JsonNode containerNode, DeserializationContext ctxt) throws IOException {
		List<Cut> result = new ArrayList<>();
		for (JsonNode cutNode: requiredArray(containerNode, CHILD_CUTS, ctxt)) {
			result.add(readCut(cutNode, ctxt));
		}
		return result;
	}

	private static void requireObject(JsonNode node, Class<?> targetType, DeserializationContext ctxt) throws IOException {
		if (!node.isObject()) {
			ctxt.reportInputMismatch(targetType, "Expected a JSON object for %s; found %s", targetType.getSimpleName(), node.getNodeType());
		}
	}

	private static JsonNode requiredField(JsonNode node, String fieldName, Class<?> targetType, DeserializationContext ctxt) throws IOException {
		JsonNode result = node.get(fieldName);
		if (result == null || result.isNull()) {
			return ctxt.reportInputMismatch(targetType, "%s is missing field \"%s\"", targetType.getSimpleName(), fieldName);
		}
		return result;
	}

	private static JsonNode requiredArray(JsonNode node, String fieldName, DeserializationContext ctxt) throws IOException {
		JsonNode result = requiredField(node, fieldName, List.class, ctxt);
		if (!result.isArray()) {
			return ctxt.reportInputMismatch(List.class, "Field \"%s\" must be an array", fieldName);
		}
		return result;
	}

	private static double requiredDouble(JsonNode node, String fieldName, Class<?> targetType, DeserializationContext ctxt) throws IOException {
		JsonNode result = requiredField(node, fieldName, targetType, ctxt);
		if (!result.isNumber()) {
			return ctxt.reportInputMismatch(targetType, "Field \"%s\" of %s must be a number", fieldName, targetType.getSimpleName());
		}
		return result.doubleValue();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(GraphTreeReader.class);
}
