package io.vena.egraph.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import io.vena.egraph.AbstractGraphTest;
import io.vena.egraph.Cut;
import io.vena.egraph.Graph;
import io.vena.egraph.GraphElement;
import io.vena.egraph.GraphElementContainer;
import io.vena.egraph.GraphSettings;
import io.vena.egraph.Literal;
import io.vena.egraph.geometry.Point;
import io.vena.egraph.geometry.Rect;
import java.awt.geom.AffineTransform;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static com.fasterxml.jackson.databind.SerializationFeature.INDENT_OUTPUT;
import static java.util.Collections.emptyList;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JacksonPluginTest extends AbstractGraphTest {
	private JacksonPlugin jacksonPlugin;
	private ObjectMapper graphMapper;

	/**
	 * Not configured by JacksonPlugin. Only for checking the properties of the generated JSON.
	 */
	private ObjectMapper plainMapper;

	@BeforeEach
	void setUpJackson() {
		plainMapper = new ObjectMapper();
		jacksonPlugin = new JacksonPlugin();
		graphMapper = mapperFor(GraphSettings.defaults());
	}

	@Test
	void literal_json() throws JsonProcessingException {
		String expected = "{ \"character\": \"P\", \"position\": { \"x\": 50.0, \"y\": 50.0 } }";
		assertJsonEquals(expected, graphMapper.writeValueAsString(literal("P", 50, 50)));
	}

	@Test
	void cut_json() throws JsonProcessingException {
		Cut cut = new Cut(List.of(literal("Q", 5, 6)), emptyList(), new Rect(0, 0, 100, 80));
		String expected = "{"
			+ "\"childLiterals\": [ { \"character\": \"Q\", \"position\": { \"x\": 5.0, \"y\": 6.0 } } ],"
			+ "\"childCuts\": [],"
			+ "\"frame\": { \"x\": 0.0, \"y\": 0.0, \"width\": 100.0, \"height\": 80.0 },"
			+ "\"transform\": { \"a\": 1.0, \"b\": 0.0, \"c\": 0.0, \"d\": 1.0, \"tx\": 0.0, \"ty\": 0.0 }"
			+ "}";
		assertJsonEquals(expected, graphMapper.writeValueAsString(cut));
	}

	@Test
	void transform_json() throws JsonProcessingException {
		AffineTransform transform = new AffineTransform(2, 3, 4, 5, 6, 7);
		String expected = "{ \"a\": 2.0, \"b\": 3.0, \"c\": 4.0, \"d\": 5.0, \"tx\": 6.0, \"ty\": 7.0 }";
		assertJsonEquals(expected, graphMapper.writeValueAsString(transform));
		assertEquals(transform, graphMapper.readValue(expected, AffineTransform.class));
	}

	@Test
	void pointAndRect_roundTrip() throws JsonProcessingException {
		Point point = new Point(-1.5, 2.25);
		Rect rect = new Rect(1, 2, 3, 4);
		assertEquals(point, graphMapper.readValue(graphMapper.writeValueAsString(point), Point.class));
		assertEquals(rect, graphMapper.readValue(graphMapper.writeValueAsString(rect), Rect.class));
	}

	@Test
	void emptyGraph_json() throws JsonProcessingException {
		assertJsonEquals("{ \"childLiterals\": [], \"childCuts\": [] }", graphMapper.writeValueAsString(new Graph()));
	}

	@Test
	void graph_roundTrip() throws JsonProcessingException {
		inner.insert(new Cut(emptyList(), emptyList(), new Rect(160, 160, 20, 20), AffineTransform.getRotateInstance(0.5)));

		Graph loaded = graphMapper.readValue(graphMapper.writeValueAsString(graph), Graph.class);

		assertSameStructure(graph, loaded);
		assertConsistent(loaded);
		assertFalse(loaded.isLoading());
		assertEquals(graph.allLiterals().size(), loaded.allLiterals().size());
		assertEquals(graph.allCuts().size(), loaded.allCuts().size());
	}

	@Test
	void roundTrip_doesNotPreserveIdentity() throws JsonProcessingException {
		Graph loaded = graphMapper.readValue(graphMapper.writeValueAsString(graph), Graph.class);
		assertNotEquals(graph, loaded);
		assertNotEquals(p, loaded.childLiterals().get(0));
		assertNotEquals(outer, loaded.childCuts().get(0));
	}

	@Test
	void transientState_isNotWritten() throws JsonProcessingException {
		p.setSelected(true);
		r.setHighlighted(true);
		inner.setSelected(true);

		String json = graphMapper.writeValueAsString(graph);
		assertThat(json, not(containsString("selected")));
		assertThat(json, not(containsString("ighlight")));
		assertThat(json, not(containsString("parent")));
		assertThat(json, not(containsString("allLiterals")));
		assertThat(json, not(containsString(p.id().toString())));

		Graph loaded = graphMapper.readValue(json, Graph.class);
		for (GraphElement element: loaded) {
			assertFalse(element.isSelected(), "Selected: " + element);
			assertFalse(element.isHighlighted(), "Highlighted: " + element);
		}
	}

	@Test
	void literalSize_comesFromSettings() throws JsonProcessingException {
		ObjectMapper mapper = mapperFor(GraphSettings.builder()
			.literalWidth(12)
			.literalHeight(24)
			.build());
		Literal literal = mapper.readValue("{ \"character\": \"P\", \"position\": { \"x\": 0, \"y\": 0 } }", Literal.class);
		assertEquals(new Rect(-6, -12, 12, 24), literal.frame());
	}

	@Test
	void noSynchronizeOnLoad_leavesGraphLoading() throws JsonProcessingException {
		ObjectMapper mapper = mapperFor(GraphSettings.builder()
			.synchronizeOnLoad(false)
			.build());
		Graph loaded = mapper.readValue(graphMapper.writeValueAsString(graph), Graph.class);
		assertTrue(loaded.isLoading());
		assertSameStructure(graph, loaded);

		loaded.reattachParents();
		assertConsistent(loaded);
	}

	@Test
	void invalidSettings_throw() {
		GraphSettings settings = GraphSettings.builder().literalWidth(-1).build();
		assertThrows(IllegalArgumentException.class, () -> jacksonPlugin.moduleFor(settings));
	}

	@ParameterizedTest
	@ValueSource(strings = {
		"{ \"childLiterals\": [] }",
		"{ \"childLiterals\": {}, \"childCuts\": [] }",
		"[]",
		"{ \"childLiterals\": [ { \"character\": \"PQ\", \"position\": { \"x\": 0, \"y\": 0 } } ], \"childCuts\": [] }",
		"{ \"childLiterals\": [ { \"character\": \"P\" } ], \"childCuts\": [] }",
		"{ \"childLiterals\": [ { \"character\": 7, \"position\": { \"x\": 0, \"y\": 0 } } ], \"childCuts\": [] }",
		"{ \"childLiterals\": [ { \"character\": \"P\", \"position\": { \"x\": \"zero\", \"y\": 0 } } ], \"childCuts\": [] }",
		"{ \"childLiterals\": [], \"childCuts\": [ { \"childLiterals\": [], \"childCuts\": [], \"frame\": { \"x\": 0, \"y\": 0, \"width\": 10, \"height\": 10 } } ] }",
		"{ \"childLiterals\": [], \"childCuts\": [ { \"childLiterals\": [], \"childCuts\": [], \"frame\": { \"x\": 0, \"y\": 0, \"width\": -10, \"height\": 10 }, \"transform\": { \"a\": 1, \"b\": 0, \"c\": 0, \"d\": 1, \"tx\": 0, \"ty\": 0 } } ] }",
		"{ \"childLiterals\": [], \"childCuts\": [ { \"childLiterals\": [], \"childCuts\": [], \"frame\": { \"x\": 0, \"y\": 0, \"width\": 10, \"height\": 10 }, \"transform\": { \"a\": 1, \"b\": 0, \"c\": 0, \"d\": 1 } } ] }",
	})
	void malformedGraph_throws(String json) {
		assertThrows(MismatchedInputException.class, () -> graphMapper.readValue(json, Graph.class));
	}

	private ObjectMapper mapperFor(GraphSettings settings) {
		return new ObjectMapper()
			.registerModule(jacksonPlugin.moduleFor(settings))
			.enable(INDENT_OUTPUT);
	}

	private void assertJsonEquals(String expected, String actual) throws JsonProcessingException {
		JsonNode expectedTree = plainMapper.readTree(expected);
		JsonNode actualTree = plainMapper.readTree(actual);
		assertEquals(expectedTree, actualTree);
	}

	/**
	 * Compares authored content only. Identities are expected to differ.
	 */
	private static void assertSameStructure(GraphElementContainer expected, GraphElementContainer actual) {
		assertEquals(expected.childLiterals().size(), actual.childLiterals().size(), "Literals in " + actual);
		for (int i = 0; i < expected.childLiterals().size(); i++) {
			Literal e = expected.childLiterals().get(i);
			Literal a = actual.childLiterals().get(i);
			assertEquals(e.character(), a.character());
			assertEquals(e.position(), a.position());
			assertEquals(e.frame(), a.frame());
		}
		assertEquals(expected.childCuts().size(), actual.childCuts().size(), "Cuts in " + actual);
		for (int i = 0; i < expected.childCuts().size(); i++) {
			Cut e = expected.childCuts().get(i);
			Cut a = actual.childCuts().get(i);
			assertEquals(e.frame(), a.frame());
			assertEquals(e.transform(), a.transform());
			assertEquals(e.position(), a.position());
			assertSameStructure(e, a);
		}
	}
}
