package io.vena.egraph.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.DeserializationConfig;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializationConfig;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.Deserializers;
import com.fasterxml.jackson.databind.ser.Serializers;
import io.vena.egraph.Cut;
import io.vena.egraph.ElementContainer;
import io.vena.egraph.Graph;
import io.vena.egraph.GraphSettings;
import io.vena.egraph.Literal;
import io.vena.egraph.geometry.Point;
import io.vena.egraph.geometry.Rect;
import java.awt.geom.AffineTransform;
import java.io.IOException;
import lombok.NonNull;

/**
 * Provides JSON serialization/deserialization of existential graphs using Jackson.
 *
 * <p>
 * Only the authored content is written: for a {@link Cut}, its children, frame and transform;
 * for a {@link Literal}, its character and position. Identifiers, parent references,
 * flattened sets, selection and highlighting are not persisted, and come back
 * with fresh or default values. Literal sizes come from the {@link GraphSettings}.
 *
 * <p>
 * Deserializing a {@link Graph} assembles the tree bottom-up and then,
 * if {@link GraphSettings#synchronizeOnLoad()}, calls {@link Graph#reattachParents()}.
 * Otherwise, the graph is marked {@link Graph#isLoading() loading} and the caller is
 * responsible for reattaching once it's done.
 */
public final class JacksonPlugin {
	static final String CHILD_LITERALS = "childLiterals";
	static final String CHILD_CUTS = "childCuts";
	static final String FRAME = "frame";
	static final String TRANSFORM = "transform";
	static final String CHARACTER = "character";
	static final String POSITION = "position";

	public EgraphJacksonModule moduleFor(@NonNull GraphSettings settings) {
		settings.validate();
		return new EgraphJacksonModule() {
			@Override
			public void setupModule(SetupContext context) {
				context.addSerializers(new GraphSerializers());
				context.addDeserializers(new GraphDeserializers(new GraphTreeReader(settings)));
			}
		};
	}

	private static final class GraphSerializers extends Serializers.Base {
		@Override
		public JsonSerializer<?> findSerializer(SerializationConfig config, JavaType type, BeanDescription beanDesc) {
			Class<?> theClass = type.getRawClass();
			if (Graph.class.isAssignableFrom(theClass)) {
				return graphSerializer();
			} else if (Cut.class.isAssignableFrom(theClass)) {
				return cutSerializer();
			} else if (Literal.class.isAssignableFrom(theClass)) {
				return literalSerializer();
			} else if (Point.class.isAssignableFrom(theClass)) {
				return pointSerializer();
			} else if (Rect.class.isAssignableFrom(theClass)) {
				return rectSerializer();
			} else if (AffineTransform.class.isAssignableFrom(theClass)) {
				return transformSerializer();
			} else {
				return null;
			}
		}

		private JsonSerializer<Graph> graphSerializer() {
			return new JsonSerializer<Graph>() {
				@Override
				public void serialize(Graph value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
					gen.writeStartObject();
					writeChildren(value, gen, serializers);
					gen.writeEndObject();
				}
			};
		}

		private JsonSerializer<Cut> cutSerializer() {
			return new JsonSerializer<Cut>() {
				@Override
				public void serialize(Cut value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
					gen.writeStartObject();
					writeChildren(value, gen, serializers);
					serializers.defaultSerializeField(FRAME, value.frame(), gen);
					serializers.defaultSerializeField(TRANSFORM, value.transform(), gen);
					gen.writeEndObject();
				}
			};
		}

		private JsonSerializer<Literal> literalSerializer() {
			return new JsonSerializer<Literal>() {
				@Override
				public void serialize(Literal value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
					gen.writeStartObject();
					gen.writeStringField(CHARACTER, value.character());
					serializers.defaultSerializeField(POSITION, value.position(), gen);
					gen.writeEndObject();
				}
			};
		}

		private JsonSerializer<Point> pointSerializer() {
			return new JsonSerializer<Point>() {
				@Override
				public void serialize(Point value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
					gen.writeStartObject();
					gen.writeNumberField("x", value.x());
					gen.writeNumberField("y", value.y());
					gen.writeEndObject();
				}
			};
		}

		private JsonSerializer<Rect> rectSerializer() {
			return new JsonSerializer<Rect>() {
				@Override
				public void serialize(Rect value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
					gen.writeStartObject();
					gen.writeNumberField("x", value.x());
					gen.writeNumberField("y", value.y());
					gen.writeNumberField("width", value.width());
					gen.writeNumberField("height", value.height());
					gen.writeEndObject();
				}
			};
		}

		private JsonSerializer<AffineTransform> transformSerializer() {
			return new JsonSerializer<AffineTransform>() {
				@Override
				public void serialize(AffineTransform value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
					double[] matrix = new double[6];
					value.getMatrix(matrix);
					gen.writeStartObject();
					for (int i = 0; i < matrix.length; i++) {
						gen.writeNumberField(GraphTreeReader.TRANSFORM_COMPONENTS.get(i), matrix[i]);
					}
					gen.writeEndObject();
				}
			};
		}

		private static void writeChildren(ElementContainer container, JsonGenerator gen, SerializerProvider serializers) throws IOException {
			gen.writeArrayFieldStart(CHILD_LITERALS);
			for (Literal literal: container.childLiterals()) {
				serializers.defaultSerializeValue(literal, gen);
			}
			gen.writeEndArray();
			gen.writeArrayFieldStart(CHILD_CUTS);
			for (Cut cut: container.childCuts()) {
				serializers.defaultSerializeValue(cut, gen);
			}
			gen.writeEndArray();
		}
	}

	private static final class GraphDeserializers extends Deserializers.Base {
		private final GraphTreeReader reader;

		GraphDeserializers(GraphTreeReader reader) {
			this.reader = reader;
		}

		@Override
		public JsonDeserializer<?> findBeanDeserializer(JavaType type, DeserializationConfig config, BeanDescription beanDesc) {
			Class<?> theClass = type.getRawClass();
			if (Graph.class.isAssignableFrom(theClass)) {
				return new TreeDeserializer<Graph>(reader::readGraph);
			} else if (Cut.class.isAssignableFrom(theClass)) {
				return new TreeDeserializer<Cut>(reader::readCut);
			} else if (Literal.class.isAssignableFrom(theClass)) {
				return new TreeDeserializer<Literal>(reader::readLiteral);
			} else if (Point.class.isAssignableFrom(theClass)) {
				return new TreeDeserializer<Point>(reader::readPoint);
			} else if (Rect.class.isAssignableFrom(theClass)) {
				return new TreeDeserializer<Rect>(reader::readRect);
			} else if (AffineTransform.class.isAssignableFrom(theClass)) {
				return new TreeDeserializer<AffineTransform>(reader::readTransform);
			} else {
				return null;
			}
		}
	}

	/**
	 * Reads the whole value as a tree first, then hands it to a {@link GraphTreeReader} method.
	 */
	private static final class TreeDeserializer<T> extends JsonDeserializer<T> {
		private final GraphTreeReader.NodeReader<T> nodeReader;

		TreeDeserializer(GraphTreeReader.NodeReader<T> nodeReader) {
			this.nodeReader = nodeReader;
		}

		@Override
		public T deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
			JsonNode node = ctxt.readTree(p);
			return nodeReader.read(node, ctxt);
		}
	}
}
