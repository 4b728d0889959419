package io.vena.strata.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.DeserializationConfig;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.Module;
import com.fasterxml.jackson.databind.SerializationConfig;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.Deserializers;
import com.fasterxml.jackson.databind.jsontype.TypeDeserializer;
import com.fasterxml.jackson.databind.ser.Serializers;
import com.fasterxml.jackson.databind.type.CollectionType;
import io.vena.strata.Entity;
import io.vena.strata.EntityCollection;
import java.io.IOException;

import static com.fasterxml.jackson.core.JsonToken.END_ARRAY;
import static com.fasterxml.jackson.core.JsonToken.START_ARRAY;

/**
 * Lets entities appear inside values that Jackson serializes, such as
 * {@link io.vena.strata.metadata.FieldType#OBJECT OBJECT} column values.
 *
 * <p>
 * An {@link Entity} is written as a binary value holding its {@link Entity#toBytes() snapshot},
 * and read back with {@link Entity#fromBytes}, so it comes back as a new object with the same state.
 * Reading requires a concrete static type, because the manager is looked up by type;
 * an {@link EntityCollection} is read back as an array of its declared element type.
 */
public final class StrataJacksonModule extends Module {

	@Override
	public String getModuleName() {
		return getClass().getSimpleName();
	}

	@Override
	public Version version() {
		return Version.unknownVersion();
	}

	@Override
	public void setupModule(SetupContext context) {
		context.addSerializers(new StrataSerializers());
		context.addDeserializers(new StrataDeserializers());
	}

	private static final class StrataSerializers extends Serializers.Base {
		@Override
		public JsonSerializer<?> findSerializer(SerializationConfig config, JavaType type, BeanDescription beanDesc) {
			if (Entity.class.isAssignableFrom(type.getRawClass())) {
				return ENTITY_SERIALIZER;
			} else {
				return null;
			}
		}
	}

	private static final class StrataDeserializers extends Deserializers.Base {
		@Override
		public JsonDeserializer<?> findBeanDeserializer(JavaType type, DeserializationConfig config, BeanDescription beanDesc) {
			Class<?> theClass = type.getRawClass();
			if (Entity.class.isAssignableFrom(theClass)) {
				return entityDeserializer(theClass.asSubclass(Entity.class));
			} else {
				return null;
			}
		}

		@Override
		public JsonDeserializer<?> findCollectionDeserializer(CollectionType type, DeserializationConfig config, BeanDescription beanDesc, TypeDeserializer elementTypeDeserializer, JsonDeserializer<?> elementDeserializer) {
			if (EntityCollection.class.isAssignableFrom(type.getRawClass())) {
				Class<?> elementType = type.getContentType().getRawClass();
				if (!Entity.class.isAssignableFrom(elementType) || elementType == Entity.class) {
					throw new IllegalArgumentException("Can't deserialize " + type + " without a concrete element type");
				}
				return entityCollectionDeserializer(elementType.asSubclass(Entity.class));
			} else {
				return null;
			}
		}
	}

	private static final JsonSerializer<Entity> ENTITY_SERIALIZER = new JsonSerializer<>() {
		@Override
		public void serialize(Entity value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
			gen.writeBinary(value.toBytes());
		}
	};

	private static <E extends Entity> JsonDeserializer<E> entityDeserializer(Class<E> entityType) {
		return new JsonDeserializer<E>() {
			@Override
			public E deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
				return Entity.fromBytes(entityType, p.getBinaryValue());
			}
		};
	}

	private static <E extends Entity> JsonDeserializer<EntityCollection<E>> entityCollectionDeserializer(Class<E> elementType) {
		return new JsonDeserializer<EntityCollection<E>>() {
			@Override
			public EntityCollection<E> deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
				expect(START_ARRAY, p, ctxt);
				EntityCollection<E> result = new EntityCollection<>();
				while (p.nextToken() != END_ARRAY) {
					result.add(Entity.fromBytes(elementType, p.getBinaryValue()));
				}
				return result;
			}
		};
	}

	private static void expect(JsonToken expected, JsonParser p, DeserializationContext ctxt) throws IOException {
		if (p.currentToken() != expected) {
			ctxt.reportInputMismatch(EntityCollection.class, "Expected %s; found %s", expected, p.currentToken());
		}
	}
}
