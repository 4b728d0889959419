package io.vena.strata.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.vena.strata.EntitySerializer;
import io.vena.strata.EntitySnapshot;
import io.vena.strata.exceptions.DeserializationException;
import io.vena.strata.exceptions.SerializationException;
import java.io.IOException;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An {@link EntitySerializer} that writes JSON.
 *
 * <p>
 * Byte arrays, which is what snapshots hold for encoded columns, are written as base64 strings;
 * {@link #convert} turns them back into byte arrays.
 *
 * <p>
 * JSON numbers carry no width, so untyped integers are read as {@link Long} and untyped
 * decimals as {@link java.math.BigDecimal}, which loses neither range nor scale.
 * Values whose type is declared are then converted to that type.
 */
public final class JacksonSerializer implements EntitySerializer {
	private final ObjectMapper mapper;

	public JacksonSerializer() {
		this(new ObjectMapper());
	}

	/**
	 * @param mapper is copied, not modified
	 */
	public JacksonSerializer(ObjectMapper mapper) {
		this.mapper = mapper.copy()
			.enable(DeserializationFeature.USE_LONG_FOR_INTS)
			.enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
			.registerModule(new StrataJacksonModule());
	}

	@Override
	public byte[] flatten(Object value) {
		try {
			return mapper.writeValueAsBytes(value);
		} catch (JsonProcessingException e) {
			throw new SerializationException("Unable to serialize " + value.getClass().getSimpleName(), e);
		}
	}

	@Override
	public <T> T restore(byte[] bytes, Class<T> type) {
		try {
			return mapper.readValue(bytes, type);
		} catch (IOException e) {
			throw new DeserializationException("Unable to deserialize " + type.getSimpleName(), e);
		}
	}

	@Override
	@SuppressWarnings("unchecked")
	public @Nullable <T> T convert(@Nullable Object raw, Class<T> type) {
		if (raw == null) {
			return null;
		} else if (!type.isPrimitive() && type.isInstance(raw)) {
			return type.cast(raw);
		}
		try {
			return (T) mapper.convertValue(raw, type);
		} catch (IllegalArgumentException e) {
			throw new DeserializationException("Unable to convert " + raw.getClass().getSimpleName() + " to " + type.getSimpleName(), e);
		}
	}

	@Override
	public byte[] writeSnapshot(EntitySnapshot snapshot) {
		try {
			return mapper.writeValueAsBytes(snapshot);
		} catch (JsonProcessingException e) {
			throw new SerializationException("Unable to write snapshot of " + snapshot.type(), e);
		}
	}

	@Override
	public EntitySnapshot readSnapshot(byte[] bytes) {
		try {
			EntitySnapshot result = mapper.readValue(bytes, EntitySnapshot.class);
			LOGGER.trace("Read snapshot of {} oid {}", result.type(), result.oid());
			return result;
		} catch (IOException e) {
			throw new DeserializationException("Invalid entity snapshot", e);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(JacksonSerializer.class);
}
