package io.vena.strata;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;

/**
 * The serializable state of an {@link Entity}, as produced by {@link Entity#toBytes()}.
 *
 * <p>
 * Field values have already been encoded for storage: structured values are flattened,
 * compressed text is compressed, and enumerated values are replaced by their codes.
 * References and the owning manager are not included.
 *
 * @param type the name of the entity class
 * @param oid the object id of the entity that was captured; not reused on restore
 * @param modified the names of fields that had unsaved changes
 */
public record EntitySnapshot(
	String type,
	LifecycleState state,
	long oid,
	Map<String, Object> fields,
	Map<String, Object> identity,
	List<String> modified
) {
	public EntitySnapshot {
		requireNonNull(type);
		requireNonNull(state);
		// These may contain nulls, so Map.copyOf is out
		fields = unmodifiableMap(new LinkedHashMap<>(fields));
		identity = unmodifiableMap(new LinkedHashMap<>(identity));
		modified = List.copyOf(modified);
	}
}
