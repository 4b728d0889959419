package io.vena.strata.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.vena.strata.Change;
import io.vena.strata.Entity;
import io.vena.strata.exceptions.DeserializationException;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import static io.vena.strata.LifecycleState.DELETED;
import static io.vena.strata.LifecycleState.MANAGED;
import static io.vena.strata.LifecycleState.NEW;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EntityRoundTripTest extends AbstractJacksonTest {

	static Stream<Arguments> fieldValues() {
		return Stream.of(
			Arguments.of("name", "Ada Lovelace"),
			Arguments.of("balance", 1234.5),
			Arguments.of("creditLimit", new BigDecimal("12.50")),
			Arguments.of("creditLimit", new BigDecimal("12345678901234567.89")),
			Arguments.of("ref", 3L),
			Arguments.of("ref", 12345678901234567L),
			Arguments.of("ref", new BigDecimal("0.1")),
			Arguments.of("active", true),
			Arguments.of("active", false),
			Arguments.of("status", Status.CHURNED),
			Arguments.of("plan", "premium"),
			Arguments.of("notes", "Prefers email. ".repeat(50)),
			Arguments.of("tags", List.of("vip", "early-adopter")),
			Arguments.of("tags", List.of(1L, 2L)),
			Arguments.of("preferences", Map.of("language", "en", "digest", "weekly"))
		);
	}

	@ParameterizedTest
	@MethodSource("fieldValues")
	void fieldValue_survives(String fieldName, Object value) {
		Customer original = manager.hydrate(Customer.class, row("id", 1L, fieldName, value));
		Customer restored = Entity.fromBytes(Customer.class, original.toBytes());
		assertEquals(value, restored.getField(fieldName));
		assertEquals(1L, restored.getField("id"), "Integral values come back as their declared type");
	}

	@Test
	void wholeEntity_survives() {
		Customer original = manager.hydrate(Customer.class, row(
			"id", 42L,
			"name", "Grace Hopper",
			"active", true,
			"status", Status.ACTIVE,
			"notes", "Navy",
			"tags", List.of("cobol")));

		Customer restored = Entity.fromBytes(Customer.class, original.toBytes());

		assertNotSame(original, restored);
		assertNotEquals(original.getOid(), restored.getOid());
		assertEquals(MANAGED, restored.getState());
		assertEquals(Map.of("id", 42L), restored.identity());
		assertEquals(original.getData(), restored.getData());
		assertFalse(restored.isModified());
	}

	@Test
	void state_survives() {
		Customer original = manager.hydrate(Customer.class, row("id", 1L));
		original.setState(DELETED);
		assertEquals(DELETED, Entity.fromBytes(Customer.class, original.toBytes()).getState());
	}

	@Test
	void pendingChanges_survive() {
		Customer original = manager.create(Customer.class);
		original.setValue("id", 5L);
		original.setValue("status", Status.PROSPECT);

		Customer restored = Entity.fromBytes(Customer.class, original.toBytes());

		assertEquals(NEW, restored.getState());
		assertEquals(Map.of("id", 5L), restored.identity());
		assertEquals(List.of(new Change(null, Status.PROSPECT)), restored.getModified().get("status"));
		assertEquals(original.buildWritePayload(), restored.buildWritePayload());
	}

	@Test
	void compositeIdentity_survives() {
		LineItem original = manager.hydrate(LineItem.class, row("orderId", 100L, "line", null, "sku", "X-1"));
		LineItem restored = Entity.fromBytes(LineItem.class, original.toBytes());
		assertEquals(row("orderId", 100L, "line", null), restored.identity());
		assertEquals("X-1", restored.getField("sku"));
	}

	@Test
	void entityInObjectColumn_isRestoredAsACopy() {
		Customer referrer = manager.hydrate(Customer.class, row("id", 1L, "name", "Alan"));
		Customer original = manager.hydrate(Customer.class, row("id", 2L, "name", "Joan", "referrer", referrer));

		Customer restored = Entity.fromBytes(Customer.class, original.toBytes());

		Customer restoredReferrer = (Customer) restored.getField("referrer");
		assertNotSame(referrer, restoredReferrer);
		assertEquals(referrer.getData(), restoredReferrer.getData());
		assertEquals(referrer.identity(), restoredReferrer.identity());
	}

	@Test
	void entityInPlainColumn_isDropped() {
		Account account = manager.hydrate(Account.class, row("id", 9L, "number", "ACC-9"));
		Customer original = manager.hydrate(Customer.class, row("id", 1L));
		original.setValue("account", account);

		Customer restored = Entity.fromBytes(Customer.class, original.toBytes());

		assertFalse(restored.isLoaded("accountId"));
		assertFalse(restored.hasReference("account"));
		assertTrue(restored.getModified().containsKey("accountId"), "The change itself is still pending");
	}

	@Test
	void snapshot_isReadableJson() throws IOException {
		Customer customer = manager.hydrate(Customer.class, row("id", 7L, "name", "Edsger"));
		customer.setValue("name", "Edsger W.");
		String json = new String(customer.toBytes(), StandardCharsets.UTF_8);
		assertThat(json, not(containsString("references")));

		JsonNode snapshot = new ObjectMapper().readTree(json);
		assertEquals(Customer.class.getName(), snapshot.get("type").asText());
		assertEquals("MANAGED", snapshot.get("state").asText());
		assertEquals(customer.getOid(), snapshot.get("oid").asLong());
		assertEquals("Edsger W.", snapshot.get("fields").get("name").asText());
		assertEquals(7, snapshot.get("identity").get("id").asInt());
		assertEquals("name", snapshot.get("modified").get(0).asText());
	}

	@Test
	void fromBytes_garbage_throws() {
		byte[] garbage = "{ not json".getBytes(StandardCharsets.UTF_8);
		assertThrows(DeserializationException.class, () -> Entity.fromBytes(Customer.class, garbage));
	}

	@Test
	void fromBytes_wrongClass_throws() {
		Customer customer = manager.hydrate(Customer.class, row("id", 1L));
		byte[] bytes = customer.toBytes();
		assertThrows(DeserializationException.class, () -> Entity.fromBytes(Account.class, bytes));
	}
}
