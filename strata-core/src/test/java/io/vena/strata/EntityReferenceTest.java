package io.vena.strata;

import io.vena.strata.exceptions.InvalidFieldException;
import io.vena.strata.exceptions.InvalidReferenceException;
import io.vena.strata.exceptions.UnknownFieldException;
import io.vena.strata.exceptions.UnknownReferenceException;
import io.vena.strata.metadata.EntityClass;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import static io.vena.strata.exceptions.InvalidReferenceException.Kind.MANY_TO_MANY;
import static io.vena.strata.exceptions.InvalidReferenceException.Kind.ONE_TO_MANY;
import static io.vena.strata.exceptions.InvalidReferenceException.Kind.ONE_TO_ONE;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EntityReferenceTest extends AbstractEntityTest {
	User user;
	Address address;

	@BeforeEach
	void setupEntities() {
		user = manager.hydrate(User.class, row("id", 1L, "name", "Alice"));
		address = manager.hydrate(Address.class, row("id", 10L, "city", "Toronto", "postcode", "M5V 2T6"));
	}

	@Test
	void lazyRelation_isLoadedOnceThroughTheManager() {
		AtomicInteger calls = new AtomicInteger();
		manager.registerLoader(User.class, "address", (owner, relation) -> {
			calls.incrementAndGet();
			assertSame(user, owner);
			assertEquals("address", relation.name());
			return address;
		});

		assertFalse(user.hasReference("address"));
		assertSame(address, user.getValue("address"));
		assertSame(address, user.getValue("address"));
		assertEquals(1, calls.get());
		assertTrue(user.hasReference("address"));
		assertSame(address, user.getReference("address"));
	}

	@Test
	void lazyRelation_withNoLoader_isCachedAsNull() {
		assertNull(user.getValue("groups"));
		assertTrue(user.hasReference("groups"));
		assertNull(user.getReference("groups"));
		assertFalse(user.contains("groups"));
	}

	@Test
	void eagerRelation_notLoaded_readsAsNullWithoutLoading() {
		manager.register(EntityClass.builder(Group.class)
			.identifier("id")
			.field("id", Long.class)
			.relation(manager.classDescriptorFor(User.class).getRelation("groups").withLazilyLoaded(false))
			.build());
		manager.registerLoader(Group.class, "groups", (owner, relation) -> {
			throw new AssertionError("Eager relations are loaded with their owner");
		});
		Group group = manager.hydrate(Group.class, row("id", 1L));

		assertNull(group.getValue("groups"));
		assertFalse(group.hasReference("groups"));
	}

	@Test
	void getReference_neverLoaded_throws() {
		UnknownReferenceException e = assertThrows(UnknownReferenceException.class, () -> user.getReference("address"));
		assertThat(e.getMessage(), containsString("address"));
	}

	@Test
	void getField_seesLoadedReferences() {
		user.setValue("address", address);
		assertSame(address, user.getField("address"));
	}

	static Stream<Arguments> wrongShapes() {
		return Stream.of(
			Arguments.of("phones", "not a collection", ONE_TO_MANY),
			Arguments.of("phones", List.of(), ONE_TO_MANY),
			Arguments.of("address", EntityCollection.of(), ONE_TO_ONE),
			Arguments.of("address", 10L, ONE_TO_ONE),
			Arguments.of("profile", "someone", ONE_TO_ONE),
			Arguments.of("groups", "admins", MANY_TO_MANY)
		);
	}

	@ParameterizedTest
	@MethodSource("wrongShapes")
	void setReference_wrongShape_throws(String relationName, Object value, InvalidReferenceException.Kind expectedKind) {
		InvalidReferenceException e = assertThrows(InvalidReferenceException.class, () -> user.setValue(relationName, value));
		assertEquals(expectedKind, e.kind());
		assertThat(e.getMessage(), containsString(value.getClass().getSimpleName()));
		assertFalse(user.hasReference(relationName));
	}

	@Test
	void setReference_undeclared_throws() {
		assertThrows(InvalidFieldException.class, () -> user.setReference("nonexistent", address));
	}

	@Test
	void setReference_null_recordsEmptyRelation() {
		user.setValue("address", null);
		assertTrue(user.hasReference("address"));
		assertNull(user.getReference("address"));
		assertNull(user.getValue("address"), "Must not try to load it");
	}

	@Test
	void oneToOne_local_joinsOnIdentifier() {
		user.setValue("address", address);
		assertSame(address, user.getReference("address"));
		assertSame(address, user.getField("addressId"), "Resolved to a key when written");
		assertTrue(user.getModified().containsKey("addressId"));
	}

	@Test
	void oneToOne_local_copiesForeignField() {
		user.setValue("billingAddress", address);
		assertSame(address, user.getReference("billingAddress"));
		assertEquals("M5V 2T6", user.getField("billingPostcode"));
	}

	@Test
	void oneToOne_local_unloadedForeignField_throws() {
		Address partial = manager.hydrate(Address.class, row("id", 11L, "city", "Ottawa"));
		UnknownFieldException e = assertThrows(UnknownFieldException.class, () -> user.setValue("billingAddress", partial));
		assertThat(e.getMessage(), containsString("postcode"));
		assertFalse(user.isLoaded("billingPostcode"));
	}

	@Test
	void oneToOne_foreign_setsFieldOnRelatedEntity() {
		Profile profile = manager.create(Profile.class);
		user.setValue("profile", profile);
		assertSame(profile, user.getReference("profile"));
		assertSame(user, profile.getField("user"));
		assertTrue(profile.isModified());
		assertFalse(user.isModified());
	}

	@Test
	void oneToMany_replacingCollection_keepsTheSameObject() {
		Phone home = manager.hydrate(Phone.class, row("id", 100L, "number", "111"));
		Phone work = manager.hydrate(Phone.class, row("id", 101L, "number", "222"));
		EntityCollection<Phone> original = EntityCollection.of(home);
		user.setValue("phones", original);
		assertSame(original, user.getReference("phones"));

		user.setValue("phones", EntityCollection.of(work));
		assertSame(original, user.getReference("phones"));
		assertEquals(List.of(work), original);
	}

	@Test
	void manyToMany_storesCollection() {
		Group group = manager.hydrate(Group.class, row("id", 7L, "name", "admins"));
		EntityCollection<Group> groups = EntityCollection.of(group);
		user.setValue("groups", groups);
		assertSame(groups, user.getReference("groups"));
		assertTrue(user.contains("groups"));
	}

	@Test
	void remove_entityReference_becomesNull() {
		user.setValue("address", address);
		user.remove("address");
		assertTrue(user.hasReference("address"));
		assertNull(user.getReference("address"));
		assertEquals("Toronto", address.getField("city"), "Related entity is untouched");
	}

	@Test
	void remove_collectionReference_clearsInPlace() {
		Phone phone = manager.hydrate(Phone.class, row("id", 100L, "number", "111"));
		EntityCollection<Phone> phones = EntityCollection.of(phone);
		user.setValue("phones", phones);
		user.remove("phones");
		assertSame(phones, user.getReference("phones"));
		assertTrue(phones.isEmpty());
	}

	@Test
	void allReferences_includesEmptyOnes() {
		user.setValue("address", address);
		user.setValue("profile", null);
		Map<String, Object> references = user.allReferences();
		assertEquals(2, references.size());
		assertSame(address, references.get("address"));
		assertTrue(references.containsKey("profile"));
		assertNull(references.get("profile"));
	}

	@Test
	void setRelatedCollection_hasNoSideEffects() {
		Phone phone = manager.hydrate(Phone.class, row("id", 100L, "number", "111"));
		EntityCollection<Phone> phones = EntityCollection.of(phone);
		user.setRelatedCollection("phonesByNumber", phones);
		assertSame(phones, user.getReference("phonesByNumber"));
		assertFalse(user.isModified());
		assertFalse(phone.isModified());
	}
}
