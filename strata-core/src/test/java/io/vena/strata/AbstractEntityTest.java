package io.vena.strata;

import io.vena.strata.metadata.EntityClass;
import io.vena.strata.metadata.InheritanceKind;
import io.vena.strata.metadata.OwningSide;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;

/**
 * Entity classes and a manager that knows about them, for tests that need a small schema.
 */
public abstract class AbstractEntityTest {
	protected SimpleEntityManager manager;
	protected InMemorySerializer serializer;

	@BeforeEach
	void setupManager() {
		serializer = new InMemorySerializer();
		manager = SimpleEntityManager.builder()
			.serializer(serializer)
			.build();
		registerEntities(manager);
	}

	public static void registerEntities(SimpleEntityManager manager) {
		manager
			.register(EntityClass.builder(User.class)
				.identifier("id")
				.field("id", Long.class)
				.field("name", String.class)
				.field("nickname", String.class)
				.field("email", String.class)
				.field("addressId")
				.field("billingPostcode", String.class)
				.booleanField("active")
				.enumField("role", Role.class)
				.enumField("tier", List.of("free", "pro", "enterprise"))
				.compressedTextField("bio")
				.arrayField("tags", List.class)
				.objectField("settings", Map.class)
				.oneToOne("address", Address.class, OwningSide.LOCAL, "addressId", null)
				.oneToOne("billingAddress", Address.class, OwningSide.LOCAL, "billingPostcode", "postcode")
				.oneToOne("profile", Profile.class, OwningSide.FOREIGN, null, "user")
				.oneToMany("phones", Phone.class, "id", "userId")
				.manyToMany("groups", Group.class)
				.accessor("nickname", user -> {
					Object nickname = user.getData().get("nickname");
					return (nickname == null)? user.getData().get("name") : nickname;
				})
				.mutator("email", (user, value) -> user.setField("email", (value == null)? null : value.toString().toLowerCase()))
				.build())
			.register(EntityClass.builder(Address.class)
				.identifier("id")
				.field("id", Long.class)
				.field("city", String.class)
				.field("postcode", String.class)
				.build())
			.register(EntityClass.builder(Profile.class)
				.identifier("id")
				.field("id", Long.class)
				.field("user")
				.field("headline", String.class)
				.build())
			.register(EntityClass.builder(Phone.class)
				.identifier("id")
				.field("id", Long.class)
				.field("number", String.class)
				.field("userId", Long.class)
				.build())
			.register(EntityClass.builder(Group.class)
				.identifier("id")
				.field("id", Long.class)
				.field("name", String.class)
				.build())
			.register(EntityClass.builder(Membership.class)
				.identifier("userId", "groupId")
				.field("userId", Long.class)
				.field("groupId", Long.class)
				.field("since", String.class)
				.build())
			.register(EntityClass.builder(Vehicle.class)
				.identifier("id")
				.field("id", Long.class)
				.field("kind", String.class)
				.field("wheels", Integer.class)
				.inheritance(InheritanceKind.SINGLE_TABLE, "kind", VEHICLE_KINDS)
				.build())
			.register(EntityClass.builder(Car.class)
				.identifier("id")
				.field("id", Long.class)
				.field("kind", String.class)
				.field("wheels", Integer.class)
				.field("seats", Integer.class)
				.inheritance(InheritanceKind.SINGLE_TABLE, "kind", VEHICLE_KINDS)
				.build());
	}

	public static final Map<Object, Class<? extends Entity>> VEHICLE_KINDS = vehicleKinds();

	private static Map<Object, Class<? extends Entity>> vehicleKinds() {
		Map<Object, Class<? extends Entity>> result = new LinkedHashMap<>();
		result.put("vehicle", Vehicle.class);
		result.put("car", Car.class);
		return result;
	}

	public enum Role { GUEST, MEMBER, ADMIN }

	public static class User extends Entity {
		public User(EntityManager manager) { super(manager); }
	}

	public static class Address extends Entity {
		public Address(EntityManager manager) { super(manager); }
	}

	public static class Profile extends Entity {
		public Profile(EntityManager manager) { super(manager); }
	}

	public static class Phone extends Entity {
		public Phone(EntityManager manager) { super(manager); }
	}

	public static class Group extends Entity {
		public Group(EntityManager manager) { super(manager); }
	}

	public static class Membership extends Entity {
		public Membership(EntityManager manager) { super(manager); }
	}

	public static class Vehicle extends Entity {
		public Vehicle(EntityManager manager) { super(manager); }
	}

	public static class Car extends Vehicle {
		public Car(EntityManager manager) { super(manager); }
	}

	public static class Unregistered extends Entity {
		public Unregistered(EntityManager manager) { super(manager); }
	}

	public static Map<String, Object> row(Object... keysAndValues) {
		Map<String, Object> result = new LinkedHashMap<>();
		for (int i = 0; i < keysAndValues.length; i += 2) {
			result.put((String) keysAndValues[i], keysAndValues[i+1]);
		}
		return result;
	}
}
