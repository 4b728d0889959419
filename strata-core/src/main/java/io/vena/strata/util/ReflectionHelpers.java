package io.vena.strata.util;

import io.vena.strata.Entity;
import io.vena.strata.EntityManager;
import java.lang.reflect.Constructor;
import java.lang.reflect.Executable;
import java.lang.reflect.InvocationTargetException;

import static java.lang.reflect.Modifier.isAbstract;
import static java.lang.reflect.Modifier.isPrivate;

public final class ReflectionHelpers {

	/**
	 * Instantiates <code>entityType</code> through its constructor taking a single {@link EntityManager}.
	 *
	 * @throws IllegalArgumentException if there's no such non-private constructor, or the class is abstract
	 */
	public static <E extends Entity> E construct(Class<E> entityType, EntityManager manager) {
		Constructor<E> constructor = managerConstructorFor(entityType);
		try {
			return constructor.newInstance(manager);
		} catch (InvocationTargetException e) {
			Throwable cause = e.getCause();
			if (cause instanceof RuntimeException runtimeException) {
				throw runtimeException;
			} else if (cause instanceof Error error) {
				throw error;
			} else {
				throw new IllegalStateException("Constructor of " + entityType.getSimpleName() + " threw", cause);
			}
		} catch (InstantiationException | IllegalAccessException e) {
			throw new IllegalArgumentException("Unable to instantiate " + entityType.getSimpleName(), e);
		}
	}

	public static <E extends Entity> Constructor<E> managerConstructorFor(Class<E> entityType) {
		if (isAbstract(entityType.getModifiers())) {
			throw new IllegalArgumentException("Can't instantiate abstract entity class " + entityType.getSimpleName());
		}
		try {
			return setAccessible(entityType.getDeclaredConstructor(EntityManager.class));
		} catch (NoSuchMethodException e) {
			throw new IllegalArgumentException(entityType.getSimpleName() + " needs a constructor taking an " + EntityManager.class.getSimpleName(), e);
		}
	}

	public static <T extends Executable> T setAccessible(T method) {
		// Private constructors are left alone so subclasses can keep them out of our reach
		if (isPrivate(method.getModifiers())) {
			throw new IllegalArgumentException("Access to private " + method.getClass().getSimpleName() + " is forbidden: " + method);
		}
		method.setAccessible(true);
		return method;
	}

}
