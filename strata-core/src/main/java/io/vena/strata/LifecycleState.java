package io.vena.strata;

/**
 * Where an {@link Entity} stands with respect to its {@link EntityManager}.
 */
public enum LifecycleState {
	/**
	 * Constructed by the application and not yet inserted. The identifier may be incomplete.
	 */
	NEW,

	/**
	 * Has a complete identifier and is tracked by its manager.
	 */
	MANAGED,

	/**
	 * Has an identifier but is no longer tracked.
	 */
	DETACHED,

	/**
	 * Scheduled for removal, or already removed.
	 */
	DELETED,

	/**
	 * Currently being visited by a cascading save or delete.
	 * Set and cleared by the manager to break cycles; it is not a mutual exclusion lock.
	 */
	LOCKED
}
