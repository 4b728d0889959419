package io.vena.strata;

import java.util.concurrent.atomic.AtomicLong;

/**
 * The default source of {@link Entity#getOid() object ids}: unique within the process, increasing.
 * They carry no meaning in the database.
 */
public final class ObjectIds {
	private static final AtomicLong counter = new AtomicLong(1000);

	public static long next() {
		return counter.getAndIncrement();
	}
}
