package io.vena.strata;

import org.jetbrains.annotations.Nullable;

/**
 * One recorded assignment to an entity field.
 */
public record Change(@Nullable Object oldValue, @Nullable Object newValue) { }
