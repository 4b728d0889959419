package io.vena.strata;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import static java.util.Arrays.asList;
import static java.util.Objects.requireNonNull;

/**
 * The value of a to-many relation.
 *
 * <p>
 * Unlike the values of ordinary fields, a collection is mutable, and an entity keeps the
 * same collection object for the life of the relation: assigning a new collection to a
 * relation that already has one copies the contents into the existing object
 * (see {@link #setData}) so that anyone holding it sees the change.
 */
public class EntityCollection<E extends Entity> extends AbstractList<E> {
	private final List<E> elements = new ArrayList<>();

	public EntityCollection() { }

	public EntityCollection(Collection<? extends E> elements) {
		addAll(elements);
	}

	@SafeVarargs
	public static <EE extends Entity> EntityCollection<EE> of(EE... elements) {
		return new EntityCollection<>(asList(elements));
	}

	/**
	 * Replaces the entire contents of this collection.
	 */
	public void setData(Collection<? extends E> newElements) {
		List<E> copy = new ArrayList<>(newElements);
		elements.clear();
		elements.addAll(copy);
	}

	/**
	 * @return a copy of the current contents
	 */
	public List<E> getData() {
		return new ArrayList<>(elements);
	}

	/**
	 * Calls {@link Entity#free} on every element, then empties this collection.
	 */
	public void free(boolean deep) {
		List<E> freeing = getData();
		elements.clear();
		freeing.forEach(e -> e.free(deep));
	}

	@Override public E get(int index) { return elements.get(index); }
	@Override public int size() { return elements.size(); }
	@Override public E set(int index, E element) { return elements.set(index, requireNonNull(element)); }
	@Override public void add(int index, E element) { elements.add(index, requireNonNull(element)); }
	@Override public E remove(int index) { return elements.remove(index); }
	@Override public void clear() { elements.clear(); }
}
