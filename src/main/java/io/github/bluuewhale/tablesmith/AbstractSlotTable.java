package io.github.bluuewhale.tablesmith;

import java.util.AbstractCollection;
import java.util.AbstractMap;
import java.util.AbstractSet;
import java.util.Collection;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Open-addressing engine shared by {@link HashTable} and {@link OrderedTable}.
 *
 * <p>Slots live in parallel arrays and carry one of three tags. Lookups start at
 * {@code hash & (capacity - 1)} and follow {@link Utils#nextTry}, skipping DELETED
 * slots until an EMPTY slot (miss) or a FILLED slot holding an equal key (hit).
 * Inserts only ever claim EMPTY slots; tombstones are dropped by the next rehash.
 *
 * <p>Null keys are not supported (queries with {@code null} simply miss), null values are.
 * Not thread-safe.
 */
abstract class AbstractSlotTable<K, V> extends AbstractMap<K, V> {

	/* Slot tags */
	static final byte EMPTY = 0;
	static final byte FILLED = 1;
	static final byte DELETED = 2;

	protected final Hasher<? super K> hasher;
	protected int capacity;
	protected int size;
	protected int tombstones;

	/* Storage */
	protected byte[] slots;
	protected Object[] keys;
	protected Object[] vals;

	protected AbstractSlotTable(int initialCapacity, Hasher<? super K> hasher) {
		Utils.validateCapacity(initialCapacity);
		this.hasher = Objects.requireNonNull(hasher, "hasher");
		allocate(initialCapacity);
	}

	protected AbstractSlotTable(AbstractSlotTable<K, V> src) {
		this.hasher = src.hasher;
		this.capacity = src.capacity;
		this.size = src.size;
		this.tombstones = src.tombstones;
		this.slots = src.slots.clone();
		this.keys = src.keys.clone();
		this.vals = src.vals.clone();
	}

	/* Hooks for subclasses */

	/**
	 * Replaces the storage with empty arrays of {@code newCapacity} slots. Leaves {@link #size} alone.
	 */
	protected void allocate(int newCapacity) {
		this.capacity = newCapacity;
		this.slots = new byte[newCapacity];
		this.keys = new Object[newCapacity];
		this.vals = new Object[newCapacity];
		this.tombstones = 0;
	}

	/**
	 * Writes the pair into the first EMPTY slot of the key's probe sequence.
	 * Does not check for an existing key and does not touch {@link #size}.
	 *
	 * @return the slot index written
	 */
	protected int rawInsert(K key, V value) {
		int mask = capacity - 1;
		int h = hash(key) & mask;
		while (slots[h] != EMPTY) {
			h = Utils.nextTry(h, mask);
		}
		keys[h] = key;
		vals[h] = value;
		slots[h] = FILLED;
		return h;
	}

	/**
	 * Moves every FILLED slot into fresh arrays of {@code newCapacity} slots.
	 */
	protected void rehash(int newCapacity) {
		byte[] oldSlots = slots;
		Object[] oldKeys = keys;
		Object[] oldVals = vals;
		allocate(newCapacity);
		for (int i = 0; i < oldSlots.length; i++) {
			if (oldSlots[i] == FILLED) rawInsert(castKey(oldKeys[i]), castValue(oldVals[i]));
		}
	}

	/** First FILLED slot in iteration order, or -1. */
	protected abstract int firstSlot();

	/** FILLED slot following {@code idx} in iteration order, or -1. */
	protected abstract int nextSlot(int idx);

	/* Lookup */

	protected int hash(Object key) {
		return hasher.hash(castKey(key));
	}

	protected int findIndex(Object key) {
		if (key == null) return -1;
		int mask = capacity - 1;
		int h = hash(key) & mask;
		while (slots[h] != EMPTY) {
			if (slots[h] == FILLED && key.equals(keys[h])) return h;
			h = Utils.nextTry(h, mask);
		}
		return -1;
	}

	@Override
	public int size() {
		return size;
	}

	@Override
	public boolean isEmpty() {
		return size == 0;
	}

	@Override
	public boolean containsKey(Object key) {
		return findIndex(key) >= 0;
	}

	@Override
	public boolean containsValue(Object value) {
		for (int i = firstSlot(); i >= 0; i = nextSlot(i)) {
			if (Objects.equals(vals[i], value)) return true;
		}
		return false;
	}

	/**
	 * Returns the value for {@code key}, or {@code null} when absent. Never throws for a missing key.
	 */
	@Override
	public V get(Object key) {
		int idx = findIndex(key);
		return (idx >= 0) ? castValue(vals[idx]) : null;
	}

	/**
	 * Returns the value for {@code key}.
	 *
	 * @throws KeyNotFoundException if the key is absent
	 */
	public V getOrThrow(Object key) {
		int idx = findIndex(key);
		if (idx < 0) throw new KeyNotFoundException(key);
		return castValue(vals[idx]);
	}

	/**
	 * Replaces the value of a present key with {@code remapping.apply(oldValue)} in its slot.
	 *
	 * @return the new value
	 * @throws KeyNotFoundException if the key is absent; the table is left untouched
	 */
	public V computeExisting(K key, UnaryOperator<V> remapping) {
		Objects.requireNonNull(remapping, "remapping");
		int idx = findIndex(key);
		if (idx < 0) throw new KeyNotFoundException(key);
		V updated = remapping.apply(castValue(vals[idx]));
		vals[idx] = updated;
		return updated;
	}

	/* Mutation */

	@Override
	public V put(K key, V value) {
		requireKey(key);
		int idx = findIndex(key);
		if (idx >= 0) {
			V old = castValue(vals[idx]);
			vals[idx] = value;
			return old;
		}
		insertNew(key, value);
		return null;
	}

	/**
	 * Inserts the pair even if {@code key} is already present. The table then holds two
	 * slots with equal keys; which one a later lookup reaches depends on the probe sequence.
	 */
	public void addDuplicate(K key, V value) {
		requireKey(key);
		insertNew(key, value);
	}

	@Override
	public V remove(Object key) {
		int idx = findIndex(key);
		if (idx < 0) return null;
		V old = castValue(vals[idx]);
		deleteAt(idx);
		return old;
	}

	@Override
	public void clear() {
		allocate(capacity);
		size = 0;
	}

	private void insertNew(K key, V value) {
		ensureCapacity();
		rawInsert(key, value);
		size++;
	}

	private void ensureCapacity() {
		if (Utils.mustRehash(capacity, size)) {
			rehash(Utils.grownCapacity(capacity));
		} else if (Utils.mustRehash(capacity, size + tombstones)) {
			// tombstones tipped the load over: rebuild in place once they exceed half the live entries, else grow
			boolean tooManyTombstones = tombstones > (size >>> 1);
			rehash(tooManyTombstones || capacity == Utils.MAX_CAPACITY ? capacity : Utils.grownCapacity(capacity));
		}
	}

	// Key and value stay in the slot; only the tag changes.
	private void deleteAt(int idx) {
		slots[idx] = DELETED;
		size--;
		tombstones++;
	}

	private static void requireKey(Object key) {
		if (key == null) throw new NullPointerException("Null keys not supported");
	}

	@SuppressWarnings("unchecked")
	protected final K castKey(Object k) {
		return (K) k;
	}

	@SuppressWarnings("unchecked")
	protected final V castValue(Object v) {
		return (V) v;
	}

	/* Rendering */

	@Override
	public String toString() {
		return Utils.render(new EntryIter());
	}

	/* Views */

	@Override
	public Set<K> keySet() {
		return new KeyView();
	}

	@Override
	public Collection<V> values() {
		return new ValuesView();
	}

	@Override
	public Set<Entry<K, V>> entrySet() {
		return new EntryView();
	}

	/* iterator base */
	private abstract class BaseIter<T> implements Iterator<T> {
		private int next = firstSlot();
		private int last = -1;

		@Override
		public boolean hasNext() {
			return next >= 0;
		}

		int advance() {
			if (next < 0) throw new NoSuchElementException();
			last = next;
			next = nextSlot(next);
			return last;
		}

		@Override
		public void remove() {
			if (last < 0) throw new IllegalStateException();
			if (slots[last] == FILLED) deleteAt(last);
			last = -1;
		}
	}

	private final class KeyIter extends BaseIter<K> {
		@Override
		public K next() {
			return castKey(keys[advance()]);
		}
	}

	private final class ValueIter extends BaseIter<V> {
		@Override
		public V next() {
			return castValue(vals[advance()]);
		}
	}

	private final class EntryIter extends BaseIter<Entry<K, V>> {
		@Override
		public Entry<K, V> next() {
			return new EntryRef(advance());
		}
	}

	/**
	 * Live view of one slot; {@link #setValue} writes straight into the table.
	 */
	protected final class EntryRef implements Entry<K, V> {
		private final int idx;

		EntryRef(int idx) {
			this.idx = idx;
		}

		@Override
		public K getKey() {
			return castKey(keys[idx]);
		}

		@Override
		public V getValue() {
			return castValue(vals[idx]);
		}

		@Override
		public V setValue(V value) {
			V old = castValue(vals[idx]);
			vals[idx] = value;
			return old;
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof Entry)) return false;
			Entry<?, ?> e = (Entry<?, ?>) o;
			return Objects.equals(getKey(), e.getKey()) && Objects.equals(getValue(), e.getValue());
		}

		@Override
		public int hashCode() {
			return Objects.hashCode(getKey()) ^ Objects.hashCode(getValue());
		}

		@Override
		public String toString() {
			return getKey() + "=" + getValue();
		}
	}

	private final class KeyView extends AbstractSet<K> {
		@Override
		public Iterator<K> iterator() {
			return new KeyIter();
		}

		@Override
		public int size() { return AbstractSlotTable.this.size; }

		@Override
		public boolean contains(Object o) { return containsKey(o); }

		@Override
		public void clear() { AbstractSlotTable.this.clear(); }
	}

	private final class ValuesView extends AbstractCollection<V> {
		@Override
		public Iterator<V> iterator() {
			return new ValueIter();
		}

		@Override
		public int size() { return AbstractSlotTable.this.size; }

		@Override
		public void clear() { AbstractSlotTable.this.clear(); }
	}

	private final class EntryView extends AbstractSet<Entry<K, V>> {
		@Override
		public Iterator<Entry<K, V>> iterator() {
			return new EntryIter();
		}

		@Override
		public int size() { return AbstractSlotTable.this.size; }

		@Override
		public void clear() { AbstractSlotTable.this.clear(); }
	}
}
