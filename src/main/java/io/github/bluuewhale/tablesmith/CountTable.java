package io.github.bluuewhale.tablesmith;

import java.util.AbstractMap;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Table that counts occurrences of each key (null keys NOT allowed).
 *
 * <p>Counts are always positive; a slot whose count is 0 is empty, so there is no remove.
 * Uses the same probe sequence and growth policy as {@link HashTable}.
 *
 * <p>{@link #sortDescending()} reorders the slot array in place. After it the table is
 * frozen: it can be iterated and queried, but no longer modified.
 */
public class CountTable<K> implements Iterable<Map.Entry<K, Integer>> {

	private final Hasher<? super K> hasher;
	int capacity;
	private int size;
	private boolean sorted;

	/* Storage: counts[i] == 0 marks an empty slot */
	private Object[] keys;
	private int[] counts;

	public CountTable() {
		this(Utils.DEFAULT_INITIAL_CAPACITY);
	}

	/**
	 * @param initialCapacity a power of two
	 */
	public CountTable(int initialCapacity) {
		this(initialCapacity, Hasher.defaultHasher());
	}

	public CountTable(int initialCapacity, Hasher<? super K> hasher) {
		Utils.validateCapacity(initialCapacity);
		this.hasher = Objects.requireNonNull(hasher, "hasher");
		this.capacity = initialCapacity;
		this.keys = new Object[initialCapacity];
		this.counts = new int[initialCapacity];
	}

	private CountTable(CountTable<K> src) {
		this.hasher = src.hasher;
		this.capacity = src.capacity;
		this.size = src.size;
		this.sorted = src.sorted;
		this.keys = src.keys.clone();
		this.counts = src.counts.clone();
	}

	/**
	 * Builds a table where every key of {@code keys} has a count of 1.
	 */
	public static <K> CountTable<K> fromKeys(Iterable<? extends K> keys) {
		CountTable<K> t = new CountTable<>(Utils.capacityFor(keys));
		for (K key : keys) {
			t.set(key, 1);
		}
		return t;
	}

	public CountTable<K> copy() {
		return new CountTable<>(this);
	}

	public int size() {
		return size;
	}

	public boolean isEmpty() {
		return size == 0;
	}

	public boolean containsKey(Object key) {
		return findIndex(key) >= 0;
	}

	/**
	 * Returns the count of {@code key}, or 0 when absent.
	 */
	public int get(Object key) {
		int idx = findIndex(key);
		return (idx >= 0) ? counts[idx] : 0;
	}

	/**
	 * @throws KeyNotFoundException if the key is absent
	 */
	public int getOrThrow(Object key) {
		int idx = findIndex(key);
		if (idx < 0) throw new KeyNotFoundException(key);
		return counts[idx];
	}

	/**
	 * Sets the count of {@code key}, inserting it if needed.
	 *
	 * @throws IllegalArgumentException if {@code count} is not positive
	 */
	public void set(K key, int count) {
		checkMutable();
		requireKey(key);
		if (count <= 0) throw new IllegalArgumentException("count must be positive: " + count);
		int idx = findIndex(key);
		if (idx >= 0) {
			counts[idx] = count;
		} else {
			insertNew(key, count);
		}
	}

	public void inc(K key) {
		inc(key, 1);
	}

	/**
	 * Adds {@code delta} to the count of {@code key}; an absent key starts at {@code delta}.
	 *
	 * @throws IllegalArgumentException if the resulting count would not be positive
	 */
	public void inc(K key, int delta) {
		checkMutable();
		requireKey(key);
		int idx = findIndex(key);
		if (idx >= 0) {
			int updated = counts[idx] + delta;
			if (updated <= 0) {
				throw new IllegalArgumentException("count of " + key + " must stay positive: " + updated);
			}
			counts[idx] = updated;
		} else {
			if (delta <= 0) throw new IllegalArgumentException("initial count must be positive: " + delta);
			insertNew(key, delta);
		}
	}

	/**
	 * Entry with the smallest count. O(n).
	 *
	 * @throws IllegalStateException if the table is empty
	 */
	public Map.Entry<K, Integer> smallest() {
		requireNonEmpty();
		int minIdx = -1;
		for (int i = 0; i < capacity; i++) {
			if (counts[i] > 0 && (minIdx < 0 || counts[i] < counts[minIdx])) minIdx = i;
		}
		return entryAt(minIdx);
	}

	/**
	 * Entry with the largest count. O(n).
	 *
	 * @throws IllegalStateException if the table is empty
	 */
	public Map.Entry<K, Integer> largest() {
		requireNonEmpty();
		int maxIdx = -1;
		for (int i = 0; i < capacity; i++) {
			if (counts[i] > 0 && (maxIdx < 0 || counts[i] > counts[maxIdx])) maxIdx = i;
		}
		return entryAt(maxIdx);
	}

	/**
	 * Sorts the slot array so that the highest counts come first (ties in no particular order).
	 *
	 * <p>This is destructive: the slots no longer follow their probe sequences, so the table
	 * is frozen afterwards. {@link #set} and {@link #inc} throw {@link IllegalStateException};
	 * iteration yields the sorted order and lookups fall back to a linear scan.
	 */
	public void sortDescending() {
		// shell sort, gaps 1, 4, 13, 40, ...
		int n = capacity;
		int h = 1;
		while (h < n / 3) h = 3 * h + 1;
		for (; h >= 1; h /= 3) {
			for (int i = h; i < n; i++) {
				for (int j = i; j >= h && counts[j - h] < counts[j]; j -= h) {
					swap(j, j - h);
				}
			}
		}
		sorted = true;
	}

	public boolean isSorted() {
		return sorted;
	}

	@Override
	public Iterator<Map.Entry<K, Integer>> iterator() {
		return new EntryIter();
	}

	@Override
	public String toString() {
		return Utils.render(iterator());
	}

	/* Internal helpers */

	private int findIndex(Object key) {
		if (key == null) return -1;
		if (sorted) return scanFor(key);
		int mask = capacity - 1;
		int h = hasher.hash(castKey(key)) & mask;
		while (counts[h] != 0) {
			if (key.equals(keys[h])) return h;
			h = Utils.nextTry(h, mask);
		}
		return -1;
	}

	private int scanFor(Object key) {
		for (int i = 0; i < capacity; i++) {
			if (counts[i] > 0 && key.equals(keys[i])) return i;
		}
		return -1;
	}

	private void insertNew(K key, int count) {
		if (Utils.mustRehash(capacity, size)) enlarge();
		rawInsert(keys, counts, key, count);
		size++;
	}

	private void rawInsert(Object[] keyData, int[] countData, K key, int count) {
		int mask = countData.length - 1;
		int h = hasher.hash(key) & mask;
		while (countData[h] != 0) {
			h = Utils.nextTry(h, mask);
		}
		keyData[h] = key;
		countData[h] = count;
	}

	private void enlarge() {
		int newCapacity = Utils.grownCapacity(capacity);
		Object[] newKeys = new Object[newCapacity];
		int[] newCounts = new int[newCapacity];
		for (int i = 0; i < capacity; i++) {
			if (counts[i] != 0) rawInsert(newKeys, newCounts, castKey(keys[i]), counts[i]);
		}
		this.keys = newKeys;
		this.counts = newCounts;
		this.capacity = newCapacity;
	}

	private void swap(int a, int b) {
		Object k = keys[a];
		keys[a] = keys[b];
		keys[b] = k;
		int c = counts[a];
		counts[a] = counts[b];
		counts[b] = c;
	}

	private Map.Entry<K, Integer> entryAt(int idx) {
		return new AbstractMap.SimpleImmutableEntry<>(castKey(keys[idx]), counts[idx]);
	}

	private void checkMutable() {
		if (sorted) throw new IllegalStateException("count table was sorted and can no longer be modified");
	}

	private void requireNonEmpty() {
		if (size == 0) throw new IllegalStateException("count table is empty");
	}

	private static void requireKey(Object key) {
		if (key == null) throw new NullPointerException("Null keys not supported");
	}

	@SuppressWarnings("unchecked")
	private K castKey(Object k) {
		return (K) k;
	}

	/* ------------ Iterator ------------ */

	private final class EntryIter implements Iterator<Map.Entry<K, Integer>> {
		private int next = scanFrom(0);

		private int scanFrom(int idx) {
			for (int i = idx; i < capacity; i++) {
				if (counts[i] != 0) return i;
			}
			return -1;
		}

		@Override
		public boolean hasNext() {
			return next >= 0;
		}

		@Override
		public Map.Entry<K, Integer> next() {
			if (next < 0) throw new NoSuchElementException();
			int idx = next;
			next = scanFrom(idx + 1);
			return new CountRef(idx);
		}
	}

	/**
	 * Live view of one slot; {@link #setValue} replaces the count in place.
	 */
	private final class CountRef implements Map.Entry<K, Integer> {
		private final int idx;

		CountRef(int idx) {
			this.idx = idx;
		}

		@Override
		public K getKey() {
			return castKey(keys[idx]);
		}

		@Override
		public Integer getValue() {
			return counts[idx];
		}

		@Override
		public Integer setValue(Integer value) {
			checkMutable();
			if (value == null || value <= 0) {
				throw new IllegalArgumentException("count must be positive: " + value);
			}
			int old = counts[idx];
			counts[idx] = value;
			return old;
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof Map.Entry)) return false;
			Map.Entry<?, ?> e = (Map.Entry<?, ?>) o;
			return Objects.equals(getKey(), e.getKey()) && Objects.equals(getValue(), e.getValue());
		}

		@Override
		public int hashCode() {
			return Objects.hashCode(getKey()) ^ counts[idx];
		}

		@Override
		public String toString() {
			return getKey() + "=" + counts[idx];
		}
	}
}
