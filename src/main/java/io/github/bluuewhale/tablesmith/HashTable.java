package io.github.bluuewhale.tablesmith;

import java.util.Arrays;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Open-addressing hash table with no ordering guarantee (null keys NOT allowed, null values allowed).
 * Iteration and {@link #toString()} follow the physical slot order.
 *
 * <p>Probe sequence {@code h -> 5h + 1}, tombstone deletion, growth by doubling once
 * two thirds of the slots are live or fewer than four remain free.
 */
public class HashTable<K, V> extends AbstractSlotTable<K, V> {

	public HashTable() {
		this(Utils.DEFAULT_INITIAL_CAPACITY);
	}

	/**
	 * @param initialCapacity a power of two
	 */
	public HashTable(int initialCapacity) {
		this(initialCapacity, Hasher.defaultHasher());
	}

	public HashTable(int initialCapacity, Hasher<? super K> hasher) {
		super(initialCapacity, hasher);
	}

	private HashTable(HashTable<K, V> src) {
		super(src);
	}

	/**
	 * Builds a table holding {@code pairs}; a later pair overwrites an earlier one with the same key.
	 */
	public static <K, V> HashTable<K, V> fromPairs(Iterable<? extends Map.Entry<? extends K, ? extends V>> pairs) {
		HashTable<K, V> t = new HashTable<>(Utils.capacityFor(pairs));
		for (Map.Entry<? extends K, ? extends V> e : pairs) {
			t.put(e.getKey(), e.getValue());
		}
		return t;
	}

	@SafeVarargs
	public static <K, V> HashTable<K, V> fromPairs(Map.Entry<? extends K, ? extends V>... pairs) {
		return fromPairs(Arrays.asList(pairs));
	}

	/**
	 * Indexes {@code items} by {@code index}; an item overwrites any earlier item with the same index.
	 */
	public static <K, V> HashTable<K, V> indexBy(Iterable<? extends V> items, Function<? super V, ? extends K> index) {
		Objects.requireNonNull(index, "index");
		HashTable<K, V> t = new HashTable<>();
		for (V item : items) {
			t.put(index.apply(item), item);
		}
		return t;
	}

	/**
	 * Independent copy with the same slot layout.
	 */
	public HashTable<K, V> copy() {
		return new HashTable<>(this);
	}

	@Override
	protected int firstSlot() {
		return scanFrom(0);
	}

	@Override
	protected int nextSlot(int idx) {
		return scanFrom(idx + 1);
	}

	private int scanFrom(int idx) {
		for (int i = idx; i < capacity; i++) {
			if (slots[i] == FILLED) return i;
		}
		return -1;
	}
}
