package io.github.bluuewhale.tablesmith;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Hash table that remembers insertion order (null keys NOT allowed, null values allowed).
 *
 * <p>Order is kept by an intrusive singly linked list threaded through the slot array:
 * each slot has a {@code next} index, and {@code head}/{@code tail} mark the ends (-1 = none).
 * Removed slots stay linked as tombstones until the next rehash or {@link #sortBy}.
 * Overwriting a key keeps its position; a key removed and put again moves to the end.
 */
public class OrderedTable<K, V> extends AbstractSlotTable<K, V> {

	private int[] next;
	private int head;
	private int tail;

	public OrderedTable() {
		this(Utils.DEFAULT_INITIAL_CAPACITY);
	}

	/**
	 * @param initialCapacity a power of two
	 */
	public OrderedTable(int initialCapacity) {
		this(initialCapacity, Hasher.defaultHasher());
	}

	public OrderedTable(int initialCapacity, Hasher<? super K> hasher) {
		super(initialCapacity, hasher);
	}

	private OrderedTable(OrderedTable<K, V> src) {
		super(src);
		this.next = src.next.clone();
		this.head = src.head;
		this.tail = src.tail;
	}

	/**
	 * Builds a table holding {@code pairs} in their iteration order; a later pair overwrites
	 * the value of an earlier one with the same key but keeps the earlier position.
	 */
	public static <K, V> OrderedTable<K, V> fromPairs(Iterable<? extends Map.Entry<? extends K, ? extends V>> pairs) {
		OrderedTable<K, V> t = new OrderedTable<>(Utils.capacityFor(pairs));
		for (Map.Entry<? extends K, ? extends V> e : pairs) {
			t.put(e.getKey(), e.getValue());
		}
		return t;
	}

	@SafeVarargs
	public static <K, V> OrderedTable<K, V> fromPairs(Map.Entry<? extends K, ? extends V>... pairs) {
		return fromPairs(Arrays.asList(pairs));
	}

	public static <K, V> OrderedTable<K, V> indexBy(Iterable<? extends V> items, Function<? super V, ? extends K> index) {
		Objects.requireNonNull(index, "index");
		OrderedTable<K, V> t = new OrderedTable<>();
		for (V item : items) {
			t.put(index.apply(item), item);
		}
		return t;
	}

	public OrderedTable<K, V> copy() {
		return new OrderedTable<>(this);
	}

	@Override
	protected void allocate(int newCapacity) {
		super.allocate(newCapacity);
		this.next = new int[newCapacity];
		this.head = -1;
		this.tail = -1;
	}

	@Override
	protected int rawInsert(K key, V value) {
		int h = super.rawInsert(key, value);
		next[h] = -1;
		if (head < 0) head = h;
		if (tail >= 0) next[tail] = h;
		tail = h;
		return h;
	}

	/**
	 * Re-inserts by walking the old list, so the order survives growth.
	 */
	@Override
	protected void rehash(int newCapacity) {
		byte[] oldSlots = slots;
		Object[] oldKeys = keys;
		Object[] oldVals = vals;
		int[] oldNext = next;
		int h = head;
		allocate(newCapacity);
		while (h >= 0) {
			if (oldSlots[h] == FILLED) rawInsert(castKey(oldKeys[h]), castValue(oldVals[h]));
			h = oldNext[h];
		}
	}

	@Override
	protected int firstSlot() {
		return skipDeleted(head);
	}

	@Override
	protected int nextSlot(int idx) {
		return skipDeleted(next[idx]);
	}

	private int skipDeleted(int h) {
		while (h >= 0 && slots[h] != FILLED) {
			h = next[h];
		}
		return h;
	}

	/**
	 * Sorts the entries by {@code cmp} with a stable, bottom-up merge sort over the {@code next}
	 * links; slot payloads never move.
	 *
	 * <p>Insertion order is lost: iteration afterwards yields the sorted entries followed by
	 * anything inserted later. Lookups, inserts and removals remain valid.
	 */
	public void sortBy(Comparator<? super Map.Entry<K, V>> cmp) {
		Objects.requireNonNull(cmp, "cmp");
		unlinkDeleted();
		if (head < 0) return;

		int list = head;
		int last;
		int insize = 1;
		for (;;) {
			int p = list;
			list = -1;
			last = -1;
			int nmerges = 0;
			while (p >= 0) {
				nmerges++;
				// step q at most insize places past p
				int q = p;
				int psize = 0;
				for (int i = 0; i < insize; i++) {
					psize++;
					q = next[q];
					if (q < 0) break;
				}
				int qsize = insize;
				// merge run p (psize) with run q (qsize or until the list ends)
				while (psize > 0 || (qsize > 0 && q >= 0)) {
					int e;
					if (psize == 0) {
						e = q; q = next[q]; qsize--;
					} else if (qsize == 0 || q < 0) {
						e = p; p = next[p]; psize--;
					} else if (cmp.compare(new EntryRef(p), new EntryRef(q)) <= 0) {
						e = p; p = next[p]; psize--;
					} else {
						e = q; q = next[q]; qsize--;
					}
					if (last >= 0) next[last] = e;
					else list = e;
					last = e;
				}
				p = q;
			}
			next[last] = -1;
			if (nmerges <= 1) break;
			insize <<= 1;
		}
		head = list;
		tail = last;
	}

	// Drops tombstones from the list so the sort only sees live entries.
	private void unlinkDeleted() {
		int prev = -1;
		for (int h = head; h >= 0; h = next[h]) {
			if (slots[h] != FILLED) continue;
			if (prev >= 0) next[prev] = h;
			else head = h;
			prev = h;
		}
		if (prev >= 0) next[prev] = -1;
		else head = -1;
		tail = prev;
	}
}
