package io.github.bluuewhale.tablesmith;

import java.util.Collection;
import java.util.Iterator;
import java.util.Map;

/**
 * Shared utilities for open-addressed tables.
 */
final class Utils {
	private Utils() {}

	static final int DEFAULT_INITIAL_CAPACITY = 64;

	/* Largest power of two an int-indexed array can hold */
	static final int MAX_CAPACITY = 1 << 30;

	/* Free slots that must remain after an insert, bounding the worst-case probe length */
	private static final int MIN_FREE_SLOTS = 4;

	/**
	 * Smallest power of two that is {@code >= x}; sizes a table built from {@code x} pairs.
	 */
	static int ceilPow2(int x) {
		if (x <= 1) return 1;
		return Integer.highestOneBit(x - 1) << 1;
	}

	/**
	 * Initial capacity for a table built from {@code items}: {@code ceilPow2(n + 10)} when the
	 * count is known up front, the default capacity otherwise.
	 */
	static int capacityFor(Iterable<?> items) {
		if (items instanceof Collection<?> c) return ceilPow2(c.size() + 10);
		return DEFAULT_INITIAL_CAPACITY;
	}

	/**
	 * Doubled capacity for a growing table.
	 *
	 * @throws IllegalStateException if the table is already at {@link #MAX_CAPACITY}
	 */
	static int grownCapacity(int capacity) {
		if (capacity >= MAX_CAPACITY) {
			throw new IllegalStateException("table cannot grow beyond capacity " + MAX_CAPACITY);
		}
		return capacity << 1;
	}

	static boolean isPowerOfTwo(int x) {
		return x > 0 && (x & (x - 1)) == 0;
	}

	static int validateCapacity(int capacity) {
		if (!isPowerOfTwo(capacity)) {
			throw new IllegalArgumentException("capacity must be a power of two: " + capacity);
		}
		return capacity;
	}

	/**
	 * Grow trigger checked before every insert: load above 2/3, or fewer than
	 * {@value #MIN_FREE_SLOTS} free slots.
	 */
	static boolean mustRehash(int length, int counter) {
		return (length * 2 < counter * 3) || (length - counter < MIN_FREE_SLOTS);
	}

	/**
	 * Next probe index. {@code h -> 5h + 1 (mod 2^n)} has full period, so every slot is visited.
	 */
	static int nextTry(int h, int mask) {
		return ((5 * h) + 1) & mask;
	}

	/**
	 * Renders entries as {@code {k1: v1, k2: v2}}; an empty table renders as {@code {}}.
	 */
	static String render(Iterator<? extends Map.Entry<?, ?>> it) {
		StringBuilder sb = new StringBuilder("{");
		while (it.hasNext()) {
			Map.Entry<?, ?> e = it.next();
			if (sb.length() > 1) sb.append(", ");
			sb.append(e.getKey()).append(": ").append(e.getValue());
		}
		return sb.append('}').toString();
	}
}
