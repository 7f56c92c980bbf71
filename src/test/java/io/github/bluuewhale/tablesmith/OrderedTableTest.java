package io.github.bluuewhale.tablesmith;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Random;

import org.junit.jupiter.api.Test;

class OrderedTableTest {

	private static <K> List<K> keysOf(OrderedTable<K, ?> t) {
		return new ArrayList<>(t.keySet());
	}

	@Test
	void iteratesInInsertionOrderAcrossGrowth() {
		var keys = new ArrayList<Integer>();
		for (int i = 0; i < 1_000; i++) keys.add(i);
		Collections.shuffle(keys, new Random(7));

		var t = new OrderedTable<Integer, Integer>(4);
		for (int k : keys) t.put(k, k);

		assertEquals(keys, keysOf(t));
	}

	@Test
	void overwriteKeepsPosition() {
		var t = new OrderedTable<String, Integer>();
		t.put("a", 1);
		t.put("b", 2);
		t.put("c", 3);

		t.put("a", 9);

		assertEquals(List.of("a", "b", "c"), keysOf(t));
		assertEquals(List.of(9, 2, 3), new ArrayList<>(t.values()));
	}

	@Test
	void removedKeyMovesToEndWhenPutAgain() {
		var t = new OrderedTable<String, Integer>();
		t.put("a", 1);
		t.put("b", 2);
		t.put("c", 3);

		t.remove("a");
		t.put("a", 4);

		assertEquals(List.of("b", "c", "a"), keysOf(t));
		assertEquals("{b: 2, c: 3, a: 4}", t.toString());
	}

	@Test
	void iteratorRemoveKeepsRestInOrder() {
		var t = new OrderedTable<Integer, String>();
		for (int i = 0; i < 6; i++) t.put(i, "v" + i);

		var it = t.keySet().iterator();
		while (it.hasNext()) {
			if (it.next() % 2 == 0) it.remove();
		}

		assertEquals(List.of(1, 3, 5), keysOf(t));
		assertEquals(3, t.size());
	}

	@Test
	void sortByKey() {
		var t = new OrderedTable<String, Integer>();
		t.put("c", 3);
		t.put("a", 1);
		t.put("b", 2);

		t.sortBy(Map.Entry.comparingByKey());

		assertEquals(List.of("a", "b", "c"), keysOf(t));
		assertEquals(2, t.get("b"));
	}

	@Test
	void insertsAfterSortAppendToSortedOrder() {
		var t = new OrderedTable<Integer, Integer>(8);
		t.put(5, 5);
		t.put(3, 3);
		t.put(1, 1);
		t.sortBy(Map.Entry.comparingByKey());

		// the third insert also grows the table, which must keep the list order
		t.put(4, 4);
		t.put(2, 2);
		t.put(0, 0);

		assertEquals(16, t.capacity);
		assertEquals(List.of(1, 3, 5, 4, 2, 0), keysOf(t));
		for (int i = 0; i < 6; i++) assertEquals(i, t.get(i));
	}

	@Test
	void sortIsStable() {
		var t = new OrderedTable<String, Integer>();
		t.put("k1", 2);
		t.put("k2", 1);
		t.put("k3", 2);
		t.put("k4", 1);
		t.put("k5", 1);

		t.sortBy(Map.Entry.comparingByValue());

		assertEquals(List.of("k2", "k4", "k5", "k1", "k3"), keysOf(t));
	}

	@Test
	void sortSkipsRemovedEntries() {
		var t = new OrderedTable<Integer, String>();
		for (int i = 1; i <= 10; i++) t.put(i, "v" + i);
		for (int i = 2; i <= 10; i += 2) t.remove(i);

		t.sortBy(Map.Entry.<Integer, String>comparingByKey().reversed());

		assertEquals(List.of(9, 7, 5, 3, 1), keysOf(t));
		assertEquals(5, t.size());

		t.put(4, "v4");
		assertEquals(List.of(9, 7, 5, 3, 1, 4), keysOf(t));
		assertNull(t.get(2));
	}

	@Test
	void sortEmptyAndFullyRemovedTables() {
		var empty = new OrderedTable<String, Integer>();
		empty.sortBy(Map.Entry.comparingByKey());
		assertTrue(keysOf(empty).isEmpty());

		var t = new OrderedTable<String, Integer>();
		t.put("a", 1);
		t.put("b", 2);
		t.remove("a");
		t.remove("b");
		t.sortBy(Map.Entry.comparingByKey());
		assertTrue(keysOf(t).isEmpty());

		t.put("c", 3);
		assertEquals(List.of("c"), keysOf(t));
	}

	@Test
	void sortLargeRandomTable() {
		var rnd = new Random(11);
		var t = new OrderedTable<Integer, Integer>();
		for (int i = 0; i < 5_000; i++) t.put(i, rnd.nextInt(1_000));

		t.sortBy(Map.Entry.comparingByValue());

		assertEquals(5_000, t.size());
		int prevValue = Integer.MIN_VALUE;
		int prevKey = -1;
		int count = 0;
		for (var e : t.entrySet()) {
			int v = e.getValue();
			assertTrue(v >= prevValue);
			// stable: equal values keep ascending key (= insertion) order
			if (v == prevValue) assertTrue(e.getKey() > prevKey);
			prevValue = v;
			prevKey = e.getKey();
			count++;
		}
		assertEquals(5_000, count);
	}

	@Test
	void sortByRequiresComparator() {
		var t = new OrderedTable<String, Integer>();
		assertThrows(NullPointerException.class, () -> t.sortBy(null));
	}

	@Test
	void fromPairsKeepsFirstPositionAndLastValue() {
		OrderedTable<String, Integer> t = OrderedTable.fromPairs(
			Map.entry("x", 1), Map.entry("y", 2), Map.entry("x", 3));

		assertEquals("{x: 3, y: 2}", t.toString());
		assertEquals(16, t.capacity);
	}

	@Test
	void fromPairsOfIterableKeepsOrder() {
		var list = List.of(Map.entry("q", 1), Map.entry("p", 2));
		Iterable<Map.Entry<String, Integer>> pairs = list::iterator;

		OrderedTable<String, Integer> t = OrderedTable.fromPairs(pairs);

		assertEquals("{q: 1, p: 2}", t.toString());
		assertEquals(64, t.capacity);
	}

	@Test
	void equalityIgnoresOrder() {
		OrderedTable<Integer, String> ab = OrderedTable.fromPairs(Map.entry(1, "a"), Map.entry(2, "b"));
		OrderedTable<Integer, String> ba = OrderedTable.fromPairs(Map.entry(2, "b"), Map.entry(1, "a"));

		assertEquals(ab, ba);
		assertEquals(HashTable.fromPairs(Map.entry(1, "a"), Map.entry(2, "b")), ab);
		assertNotEquals(ab, OrderedTable.fromPairs(Map.entry(1, "a"), Map.entry(2, "c")));
	}

	@Test
	void indexByKeepsFirstPosition() {
		OrderedTable<Character, String> byInitial =
			OrderedTable.indexBy(List.of("bob", "alice", "bill"), s -> s.charAt(0));

		assertEquals("{b: bill, a: alice}", byInitial.toString());
	}

	@Test
	void copyKeepsOrderAndIsIndependent() {
		var t = new OrderedTable<String, Integer>();
		t.put("z", 1);
		t.put("y", 2);

		var copy = t.copy();
		copy.put("x", 3);
		t.remove("z");

		assertEquals(List.of("z", "y", "x"), keysOf(copy));
		assertEquals(List.of("y"), keysOf(t));
	}

	@Test
	void sortByValueDescendingThenLookup() {
		var t = new OrderedTable<String, Integer>();
		t.put("low", 1);
		t.put("high", 30);
		t.put("mid", 10);

		t.sortBy(Comparator.comparing(Map.Entry<String, Integer>::getValue).reversed());

		assertEquals(List.of("high", "mid", "low"), keysOf(t));
		assertEquals(List.of(30, 10, 1), new ArrayList<>(t.values()));
		assertTrue(t.containsKey("mid"));
		assertEquals(10, t.remove("mid"));
		assertEquals("{high: 30, low: 1}", t.toString());
	}
}
