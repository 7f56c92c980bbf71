package io.github.bluuewhale.tablesmith;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Random;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2ObjectOpenHashMap;
import org.eclipse.collections.impl.map.mutable.UnifiedMap;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

@Fork(value = 1)
@Warmup(iterations = 5)
@Measurement(iterations = 5)
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
public class MapBenchmark {

	private static String randomUuidString(Random rnd) {
		return new UUID(rnd.nextLong(), rnd.nextLong()).toString();
	}

	/**
	 * Generates UUID-string keys and miss-keys such that:
	 * - keys are unique
	 * - misses are unique
	 * - misses never overlap with keys
	 */
	private static void generateKeysAndMisses(Random rnd, String[] keys, String[] misses) {
		if (keys.length != misses.length) throw new IllegalArgumentException("keys and misses must have same length");
		int size = keys.length;
		var set = new java.util.HashSet<String>(size * 2);
		for (int i = 0; i < size; i++) {
			String k;
			do { k = randomUuidString(rnd); } while (!set.add(k));
			keys[i] = k;
		}
		for (int i = 0; i < size; i++) {
			String miss;
			do { miss = randomUuidString(rnd); } while (set.contains(miss));
			misses[i] = miss;
			set.add(miss); // ensures misses are unique as well
		}
	}

	@State(Scope.Benchmark)
	public static class ReadState {
		@Param({ "10000", "40000", "170000", "700000" }) // close to the 2/3 grow trigger
		int size;

		HashTable<String, Object> table;
		OrderedTable<String, Object> ordered;
		Object2ObjectOpenHashMap<String, Object> fastutil;
		UnifiedMap<String, Object> unified;
		HashMap<String, Object> jdk;
		LinkedHashMap<String, Object> jdkLinked;
		String[] keys;
		String[] misses;
		int nextKeyIndex;
		int nextMissIndex;

		@Setup(Level.Trial)
		public void setup() {
			keys = new String[size];
			misses = new String[size];
			generateKeysAndMisses(new Random(123), keys, misses);
			nextKeyIndex = 0;
			nextMissIndex = 0;
			table = new HashTable<>();
			ordered = new OrderedTable<>();
			fastutil = new Object2ObjectOpenHashMap<>();
			unified = new UnifiedMap<>();
			jdk = new HashMap<>();
			jdkLinked = new LinkedHashMap<>();
			for (int i = 0; i < size; i++) {
				table.put(keys[i], "dummy");
				ordered.put(keys[i], "dummy");
				fastutil.put(keys[i], "dummy");
				unified.put(keys[i], "dummy");
				jdk.put(keys[i], "dummy");
				jdkLinked.put(keys[i], "dummy");
			}
		}

		String nextHitKey() {
			var k = keys[nextKeyIndex];
			nextKeyIndex = (nextKeyIndex + 1) % keys.length;
			return k;
		}
		String nextMissingKey() {
			var k = misses[nextMissIndex];
			nextMissIndex = (nextMissIndex + 1) % misses.length;
			return k;
		}
	}

	/**
	 * Keeps entry count constant at n by doing the compensating remove
	 * in {@code @Setup(Level.Invocation)} (excluded from measurement).
	 * The removals leave tombstones in the tables, so this also exercises the in-place purge.
	 */
	@State(Scope.Thread)
	public static class PutMissState {
		@Param({ "10000", "40000", "170000", "700000" })
		int size;

		int idx;
		String[] keys;   // keys currently present in the maps
		String[] misses; // keys currently absent from the maps
		String nextKey;

		HashTable<String, Object> table;
		OrderedTable<String, Object> ordered;
		Object2ObjectOpenHashMap<String, Object> fastutil;
		HashMap<String, Object> jdk;

		@Setup(Level.Trial)
		public void initKeys() {
			keys = new String[size];
			misses = new String[size];
			generateKeysAndMisses(new Random(456), keys, misses);
		}

		@Setup(Level.Iteration)
		public void resetMaps() {
			idx = 0;
			table = new HashTable<>();
			ordered = new OrderedTable<>();
			fastutil = new Object2ObjectOpenHashMap<>();
			jdk = new HashMap<>();
			for (int i = 0; i < size; i++) {
				table.put(keys[i], "dummy");
				ordered.put(keys[i], "dummy");
				fastutil.put(keys[i], "dummy");
				jdk.put(keys[i], "dummy");
			}
		}

		@Setup(Level.Invocation)
		public void beforeInvocation() {
			String evictKey = keys[idx];
			table.remove(evictKey);
			ordered.remove(evictKey);
			fastutil.remove(evictKey);
			jdk.remove(evictKey);

			nextKey = misses[idx];

			// swap so that nextKey becomes a "present" key and evict becomes an "absent" key
			keys[idx] = nextKey;
			misses[idx] = evictKey;

			idx = (idx + 1) % keys.length;
		}

		String nextMissKey() { return nextKey; }
	}

	@State(Scope.Thread)
	public static class CountState {
		@Param({ "1000", "100000" }) // distinct keys
		int distinct;

		String[] stream;
		int idx;

		@Setup(Level.Trial)
		public void setup() {
			var rnd = new Random(789);
			String[] pool = new String[distinct];
			for (int i = 0; i < distinct; i++) pool[i] = randomUuidString(rnd);
			stream = new String[1 << 20];
			for (int i = 0; i < stream.length; i++) stream[i] = pool[rnd.nextInt(distinct)];
		}

		String nextWord() {
			var w = stream[idx];
			idx = (idx + 1) & (stream.length - 1);
			return w;
		}
	}

	// ------- get hit/miss -------
	@Benchmark
	public void tableGetHit(ReadState s, Blackhole bh) {
		bh.consume(s.table.get(s.nextHitKey()));
	}

	@Benchmark
	public void orderedGetHit(ReadState s, Blackhole bh) {
		bh.consume(s.ordered.get(s.nextHitKey()));
	}

	@Benchmark
	public void fastutilGetHit(ReadState s, Blackhole bh) {
		bh.consume(s.fastutil.get(s.nextHitKey()));
	}

	@Benchmark
	public void unifiedGetHit(ReadState s, Blackhole bh) {
		bh.consume(s.unified.get(s.nextHitKey()));
	}

	@Benchmark
	public void jdkGetHit(ReadState s, Blackhole bh) {
		bh.consume(s.jdk.get(s.nextHitKey()));
	}

	@Benchmark
	public void tableGetMiss(ReadState s, Blackhole bh) {
		bh.consume(s.table.get(s.nextMissingKey()));
	}

	@Benchmark
	public void fastutilGetMiss(ReadState s, Blackhole bh) {
		bh.consume(s.fastutil.get(s.nextMissingKey()));
	}

	@Benchmark
	public void jdkGetMiss(ReadState s, Blackhole bh) {
		bh.consume(s.jdk.get(s.nextMissingKey()));
	}

	// ------- ordered iteration -------
	@Benchmark
	public void orderedIterate(ReadState s, Blackhole bh) {
		for (var e : s.ordered.entrySet()) bh.consume(e.getKey());
	}

	@Benchmark
	public void jdkLinkedIterate(ReadState s, Blackhole bh) {
		for (var e : s.jdkLinked.entrySet()) bh.consume(e.getKey());
	}

	// ------- put miss -------
	@Benchmark
	public void tablePutMiss(PutMissState s, Blackhole bh) {
		bh.consume(s.table.put(s.nextMissKey(), "dummy"));
	}

	@Benchmark
	public void orderedPutMiss(PutMissState s, Blackhole bh) {
		bh.consume(s.ordered.put(s.nextMissKey(), "dummy"));
	}

	@Benchmark
	public void fastutilPutMiss(PutMissState s, Blackhole bh) {
		bh.consume(s.fastutil.put(s.nextMissKey(), "dummy"));
	}

	@Benchmark
	public void jdkPutMiss(PutMissState s, Blackhole bh) {
		bh.consume(s.jdk.put(s.nextMissKey(), "dummy"));
	}

	// ------- counting -------
	@Benchmark
	@OperationsPerInvocation(1 << 16)
	public void countTableInc(CountState s, Blackhole bh) {
		var t = new CountTable<String>();
		for (int i = 0; i < (1 << 16); i++) t.inc(s.nextWord());
		bh.consume(t.size());
	}

	@Benchmark
	@OperationsPerInvocation(1 << 16)
	public void fastutilAddTo(CountState s, Blackhole bh) {
		var m = new Object2IntOpenHashMap<String>();
		for (int i = 0; i < (1 << 16); i++) m.addTo(s.nextWord(), 1);
		bh.consume(m.size());
	}
}
