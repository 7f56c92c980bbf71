package io.github.bluuewhale.tablesmith;

/**
 * Computes the hash a table uses to pick the first probe slot for a key.
 * The rules of {@link Object#hashCode()} apply: keys that are equal must hash equally.
 */
@FunctionalInterface
public interface Hasher<K> {

	int hash(K key);

	/**
	 * Smears {@code key.hashCode()} so that keys differing only in their high bits
	 * still spread across a power-of-two table.
	 */
	static <K> Hasher<K> defaultHasher() {
		return Hashing::smearedHash;
	}
}
