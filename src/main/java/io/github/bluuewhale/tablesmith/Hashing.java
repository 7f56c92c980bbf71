package io.github.bluuewhale.tablesmith;

/**
 * Hash mixing shared by the tables.
 */
final class Hashing {
	private Hashing() {}

	/* Murmur3 mixing constants */
	private static final int C1 = 0xcc9e2d51;
	private static final int C2 = 0x1b873593;

	static int smearedHash(Object key) {
		return C2 * Integer.rotateLeft(key.hashCode() * C1, 15);
	}
}
