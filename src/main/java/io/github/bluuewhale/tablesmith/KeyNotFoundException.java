package io.github.bluuewhale.tablesmith;

import java.util.NoSuchElementException;

/**
 * Thrown by the accessors that require the key to be present, such as
 * {@code getOrThrow} and {@code computeExisting}.
 */
public class KeyNotFoundException extends NoSuchElementException {

	private static final long serialVersionUID = 1L;

	private final transient Object key;

	public KeyNotFoundException(Object key) {
		super("key not found: " + key);
		this.key = key;
	}

	public Object getKey() {
		return key;
	}
}
