/*
 * Subspace.java
 *
 * This source file is part of the keytuple project, derived from the
 * FoundationDB open source project
 *
 * Copyright 2013-2018 Apple Inc. and the FoundationDB project authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.keytuple.subspace;

import java.util.Arrays;

import io.keytuple.Range;
import io.keytuple.tuple.ByteArrayUtil;
import io.keytuple.tuple.Tuple;
import io.keytuple.tuple.TupleDecodeException;
import io.keytuple.tuple.VersionstampOffsetFormat;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A region of the key space set apart by a common byte prefix. Keys are built by
 *  packing a {@link Tuple} behind the prefix, and read back by stripping it.
 *  The prefix is often itself a packed {@code Tuple}, so that with
 *  {@code new Subspace(Tuple.from("users"))} the key for {@code ("Smith")} is the
 *  packed form of {@code ("users", "Smith")}.
 */
public class Subspace {
	private static final Logger LOGGER = LoggerFactory.getLogger(Subspace.class);

	private final byte[] prefix;

	public Subspace() {
		this(new byte[0]);
	}

	/**
	 * Creates a subspace whose prefix is a packed {@link Tuple}.
	 *
	 * @param prefix the tuple to pack
	 * @throws IllegalArgumentException if {@code prefix} holds an incomplete {@link io.keytuple.tuple.Versionstamp}
	 */
	public Subspace(Tuple prefix) {
		this(prefix, new byte[0]);
	}

	public Subspace(byte[] rawPrefix) {
		this.prefix = rawPrefix.clone();
	}

	/**
	 * Creates a subspace whose prefix is {@code rawPrefix} followed by the packed {@code prefix}.
	 *
	 * @param prefix the tuple to pack after the raw bytes
	 * @param rawPrefix leading bytes of every key
	 */
	public Subspace(Tuple prefix, byte[] rawPrefix) {
		this.prefix = prefix.pack(rawPrefix);
	}

	/**
	 * Gets the prefix shared by every key of this subspace.
	 *
	 * @return a copy of the prefix
	 */
	public byte[] getKey() {
		return prefix.clone();
	}

	public byte[] pack(Tuple tuple) {
		return tuple.pack(prefix);
	}

	public byte[] pack(Object item) {
		return pack(Tuple.from(item));
	}

	/**
	 * Packs a {@link Tuple} holding one incomplete {@link io.keytuple.tuple.Versionstamp}
	 *  behind the prefix, ending in a two-byte trailer that counts the prefix.
	 *
	 * @param tuple the tuple to pack
	 * @return the key for a versionstamped mutation
	 * @throws IllegalArgumentException if {@code tuple} does not hold exactly one incomplete versionstamp
	 */
	public byte[] packWithVersionstamp(Tuple tuple) {
		return tuple.packWithVersionstamp(prefix);
	}

	public byte[] packWithVersionstamp(Tuple tuple, VersionstampOffsetFormat format) {
		return tuple.packWithVersionstamp(prefix, format);
	}

	/**
	 * Decodes the {@link Tuple} packed after the prefix of {@code key}.
	 *
	 * @param key a key of this subspace
	 * @return the tuple following the prefix
	 * @throws IllegalArgumentException if {@code key} does not start with the prefix
	 * @throws TupleDecodeException if the rest of {@code key} is not a packed tuple
	 */
	public Tuple unpack(byte[] key) {
		if(!contains(key)) {
			LOGGER.debug("Key {} is outside subspace {}", ByteArrayUtil.printable(key), this);
			throw new IllegalArgumentException("Cannot unpack key that is not contained in subspace.");
		}
		return Tuple.fromBytes(key, prefix.length, key.length - prefix.length);
	}

	/**
	 * Gets the range of keys that pack a {@link Tuple} in this subspace. The prefix
	 *  itself is not part of it.
	 *
	 * @return the range of this subspace
	 */
	public Range range() {
		return range(new Tuple());
	}

	public Range range(Tuple tuple) {
		return tuple.range(prefix);
	}

	public boolean contains(byte[] key) {
		return ByteArrayUtil.startsWith(key, prefix);
	}

	/**
	 * Gets the subspace for keys of this one that continue with {@code tuple}.
	 *
	 * @param tuple elements appended to the prefix
	 * @return the nested subspace
	 */
	public Subspace subspace(Tuple tuple) {
		return new Subspace(tuple, prefix);
	}

	public Subspace get(Object item) {
		return subspace(Tuple.from(item));
	}

	public Subspace get(Tuple tuple) {
		return subspace(tuple);
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof Subspace && Arrays.equals(prefix, ((Subspace)o).prefix);
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(prefix);
	}

	@Override
	public String toString() {
		return "Subspace(rawPrefix=" + ByteArrayUtil.printable(prefix) + ")";
	}
}
