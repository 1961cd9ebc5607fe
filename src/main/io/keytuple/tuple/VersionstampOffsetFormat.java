/*
 * VersionstampOffsetFormat.java
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

package io.keytuple.tuple;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Layout of the trailer that {@link Tuple#packWithVersionstamp(byte[], VersionstampOffsetFormat)}
 *  appends to a packed {@code Tuple}. The trailer is the little-endian position, within
 *  the key handed to the database, of the ten placeholder bytes of the incomplete
 *  {@link Versionstamp}. The database strips it when it applies the mutation.
 *
 * <p>
 * The versionstamped-key protocol uses the two-byte {@link #SHORT} trailer, and that
 *  is what every overload without a format argument writes. Database API versions
 *  from {@value #INT_OFFSET_API_VERSION} on accept the four-byte {@link #INT} trailer,
 *  which callers have to ask for explicitly.
 * </p>
 */
public enum VersionstampOffsetFormat {
	/**
	 * Two-byte little-endian trailer. The placeholder must start within the
	 *  first {@code 0xffff} bytes of the key.
	 */
	SHORT(Short.BYTES, 0xffff),

	/**
	 * Four-byte little-endian trailer.
	 */
	INT(Integer.BYTES, Integer.MAX_VALUE);

	/**
	 * First API version that uses the four-byte trailer.
	 */
	public static final int INT_OFFSET_API_VERSION = 520;

	private final int bytes;
	private final int maxPosition;

	VersionstampOffsetFormat(int bytes, int maxPosition) {
		this.bytes = bytes;
		this.maxPosition = maxPosition;
	}

	/**
	 * Gets the number of bytes the trailer occupies.
	 *
	 * @return trailer length in bytes
	 */
	public int getBytes() {
		return bytes;
	}

	public int getMaxPosition() {
		return maxPosition;
	}

	/**
	 * Selects the trailer format expected by a given database API version.
	 *
	 * @param apiVersion the API version the client was started with
	 * @return {@link #SHORT} below {@value #INT_OFFSET_API_VERSION}, otherwise {@link #INT}
	 */
	public static VersionstampOffsetFormat forApiVersion(int apiVersion) {
		return apiVersion < INT_OFFSET_API_VERSION ? SHORT : INT;
	}

	void write(ByteBuffer dest, int position) {
		if(position < 0) {
			throw new IllegalArgumentException("Versionstamp placeholder cannot sit at negative position " + position);
		}
		if(position > maxPosition) {
			throw new IllegalArgumentException("Versionstamp placeholder at position " + position
					+ " does not fit a " + name() + " trailer (maximum " + maxPosition + ")");
		}
		ByteOrder order = dest.order();
		dest.order(ByteOrder.LITTLE_ENDIAN);
		if(bytes == Short.BYTES) {
			dest.putShort((short)position);
		}
		else {
			dest.putInt(position);
		}
		dest.order(order);
	}

	/**
	 * Reads the placeholder position from the trailer at the end of a packed key.
	 *
	 * @param packed a key ending in a trailer of this format
	 * @return the position of the incomplete {@link Versionstamp}'s placeholder
	 * @throws IllegalArgumentException if {@code packed} is shorter than the trailer
	 */
	public int readPosition(byte[] packed) {
		if(packed.length < bytes) {
			throw new IllegalArgumentException("Packed key is too short to hold a versionstamp offset");
		}
		ByteBuffer trailer = ByteBuffer.wrap(packed, packed.length - bytes, bytes).order(ByteOrder.LITTLE_ENDIAN);
		return bytes == Short.BYTES ? (trailer.getShort() & 0xffff) : trailer.getInt();
	}

	/**
	 * Shifts the trailer of a packed key in place, as needed once {@code delta} bytes
	 *  have been put in front of it.
	 *
	 * @param packed a key ending in a trailer of this format
	 * @param delta number of bytes the placeholder moved by
	 * @throws IllegalArgumentException if the shifted position does not fit the trailer
	 */
	public void adjust(byte[] packed, int delta) {
		int position = readPosition(packed) + delta;
		ByteBuffer dest = ByteBuffer.wrap(packed);
		dest.position(packed.length - bytes);
		write(dest, position);
	}
}
