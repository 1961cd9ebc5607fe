/*
 * Range.java
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

package io.keytuple;

import java.util.Arrays;

import io.keytuple.tuple.ByteArrayUtil;

/**
 * A half-open span of keys, from {@code begin} (inclusive) to {@code end} (exclusive),
 *  ordered as unsigned bytes.
 */
public class Range {
	/** First key of the range. */
	public final byte[] begin;

	/** First key past the range. */
	public final byte[] end;

	public Range(byte[] begin, byte[] end) {
		this.begin = begin;
		this.end = end;
	}

	/**
	 * Gets the range of every key that starts with {@code prefix}.
	 *
	 * @param prefix the common prefix
	 * @return {@code prefix} up to the first key after all keys it prefixes
	 * @throws NullPointerException if {@code prefix} is {@code null}
	 * @throws IllegalArgumentException if {@code prefix} is empty or only {@code 0xff} bytes
	 */
	public static Range startsWith(byte[] prefix) {
		if(prefix == null) {
			throw new NullPointerException("prefix cannot be null");
		}
		return new Range(prefix, ByteArrayUtil.strinc(prefix));
	}

	public boolean contains(byte[] key) {
		return ByteArrayUtil.compareUnsigned(begin, key) <= 0 && ByteArrayUtil.compareUnsigned(key, end) < 0;
	}

	@Override
	public boolean equals(Object o) {
		if(!(o instanceof Range)) {
			return false;
		}
		Range other = (Range)o;
		return Arrays.equals(begin, other.begin) && Arrays.equals(end, other.end);
	}

	@Override
	public int hashCode() {
		return 31 * Arrays.hashCode(begin) + Arrays.hashCode(end);
	}

	@Override
	public String toString() {
		return "Range(" + quote(begin) + ", " + quote(end) + ")";
	}

	private static String quote(byte[] key) {
		return key == null ? "null" : "\"" + ByteArrayUtil.printable(key) + "\"";
	}
}
