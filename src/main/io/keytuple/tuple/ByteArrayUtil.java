/*
 * ByteArrayUtil.java
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

import java.util.Arrays;

/**
 * Byte-array helpers for working with packed keys. Keys are ordered as unsigned bytes,
 *  the order a sorted key-value store keeps them in.
 */
public final class ByteArrayUtil {
	private ByteArrayUtil() {}

	/**
	 * Concatenates byte arrays. {@code null} arrays are treated as empty.
	 *
	 * @param parts the arrays to concatenate
	 * @return a new array holding every part in order
	 */
	public static byte[] join(byte[]... parts) {
		int size = 0;
		for(byte[] part : parts) {
			size += part == null ? 0 : part.length;
		}
		byte[] joined = new byte[size];
		int pos = 0;
		for(byte[] part : parts) {
			if(part != null) {
				System.arraycopy(part, 0, joined, pos, part.length);
				pos += part.length;
			}
		}
		return joined;
	}

	/**
	 * Compares two arrays as unsigned bytes, a proper prefix sorting first.
	 *
	 * @param l the left array
	 * @param r the right array
	 * @return a negative number, zero, or a positive number as {@code l} sorts
	 *  before, with, or after {@code r}
	 */
	public static int compareUnsigned(byte[] l, byte[] r) {
		return Arrays.compareUnsigned(l, r);
	}

	public static boolean startsWith(byte[] array, byte[] prefix) {
		return array.length >= prefix.length
				&& Arrays.equals(array, 0, prefix.length, prefix, 0, prefix.length);
	}

	/**
	 * Computes the first key that sorts after every key starting with {@code key}:
	 *  trailing {@code 0xff} bytes are dropped and the last remaining byte is incremented.
	 *
	 * @param key a non-empty key
	 * @return the first key past all keys prefixed by {@code key}
	 * @throws IllegalArgumentException if {@code key} is empty or holds only {@code 0xff} bytes
	 */
	public static byte[] strinc(byte[] key) {
		int end = key.length;
		while(end > 0 && key[end - 1] == (byte)0xff) {
			end--;
		}
		if(end == 0) {
			throw new IllegalArgumentException("No key beyond supplied prefix");
		}
		byte[] next = Arrays.copyOf(key, end);
		next[end - 1]++;
		return next;
	}

	/**
	 * Renders bytes for humans: printable ASCII as is, a backslash doubled,
	 *  and anything else as {@code \xNN}.
	 *
	 * @param val the bytes to render, possibly {@code null}
	 * @return the rendering, or {@code null} for {@code null}
	 */
	public static String printable(byte[] val) {
		if(val == null) {
			return null;
		}
		StringBuilder sb = new StringBuilder(val.length);
		for(byte b : val) {
			if(b == '\\') {
				sb.append("\\\\");
			}
			else if(b >= 0x20 && b < 0x7f) {
				sb.append((char)b);
			}
			else {
				sb.append(String.format("\\x%02x", b & 0xff));
			}
		}
		return sb.toString();
	}
}
