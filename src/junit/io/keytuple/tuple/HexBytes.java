/*
 * HexBytes.java
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

/**
 * Spells test vectors as hex, e.g. {@code "15 01"}.
 */
final class HexBytes {
	private HexBytes() {}

	static byte[] hex(String spaced) {
		String digits = spaced.replace(" ", "");
		byte[] bytes = new byte[digits.length() / 2];
		for(int i = 0; i < bytes.length; i++) {
			bytes[i] = (byte)Integer.parseInt(digits.substring(2 * i, 2 * i + 2), 16);
		}
		return bytes;
	}

	static String repeat(String hexByte, int times) {
		StringBuilder sb = new StringBuilder();
		for(int i = 0; i < times; i++) {
			sb.append(hexByte).append(' ');
		}
		return sb.toString();
	}
}
