/*
 * Utf8.java
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
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * UTF-8 helpers for string elements. Java strings are UTF-16, so a string is checked
 *  for unpaired surrogates before it is packed, and comparisons go by code point,
 *  which is the order of the UTF-8 bytes.
 */
final class Utf8 {
	private Utf8() {}

	/**
	 * Checks that every surrogate in {@code s} is part of a pair.
	 *
	 * @throws IllegalArgumentException if {@code s} is not well-formed UTF-16
	 */
	static void validate(String s) {
		for(int i = 0; i < s.length(); i++) {
			char c = s.charAt(i);
			if(Character.isHighSurrogate(c)) {
				if(i + 1 >= s.length() || !Character.isLowSurrogate(s.charAt(i + 1))) {
					throw new IllegalArgumentException("malformed UTF-16 string: unpaired high surrogate at index " + i);
				}
				i++;
			}
			else if(Character.isLowSurrogate(c)) {
				throw new IllegalArgumentException("malformed UTF-16 string: unpaired low surrogate at index " + i);
			}
		}
	}

	static byte[] encode(String s) {
		validate(s);
		return s.getBytes(StandardCharsets.UTF_8);
	}

	/**
	 * Decodes UTF-8, refusing malformed input instead of substituting replacement characters.
	 */
	static String decode(byte[] bytes) throws CharacterCodingException {
		return StandardCharsets.UTF_8.newDecoder()
				.onMalformedInput(CodingErrorAction.REPORT)
				.onUnmappableCharacter(CodingErrorAction.REPORT)
				.decode(ByteBuffer.wrap(bytes))
				.toString();
	}

	/**
	 * Length of the UTF-8 form of {@code s} once every {@code NUL} is escaped to two bytes.
	 */
	static int escapedLength(String s) {
		int length = 0;
		for(int i = 0; i < s.length(); i++) {
			char c = s.charAt(i);
			if(c == 0 || c >= 0x80 && c < 0x800) {
				length += 2;
			}
			else if(c < 0x80) {
				length += 1;
			}
			else if(Character.isHighSurrogate(c) && i + 1 < s.length() && Character.isLowSurrogate(s.charAt(i + 1))) {
				length += 4;
				i++;
			}
			else {
				length += 3;
			}
		}
		return length;
	}

	static int compare(String s1, String s2) {
		int i = 0;
		int j = 0;
		while(i < s1.length() && j < s2.length()) {
			int cp1 = s1.codePointAt(i);
			int cp2 = s2.codePointAt(j);
			if(cp1 != cp2) {
				return Integer.compare(cp1, cp2);
			}
			i += Character.charCount(cp1);
			j += Character.charCount(cp2);
		}
		return Integer.compare(s1.length() - i, s2.length() - j);
	}
}
