/*
 * RangeTest.java
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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class RangeTest {
	@Test
	void testStartsWith() {
		Range range = Range.startsWith(new byte[] { 0x01, (byte)0xff });
		Assertions.assertArrayEquals(new byte[] { 0x01, (byte)0xff }, range.begin);
		Assertions.assertArrayEquals(new byte[] { 0x02 }, range.end);
		Assertions.assertTrue(range.contains(new byte[] { 0x01, (byte)0xff }));
		Assertions.assertTrue(range.contains(new byte[] { 0x01, (byte)0xff, (byte)0xff, 0x00 }));
		Assertions.assertFalse(range.contains(new byte[] { 0x02 }));
		Assertions.assertFalse(range.contains(new byte[] { 0x01, (byte)0xfe }));

		Assertions.assertThrows(NullPointerException.class, () -> Range.startsWith(null));
		Assertions.assertThrows(IllegalArgumentException.class, () -> Range.startsWith(new byte[] { (byte)0xff, (byte)0xff }));
	}

	@Test
	void testEquality() {
		Range a = new Range(new byte[] { 0x01 }, new byte[] { 0x02 });
		Range b = new Range(new byte[] { 0x01 }, new byte[] { 0x02 });
		Range c = new Range(new byte[] { 0x01 }, new byte[] { 0x03 });
		Assertions.assertEquals(a, b);
		Assertions.assertEquals(a.hashCode(), b.hashCode());
		Assertions.assertNotEquals(a, c);
		Assertions.assertNotEquals(a, "not a range");
		Assertions.assertEquals("Range(\"\\x01\", \"\\x02\")", a.toString());
	}
}
