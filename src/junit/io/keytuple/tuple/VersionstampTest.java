/*
 * VersionstampTest.java
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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

/**
 * Tests for the versionstamp value type.
 */
class VersionstampTest {
	private static final byte FF = (byte)0xff;

	@Test
	void completeFromParts() {
		Versionstamp v = Versionstamp.complete(0xdeadbeefdeadbeefL, 0xbeef, 12);
		Assertions.assertTrue(v.isComplete());
		Assertions.assertArrayEquals(new byte[] { (byte)0xde, (byte)0xad, (byte)0xbe, (byte)0xef, (byte)0xde, (byte)0xad,
		                                          (byte)0xbe, (byte)0xef, (byte)0xbe, (byte)0xef, 0x00, 0x0c },
		                             v.getBytes());
		Assertions.assertEquals(0xdeadbeefdeadbeefL, v.getTransactionVersion());
		Assertions.assertEquals(0xbeef, v.getBatchNumber());
		Assertions.assertEquals(12, v.getUserVersion());
		Assertions.assertEquals(Versionstamp.GLOBAL_VERSION_LENGTH, v.getGlobalVersion().length);
		Assertions.assertEquals("Versionstamp(16045690984833335023 48879 12)", v.toString());
	}

	@Test
	void completeFieldsSurviveRoundTrip() {
		Versionstamp v = Versionstamp.complete(-2L, 0xffff, 0xfffe);
		Versionstamp decoded = Tuple.fromBytes(Tuple.from(v).pack()).getVersionstamp(0);
		Assertions.assertEquals(v, decoded);
		Assertions.assertEquals(-2L, decoded.getTransactionVersion());
		Assertions.assertEquals(0xffff, decoded.getBatchNumber());
		Assertions.assertEquals(0xfffe, decoded.getUserVersion());
	}

	@Test
	void incomplete() {
		Versionstamp v = Versionstamp.incomplete(7);
		Assertions.assertFalse(v.isComplete());
		Assertions.assertEquals(7, v.getUserVersion());
		byte[] bytes = v.getBytes();
		for(int i = 0; i < Versionstamp.GLOBAL_VERSION_LENGTH; i++) {
			Assertions.assertEquals(FF, bytes[i], "placeholder byte " + i);
		}
		Assertions.assertEquals(Versionstamp.incomplete(0), Versionstamp.incomplete());
		Assertions.assertEquals("Versionstamp(<incomplete> 7)", v.toString());
	}

	@Test
	void fromBytesDetectsPlaceholder() {
		byte[] bytes = Versionstamp.incomplete(3).getBytes().clone();
		Assertions.assertFalse(Versionstamp.fromBytes(bytes).isComplete());
		bytes[9] = (byte)0xfe;
		Versionstamp v = Versionstamp.fromBytes(bytes);
		Assertions.assertTrue(v.isComplete());
		Assertions.assertEquals(3, v.getUserVersion());

		// the bytes are copied
		bytes[0] = 0x00;
		Assertions.assertEquals(FF, v.getBytes()[0]);
	}

	@Test
	void rejectsInvalidArguments() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> Versionstamp.incomplete(-1));
		Assertions.assertThrows(IllegalArgumentException.class, () -> Versionstamp.incomplete(0x10000));
		Assertions.assertThrows(IllegalArgumentException.class, () -> Versionstamp.complete(1L, 0x10000, 0));
		Assertions.assertThrows(IllegalArgumentException.class, () -> Versionstamp.complete(1L, 0, -1));
		Assertions.assertThrows(IllegalArgumentException.class, () -> Versionstamp.complete(new byte[9], 0));
		Assertions.assertThrows(IllegalArgumentException.class, () -> Versionstamp.fromBytes(new byte[11]));
	}

	@Test
	void ordering() {
		Versionstamp low = Versionstamp.complete(1L, 0, 5);
		Versionstamp lowBatch = Versionstamp.complete(1L, 1, 0);
		Versionstamp high = Versionstamp.complete(-1L, 0, 0); // unsigned max
		Versionstamp incomplete0 = Versionstamp.incomplete(0);
		Versionstamp incomplete1 = Versionstamp.incomplete(1);

		List<Versionstamp> expected = Arrays.asList(low, lowBatch, high, incomplete0, incomplete1);
		List<Versionstamp> shuffled = new ArrayList<>(expected);
		Collections.reverse(shuffled);
		Collections.sort(shuffled);
		Assertions.assertEquals(expected, shuffled);
	}

	@Test
	void completeCannotUsePlaceholderGlobalVersion() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> Versionstamp.complete(0xffffffffffffffffL, 0xffff, 7));
		byte[] placeholder = new byte[Versionstamp.GLOBAL_VERSION_LENGTH];
		Arrays.fill(placeholder, FF);
		Assertions.assertThrows(IllegalArgumentException.class, () -> Versionstamp.complete(placeholder));

		// one bit short of the placeholder is a legal commit version and must come back complete
		Versionstamp largest = Versionstamp.complete(0xffffffffffffffffL, 0xfffe, 7);
		Tuple decoded = Tuple.fromBytes(Tuple.from(largest).pack());
		Assertions.assertTrue(decoded.getVersionstamp(0).isComplete());
		Assertions.assertEquals(Tuple.from(largest), decoded);
	}

	@Test
	void bytesAreCopies() {
		Versionstamp v = Versionstamp.complete(1L, 2, 3);
		byte[] bytes = v.getBytes();
		bytes[Versionstamp.LENGTH - 1] = 5;
		Assertions.assertEquals(3, v.getUserVersion());
		Assertions.assertEquals(3, v.getBytes()[Versionstamp.LENGTH - 1]);
		v.getGlobalVersion()[0] = 0x7f;
		Assertions.assertEquals(1L, v.getTransactionVersion());
	}

	@Test
	void unpackUserVersion() {
		byte[] bytes = new byte[] { 0x00, 0x01, (byte)0x91, 0x00 };
		Assertions.assertEquals(0x0191, Versionstamp.unpackUserVersion(bytes, 1));
	}

	@Test
	void equalityAndHash() {
		Versionstamp a = Versionstamp.complete(new byte[] { 0x01, 0x02, 0x03, 0x04, 0x05, 0x06, 0x07, 0x08, 0x09, 0x0a }, 657);
		Versionstamp b = Versionstamp.fromBytes(a.getBytes());
		Assertions.assertEquals(a, b);
		Assertions.assertEquals(a.hashCode(), b.hashCode());
		Assertions.assertNotEquals(a, Versionstamp.incomplete(657));
	}
}
