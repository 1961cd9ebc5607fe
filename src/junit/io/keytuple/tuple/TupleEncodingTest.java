/*
 * TupleEncodingTest.java
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

import static io.keytuple.tuple.HexBytes.hex;
import static io.keytuple.tuple.HexBytes.repeat;

import java.math.BigInteger;
import java.nio.BufferOverflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.UUID;
import java.util.stream.Stream;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

/**
 * Known packed forms of single elements and small tuples.
 */
class TupleEncodingTest {
	private static final BigInteger TWO_TO_THE_64 = BigInteger.ONE.shiftLeft(64);

	static Stream<Arguments> knownEncodings() {
		return Stream.of(
		    // the reference scenarios of the format
		    Arguments.of(Tuple.from(), ""),
		    Arguments.of(Tuple.from(new byte[] { 'h', 'e', 'l', 'l', 'o' }), "01 68 65 6c 6c 6f 00"),
		    Arguments.of(Tuple.from(1L), "15 01"),
		    Arguments.of(Tuple.from(0L), "14"),
		    Arguments.of(Tuple.from(-5L), "13 fa"),
		    Arguments.of(Tuple.from(1.5f), "20 bf c0 00 00"),
		    Arguments.of(Tuple.from(true), "27"),
		    Arguments.of(Tuple.from(false), "26"),
		    Arguments.of(Tuple.from(Versionstamp.complete(0xdeadbeefdeadbeefL, 0xbeef, 12)),
		                 "33 de ad be ef de ad be ef be ef 00 0c"),

		    // integers around each length boundary
		    Arguments.of(Tuple.from(-1L), "13 fe"),
		    Arguments.of(Tuple.from(255L), "15 ff"),
		    Arguments.of(Tuple.from(256L), "16 01 00"),
		    Arguments.of(Tuple.from(-255L), "13 00"),
		    Arguments.of(Tuple.from(-256L), "12 fe ff"),
		    Arguments.of(Tuple.from(123456789L), "18 07 5b cd 15"),
		    Arguments.of(Tuple.from(Long.MAX_VALUE), "1c 7f ff ff ff ff ff ff ff"),
		    Arguments.of(Tuple.from(Long.MIN_VALUE), "0c 7f ff ff ff ff ff ff ff"),
		    Arguments.of(Tuple.from(TWO_TO_THE_64.subtract(BigInteger.ONE)), "1c ff ff ff ff ff ff ff ff"),
		    Arguments.of(Tuple.from(TWO_TO_THE_64.negate().add(BigInteger.ONE)), "0c 00 00 00 00 00 00 00 00"),
		    Arguments.of(Tuple.from(TWO_TO_THE_64), "1d 09 01 00 00 00 00 00 00 00 00"),
		    Arguments.of(Tuple.from(TWO_TO_THE_64.negate()), "0b f6 fe ff ff ff ff ff ff ff ff"),
		    Arguments.of(Tuple.from(BigInteger.ONE.shiftLeft(8 * 255).subtract(BigInteger.ONE)), "1d ff " + repeat("ff", 255)),
		    Arguments.of(Tuple.from(BigInteger.ZERO), "14"),
		    Arguments.of(Tuple.from(7), "15 07"),

		    // floating point
		    Arguments.of(Tuple.from(-1.5f), "20 40 3f ff ff"),
		    Arguments.of(Tuple.from(0.0f), "20 80 00 00 00"),
		    Arguments.of(Tuple.from(-0.0f), "20 7f ff ff ff"),
		    Arguments.of(Tuple.from(Float.POSITIVE_INFINITY), "20 ff 80 00 00"),
		    Arguments.of(Tuple.from(1.5), "21 bf f8 00 00 00 00 00 00"),
		    Arguments.of(Tuple.from(-1.5), "21 40 07 ff ff ff ff ff ff"),
		    Arguments.of(Tuple.from(-0.0), "21 7f ff ff ff ff ff ff ff"),

		    // strings and byte strings, with escaped nulls
		    Arguments.of(Tuple.from(""), "02 00"),
		    Arguments.of(Tuple.from("hello"), "02 68 65 6c 6c 6f 00"),
		    Arguments.of(Tuple.from("a\u0000b"), "02 61 00 ff 62 00"),
		    Arguments.of(Tuple.from("é"), "02 c3 a9 00"),
		    Arguments.of(Tuple.from("😀"), "02 f0 9f 98 80 00"),
		    Arguments.of(Tuple.from(new byte[0]), "01 00"),
		    Arguments.of(Tuple.from(new byte[] { 0x00 }), "01 00 ff 00"),
		    Arguments.of(Tuple.from(new byte[] { 0x00, (byte)0xff, 0x00 }), "01 00 ff ff 00 ff 00"),

		    // nulls, nesting, UUIDs
		    Arguments.of(Tuple.from((Object)null), "00"),
		    Arguments.of(Tuple.from(null, null), "00 00"),
		    Arguments.of(Tuple.from(Tuple.from()), "05 00"),
		    Arguments.of(Tuple.from(Tuple.from(1L)), "05 15 01 00"),
		    Arguments.of(Tuple.from(Tuple.from((Object)null)), "05 00 ff 00"),
		    Arguments.of(Tuple.from(Arrays.asList("a", Arrays.asList((Object)null)), 1L), "05 02 61 00 05 00 ff 00 00 15 01"),
		    Arguments.of(Tuple.from(UUID.fromString("00112233-4455-6677-8899-aabbccddeeff")),
		                 "30 00 11 22 33 44 55 66 77 88 99 aa bb cc dd ee ff"),
		    Arguments.of(Tuple.from("k", 2L, true), "02 6b 00 15 02 27"));
	}

	@ParameterizedTest
	@MethodSource("knownEncodings")
	void packsToKnownBytes(Tuple tuple, String expected) {
		Assertions.assertArrayEquals(hex(expected), tuple.pack());
	}

	@ParameterizedTest
	@MethodSource("knownEncodings")
	void packedSizeIsExact(Tuple tuple, String expected) {
		Assertions.assertEquals(hex(expected).length, tuple.getPackedSize());
	}

	@ParameterizedTest
	@MethodSource("knownEncodings")
	void decodesKnownBytes(Tuple tuple, String expected) {
		Tuple decoded = Tuple.fromBytes(hex(expected));
		Assertions.assertEquals(tuple, decoded);
		Assertions.assertEquals(tuple.hashCode(), decoded.hashCode());
		Assertions.assertEquals(tuple.size(), decoded.size());
	}

	@Test
	void completeVersionstampFieldsSurvive() {
		Versionstamp decoded = Tuple.fromBytes(hex("33 de ad be ef de ad be ef be ef 00 0c")).getVersionstamp(0);
		Assertions.assertTrue(decoded.isComplete());
		Assertions.assertEquals(0xdeadbeefdeadbeefL, decoded.getTransactionVersion());
		Assertions.assertEquals(0xbeef, decoded.getBatchNumber());
		Assertions.assertEquals(12, decoded.getUserVersion());
	}

	@Test
	void integersDecodeToNarrowestType() {
		Assertions.assertEquals(Long.class, Tuple.fromBytes(hex("1c 7f ff ff ff ff ff ff ff")).get(0).getClass());
		Assertions.assertEquals(Long.class, Tuple.fromBytes(hex("0c 7f ff ff ff ff ff ff ff")).get(0).getClass());
		Assertions.assertEquals(BigInteger.class, Tuple.fromBytes(hex("1c 80 00 00 00 00 00 00 00")).get(0).getClass());
		// an over-long extended form still decodes to the value it holds
		Assertions.assertEquals(5L, Tuple.fromBytes(hex("1d 01 05")).get(0));
	}

	@Test
	void decodesSlice() {
		byte[] framed = hex("ee ee 15 01 02 61 00 ee");
		Assertions.assertEquals(Tuple.from(1L, "a"), Tuple.fromBytes(framed, 2, 5));
		Assertions.assertEquals(Tuple.from(), Tuple.fromBytes(framed, 8, 0));

		Assertions.assertThrows(IllegalArgumentException.class, () -> Tuple.fromBytes(framed, -1, 2));
		Assertions.assertThrows(IllegalArgumentException.class, () -> Tuple.fromBytes(framed, 9, 0));
		Assertions.assertThrows(IllegalArgumentException.class, () -> Tuple.fromBytes(framed, 2, -1));
		Assertions.assertThrows(IllegalArgumentException.class, () -> Tuple.fromBytes(framed, 2, 7));
	}

	@Test
	void packsIntoBuffer() {
		Tuple t = Tuple.from("k", 2L, true);
		ByteBuffer buffer = ByteBuffer.allocate(t.getPackedSize() + 2).order(ByteOrder.LITTLE_ENDIAN);
		buffer.put((byte)0x42);
		t.packInto(buffer);
		Assertions.assertEquals(ByteOrder.LITTLE_ENDIAN, buffer.order());
		Assertions.assertEquals(1 + t.getPackedSize(), buffer.position());
		Assertions.assertArrayEquals(hex("42 02 6b 00 15 02 27 00"), buffer.array());

		ByteBuffer tooSmall = ByteBuffer.allocate(t.getPackedSize() - 1);
		Assertions.assertThrows(BufferOverflowException.class, () -> Tuple.from("k", 2L, true).packInto(tooSmall));
	}
}
