/*
 * TupleDecoder.java
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

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import io.keytuple.tuple.TupleDecodeException.Reason;

/**
 * Reads packed elements front to back. Every failure is a {@link TupleDecodeException}
 *  whose position is the index, in the source array, of the type code of the element
 *  being read.
 */
final class TupleDecoder {
	private static final int INT_ZERO_CODE = ElementType.INTEGER.getCode();
	private static final int TRUE_CODE = ElementType.TRUE_CODE;

	private final byte[] rep;
	private final int limit;
	private int pos;

	private TupleDecoder(byte[] rep, int offset, int length) {
		this.rep = rep;
		this.pos = offset;
		this.limit = offset + length;
	}

	static List<Object> unpack(byte[] rep, int offset, int length) {
		TupleDecoder decoder = new TupleDecoder(rep, offset, length);
		List<Object> items = new ArrayList<>();
		while(decoder.pos < decoder.limit) {
			items.add(decoder.readElement());
		}
		return items;
	}

	private Object readElement() {
		int start = pos;
		int code = rep[pos++] & 0xff;
		ElementType type = ElementType.forCode(code);
		if(type == null) {
			throw new TupleDecodeException(Reason.UNKNOWN_TAG, start, String.format("Unknown tuple data type 0x%02x at index %d", code, start));
		}
		switch(type) {
			case NULL:
				return null;
			case BYTES:
				return readEscaped(start);
			case STRING:
				return readString(start);
			case NESTED:
				return readNested(start);
			case INTEGER:
				return readInteger(code, start);
			case FLOAT:
				return restoreFloat((int)readBigEndian(start, Float.BYTES));
			case DOUBLE:
				return restoreDouble(readBigEndian(start, Double.BYTES));
			case BOOLEAN:
				return code == TRUE_CODE;
			case UUID: {
				require(start, TupleEncoder.UUID_BYTES);
				return new UUID(readBigEndian(start, Long.BYTES), readBigEndian(start, Long.BYTES));
			}
			case VERSIONSTAMP: {
				require(start, Versionstamp.LENGTH);
				Versionstamp stamp = Versionstamp.read(ByteBuffer.wrap(rep, pos, Versionstamp.LENGTH));
				pos += Versionstamp.LENGTH;
				return stamp;
			}
			default:
				throw new TupleDecodeException(Reason.UNKNOWN_TAG, start, "Unknown tuple data type " + type + " at index " + start);
		}
	}

	private void require(int start, int count) {
		if(limit - pos < count) {
			throw new TupleDecodeException(Reason.TRUNCATED, start,
					"Element at index " + start + " needs " + count + " more bytes but only " + (limit - pos) + " remain");
		}
	}

	private long readBigEndian(int start, int count) {
		require(start, count);
		long value = 0L;
		for(int i = 0; i < count; i++) {
			value = (value << 8) | (rep[pos++] & 0xff);
		}
		return value;
	}

	private byte[] readEscaped(int start) {
		int end = pos;
		int escapes = 0;
		while(true) {
			if(end >= limit) {
				throw new TupleDecodeException(Reason.TRUNCATED, start, "No terminator found for element at index " + start);
			}
			if(rep[end] == TupleEncoder.NIL) {
				if(end + 1 < limit && rep[end + 1] == TupleEncoder.ESCAPE) {
					escapes++;
					end += 2;
					continue;
				}
				break;
			}
			end++;
		}
		byte[] value = new byte[end - pos - escapes];
		int out = 0;
		for(int i = pos; i < end; i++) {
			value[out++] = rep[i];
			if(rep[i] == TupleEncoder.NIL) {
				i++;
			}
		}
		pos = end + 1;
		return value;
	}

	private String readString(int start) {
		byte[] bytes = readEscaped(start);
		try {
			return Utf8.decode(bytes);
		}
		catch(CharacterCodingException e) {
			throw new TupleDecodeException(Reason.INVALID_UTF8, start, "Malformed UTF-8 in string at index " + start, e);
		}
	}

	private List<Object> readNested(int start) {
		List<Object> items = new ArrayList<>();
		while(pos < limit) {
			if(rep[pos] != TupleEncoder.NIL) {
				items.add(readElement());
			}
			else if(pos + 1 < limit && rep[pos + 1] == TupleEncoder.ESCAPE) {
				items.add(null);
				pos += 2;
			}
			else {
				pos++;
				return items;
			}
		}
		throw new TupleDecodeException(Reason.INVALID_NESTED_TUPLE, start, "No terminator found for nested tuple at index " + start);
	}

	private Object readInteger(int code, int start) {
		if(code == INT_ZERO_CODE) {
			return 0L;
		}
		boolean negative = code < INT_ZERO_CODE;
		int n;
		if(code == ElementType.POS_INT_END || code == ElementType.NEG_INT_START) {
			require(start, 1);
			int lengthByte = rep[pos++] & 0xff;
			n = negative ? lengthByte ^ 0xff : lengthByte;
		}
		else {
			n = negative ? INT_ZERO_CODE - code : code - INT_ZERO_CODE;
		}
		require(start, n);
		int flip = negative ? 0xff : 0x00;
		if(n < Long.BYTES) {
			long magnitude = 0L;
			for(int i = 0; i < n; i++) {
				magnitude = (magnitude << 8) | ((rep[pos++] ^ flip) & 0xff);
			}
			return negative ? -magnitude : magnitude;
		}
		byte[] magnitude = new byte[n];
		for(int i = 0; i < n; i++) {
			magnitude[i] = (byte)(rep[pos++] ^ flip);
		}
		BigInteger value = new BigInteger(1, magnitude);
		if(negative) {
			value = value.negate();
		}
		// Values that fit a long come back as one whatever their packed length.
		return value.bitLength() < Long.SIZE ? (Object)value.longValue() : value;
	}

	static float restoreFloat(int bits) {
		return Float.intBitsToFloat(bits ^ ((~bits >> 31) | Integer.MIN_VALUE));
	}

	static double restoreDouble(long bits) {
		return Double.longBitsToDouble(bits ^ ((~bits >> 63) | Long.MIN_VALUE));
	}
}
