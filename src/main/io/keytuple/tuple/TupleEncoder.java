/*
 * TupleEncoder.java
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
import java.nio.ByteOrder;
import java.util.List;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes tuple elements into a {@link ByteBuffer}. One encoder packs one tuple; it
 *  remembers where the placeholder of an incomplete {@link Versionstamp} was written
 *  so that a versionstamp trailer can point at it.
 */
final class TupleEncoder {
	private static final Logger LOGGER = LoggerFactory.getLogger(TupleEncoder.class);

	static final byte NIL = 0x00;
	static final byte ESCAPE = (byte)0xff;

	private static final byte BYTES_CODE = (byte)ElementType.BYTES.getCode();
	private static final byte STRING_CODE = (byte)ElementType.STRING.getCode();
	private static final byte NESTED_CODE = (byte)ElementType.NESTED.getCode();
	private static final int INT_ZERO_CODE = ElementType.INTEGER.getCode();
	private static final byte FLOAT_CODE = (byte)ElementType.FLOAT.getCode();
	private static final byte DOUBLE_CODE = (byte)ElementType.DOUBLE.getCode();
	private static final byte FALSE_CODE = (byte)ElementType.BOOLEAN.getCode();
	private static final byte TRUE_CODE = (byte)ElementType.TRUE_CODE;
	private static final byte UUID_CODE = (byte)ElementType.UUID.getCode();
	private static final byte VERSIONSTAMP_CODE = (byte)ElementType.VERSIONSTAMP.getCode();

	static final int MAX_INT_BYTES = 0xff;
	static final int UUID_BYTES = 2 * Long.BYTES;

	/**
	 * What to do on meeting an incomplete {@link Versionstamp}.
	 */
	enum Mode {
		/** Refuse it: plain keys cannot hold a placeholder. */
		PLAIN,
		/** Record its position; a second one is an error. */
		VERSIONSTAMP,
		/** Write the placeholder and carry on, for hashing. */
		LENIENT
	}

	private final ByteBuffer dest;
	private final int origin;
	private final Mode mode;
	private int placeholderPosition = -1;

	private TupleEncoder(ByteBuffer dest, int origin, Mode mode) {
		this.dest = dest;
		this.origin = origin;
		this.mode = mode;
	}

	static byte[] pack(List<?> items, int size) {
		ByteBuffer dest = ByteBuffer.allocate(size);
		new TupleEncoder(dest, 0, Mode.PLAIN).writeAll(items);
		return dest.array();
	}

	static void packInto(ByteBuffer dest, List<?> items) {
		ByteOrder order = dest.order();
		dest.order(ByteOrder.BIG_ENDIAN);
		try {
			new TupleEncoder(dest, dest.position(), Mode.PLAIN).writeAll(items);
		}
		finally {
			dest.order(order);
		}
	}

	static byte[] packLeniently(List<?> items) {
		ByteBuffer dest = ByteBuffer.allocate(packedSize(items, false, 0));
		new TupleEncoder(dest, 0, Mode.LENIENT).writeAll(items);
		return dest.array();
	}

	/**
	 * Packs a tuple holding exactly one incomplete {@link Versionstamp} behind
	 *  {@code prefix} and appends a trailer with the placeholder's position in the
	 *  returned array.
	 */
	static byte[] packWithVersionstamp(byte[] prefix, List<?> items, VersionstampOffsetFormat format) {
		int size = prefix.length + packedSize(items, false, 0) + format.getBytes();
		ByteBuffer dest = ByteBuffer.allocate(size);
		dest.put(prefix);
		TupleEncoder encoder = new TupleEncoder(dest, 0, Mode.VERSIONSTAMP);
		encoder.writeAll(items);
		if(encoder.placeholderPosition < 0) {
			throw new IllegalArgumentException("No incomplete Versionstamp included in tuple pack with versionstamp");
		}
		format.write(dest, encoder.placeholderPosition);
		LOGGER.trace("Versionstamp placeholder at offset {} of a {} byte key ({} trailer)",
				encoder.placeholderPosition, size, format);
		return dest.array();
	}

	private void writeAll(List<?> items) {
		for(Object item : items) {
			write(item, false);
		}
	}

	private void write(Object item, boolean nested) {
		switch(ElementType.of(item)) {
			case NULL:
				dest.put(NIL);
				if(nested) {
					dest.put(ESCAPE);
				}
				break;
			case BYTES:
				writeEscaped(BYTES_CODE, (byte[])item);
				break;
			case STRING:
				writeEscaped(STRING_CODE, Utf8.encode((String)item));
				break;
			case NESTED:
				dest.put(NESTED_CODE);
				for(Object inner : nestedItems(item)) {
					write(inner, true);
				}
				dest.put(NIL);
				break;
			case INTEGER:
				if(item instanceof BigInteger) {
					writeInteger((BigInteger)item);
				}
				else {
					writeInteger(((Number)item).longValue());
				}
				break;
			case FLOAT:
				dest.put(FLOAT_CODE).putInt(orderedBits((Float)item));
				break;
			case DOUBLE:
				dest.put(DOUBLE_CODE).putLong(orderedBits((Double)item));
				break;
			case BOOLEAN:
				dest.put((Boolean)item ? TRUE_CODE : FALSE_CODE);
				break;
			case UUID: {
				UUID uuid = (UUID)item;
				dest.put(UUID_CODE).putLong(uuid.getMostSignificantBits()).putLong(uuid.getLeastSignificantBits());
				break;
			}
			case VERSIONSTAMP:
				writeVersionstamp((Versionstamp)item);
				break;
			default:
				throw new IllegalArgumentException("Unsupported data type: " + item.getClass().getName());
		}
	}

	private void writeEscaped(byte code, byte[] bytes) {
		dest.put(code);
		for(byte b : bytes) {
			dest.put(b);
			if(b == NIL) {
				dest.put(ESCAPE);
			}
		}
		dest.put(NIL);
	}

	private void writeInteger(long value) {
		if(value == 0L) {
			dest.put((byte)INT_ZERO_CODE);
			return;
		}
		if(value == Long.MIN_VALUE) {
			writeInteger(BigInteger.valueOf(value));
			return;
		}
		long magnitude = Math.abs(value);
		int n = byteLength(magnitude);
		// Negative values store the complement of their magnitude so that larger magnitudes sort first.
		long body = value > 0 ? magnitude : ~magnitude;
		dest.put((byte)(value > 0 ? INT_ZERO_CODE + n : INT_ZERO_CODE - n));
		for(int shift = 8 * (n - 1); shift >= 0; shift -= 8) {
			dest.put((byte)(body >>> shift));
		}
	}

	private void writeInteger(BigInteger value) {
		int sign = value.signum();
		if(sign == 0) {
			dest.put((byte)INT_ZERO_CODE);
			return;
		}
		byte[] raw = value.abs().toByteArray();
		int skip = raw[0] == 0 ? 1 : 0;
		int n = raw.length - skip;
		if(n > MAX_INT_BYTES) {
			throw new IllegalArgumentException("BigInteger magnitude is too large (more than " + MAX_INT_BYTES + " bytes)");
		}
		if(n <= Long.BYTES) {
			dest.put((byte)(sign > 0 ? INT_ZERO_CODE + n : INT_ZERO_CODE - n));
		}
		else if(sign > 0) {
			dest.put((byte)ElementType.POS_INT_END).put((byte)n);
		}
		else {
			dest.put((byte)ElementType.NEG_INT_START).put((byte)(n ^ 0xff));
		}
		int flip = sign > 0 ? 0x00 : 0xff;
		for(int i = skip; i < raw.length; i++) {
			dest.put((byte)(raw[i] ^ flip));
		}
	}

	private void writeVersionstamp(Versionstamp stamp) {
		dest.put(VERSIONSTAMP_CODE);
		if(!stamp.isComplete()) {
			if(mode == Mode.PLAIN) {
				throw new IllegalArgumentException("Incomplete Versionstamp included in vanilla tuple pack");
			}
			if(placeholderPosition >= 0 && mode == Mode.VERSIONSTAMP) {
				throw new IllegalArgumentException("Multiple incomplete Versionstamps included in Tuple");
			}
			if(placeholderPosition < 0) {
				placeholderPosition = dest.position() - origin;
			}
		}
		stamp.writeTo(dest);
	}

	static List<?> nestedItems(Object nested) {
		return nested instanceof Tuple ? ((Tuple)nested).elements : (List<?>)nested;
	}

	// Flip every bit of a negative number and only the sign bit of a positive one, so that
	// unsigned comparison of the result follows numeric order. -0.0 counts as negative.
	static int orderedBits(float f) {
		int bits = Float.floatToRawIntBits(f);
		return bits ^ ((bits >> 31) | Integer.MIN_VALUE);
	}

	static long orderedBits(double d) {
		long bits = Double.doubleToRawLongBits(d);
		return bits ^ ((bits >> 63) | Long.MIN_VALUE);
	}

	static int byteLength(long magnitude) {
		return (Long.SIZE - Long.numberOfLeadingZeros(magnitude) + 7) / 8;
	}

	/**
	 * Computes how many bytes {@code items} pack into, adding {@code trailerBytes}
	 *  for each incomplete {@link Versionstamp}.
	 */
	static int packedSize(List<?> items, boolean nested, int trailerBytes) {
		int size = 0;
		for(Object item : items) {
			size += packedSize(item, nested, trailerBytes);
		}
		return size;
	}

	private static int packedSize(Object item, boolean nested, int trailerBytes) {
		switch(ElementType.of(item)) {
			case NULL:
				return nested ? 2 : 1;
			case BYTES: {
				byte[] bytes = (byte[])item;
				int size = 2 + bytes.length;
				for(byte b : bytes) {
					if(b == NIL) {
						size++;
					}
				}
				return size;
			}
			case STRING:
				return 2 + Utf8.escapedLength((String)item);
			case NESTED:
				return 2 + packedSize(nestedItems(item), true, trailerBytes);
			case INTEGER:
				return integerSize(item);
			case FLOAT:
				return 1 + Float.BYTES;
			case DOUBLE:
				return 1 + Double.BYTES;
			case BOOLEAN:
				return 1;
			case UUID:
				return 1 + UUID_BYTES;
			case VERSIONSTAMP:
				return 1 + Versionstamp.LENGTH + (((Versionstamp)item).isComplete() ? 0 : trailerBytes);
			default:
				throw new IllegalArgumentException("Unsupported data type: " + item.getClass().getName());
		}
	}

	private static int integerSize(Object item) {
		int n;
		if(item instanceof BigInteger) {
			n = (((BigInteger)item).abs().bitLength() + 7) / 8;
		}
		else {
			long value = ((Number)item).longValue();
			n = value == Long.MIN_VALUE ? Long.BYTES : byteLength(Math.abs(value));
		}
		// zero is the bare type code; magnitudes beyond a long also carry a length byte
		return n <= Long.BYTES ? 1 + n : 2 + n;
	}
}
