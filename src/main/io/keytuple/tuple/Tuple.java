/*
 * Tuple.java
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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import io.keytuple.Range;

/**
 * An ordered, immutable sequence of typed elements that packs into a byte array
 *  whose unsigned order matches the order of the elements. {@code Tuple}s compare,
 *  hash and test equal by that order, so two {@code Tuple}s are equal exactly when
 *  they pack to the same bytes.
 *
 * <p>
 * Elements may be any of the kinds listed in {@link ElementType}: {@code null},
 *  {@code byte[]}, {@link String}, a nested {@code Tuple} or {@link List}, an integral
 *  {@link Number} ({@link BigInteger}s of up to 255 bytes included), {@link Float},
 *  {@link Double}, {@link Boolean}, {@link UUID} or {@link Versionstamp}. Byte arrays
 *  and lists are copied on the way in and on the way out, so callers cannot change a
 *  {@code Tuple} after it has been built. Unsupported values are rejected when they
 *  are added.
 * </p>
 *
 * <pre>
 * <code>
 *  byte[] key = Tuple.from("users", 42L).pack();
 *  Tuple t = Tuple.fromBytes(key);
 *  long id = t.getLong(1);
 * </code>
 * </pre>
 *
 * Decoding goes through {@link #fromBytes(byte[])}. Integers come back as {@link Long}
 *  when they fit and as {@link BigInteger} otherwise, nested tuples as {@link List}s,
 *  and malformed input raises a {@link TupleDecodeException}.
 */
public class Tuple implements Comparable<Tuple>, Iterable<Object> {
	private static final byte[] EMPTY_BYTES = new byte[0];

	final List<Object> elements;
	private final boolean incompleteVersionstamp;
	private byte[] packed;
	private int memoizedPackedSize = -1;
	private int memoizedHash;

	private Tuple(List<Object> elements, boolean incompleteVersionstamp) {
		this.elements = elements;
		this.incompleteVersionstamp = incompleteVersionstamp;
	}

	/**
	 * Creates an empty {@code Tuple}. Elements are added with the {@code add} methods,
	 *  each of which returns a new {@code Tuple}.
	 *
	 * @see #from(Object...)
	 */
	public Tuple() {
		this(new ArrayList<>(), false);
	}

	private static Tuple of(List<Object> normalized) {
		return new Tuple(normalized, containsIncomplete(normalized));
	}

	private static List<Object> normalizeAll(Iterable<?> items) {
		List<Object> normalized = new ArrayList<>();
		for(Object item : items) {
			normalized.add(normalize(item));
		}
		return normalized;
	}

	// Validates an element and takes a private copy of anything mutable.
	private static Object normalize(Object item) {
		switch(ElementType.of(item)) {
			case BYTES:
				return ((byte[])item).clone();
			case STRING:
				Utf8.validate((String)item);
				return item;
			case NESTED:
				return item instanceof Tuple ? item : normalizeAll((List<?>)item);
			default:
				return item;
		}
	}

	// Copies mutable elements on the way out.
	private static Object expose(Object item) {
		if(item instanceof byte[]) {
			return ((byte[])item).clone();
		}
		if(item instanceof List<?>) {
			List<Object> copy = new ArrayList<>();
			for(Object inner : (List<?>)item) {
				copy.add(expose(inner));
			}
			return copy;
		}
		return item;
	}

	private static boolean containsIncomplete(Iterable<?> items) {
		for(Object item : items) {
			if(item instanceof Versionstamp && !((Versionstamp)item).isComplete()) {
				return true;
			}
			if(item instanceof Tuple && ((Tuple)item).incompleteVersionstamp) {
				return true;
			}
			if(item instanceof List<?> && containsIncomplete((List<?>)item)) {
				return true;
			}
		}
		return false;
	}

	private Tuple append(Object normalized) {
		List<Object> grown = new ArrayList<>(elements.size() + 1);
		grown.addAll(elements);
		grown.add(normalized);
		return new Tuple(grown, incompleteVersionstamp || containsIncomplete(Collections.singletonList(normalized)));
	}

	/**
	 * Creates a copy of this {@code Tuple} with an object appended as the last element.
	 *
	 * @param o the object to append, of a kind listed in {@link ElementType}
	 * @return a new {@code Tuple}
	 * @throws IllegalArgumentException if {@code o} cannot be stored in a {@code Tuple}
	 */
	public Tuple addObject(Object o) {
		return append(normalize(o));
	}

	public Tuple add(String s) {
		return addObject(s);
	}

	public Tuple add(long l) {
		return append(l);
	}

	public Tuple add(byte[] b) {
		return addObject(b);
	}

	/**
	 * Creates a copy of this {@code Tuple} with part of a byte array appended.
	 *
	 * @param b the source array
	 * @param offset first byte to take
	 * @param length number of bytes to take
	 * @return a new {@code Tuple}
	 */
	public Tuple add(byte[] b, int offset, int length) {
		return append(Arrays.copyOfRange(b, offset, offset + length));
	}

	public Tuple add(boolean b) {
		return append(b);
	}

	public Tuple add(UUID uuid) {
		return addObject(uuid);
	}

	/**
	 * Creates a copy of this {@code Tuple} with a {@link BigInteger} appended.
	 *
	 * @param bi the integer to append, not {@code null}
	 * @return a new {@code Tuple}
	 * @throws NullPointerException if {@code bi} is {@code null}
	 */
	public Tuple add(BigInteger bi) {
		if(bi == null) {
			throw new NullPointerException("Number types in Tuple cannot be null");
		}
		return append(bi);
	}

	public Tuple add(float f) {
		return append(f);
	}

	public Tuple add(double d) {
		return append(d);
	}

	public Tuple add(Versionstamp v) {
		return addObject(v);
	}

	public Tuple add(List<?> l) {
		return addObject(l);
	}

	public Tuple add(Tuple t) {
		return addObject(t);
	}

	/**
	 * Creates a copy of this {@code Tuple} with every element of a list appended.
	 *
	 * @param o the elements to append
	 * @return a new {@code Tuple}
	 * @throws IllegalArgumentException if an element cannot be stored in a {@code Tuple}
	 */
	public Tuple addAll(List<?> o) {
		List<Object> grown = new ArrayList<>(elements);
		grown.addAll(normalizeAll(o));
		return of(grown);
	}

	public Tuple addAll(Tuple other) {
		List<Object> grown = new ArrayList<>(elements);
		grown.addAll(other.elements);
		return new Tuple(grown, incompleteVersionstamp || other.incompleteVersionstamp);
	}

	/**
	 * Packs this {@code Tuple}. The result is memoized, and each call returns a fresh copy.
	 *
	 * @return the packed form
	 * @throws IllegalArgumentException if this {@code Tuple} holds an incomplete
	 *  {@link Versionstamp}, or an integer of more than 255 bytes
	 */
	public byte[] pack() {
		return packed().clone();
	}

	/**
	 * Packs this {@code Tuple} behind a prefix.
	 *
	 * @param prefix bytes to put in front of the packed form, possibly {@code null}
	 * @return {@code prefix} followed by the packed form
	 */
	public byte[] pack(byte[] prefix) {
		return ByteArrayUtil.join(prefix, packed());
	}

	private byte[] packed() {
		if(incompleteVersionstamp) {
			throw new IllegalArgumentException("Incomplete Versionstamp included in vanilla tuple pack");
		}
		if(packed == null) {
			packed = TupleEncoder.pack(elements, getPackedSize());
		}
		return packed;
	}

	/**
	 * Packs this {@code Tuple} at the position of {@code dest}. The caller has to leave
	 *  room for {@link #getPackedSize()} bytes. The buffer's byte order is left as found.
	 *
	 * @param dest the buffer to write to
	 * @throws java.nio.BufferOverflowException if {@code dest} is too small
	 * @throws IllegalArgumentException if this {@code Tuple} holds an incomplete {@link Versionstamp}
	 */
	public void packInto(ByteBuffer dest) {
		if(incompleteVersionstamp) {
			throw new IllegalArgumentException("Incomplete Versionstamp included in vanilla tuple pack");
		}
		if(packed != null) {
			dest.put(packed);
		}
		else {
			TupleEncoder.packInto(dest, elements);
		}
	}

	/**
	 * Packs this {@code Tuple} for a versionstamped-key mutation. The {@code Tuple} must
	 *  hold exactly one incomplete {@link Versionstamp}, anywhere in it. The result ends
	 *  in a two-byte little-endian trailer giving the position of the ten placeholder
	 *  bytes, which the database overwrites when the transaction commits.
	 *
	 * @return the packed form followed by the trailer
	 * @throws IllegalArgumentException if there is not exactly one incomplete {@link Versionstamp}
	 */
	public byte[] packWithVersionstamp() {
		return packWithVersionstamp(null, VersionstampOffsetFormat.SHORT);
	}

	/**
	 * Packs this {@code Tuple} behind a prefix for a versionstamped-key mutation. The
	 *  two-byte trailer counts the prefix.
	 *
	 * @param prefix bytes to put in front of the packed form, possibly {@code null}
	 * @return {@code prefix}, the packed form, and the trailer
	 * @see #packWithVersionstamp()
	 */
	public byte[] packWithVersionstamp(byte[] prefix) {
		return packWithVersionstamp(prefix, VersionstampOffsetFormat.SHORT);
	}

	/**
	 * Packs this {@code Tuple} behind a prefix for a versionstamped-key mutation with
	 *  the given trailer layout.
	 *
	 * @param prefix bytes to put in front of the packed form, possibly {@code null}
	 * @param format layout of the trailer
	 * @return {@code prefix}, the packed form, and the trailer
	 * @throws IllegalArgumentException if there is not exactly one incomplete
	 *  {@link Versionstamp}, or if its position does not fit {@code format}
	 */
	public byte[] packWithVersionstamp(byte[] prefix, VersionstampOffsetFormat format) {
		if(!incompleteVersionstamp) {
			throw new IllegalArgumentException("No incomplete Versionstamp included in tuple pack with versionstamp");
		}
		return TupleEncoder.packWithVersionstamp(prefix == null ? EMPTY_BYTES : prefix, elements, format);
	}

	/**
	 * Decodes a packed {@code Tuple}.
	 *
	 * @param bytes a packed {@code Tuple}
	 * @return the decoded {@code Tuple}
	 * @throws TupleDecodeException if {@code bytes} is not a valid packed {@code Tuple}
	 */
	public static Tuple fromBytes(byte[] bytes) {
		return fromBytes(bytes, 0, bytes.length);
	}

	/**
	 * Decodes a packed {@code Tuple} stored in part of an array. Positions reported by a
	 *  {@link TupleDecodeException} are indices into {@code bytes}.
	 *
	 * @param bytes array holding the packed {@code Tuple}
	 * @param offset index of the first packed byte
	 * @param length number of packed bytes
	 * @return the decoded {@code Tuple}
	 * @throws IllegalArgumentException if {@code offset} and {@code length} do not lie within {@code bytes}
	 * @throws TupleDecodeException if the bytes are not a valid packed {@code Tuple}
	 */
	public static Tuple fromBytes(byte[] bytes, int offset, int length) {
		if(offset < 0 || offset > bytes.length) {
			throw new IllegalArgumentException("Invalid offset for Tuple deserialization");
		}
		if(length < 0 || offset + length > bytes.length) {
			throw new IllegalArgumentException("Invalid length for Tuple deserialization");
		}
		Tuple t = of(TupleDecoder.unpack(bytes, offset, length));
		if(!t.incompleteVersionstamp) {
			t.packed = Arrays.copyOfRange(bytes, offset, offset + length);
			t.memoizedPackedSize = length;
		}
		return t;
	}

	public int size() {
		return elements.size();
	}

	public boolean isEmpty() {
		return elements.isEmpty();
	}

	/**
	 * Gets the elements of this {@code Tuple}. Byte arrays and nested lists are copies.
	 *
	 * @return a new, modifiable list of the elements
	 */
	public List<Object> getItems() {
		List<Object> items = new ArrayList<>(elements.size());
		for(Object item : elements) {
			items.add(expose(item));
		}
		return items;
	}

	public Stream<Object> stream() {
		return elements.stream().map(Tuple::expose);
	}

	/**
	 * Iterates over the elements. The iterator does not support {@link Iterator#remove()}.
	 *
	 * @return an unmodifiable iterator
	 */
	@Override
	public Iterator<Object> iterator() {
		return Collections.unmodifiableList(getItems()).iterator();
	}

	/**
	 * Gets an element without converting it.
	 *
	 * @param index position of the element
	 * @return the element, a copy if it is a byte array or list
	 */
	public Object get(int index) {
		return expose(elements.get(index));
	}

	private Number number(int index) {
		Object o = elements.get(index);
		if(o == null) {
			throw new NullPointerException("Number types in Tuples may not be null");
		}
		return (Number)o;
	}

	/**
	 * Gets an integral element as a {@code long}.
	 *
	 * @param index position of the element
	 * @return the element's value
	 * @throws ClassCastException if the element is not a number
	 * @throws NullPointerException if the element is {@code null}
	 */
	public long getLong(int index) {
		return number(index).longValue();
	}

	public BigInteger getBigInteger(int index) {
		Number n = number(index);
		return n instanceof BigInteger ? (BigInteger)n : BigInteger.valueOf(n.longValue());
	}

	public float getFloat(int index) {
		return number(index).floatValue();
	}

	public double getDouble(int index) {
		return number(index).doubleValue();
	}

	public boolean getBoolean(int index) {
		Object o = elements.get(index);
		if(o == null) {
			throw new NullPointerException("Boolean type in Tuples may not be null");
		}
		return (Boolean)o;
	}

	/**
	 * Gets a byte-string element.
	 *
	 * @param index position of the element
	 * @return a copy of the element, or {@code null}
	 * @throws ClassCastException if the element is not a byte array
	 */
	public byte[] getBytes(int index) {
		Object o = elements.get(index);
		return o == null ? null : ((byte[])o).clone();
	}

	public String getString(int index) {
		return (String)elements.get(index);
	}

	public UUID getUUID(int index) {
		return (UUID)elements.get(index);
	}

	public Versionstamp getVersionstamp(int index) {
		return (Versionstamp)elements.get(index);
	}

	/**
	 * Gets a nested element as a list. Nested {@code Tuple}s are converted.
	 *
	 * @param index position of the element
	 * @return a new list holding the nested elements, or {@code null}
	 * @throws ClassCastException if the element is not nested
	 */
	public List<Object> getNestedList(int index) {
		Object o = elements.get(index);
		if(o == null) {
			return null;
		}
		if(o instanceof Tuple) {
			return ((Tuple)o).getItems();
		}
		if(o instanceof List<?>) {
			@SuppressWarnings("unchecked")
			List<Object> copy = (List<Object>)expose(o);
			return copy;
		}
		throw new ClassCastException("Cannot convert item of type " + o.getClass() + " to list");
	}

	public Tuple getNestedTuple(int index) {
		Object o = elements.get(index);
		if(o == null) {
			return null;
		}
		if(o instanceof Tuple) {
			return (Tuple)o;
		}
		if(o instanceof List<?>) {
			@SuppressWarnings("unchecked")
			List<Object> nested = (List<Object>)o;
			return of(new ArrayList<>(nested));
		}
		throw new ClassCastException("Cannot convert item of type " + o.getClass() + " to tuple");
	}

	/**
	 * Creates a {@code Tuple} without the first element of this one.
	 *
	 * @return a new {@code Tuple}
	 * @throws IllegalStateException if this {@code Tuple} is empty
	 */
	public Tuple popFront() {
		if(elements.isEmpty()) {
			throw new IllegalStateException("Tuple contains no elements");
		}
		return of(new ArrayList<>(elements.subList(1, elements.size())));
	}

	/**
	 * Creates a {@code Tuple} without the last element of this one.
	 *
	 * @return a new {@code Tuple}
	 * @throws IllegalStateException if this {@code Tuple} is empty
	 */
	public Tuple popBack() {
		if(elements.isEmpty()) {
			throw new IllegalStateException("Tuple contains no elements");
		}
		return of(new ArrayList<>(elements.subList(0, elements.size() - 1)));
	}

	/**
	 * Gets the range of keys that pack a {@code Tuple} strictly extending this one.
	 *  For {@code ("a", "b")} that is every key packing {@code ("a", "b", ...)}.
	 *
	 * @return {@code pack() + 0x00} up to {@code pack() + 0xff}
	 * @throws IllegalStateException if this {@code Tuple} holds an incomplete {@link Versionstamp}
	 */
	public Range range() {
		return range(null);
	}

	public Range range(byte[] prefix) {
		if(incompleteVersionstamp) {
			throw new IllegalStateException("Tuple with incomplete versionstamp used for range");
		}
		byte[] start = pack(prefix);
		return new Range(ByteArrayUtil.join(start, new byte[] { 0x00 }), ByteArrayUtil.join(start, new byte[] { (byte)0xff }));
	}

	/**
	 * Whether an incomplete {@link Versionstamp} appears anywhere in this {@code Tuple},
	 *  nested elements included.
	 *
	 * @return {@code true} if this {@code Tuple} can only be packed with a versionstamp trailer
	 */
	public boolean hasIncompleteVersionstamp() {
		return incompleteVersionstamp;
	}

	/**
	 * Gets the packed length of this {@code Tuple} without packing it. With an incomplete
	 *  {@link Versionstamp} this is the length {@link #packWithVersionstamp()} produces,
	 *  two-byte trailer included.
	 *
	 * @return the number of packed bytes
	 */
	public int getPackedSize() {
		if(memoizedPackedSize < 0) {
			memoizedPackedSize = TupleEncoder.packedSize(elements, false, VersionstampOffsetFormat.SHORT.getBytes());
		}
		return memoizedPackedSize;
	}

	/**
	 * Compares the packed forms of two {@code Tuple}s as unsigned bytes. The elements are
	 *  compared directly unless both packed forms are already known.
	 *
	 * @param t the {@code Tuple} to compare with
	 * @return a negative number, zero, or a positive number as this {@code Tuple} sorts
	 *  before, with, or after {@code t}
	 */
	@Override
	public int compareTo(Tuple t) {
		if(packed != null && t.packed != null) {
			return ByteArrayUtil.compareUnsigned(packed, t.packed);
		}
		return ElementComparator.INSTANCE.compareSequences(elements, t.elements);
	}

	/**
	 * Hashes the packed form. Incomplete {@link Versionstamp}s hash by their
	 *  placeholder bytes, so any {@code Tuple} can be hashed.
	 *
	 * @return a hash consistent with {@link #equals(Object)}
	 */
	@Override
	public int hashCode() {
		if(memoizedHash == 0) {
			memoizedHash = Arrays.hashCode(incompleteVersionstamp ? TupleEncoder.packLeniently(elements) : packed());
		}
		return memoizedHash;
	}

	@Override
	public boolean equals(Object o) {
		if(o == this) {
			return true;
		}
		return o instanceof Tuple && compareTo((Tuple)o) == 0;
	}

	/**
	 * Renders the elements in parentheses. Strings are quoted and byte arrays are shown
	 *  with {@link ByteArrayUtil#printable(byte[])}.
	 *
	 * @return a human-readable form of this {@code Tuple}
	 */
	@Override
	public String toString() {
		return elements.stream().map(Tuple::render).collect(Collectors.joining(", ", "(", ")"));
	}

	private static String render(Object item) {
		if(item instanceof String) {
			return "\"" + item + "\"";
		}
		if(item instanceof byte[]) {
			return "b\"" + ByteArrayUtil.printable((byte[])item) + "\"";
		}
		if(item instanceof List<?>) {
			return ((List<?>)item).stream().map(Tuple::render).collect(Collectors.joining(", ", "(", ")"));
		}
		return String.valueOf(item);
	}

	/**
	 * Creates a {@code Tuple} from any iterable source of elements.
	 *
	 * @param items the elements
	 * @return a new {@code Tuple}
	 * @throws IllegalArgumentException if an element cannot be stored in a {@code Tuple}
	 */
	public static Tuple fromItems(Iterable<?> items) {
		return of(normalizeAll(items));
	}

	public static Tuple fromList(List<?> items) {
		return fromItems(items);
	}

	public static Tuple fromStream(Stream<?> items) {
		return fromItems(items.collect(Collectors.toList()));
	}

	/**
	 * Creates a {@code Tuple} from a variable number of elements.
	 *
	 * @param items the elements, of the kinds listed in {@link ElementType}
	 * @return a new {@code Tuple}
	 * @throws IllegalArgumentException if an element cannot be stored in a {@code Tuple}
	 */
	public static Tuple from(Object... items) {
		return fromItems(Arrays.asList(items));
	}
}
