/*
 * ElementComparator.java
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
import java.util.Comparator;
import java.util.Iterator;
import java.util.UUID;

/**
 * Orders tuple elements the way their packed forms sort, without packing them.
 *  Elements of different kinds sort by {@link ElementType}; nested tuples and lists
 *  compare element by element, a shorter sequence sorting before any longer one it
 *  is a prefix of.
 */
final class ElementComparator implements Comparator<Object> {
	static final ElementComparator INSTANCE = new ElementComparator();

	private ElementComparator() {}

	@Override
	public int compare(Object a, Object b) {
		if(a == b) {
			return 0;
		}
		ElementType type = ElementType.of(a);
		int cmp = type.compareTo(ElementType.of(b));
		if(cmp != 0) {
			return cmp;
		}
		switch(type) {
			case NULL:
				return 0;
			case BYTES:
				return ByteArrayUtil.compareUnsigned((byte[])a, (byte[])b);
			case STRING:
				return Utf8.compare((String)a, (String)b);
			case NESTED:
				return compareSequences(TupleEncoder.nestedItems(a), TupleEncoder.nestedItems(b));
			case INTEGER:
				if(a instanceof BigInteger || b instanceof BigInteger) {
					return bigInteger(a).compareTo(bigInteger(b));
				}
				return Long.compare(((Number)a).longValue(), ((Number)b).longValue());
			case FLOAT:
				return Integer.compareUnsigned(TupleEncoder.orderedBits((Float)a), TupleEncoder.orderedBits((Float)b));
			case DOUBLE:
				return Long.compareUnsigned(TupleEncoder.orderedBits((Double)a), TupleEncoder.orderedBits((Double)b));
			case BOOLEAN:
				return Boolean.compare((Boolean)a, (Boolean)b);
			case UUID: {
				// UUID.compareTo is signed
				UUID u1 = (UUID)a;
				UUID u2 = (UUID)b;
				cmp = Long.compareUnsigned(u1.getMostSignificantBits(), u2.getMostSignificantBits());
				return cmp != 0 ? cmp : Long.compareUnsigned(u1.getLeastSignificantBits(), u2.getLeastSignificantBits());
			}
			case VERSIONSTAMP:
				return ((Versionstamp)a).compareTo((Versionstamp)b);
			default:
				throw new IllegalArgumentException("Unsupported data type: " + a.getClass().getName());
		}
	}

	int compareSequences(Iterable<?> a, Iterable<?> b) {
		Iterator<?> left = a.iterator();
		Iterator<?> right = b.iterator();
		while(left.hasNext() && right.hasNext()) {
			int cmp = compare(left.next(), right.next());
			if(cmp != 0) {
				return cmp;
			}
		}
		return Boolean.compare(left.hasNext(), right.hasNext());
	}

	private static BigInteger bigInteger(Object o) {
		return o instanceof BigInteger ? (BigInteger)o : BigInteger.valueOf(((Number)o).longValue());
	}
}
