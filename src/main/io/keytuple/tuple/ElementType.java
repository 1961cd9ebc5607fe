/*
 * ElementType.java
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
import java.util.List;

/**
 * The closed set of element kinds a {@link Tuple} can hold. Each constant carries the
 *  type code that starts its packed representation, and the constants are declared
 *  in the order of those codes, which is also the order in which elements of different
 *  kinds sort against each other. Integers own the whole range of codes from
 *  {@code 0x0b} to {@code 0x1d}; {@link #getCode()} reports the code used for zero.
 *  Both booleans share the {@link #BOOLEAN} kind, and complete and incomplete
 *  {@link Versionstamp}s share the {@link #VERSIONSTAMP} kind.
 */
public enum ElementType {
	NULL(0x00),
	BYTES(0x01),
	STRING(0x02),
	NESTED(0x05),
	INTEGER(0x14),
	FLOAT(0x20),
	DOUBLE(0x21),
	BOOLEAN(0x26),
	UUID(0x30),
	VERSIONSTAMP(0x33);

	static final int NEG_INT_START = 0x0b;
	static final int POS_INT_END = 0x1d;
	static final int TRUE_CODE = 0x27;

	private final int code;

	ElementType(int code) {
		this.code = code;
	}

	/**
	 * Gets the type code of this kind of element. For {@link #INTEGER} this is the
	 *  code of zero, and for {@link #BOOLEAN} it is the code of {@code false}.
	 *
	 * @return the leading byte of the packed representation, as an unsigned value
	 */
	public int getCode() {
		return code;
	}

	/**
	 * Classifies a Java object as one of the tuple element kinds. {@link Long},
	 *  {@link Integer}, {@link Short}, {@link Byte} and {@link BigInteger} are integers;
	 *  other {@link Number} classes are rejected rather than truncated.
	 *  {@link List}s and {@link Tuple}s are both nested tuples.
	 *
	 * @param o the object to classify, possibly {@code null}
	 * @return the element kind of {@code o}
	 * @throws IllegalArgumentException if {@code o} cannot be stored in a {@link Tuple}
	 */
	public static ElementType of(Object o) {
		if(o == null)
			return NULL;
		if(o instanceof byte[])
			return BYTES;
		if(o instanceof String)
			return STRING;
		if(o instanceof Float)
			return FLOAT;
		if(o instanceof Double)
			return DOUBLE;
		if(o instanceof Boolean)
			return BOOLEAN;
		if(o instanceof java.util.UUID)
			return UUID;
		if(o instanceof Long || o instanceof Integer || o instanceof Short || o instanceof Byte || o instanceof BigInteger)
			return INTEGER;
		if(o instanceof Versionstamp)
			return VERSIONSTAMP;
		if(o instanceof List<?> || o instanceof Tuple)
			return NESTED;
		throw new IllegalArgumentException("Unsupported data type: " + o.getClass().getName());
	}

	/**
	 * Looks up the element kind introduced by a type code.
	 *
	 * @param code the leading byte of a packed element, as an unsigned value
	 * @return the matching element kind, or {@code null} if {@code code} is not a type code
	 */
	public static ElementType forCode(int code) {
		if(code >= NEG_INT_START && code <= POS_INT_END) {
			return INTEGER;
		}
		if(code == TRUE_CODE) {
			return BOOLEAN;
		}
		for(ElementType type : values()) {
			if(type.code == code) {
				return type;
			}
		}
		return null;
	}
}
