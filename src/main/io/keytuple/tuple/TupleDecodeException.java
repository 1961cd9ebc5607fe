/*
 * TupleDecodeException.java
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
 * Thrown when a byte array does not hold a valid packed {@link Tuple}. Decoding
 *  stops at the first problem; no partially decoded {@code Tuple} is ever returned.
 *  This extends {@link IllegalArgumentException}, which is what the rest of the
 *  tuple layer raises for bad input, so callers that only care that the input was
 *  rejected need not catch it separately.
 */
public class TupleDecodeException extends IllegalArgumentException {
	private static final long serialVersionUID = 3187467710418436302L;

	/**
	 * Why a packed representation was rejected.
	 */
	public enum Reason {
		/** The input ended in the middle of an element. */
		TRUNCATED,
		/** An element started with a byte that is not a type code. */
		UNKNOWN_TAG,
		/** A nested tuple was not closed by its terminator. */
		INVALID_NESTED_TUPLE,
		/** A string element was not valid UTF-8 once its escapes were removed. */
		INVALID_UTF8
	}

	private final Reason reason;
	private final int position;

	TupleDecodeException(Reason reason, int position, String message) {
		this(reason, position, message, null);
	}

	TupleDecodeException(Reason reason, int position, String message, Throwable cause) {
		super(message, cause);
		this.reason = reason;
		this.position = position;
	}

	/**
	 * Gets the kind of problem found in the input.
	 *
	 * @return the reason decoding failed
	 */
	public Reason getReason() {
		return reason;
	}

	/**
	 * Gets the index, within the decoded array, of the element that could not be decoded.
	 *
	 * @return byte position at which decoding failed
	 */
	public int getPosition() {
		return position;
	}
}
