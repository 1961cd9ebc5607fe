/*
 * Versionstamp.java
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

/**
 * A twelve-byte commit identifier as stored in a {@link Tuple}. The first ten bytes
 *  are the global version the database hands out at commit time (an eight-byte
 *  transaction version and a two-byte batch number) and the last two are a user
 *  version that orders writes made by the same transaction. All three parts are
 *  big-endian and unsigned.
 *
 * <p>
 * Before commit the global version is unknown. Such a {@code Versionstamp} is
 *  <i>incomplete</i>: it packs as ten {@code 0xff} bytes followed by the user version,
 *  and the database fills in the real value when the key is written through
 *  {@link Tuple#packWithVersionstamp()}. Because that placeholder is what marks a
 *  stamp as incomplete, a <i>complete</i> {@code Versionstamp} can never carry a
 *  global version made only of {@code 0xff} bytes.
 * </p>
 *
 * <pre>
 * <code>
 *  byte[] key = Tuple.from("events", Versionstamp.incomplete(0)).packWithVersionstamp();
 *  // ... after commit, reading the key back
 *  Versionstamp v = Tuple.fromBytes(storedKey).getVersionstamp(1);
 *  long commitVersion = v.getTransactionVersion();
 * </code>
 * </pre>
 */
public class Versionstamp implements Comparable<Versionstamp> {
	/**
	 * Length of a packed {@code Versionstamp}, without its type code.
	 */
	public static final int LENGTH = 12;

	/**
	 * Length of the database-assigned part: transaction version and batch number.
	 */
	public static final int GLOBAL_VERSION_LENGTH = 10;

	private static final long UNSET_TRANSACTION_VERSION = -1L;
	private static final int UNSET_BATCH_NUMBER = 0xffff;

	private final boolean complete;
	private final long transactionVersion;
	private final int batchNumber;
	private final int userVersion;

	private Versionstamp(boolean complete, long transactionVersion, int batchNumber, int userVersion) {
		this.complete = complete;
		this.transactionVersion = transactionVersion;
		this.batchNumber = batchNumber;
		this.userVersion = userVersion;
	}

	/**
	 * Reads a big-endian unsigned short, the way user versions are packed.
	 *
	 * @param bytes array holding the user version
	 * @param pos index of its first byte
	 * @return the user version found at {@code pos}
	 */
	public static int unpackUserVersion(byte[] bytes, int pos) {
		return ((bytes[pos] & 0xff) << 8) | (bytes[pos + 1] & 0xff);
	}

	/**
	 * Rebuilds a {@code Versionstamp} from its twelve packed bytes. The result is
	 *  incomplete exactly when the first ten bytes are the {@code 0xff} placeholder.
	 *
	 * @param versionBytes twelve packed bytes
	 * @return the {@code Versionstamp} they describe
	 * @throws IllegalArgumentException if {@code versionBytes} is not twelve bytes long
	 */
	public static Versionstamp fromBytes(byte[] versionBytes) {
		if(versionBytes.length != LENGTH) {
			throw new IllegalArgumentException("Versionstamp bytes must have length " + LENGTH);
		}
		return read(ByteBuffer.wrap(versionBytes));
	}

	static Versionstamp read(ByteBuffer src) {
		long transactionVersion = src.getLong();
		int batchNumber = src.getShort() & 0xffff;
		int userVersion = src.getShort() & 0xffff;
		if(isPlaceholder(transactionVersion, batchNumber)) {
			return new Versionstamp(false, UNSET_TRANSACTION_VERSION, UNSET_BATCH_NUMBER, userVersion);
		}
		return new Versionstamp(true, transactionVersion, batchNumber, userVersion);
	}

	/**
	 * Creates a placeholder whose global version is assigned when the transaction
	 *  that writes it commits.
	 *
	 * @param userVersion order of the write within its transaction, an unsigned short
	 * @return an incomplete {@code Versionstamp}
	 */
	public static Versionstamp incomplete(int userVersion) {
		checkUnsignedShort(userVersion, "User version");
		return new Versionstamp(false, UNSET_TRANSACTION_VERSION, UNSET_BATCH_NUMBER, userVersion);
	}

	public static Versionstamp incomplete() {
		return incomplete(0);
	}

	/**
	 * Creates a complete {@code Versionstamp} from its three parts. The transaction
	 *  version is read as an unsigned 64-bit value.
	 *
	 * @param transactionVersion commit version of the writing transaction
	 * @param batchNumber position of the transaction in its commit batch, an unsigned short
	 * @param userVersion order of the write within its transaction, an unsigned short
	 * @return a complete {@code Versionstamp}
	 * @throws IllegalArgumentException if a short part is out of range, or if the
	 *  global version is the all-{@code 0xff} placeholder
	 */
	public static Versionstamp complete(long transactionVersion, int batchNumber, int userVersion) {
		checkUnsignedShort(batchNumber, "Batch number");
		checkUnsignedShort(userVersion, "User version");
		if(isPlaceholder(transactionVersion, batchNumber)) {
			throw new IllegalArgumentException("Global version of a complete Versionstamp cannot be the incomplete placeholder");
		}
		return new Versionstamp(true, transactionVersion, batchNumber, userVersion);
	}

	/**
	 * Creates a complete {@code Versionstamp} from a ten-byte global version.
	 *
	 * @param globalVersion transaction version followed by batch number
	 * @param userVersion order of the write within its transaction, an unsigned short
	 * @return a complete {@code Versionstamp}
	 * @throws IllegalArgumentException if {@code globalVersion} is not ten bytes or is
	 *  the all-{@code 0xff} placeholder
	 */
	public static Versionstamp complete(byte[] globalVersion, int userVersion) {
		if(globalVersion.length != GLOBAL_VERSION_LENGTH) {
			throw new IllegalArgumentException("Global version has invalid length " + globalVersion.length);
		}
		ByteBuffer src = ByteBuffer.wrap(globalVersion);
		return complete(src.getLong(), src.getShort() & 0xffff, userVersion);
	}

	public static Versionstamp complete(byte[] globalVersion) {
		return complete(globalVersion, 0);
	}

	private static boolean isPlaceholder(long transactionVersion, int batchNumber) {
		return transactionVersion == UNSET_TRANSACTION_VERSION && batchNumber == UNSET_BATCH_NUMBER;
	}

	private static void checkUnsignedShort(int value, String name) {
		if(value < 0 || value > 0xffff) {
			throw new IllegalArgumentException(name + " must fit in unsigned short");
		}
	}

	public boolean isComplete() {
		return complete;
	}

	/**
	 * Packs this {@code Versionstamp} into a new twelve-byte array. Incomplete
	 *  stamps start with the ten placeholder bytes.
	 *
	 * @return a fresh copy of the packed bytes
	 */
	public byte[] getBytes() {
		ByteBuffer dest = ByteBuffer.allocate(LENGTH);
		writeTo(dest);
		return dest.array();
	}

	void writeTo(ByteBuffer dest) {
		dest.putLong(transactionVersion).putShort((short)batchNumber).putShort((short)userVersion);
	}

	/**
	 * Gets the ten database-assigned bytes. For an incomplete stamp these are the placeholder.
	 *
	 * @return a fresh copy of the global version
	 */
	public byte[] getGlobalVersion() {
		ByteBuffer dest = ByteBuffer.allocate(GLOBAL_VERSION_LENGTH);
		dest.putLong(transactionVersion).putShort((short)batchNumber);
		return dest.array();
	}

	/**
	 * Gets the commit version of the writing transaction. The value is unsigned, so order
	 *  it with {@link Long#compareUnsigned(long, long)}.
	 *
	 * @return the transaction version
	 */
	public long getTransactionVersion() {
		return transactionVersion;
	}

	public int getBatchNumber() {
		return batchNumber;
	}

	public int getUserVersion() {
		return userVersion;
	}

	@Override
	public String toString() {
		if(!complete) {
			return "Versionstamp(<incomplete> " + userVersion + ")";
		}
		return "Versionstamp(" + Long.toUnsignedString(transactionVersion) + " " + batchNumber + " " + userVersion + ")";
	}

	/**
	 * Orders {@code Versionstamp}s the way their packed forms sort. Complete stamps
	 *  compare part by part as unsigned numbers and all come before incomplete ones,
	 *  which in turn compare by user version alone.
	 *
	 * @param other the {@code Versionstamp} to compare with
	 * @return a negative number, zero, or a positive number as this stamp sorts
	 *  before, with, or after {@code other}
	 */
	@Override
	public int compareTo(Versionstamp other) {
		if(complete != other.complete) {
			return complete ? -1 : 1;
		}
		int cmp = Long.compareUnsigned(transactionVersion, other.transactionVersion);
		if(cmp == 0) {
			cmp = Integer.compare(batchNumber, other.batchNumber);
		}
		if(cmp == 0) {
			cmp = Integer.compare(userVersion, other.userVersion);
		}
		return cmp;
	}

	@Override
	public boolean equals(Object o) {
		if(o == this) {
			return true;
		}
		if(!(o instanceof Versionstamp)) {
			return false;
		}
		return compareTo((Versionstamp)o) == 0;
	}

	@Override
	public int hashCode() {
		int h = Long.hashCode(transactionVersion);
		h = 31 * h + batchNumber;
		h = 31 * h + userVersion;
		return complete ? h : ~h;
	}
}
