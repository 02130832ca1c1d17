/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package io.github.jbellis.fixedbits;

import io.github.jbellis.fixedbits.util.BitUtil;
import io.github.jbellis.fixedbits.util.Bits;

/**
 * A fixed-width bit vector. Bitsets can be manipulated bit by bit, combined with word-wise logic,
 * and converted to and from strings, byte arrays, integers and the other widths.
 * <p>
 * Positions run from 0 (least significant) to {@code length() - 1}. The length is determined by the
 * implementing type and never changes. Single-bit mutators ({@link #set}, {@link #reset},
 * {@link #flip}) modify the instance in place; the logical operators are pure and return a new
 * instance, so compound assignment reads {@code c = c.or(a)}.
 * <p>
 * Instances are not thread-safe and do not share storage: {@link #copy()} and every operator
 * result are independent of their sources.
 * <p>
 * Out-of-range positions and out-of-range numeric extraction are programming errors. They raise
 * {@link AssertionError} when checks are enabled (see {@link io.github.jbellis.fixedbits.util.Checks})
 * and are otherwise undefined.
 * <p>
 * Width-agnostic helpers take the interface type rather than the bare type variable, so they can be
 * called with a {@code Bitset<?>} such as the result of {@link BitWidth#convert}:
 * <pre>{@code
 * static <T extends Bitset<T>> T invertLowest(Bitset<T> bitset) {
 *     T result = bitset.copy();
 *     result.flip(0);
 *     return result;
 * }
 * }</pre>
 *
 * @param <T> the implementing width
 */
public interface Bitset<T extends Bitset<T>> extends Bits {
    /**
     * Returns the width constant of this type.
     * @return the width
     */
    BitWidth width();

    /**
     * Returns the total number of bits, the same for every instance of the type.
     * @return the number of bits
     */
    @Override
    default int length() {
        return width().bits();
    }

    /**
     * Checks if the bit at a position is set.
     * @param position the bit position
     * @return {@code true} if the bit is 1
     */
    boolean test(int position);

    /**
     * Alias of {@link #test(int)}.
     */
    @Override
    default boolean get(int position) {
        return test(position);
    }

    /**
     * Sets the bit at the given position to 1.
     * @param position the bit position
     */
    void set(int position);

    /**
     * Sets the bit at a position to the given value.
     * @param position the bit position
     * @param value {@code true} for 1, {@code false} for 0
     */
    default void set(int position, boolean value) {
        if (value) {
            set(position);
        } else {
            reset(position);
        }
    }

    /**
     * Resets the bit at the given position to 0.
     * @param position the bit position
     */
    void reset(int position);

    /**
     * Flips the bit at the given position.
     * @param position the bit position
     */
    void flip(int position);

    /**
     * Checks if all bits are set to 1.
     * @return {@code true} if every word is all ones
     */
    boolean all();

    /**
     * Checks if any bit is set to 1.
     * @return {@code true} if at least one word is non-zero
     */
    boolean any();

    /**
     * Checks if none of the bits are set to 1.
     * @return the negation of {@link #any()}
     */
    default boolean none() {
        return !any();
    }

    /**
     * Returns the value as an unsigned 32-bit integer. Use {@link Integer#toUnsignedLong(int)} to
     * read it as a non-negative number.
     * @return the low 32 bits
     */
    int toUInt32();

    /**
     * Returns the value as an unsigned 64-bit integer. Use {@link Long#toUnsignedString(long)} and
     * friends to read it as a non-negative number.
     * @return the low 64 bits
     */
    long toUInt64();

    /**
     * Converts each bit to one byte, 1 or 0, position 0 first.
     * @return a new array of {@link #length()} bytes
     */
    default byte[] toByteArray() {
        return BitUtil.toByteArray(this);
    }

    /**
     * Returns the bits as little-endian 64-bit words. Widths below 64 are zero-extended into a single word.
     * @return a new word array
     */
    long[] toLongArray();

    /**
     * Returns the number of bits set to 1.
     * @return the population count
     */
    default int cardinality() {
        return BitUtil.cardinality(toLongArray());
    }

    /**
     * Returns the index of the first set bit starting at the index specified.
     * @param from the index to start searching from (inclusive), non-negative
     * @return the index of the next set bit, or -1 if there are no more set bits
     */
    default int nextSetBit(int from) {
        return BitUtil.nextSetBit(toLongArray(), length(), from);
    }

    /**
     * Returns the index of the last set bit before or on the index specified.
     * @param from the index to start searching backwards from (inclusive)
     * @return the index of the previous set bit, or -1 if there are no more set bits
     */
    default int prevSetBit(int from) {
        return BitUtil.prevSetBit(toLongArray(), length(), from);
    }

    /**
     * Word-wise AND.
     * @param other a bitset of the same width
     * @return a new bitset
     */
    T and(T other);

    /**
     * Word-wise OR.
     * @param other a bitset of the same width
     * @return a new bitset
     */
    T or(T other);

    /**
     * Word-wise XOR.
     * @param other a bitset of the same width
     * @return a new bitset
     */
    T xor(T other);

    /**
     * Word-wise NOT.
     * @return a new bitset with every bit flipped
     */
    T not();

    /**
     * Creates an independent copy.
     * @return the copy
     */
    T copy();

    /**
     * Narrows to 8 bits, keeping the lowest-order bits.
     * @return a new bitset
     */
    default Bitset8 toBitset8() {
        return Bitset8.fromLongArray(toLongArray());
    }

    /**
     * Narrows or zero-extends to 16 bits.
     * @return a new bitset
     */
    default Bitset16 toBitset16() {
        return Bitset16.fromLongArray(toLongArray());
    }

    /**
     * Narrows or zero-extends to 32 bits.
     * @return a new bitset
     */
    default Bitset32 toBitset32() {
        return Bitset32.fromLongArray(toLongArray());
    }

    /**
     * Narrows or zero-extends to 64 bits.
     * @return a new bitset
     */
    default Bitset64 toBitset64() {
        return Bitset64.fromLongArray(toLongArray());
    }

    /**
     * Narrows or zero-extends to 128 bits.
     * @return a new bitset
     */
    default Bitset128 toBitset128() {
        return Bitset128.fromLongArray(toLongArray());
    }

    /**
     * Zero-extends to 256 bits.
     * @return a new bitset
     */
    default Bitset256 toBitset256() {
        return Bitset256.fromLongArray(toLongArray());
    }
}
