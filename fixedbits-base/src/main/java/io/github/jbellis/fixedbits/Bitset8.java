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

import io.github.jbellis.fixedbits.util.Checks;
import io.github.jbellis.fixedbits.util.WordArrays;

/**
 * A fixed size sequence of 8 bits stored in a single {@code byte}.
 */
public final class Bitset8 implements Bitset<Bitset8> {
    private static final int LENGTH = 8;

    private byte w;

    /**
     * Creates a bitset with every bit 0.
     */
    public Bitset8() {
    }

    /**
     * Creates a bitset from its raw word.
     * @param w the word, bit 0 is position 0
     */
    public Bitset8(byte w) {
        this.w = w;
    }

    /**
     * Creates a bitset from one boolean per bit.
     * @param bits exactly 8 values, element {@code i} becomes position {@code i}
     */
    public Bitset8(boolean[] bits) {
        Checks.checkArrayLength(bits.length, LENGTH);
        for (int i = 0; i < Math.min(bits.length, LENGTH); i++) {
            set(i, bits[i]);
        }
    }

    /**
     * Creates a bitset from one byte per bit, any non-zero byte meaning 1.
     * @param bytes exactly 8 values, element {@code i} becomes position {@code i}
     */
    public Bitset8(byte[] bytes) {
        Checks.checkArrayLength(bytes.length, LENGTH);
        for (int i = 0; i < Math.min(bytes.length, LENGTH); i++) {
            set(i, bytes[i] != 0);
        }
    }

    /**
     * Parses a bitset from binary digits in the format produced by {@link #toString()}.
     * @param s exactly 8 characters from {@code '0'} and {@code '1'}, most significant bit first
     */
    public Bitset8(String s) {
        Checks.checkStringLength(s.length(), LENGTH);
        for (int i = 0; i < Math.min(s.length(), LENGTH); i++) {
            char c = s.charAt(i);
            Checks.checkDigit(c, i);
            set(LENGTH - 1 - i, c == '1');
        }
    }

    /**
     * Creates a copy of {@code other}.
     * @param other the bitset to copy
     */
    public Bitset8(Bitset8 other) {
        this.w = other.w;
    }

    /**
     * Creates a bitset from the lowest 8 bits of little-endian words.
     * @param words source words, may be shorter or longer than one word
     * @return a new bitset
     */
    public static Bitset8 fromLongArray(long[] words) {
        return new Bitset8((byte) WordArrays.resize(words, LENGTH)[0]);
    }

    /**
     * @return the raw word
     */
    public byte word() {
        return w;
    }

    @Override
    public BitWidth width() {
        return BitWidth.W8;
    }

    @Override
    public boolean test(int position) {
        Checks.checkPosition(position, LENGTH, Bitset8.class);
        return (w & (1 << position)) != 0;
    }

    @Override
    public void set(int position) {
        Checks.checkPosition(position, LENGTH, Bitset8.class);
        w |= 1 << position;
    }

    @Override
    public void reset(int position) {
        Checks.checkPosition(position, LENGTH, Bitset8.class);
        w &= ~(1 << position);
    }

    @Override
    public void flip(int position) {
        Checks.checkPosition(position, LENGTH, Bitset8.class);
        w ^= 1 << position;
    }

    @Override
    public boolean all() {
        return w == (byte) 0xff;
    }

    @Override
    public boolean any() {
        return w != 0;
    }

    @Override
    public int toUInt32() {
        return Byte.toUnsignedInt(w);
    }

    @Override
    public long toUInt64() {
        return Byte.toUnsignedLong(w);
    }

    @Override
    public long[] toLongArray() {
        return new long[] { Byte.toUnsignedLong(w) };
    }

    @Override
    public Bitset8 and(Bitset8 other) {
        return new Bitset8((byte) (w & other.w));
    }

    @Override
    public Bitset8 or(Bitset8 other) {
        return new Bitset8((byte) (w | other.w));
    }

    @Override
    public Bitset8 xor(Bitset8 other) {
        return new Bitset8((byte) (w ^ other.w));
    }

    @Override
    public Bitset8 not() {
        return new Bitset8((byte) ~w);
    }

    @Override
    public Bitset8 copy() {
        return new Bitset8(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Bitset8)) return false;
        return w == ((Bitset8) o).w;
    }

    @Override
    public int hashCode() {
        return Byte.hashCode(w);
    }

    @Override
    public String toString() {
        return WordArrays.appendBinary(new StringBuilder(LENGTH), w, LENGTH).toString();
    }
}
