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
 * A fixed size sequence of 32 bits stored in a single {@code int}.
 */
public final class Bitset32 implements Bitset<Bitset32> {
    private static final int LENGTH = 32;

    private int w;

    /**
     * Creates a bitset with every bit 0.
     */
    public Bitset32() {
    }

    /**
     * Creates a bitset from its raw word.
     * @param w the word, bit 0 is position 0
     */
    public Bitset32(int w) {
        this.w = w;
    }

    /**
     * Creates a bitset from one boolean per bit.
     * @param bits exactly 32 values, element {@code i} becomes position {@code i}
     */
    public Bitset32(boolean[] bits) {
        Checks.checkArrayLength(bits.length, LENGTH);
        for (int i = 0; i < Math.min(bits.length, LENGTH); i++) {
            set(i, bits[i]);
        }
    }

    /**
     * Creates a bitset from one byte per bit, any non-zero byte meaning 1.
     * @param bytes exactly 32 values, element {@code i} becomes position {@code i}
     */
    public Bitset32(byte[] bytes) {
        Checks.checkArrayLength(bytes.length, LENGTH);
        for (int i = 0; i < Math.min(bytes.length, LENGTH); i++) {
            set(i, bytes[i] != 0);
        }
    }

    /**
     * Parses a bitset from binary digits in the format produced by {@link #toString()}.
     * @param s exactly 32 characters from {@code '0'} and {@code '1'}, most significant bit first
     */
    public Bitset32(String s) {
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
    public Bitset32(Bitset32 other) {
        this.w = other.w;
    }

    /**
     * Creates a bitset from the lowest 32 bits of little-endian words.
     * @param words source words
     * @return a new bitset
     */
    public static Bitset32 fromLongArray(long[] words) {
        return new Bitset32((int) WordArrays.resize(words, LENGTH)[0]);
    }

    /**
     * @return the raw word
     */
    public int word() {
        return w;
    }

    @Override
    public BitWidth width() {
        return BitWidth.W32;
    }

    @Override
    public boolean test(int position) {
        Checks.checkPosition(position, LENGTH, Bitset32.class);
        return (w & (1 << position)) != 0;
    }

    @Override
    public void set(int position) {
        Checks.checkPosition(position, LENGTH, Bitset32.class);
        w |= 1 << position;
    }

    @Override
    public void reset(int position) {
        Checks.checkPosition(position, LENGTH, Bitset32.class);
        w &= ~(1 << position);
    }

    @Override
    public void flip(int position) {
        Checks.checkPosition(position, LENGTH, Bitset32.class);
        w ^= 1 << position;
    }

    @Override
    public boolean all() {
        return w == 0xffffffff;
    }

    @Override
    public boolean any() {
        return w != 0;
    }

    @Override
    public int toUInt32() {
        return w;
    }

    @Override
    public long toUInt64() {
        return Integer.toUnsignedLong(w);
    }

    @Override
    public long[] toLongArray() {
        return new long[] { Integer.toUnsignedLong(w) };
    }

    @Override
    public Bitset32 and(Bitset32 other) {
        return new Bitset32(w & other.w);
    }

    @Override
    public Bitset32 or(Bitset32 other) {
        return new Bitset32(w | other.w);
    }

    @Override
    public Bitset32 xor(Bitset32 other) {
        return new Bitset32(w ^ other.w);
    }

    @Override
    public Bitset32 not() {
        return new Bitset32(~w);
    }

    @Override
    public Bitset32 copy() {
        return new Bitset32(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Bitset32)) return false;
        return w == ((Bitset32) o).w;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(w);
    }

    @Override
    public String toString() {
        return WordArrays.appendBinary(new StringBuilder(LENGTH), w, LENGTH).toString();
    }
}
