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
 * A fixed size sequence of 16 bits stored in a single {@code short}.
 */
public final class Bitset16 implements Bitset<Bitset16> {
    private static final int LENGTH = 16;

    private short w;

    /**
     * Creates a bitset with every position clear.
     */
    public Bitset16() {
    }

    /**
     * @param w the word, bit {@code i} becoming position {@code i}
     */
    public Bitset16(short w) {
        this.w = w;
    }

    /**
     * @param bits exactly 16 values, element {@code i} becomes position {@code i}
     */
    public Bitset16(boolean[] bits) {
        Checks.checkArrayLength(bits.length, LENGTH);
        for (int i = 0; i < Math.min(bits.length, LENGTH); i++) {
            set(i, bits[i]);
        }
    }

    /**
     * @param bytes exactly 16 values, non-zero meaning 1
     */
    public Bitset16(byte[] bytes) {
        Checks.checkArrayLength(bytes.length, LENGTH);
        for (int i = 0; i < Math.min(bytes.length, LENGTH); i++) {
            set(i, bytes[i] != 0);
        }
    }

    /**
     * @param s exactly 16 binary digits, most significant bit first
     */
    public Bitset16(String s) {
        Checks.checkStringLength(s.length(), LENGTH);
        for (int i = 0; i < Math.min(s.length(), LENGTH); i++) {
            char c = s.charAt(i);
            Checks.checkDigit(c, i);
            set(LENGTH - 1 - i, c == '1');
        }
    }

    /**
     * @param other the bitset to copy
     */
    public Bitset16(Bitset16 other) {
        this.w = other.w;
    }

    /**
     * Truncates or zero-extends little-endian words to 16 bits.
     * @param words the source words, word 0 holding positions 0 to 63
     * @return the low 16 bits of {@code words}
     */
    public static Bitset16 fromLongArray(long[] words) {
        return new Bitset16((short) WordArrays.resize(words, LENGTH)[0]);
    }

    /**
     * @return the backing word
     */
    public short word() {
        return w;
    }

    @Override
    public BitWidth width() {
        return BitWidth.W16;
    }

    @Override
    public boolean test(int position) {
        Checks.checkPosition(position, LENGTH, Bitset16.class);
        return (w & (1 << position)) != 0;
    }

    @Override
    public void set(int position) {
        Checks.checkPosition(position, LENGTH, Bitset16.class);
        w |= 1 << position;
    }

    @Override
    public void reset(int position) {
        Checks.checkPosition(position, LENGTH, Bitset16.class);
        w &= ~(1 << position);
    }

    @Override
    public void flip(int position) {
        Checks.checkPosition(position, LENGTH, Bitset16.class);
        w ^= 1 << position;
    }

    @Override
    public boolean all() {
        return w == (short) 0xffff;
    }

    @Override
    public boolean any() {
        return w != 0;
    }

    @Override
    public int toUInt32() {
        return Short.toUnsignedInt(w);
    }

    @Override
    public long toUInt64() {
        return Short.toUnsignedLong(w);
    }

    @Override
    public long[] toLongArray() {
        return new long[] { Short.toUnsignedLong(w) };
    }

    @Override
    public Bitset16 and(Bitset16 other) {
        return new Bitset16((short) (w & other.w));
    }

    @Override
    public Bitset16 or(Bitset16 other) {
        return new Bitset16((short) (w | other.w));
    }

    @Override
    public Bitset16 xor(Bitset16 other) {
        return new Bitset16((short) (w ^ other.w));
    }

    @Override
    public Bitset16 not() {
        return new Bitset16((short) ~w);
    }

    @Override
    public Bitset16 copy() {
        return new Bitset16(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Bitset16)) return false;
        return w == ((Bitset16) o).w;
    }

    @Override
    public int hashCode() {
        return Short.hashCode(w);
    }

    @Override
    public String toString() {
        return WordArrays.appendBinary(new StringBuilder(LENGTH), w, LENGTH).toString();
    }
}
