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
 * A fixed size sequence of 64 bits stored in a single {@code long}.
 * <p>
 * This is the widest single-word width. {@link #toUInt32()} is the only extraction that can fail.
 */
public final class Bitset64 implements Bitset<Bitset64> {
    private static final int LENGTH = 64;

    private long w;

    public Bitset64() {
    }

    /**
     * @param w the raw word, bit 0 is position 0
     */
    public Bitset64(long w) {
        this.w = w;
    }

    /**
     * @param bits exactly 64 values, element {@code i} becomes position {@code i}
     */
    public Bitset64(boolean[] bits) {
        Checks.checkArrayLength(bits.length, LENGTH);
        for (int i = 0; i < Math.min(bits.length, LENGTH); i++) {
            set(i, bits[i]);
        }
    }

    /**
     * @param bytes exactly 64 values, non-zero meaning 1
     */
    public Bitset64(byte[] bytes) {
        Checks.checkArrayLength(bytes.length, LENGTH);
        for (int i = 0; i < Math.min(bytes.length, LENGTH); i++) {
            set(i, bytes[i] != 0);
        }
    }

    /**
     * @param s exactly 64 binary digits, most significant bit first
     */
    public Bitset64(String s) {
        Checks.checkStringLength(s.length(), LENGTH);
        for (int i = 0; i < Math.min(s.length(), LENGTH); i++) {
            char c = s.charAt(i);
            Checks.checkDigit(c, i);
            set(LENGTH - 1 - i, c == '1');
        }
    }

    public Bitset64(Bitset64 other) {
        this.w = other.w;
    }

    public static Bitset64 fromLongArray(long[] words) {
        return new Bitset64(WordArrays.resize(words, LENGTH)[0]);
    }

    public long word() {
        return w;
    }

    @Override
    public BitWidth width() {
        return BitWidth.W64;
    }

    @Override
    public boolean test(int position) {
        Checks.checkPosition(position, LENGTH, Bitset64.class);
        return (w & (1L << position)) != 0;
    }

    @Override
    public void set(int position) {
        Checks.checkPosition(position, LENGTH, Bitset64.class);
        w |= 1L << position;
    }

    @Override
    public void reset(int position) {
        Checks.checkPosition(position, LENGTH, Bitset64.class);
        w &= ~(1L << position);
    }

    @Override
    public void flip(int position) {
        Checks.checkPosition(position, LENGTH, Bitset64.class);
        w ^= 1L << position;
    }

    @Override
    public boolean all() {
        return w == -1L;
    }

    @Override
    public boolean any() {
        return w != 0L;
    }

    @Override
    public int toUInt32() {
        Checks.checkConvertible((w >>> Integer.SIZE) == 0, "UInt32");
        return (int) w;
    }

    @Override
    public long toUInt64() {
        return w;
    }

    @Override
    public long[] toLongArray() {
        return new long[] { w };
    }

    @Override
    public Bitset64 and(Bitset64 other) {
        return new Bitset64(w & other.w);
    }

    @Override
    public Bitset64 or(Bitset64 other) {
        return new Bitset64(w | other.w);
    }

    @Override
    public Bitset64 xor(Bitset64 other) {
        return new Bitset64(w ^ other.w);
    }

    @Override
    public Bitset64 not() {
        return new Bitset64(~w);
    }

    @Override
    public Bitset64 copy() {
        return new Bitset64(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Bitset64)) return false;
        return w == ((Bitset64) o).w;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(w);
    }

    @Override
    public String toString() {
        return WordArrays.appendBinary(new StringBuilder(LENGTH), w, LENGTH).toString();
    }
}
