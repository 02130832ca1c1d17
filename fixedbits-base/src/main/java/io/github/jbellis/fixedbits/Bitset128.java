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

import io.github.jbellis.fixedbits.util.WordArrays;

/**
 * A fixed size sequence of 128 bits stored as two 64-bit words, addressable as a {@link #high()} and
 * {@link #low()} pair.
 */
public final class Bitset128 extends AbstractMultiWordBitset<Bitset128> {
    private static final int LENGTH = 128;

    /**
     * Creates a bitset with every bit 0.
     */
    public Bitset128() {
        super(new long[2]);
    }

    /**
     * Creates a bitset whose low word is {@code w0} and high word is 0.
     * @param w0 positions 0 to 63
     */
    public Bitset128(long w0) {
        this(w0, 0L);
    }

    /**
     * Creates a bitset from its raw words.
     * @param w0 positions 0 to 63
     * @param w1 positions 64 to 127
     */
    public Bitset128(long w0, long w1) {
        super(new long[] { w0, w1 });
    }

    /**
     * Creates a bitset from one boolean per bit.
     * @param bits exactly 128 values, element {@code i} becomes position {@code i}
     */
    public Bitset128(boolean[] bits) {
        super(wordsOf(bits, LENGTH));
    }

    /**
     * Creates a bitset from one byte per bit, any non-zero byte meaning 1.
     * @param bytes exactly 128 values, element {@code i} becomes position {@code i}
     */
    public Bitset128(byte[] bytes) {
        super(wordsOf(bytes, LENGTH));
    }

    /**
     * Parses a bitset from binary digits in the format produced by {@link #toString()}.
     * @param s exactly 128 characters from {@code '0'} and {@code '1'}, most significant bit first
     */
    public Bitset128(String s) {
        super(wordsOf(s, LENGTH));
    }

    /**
     * Creates a copy of {@code other}.
     * @param other the bitset to copy
     */
    public Bitset128(Bitset128 other) {
        super(other.words.clone());
    }

    private Bitset128(long[] words) {
        super(words);
    }

    /**
     * Creates a bitset from the lowest 128 bits of little-endian words, zero-extending shorter input.
     * @param words source words
     * @return a new bitset
     */
    public static Bitset128 fromLongArray(long[] words) {
        return new Bitset128(WordArrays.resize(words, LENGTH));
    }

    @Override
    protected Bitset128 newInstance(long[] words) {
        return new Bitset128(words);
    }

    @Override
    public BitWidth width() {
        return BitWidth.W128;
    }

    /**
     * @return positions 64 to 127 as a raw word
     */
    public long high() {
        return words[1];
    }

    /**
     * @param value the new raw word for positions 64 to 127
     */
    public void setHigh(long value) {
        words[1] = value;
    }

    /**
     * @return positions 0 to 63 as a raw word
     */
    public long low() {
        return words[0];
    }

    /**
     * @param value the new raw word for positions 0 to 63
     */
    public void setLow(long value) {
        words[0] = value;
    }
}
