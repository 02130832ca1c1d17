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
 * A fixed size sequence of 256 bits stored as four 64-bit words, addressable as a {@link #high()} and
 * {@link #low()} pair of {@link Bitset128} halves.
 * <p>
 * The halves are returned by value: mutating the result of {@code low()} does not affect this bitset,
 * use {@link #setLow(Bitset128)} to write it back.
 */
public final class Bitset256 extends AbstractMultiWordBitset<Bitset256> {
    private static final int LENGTH = 256;

    /**
     * Creates a bitset with every position clear.
     */
    public Bitset256() {
        super(new long[4]);
    }

    /**
     * @param w0 positions 0 to 63, the rest clear
     */
    public Bitset256(long w0) {
        this(w0, 0L, 0L, 0L);
    }

    /**
     * @param w0 positions 0 to 63
     * @param w1 positions 64 to 127
     */
    public Bitset256(long w0, long w1) {
        this(w0, w1, 0L, 0L);
    }

    /**
     * @param w0 positions 0 to 63
     * @param w1 positions 64 to 127
     * @param w2 positions 128 to 191
     */
    public Bitset256(long w0, long w1, long w2) {
        this(w0, w1, w2, 0L);
    }

    /**
     * @param w0 positions 0 to 63
     * @param w1 positions 64 to 127
     * @param w2 positions 128 to 191
     * @param w3 positions 192 to 255
     */
    public Bitset256(long w0, long w1, long w2, long w3) {
        super(new long[] { w0, w1, w2, w3 });
    }

    /**
     * @param low positions 0 to 127
     * @param high positions 128 to 255
     */
    public Bitset256(Bitset128 low, Bitset128 high) {
        this(low.low(), low.high(), high.low(), high.high());
    }

    /**
     * @param bits exactly 256 values, element {@code i} becomes position {@code i}
     */
    public Bitset256(boolean[] bits) {
        super(wordsOf(bits, LENGTH));
    }

    /**
     * @param bytes exactly 256 values, non-zero meaning 1
     */
    public Bitset256(byte[] bytes) {
        super(wordsOf(bytes, LENGTH));
    }

    /**
     * @param s exactly 256 binary digits, most significant bit first
     */
    public Bitset256(String s) {
        super(wordsOf(s, LENGTH));
    }

    /**
     * @param other the bitset to copy
     */
    public Bitset256(Bitset256 other) {
        super(other.words.clone());
    }

    private Bitset256(long[] words) {
        super(words);
    }

    /**
     * Truncates or zero-extends little-endian words to 256 bits.
     * @param words the source words, word 0 holding positions 0 to 63
     * @return a bitset holding the low 256 bits of {@code words}
     */
    public static Bitset256 fromLongArray(long[] words) {
        return new Bitset256(WordArrays.resize(words, LENGTH));
    }

    @Override
    protected Bitset256 newInstance(long[] words) {
        return new Bitset256(words);
    }

    @Override
    public BitWidth width() {
        return BitWidth.W256;
    }

    /**
     * @return a copy of positions 128 to 255
     */
    public Bitset128 high() {
        return new Bitset128(words[2], words[3]);
    }

    /**
     * @param value the new positions 128 to 255
     */
    public void setHigh(Bitset128 value) {
        words[2] = value.low();
        words[3] = value.high();
    }

    /**
     * @return a copy of positions 0 to 127
     */
    public Bitset128 low() {
        return new Bitset128(words[0], words[1]);
    }

    /**
     * @param value the new positions 0 to 127
     */
    public void setLow(Bitset128 value) {
        words[0] = value.low();
        words[1] = value.high();
    }
}
