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


package io.github.jbellis.fixedbits.util;

/**
 * Width-agnostic algorithms over bit vectors, written once against word arrays or {@link Bits}.
 */
public final class BitUtil {
    private BitUtil() {
    }

    /**
     * Returns the number of set bits in {@code words}.
     * @param words little-endian words
     * @return the population count
     */
    public static int cardinality(long[] words) {
        int count = 0;
        for (long word : words) {
            count += Long.bitCount(word);
        }
        return count;
    }

    /**
     * Returns the index of the first set bit at or after {@code from}.
     * @param words little-endian words, with no bits set at or beyond {@code length}
     * @param length number of valid bits
     * @param from the index to start searching from (inclusive), non-negative
     * @return the index of the next set bit, or -1 if there is none
     */
    public static int nextSetBit(long[] words, int length, int from) {
        if (from >= length) {
            return -1;
        }
        int i = WordArrays.wordIndex(from);
        // unsigned shift by the in-word offset discards the bits below 'from'
        long word = words[i] >>> from;
        if (word != 0) {
            return from + Long.numberOfTrailingZeros(word);
        }
        while (++i < words.length) {
            word = words[i];
            if (word != 0) {
                return i * WordArrays.BITS_PER_WORD + Long.numberOfTrailingZeros(word);
            }
        }
        return -1;
    }

    /**
     * Returns the index of the last set bit at or before {@code from}.
     * @param words little-endian words, with no bits set at or beyond {@code length}
     * @param length number of valid bits
     * @param from the index to start searching backwards from (inclusive)
     * @return the index of the previous set bit, or -1 if there is none
     */
    public static int prevSetBit(long[] words, int length, int from) {
        if (from < 0) {
            return -1;
        }
        if (from >= length) {
            from = length - 1;
        }
        int i = WordArrays.wordIndex(from);
        int shift = WordArrays.BITS_PER_WORD - 1 - (from & (WordArrays.BITS_PER_WORD - 1));
        // left shift discards the bits above 'from'
        long word = words[i] << shift;
        if (word != 0) {
            return from - Long.numberOfLeadingZeros(word);
        }
        while (--i >= 0) {
            word = words[i];
            if (word != 0) {
                return i * WordArrays.BITS_PER_WORD + WordArrays.BITS_PER_WORD - 1 - Long.numberOfLeadingZeros(word);
            }
        }
        return -1;
    }

    /**
     * Expands {@code bits} into one byte per position, 1 for a set bit and 0 otherwise, position 0 first.
     * @param bits the bits to expand
     * @return a new array of {@code bits.length()} bytes
     */
    public static byte[] toByteArray(Bits bits) {
        byte[] bytes = new byte[bits.length()];
        for (int i = 0; i < bytes.length; i++) {
            bytes[i] = bits.get(i) ? (byte) 1 : (byte) 0;
        }
        return bytes;
    }
}
