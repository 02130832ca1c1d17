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
 * Arithmetic over little-endian arrays of 64-bit words, where word 0 holds positions 0..63.
 * <p>
 * This is the common representation every bitset width can be exported to, so conversions between
 * widths reduce to {@link #resize(long[], int)}.
 */
public final class WordArrays {
    /** Number of bits in one storage word. */
    public static final int BITS_PER_WORD = Long.SIZE;

    private static final int WORD_SHIFT = 6;

    private WordArrays() {
    }

    /**
     * Returns the number of 64-bit words needed to hold {@code bitLength} bits.
     * @param bitLength number of bits, positive
     * @return the word count
     */
    public static int wordCount(int bitLength) {
        return ((bitLength - 1) >> WORD_SHIFT) + 1;
    }

    /**
     * Returns the index of the word holding {@code position}.
     * @param position a bit position
     * @return the word index
     */
    public static int wordIndex(int position) {
        return position >> WORD_SHIFT;
    }

    /**
     * Returns a mask with only the bit for {@code position} set within its word.
     * @param position a bit position
     * @return the single-bit mask
     */
    public static long bitMask(int position) {
        return 1L << (position & (BITS_PER_WORD - 1));
    }

    /**
     * Returns a mask of the bits of the last word that are inside a vector of {@code bitLength} bits.
     * @param bitLength number of bits, positive
     * @return {@code -1L} when {@code bitLength} is a multiple of 64, otherwise the low {@code bitLength % 64} bits
     */
    public static long lastWordMask(int bitLength) {
        int r = bitLength & (BITS_PER_WORD - 1);
        return r == 0 ? -1L : -1L >>> (BITS_PER_WORD - r);
    }

    /**
     * Truncates or zero-extends {@code words} to exactly {@code bitLength} bits.
     * <p>
     * The result always has {@link #wordCount(int)} words, every position below {@code bitLength} keeps
     * its value from the source (or reads 0 if the source is shorter) and every position above it is 0.
     * The source array is never modified or shared.
     *
     * @param words source words, little-endian by position
     * @param bitLength number of bits to keep, positive
     * @return a new word array
     */
    public static long[] resize(long[] words, int bitLength) {
        long[] resized = new long[wordCount(bitLength)];
        System.arraycopy(words, 0, resized, 0, Math.min(words.length, resized.length));
        resized[resized.length - 1] &= lastWordMask(bitLength);
        return resized;
    }

    /**
     * Appends the low {@code width} bits of {@code word} to {@code sb} as binary digits, most significant
     * first and zero-padded to {@code width} characters.
     * @param sb destination
     * @param word the word to render
     * @param width number of low-order bits to render, 1 to 64
     * @return {@code sb}
     */
    public static StringBuilder appendBinary(StringBuilder sb, long word, int width) {
        for (int i = width - 1; i >= 0; i--) {
            sb.append(((word >>> i) & 1L) != 0 ? '1' : '0');
        }
        return sb;
    }
}
