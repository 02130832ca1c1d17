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

import java.util.Arrays;

/**
 * Base implementation for bitsets stored as an array of 64-bit words.
 * <p>
 * Position {@code p} lives in {@code words[p / 64]} at bit {@code p % 64}. Widths using this class are
 * multiples of 64, so every word is fully used and {@link #all()} compares each word against all ones.
 * Subclasses fix the word count and provide {@link #newInstance(long[])}; everything else is shared.
 *
 * @param <T> the concrete width
 */
public abstract class AbstractMultiWordBitset<T extends AbstractMultiWordBitset<T>> implements Bitset<T> {
    /** Little-endian storage, owned by this instance. */
    protected final long[] words;

    /**
     * Takes ownership of {@code words}.
     * @param words storage of exactly the width's word count
     */
    protected AbstractMultiWordBitset(long[] words) {
        this.words = words;
    }

    /**
     * Creates a new instance of the concrete width that takes ownership of {@code words}.
     * @param words storage of exactly the width's word count
     * @return the new instance
     */
    protected abstract T newInstance(long[] words);

    static long[] wordsOf(boolean[] bits, int length) {
        Checks.checkArrayLength(bits.length, length);
        long[] words = new long[WordArrays.wordCount(length)];
        for (int i = 0; i < Math.min(bits.length, length); i++) {
            if (bits[i]) {
                words[WordArrays.wordIndex(i)] |= WordArrays.bitMask(i);
            }
        }
        return words;
    }

    static long[] wordsOf(byte[] bytes, int length) {
        Checks.checkArrayLength(bytes.length, length);
        long[] words = new long[WordArrays.wordCount(length)];
        for (int i = 0; i < Math.min(bytes.length, length); i++) {
            if (bytes[i] != 0) {
                words[WordArrays.wordIndex(i)] |= WordArrays.bitMask(i);
            }
        }
        return words;
    }

    static long[] wordsOf(String s, int length) {
        Checks.checkStringLength(s.length(), length);
        long[] words = new long[WordArrays.wordCount(length)];
        for (int i = 0; i < Math.min(s.length(), length); i++) {
            char c = s.charAt(i);
            Checks.checkDigit(c, i);
            if (c == '1') {
                int position = length - 1 - i;
                words[WordArrays.wordIndex(position)] |= WordArrays.bitMask(position);
            }
        }
        return words;
    }

    @Override
    public boolean test(int position) {
        Checks.checkPosition(position, length(), getClass());
        return (words[WordArrays.wordIndex(position)] & WordArrays.bitMask(position)) != 0;
    }

    @Override
    public void set(int position) {
        Checks.checkPosition(position, length(), getClass());
        words[WordArrays.wordIndex(position)] |= WordArrays.bitMask(position);
    }

    @Override
    public void reset(int position) {
        Checks.checkPosition(position, length(), getClass());
        words[WordArrays.wordIndex(position)] &= ~WordArrays.bitMask(position);
    }

    @Override
    public void flip(int position) {
        Checks.checkPosition(position, length(), getClass());
        words[WordArrays.wordIndex(position)] ^= WordArrays.bitMask(position);
    }

    @Override
    public boolean all() {
        for (long word : words) {
            if (word != -1L) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean any() {
        for (long word : words) {
            if (word != 0L) {
                return true;
            }
        }
        return false;
    }

    @Override
    public int toUInt32() {
        Checks.checkConvertible((words[0] >>> Integer.SIZE) == 0 && upperWordsZero(), "UInt32");
        return (int) words[0];
    }

    @Override
    public long toUInt64() {
        Checks.checkConvertible(upperWordsZero(), "UInt64");
        return words[0];
    }

    private boolean upperWordsZero() {
        for (int i = 1; i < words.length; i++) {
            if (words[i] != 0L) {
                return false;
            }
        }
        return true;
    }

    @Override
    public long[] toLongArray() {
        return words.clone();
    }

    @Override
    public T and(T other) {
        long[] result = new long[words.length];
        for (int i = 0; i < words.length; i++) {
            result[i] = words[i] & other.words[i];
        }
        return newInstance(result);
    }

    @Override
    public T or(T other) {
        long[] result = new long[words.length];
        for (int i = 0; i < words.length; i++) {
            result[i] = words[i] | other.words[i];
        }
        return newInstance(result);
    }

    @Override
    public T xor(T other) {
        long[] result = new long[words.length];
        for (int i = 0; i < words.length; i++) {
            result[i] = words[i] ^ other.words[i];
        }
        return newInstance(result);
    }

    @Override
    public T not() {
        long[] result = new long[words.length];
        for (int i = 0; i < words.length; i++) {
            result[i] = ~words[i];
        }
        return newInstance(result);
    }

    @Override
    public T copy() {
        return newInstance(words.clone());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(words, ((AbstractMultiWordBitset<?>) o).words);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(words);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(words.length * WordArrays.BITS_PER_WORD);
        for (int i = words.length - 1; i >= 0; i--) {
            WordArrays.appendBinary(sb, words[i], WordArrays.BITS_PER_WORD);
        }
        return sb.toString();
    }
}
