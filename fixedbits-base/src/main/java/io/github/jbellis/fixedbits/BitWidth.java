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

import java.util.function.Function;

/**
 * The supported bitset widths.
 */
public enum BitWidth {
    /** {@link Bitset8} */
    W8(8, Bitset8::fromLongArray),

    /** {@link Bitset16} */
    W16(16, Bitset16::fromLongArray),

    /** {@link Bitset32} */
    W32(32, Bitset32::fromLongArray),

    /** {@link Bitset64} */
    W64(64, Bitset64::fromLongArray),

    /** {@link Bitset128}, two words */
    W128(128, Bitset128::fromLongArray),

    /** {@link Bitset256}, four words */
    W256(256, Bitset256::fromLongArray);

    private final int bits;
    private final Function<long[], Bitset<?>> factory;

    BitWidth(int bits, Function<long[], Bitset<?>> factory) {
        this.bits = bits;
        this.factory = factory;
    }

    /**
     * @return the number of bits
     */
    public int bits() {
        return bits;
    }

    /**
     * @return the number of 64-bit words needed to hold this width
     */
    public int words() {
        return (bits + Long.SIZE - 1) / Long.SIZE;
    }

    /**
     * Creates a bitset of this width from little-endian words, truncating or zero-extending as needed.
     * @param words source words
     * @return a new bitset
     */
    public Bitset<?> fromLongArray(long[] words) {
        return factory.apply(words);
    }

    /**
     * Converts {@code source} to this width: narrowing keeps the low-order bits, widening zero-extends.
     * @param source any bitset
     * @return a new bitset of this width
     */
    public Bitset<?> convert(Bitset<?> source) {
        return fromLongArray(source.toLongArray());
    }

    /**
     * Looks up the width with exactly {@code bits} bits.
     * @param bits 8, 16, 32, 64, 128 or 256
     * @return the width
     * @throws IllegalArgumentException for any other number of bits
     */
    public static BitWidth of(int bits) {
        for (BitWidth width : values()) {
            if (width.bits == bits) {
                return width;
            }
        }
        throw new IllegalArgumentException("Unsupported bitset width: " + bits);
    }
}
