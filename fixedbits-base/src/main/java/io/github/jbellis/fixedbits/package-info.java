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


/**
 * Fixed-width bit vectors of 8, 16, 32, 64, 128 and 256 bits.
 *
 * <p>Every width implements {@link io.github.jbellis.fixedbits.Bitset}, which provides:
 *
 * <ul>
 *   <li><b>Bit access</b>: {@code test}, {@code set}, {@code reset} and {@code flip} on a single
 *       position, position 0 being the least significant bit.
 *   <li><b>Aggregate queries</b>: {@code all}, {@code any}, {@code none} and {@code cardinality}.
 *   <li><b>Word-wise logic</b>: {@code and}, {@code or}, {@code xor} and {@code not}, each returning
 *       a new instance.
 *   <li><b>Conversion</b>: {@code toBitset8()} through {@code toBitset256()}, narrowing by keeping the
 *       low-order bits and widening by zero-extension, plus {@code toUInt32}, {@code toUInt64},
 *       {@code toByteArray} and a binary {@code toString}.
 * </ul>
 *
 * <p>{@link io.github.jbellis.fixedbits.Bitset8} through {@link io.github.jbellis.fixedbits.Bitset64}
 * each hold one primitive word. {@link io.github.jbellis.fixedbits.Bitset128} and
 * {@link io.github.jbellis.fixedbits.Bitset256} share the word-array implementation in
 * {@link io.github.jbellis.fixedbits.AbstractMultiWordBitset}.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * Bitset8 a = new Bitset8();
 * Bitset8 b = new Bitset8();
 * a.set(0);
 * b.set(1);
 * Bitset8 c = a.or(b);                 // 00000011
 * Bitset256 wide = c.toBitset256();    // zero-extended
 * Bitset8 back = wide.toBitset8();     // equals c
 * }</pre>
 *
 * <p>Instances are mutable, unsynchronized values. Precondition failures are reported by
 * {@link io.github.jbellis.fixedbits.util.Checks}.
 */
package io.github.jbellis.fixedbits;
