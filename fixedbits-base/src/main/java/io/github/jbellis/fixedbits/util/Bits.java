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
 * Read-only view of a fixed-length sequence of bits.
 * <p>
 * Positions run from 0 (least significant) to {@code length() - 1} (most significant).
 * Width-agnostic helpers in {@link BitUtil} are written against this view.
 */
public interface Bits {
    /**
     * Returns the value of the bit with the specified <code>index</code>.
     *
     * @param index index, must be in {@code [0, length())}. Out of range values
     *     fail the precondition check when checks are enabled and are undefined otherwise.
     * @return <code>true</code> if the bit is set, <code>false</code> otherwise.
     */
    boolean get(int index);

    /**
     * Returns the number of bits in this view.
     * @return the number of bits, fixed for the lifetime of the instance
     */
    int length();
}
