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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Precondition checks for bit positions, input lengths and numeric extraction.
 * <p>
 * Every failure here is a programming error, reported as an {@link AssertionError}. Checks run
 * when JVM assertions are enabled for this library (for example under Surefire) or when the
 * {@code fixedbits.checks} system property is {@code true}; otherwise the conditions are not
 * evaluated at all and the JIT removes the calls.
 */
public final class Checks {
    private static final Logger log = LoggerFactory.getLogger(Checks.class);

    /**
     * Name of the system property that forces checks on when assertions are disabled
     */
    public static final String CHECKS_PROPERTY = "fixedbits.checks";

    /**
     * Whether precondition checks are evaluated, resolved once at class initialization
     */
    public static final boolean ENABLED = Boolean.getBoolean(CHECKS_PROPERTY) || assertionsEnabled();

    static {
        log.debug("Bitset precondition checks {} ({}={}, assertions={})",
                  ENABLED ? "enabled" : "disabled", CHECKS_PROPERTY, Boolean.getBoolean(CHECKS_PROPERTY), assertionsEnabled());
    }

    private Checks() {
    }

    @SuppressWarnings({"AssertWithSideEffects", "ConstantConditions"})
    private static boolean assertionsEnabled() {
        boolean enabled = false;
        assert enabled = true;
        return enabled;
    }

    /**
     * Checks that {@code position} addresses a bit of a vector with {@code length} bits.
     * @param position the bit position
     * @param length the number of bits in the vector
     * @param type the vector type, named in the failure message
     */
    public static void checkPosition(int position, int length, Class<?> type) {
        if (ENABLED && (position < 0 || position >= length)) {
            throw new AssertionError("Index out of bounds: " + type.getSimpleName() + "[" + position + "]");
        }
    }

    /**
     * Checks that an input array has exactly one element per bit.
     * @param actual the array length
     * @param length the number of bits in the vector
     */
    public static void checkArrayLength(int actual, int length) {
        if (ENABLED && actual != length) {
            throw new AssertionError("Array length does not match bitset length: " + actual + " != " + length);
        }
    }

    /**
     * Checks that a binary-digit string has exactly one character per bit.
     * @param actual the string length
     * @param length the number of bits in the vector
     */
    public static void checkStringLength(int actual, int length) {
        if (ENABLED && actual != length) {
            throw new AssertionError("String length does not match bitset length: " + actual + " != " + length);
        }
    }

    /**
     * Checks that the character at {@code index} is a binary digit.
     * @param c the character
     * @param index its index in the input string
     */
    public static void checkDigit(char c, int index) {
        if (ENABLED && c != '0' && c != '1') {
            throw new AssertionError("Illegal character '" + c + "' at index " + index + ", expected '0' or '1'");
        }
    }

    /**
     * Checks that a value fits the unsigned integer type it is being extracted as.
     * @param fits whether every bit above the target range is zero
     * @param target the target type name, used in the failure message
     */
    public static void checkConvertible(boolean fits, String target) {
        if (ENABLED && !fits) {
            throw new AssertionError("Cannot convert to " + target);
        }
    }
}
