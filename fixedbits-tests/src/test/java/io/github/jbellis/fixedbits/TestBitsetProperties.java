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

import com.carrotsearch.randomizedtesting.RandomizedTest;
import org.junit.Test;

import java.util.Random;

import static io.github.jbellis.fixedbits.TestUtil.fromBooleans;
import static io.github.jbellis.fixedbits.TestUtil.randomBitset;
import static io.github.jbellis.fixedbits.TestUtil.randomBooleans;
import static io.github.jbellis.fixedbits.TestUtil.randomLike;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

/**
 * Properties every width must satisfy identically, checked on random values.
 */
public class TestBitsetProperties extends RandomizedTest {
    private static final int ITERATIONS = 50;

    @Test
    public void testBooleanRoundTrip() {
        for (BitWidth width : BitWidth.values()) {
            for (int iter = 0; iter < ITERATIONS; iter++) {
                boolean[] bits = randomBooleans(getRandom(), width.bits());
                Bitset<?> bitset = fromBooleans(width, bits);
                assertEquals(width.bits(), bitset.length());
                for (int i = 0; i < bits.length; i++) {
                    assertEquals(width + "[" + i + "]", bits[i], bitset.get(i));
                    assertEquals(bits[i], bitset.test(i));
                }
            }
        }
    }

    @Test
    public void testSetAndResetAreIdempotent() {
        for (BitWidth width : BitWidth.values()) {
            for (int iter = 0; iter < ITERATIONS; iter++) {
                checkIdempotence(randomBitset(getRandom(), width), getRandom());
            }
        }
    }

    private static <T extends Bitset<T>> void checkIdempotence(Bitset<T> x, Random random) {
        int p = random.nextInt(x.length());

        T once = x.copy();
        once.set(p);
        T twice = x.copy();
        twice.set(p);
        twice.set(p);
        assertEquals(once, twice);
        assertTrue(twice.test(p));

        once = x.copy();
        once.reset(p);
        twice = x.copy();
        twice.reset(p);
        twice.reset(p);
        assertEquals(once, twice);
        assertFalse(twice.test(p));

        T viaValue = x.copy();
        viaValue.set(p, true);
        assertTrue(viaValue.test(p));
        viaValue.set(p, false);
        assertEquals(once, viaValue);
    }

    @Test
    public void testFlipAndNotAreInvolutions() {
        for (BitWidth width : BitWidth.values()) {
            for (int iter = 0; iter < ITERATIONS; iter++) {
                checkInvolution(randomBitset(getRandom(), width), getRandom());
            }
        }
    }

    private static <T extends Bitset<T>> void checkInvolution(Bitset<T> x, Random random) {
        int p = random.nextInt(x.length());
        T y = x.copy();
        y.flip(p);
        assertNotEquals(x, y);
        assertEquals(!x.test(p), y.test(p));
        y.flip(p);
        assertEquals(x, y);

        assertEquals(x, x.not().not());
        T inverted = x.not();
        for (int i = 0; i < x.length(); i++) {
            assertEquals(!x.get(i), inverted.get(i));
        }
    }

    @Test
    public void testAllAnyNoneConsistency() {
        for (BitWidth width : BitWidth.values()) {
            for (int iter = 0; iter < ITERATIONS; iter++) {
                Bitset<?> x = randomBitset(getRandom(), width);
                if (x.all()) {
                    assertTrue(x.any());
                }
                assertEquals(x.none(), !x.any());
            }

            Bitset<?> zero = TestUtil.zero(width);
            assertTrue(zero.none());
            assertFalse(zero.any());
            assertFalse(zero.all());

            Bitset<?> ones = zero.not();
            assertTrue(ones.all());
            assertTrue(ones.any());
            assertFalse(ones.none());
            assertEquals(width.bits(), ones.cardinality());

            Bitset<?> single = zero.copy();
            single.set(randomIntBetween(0, width.bits() - 1));
            assertTrue(single.any());
            assertFalse(single.all());
            assertFalse(single.none());
            assertEquals(1, single.cardinality());
        }
    }

    @Test
    public void testDeMorgan() {
        for (BitWidth width : BitWidth.values()) {
            for (int iter = 0; iter < ITERATIONS; iter++) {
                checkDeMorgan(randomBitset(getRandom(), width), getRandom());
            }
        }
    }

    private static <T extends Bitset<T>> void checkDeMorgan(Bitset<T> a, Random random) {
        T b = randomLike(a, random);
        assertEquals(a.and(b).not(), a.not().or(b.not()));
        assertEquals(a.or(b).not(), a.not().and(b.not()));
        assertEquals(a.xor(b), a.and(b.not()).or(a.not().and(b)));
        assertTrue(a.xor((T) a).none());
    }

    @Test
    public void testOperatorsArePure() {
        for (BitWidth width : BitWidth.values()) {
            checkPurity(randomBitset(getRandom(), width), getRandom());
        }
    }

    private static <T extends Bitset<T>> void checkPurity(Bitset<T> a, Random random) {
        T b = randomLike(a, random);
        T aBefore = a.copy();
        T bBefore = b.copy();
        a.and(b);
        a.or(b);
        a.xor(b);
        a.not();
        assertEquals(aBefore, a);
        assertEquals(bBefore, b);
    }

    @Test
    public void testStringRendering() {
        for (BitWidth width : BitWidth.values()) {
            for (int iter = 0; iter < ITERATIONS; iter++) {
                Bitset<?> x = randomBitset(getRandom(), width);
                String s = x.toString();
                assertEquals(width.bits(), s.length());
                for (int i = 0; i < s.length(); i++) {
                    // most significant bit first
                    assertEquals(x.get(width.bits() - 1 - i) ? '1' : '0', s.charAt(i));
                }
                assertEquals(x, TestUtil.fromString(width, s));
            }
        }
    }

    @Test
    public void testByteArray() {
        for (BitWidth width : BitWidth.values()) {
            for (int iter = 0; iter < ITERATIONS; iter++) {
                Bitset<?> x = randomBitset(getRandom(), width);
                byte[] bytes = x.toByteArray();
                assertEquals(width.bits(), bytes.length);
                for (int i = 0; i < bytes.length; i++) {
                    assertEquals(x.get(i) ? 1 : 0, bytes[i]);
                }
                assertEquals(x, TestUtil.fromBytes(width, bytes));
                assertArrayEquals(bytes, TestUtil.fromBytes(width, bytes).toByteArray());
            }
        }
    }

    @Test
    public void testEqualsAndHashCode() {
        for (BitWidth width : BitWidth.values()) {
            for (int iter = 0; iter < ITERATIONS; iter++) {
                Bitset<?> x = randomBitset(getRandom(), width);
                Bitset<?> y = width.fromLongArray(x.toLongArray());
                assertEquals(x, y);
                assertEquals(x.hashCode(), y.hashCode());
                y.flip(randomIntBetween(0, width.bits() - 1));
                assertNotEquals(x, y);
            }
        }
    }

    @Test
    public void testCardinalityAndIteration() {
        for (BitWidth width : BitWidth.values()) {
            for (int iter = 0; iter < ITERATIONS; iter++) {
                Bitset<?> x = randomBitset(getRandom(), width);
                int expected = 0;
                for (int i = 0; i < width.bits(); i++) {
                    if (x.get(i)) {
                        expected++;
                    }
                }
                assertEquals(expected, x.cardinality());

                int from = randomIntBetween(0, width.bits() - 1);
                assertEquals(naiveNextSetBit(x, from), x.nextSetBit(from));
                assertEquals(naivePrevSetBit(x, from), x.prevSetBit(from));
            }
        }
    }

    private static int naiveNextSetBit(Bitset<?> x, int from) {
        for (int i = from; i < x.length(); i++) {
            if (x.get(i)) {
                return i;
            }
        }
        return -1;
    }

    private static int naivePrevSetBit(Bitset<?> x, int from) {
        for (int i = from; i >= 0; i--) {
            if (x.get(i)) {
                return i;
            }
        }
        return -1;
    }
}
