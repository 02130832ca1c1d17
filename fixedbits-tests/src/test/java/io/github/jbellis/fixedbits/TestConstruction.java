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

import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

public class TestConstruction {

    @Test
    public void testDefaultIsZero() {
        for (BitWidth width : BitWidth.values()) {
            Bitset<?> zero = TestUtil.zero(width);
            assertTrue(zero.none());
            assertEquals("0".repeat(width.bits()), zero.toString());
        }
        assertTrue(new Bitset8().none());
        assertTrue(new Bitset16().none());
        assertTrue(new Bitset32().none());
        assertTrue(new Bitset64().none());
        assertTrue(new Bitset128().none());
        assertTrue(new Bitset256().none());
    }

    @Test
    public void testTrailingWordsDefaultToZero() {
        assertEquals(new Bitset128(9L, 0L), new Bitset128(9L));
        assertEquals(new Bitset256(9L, 0L, 0L, 0L), new Bitset256(9L));
        assertEquals(new Bitset256(9L, 8L, 0L, 0L), new Bitset256(9L, 8L));
        assertEquals(new Bitset256(9L, 8L, 7L, 0L), new Bitset256(9L, 8L, 7L));
    }

    @Test
    public void testStringLeftmostCharacterIsHighestBit() {
        var b8 = new Bitset8("10000001");
        assertTrue(b8.test(7));
        assertTrue(b8.test(0));
        assertEquals((byte) 0x81, b8.word());

        var b16 = new Bitset16("0000000000000110");
        assertEquals((short) 6, b16.word());

        var b128 = new Bitset128("1" + "0".repeat(127));
        assertEquals(0x8000000000000000L, b128.high());
        assertEquals(0L, b128.low());

        var b256 = new Bitset256("0".repeat(255) + "1");
        assertEquals(new Bitset256(1L), b256);
    }

    @Test
    public void testStringRenderingPadsEachWord() {
        assertEquals("00000101", new Bitset8((byte) 5).toString());
        assertEquals("1111111111111111", new Bitset16((short) -1).toString());
        assertEquals("0".repeat(31) + "1", new Bitset32(1).toString());
        assertEquals("1" + "0".repeat(63), new Bitset64(Long.MIN_VALUE).toString());
        assertEquals("0".repeat(63) + "1" + "0".repeat(62) + "10", new Bitset128(2L, 1L).toString());
    }

    @Test
    public void testBytesTreatNonZeroAsSet() {
        byte[] bytes = new byte[16];
        bytes[0] = 1;
        bytes[3] = (byte) 0xff;
        bytes[15] = 42;
        var b16 = new Bitset16(bytes);
        assertEquals((short) 0b1000000000001001, b16.word());
        byte[] normalized = b16.toByteArray();
        assertEquals(1, normalized[3]);
        assertEquals(1, normalized[15]);
        assertEquals(0, normalized[1]);
    }

    @Test
    public void testByteArrayIsPositionZeroFirst() {
        assertArrayEquals(new byte[] { 1, 0, 1, 0, 0, 0, 0, 0 }, new Bitset8((byte) 5).toByteArray());
    }

    @Test
    public void testUnsignedExtraction() {
        assertEquals(0xffL, Integer.toUnsignedLong(new Bitset8((byte) -1).toUInt32()));
        assertEquals(0xffffL, new Bitset16((short) -1).toUInt64());
        assertEquals(0xffffffffL, new Bitset32(-1).toUInt64());
        assertEquals(-1, new Bitset32(-1).toUInt32());
        assertEquals(0xffffffffL, Integer.toUnsignedLong(new Bitset64(0xffffffffL).toUInt32()));
        assertEquals(-1L, new Bitset64(-1L).toUInt64());
        assertEquals(-1L, new Bitset128(-1L).toUInt64());
        assertEquals(12345, new Bitset256(12345L).toUInt32());
    }

    @Test
    public void testCopiesAreIndependent() {
        var b8 = new Bitset8((byte) 1);
        var b8Copy = new Bitset8(b8);
        b8Copy.flip(0);
        assertTrue(b8.test(0));
        assertFalse(b8Copy.test(0));

        var b128 = new Bitset128(1L, 2L);
        var b128Copy = b128.copy();
        b128Copy.setHigh(0L);
        assertEquals(2L, b128.high());

        var b256 = new Bitset256(1L, 2L, 3L, 4L);
        var b256Copy = new Bitset256(b256);
        b256Copy.set(200);
        assertNotEquals(b256, b256Copy);

        long[] exported = b256.toLongArray();
        exported[0] = 0L;
        assertTrue(b256.test(0));
    }

    @Test
    public void testDifferentWidthsAreNeverEqual() {
        assertNotEquals(new Bitset8(), new Bitset16());
        assertNotEquals(new Bitset128(), new Bitset256());
        assertNotEquals(new Bitset64(1L), new Bitset128(1L));
    }

    @Test
    public void testBitWidthLookup() {
        for (BitWidth width : BitWidth.values()) {
            assertEquals(width, BitWidth.of(width.bits()));
            assertEquals(width.bits(), TestUtil.zero(width).length());
        }
        assertEquals(1, BitWidth.W8.words());
        assertEquals(4, BitWidth.W256.words());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnsupportedBitWidth() {
        BitWidth.of(24);
    }
}
