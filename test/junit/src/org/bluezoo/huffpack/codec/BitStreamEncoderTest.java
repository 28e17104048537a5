/*
 * BitStreamEncoderTest.java
 * Copyright (C) 2026 Chris Burdess
 *
 * This file is part of huffpack, a static Huffman coding library.
 *
 * huffpack is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * huffpack is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with huffpack.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.bluezoo.huffpack.codec;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import org.junit.Test;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link BitStreamEncoder}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class BitStreamEncoderTest {

    private static <S> byte[] encodeWithOwnTable(List<S> symbols) throws HuffmanException {
        CodeTable<S> table = HuffmanCodec.buildCodeTable(FrequencyAnalyzer.analyze(symbols));
        return BitStreamEncoder.encode(symbols, table);
    }

    @Test
    public void testEncodeExample() throws HuffmanException {
        // 0 0 0 11 11 10 = 000111110, 9 bits, 7 padding bits
        byte[] encoded = encodeWithOwnTable(HuffmanCodec.toSymbols("aaabbc"));
        assertArrayEquals(new byte[] { 0x07, 0x1f, 0x00 }, encoded);
    }

    @Test
    public void testEncodeTwoSymbols() throws HuffmanException {
        // a=0, b=1: 0101 plus 4 padding bits
        byte[] encoded = encodeWithOwnTable(HuffmanCodec.toSymbols("abab"));
        assertArrayEquals(new byte[] { 0x04, 0x50 }, encoded);
    }

    @Test
    public void testEncodeAlignedNeedsNoPadding() throws HuffmanException {
        byte[] encoded = encodeWithOwnTable(HuffmanCodec.toSymbols("aaaaaaaa"));
        assertArrayEquals(new byte[] { 0x00, 0x00 }, encoded);
    }

    @Test
    public void testEncodeSingleSymbol() throws HuffmanException {
        byte[] encoded = encodeWithOwnTable(HuffmanCodec.toSymbols("x"));
        assertArrayEquals(new byte[] { 0x07, 0x00 }, encoded);
    }

    @Test
    public void testEncodeEmpty() throws HuffmanException {
        CodeTable<Character> table = CodeTableGenerator.generate(null);
        byte[] encoded = BitStreamEncoder.encode(Collections.<Character>emptyList(), table);
        assertArrayEquals(new byte[] { 0x00 }, encoded);
    }

    @Test
    public void testEncodeWithSuppliedCodes() throws HuffmanException {
        CodeTable<Character> table = HuffmanCodec.buildCodeTable(FrequencyAnalyzer.analyze("aaabbc"));
        // c b a = 10 11 0 = 10110, padded 10110000
        byte[] encoded = BitStreamEncoder.encode(HuffmanCodec.toSymbols("cba"), table);
        assertArrayEquals(new byte[] { 0x03, (byte) 0xb0 }, encoded);
    }

    @Test
    public void testSinglePassIterable() throws HuffmanException {
        CodeTable<Character> table = HuffmanCodec.buildCodeTable(FrequencyAnalyzer.analyze("aaabbc"));
        final Iterator<Character> source = HuffmanCodec.toSymbols("aaabbc").iterator();
        Iterable<Character> once = new Iterable<Character>() {
            private boolean used;

            @Override
            public Iterator<Character> iterator() {
                if (used) {
                    return Collections.<Character>emptyList().iterator();
                }
                used = true;
                return source;
            }
        };
        assertArrayEquals(new byte[] { 0x07, 0x1f, 0x00 }, BitStreamEncoder.encode(once, table));
    }

    @Test
    public void testUnknownSymbol() {
        CodeTable<Character> table = HuffmanCodec.buildCodeTable(FrequencyAnalyzer.analyze("aaabbc"));
        try {
            BitStreamEncoder.encode(HuffmanCodec.toSymbols("abcd"), table);
            fail("Symbol 'd' has no code and should be rejected");
        } catch (HuffmanException e) {
            assertEquals(HuffmanException.Kind.UNKNOWN_SYMBOL, e.getKind());
            assertEquals(Character.valueOf('d'), e.getSymbol());
            assertNotNull(e.getMessage());
        }
    }

    @Test
    public void testPadding() {
        assertEquals(0, BitStreamEncoder.padding(0L));
        assertEquals(7, BitStreamEncoder.padding(1L));
        assertEquals(7, BitStreamEncoder.padding(9L));
        assertEquals(1, BitStreamEncoder.padding(15L));
        assertEquals(0, BitStreamEncoder.padding(16L));
        for (long len = 0L; len < 100L; len++) {
            int pad = BitStreamEncoder.padding(len);
            assertTrue(pad >= 0 && pad <= 7);
            assertEquals(0L, (len + pad) % 8);
        }
    }

    @Test
    public void testBitBuffer() {
        BitStreamEncoder.BitBuffer buffer = new BitStreamEncoder.BitBuffer(2);
        buffer.appendBits(0x5L, 3);
        assertFalse(buffer.isAligned());
        buffer.appendBits(0x1fL, 5);
        assertTrue(buffer.isAligned());
        buffer.appendBits(0xffL, 8);
        assertEquals(16L, buffer.getBitCount());
        assertArrayEquals(new byte[] { (byte) 0xbf, (byte) 0xff }, buffer.toByteArray());
    }

}
