/*
 * HuffmanExceptionTest.java
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

import org.junit.Test;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link HuffmanException}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class HuffmanExceptionTest {

    @Test
    public void testKindAndMessage() {
        HuffmanException ex = new HuffmanException(HuffmanException.Kind.CORRUPT_PAYLOAD, "bad");
        assertEquals(HuffmanException.Kind.CORRUPT_PAYLOAD, ex.getKind());
        assertEquals("bad", ex.getMessage());
        assertNull(ex.getSymbol());
    }

    @Test
    public void testSymbol() {
        HuffmanException ex = new HuffmanException(HuffmanException.Kind.UNKNOWN_SYMBOL, "no code", 'x');
        assertEquals(Character.valueOf('x'), ex.getSymbol());
    }

    @Test
    public void testExceptionIsCheckedException() {
        assertFalse(RuntimeException.class.isAssignableFrom(HuffmanException.class));
    }

    @Test(expected = NullPointerException.class)
    public void testKindRequired() {
        new HuffmanException(null, "no kind");
    }

}
