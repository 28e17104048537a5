/*
 * HuffmanException.java
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

/**
 * Exception thrown when a symbol sequence cannot be encoded or an encoded
 * payload cannot be decoded.
 *
 * <p>The {@link Kind} distinguishes the failure so that callers can react
 * to it without parsing the message. No partial output is ever produced
 * alongside this exception.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class HuffmanException extends Exception {

    private static final long serialVersionUID = 1L;

    /**
     * The kinds of codec failure.
     */
    public enum Kind {

        /**
         * A symbol in the input has no entry in the forward code table.
         */
        UNKNOWN_SYMBOL,

        /**
         * The padded bit sequence was not a whole number of bytes before
         * packing. This indicates a defect in the encoder.
         */
        MISALIGNED_PAYLOAD,

        /**
         * The payload is truncated, its padding header is invalid, or its
         * bits do not match the supplied code table.
         */
        CORRUPT_PAYLOAD

    }

    private final Kind kind;
    private final transient Object symbol;

    /**
     * Creates a new Huffman exception.
     *
     * @param kind the kind of failure
     * @param message the error message
     */
    public HuffmanException(Kind kind, String message) {
        this(kind, message, null);
    }

    /**
     * Creates a new Huffman exception for an unencodable symbol.
     *
     * @param kind the kind of failure
     * @param message the error message
     * @param symbol the offending symbol, or null if not applicable
     */
    public HuffmanException(Kind kind, String message, Object symbol) {
        super(message);
        if (kind == null) {
            throw new NullPointerException("kind");
        }
        this.kind = kind;
        this.symbol = symbol;
    }

    /**
     * Returns the kind of failure.
     *
     * @return the kind
     */
    public Kind getKind() {
        return kind;
    }

    /**
     * Returns the symbol that could not be encoded, if any.
     *
     * @return the symbol, or null
     */
    public Object getSymbol() {
        return symbol;
    }

}
