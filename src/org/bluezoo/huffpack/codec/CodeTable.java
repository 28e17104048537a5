/*
 * CodeTable.java
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
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A prefix-free code: a forward map from symbol to code and the reverse
 * map from code to symbol. The two maps are exact inverses.
 *
 * <p>Instances are immutable and may be shared between threads.
 *
 * @param <S> the symbol type
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class CodeTable<S> {

    private final Map<S, HuffmanCode> forward;
    private final Map<HuffmanCode, S> reverse;
    private final int maxCodeLength;

    /**
     * Creates a code table from a forward map.
     *
     * @param codes the code for each symbol
     * @throws IllegalArgumentException if two symbols share a code, a code
     * is empty, or one code is a prefix of another
     */
    public CodeTable(Map<S, HuffmanCode> codes) {
        Map<S, HuffmanCode> f = new LinkedHashMap<>();
        Map<HuffmanCode, S> r = new LinkedHashMap<>();
        int max = 0;
        for (Map.Entry<S, HuffmanCode> entry : codes.entrySet()) {
            S symbol = entry.getKey();
            HuffmanCode code = entry.getValue();
            if (code.getLength() == 0) {
                throw new IllegalArgumentException("Empty code for symbol " + symbol);
            }
            S previous = r.put(code, symbol);
            if (previous != null) {
                throw new IllegalArgumentException("Code " + code + " assigned to both "
                        + previous + " and " + symbol);
            }
            f.put(symbol, code);
            max = Math.max(max, code.getLength());
        }
        checkPrefixFree(r);
        this.forward = Collections.unmodifiableMap(f);
        this.reverse = Collections.unmodifiableMap(r);
        this.maxCodeLength = max;
    }

    // Every proper prefix of a code must be absent from the table.
    private static void checkPrefixFree(Map<HuffmanCode, ?> reverse) {
        for (HuffmanCode code : reverse.keySet()) {
            HuffmanCode prefix = HuffmanCode.EMPTY;
            for (int i = 0; i < code.getLength() - 1; i++) {
                prefix = prefix.append(code.bitAt(i));
                if (reverse.containsKey(prefix)) {
                    throw new IllegalArgumentException("Code " + prefix
                            + " is a prefix of " + code);
                }
            }
        }
    }

    /**
     * Returns the code for a symbol.
     *
     * @param symbol the symbol
     * @return the code, or null if the symbol is not in this table
     */
    public HuffmanCode getCode(S symbol) {
        return forward.get(symbol);
    }

    /**
     * Returns the symbol for a code.
     *
     * @param code the code
     * @return the symbol, or null if no symbol has exactly this code
     */
    public S getSymbol(HuffmanCode code) {
        return reverse.get(code);
    }

    public Map<S, HuffmanCode> getForward() {
        return forward;
    }

    public Map<HuffmanCode, S> getReverse() {
        return reverse;
    }

    /**
     * Returns the length of the longest code, 0 for an empty table.
     */
    public int getMaxCodeLength() {
        return maxCodeLength;
    }

    public int size() {
        return forward.size();
    }

    public boolean isEmpty() {
        return forward.isEmpty();
    }

    @Override
    public boolean equals(Object other) {
        return (other instanceof CodeTable) && forward.equals(((CodeTable<?>) other).forward);
    }

    @Override
    public int hashCode() {
        return forward.hashCode();
    }

    @Override
    public String toString() {
        return "CodeTable" + forward;
    }

}
