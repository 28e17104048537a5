/*
 * FrequencyTable.java
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
import java.util.Set;

/**
 * Immutable mapping from symbol to occurrence count.
 *
 * <p>Iteration order is the order in which symbols were first added. The
 * tree builder numbers its leaves in this order to break frequency ties,
 * so two tables holding the same entries in the same order always yield
 * the same code table.
 *
 * @param <S> the symbol type
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class FrequencyTable<S> {

    private static final FrequencyTable<Object> EMPTY =
            new FrequencyTable<>(Collections.emptyMap());

    private final Map<S, Long> counts;
    private final long total;

    private FrequencyTable(Map<S, Long> counts) {
        this.counts = Collections.unmodifiableMap(counts);
        long sum = 0L;
        for (Long count : counts.values()) {
            sum += count;
        }
        this.total = sum;
    }

    /**
     * Returns the empty frequency table.
     *
     * @param <S> the symbol type
     * @return a table with no symbols
     */
    @SuppressWarnings("unchecked")
    public static <S> FrequencyTable<S> empty() {
        return (FrequencyTable<S>) EMPTY;
    }

    /**
     * Returns the count for the given symbol.
     *
     * @param symbol the symbol
     * @return the number of occurrences, 0 if the symbol is absent
     */
    public long get(S symbol) {
        Long count = counts.get(symbol);
        return (count == null) ? 0L : count;
    }

    public boolean contains(S symbol) {
        return counts.containsKey(symbol);
    }

    /**
     * Returns the distinct symbols, in first-occurrence order.
     *
     * @return an unmodifiable set of symbols
     */
    public Set<S> symbols() {
        return counts.keySet();
    }

    /**
     * Returns the entries of this table, in first-occurrence order.
     *
     * @return an unmodifiable view of the counts
     */
    public Map<S, Long> asMap() {
        return counts;
    }

    /**
     * Returns the number of distinct symbols.
     */
    public int size() {
        return counts.size();
    }

    public boolean isEmpty() {
        return counts.isEmpty();
    }

    /**
     * Returns the sum of all counts, i.e. the length of the analysed input.
     */
    public long getTotal() {
        return total;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof FrequencyTable)) {
            return false;
        }
        return counts.equals(((FrequencyTable<?>) other).counts);
    }

    @Override
    public int hashCode() {
        return counts.hashCode();
    }

    @Override
    public String toString() {
        return "FrequencyTable" + counts;
    }

    /**
     * Accumulates counts for a new frequency table.
     *
     * <p>A builder is not thread-safe and should be discarded after
     * {@link #build()}.
     *
     * @param <S> the symbol type
     */
    public static final class Builder<S> {

        private LinkedHashMap<S, Long> counts = new LinkedHashMap<>();

        /**
         * Records one occurrence of a symbol.
         *
         * @param symbol the symbol, not null
         * @return this builder
         */
        public Builder<S> increment(S symbol) {
            return add(symbol, 1L);
        }

        /**
         * Records a number of occurrences of a symbol.
         *
         * @param symbol the symbol, not null
         * @param count the number of occurrences, must be positive
         * @return this builder
         * @throws IllegalArgumentException if count is not positive
         */
        public Builder<S> add(S symbol, long count) {
            if (symbol == null) {
                throw new NullPointerException("symbol");
            }
            if (count <= 0L) {
                throw new IllegalArgumentException("count must be positive: " + count);
            }
            if (counts == null) {
                throw new IllegalStateException("builder already used");
            }
            counts.merge(symbol, count, Long::sum);
            return this;
        }

        /**
         * Indicates whether a symbol has been recorded.
         *
         * @param symbol the symbol
         * @return true if at least one occurrence was recorded
         */
        public boolean contains(S symbol) {
            return counts != null && counts.containsKey(symbol);
        }

        /**
         * Returns an immutable table of the counts recorded so far.
         *
         * @return the frequency table
         */
        public FrequencyTable<S> build() {
            if (counts == null) {
                throw new IllegalStateException("builder already used");
            }
            FrequencyTable<S> table = counts.isEmpty() ? FrequencyTable.<S>empty() : new FrequencyTable<>(counts);
            counts = null;
            return table;
        }

    }

}
