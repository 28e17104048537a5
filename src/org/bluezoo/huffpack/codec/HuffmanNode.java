/*
 * HuffmanNode.java
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
 * A node in a Huffman tree: either a {@link Leaf} carrying one symbol, or
 * an {@link Internal} node owning exactly two children.
 *
 * @param <S> the symbol type
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public abstract class HuffmanNode<S> {

    private final long frequency;

    HuffmanNode(long frequency) {
        this.frequency = frequency;
    }

    /**
     * Returns the aggregate frequency of the subtree rooted at this node.
     */
    public final long getFrequency() {
        return frequency;
    }

    /**
     * Indicates whether this node is a leaf.
     */
    public abstract boolean isLeaf();

    /**
     * Leaf node carrying a single symbol.
     *
     * @param <S> the symbol type
     */
    public static final class Leaf<S> extends HuffmanNode<S> {

        private final S symbol;

        public Leaf(S symbol, long frequency) {
            super(frequency);
            if (symbol == null) {
                throw new NullPointerException("symbol");
            }
            this.symbol = symbol;
        }

        public S getSymbol() {
            return symbol;
        }

        @Override
        public boolean isLeaf() {
            return true;
        }

        @Override
        public String toString() {
            return "Leaf[" + symbol + ":" + getFrequency() + "]";
        }

    }

    /**
     * Internal node. Its frequency is the sum of its children's.
     *
     * @param <S> the symbol type
     */
    public static final class Internal<S> extends HuffmanNode<S> {

        private final HuffmanNode<S> left;
        private final HuffmanNode<S> right;

        public Internal(HuffmanNode<S> left, HuffmanNode<S> right) {
            super(left.getFrequency() + right.getFrequency());
            this.left = left;
            this.right = right;
        }

        /**
         * Returns the child reached by a 0 bit.
         */
        public HuffmanNode<S> getLeft() {
            return left;
        }

        /**
         * Returns the child reached by a 1 bit.
         */
        public HuffmanNode<S> getRight() {
            return right;
        }

        @Override
        public boolean isLeaf() {
            return false;
        }

        @Override
        public String toString() {
            return "Internal[" + getFrequency() + ": " + left + ", " + right + "]";
        }

    }

}
