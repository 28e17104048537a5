/*
 * CodeTableGenerator.java
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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Derives a code table from a Huffman tree. A left edge contributes a 0
 * bit and a right edge a 1 bit; each symbol's code is the path from the
 * root to its leaf.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class CodeTableGenerator {

    /**
     * Code assigned to the symbol of a tree consisting of a single leaf.
     */
    public static final HuffmanCode SINGLE_SYMBOL_CODE = HuffmanCode.of(0L, 1);

    private CodeTableGenerator() {
    }

    // Pending traversal step
    private static final class Step<S> {

        final HuffmanNode<S> node;
        final HuffmanCode path;

        Step(HuffmanNode<S> node, HuffmanCode path) {
            this.node = node;
            this.path = path;
        }

    }

    /**
     * Generates the code table for a tree.
     *
     * @param root the root of the tree, or null
     * @param <S> the symbol type
     * @return the code table; empty if root is null
     * @throws IllegalStateException if a leaf lies deeper than
     * {@link HuffmanCode#MAX_LENGTH}
     */
    public static <S> CodeTable<S> generate(HuffmanNode<S> root) {
        Map<S, HuffmanCode> codes = new LinkedHashMap<>();
        if (root == null) {
            return new CodeTable<>(codes);
        }
        if (root.isLeaf()) {
            // No edges to walk, but the code must not be empty
            codes.put(((HuffmanNode.Leaf<S>) root).getSymbol(), SINGLE_SYMBOL_CODE);
            return new CodeTable<>(codes);
        }
        // Depth-first, left before right, without recursion
        Deque<Step<S>> stack = new ArrayDeque<>();
        stack.push(new Step<>(root, HuffmanCode.EMPTY));
        while (!stack.isEmpty()) {
            Step<S> step = stack.pop();
            if (step.node.isLeaf()) {
                codes.put(((HuffmanNode.Leaf<S>) step.node).getSymbol(), step.path);
            } else {
                HuffmanNode.Internal<S> internal = (HuffmanNode.Internal<S>) step.node;
                stack.push(new Step<>(internal.getRight(), step.path.append(1)));
                stack.push(new Step<>(internal.getLeft(), step.path.append(0)));
            }
        }
        return new CodeTable<>(codes);
    }

}
