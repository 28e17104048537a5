/*
 * HuffmanTreeBuilder.java
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

import java.text.MessageFormat;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds a Huffman tree from a frequency table by repeatedly merging the
 * two lowest-frequency nodes.
 *
 * <p>Nodes of equal frequency are ordered by creation: leaves are numbered
 * in the iteration order of the frequency table, and each merged node is
 * numbered after every node created before it. Of the two nodes removed
 * at each step, the first becomes the left child and the second the right.
 * The same table therefore always produces the same tree.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class HuffmanTreeBuilder {

    private static final Logger LOGGER = Logger.getLogger(HuffmanTreeBuilder.class.getName());

    private HuffmanTreeBuilder() {
    }

    // Queue entry: a node plus its creation sequence number.
    private static final class QueuedNode<S> implements Comparable<QueuedNode<S>> {

        final HuffmanNode<S> node;
        final int sequence;

        QueuedNode(HuffmanNode<S> node, int sequence) {
            this.node = node;
            this.sequence = sequence;
        }

        @Override
        public int compareTo(QueuedNode<S> other) {
            int cmp = Long.compare(node.getFrequency(), other.node.getFrequency());
            return (cmp != 0) ? cmp : Integer.compare(sequence, other.sequence);
        }

    }

    /**
     * Builds the Huffman tree for a frequency table.
     *
     * @param frequencies the symbol frequencies
     * @param <S> the symbol type
     * @return the root of the tree; a lone leaf if the table has exactly one
     * symbol; null if the table is empty
     */
    public static <S> HuffmanNode<S> build(FrequencyTable<S> frequencies) {
        if (frequencies.isEmpty()) {
            return null;
        }
        PriorityQueue<QueuedNode<S>> queue = new PriorityQueue<>(frequencies.size());
        int sequence = 0;
        for (Map.Entry<S, Long> entry : frequencies.asMap().entrySet()) {
            HuffmanNode<S> leaf = new HuffmanNode.Leaf<>(entry.getKey(), entry.getValue());
            queue.add(new QueuedNode<>(leaf, sequence++));
        }
        int merges = 0;
        while (queue.size() > 1) {
            HuffmanNode<S> left = queue.poll().node;
            HuffmanNode<S> right = queue.poll().node;
            queue.add(new QueuedNode<>(new HuffmanNode.Internal<>(left, right), sequence++));
            merges++;
        }
        HuffmanNode<S> root = queue.poll().node;
        if (LOGGER.isLoggable(Level.FINEST)) {
            String msg = MessageFormat.format(HuffmanCodec.L10N.getString("debug.tree_built"),
                    frequencies.size(), merges, root.getFrequency());
            LOGGER.finest(msg);
        }
        return root;
    }

}
