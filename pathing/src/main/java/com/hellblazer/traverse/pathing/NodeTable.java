/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.traverse.pathing;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * The arena of nodes owned by one search run. Nodes are created on first request and keyed by their packed coordinate,
 * so there is exactly one node per coordinate for the life of the table. Each node keeps the slot it was allocated in,
 * and parent links are slots in this table.
 * <p>
 * Not thread safe; a table belongs to a single run.
 *
 * @author hal.hildebrand
 */
public class NodeTable {

    private final int             width;
    private final int             height;
    private final int             depth;
    private final List<Node>      nodes = new ArrayList<>();
    private final Map<Long, Node> byKey = new HashMap<>();

    public NodeTable(Grid grid) {
        this(grid.getWidth(), grid.getHeight(), grid.getDepth());
    }

    public NodeTable(int width, int height, int depth) {
        this.width = width;
        this.height = height;
        this.depth = depth;
    }

    /**
     * Visit every node allocated so far, in allocation order.
     */
    public void forEach(Consumer<Node> action) {
        nodes.forEach(action);
    }

    /**
     * @return the node for the coordinate, allocating it on first request
     * @throws IllegalArgumentException if the coordinate is outside the table's bounds
     */
    public Node get(int x, int y, int z) {
        long key = key(x, y, z);
        Node node = byKey.get(key);
        if (node == null) {
            node = new Node(x, y, z, nodes.size());
            nodes.add(node);
            byKey.put(key, node);
        }
        return node;
    }

    /**
     * @return the parent of the node, or null for a root
     */
    public Node parentOf(Node node) {
        return node.hasParent() ? nodes.get(node.getParent()) : null;
    }

    public int size() {
        return nodes.size();
    }

    long key(int x, int y, int z) {
        if (x < 0 || x >= width || y < 0 || y >= height || z < 0 || z >= depth) {
            throw new IllegalArgumentException(
            String.format("(%d, %d, %d) outside node table %d x %d x %d", x, y, z, width, height, depth));
        }
        return ((long) z * height + y) * width + x;
    }
}
