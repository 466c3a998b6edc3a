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
import java.util.List;
import java.util.Objects;

/**
 * A bounded view over a {@link VoxelSource} that answers the walkability questions a ground-bound agent cares about.
 * A cell is walkable when it lies inside the bounds, its voxel is empty, and it either rests on a solid voxel or sits on
 * the ground layer z = 0.
 * <p>
 * Moves from a cell go to the four axis cells and, optionally, the four diagonal cells of the layer below, the same
 * layer and the layer above. There is no purely vertical move.
 *
 * <pre>
 *     axis           diagonal
 *  +---+---+---+  +---+---+---+
 *  |   | N |   |  |NW |   |NE |      N = y - 1
 *  +---+---+---+  +---+---+---+      E = x + 1
 *  | W |   | E |  |   |   |   |      S = y + 1
 *  +---+---+---+  +---+---+---+      W = x - 1
 *  |   | S |   |  |SW |   |SE |
 *  +---+---+---+  +---+---+---+
 * </pre>
 * <p>
 * The grid holds no search state and never mutates its source, so any number of searches may share it.
 *
 * @author hal.hildebrand
 */
public class Grid implements Cloneable {

    // Axis offsets, N E S W
    private static final int[] AXIS_X     = { 0, 1, 0, -1 };
    private static final int[] AXIS_Y     = { -1, 0, 1, 0 };
    // Diagonal offsets, NW NE SE SW: diagonal i sits between axis (i + 3) % 4 and axis i
    private static final int[] DIAGONAL_X = { -1, 1, 1, -1 };
    private static final int[] DIAGONAL_Y = { -1, -1, 1, 1 };

    private final int         width;
    private final int         height;
    private final int         depth;
    private final VoxelSource source;

    /**
     * A grid over a fresh, entirely empty volume. Only the ground layer is walkable.
     */
    public Grid(int width, int height, int depth) {
        this(new VoxelVolume(width, height, depth));
    }

    public Grid(int width, int height, int depth, VoxelSource source) {
        if (width <= 0 || height <= 0 || depth <= 0) {
            throw new IllegalArgumentException(
            String.format("Grid dimensions must be positive: %d x %d x %d", width, height, depth));
        }
        this.width = width;
        this.height = height;
        this.depth = depth;
        this.source = Objects.requireNonNull(source, "source");
    }

    public Grid(VoxelVolume volume) {
        this(volume.getWidth(), volume.getHeight(), volume.getDepth(), volume);
    }

    /**
     * @return an independent handle over the same voxel source. The source itself is shared, not copied.
     */
    @Override
    public Grid clone() {
        return new Grid(width, height, depth, source);
    }

    public int getDepth() {
        return depth;
    }

    public int getHeight() {
        return height;
    }

    /**
     * Enumerate the walkable cells one move away from the node, over the layers z - 1, z and z + 1.
     * <p>
     * Each diagonal is gated by the two axis cells flanking it on its own layer. With {@code dontCrossCorners} both must
     * be walkable; without it one is enough.
     *
     * @param node             the cell to move from
     * @param allowDiagonal    include the diagonal moves
     * @param dontCrossCorners forbid a diagonal unless both flanking axis cells are walkable
     * @return fresh, transient nodes for the reachable cells
     */
    public List<Node> getNeighbors(Node node, boolean allowDiagonal, boolean dontCrossCorners) {
        int x = node.getX(), y = node.getY(), z = node.getZ();
        var neighbors = new ArrayList<Node>();
        var axis = new boolean[4];

        for (int cz = -1; cz <= 1; cz++) {
            int layer = z + cz;
            for (int i = 0; i < 4; i++) {
                axis[i] = isWalkableAt(x + AXIS_X[i], y + AXIS_Y[i], layer);
                if (axis[i]) {
                    neighbors.add(new Node(x + AXIS_X[i], y + AXIS_Y[i], layer));
                }
            }
            if (!allowDiagonal) {
                continue;
            }
            for (int i = 0; i < 4; i++) {
                boolean before = axis[(i + 3) % 4];
                boolean after = axis[i];
                boolean gate = dontCrossCorners ? before && after : before || after;
                if (gate && isWalkableAt(x + DIAGONAL_X[i], y + DIAGONAL_Y[i], layer)) {
                    neighbors.add(new Node(x + DIAGONAL_X[i], y + DIAGONAL_Y[i], layer));
                }
            }
        }
        return neighbors;
    }

    /**
     * Materialize a node for the coordinate. This says nothing about walkability.
     */
    public Node getNodeAt(int x, int y, int z) {
        return new Node(x, y, z);
    }

    public VoxelSource getSource() {
        return source;
    }

    public int getWidth() {
        return width;
    }

    public boolean isInside(int x, int y, int z) {
        return x >= 0 && x < width && y >= 0 && y < height && z >= 0 && z < depth;
    }

    /**
     * A cell is walkable when it is inside the grid, empty, and supported: either the voxel below is solid or the cell
     * is on the ground layer. Fails closed for everything else.
     */
    public boolean isWalkableAt(int x, int y, int z) {
        if (!isInside(x, y, z) || source.occupancy(x, y, z) != VoxelSource.EMPTY) {
            return false;
        }
        return z == 0 || source.occupancy(x, y, z - 1) != VoxelSource.EMPTY;
    }

    @Override
    public String toString() {
        return String.format("Grid[%d x %d x %d]", width, height, depth);
    }
}
