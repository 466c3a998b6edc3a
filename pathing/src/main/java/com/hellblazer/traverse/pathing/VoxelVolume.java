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

import java.util.Arrays;

/**
 * Dense, bounded voxel storage. Voxels are laid out x fastest, then y, then z. Reads outside the volume answer solid so
 * that nothing beyond the edges is ever standable.
 *
 * @author hal.hildebrand
 */
public class VoxelVolume implements VoxelSource {

    /**
     * Occupancy reported for coordinates outside the volume
     */
    public static final int OUTSIDE = 1;

    private final int   width;
    private final int   height;
    private final int   depth;
    private final int[] voxels;

    public VoxelVolume(int width, int height, int depth) {
        if (width <= 0 || height <= 0 || depth <= 0) {
            throw new IllegalArgumentException(
            String.format("Volume dimensions must be positive: %d x %d x %d", width, height, depth));
        }
        long size = (long) width * height * depth;
        if (size > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Volume too large: " + size + " voxels");
        }
        this.width = width;
        this.height = height;
        this.depth = depth;
        this.voxels = new int[(int) size];
    }

    public boolean contains(int x, int y, int z) {
        return x >= 0 && x < width && y >= 0 && y < height && z >= 0 && z < depth;
    }

    /**
     * Fill the inclusive box between the two corners with the given value. The corners may be given in any order; the
     * box is clipped to the volume.
     */
    public VoxelVolume fill(int x0, int y0, int z0, int x1, int y1, int z1, int value) {
        int minX = Math.max(0, Math.min(x0, x1)), maxX = Math.min(width - 1, Math.max(x0, x1));
        int minY = Math.max(0, Math.min(y0, y1)), maxY = Math.min(height - 1, Math.max(y0, y1));
        int minZ = Math.max(0, Math.min(z0, z1)), maxZ = Math.min(depth - 1, Math.max(z0, z1));
        for (int z = minZ; z <= maxZ; z++) {
            for (int y = minY; y <= maxY; y++) {
                int row = index(minX, y, z);
                if (minX <= maxX) {
                    Arrays.fill(voxels, row, row + (maxX - minX) + 1, value);
                }
            }
        }
        return this;
    }

    public int get(int x, int y, int z) {
        return contains(x, y, z) ? voxels[index(x, y, z)] : OUTSIDE;
    }

    public int getDepth() {
        return depth;
    }

    public int getHeight() {
        return height;
    }

    public int getWidth() {
        return width;
    }

    @Override
    public int occupancy(int x, int y, int z) {
        return get(x, y, z);
    }

    /**
     * @throws IndexOutOfBoundsException if the coordinate is outside the volume
     */
    public VoxelVolume set(int x, int y, int z, int value) {
        if (!contains(x, y, z)) {
            throw new IndexOutOfBoundsException(
            String.format("(%d, %d, %d) outside volume %d x %d x %d", x, y, z, width, height, depth));
        }
        voxels[index(x, y, z)] = value;
        return this;
    }

    @Override
    public String toString() {
        return String.format("VoxelVolume[%d x %d x %d]", width, height, depth);
    }

    private int index(int x, int y, int z) {
        return (z * height + y) * width + x;
    }
}
