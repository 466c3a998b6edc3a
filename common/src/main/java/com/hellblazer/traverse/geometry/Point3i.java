/*
 * Copyright (c) 2025 Hal Hildebrand. All rights reserved.
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */

package com.hellblazer.traverse.geometry;

/**
 * Immutable voxel coordinate. The z axis is vertical: layer z rests on layer z - 1.
 * <p>
 * Paths are ordered lists of these points. Points order lexicographically by (x, y, z), which gives line rasterization
 * a canonical direction to walk.
 *
 * @author hal.hildebrand
 */
public final class Point3i implements Comparable<Point3i> {

    /** X coordinate */
    public final int x;

    /** Y coordinate */
    public final int y;

    /** Z coordinate (layer) */
    public final int z;

    public Point3i(int x, int y, int z) {
        this.x = x;
        this.y = y;
        this.z = z;
    }

    public static Point3i of(int x, int y, int z) {
        return new Point3i(x, y, z);
    }

    /**
     * Largest per-axis difference to another point, i.e. the number of single steps a line between the two needs.
     */
    public int chebyshevDistance(Point3i other) {
        return Math.max(Math.abs(x - other.x), Math.max(Math.abs(y - other.y), Math.abs(z - other.z)));
    }

    /**
     * Squared Euclidean distance, avoiding the sqrt.
     */
    public long distanceSquared(Point3i other) {
        long dx = x - other.x;
        long dy = y - other.y;
        long dz = z - other.z;
        return dx * dx + dy * dy + dz * dz;
    }

    public double distance(Point3i other) {
        return Math.sqrt(distanceSquared(other));
    }

    @Override
    public int compareTo(Point3i o) {
        int c = Integer.compare(x, o.x);
        if (c != 0) {
            return c;
        }
        c = Integer.compare(y, o.y);
        return c != 0 ? c : Integer.compare(z, o.z);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Point3i other)) return false;
        return x == other.x && y == other.y && z == other.z;
    }

    @Override
    public int hashCode() {
        int h = x;
        h = 31 * h + y;
        return 31 * h + z;
    }

    @Override
    public String toString() {
        return String.format("(%d, %d, %d)", x, y, z);
    }
}
