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
package com.hellblazer.traverse.pathing.util;

import com.hellblazer.traverse.geometry.Point3i;
import com.hellblazer.traverse.pathing.Grid;
import com.hellblazer.traverse.pathing.Node;
import com.hellblazer.traverse.pathing.NodeTable;

import javax.vecmath.Vector3d;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Operations on paths, i.e. ordered lists of voxel coordinates. None of these modify their input.
 *
 * @author hal.hildebrand
 */
public final class PathUtil {

    private static final double DIRECTION_EPSILON = 1e-9;

    private PathUtil() {
    }

    /**
     * Follow the parent links from the node back to the root of its search tree.
     *
     * @param nodes the table the node and its ancestors live in
     * @param node  the last node of the path
     * @return the path from the root to the node, inclusive
     */
    public static List<Point3i> backtrace(NodeTable nodes, Node node) {
        var path = new ArrayList<Point3i>();
        for (Node current = node; current != null; current = nodes.parentOf(current)) {
            path.add(current.toPoint());
        }
        Collections.reverse(path);
        return path;
    }

    /**
     * Join the two halves of a bidirectional search that met between nodeA and nodeB: the path to nodeA from its root,
     * then the path from nodeB back to its root.
     */
    public static List<Point3i> biBacktrace(NodeTable nodes, Node nodeA, Node nodeB) {
        List<Point3i> path = backtrace(nodes, nodeA);
        List<Point3i> tail = backtrace(nodes, nodeB);
        Collections.reverse(tail);
        path.addAll(tail);
        return path;
    }

    /**
     * Drop interior points that continue in the direction of the segment before them, leaving only the start, the
     * turning points and the end. Repeated points are dropped as well.
     *
     * @return the compressed path; paths shorter than three points are returned as is
     */
    public static List<Point3i> compressPath(List<Point3i> path) {
        if (path.size() < 3) {
            return path;
        }

        var compressed = new ArrayList<Point3i>();
        compressed.add(path.get(0));
        Point3i previous = path.get(0);
        Vector3d direction = null;

        for (int i = 1; i < path.size(); i++) {
            Point3i current = path.get(i);
            Vector3d next = direction(previous, current);
            if (next == null) {
                continue;
            }
            if (direction != null && !direction.epsilonEquals(next, DIRECTION_EPSILON)) {
                compressed.add(previous);
            }
            direction = next;
            previous = current;
        }

        if (!previous.equals(compressed.get(compressed.size() - 1))) {
            compressed.add(previous);
        }
        return compressed;
    }

    /**
     * Interpolate every segment of the path, so that consecutive points differ by at most one unit per axis.
     *
     * @return the expanded path, or an empty list if the path has fewer than two points
     */
    public static List<Point3i> expandPath(List<Point3i> path) {
        var expanded = new ArrayList<Point3i>();
        int len = path.size();
        if (len < 2) {
            return expanded;
        }

        for (int i = 0; i < len - 1; i++) {
            List<Point3i> segment = interpolate(path.get(i), path.get(i + 1));
            // the segment end is the next segment's start
            expanded.addAll(segment.subList(0, segment.size() - 1));
        }
        expanded.add(path.get(len - 1));
        return expanded;
    }

    /**
     * @see #interpolate(int, int, int, int, int, int)
     */
    public static List<Point3i> interpolate(Point3i from, Point3i to) {
        return interpolate(from.x, from.y, from.z, to.x, to.y, to.z);
    }

    /**
     * The lattice points on the line between two coordinates, both ends included, by 3D Bresenham. Each step moves
     * along the dominant axis and along each other axis whose accumulated error has come due, so no point repeats and
     * no axis moves more than one unit at a time.
     * <p>
     * The line is always rasterized from the lexicographically smaller end, so the points from b to a are exactly the
     * points from a to b reversed.
     */
    public static List<Point3i> interpolate(int x0, int y0, int z0, int x1, int y1, int z1) {
        Point3i from = new Point3i(x0, y0, z0);
        Point3i to = new Point3i(x1, y1, z1);
        if (from.compareTo(to) <= 0) {
            return rasterize(from, to);
        }
        List<Point3i> line = rasterize(to, from);
        Collections.reverse(line);
        return line;
    }

    /**
     * @return the sum of the Euclidean lengths of the path's segments
     */
    public static double pathLength(List<Point3i> path) {
        double sum = 0;
        for (int i = 1; i < path.size(); i++) {
            sum += path.get(i - 1).distance(path.get(i));
        }
        return sum;
    }

    /**
     * Greedy line of sight smoothing in one forward pass. From the current anchor, the path is followed for as long as
     * the straight line from the anchor to the next point crosses only walkable cells. When the line is blocked, the
     * last point that could still be seen becomes the new anchor. The end of the path is always the last point.
     *
     * @return the smoothed path; paths shorter than three points are copied
     */
    public static List<Point3i> smoothenPath(Grid grid, List<Point3i> path) {
        int len = path.size();
        if (len < 3) {
            return new ArrayList<>(path);
        }

        var smoothed = new ArrayList<Point3i>();
        Point3i anchor = path.get(0);
        Point3i last = path.get(1);
        smoothed.add(anchor);

        for (int i = 2; i < len; i++) {
            Point3i current = path.get(i);
            if (!isClear(grid, anchor, current)) {
                if (!last.equals(anchor)) {
                    smoothed.add(last);
                    anchor = last;
                }
            }
            last = current;
        }

        Point3i end = path.get(len - 1);
        if (!end.equals(smoothed.get(smoothed.size() - 1))) {
            smoothed.add(end);
        }
        return smoothed;
    }

    /**
     * @return the normalized direction from a to b, or null if they are the same point
     */
    private static Vector3d direction(Point3i a, Point3i b) {
        if (a.equals(b)) {
            return null;
        }
        var d = new Vector3d(b.x - a.x, b.y - a.y, b.z - a.z);
        d.normalize();
        return d;
    }

    /**
     * True if every cell on the line after the anchor is walkable
     */
    private static boolean isClear(Grid grid, Point3i anchor, Point3i target) {
        List<Point3i> line = interpolate(anchor, target);
        for (int j = 1; j < line.size(); j++) {
            Point3i p = line.get(j);
            if (!grid.isWalkableAt(p.x, p.y, p.z)) {
                return false;
            }
        }
        return true;
    }

    private static List<Point3i> rasterize(Point3i from, Point3i to) {
        int x = from.x, y = from.y, z = from.z;
        int dx = Math.abs(to.x - x), dy = Math.abs(to.y - y), dz = Math.abs(to.z - z);
        int sx = to.x >= x ? 1 : -1;
        int sy = to.y >= y ? 1 : -1;
        int sz = to.z >= z ? 1 : -1;

        var line = new ArrayList<Point3i>(from.chebyshevDistance(to) + 1);
        line.add(from);

        if (dx >= dy && dx >= dz) {
            int ey = 2 * dy - dx, ez = 2 * dz - dx;
            for (int i = 0; i < dx; i++) {
                x += sx;
                if (ey >= 0) {
                    y += sy;
                    ey -= 2 * dx;
                }
                if (ez >= 0) {
                    z += sz;
                    ez -= 2 * dx;
                }
                ey += 2 * dy;
                ez += 2 * dz;
                line.add(Point3i.of(x, y, z));
            }
        } else if (dy >= dx && dy >= dz) {
            int ex = 2 * dx - dy, ez = 2 * dz - dy;
            for (int i = 0; i < dy; i++) {
                y += sy;
                if (ex >= 0) {
                    x += sx;
                    ex -= 2 * dy;
                }
                if (ez >= 0) {
                    z += sz;
                    ez -= 2 * dy;
                }
                ex += 2 * dx;
                ez += 2 * dz;
                line.add(Point3i.of(x, y, z));
            }
        } else {
            int ex = 2 * dx - dz, ey = 2 * dy - dz;
            for (int i = 0; i < dz; i++) {
                z += sz;
                if (ex >= 0) {
                    x += sx;
                    ex -= 2 * dz;
                }
                if (ey >= 0) {
                    y += sy;
                    ey -= 2 * dz;
                }
                ex += 2 * dx;
                ey += 2 * dy;
                line.add(Point3i.of(x, y, z));
            }
        }
        return line;
    }
}
