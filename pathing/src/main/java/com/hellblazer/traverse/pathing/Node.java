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

import com.hellblazer.traverse.geometry.Point3i;

/**
 * One grid cell plus the bookkeeping a search keeps for it. The coordinate is the identity; everything else is per-run
 * state.
 * <p>
 * Nodes handed out by {@link Grid#getNodeAt(int, int, int)} are transient views with no slot in any table. Nodes taking
 * part in a search come from that search's {@link NodeTable}, which assigns each a stable index; the parent link is such
 * an index, never a reference.
 *
 * @author hal.hildebrand
 */
public final class Node {

    public static final int NONE = -1;

    private final int x;
    private final int y;
    private final int z;
    private final int index;

    private double  g;
    private double  h         = Double.NaN;
    private double  f;
    private boolean opened;
    private boolean closed;
    private boolean tested;
    private int     parent    = NONE;
    private int     heapIndex = NONE;

    public Node(int x, int y, int z) {
        this(x, y, z, NONE);
    }

    Node(int x, int y, int z, int index) {
        this.x = x;
        this.y = y;
        this.z = z;
        this.index = index;
    }

    public double getF() {
        return f;
    }

    public double getG() {
        return g;
    }

    /**
     * @return the heuristic estimate to the goal, NaN until it has been computed
     */
    public double getH() {
        return h;
    }

    /**
     * @return this node's slot in its {@link NodeTable}, or {@link #NONE} for a transient node
     */
    public int getIndex() {
        return index;
    }

    /**
     * @return the table index of the predecessor on the best known path, or {@link #NONE} for the root
     */
    public int getParent() {
        return parent;
    }

    public int getX() {
        return x;
    }

    public int getY() {
        return y;
    }

    public int getZ() {
        return z;
    }

    public boolean hasHeuristic() {
        return !Double.isNaN(h);
    }

    public boolean hasParent() {
        return parent != NONE;
    }

    public boolean isAt(int x, int y, int z) {
        return this.x == x && this.y == y && this.z == z;
    }

    public boolean isClosed() {
        return closed;
    }

    public boolean isOpened() {
        return opened;
    }

    public boolean isTested() {
        return tested;
    }

    public void setG(double g) {
        this.g = g;
    }

    public void setH(double h) {
        this.h = h;
    }

    public void setF(double f) {
        this.f = f;
    }

    public void setOpened(boolean opened) {
        this.opened = opened;
    }

    public void setClosed(boolean closed) {
        this.closed = closed;
    }

    public void setTested(boolean tested) {
        this.tested = tested;
    }

    public void setParent(int parent) {
        this.parent = parent;
    }

    public Point3i toPoint() {
        return new Point3i(x, y, z);
    }

    @Override
    public String toString() {
        return String.format("Node(%d, %d, %d) g=%.3f h=%.3f f=%.3f", x, y, z, g, h, f);
    }

    int getHeapIndex() {
        return heapIndex;
    }

    void setHeapIndex(int heapIndex) {
        this.heapIndex = heapIndex;
    }
}
