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
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

/**
 * Tests for walkability and neighbor enumeration
 */
public class GridTest {

    private static List<Point3i> points(List<Node> nodes) {
        return nodes.stream().map(Node::toPoint).collect(Collectors.toList());
    }

    @Test
    public void testSupportRule() {
        var volume = new VoxelVolume(3, 3, 3).set(1, 1, 0, 1);
        var grid = new Grid(volume);

        assertFalse(grid.isWalkableAt(1, 1, 0), "solid voxel");
        assertTrue(grid.isWalkableAt(1, 1, 1), "resting on the solid voxel");
        assertFalse(grid.isWalkableAt(1, 1, 2), "nothing beneath");
        assertTrue(grid.isWalkableAt(0, 0, 0), "ground layer");
        assertFalse(grid.isWalkableAt(0, 0, 1), "floating above the ground");
    }

    @Test
    public void testOutsideBoundsIsNotWalkable() {
        var grid = new Grid(3, 3, 2);
        assertFalse(grid.isWalkableAt(-1, 0, 0));
        assertFalse(grid.isWalkableAt(0, -1, 0));
        assertFalse(grid.isWalkableAt(0, 0, -1));
        assertFalse(grid.isWalkableAt(3, 0, 0));
        assertFalse(grid.isWalkableAt(0, 3, 0));
        assertFalse(grid.isWalkableAt(0, 0, 2));
        assertTrue(grid.isInside(2, 2, 1));
        assertFalse(grid.isInside(2, 2, 2));
    }

    @Test
    public void testNonZeroOccupancyIsSolid() {
        VoxelSource source = (x, y, z) -> z == 0 ? 7 : 0;
        var grid = new Grid(2, 2, 3, source);
        assertFalse(grid.isWalkableAt(0, 0, 0));
        assertTrue(grid.isWalkableAt(0, 0, 1));
        assertFalse(grid.isWalkableAt(0, 0, 2));
    }

    @Test
    public void testSourceOnlyReadInsideBounds() {
        VoxelSource source = mock(VoxelSource.class);
        when(source.occupancy(anyInt(), anyInt(), anyInt())).thenReturn(0);
        var grid = new Grid(4, 4, 4, source);

        assertFalse(grid.isWalkableAt(-1, 0, 0));
        assertFalse(grid.isWalkableAt(0, 0, 4));
        verifyNoInteractions(source);

        assertTrue(grid.isWalkableAt(1, 1, 0));
        verify(source).occupancy(1, 1, 0);
        // ground needs no support lookup
        verify(source, never()).occupancy(1, 1, -1);

        assertFalse(grid.isWalkableAt(1, 1, 2));
        verify(source).occupancy(1, 1, 2);
        verify(source).occupancy(1, 1, 1);
    }

    @Test
    public void testCloneSharesSource() {
        VoxelSource source = mock(VoxelSource.class);
        var grid = new Grid(5, 6, 7, source);
        var clone = grid.clone();

        assertNotSame(grid, clone);
        assertSame(source, clone.getSource());
        assertEquals(5, clone.getWidth());
        assertEquals(6, clone.getHeight());
        assertEquals(7, clone.getDepth());
        verifyNoInteractions(source);
    }

    @Test
    public void testCloneSeesSourceChanges() {
        var volume = new VoxelVolume(3, 3, 1);
        var grid = new Grid(volume);
        var clone = grid.clone();
        volume.set(1, 1, 0, 1);
        assertFalse(grid.isWalkableAt(1, 1, 0));
        assertFalse(clone.isWalkableAt(1, 1, 0));
    }

    @Test
    public void testConstructorValidation() {
        assertThrows(IllegalArgumentException.class, () -> new Grid(0, 1, 1));
        assertThrows(IllegalArgumentException.class, () -> new Grid(1, 1, -1, (x, y, z) -> 0));
        assertThrows(NullPointerException.class, () -> new Grid(1, 1, 1, null));
    }

    @Test
    public void testGetNodeAtDoesNotImplyWalkable() {
        var grid = new Grid(new VoxelVolume(2, 2, 1).set(0, 0, 0, 1));
        var node = grid.getNodeAt(0, 0, 0);
        assertTrue(node.isAt(0, 0, 0));
        assertFalse(grid.isWalkableAt(0, 0, 0));
        assertEquals(Node.NONE, node.getIndex());
        assertFalse(node.hasParent());
    }

    @Test
    public void testOpenFloorNeighbors() {
        var grid = new Grid(3, 3, 1);
        var center = grid.getNodeAt(1, 1, 0);

        var axis = points(grid.getNeighbors(center, false, false));
        assertEquals(List.of(new Point3i(1, 0, 0), new Point3i(2, 1, 0), new Point3i(1, 2, 0), new Point3i(0, 1, 0)),
                     axis);

        var all = points(grid.getNeighbors(center, true, true));
        assertEquals(8, all.size());
        assertTrue(all.containsAll(
        List.of(new Point3i(0, 0, 0), new Point3i(2, 0, 0), new Point3i(2, 2, 0), new Point3i(0, 2, 0))));
    }

    @Test
    public void testCornerNeighborsAtEdge() {
        var grid = new Grid(3, 3, 1);
        var corner = points(grid.getNeighbors(grid.getNodeAt(0, 0, 0), true, false));
        assertEquals(3, corner.size());
        assertTrue(corner.containsAll(List.of(new Point3i(1, 0, 0), new Point3i(0, 1, 0), new Point3i(1, 1, 0))));
    }

    @Test
    public void testNeighborsOnAdjacentLayers() {
        // a one voxel step east of the center, a platform to stand on south-west one layer up
        var volume = new VoxelVolume(3, 3, 2).set(2, 1, 0, 1).set(0, 2, 0, 1);
        var grid = new Grid(volume);

        var axis = points(grid.getNeighbors(grid.getNodeAt(1, 1, 0), false, false));
        assertEquals(4, axis.size());
        assertTrue(axis.contains(new Point3i(2, 1, 1)), "step up east");
        assertFalse(axis.contains(new Point3i(2, 1, 0)), "solid");

        var all = points(grid.getNeighbors(grid.getNodeAt(1, 1, 0), true, false));
        // south-west on layer 1 is gated by west and south on layer 1, neither of which is walkable
        assertFalse(all.contains(new Point3i(0, 2, 1)));
        // south-east on layer 0 is gated by south
        assertTrue(all.contains(new Point3i(2, 2, 0)));

        // from the top of the step, the floor is one layer down
        var down = points(grid.getNeighbors(grid.getNodeAt(2, 1, 1), false, false));
        assertTrue(down.contains(new Point3i(1, 1, 0)));
        assertTrue(down.contains(new Point3i(2, 0, 0)));
        assertTrue(down.contains(new Point3i(2, 2, 0)));
    }

    @Test
    public void testDontCrossCornersRequiresBothFlanks() {
        // a tall pillar north of the center
        var volume = new VoxelVolume(3, 3, 2).fill(1, 0, 0, 1, 0, 1, 1);
        var grid = new Grid(volume);
        var center = grid.getNodeAt(1, 1, 0);

        var strict = points(grid.getNeighbors(center, true, true));
        assertEquals(5, strict.size());
        assertTrue(grid.isWalkableAt(2, 0, 0));
        assertFalse(strict.contains(new Point3i(2, 0, 0)), "north-east flanked by the pillar");
        assertFalse(strict.contains(new Point3i(0, 0, 0)), "north-west flanked by the pillar");

        var cutting = points(grid.getNeighbors(center, true, false));
        assertEquals(7, cutting.size());
        assertTrue(cutting.contains(new Point3i(2, 0, 0)));
        assertTrue(cutting.contains(new Point3i(0, 0, 0)));
    }

    @Test
    public void testDiagonalNeedsOneFlankWhenCuttingCorners() {
        // north and east both blocked: the north-east diagonal is closed even when corner cutting is allowed
        var volume = new VoxelVolume(3, 3, 2).fill(1, 0, 0, 1, 0, 1, 1).fill(2, 1, 0, 2, 1, 1, 1);
        var grid = new Grid(volume);
        var neighbors = points(grid.getNeighbors(grid.getNodeAt(1, 1, 0), true, false));
        assertTrue(grid.isWalkableAt(2, 0, 0));
        assertFalse(neighbors.contains(new Point3i(2, 0, 0)));
    }
}
