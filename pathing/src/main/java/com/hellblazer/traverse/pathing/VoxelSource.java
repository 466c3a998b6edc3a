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

/**
 * The voxel occupancy lookup a {@link Grid} is built over. A value of {@link #EMPTY} is passable; anything else is
 * solid.
 * <p>
 * The source must not change while a search over it is running.
 *
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface VoxelSource {

    int EMPTY = 0;

    /**
     * @return the occupancy of the voxel at the coordinate, {@link #EMPTY} for passable
     */
    int occupancy(int x, int y, int z);
}
