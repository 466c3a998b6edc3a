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
 * Estimate of the remaining travel cost given the non-negative per-axis distances to the goal. The search only returns
 * optimal paths when the estimate never exceeds the true remaining Euclidean cost; that is not enforced.
 *
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface Heuristic {

    double SQRT2 = Math.sqrt(2);
    double SQRT3 = Math.sqrt(3);

    /**
     * |dx| + |dy| + |dz|. Overestimates diagonal travel.
     */
    Heuristic MANHATTAN = (dx, dy, dz) -> dx + dy + dz;

    /**
     * Straight line distance, admissible for any move set.
     */
    Heuristic EUCLIDEAN = (dx, dy, dz) -> Math.sqrt((double) dx * dx + (double) dy * dy + (double) dz * dz);

    /**
     * Cost of the cheapest lattice walk when every axis, face diagonal and space diagonal step is allowed: the smallest
     * delta is covered by space diagonals, the middle remainder by face diagonals, the rest by axis steps.
     */
    Heuristic OCTILE = (dx, dy, dz) -> {
        int max = Math.max(dx, Math.max(dy, dz));
        int min = Math.min(dx, Math.min(dy, dz));
        int mid = dx + dy + dz - max - min;
        return (SQRT3 - SQRT2) * min + (SQRT2 - 1) * mid + max;
    };

    /**
     * Largest single-axis delta.
     */
    Heuristic CHEBYSHEV = (dx, dy, dz) -> Math.max(dx, Math.max(dy, dz));

    double estimate(int dx, int dy, int dz);
}
