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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class HeuristicTest {

    private static final double EPSILON = 1e-12;

    @Test
    public void testDistances() {
        assertEquals(12, Heuristic.MANHATTAN.estimate(3, 4, 5), EPSILON);
        assertEquals(Math.sqrt(50), Heuristic.EUCLIDEAN.estimate(3, 4, 5), EPSILON);
        assertEquals(5, Heuristic.CHEBYSHEV.estimate(3, 4, 5), EPSILON);
        // 3 space diagonals, 1 face diagonal, 1 axis step
        assertEquals(3 * Heuristic.SQRT3 + Heuristic.SQRT2 + 1, Heuristic.OCTILE.estimate(3, 4, 5), EPSILON);
        assertEquals(2 * Heuristic.SQRT2, Heuristic.OCTILE.estimate(2, 0, 2), EPSILON);
        assertEquals(7, Heuristic.OCTILE.estimate(0, 7, 0), EPSILON);
    }

    @Test
    public void testZeroAtGoal() {
        for (Heuristic h : new Heuristic[] { Heuristic.MANHATTAN, Heuristic.EUCLIDEAN, Heuristic.OCTILE,
                                             Heuristic.CHEBYSHEV }) {
            assertEquals(0, h.estimate(0, 0, 0), EPSILON);
        }
    }

    @Test
    public void testOrdering() {
        for (int dx = 0; dx < 6; dx++) {
            for (int dy = 0; dy < 6; dy++) {
                for (int dz = 0; dz < 6; dz++) {
                    double chebyshev = Heuristic.CHEBYSHEV.estimate(dx, dy, dz);
                    double euclidean = Heuristic.EUCLIDEAN.estimate(dx, dy, dz);
                    double octile = Heuristic.OCTILE.estimate(dx, dy, dz);
                    double manhattan = Heuristic.MANHATTAN.estimate(dx, dy, dz);
                    assertTrue(chebyshev <= euclidean + EPSILON);
                    assertTrue(euclidean <= octile + EPSILON);
                    assertTrue(octile <= manhattan + EPSILON);
                }
            }
        }
    }
}
