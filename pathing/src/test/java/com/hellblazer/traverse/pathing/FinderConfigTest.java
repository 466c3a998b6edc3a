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

import static org.junit.jupiter.api.Assertions.*;

public class FinderConfigTest {

    @Test
    public void testDefaults() {
        var config = FinderConfig.defaultConfig();
        assertSame(Heuristic.MANHATTAN, config.getHeuristic());
        assertTrue(config.isExpandPath());
        assertTrue(config.isValidateEndpoints());
        assertFalse(config.isTrackJumpRecursion());
        assertEquals(0, config.getMaxIterations());
        assertSame(Heuristic.MANHATTAN, new JumpPointFinder().getConfig().getHeuristic());
    }

    @Test
    public void testBuilder() {
        var config = FinderConfig.builder()
                                 .withHeuristic(Heuristic.OCTILE)
                                 .withExpandPath(false)
                                 .withValidateEndpoints(false)
                                 .withTrackJumpRecursion(true)
                                 .withMaxIterations(500)
                                 .build();
        assertSame(Heuristic.OCTILE, config.getHeuristic());
        assertFalse(config.isExpandPath());
        assertFalse(config.isValidateEndpoints());
        assertTrue(config.isTrackJumpRecursion());
        assertEquals(500, config.getMaxIterations());
        assertTrue(config.toString().contains("maxIterations=500"));
    }

    @Test
    public void testValidation() {
        var builder = FinderConfig.builder();
        assertThrows(IllegalArgumentException.class, () -> builder.withHeuristic(null));
        assertThrows(IllegalArgumentException.class, () -> builder.withMaxIterations(-1));
        assertEquals(0, builder.build().getMaxIterations());
    }
}
