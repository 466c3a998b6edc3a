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

import java.util.List;
import java.util.Set;

/**
 * Outcome of a single search.
 *
 * @param path        the returned path, expanded if the finder is so configured; empty unless found
 * @param jumpPoints  the sparse path of jump points from start to end; empty unless found
 * @param outcome     how the search ended
 * @param iterations  number of nodes closed
 * @param openedNodes number of nodes ever pushed onto the open list
 * @param tested      cells visited by jump rays when recursion tracking is on, otherwise empty
 *
 * @author hal.hildebrand
 */
public record PathResult(List<Point3i> path, List<Point3i> jumpPoints, Outcome outcome, int iterations,
                         int openedNodes, Set<Point3i> tested) {

    public PathResult {
        path = List.copyOf(path);
        jumpPoints = List.copyOf(jumpPoints);
        tested = Set.copyOf(tested);
    }

    public boolean isFound() {
        return outcome == Outcome.FOUND;
    }

    public enum Outcome {
        /**
         * The end was reached
         */
        FOUND,

        /**
         * The open list ran dry; the end is unreachable
         */
        NO_PATH,

        /**
         * The configured iteration limit stopped the search
         */
        ITERATION_LIMIT
    }
}
