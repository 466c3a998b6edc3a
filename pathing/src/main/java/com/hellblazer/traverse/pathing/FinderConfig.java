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
 * Configuration for {@link JumpPointFinder}.
 *
 * @author hal.hildebrand
 */
public class FinderConfig {

    private final Heuristic heuristic;
    private final boolean   trackJumpRecursion;
    private final boolean   expandPath;
    private final boolean   validateEndpoints;
    private final int       maxIterations;

    private FinderConfig(Builder builder) {
        this.heuristic = builder.heuristic;
        this.trackJumpRecursion = builder.trackJumpRecursion;
        this.expandPath = builder.expandPath;
        this.validateEndpoints = builder.validateEndpoints;
        this.maxIterations = builder.maxIterations;
    }

    /**
     * Creates a new builder for FinderConfig
     *
     * @return a new Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Manhattan heuristic, expanded paths, strict endpoint validation, no iteration limit, no recursion tracking.
     */
    public static FinderConfig defaultConfig() {
        return builder().build();
    }

    public Heuristic getHeuristic() {
        return heuristic;
    }

    /**
     * @return the maximum number of nodes the search may close before giving up, 0 for no limit
     */
    public int getMaxIterations() {
        return maxIterations;
    }

    /**
     * Whether the sparse jump point path is interpolated into a contiguous path before it is returned
     */
    public boolean isExpandPath() {
        return expandPath;
    }

    /**
     * Whether every cell visited by a jump ray is marked as tested, for debugging and visualization
     */
    public boolean isTrackJumpRecursion() {
        return trackJumpRecursion;
    }

    /**
     * Whether an unwalkable start or end is reported as an error instead of searched
     */
    public boolean isValidateEndpoints() {
        return validateEndpoints;
    }

    @Override
    public String toString() {
        return String.format("FinderConfig[expand=%s, validateEndpoints=%s, maxIterations=%d, trackJumps=%s]",
                             expandPath, validateEndpoints, maxIterations, trackJumpRecursion);
    }

    /**
     * Builder class for FinderConfig
     */
    public static class Builder {
        private Heuristic heuristic          = Heuristic.MANHATTAN;
        private boolean   trackJumpRecursion = false;
        private boolean   expandPath         = true;
        private boolean   validateEndpoints  = true;
        private int       maxIterations      = 0;

        private Builder() {
        }

        public FinderConfig build() {
            return new FinderConfig(this);
        }

        public Builder withExpandPath(boolean expand) {
            this.expandPath = expand;
            return this;
        }

        /**
         * @throws IllegalArgumentException if heuristic is null
         */
        public Builder withHeuristic(Heuristic heuristic) {
            if (heuristic == null) {
                throw new IllegalArgumentException("Heuristic cannot be null");
            }
            this.heuristic = heuristic;
            return this;
        }

        /**
         * Bound the number of nodes a search may close. 0 removes the bound.
         *
         * @throws IllegalArgumentException if the limit is negative
         */
        public Builder withMaxIterations(int limit) {
            if (limit < 0) {
                throw new IllegalArgumentException("Iteration limit must be non-negative: " + limit);
            }
            this.maxIterations = limit;
            return this;
        }

        public Builder withTrackJumpRecursion(boolean track) {
            this.trackJumpRecursion = track;
            return this;
        }

        public Builder withValidateEndpoints(boolean validate) {
            this.validateEndpoints = validate;
            return this;
        }
    }
}
