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

import java.util.Locale;

/**
 * Failures raised by path finding. Not finding a path is not one of them: that is an empty result.
 * <p>
 * Exception types:
 * <ul>
 * <li>{@link InvalidEndpointException} - start or end outside the grid, or not walkable</li>
 * </ul>
 *
 * @author hal.hildebrand
 */
public sealed class PathfindingException extends RuntimeException permits PathfindingException.InvalidEndpointException {

    public PathfindingException(String message) {
        super(message);
    }

    public PathfindingException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Which end of the requested path was rejected
     */
    public enum Endpoint {
        START, END
    }

    /**
     * Thrown when a search is asked to start or finish at a cell the agent can never occupy.
     */
    public static final class InvalidEndpointException extends PathfindingException {
        private final Endpoint endpoint;
        private final Point3i  coordinate;

        public InvalidEndpointException(Endpoint endpoint, Point3i coordinate, String reason) {
            super(String.format("Invalid %s %s: %s", endpoint.name().toLowerCase(Locale.ROOT), coordinate, reason));
            this.endpoint = endpoint;
            this.coordinate = coordinate;
        }

        public Point3i getCoordinate() {
            return coordinate;
        }

        public Endpoint getEndpoint() {
            return endpoint;
        }
    }
}
