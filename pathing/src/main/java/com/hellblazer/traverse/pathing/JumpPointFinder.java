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
import com.hellblazer.traverse.pathing.PathResult.Outcome;
import com.hellblazer.traverse.pathing.PathfindingException.Endpoint;
import com.hellblazer.traverse.pathing.PathfindingException.InvalidEndpointException;
import com.hellblazer.traverse.pathing.util.PathUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import static java.lang.Math.abs;

/**
 * Jump Point Search over a layered voxel {@link Grid}.
 * <p>
 * Within a layer this is classic 8-connected JPS with corner cutting allowed when at least one flanking cell is open:
 * rays run straight or diagonally and stop only at cells with forced neighbors, and the neighbors of an expanded node
 * are pruned to the natural continuation of the direction it was reached from. Movement between layers is confined to
 * <i>layer transitions</i>: cells with a walkable horizontal neighbor on the layer above or below. Every ray stops at a
 * transition, and transitions (like the start) are expanded with their full neighbor set. A layer-changing step always
 * lands on a transition, so rays between layers are a single step long.
 * <p>
 * Each call allocates its own {@link NodeTable} and {@link OpenList}; the finder holds nothing but its configuration.
 *
 * @author hal.hildebrand
 */
public class JumpPointFinder {

    private static final Logger log = LoggerFactory.getLogger(JumpPointFinder.class);

    private final FinderConfig config;

    public JumpPointFinder() {
        this(FinderConfig.defaultConfig());
    }

    public JumpPointFinder(FinderConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Find a path between two cells.
     *
     * @return the path from start to end inclusive, or an empty list if the end cannot be reached
     * @throws InvalidEndpointException if an endpoint is outside the grid, or unwalkable while endpoints are validated
     */
    public List<Point3i> findPath(int startX, int startY, int startZ, int endX, int endY, int endZ, Grid grid) {
        return search(new Point3i(startX, startY, startZ), new Point3i(endX, endY, endZ), grid).path();
    }

    /**
     * @see #findPath(int, int, int, int, int, int, Grid)
     */
    public List<Point3i> findPath(Point3i start, Point3i end, Grid grid) {
        return search(start, end, grid).path();
    }

    public FinderConfig getConfig() {
        return config;
    }

    /**
     * Run a search and report the path along with how it was found.
     *
     * @throws InvalidEndpointException if an endpoint is outside the grid, or unwalkable while endpoints are validated
     */
    public PathResult search(Point3i start, Point3i end, Grid grid) {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        Objects.requireNonNull(grid, "grid");
        // both ends are bounds checked before either may short circuit the search
        boolean startWalkable = checkEndpoint(Endpoint.START, start, grid);
        boolean endWalkable = checkEndpoint(Endpoint.END, end, grid);
        if (!startWalkable || !endWalkable) {
            log.debug("Unwalkable endpoint, no search from {} to {}", start, end);
            return new PathResult(List.of(), List.of(), Outcome.NO_PATH, 0, 0, Set.of());
        }
        return new Search(grid, start, end).run();
    }

    /**
     * @return true if the endpoint is walkable, false if it is not and endpoints are not validated
     */
    private boolean checkEndpoint(Endpoint endpoint, Point3i p, Grid grid) {
        if (!grid.isInside(p.x, p.y, p.z)) {
            throw new InvalidEndpointException(endpoint, p, "outside " + grid);
        }
        if (grid.isWalkableAt(p.x, p.y, p.z)) {
            return true;
        }
        if (config.isValidateEndpoints()) {
            throw new InvalidEndpointException(endpoint, p, "not walkable");
        }
        return false;
    }

    /**
     * The state of one run
     */
    private class Search {
        private final Grid      grid;
        private final NodeTable nodes;
        private final OpenList  openList = new OpenList();
        private final Node      startNode;
        private final Node      endNode;
        private final Heuristic heuristic;
        private final boolean   trackJumps;
        private       int       iterations;
        private       int       opened;

        Search(Grid grid, Point3i start, Point3i end) {
            this.grid = grid;
            this.nodes = new NodeTable(grid);
            this.startNode = nodes.get(start.x, start.y, start.z);
            this.endNode = nodes.get(end.x, end.y, end.z);
            this.heuristic = config.getHeuristic();
            this.trackJumps = config.isTrackJumpRecursion();
        }

        PathResult run() {
            startNode.setG(0);
            startNode.setF(0);
            openList.push(startNode);
            startNode.setOpened(true);
            opened = 1;

            int limit = config.getMaxIterations();
            while (!openList.isEmpty()) {
                if (limit > 0 && iterations >= limit) {
                    log.warn("Search from {} to {} abandoned after {} iterations, {} nodes still open",
                             startNode.toPoint(), endNode.toPoint(), iterations, openList.size());
                    return result(List.of(), List.of(), Outcome.ITERATION_LIMIT);
                }
                Node node = openList.pop();
                node.setClosed(true);
                iterations++;

                if (node == endNode) {
                    List<Point3i> jumpPoints = PathUtil.backtrace(nodes, endNode);
                    List<Point3i> path = config.isExpandPath() && jumpPoints.size() > 1 ? PathUtil.expandPath(
                    jumpPoints) : jumpPoints;
                    log.debug("Path {} -> {}: {} jump points, {} cells, {} iterations, {} opened, {} nodes",
                              startNode.toPoint(), endNode.toPoint(), jumpPoints.size(), path.size(), iterations,
                              opened, nodes.size());
                    return result(path, jumpPoints, Outcome.FOUND);
                }
                identifySuccessors(node);
            }
            log.debug("No path {} -> {} after {} iterations", startNode.toPoint(), endNode.toPoint(), iterations);
            return result(List.of(), List.of(), Outcome.NO_PATH);
        }

        /**
         * Every move the grid offers, diagonals with corner cutting included
         */
        private void addLayerNeighbors(Node node, List<Point3i> neighbors) {
            for (Node neighbor : grid.getNeighbors(node, true, false)) {
                neighbors.add(neighbor.toPoint());
            }
        }

        /**
         * Candidate first steps out of the node. The start and layer transitions get every neighbor; any other node was
         * reached along its own layer, and gets the natural continuation of that direction plus its forced neighbors.
         */
        private List<Point3i> findNeighbors(Node node) {
            int x = node.getX(), y = node.getY(), z = node.getZ();
            var neighbors = new ArrayList<Point3i>();
            Node parent = nodes.parentOf(node);
            if (parent == null || isLayerTransition(x, y, z)) {
                addLayerNeighbors(node, neighbors);
                return neighbors;
            }

            int dx = Integer.signum(x - parent.getX());
            int dy = Integer.signum(y - parent.getY());

            if (dx != 0 && dy != 0) {
                boolean walkX = walkable(x + dx, y, z);
                boolean walkY = walkable(x, y + dy, z);
                if (walkY) {
                    neighbors.add(new Point3i(x, y + dy, z));
                }
                if (walkX) {
                    neighbors.add(new Point3i(x + dx, y, z));
                }
                if (walkX || walkY) {
                    neighbors.add(new Point3i(x + dx, y + dy, z));
                }
                if (!walkable(x - dx, y, z) && walkY) {
                    neighbors.add(new Point3i(x - dx, y + dy, z));
                }
                if (!walkable(x, y - dy, z) && walkX) {
                    neighbors.add(new Point3i(x + dx, y - dy, z));
                }
            } else if (dx != 0) {
                if (walkable(x + dx, y, z)) {
                    neighbors.add(new Point3i(x + dx, y, z));
                    if (!walkable(x, y + 1, z)) {
                        neighbors.add(new Point3i(x + dx, y + 1, z));
                    }
                    if (!walkable(x, y - 1, z)) {
                        neighbors.add(new Point3i(x + dx, y - 1, z));
                    }
                }
            } else if (dy != 0) {
                if (walkable(x, y + dy, z)) {
                    neighbors.add(new Point3i(x, y + dy, z));
                    if (!walkable(x + 1, y, z)) {
                        neighbors.add(new Point3i(x + 1, y + dy, z));
                    }
                    if (!walkable(x - 1, y, z)) {
                        neighbors.add(new Point3i(x - 1, y + dy, z));
                    }
                }
            } else {
                addLayerNeighbors(node, neighbors);
            }
            return neighbors;
        }

        private void identifySuccessors(Node node) {
            int x = node.getX(), y = node.getY(), z = node.getZ();
            if (log.isTraceEnabled()) {
                log.trace("Expanding {}", node);
            }
            for (Point3i neighbor : findNeighbors(node)) {
                Point3i jumpPoint = jump(neighbor.x, neighbor.y, neighbor.z, x, y, z);
                if (jumpPoint == null) {
                    continue;
                }
                int jx = jumpPoint.x, jy = jumpPoint.y, jz = jumpPoint.z;
                Node jumpNode = nodes.get(jx, jy, jz);
                if (jumpNode.isClosed()) {
                    continue;
                }

                // the jump point may be many cells away
                double ng = node.getG() + Heuristic.EUCLIDEAN.estimate(abs(jx - x), abs(jy - y), abs(jz - z));

                if (!jumpNode.isOpened() || ng < jumpNode.getG()) {
                    jumpNode.setG(ng);
                    if (!jumpNode.hasHeuristic()) {
                        jumpNode.setH(heuristic.estimate(abs(jx - endNode.getX()), abs(jy - endNode.getY()),
                                                         abs(jz - endNode.getZ())));
                    }
                    jumpNode.setF(ng + jumpNode.getH());
                    jumpNode.setParent(node.getIndex());

                    if (!jumpNode.isOpened()) {
                        openList.push(jumpNode);
                        jumpNode.setOpened(true);
                        opened++;
                    } else {
                        openList.update(jumpNode);
                    }
                }
            }
        }

        /**
         * True if any horizontal neighbor on the layer above or below is walkable
         */
        private boolean isLayerTransition(int x, int y, int z) {
            for (int cz = -1; cz <= 1; cz += 2) {
                for (int ox = -1; ox <= 1; ox++) {
                    for (int oy = -1; oy <= 1; oy++) {
                        if ((ox != 0 || oy != 0) && walkable(x + ox, y + oy, z + cz)) {
                            return true;
                        }
                    }
                }
            }
            return false;
        }

        /**
         * Walk from (x, y, z) away from its parent until a jump point is found.
         * <p>
         * A diagonal ray probes both of its straight components at every step; those probes never nest further, so the
         * stack depth stays at two no matter how long the rays are.
         *
         * @return the jump point, or null if the ray dead-ends
         */
        private Point3i jump(int x, int y, int z, int px, int py, int pz) {
            int dx = x - px, dy = y - py, dz = z - pz;
            if (dx == 0 && dy == 0) {
                throw new IllegalArgumentException(
                String.format("Not a horizontal step: (%d, %d, %d) -> (%d, %d, %d)", px, py, pz, x, y, z));
            }

            while (true) {
                if (!walkable(x, y, z)) {
                    return null;
                }
                if (trackJumps) {
                    nodes.get(x, y, z).setTested(true);
                }
                if (endNode.isAt(x, y, z)) {
                    return new Point3i(x, y, z);
                }
                // a layer change always lands on a transition
                if (dz != 0 || isLayerTransition(x, y, z)) {
                    return new Point3i(x, y, z);
                }

                if (dx != 0 && dy != 0) {
                    if ((walkable(x - dx, y + dy, z) && !walkable(x - dx, y, z)) || (walkable(x + dx, y - dy, z)
                                                                                     && !walkable(x, y - dy, z))) {
                        return new Point3i(x, y, z);
                    }
                    if (jump(x + dx, y, z, x, y, z) != null || jump(x, y + dy, z, x, y, z) != null) {
                        return new Point3i(x, y, z);
                    }
                    if (!walkable(x + dx, y, z) && !walkable(x, y + dy, z)) {
                        return null;
                    }
                } else if (dx != 0) {
                    if ((walkable(x + dx, y + 1, z) && !walkable(x, y + 1, z)) || (walkable(x + dx, y - 1, z)
                                                                                   && !walkable(x, y - 1, z))) {
                        return new Point3i(x, y, z);
                    }
                } else {
                    if ((walkable(x + 1, y + dy, z) && !walkable(x + 1, y, z)) || (walkable(x - 1, y + dy, z)
                                                                                   && !walkable(x - 1, y, z))) {
                        return new Point3i(x, y, z);
                    }
                }
                x += dx;
                y += dy;
            }
        }

        private PathResult result(List<Point3i> path, List<Point3i> jumpPoints, Outcome outcome) {
            Set<Point3i> tested = new HashSet<>();
            if (trackJumps) {
                nodes.forEach(n -> {
                    if (n.isTested()) {
                        tested.add(n.toPoint());
                    }
                });
            }
            return new PathResult(path, jumpPoints, outcome, iterations, opened, tested);
        }

        private boolean walkable(int x, int y, int z) {
            return grid.isWalkableAt(x, y, z);
        }
    }
}
