package com.davisodom.townsim.navigation;

import com.davisodom.townsim.TestWorlds;
import com.davisodom.townsim.model.WorldMap;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PathfinderTest {

    private Pathfinder pathfinder;
    private WorldMap grid;

    @BeforeEach
    void setUp() {
        pathfinder = new Pathfinder();
        grid = TestWorlds.grid3x3();
    }

    @Test
    @DisplayName("Straight line across an open grid")
    void testOpenGrid() {
        List<String> path = pathfinder.findPath(grid, "grid-1-0", "grid-1-2");

        assertEquals(List.of("grid-1-0", "grid-1-1", "grid-1-2"), path);
    }

    @Test
    @DisplayName("Detours around a blocked center")
    void testDetourAroundBlockedNode() {
        List<String> path = pathfinder.findPath(grid, "grid-1-0", "grid-1-2", Set.of("grid-1-1"));

        assertEquals(5, path.size(), "Detour should take 4 hops");
        assertEquals("grid-1-0", path.get(0));
        assertEquals("grid-1-2", path.get(path.size() - 1));
        assertFalse(path.contains("grid-1-1"), "Blocked node must not appear on the path");
        // First shortest path in neighbor order goes over the top row
        assertEquals(List.of("grid-1-0", "grid-0-0", "grid-0-1", "grid-0-2", "grid-1-2"), path);
    }

    @Test
    @DisplayName("Blocked column disconnects the grid")
    void testNoPathWhenDisconnected() {
        List<String> path = pathfinder.findPath(grid, "grid-1-0", "grid-1-2",
                Set.of("grid-0-1", "grid-1-1", "grid-2-1"));

        assertTrue(path.isEmpty());
    }

    @Test
    @DisplayName("Start equal to end returns the single node")
    void testStartEqualsEnd() {
        assertEquals(List.of("grid-2-2"), pathfinder.findPath(grid, "grid-2-2", "grid-2-2"));
    }

    @Test
    @DisplayName("Blocked destination returns no path")
    void testBlockedDestination() {
        assertTrue(pathfinder.findPath(grid, "grid-0-0", "grid-2-2", Set.of("grid-2-2")).isEmpty());
    }

    @Test
    @DisplayName("Unknown endpoints return no path")
    void testUnknownEndpoints() {
        assertTrue(pathfinder.findPath(grid, "grid-9-9", "grid-0-0").isEmpty());
        assertTrue(pathfinder.findPath(grid, "grid-0-0", "nowhere").isEmpty());
    }

    @Test
    @DisplayName("Path length is minimal in hops")
    void testShortestPath() {
        List<String> path = pathfinder.findPath(grid, "grid-0-0", "grid-2-2");

        assertEquals(5, path.size());
        for (int i = 1; i < path.size(); i++) {
            assertTrue(grid.getNode(path.get(i - 1)).getConnectedTo().contains(path.get(i)),
                    "Consecutive path nodes must be connected");
        }
    }
}
