package com.example.flowmutator.validation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds directed cycles with an iterative three-colour depth-first search.
 * <p>
 * An edge into a node that is still on the DFS path (grey) closes a cycle; the cycle is
 * the path slice from that node to the current one, in edge order. The same cycle found
 * from different start nodes is reported once (keys are compared after rotating the
 * smallest id to the front).
 * </p>
 */
final class CycleDetector {

    private enum Colour { WHITE, GREY, BLACK }

    private CycleDetector() {
    }

    /**
     * @param adjacency node id to successor ids; iteration order decides which rotation is reported
     * @return each distinct cycle as the node ids along it, without repeating the first node
     */
    static List<List<String>> findCycles(Map<String, List<String>> adjacency) {
        Map<String, Colour> colours = new HashMap<>();
        List<List<String>> cycles = new ArrayList<>();
        Set<List<String>> reported = new HashSet<>();

        for (String start : adjacency.keySet()) {
            if (colours.getOrDefault(start, Colour.WHITE) != Colour.WHITE) {
                continue;
            }
            List<String> path = new ArrayList<>();
            Deque<Iterator<String>> frames = new ArrayDeque<>();
            colours.put(start, Colour.GREY);
            path.add(start);
            frames.push(adjacency.getOrDefault(start, List.of()).iterator());

            while (!frames.isEmpty()) {
                Iterator<String> successors = frames.peek();
                if (!successors.hasNext()) {
                    frames.pop();
                    colours.put(path.remove(path.size() - 1), Colour.BLACK);
                    continue;
                }
                String next = successors.next();
                Colour colour = colours.getOrDefault(next, Colour.WHITE);
                if (colour == Colour.GREY) {
                    List<String> cycle = List.copyOf(path.subList(path.indexOf(next), path.size()));
                    if (reported.add(rotationKey(cycle))) {
                        cycles.add(cycle);
                    }
                } else if (colour == Colour.WHITE) {
                    colours.put(next, Colour.GREY);
                    path.add(next);
                    frames.push(adjacency.getOrDefault(next, List.of()).iterator());
                }
            }
        }
        return cycles;
    }

    static List<String> rotationKey(List<String> cycle) {
        int min = cycle.indexOf(Collections.min(cycle));
        List<String> rotated = new ArrayList<>(cycle.size());
        for (int i = 0; i < cycle.size(); i++) {
            rotated.add(cycle.get((min + i) % cycle.size()));
        }
        return rotated;
    }
}
