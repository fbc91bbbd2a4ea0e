package com.modelforge.generator.codegen.validation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.modelforge.generator.codegen.model.input.Model;
import com.modelforge.generator.codegen.model.input.Relationship;

/**
 * Finds circular references in the model graph.
 *
 * Models are nodes and relationships directed edges. Edges towards models that do not exist are ignored here;
 * they are referential errors, reported elsewhere. Every elementary cycle is reported exactly once, rooted at
 * its earliest model in input order, so a cycle through A and B is reported as {@code "A -> B -> A"} and never
 * again as {@code "B -> A -> B"}.
 *
 * The search is Johnson's: from each start it only walks the strongly connected component the start shares with
 * later models, and blocks models that cannot lead back to the start. Time is linear in the number of cycles
 * found, so acyclic graphs of any density finish quickly.
 */
public class CycleDetector {

    private static final Logger log = LoggerFactory.getLogger(CycleDetector.class);

    static final int MAX_REPORTED_CYCLES = 1000;

    public List<String> findCycles(List<Model> models) {
        Map<String, Set<String>> graph = buildGraph(models);
        List<String> nodes = new ArrayList<>(graph.keySet());

        List<String> cycles = new ArrayList<>();
        for (int i = 0; i < nodes.size(); i++) {
            String start = nodes.get(i);
            Set<String> component = componentOf(start, graph, new HashSet<>(nodes.subList(i, nodes.size())));
            if (component.size() == 1 && !graph.get(start).contains(start)) {
                continue;
            }
            new Search(start, graph, component, cycles).circuit(start);
            if (cycles.size() >= MAX_REPORTED_CYCLES) {
                log.warn("Stopped cycle search after {} cycles", MAX_REPORTED_CYCLES);
                break;
            }
        }
        return cycles;
    }

    /**
     * Models reachable from {@code start} that can also reach it back, using only models in {@code allowed}.
     */
    private Set<String> componentOf(String start, Map<String, Set<String>> graph, Set<String> allowed) {
        Set<String> forward = reachable(start, graph, allowed);
        Map<String, Set<String>> reversed = new HashMap<>();
        graph.forEach((from, targets) -> targets.forEach(
                to -> reversed.computeIfAbsent(to, k -> new LinkedHashSet<>()).add(from)));
        Set<String> backward = reachable(start, reversed, allowed);
        forward.retainAll(backward);
        return forward;
    }

    private Set<String> reachable(String start, Map<String, Set<String>> graph, Set<String> allowed) {
        Set<String> seen = new HashSet<>();
        Deque<String> pending = new ArrayDeque<>();
        seen.add(start);
        pending.push(start);
        while (!pending.isEmpty()) {
            for (String next : graph.getOrDefault(pending.pop(), Set.of())) {
                if (allowed.contains(next) && seen.add(next)) {
                    pending.push(next);
                }
            }
        }
        return seen;
    }

    private Map<String, Set<String>> buildGraph(List<Model> models) {
        Map<String, Set<String>> graph = new LinkedHashMap<>();
        for (Model model : models) {
            if (model != null && model.getName() != null) {
                graph.putIfAbsent(model.getName(), new LinkedHashSet<>());
            }
        }
        for (Model model : models) {
            if (model == null || model.getName() == null) {
                continue;
            }
            for (Relationship relationship : model.getRelationships()) {
                if (relationship != null && graph.containsKey(relationship.getTargetModel())) {
                    graph.get(model.getName()).add(relationship.getTargetModel());
                }
            }
        }
        return graph;
    }

    /**
     * Circuit enumeration from one start inside its component.
     */
    private static final class Search {

        private final String start;
        private final Map<String, Set<String>> graph;
        private final Set<String> component;
        private final List<String> cycles;

        private final Deque<String> path = new ArrayDeque<>();
        private final Set<String> blocked = new HashSet<>();
        private final Map<String, Set<String>> blockedBy = new HashMap<>();

        Search(String start, Map<String, Set<String>> graph, Set<String> component, List<String> cycles) {
            this.start = start;
            this.graph = graph;
            this.component = component;
            this.cycles = cycles;
        }

        boolean circuit(String current) {
            boolean closed = false;
            path.addLast(current);
            blocked.add(current);
            for (String next : graph.get(current)) {
                if (cycles.size() >= MAX_REPORTED_CYCLES) {
                    break;
                }
                if (!component.contains(next)) {
                    continue;
                }
                if (next.equals(start)) {
                    cycles.add(String.join(" -> ", path) + " -> " + start);
                    closed = true;
                } else if (!blocked.contains(next) && circuit(next)) {
                    closed = true;
                }
            }
            if (closed) {
                unblock(current);
            } else {
                for (String next : graph.get(current)) {
                    if (component.contains(next)) {
                        blockedBy.computeIfAbsent(next, k -> new HashSet<>()).add(current);
                    }
                }
            }
            path.removeLast();
            return closed;
        }

        private void unblock(String model) {
            blocked.remove(model);
            Set<String> waiting = blockedBy.remove(model);
            if (waiting != null) {
                for (String other : waiting) {
                    if (blocked.contains(other)) {
                        unblock(other);
                    }
                }
            }
        }
    }
}
