package com.architecture.memory.codegraph.service.graph.query;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Tarjan's strongly connected components over a directed graph of string ids, O(V+E).
 * Iterative, so deep graphs do not overflow the stack.
 *
 * Output is deterministic: nodes and successors are visited in id order, each component is
 * listed in DFS preorder from its smallest id (restricted to the component), and components
 * are sorted by that first id.
 */
public final class StronglyConnectedComponents {

    private final Map<String, SortedSet<String>> adjacency = new TreeMap<>();

    private final Map<String, Integer> index = new HashMap<>();
    private final Map<String, Integer> lowLink = new HashMap<>();
    private final Deque<String> stack = new ArrayDeque<>();
    private final Set<String> onStack = new HashSet<>();
    private int nextIndex;

    private StronglyConnectedComponents(Map<String, ? extends Collection<String>> graph) {
        graph.forEach((node, successors) -> {
            adjacency.computeIfAbsent(node, k -> new TreeSet<>()).addAll(successors);
            for (String successor : successors) {
                adjacency.computeIfAbsent(successor, k -> new TreeSet<>());
            }
        });
    }

    /**
     * All components with more than one member, each in canonical order.
     */
    public static List<List<String>> findCycles(Map<String, ? extends Collection<String>> graph) {
        StronglyConnectedComponents scc = new StronglyConnectedComponents(graph);
        List<List<String>> cycles = new ArrayList<>();
        for (Set<String> component : scc.components()) {
            if (component.size() > 1) {
                cycles.add(scc.canonicalOrder(component));
            }
        }
        cycles.sort((a, b) -> a.get(0).compareTo(b.get(0)));
        return cycles;
    }

    private List<Set<String>> components() {
        List<Set<String>> components = new ArrayList<>();
        for (String node : adjacency.keySet()) {
            if (!index.containsKey(node)) {
                strongConnect(node, components);
            }
        }
        return components;
    }

    private void strongConnect(String root, List<Set<String>> components) {
        Deque<Frame> callStack = new ArrayDeque<>();
        visit(root);
        callStack.push(new Frame(root, adjacency.get(root).iterator()));

        while (!callStack.isEmpty()) {
            Frame frame = callStack.peek();
            if (frame.successors.hasNext()) {
                String successor = frame.successors.next();
                if (!index.containsKey(successor)) {
                    visit(successor);
                    callStack.push(new Frame(successor, adjacency.get(successor).iterator()));
                } else if (onStack.contains(successor)) {
                    lowLink.put(frame.node, Math.min(lowLink.get(frame.node), index.get(successor)));
                }
                continue;
            }

            callStack.pop();
            if (!callStack.isEmpty()) {
                String parent = callStack.peek().node;
                lowLink.put(parent, Math.min(lowLink.get(parent), lowLink.get(frame.node)));
            }
            if (lowLink.get(frame.node).equals(index.get(frame.node))) {
                Set<String> component = new TreeSet<>();
                String member;
                do {
                    member = stack.pop();
                    onStack.remove(member);
                    component.add(member);
                } while (!member.equals(frame.node));
                components.add(component);
            }
        }
    }

    private void visit(String node) {
        index.put(node, nextIndex);
        lowLink.put(node, nextIndex);
        nextIndex++;
        stack.push(node);
        onStack.add(node);
    }

    private List<String> canonicalOrder(Set<String> component) {
        List<String> order = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        Deque<String> pending = new ArrayDeque<>();
        pending.push(((TreeSet<String>) component).first());
        while (!pending.isEmpty()) {
            String node = pending.pop();
            if (!seen.add(node)) {
                continue;
            }
            order.add(node);
            // reverse so the smallest successor is visited first
            List<String> successors = new ArrayList<>(adjacency.get(node));
            for (int i = successors.size() - 1; i >= 0; i--) {
                String successor = successors.get(i);
                if (component.contains(successor) && !seen.contains(successor)) {
                    pending.push(successor);
                }
            }
        }
        return order;
    }

    private static final class Frame {
        private final String node;
        private final Iterator<String> successors;

        private Frame(String node, Iterator<String> successors) {
            this.node = node;
            this.successors = successors;
        }
    }
}
