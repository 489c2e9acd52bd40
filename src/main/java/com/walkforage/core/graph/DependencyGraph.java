package com.walkforage.core.graph;

import java.util.*;
import java.util.function.Function;

/**
 * Static prerequisite graph over content definitions (technologies, craftables).
 *
 * The node list in declaration order is the source of truth; the id map is derived from it
 * once at construction. Nothing here mutates after construction: the "unlocked" or "owned"
 * set is always supplied by the caller.
 *
 * Edges point from a node to its direct prerequisites. Prerequisite ids that do not resolve
 * to a node are kept as-is; they never satisfy anything and are reported by the content validator.
 *
 * @param <T> node definition type
 */
public final class DependencyGraph<T> {

    private final String label;
    private final List<T> nodes;
    private final Map<String, T> byId;
    private final Map<String, List<String>> edges;
    private final Function<T, String> idOf;

    public DependencyGraph(String label,
                           Collection<T> definitions,
                           Function<T, String> idOf,
                           Function<T, List<String>> prerequisitesOf) {
        this.label = (label != null) ? label : "graph";
        this.idOf = Objects.requireNonNull(idOf, "idOf");
        Objects.requireNonNull(prerequisitesOf, "prerequisitesOf");

        List<T> ordered = new ArrayList<>();
        Map<String, T> ids = new LinkedHashMap<>();
        Map<String, List<String>> e = new HashMap<>();

        if (definitions != null) {
            for (T def : definitions) {
                if (def == null) continue;
                String id = idOf.apply(def);
                if (id == null || id.isBlank()) continue;
                if (ids.putIfAbsent(id, def) != null) {
                    throw new IllegalArgumentException("[" + this.label + "] duplicate id: " + id);
                }
                ordered.add(def);

                List<String> prereqs = prerequisitesOf.apply(def);
                e.put(id, (prereqs != null) ? List.copyOf(new LinkedHashSet<>(prereqs)) : List.of());
            }
        }

        this.nodes = List.copyOf(ordered);
        this.byId = Collections.unmodifiableMap(ids);
        this.edges = Collections.unmodifiableMap(e);
    }

    public String getLabel() {
        return label;
    }

    public int size() {
        return nodes.size();
    }

    // ==========================================================
    // LOOKUP
    // ==========================================================

    public T get(String id) {
        if (id == null) return null;
        return byId.get(id);
    }

    public boolean contains(String id) {
        return id != null && byId.containsKey(id);
    }

    /** All definitions in declaration order. */
    public List<T> getAll() {
        return nodes;
    }

    public List<String> getIds() {
        return List.copyOf(byId.keySet());
    }

    /** Direct prerequisites in declaration order; empty for an unknown id. */
    public List<String> getPrerequisites(String id) {
        if (id == null) return List.of();
        return edges.getOrDefault(id, List.of());
    }

    /** Ids of nodes with no prerequisites, declaration order. */
    public List<String> getRoots() {
        List<String> out = new ArrayList<>();
        for (T n : nodes) {
            String id = idOf.apply(n);
            if (getPrerequisites(id).isEmpty()) out.add(id);
        }
        return out;
    }

    // ==========================================================
    // QUERIES
    // ==========================================================

    /**
     * True iff the node is not yet in {@code unlocked} and every direct prerequisite is.
     *
     * @return {@code null} for an id that is not part of this graph
     */
    public Boolean isAvailable(String id, Set<String> unlocked) {
        if (!contains(id)) return null;
        Set<String> have = (unlocked != null) ? unlocked : Set.of();
        if (have.contains(id)) return false;
        return have.containsAll(getPrerequisites(id));
    }

    /**
     * Ids of every available node, in declaration order.
     */
    public List<String> availableSet(Set<String> unlocked) {
        List<String> out = new ArrayList<>();
        for (T n : availableNodes(unlocked)) out.add(idOf.apply(n));
        return out;
    }

    public List<T> availableNodes(Set<String> unlocked) {
        List<T> out = new ArrayList<>();
        for (T n : nodes) {
            if (Boolean.TRUE.equals(isAvailable(idOf.apply(n), unlocked))) out.add(n);
        }
        return out;
    }

    /**
     * Direct prerequisites not yet in {@code unlocked}, declaration order. Empty for an unknown id.
     */
    public List<String> missingPrerequisites(String id, Set<String> unlocked) {
        Set<String> have = (unlocked != null) ? unlocked : Set.of();
        List<String> out = new ArrayList<>();
        for (String p : getPrerequisites(id)) {
            if (!have.contains(p)) out.add(p);
        }
        return out;
    }

    /**
     * Every direct and indirect prerequisite of {@code id}, breadth-first, each listed once.
     * The node itself is only listed if it sits on a cycle. Empty for a root or an unknown id.
     */
    public List<String> transitiveClosure(String id) {
        if (!contains(id)) return List.of();

        Set<String> seen = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>(getPrerequisites(id));

        while (!queue.isEmpty()) {
            String cur = queue.poll();
            if (!seen.add(cur)) continue;
            for (String p : getPrerequisites(cur)) {
                if (!seen.contains(p)) queue.add(p);
            }
        }
        return new ArrayList<>(seen);
    }

    // ==========================================================
    // VALIDATION (content-load time only)
    // ==========================================================

    /**
     * Iterative depth-first walk from every node, with an on-stack marker to detect back edges
     * and a done marker so each node is expanded once.
     *
     * @return ids of the nodes on detected cycles, in discovery order; empty when acyclic
     */
    public List<String> validateAcyclic() {
        Set<String> done = new HashSet<>();
        Set<String> onStack = new HashSet<>();
        Set<String> offending = new LinkedHashSet<>();

        for (T root : nodes) {
            String rootId = idOf.apply(root);
            if (done.contains(rootId)) continue;

            Deque<Frame> stack = new ArrayDeque<>();
            List<String> path = new ArrayList<>();
            stack.push(new Frame(rootId));
            onStack.add(rootId);
            path.add(rootId);

            while (!stack.isEmpty()) {
                Frame top = stack.peek();
                List<String> prereqs = getPrerequisites(top.id);

                if (top.next < prereqs.size()) {
                    String p = prereqs.get(top.next++);
                    if (!contains(p) || done.contains(p)) continue;

                    if (onStack.contains(p)) {
                        offending.addAll(path.subList(path.indexOf(p), path.size()));
                        continue;
                    }
                    stack.push(new Frame(p));
                    onStack.add(p);
                    path.add(p);
                } else {
                    stack.pop();
                    onStack.remove(top.id);
                    path.remove(path.size() - 1);
                    done.add(top.id);
                }
            }
        }
        return new ArrayList<>(offending);
    }

    private static final class Frame {
        final String id;
        int next;

        Frame(String id) {
            this.id = id;
        }
    }

    @Override
    public String toString() {
        return "DependencyGraph[" + label + ", " + nodes.size() + " nodes]";
    }
}
