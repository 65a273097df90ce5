package com.civicdesk.backend.modules.authorization.domain;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Immutable role hierarchy. Edges point from a child role to the parents whose
 * permissions it inherits; the graph is always acyclic and levels are unique.
 * Every mutation returns a new graph, so closures memoized here never go stale.
 */
public final class RoleGraph {

    private static final RoleGraph EMPTY = new RoleGraph(Map.of());

    private final Map<String, RoleNode> roles;
    private final Map<String, Set<String>> closures = new ConcurrentHashMap<>();

    private RoleGraph(Map<String, RoleNode> roles) {
        this.roles = roles;
    }

    public static RoleGraph empty() {
        return EMPTY;
    }

    public static RoleGraph of(Collection<RoleNode> nodes) {
        Map<String, RoleNode> byCode = new LinkedHashMap<>();
        Map<Integer, String> byLevel = new HashMap<>();
        for (RoleNode node : nodes) {
            if (node.level() <= 0) {
                throw RbacViolation.INVALID_ROLE.exception(
                        "level of " + node.code() + " must be positive, got " + node.level());
            }
            if (byCode.putIfAbsent(node.code(), node) != null) {
                throw RbacViolation.DUPLICATE_ROLE.exception("role already exists: " + node.code());
            }
            String holder = byLevel.putIfAbsent(node.level(), node.code());
            if (holder != null) {
                throw RbacViolation.DUPLICATE_LEVEL.exception(
                        "level " + node.level() + " is already held by " + holder);
            }
        }
        for (RoleNode node : byCode.values()) {
            for (String parent : node.parents()) {
                if (!byCode.containsKey(parent)) {
                    throw RbacViolation.UNKNOWN_ROLE.exception("unknown parent role: " + parent);
                }
            }
        }
        detectCycle(byCode);
        return new RoleGraph(Collections.unmodifiableMap(byCode));
    }

    public boolean contains(String code) {
        return code != null && roles.containsKey(code);
    }

    public Optional<RoleNode> find(String code) {
        return Optional.ofNullable(code == null ? null : roles.get(code));
    }

    public RoleNode require(String code) {
        return find(code).orElseThrow(() -> RbacViolation.UNKNOWN_ROLE.exception("unknown role: " + code));
    }

    public int level(String code) {
        return require(code).level();
    }

    public boolean hasEdge(String child, String parent) {
        RoleNode node = roles.get(child);
        return node != null && node.parents().contains(parent);
    }

    /**
     * The role itself plus every transitive ancestor.
     */
    public Set<String> closure(String code) {
        require(code);
        Set<String> cached = closures.get(code);
        if (cached != null) {
            return cached;
        }
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(code);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (!visited.add(current)) {
                continue;
            }
            Set<String> known = closures.get(current);
            if (known != null && !current.equals(code)) {
                visited.addAll(known);
                continue;
            }
            queue.addAll(roles.get(current).parents());
        }
        Set<String> computed = Collections.unmodifiableSet(visited);
        Set<String> raced = closures.putIfAbsent(code, computed);
        return raced != null ? raced : computed;
    }

    public List<RoleNode> roles() {
        List<RoleNode> sorted = new ArrayList<>(roles.values());
        sorted.sort(Comparator.comparingInt(RoleNode::level).reversed());
        return sorted;
    }

    public RoleGraph withRole(RoleNode node) {
        if (roles.containsKey(node.code())) {
            throw RbacViolation.DUPLICATE_ROLE.exception("role already exists: " + node.code());
        }
        List<RoleNode> next = new ArrayList<>(roles.values());
        next.add(node);
        return of(next);
    }

    /**
     * Adds {@code child -> parent}. Returns this graph unchanged when the edge already exists.
     */
    public RoleGraph withEdge(String child, String parent) {
        RoleNode node = require(child);
        require(parent);
        if (node.parents().contains(parent)) {
            return this;
        }
        if (child.equals(parent)) {
            throw RbacViolation.CYCLE_DETECTED.exception("role cannot inherit from itself: " + child);
        }
        return of(replace(node.withParent(parent)));
    }

    public RoleGraph withoutEdge(String child, String parent) {
        RoleNode node = require(child);
        require(parent);
        if (!node.parents().contains(parent)) {
            throw RbacViolation.EDGE_NOT_FOUND.exception(child + " does not inherit from " + parent);
        }
        return of(replace(node.withoutParent(parent)));
    }

    private List<RoleNode> replace(RoleNode updated) {
        List<RoleNode> next = new ArrayList<>(roles.size());
        for (RoleNode existing : roles.values()) {
            next.add(existing.code().equals(updated.code()) ? updated : existing);
        }
        return next;
    }

    private static void detectCycle(Map<String, RoleNode> byCode) {
        Map<String, Mark> marks = new HashMap<>();
        for (String code : byCode.keySet()) {
            if (!marks.containsKey(code)) {
                Deque<String> path = new ArrayDeque<>();
                visit(code, byCode, marks, path);
            }
        }
    }

    private static void visit(String code, Map<String, RoleNode> byCode, Map<String, Mark> marks, Deque<String> path) {
        marks.put(code, Mark.IN_PROGRESS);
        path.addLast(code);
        for (String parent : byCode.get(code).parents()) {
            Mark mark = marks.get(parent);
            if (mark == Mark.IN_PROGRESS) {
                List<String> cycle = new ArrayList<>();
                boolean inCycle = false;
                for (String step : path) {
                    inCycle = inCycle || step.equals(parent);
                    if (inCycle) {
                        cycle.add(step);
                    }
                }
                cycle.add(parent);
                throw RbacViolation.CYCLE_DETECTED.exception("inheritance cycle: " + String.join(" -> ", cycle));
            }
            if (mark == null) {
                visit(parent, byCode, marks, path);
            }
        }
        path.removeLast();
        marks.put(code, Mark.DONE);
    }

    private enum Mark {
        IN_PROGRESS,
        DONE
    }
}
