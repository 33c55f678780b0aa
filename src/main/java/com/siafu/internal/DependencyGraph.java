package com.siafu.internal;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Cycle detection for job dependencies. Edges point from a job to the jobs it depends on;
 * names without a registered job have no outgoing edges.
 */
public final class DependencyGraph {

    private DependencyGraph() {
    }

    /**
     * Looks for a path from one of {@code dependencies} back to {@code jobName}.
     *
     * @param dependenciesOf returns the dependencies of an already registered job, or an empty set
     * @return the cycle as a list of names starting and ending with {@code jobName}, or empty if there is none
     */
    public static Optional<List<String>> findCycle(
            String jobName,
            Collection<String> dependencies,
            Function<String, Set<String>> dependenciesOf) {
        Set<String> visited = new HashSet<>();
        for (String dependency : dependencies) {
            Deque<String> path = new ArrayDeque<>();
            path.addLast(jobName);
            if (reaches(dependency, jobName, dependenciesOf, visited, path)) {
                return Optional.of(new ArrayList<>(path));
            }
        }
        return Optional.empty();
    }

    private static boolean reaches(
            String current,
            String target,
            Function<String, Set<String>> dependenciesOf,
            Set<String> visited,
            Deque<String> path) {
        path.addLast(current);
        if (current.equals(target)) {
            return true;
        }
        if (visited.add(current)) {
            for (String next : dependenciesOf.apply(current)) {
                if (reaches(next, target, dependenciesOf, visited, path)) {
                    return true;
                }
            }
        }
        path.removeLast();
        return false;
    }
}
