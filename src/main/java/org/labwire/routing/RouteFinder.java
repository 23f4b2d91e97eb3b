package org.labwire.routing;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.labwire.graph.StationGraph;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Finds node-disjoint paths from chosen sources to their terminal groups.
 *
 * <p>Each candidate source combination is tried in order. For one combination, every
 * (source, terminal group) pair contributes the product of the shortest simple paths to
 * each of its terminals. Pairs whose terminal groups overlap cannot be disjoint and are
 * merged first; the merged path groups are then combined and the first combination in
 * which no node is shared between groups wins.</p>
 */
final class RouteFinder {
    private static final Logger log = LogManager.getLogger(RouteFinder.class);

    private final RoutingGraphAdapter graph;
    private final int pathBound;

    RouteFinder(RoutingGraphAdapter graph, RouterConfig config) {
        this.graph = graph;
        this.pathBound = config.pathsPerPairBound();
    }

    /**
     * Returns the paths of the first feasible source combination, each ending at its terminal.
     *
     * @param sourceGroups candidate source combinations, each aligned with {@code terminalGroups}.
     */
    Optional<List<List<String>>> findPathsFor(List<List<String>> sourceGroups, List<List<String>> terminalGroups) {
        for (List<String> sources : sourceGroups) {
            Iterator<List<List<List<String>>>> routes = disjointPathsAmong(terminalGroups, sources);
            if (routes.hasNext()) {
                List<List<String>> paths = new ArrayList<>();
                for (List<List<String>> pathGroup : routes.next()) {
                    paths.addAll(pathGroup);
                }
                if (log.isDebugEnabled()) {
                    log.debug("Found the following paths: {}", paths);
                }
                return Optional.of(paths);
            }
        }
        return Optional.empty();
    }

    private Iterator<List<List<List<String>>>> disjointPathsAmong(List<List<String>> terminalGroups, List<String> sources) {
        List<Iterator<List<List<String>>>> pathGroupsPerPair = new ArrayList<>(sources.size());
        for (int i = 0; i < sources.size(); i++) {
            pathGroupsPerPair.add(shortestPathGroupsBetween(sources.get(i), terminalGroups.get(i)));
        }
        List<Iterator<List<List<String>>>> merged = mergeGroupsWithIntersectingTerminals(pathGroupsPerPair, terminalGroups);
        return new Filtered<>(new CartesianProduct<>(merged), RouteFinder::pathGroupsAreDisjoint);
    }

    /**
     * Path groups for one pair: one shortest-first path per terminal, in product order.
     */
    private Iterator<List<List<String>>> shortestPathGroupsBetween(String sourceId, List<String> terminalGroup) {
        StationGraph searchGraph = graph.makeSearchGraphFor(terminalGroup);
        List<Iterator<List<String>>> independentPaths = new ArrayList<>(terminalGroup.size());
        for (String terminalId : terminalGroup) {
            independentPaths.add(bounded(searchGraph.shortestPathsBetween(sourceId, terminalId), pathBound));
        }
        return new CartesianProduct<>(independentPaths);
    }

    private static List<Iterator<List<List<String>>>> mergeGroupsWithIntersectingTerminals(
            List<Iterator<List<List<String>>>> pathGroupsPerPair,
            List<List<String>> terminalGroups
    ) {
        DisjointPartition<Integer, String> partition = new DisjointPartition<>();
        for (int i = 0; i < terminalGroups.size(); i++) {
            partition.insert(new LinkedHashSet<>(terminalGroups.get(i)), i);
        }
        List<Iterator<List<List<String>>>> merged = new ArrayList<>(partition.size());
        for (List<Integer> indexes : partition.keys()) {
            List<Iterator<List<List<String>>>> folded = new ArrayList<>(indexes.size());
            for (int index : indexes) {
                folded.add(pathGroupsPerPair.get(index));
            }
            merged.add(new Flattened(new CartesianProduct<>(folded)));
        }
        return merged;
    }

    private static boolean pathGroupsAreDisjoint(List<List<List<String>>> pathGroups) {
        Set<String> seen = new HashSet<>();
        for (List<List<String>> paths : pathGroups) {
            Set<String> nodes = new HashSet<>();
            for (List<String> path : paths) {
                nodes.addAll(path);
            }
            for (String node : nodes) {
                if (!seen.add(node)) {
                    return false;
                }
            }
        }
        return true;
    }

    private static <T> Iterator<T> bounded(Iterator<T> source, int limit) {
        return new Iterator<>() {
            private int yielded;

            @Override
            public boolean hasNext() {
                return yielded < limit && source.hasNext();
            }

            @Override
            public T next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                yielded++;
                return source.next();
            }
        };
    }

    /**
     * Concatenates the path groups of merged pairs into one path group.
     */
    private static final class Flattened implements Iterator<List<List<String>>> {
        private final Iterator<List<List<List<String>>>> folded;

        Flattened(Iterator<List<List<List<String>>>> folded) {
            this.folded = folded;
        }

        @Override
        public boolean hasNext() {
            return folded.hasNext();
        }

        @Override
        public List<List<String>> next() {
            List<List<String>> paths = new ArrayList<>();
            for (List<List<String>> group : folded.next()) {
                paths.addAll(group);
            }
            return paths;
        }
    }

    private static final class Filtered<T> implements Iterator<T> {
        private final Iterator<T> source;
        private final Predicate<T> accept;
        private T next;

        Filtered(Iterator<T> source, Predicate<T> accept) {
            this.source = source;
            this.accept = accept;
        }

        @Override
        public boolean hasNext() {
            while (next == null && source.hasNext()) {
                T candidate = source.next();
                if (accept.test(candidate)) {
                    next = candidate;
                }
            }
            return next != null;
        }

        @Override
        public T next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            T value = next;
            next = null;
            return value;
        }
    }
}
