package com.siafu.internal;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class DependencyGraphTest {

    private final Map<String, Set<String>> registered = Map.of(
            "load", Set.of("transform"),
            "transform", Set.of("extract"),
            "extract", Set.of(),
            "report", Set.of("load", "unknown"));

    @Test
    void shouldAcceptAcyclicGraph() {
        assertThat(DependencyGraph.findCycle("publish", Set.of("report", "load"), this::dependenciesOf)).isEmpty();
    }

    @Test
    void shouldFindCycleThroughRegisteredJobs() {
        assertThat(DependencyGraph.findCycle("extract", Set.of("report"), this::dependenciesOf))
                .contains(List.of("extract", "report", "load", "transform", "extract"));
    }

    @Test
    void shouldFindSelfDependency() {
        assertThat(DependencyGraph.findCycle("solo", Set.of("solo"), this::dependenciesOf))
                .contains(List.of("solo", "solo"));
    }

    private Set<String> dependenciesOf(String name) {
        return registered.getOrDefault(name, Set.of());
    }
}
