package com.vidnyan.depindex;

import com.vidnyan.depindex.application.port.in.DependencyQueryUseCase;
import com.vidnyan.depindex.application.port.out.GraphBackend;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {
        "depindex.facts-dir=src/test/resources/facts",
        "depindex.index-file=target/test-index/_reverse_index.json",
        "depindex.graph.enabled=false"
})
class GraphDisabledApplicationTest {

    @Autowired
    DependencyQueryUseCase queries;

    @Autowired
    Optional<GraphBackend> graphBackend;

    @Test
    void graphQueriesShouldBeUnavailable() {
        assertTrue(graphBackend.isEmpty());
        assertFalse(queries.graphStats().isAvailable());
        assertEquals(List.of("app.service", "logging"), queries.directDependencies("main.py").modules());
    }
}
