package com.vidnyan.depindex;

import com.vidnyan.depindex.application.port.in.DependencyQueryUseCase;
import com.vidnyan.depindex.application.port.out.GraphBackend;
import com.vidnyan.depindex.application.render.OutputFormat;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {
        "depindex.facts-dir=src/test/resources/facts",
        "depindex.index-file=target/test-index/_reverse_index.json"
})
class DepIndexApplicationTest {

    @Autowired
    DependencyQueryUseCase queries;

    @Autowired
    Optional<GraphBackend> graphBackend;

    @Test
    void contextLoads_AndAnswersQueries() {
        assertTrue(graphBackend.isPresent());

        assertEquals(List.of("app.service", "logging"), queries.directDependencies("main.py").modules());
        assertEquals(List.of("main.py"), queries.reverseDependencies("app/service.py"));
        assertEquals(List.of("app/service.py", "logging", "app/repository.py"),
                queries.transitiveDependencies("main.py", 2).orThrow());
        assertTrue(queries.cycles().orThrow().isEmpty());
        assertTrue(queries.render(queries.describe("main.py", false, 0), OutputFormat.TEXT)
                .contains("APP_ENV (default: dev)"));
    }
}
