package com.vidnyan.depindex.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.depindex.DepIndexProperties;
import com.vidnyan.depindex.application.port.out.FactSource;
import com.vidnyan.depindex.application.port.out.ReverseIndexRepository;
import com.vidnyan.depindex.application.render.ReportRenderer;
import com.vidnyan.depindex.application.service.RecordStore;
import com.vidnyan.depindex.application.service.ReverseIndexManager;
import com.vidnyan.depindex.domain.model.ModulePaths;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Spring configuration for the dependency index.
 * Wires the framework-free services to their adapters.
 */
@Slf4j
@Configuration
public class DepIndexConfiguration {

    /**
     * ObjectMapper for fact records, the persisted index and structured output.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true)
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    }

    @Bean
    public ModulePaths modulePaths(DepIndexProperties properties) {
        return properties.modulePaths();
    }

    @Bean
    public RecordStore recordStore(FactSource factSource, ModulePaths modulePaths, DepIndexProperties properties) {
        return new RecordStore(factSource, modulePaths, properties.getCache().getMaxEntries());
    }

    @Bean
    public ReverseIndexManager reverseIndexManager(
            FactSource factSource, ReverseIndexRepository repository, ModulePaths modulePaths) {
        return new ReverseIndexManager(factSource, repository, modulePaths);
    }

    /**
     * Log available renderers on startup.
     */
    @Bean
    public String logRenderers(List<ReportRenderer> renderers) {
        log.info("Registered {} output formats:", renderers.size());
        renderers.forEach(r -> log.info("  - {}", r.format()));
        return "renderers-logged";
    }
}
