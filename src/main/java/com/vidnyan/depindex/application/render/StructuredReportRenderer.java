package com.vidnyan.depindex.application.render;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.depindex.application.port.in.DependencyQueryUseCase.DependencyReport;
import com.vidnyan.depindex.application.port.in.DependencyQueryUseCase.GraphQueryResult;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Full machine-readable JSON dump, snake_case like the fact records themselves.
 */
@Component
public class StructuredReportRenderer implements ReportRenderer {

    private final ObjectMapper mapper;

    public StructuredReportRenderer(ObjectMapper objectMapper) {
        this.mapper = objectMapper.copy()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, false);
    }

    @Override
    public OutputFormat format() {
        return OutputFormat.STRUCTURED;
    }

    @Override
    public String render(DependencyReport report) {
        Map<String, Object> dump = new LinkedHashMap<>();
        dump.put("file_path", report.filePath());
        dump.put("dependencies", report.record());
        dump.put("reverse_dependencies", report.reverseDependencies());
        dump.put("transitive_dependencies", report.transitiveDependencies());
        dump.put("transitive_depth", report.transitiveDepth());
        return write(dump);
    }

    @Override
    public String render(GraphQueryResult<?> result) {
        Map<String, Object> dump = new LinkedHashMap<>();
        dump.put("query", result.query().name().toLowerCase(Locale.ROOT));
        dump.put("subject", result.subject());
        dump.put("status", result.status().name().toLowerCase(Locale.ROOT));
        if (result.isAvailable()) {
            dump.put("result", result.value());
        } else {
            dump.put("message", result.message());
        }
        return write(dump);
    }

    private String write(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
