package com.vidnyan.depindex.application.port.out;

import com.vidnyan.depindex.domain.model.DependencyRecord;

import java.util.List;
import java.util.Optional;

/**
 * Port for reading fact records produced by the upstream extractor.
 * Implemented by adapters that read from files, databases, etc.
 */
public interface FactSource {

    /**
     * Read the record for one file. Empty when no record exists or it cannot be parsed.
     */
    Optional<DependencyRecord> read(String filePath);

    /**
     * Read every parseable record, in a stable order.
     */
    List<DependencyRecord> readAll();

    /**
     * Human-readable description of where records come from.
     */
    String location();
}
