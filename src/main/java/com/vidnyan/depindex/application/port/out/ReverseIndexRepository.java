package com.vidnyan.depindex.application.port.out;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Port for persisting the reverse index between runs.
 */
public interface ReverseIndexRepository {

    /**
     * Load the persisted symbol map.
     * @return empty when nothing has been persisted
     * @throws com.vidnyan.depindex.domain.error.IndexCorruptException when the stored data cannot be parsed
     */
    Optional<Map<String, List<String>>> load();

    /**
     * Replace the persisted symbol map.
     */
    void save(Map<String, List<String>> index);

    /**
     * Remove persisted data, forcing a rebuild on next use.
     * @return true if something was deleted
     */
    boolean delete();

    String location();
}
