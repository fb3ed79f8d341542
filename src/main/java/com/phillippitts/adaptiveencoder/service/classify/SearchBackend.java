package com.phillippitts.adaptiveencoder.service.classify;

import java.util.List;

/**
 * Text search used by {@link KeywordContentOracle}. Returns result snippets for a query.
 */
public interface SearchBackend {

    /**
     * @param query search query
     * @param title title the query was built from
     * @return result snippets, empty when nothing was found
     */
    List<String> search(String query, String title);
}
