package com.phillippitts.adaptiveencoder.service.classify;

import com.phillippitts.adaptiveencoder.domain.OracleVerdict;

/**
 * Advisory content classifier keyed on title metadata.
 *
 * <p>Implementations may consult an external search service. An oracle that cannot answer either
 * returns {@link OracleVerdict#unknown()} or throws
 * {@link com.phillippitts.adaptiveencoder.exception.ClassificationException}; the caller treats
 * both the same way.
 */
public interface ContentOracle {

    /**
     * @param title cleaned title
     * @param year release year, or null
     * @param series whether the title is a series episode
     * @return advisory verdict, never null
     */
    OracleVerdict classify(String title, Integer year, boolean series);
}
