package com.phillippitts.adaptiveencoder.service.classify;

import com.phillippitts.adaptiveencoder.domain.Classification;
import com.phillippitts.adaptiveencoder.domain.ClassificationSource;
import com.phillippitts.adaptiveencoder.domain.OracleVerdict;

import java.util.Objects;

/**
 * Combines the technical label with an oracle verdict.
 *
 * <ol>
 *   <li>unknown verdict: technical label</li>
 *   <li>oracle more confident: oracle label</li>
 *   <li>labels agree: {@code min(95, avg + 10)}</li>
 *   <li>oracle at least 70 and technical below 70: oracle label</li>
 *   <li>otherwise: technical label</li>
 * </ol>
 */
public final class ClassificationMerger {

    static final int AGREEMENT_BONUS = 10;
    static final int AGREEMENT_CAP = 95;
    static final int STRONG_ORACLE = 70;

    private ClassificationMerger() {}

    /**
     * Whether the oracle should be asked at all.
     *
     * @param technical technical classification
     * @param highConfidence confidence at which the technical label is final
     * @param force caller forced an oracle lookup
     */
    public static boolean shouldConsultOracle(Classification technical, int highConfidence, boolean force) {
        return force || technical.confidence() < highConfidence;
    }

    public static Classification merge(Classification technical, OracleVerdict verdict) {
        Objects.requireNonNull(technical, "technical");
        if (verdict == null || verdict.isUnknown()) {
            return technical;
        }
        int tech = technical.confidence();
        int oracle = verdict.confidence();
        if (oracle > tech) {
            return Classification.of(verdict.type(), oracle, ClassificationSource.ORACLE);
        }
        if (verdict.type() == technical.type()) {
            int combined = Math.min(AGREEMENT_CAP, (tech + oracle) / 2 + AGREEMENT_BONUS);
            return Classification.of(technical.type(), combined, ClassificationSource.MERGED);
        }
        if (oracle >= STRONG_ORACLE && tech < STRONG_ORACLE) {
            return Classification.of(verdict.type(), oracle, ClassificationSource.ORACLE);
        }
        return technical;
    }
}
