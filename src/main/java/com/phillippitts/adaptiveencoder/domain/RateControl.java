package com.phillippitts.adaptiveencoder.domain;

/**
 * Rate-control arguments of one pass. Exactly one of {@code crf} or {@code targetKbps} is set.
 *
 * @param crf CRF value for quality-driven passes, else null
 * @param targetKbps average bitrate target, else null
 * @param minrateKbps pinned minimum rate (CBR only), else null
 * @param maxrateKbps pinned maximum rate (CBR only), else null
 * @param bufsizeKbps VBV buffer size (CBR only), else null
 */
public record RateControl(Double crf, Integer targetKbps, Integer minrateKbps, Integer maxrateKbps,
                          Integer bufsizeKbps) {

    public RateControl {
        if ((crf == null) == (targetKbps == null)) {
            throw new IllegalArgumentException("Exactly one of crf or targetKbps must be set");
        }
    }

    public static RateControl crf(double crf) {
        return new RateControl(crf, null, null, null, null);
    }

    public static RateControl average(int targetKbps) {
        return new RateControl(null, targetKbps, null, null, null);
    }

    /**
     * Constant bitrate: {@code minrate = maxrate = B}, {@code bufsize = round(1.5 * B)}.
     */
    public static RateControl constant(int targetKbps) {
        int bufsize = (int) Math.round(targetKbps * 1.5);
        return new RateControl(null, targetKbps, targetKbps, targetKbps, bufsize);
    }

    public boolean isQualityDriven() {
        return crf != null;
    }

    public boolean isConstrained() {
        return minrateKbps != null;
    }
}
