/**
 * Immutable value types of the encoding decision engine.
 *
 * <p>Records validate their invariants in compact constructors (score within [10,100],
 * CRF within [15,28], pass plans shaped per mode) so that an out-of-range value cannot travel
 * between components. {@link com.phillippitts.adaptiveencoder.domain.RunContext} is the only
 * mutable-resource holder and is scoped to a single run.
 *
 * @since 1.0
 */
package com.phillippitts.adaptiveencoder.domain;
