/**
 * Exceptions raised by the detection engine.
 *
 * <p>
 * All of them are unchecked and extend {@link IllegalArgumentException} for
 * caller mistakes (bad configuration, unknown backend, schema mismatch, unknown
 * detector) or {@link IllegalStateException} for conditions of the detector
 * itself (insufficient data, failed fit, duplicate id).
 * </p>
 *
 * @since 1.0.0
 */
package com.streamdetect.core.error;
