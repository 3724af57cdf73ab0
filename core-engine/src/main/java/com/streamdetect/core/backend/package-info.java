/**
 * Pluggable scoring backends.
 *
 * <p>
 * {@link com.streamdetect.core.backend.BackendAdapter} is the extension
 * point; {@link com.streamdetect.core.backend.BackendRegistry} maps names to
 * implementations. Every backend reports higher raw scores for more anomalous
 * rows and calibrates a raw threshold from its training scores.
 * </p>
 */
package com.streamdetect.core.backend;
