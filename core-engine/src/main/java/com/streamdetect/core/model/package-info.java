/**
 * Value types shared by the detection engine and the serving layer.
 *
 * <ul>
 * <li>{@link com.streamdetect.core.model.Record}: immutable ingested
 * record</li>
 * <li>{@link com.streamdetect.core.model.DetectionResult}: per-record
 * outcome</li>
 * <li>{@link com.streamdetect.core.model.IngestResult}: per-call
 * outcome</li>
 * <li>{@link com.streamdetect.core.model.DetectorStats}: management
 * view of a detector</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.streamdetect.core.model;
