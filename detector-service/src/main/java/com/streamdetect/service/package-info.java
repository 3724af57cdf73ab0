/**
 * Serving layer: owns the detector registry for the lifetime of the service
 * and implements the snake_case stream-ingest contract plus the management
 * operations (list, stats, reset, delete, save).
 */
package com.streamdetect.service;
