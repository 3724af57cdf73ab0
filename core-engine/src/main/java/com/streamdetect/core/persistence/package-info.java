/**
 * Persisted form of trained detectors and a file-based JSON store.
 */
package com.streamdetect.core.persistence;
