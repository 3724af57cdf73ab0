/**
 * Concurrent registry of named detectors.
 */
package com.streamdetect.core.registry;
