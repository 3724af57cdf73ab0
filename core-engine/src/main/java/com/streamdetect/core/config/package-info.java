/**
 * Detector and engine configuration, including YAML loading.
 */
package com.streamdetect.core.config;
