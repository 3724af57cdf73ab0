/**
 * Score normalization and threshold resolution.
 */
package com.streamdetect.core.normalize;
