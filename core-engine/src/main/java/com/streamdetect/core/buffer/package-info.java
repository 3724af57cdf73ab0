/**
 * Bounded record history and derived time-series features (rolling
 * statistics and lags).
 */
package com.streamdetect.core.buffer;
