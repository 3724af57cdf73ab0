/**
 * Record encoding: schema handling, per-field encoding strategies and the
 * immutable {@link com.streamdetect.core.encoding.FeatureEncoder} that a
 * detector pairs with each trained model.
 */
package com.streamdetect.core.encoding;
