/**
 * The streaming detector state machine and the immutable model snapshot it
 * publishes on every (re)train.
 */
package com.streamdetect.core.detection;
