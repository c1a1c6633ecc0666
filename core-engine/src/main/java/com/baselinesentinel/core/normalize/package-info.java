/**
 * Turns raw labelled series into per-entity histograms or gauge tracks.
 */
package com.baselinesentinel.core.normalize;
