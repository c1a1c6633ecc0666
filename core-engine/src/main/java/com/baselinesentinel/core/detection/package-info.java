/**
 * Breach detection, baseline comparison and the configured checks built on
 * them.
 *
 * <p>
 * New check kinds are registered in
 * {@link com.baselinesentinel.core.detection.CheckFactory}.
 * </p>
 */
package com.baselinesentinel.core.detection;
