/**
 * Collaborator contracts the detection engine consumes: the metric source,
 * the cluster inventory and the notification sink. Implementations live in
 * the runner module.
 *
 * @since 1.0.0
 */
package com.baselinesentinel.core.spi;
