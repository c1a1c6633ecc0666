/**
 * YAML configuration model and loader.
 *
 * <p>
 * {@link com.baselinesentinel.core.config.ConfigLoader} parses
 * {@link com.baselinesentinel.core.config.SentinelConfig} with SnakeYAML and
 * validates it before anything is built from it.
 * </p>
 */
package com.baselinesentinel.core.config;
