/**
 * YAML configuration of the pipeline tunables.
 *
 * <p>
 * {@link com.logsentinel.core.config.SettingsLoader} reads
 * {@code pipeline.yml} into {@link com.logsentinel.core.config.SentinelSettings}
 * and validates it before anything is built.
 * </p>
 *
 * @since 1.0.0
 */
package com.logsentinel.core.config;
