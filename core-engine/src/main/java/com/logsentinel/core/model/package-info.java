/**
 * Domain model classes for Log Sentinel.
 *
 * <p>
 * This package contains the value types shared between the pipeline stages
 * and the Flink job layer:
 * </p>
 * <ul>
 * <li>{@link com.logsentinel.core.model.ParsedRecord}: one parsed log line</li>
 * <li>{@link com.logsentinel.core.model.ClassificationResult}: model output
 * for one message body</li>
 * <li>{@link com.logsentinel.core.model.LogEntry} and
 * {@link com.logsentinel.core.model.AlertRecord}: persisted records</li>
 * <li>{@link com.logsentinel.core.model.SystemStatus}: last reported service
 * status</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.logsentinel.core.model;
