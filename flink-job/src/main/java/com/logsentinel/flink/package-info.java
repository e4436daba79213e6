/**
 * Apache Flink streaming job for Log Sentinel.
 *
 * <p>
 * This package hosts the core classification pipeline in a single Flink
 * operator that consumes raw log lines from Kafka, stores every line, and
 * publishes alert records back to Kafka.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.logsentinel.flink.LogSentinelJob}: main entry point</li>
 * <li>{@link com.logsentinel.flink.ClassificationProcessFunction}: operator
 * hosting the pipeline</li>
 * <li>{@link com.logsentinel.flink.JobConfig}: environment-driven
 * configuration</li>
 * <li>{@link com.logsentinel.flink.ControlServer}: HTTP probes, statistics and
 * control commands</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.logsentinel.flink;
