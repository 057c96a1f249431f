/**
 * Apache Flink streaming job for RCA Sentinel.
 *
 * <p>
 * This package wires the core analysis engine into a Flink pipeline that
 * consumes metric samples from Kafka, analyses tumbling event-time windows
 * per scope, and publishes analysis results back to Kafka.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.rcasentinel.flink.RcaStreamingJob} - main entry point</li>
 * <li>{@link com.rcasentinel.flink.RcaWindowFunction} - per-window
 * analysis</li>
 * <li>{@link com.rcasentinel.flink.JobConfig} - environment-driven
 * configuration</li>
 * <li>{@link com.rcasentinel.flink.HealthServer} - HTTP health, readiness
 * and threshold endpoints</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.rcasentinel.flink;
