/**
 * Analysis orchestration.
 *
 * <p>
 * {@link com.rcasentinel.core.analysis.RcaCoordinator} wires detection,
 * correlation, ranking and summarization into a single call and is the entry
 * point for embedding the engine. The summarizer is an optional collaborator;
 * {@link com.rcasentinel.core.analysis.FallbackSummary} covers its absence
 * and its failures.
 * </p>
 *
 * @since 1.0.0
 */
package com.rcasentinel.core.analysis;
