/**
 * Relationships between metrics: aligned Pearson correlation graph, lagged
 * causality screen, cross-correlation and partial correlation.
 *
 * @since 1.0.0
 */
package com.rcasentinel.core.correlation;
