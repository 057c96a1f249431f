/**
 * Configuration for the analysis engine.
 *
 * <p>
 * {@link com.rcasentinel.core.config.RcaSettingsLoader} reads start-up
 * settings from YAML. {@link com.rcasentinel.core.config.AnalysisConfig}
 * holds the two thresholds that may change while the engine runs.
 * </p>
 *
 * @since 1.0.0
 */
package com.rcasentinel.core.config;
