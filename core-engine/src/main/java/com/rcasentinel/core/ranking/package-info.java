/**
 * Root-cause ranking: confidence scoring and human-readable descriptions.
 */
package com.rcasentinel.core.ranking;
