/**
 * Numeric helpers built on Apache Commons Math: descriptive statistics,
 * Pearson significance, OLS residuals and the augmented Dickey-Fuller test.
 */
package com.rcasentinel.core.stats;
