/**
 * Batch command-line runner: reads a series file, runs the configured
 * detection profiles and writes a JSON report.
 *
 * @since 1.0.0
 */
package com.changesentinel.runner;
