/**
 * Orchestration of the per-stream analyses into one composite result, with
 * input validation and analysis callbacks.
 *
 * @since 1.0.0
 */
package com.rovertrend.core.analysis;
