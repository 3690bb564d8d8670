/**
 * Shared numeric helpers.
 *
 * @since 1.0.0
 */
package com.rovertrend.core.util;
