/**
 * Classification stage: the model interface, its HTTP client and the
 * dispatcher that applies per-record side effects.
 *
 * @since 1.0.0
 */
package com.logsentinel.core.classify;
