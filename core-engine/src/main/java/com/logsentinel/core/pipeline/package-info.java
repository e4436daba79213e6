/**
 * Composition of the processing stages and the administrative control
 * commands.
 *
 * @since 1.0.0
 */
package com.logsentinel.core.pipeline;
