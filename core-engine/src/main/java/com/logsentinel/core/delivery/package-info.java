/**
 * Outbound delivery to the remote collector, the collector's ingest side and
 * the live feed.
 *
 * @since 1.0.0
 */
package com.logsentinel.core.delivery;
