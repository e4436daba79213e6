/**
 * Log line parsing: format detection, field extraction and origin address
 * resolution.
 *
 * @since 1.0.0
 */
package com.logsentinel.core.parse;
