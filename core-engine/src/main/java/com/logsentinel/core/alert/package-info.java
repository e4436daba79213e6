/**
 * Alert policy and record storage.
 *
 * @since 1.0.0
 */
package com.logsentinel.core.alert;
