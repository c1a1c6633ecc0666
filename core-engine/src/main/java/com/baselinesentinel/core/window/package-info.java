/**
 * Resolution of the current and historical comparison windows.
 *
 * @since 1.0.0
 */
package com.baselinesentinel.core.window;
