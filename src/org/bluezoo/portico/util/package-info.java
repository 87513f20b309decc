/**
 * Utilities shared by the other portico packages: percent-encoding,
 * stream reading and library-wide configuration.
 */
package org.bluezoo.portico.util;
