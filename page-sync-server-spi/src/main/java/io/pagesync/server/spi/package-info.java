/**
 * Server-side extension points: operation persistence and the transport-neutral connection seam.
 */
package io.pagesync.server.spi;
