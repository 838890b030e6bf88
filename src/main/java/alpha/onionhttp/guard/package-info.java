/**
 * Rate limiters and a short-lived cache, consumed by middleware.
 */
package alpha.onionhttp.guard;
