/**
 * Route patterns and the per-method prefix tree that matches request paths.
 */
package alpha.onionhttp.route;
