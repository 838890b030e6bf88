/**
 * Handlers, handler chains, error handlers and built-in middleware.
 */
package alpha.onionhttp.handler;
