/**
 * The engine, its configuration and the router API.<p>
 * 
 * Start with {@link alpha.onionhttp.Engine}.
 */
package alpha.onionhttp;
