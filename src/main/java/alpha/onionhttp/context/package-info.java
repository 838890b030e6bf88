/**
 * The pooled request context, the response writer, and the two interfaces a
 * transport implements.
 */
package alpha.onionhttp.context;
