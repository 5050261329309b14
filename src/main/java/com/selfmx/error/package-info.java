/**
 * Error taxonomy shared by services and HTTP handlers.
 *
 * <p>Every failure returned to a caller has the shape
 * <pre>{"error":{"code":"domain_exists","message":"Domain already exists"}}</pre>
 */
package com.selfmx.error;
