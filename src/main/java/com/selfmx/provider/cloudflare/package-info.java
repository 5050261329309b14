/**
 * DNS record publishing.
 *
 * <p>Cloudflare is the only supported provider. Without it records are published by hand.
 */
package com.selfmx.provider.cloudflare;
