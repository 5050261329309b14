/**
 * Direct DNS verification with dnsjava.
 *
 * <p>Results are advisory: they annotate which records are live but never change a
 * domain's status.
 */
package com.selfmx.provider.dns;
