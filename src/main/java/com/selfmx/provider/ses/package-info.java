/**
 * AWS SES integration.
 *
 * <p>{@link com.selfmx.provider.ses.IdentityProviderClient} provisions and verifies domain
 * identities; {@link com.selfmx.provider.ses.EmailSender} delivers outbound mail.
 */
package com.selfmx.provider.ses;
