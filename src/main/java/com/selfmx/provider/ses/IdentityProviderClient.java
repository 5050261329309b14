package com.selfmx.provider.ses;

/**
 * Sending identity provider.
 *
 * <p>Implementations must carry their own call timeouts.
 */
public interface IdentityProviderClient {

    /**
     * Registers a domain identity. Calling it again for an existing identity returns the
     * existing records.
     *
     * @param domain Lowercase domain name.
     * @return Identity reference and required DNS records.
     * @throws IdentityProviderException on provider failure.
     */
    IdentityProvisioning createIdentity(String domain) throws IdentityProviderException;

    /**
     * Checks whether the provider considers the domain verified.
     *
     * @param domain Domain name.
     * @return True once verified, false when pending or unknown.
     * @throws IdentityProviderException on provider failure.
     */
    boolean isVerified(String domain) throws IdentityProviderException;

    /**
     * Deletes the identity. Missing identities are ignored.
     *
     * @param domain Domain name.
     * @throws IdentityProviderException on provider failure.
     */
    void deleteIdentity(String domain) throws IdentityProviderException;

    /**
     * Checks whether the provider account may send.
     *
     * @return Boolean.
     * @throws IdentityProviderException on provider failure.
     */
    boolean isSendingEnabled() throws IdentityProviderException;
}
