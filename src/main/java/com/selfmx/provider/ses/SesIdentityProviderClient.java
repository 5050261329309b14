package com.selfmx.provider.ses;

import com.selfmx.gateway.domain.DnsRecord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.sesv2.SesV2Client;
import software.amazon.awssdk.services.sesv2.model.AlreadyExistsException;
import software.amazon.awssdk.services.sesv2.model.CreateEmailIdentityRequest;
import software.amazon.awssdk.services.sesv2.model.CreateEmailIdentityResponse;
import software.amazon.awssdk.services.sesv2.model.DeleteEmailIdentityRequest;
import software.amazon.awssdk.services.sesv2.model.DkimAttributes;
import software.amazon.awssdk.services.sesv2.model.DkimSigningAttributes;
import software.amazon.awssdk.services.sesv2.model.DkimSigningKeyLength;
import software.amazon.awssdk.services.sesv2.model.DkimStatus;
import software.amazon.awssdk.services.sesv2.model.GetAccountRequest;
import software.amazon.awssdk.services.sesv2.model.GetEmailIdentityRequest;
import software.amazon.awssdk.services.sesv2.model.GetEmailIdentityResponse;
import software.amazon.awssdk.services.sesv2.model.NotFoundException;

import java.util.ArrayList;
import java.util.List;

/**
 * AWS SES v2 identity client.
 *
 * <p>Each DKIM token becomes a CNAME {@code {token}._domainkey.{domain}} pointing at
 * {@code {token}.dkim.amazonses.com}. The identity name is used as the identity reference.
 */
public class SesIdentityProviderClient implements IdentityProviderClient {
    private static final Logger log = LogManager.getLogger(SesIdentityProviderClient.class);

    static final String DKIM_TARGET_SUFFIX = ".dkim.amazonses.com";

    private final SesV2Client ses;

    public SesIdentityProviderClient(SesV2Client ses) {
        this.ses = ses;
    }

    @Override
    public IdentityProvisioning createIdentity(String domain) throws IdentityProviderException {
        log.info("Creating SES domain identity for {}", domain);
        DkimAttributes dkim;
        try {
            CreateEmailIdentityResponse response = ses.createEmailIdentity(CreateEmailIdentityRequest.builder()
                    .emailIdentity(domain)
                    .dkimSigningAttributes(DkimSigningAttributes.builder()
                            .nextSigningKeyLength(DkimSigningKeyLength.RSA_2048_BIT)
                            .build())
                    .build());
            dkim = response.dkimAttributes();
        } catch (AlreadyExistsException e) {
            log.info("SES identity for {} already exists, reusing its DKIM tokens", domain);
            dkim = getIdentity(domain).dkimAttributes();
        } catch (SdkException e) {
            throw new IdentityProviderException("SES identity creation failed: " + e.getMessage(), e);
        }

        List<DnsRecord> records = new ArrayList<>();
        if (dkim != null && dkim.hasTokens()) {
            for (String token : dkim.tokens()) {
                records.add(new DnsRecord("CNAME", token + "._domainkey." + domain, token + DKIM_TARGET_SUFFIX, 0));
            }
        }
        log.info("SES identity ready for {}: dkimRecords={}", domain, records.size());
        return new IdentityProvisioning(domain, records);
    }

    @Override
    public boolean isVerified(String domain) throws IdentityProviderException {
        try {
            GetEmailIdentityResponse response = ses.getEmailIdentity(
                    GetEmailIdentityRequest.builder().emailIdentity(domain).build());
            DkimStatus status = response.dkimAttributes() != null ? response.dkimAttributes().status() : null;
            log.debug("DKIM status for {}: {}", domain, status);
            return status == DkimStatus.SUCCESS;
        } catch (NotFoundException e) {
            log.warn("Domain identity not found in SES: {}", domain);
            return false;
        } catch (SdkException e) {
            throw new IdentityProviderException("SES identity lookup failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void deleteIdentity(String domain) throws IdentityProviderException {
        log.info("Deleting SES domain identity for {}", domain);
        try {
            ses.deleteEmailIdentity(DeleteEmailIdentityRequest.builder().emailIdentity(domain).build());
        } catch (NotFoundException e) {
            log.warn("Domain identity not found when attempting deletion: {}", domain);
        } catch (SdkException e) {
            throw new IdentityProviderException("SES identity deletion failed: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean isSendingEnabled() throws IdentityProviderException {
        try {
            Boolean enabled = ses.getAccount(GetAccountRequest.builder().build()).sendingEnabled();
            return Boolean.TRUE.equals(enabled);
        } catch (SdkException e) {
            throw new IdentityProviderException("SES account lookup failed: " + e.getMessage(), e);
        }
    }

    private GetEmailIdentityResponse getIdentity(String domain) throws IdentityProviderException {
        try {
            return ses.getEmailIdentity(GetEmailIdentityRequest.builder().emailIdentity(domain).build());
        } catch (SdkException e) {
            throw new IdentityProviderException("SES identity lookup failed: " + e.getMessage(), e);
        }
    }
}
