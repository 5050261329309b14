package com.selfmx.provider.ses;

import com.selfmx.gateway.domain.DnsRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.sesv2.SesV2Client;
import software.amazon.awssdk.services.sesv2.model.AlreadyExistsException;
import software.amazon.awssdk.services.sesv2.model.CreateEmailIdentityRequest;
import software.amazon.awssdk.services.sesv2.model.CreateEmailIdentityResponse;
import software.amazon.awssdk.services.sesv2.model.DeleteEmailIdentityRequest;
import software.amazon.awssdk.services.sesv2.model.DkimAttributes;
import software.amazon.awssdk.services.sesv2.model.DkimSigningKeyLength;
import software.amazon.awssdk.services.sesv2.model.DkimStatus;
import software.amazon.awssdk.services.sesv2.model.GetAccountRequest;
import software.amazon.awssdk.services.sesv2.model.GetAccountResponse;
import software.amazon.awssdk.services.sesv2.model.GetEmailIdentityRequest;
import software.amazon.awssdk.services.sesv2.model.GetEmailIdentityResponse;
import software.amazon.awssdk.services.sesv2.model.NotFoundException;
import software.amazon.awssdk.services.sesv2.model.SendEmailRequest;
import software.amazon.awssdk.services.sesv2.model.SendEmailResponse;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SesIdentityProviderClientTest {

    @Mock
    private SesV2Client ses;

    private AutoCloseable closeable;
    private SesIdentityProviderClient client;

    @BeforeEach
    void setUp() {
        closeable = MockitoAnnotations.openMocks(this);
        client = new SesIdentityProviderClient(ses);
    }

    @AfterEach
    void tearDown() throws Exception {
        closeable.close();
    }

    private static DkimAttributes dkim(DkimStatus status, String... tokens) {
        return DkimAttributes.builder().status(status).tokens(tokens).build();
    }

    // --- identities ---

    @Test
    void createIdentityMapsTokensToCnames() throws Exception {
        when(ses.createEmailIdentity(any(CreateEmailIdentityRequest.class))).thenReturn(
                CreateEmailIdentityResponse.builder().dkimAttributes(dkim(DkimStatus.PENDING, "t1", "t2", "t3")).build());

        IdentityProvisioning provisioning = client.createIdentity("example.com");

        assertEquals("example.com", provisioning.getIdentityRef());
        List<DnsRecord> records = provisioning.getRecords();
        assertEquals(3, records.size());
        assertEquals("CNAME", records.get(0).getType());
        assertEquals("t1._domainkey.example.com", records.get(0).getName());
        assertEquals("t1.dkim.amazonses.com", records.get(0).getValue());
        assertEquals("t3._domainkey.example.com", records.get(2).getName());

        ArgumentCaptor<CreateEmailIdentityRequest> captor = ArgumentCaptor.forClass(CreateEmailIdentityRequest.class);
        verify(ses).createEmailIdentity(captor.capture());
        assertEquals("example.com", captor.getValue().emailIdentity());
        assertEquals(DkimSigningKeyLength.RSA_2048_BIT, captor.getValue().dkimSigningAttributes().nextSigningKeyLength());
    }

    @Test
    void existingIdentityIsReused() throws Exception {
        when(ses.createEmailIdentity(any(CreateEmailIdentityRequest.class)))
                .thenThrow(AlreadyExistsException.builder().message("exists").build());
        when(ses.getEmailIdentity(any(GetEmailIdentityRequest.class))).thenReturn(
                GetEmailIdentityResponse.builder().dkimAttributes(dkim(DkimStatus.PENDING, "a", "b", "c")).build());

        IdentityProvisioning provisioning = client.createIdentity("example.com");

        assertEquals(3, provisioning.getRecords().size());
        assertEquals("a._domainkey.example.com", provisioning.getRecords().get(0).getName());
    }

    @Test
    void createFailureIsWrapped() {
        when(ses.createEmailIdentity(any(CreateEmailIdentityRequest.class)))
                .thenThrow(SdkClientException.create("AccessDenied"));

        IdentityProviderException e = assertThrows(IdentityProviderException.class, () -> client.createIdentity("example.com"));
        assertTrue(e.getMessage().contains("AccessDenied"));
    }

    @Test
    void verifiedOnlyOnDkimSuccess() throws Exception {
        when(ses.getEmailIdentity(any(GetEmailIdentityRequest.class)))
                .thenReturn(GetEmailIdentityResponse.builder().dkimAttributes(dkim(DkimStatus.PENDING)).build())
                .thenReturn(GetEmailIdentityResponse.builder().dkimAttributes(dkim(DkimStatus.SUCCESS)).build())
                .thenReturn(GetEmailIdentityResponse.builder().build())
                .thenThrow(NotFoundException.builder().message("gone").build())
                .thenThrow(SdkClientException.create("throttled"));

        assertFalse(client.isVerified("example.com"));
        assertTrue(client.isVerified("example.com"));
        assertFalse(client.isVerified("example.com"));
        assertFalse(client.isVerified("example.com"));
        assertThrows(IdentityProviderException.class, () -> client.isVerified("example.com"));
    }

    @Test
    void deleteIgnoresMissingIdentity() {
        when(ses.deleteEmailIdentity(any(DeleteEmailIdentityRequest.class)))
                .thenThrow(NotFoundException.builder().message("gone").build());

        assertDoesNotThrow(() -> client.deleteIdentity("example.com"));
    }

    @Test
    void sendingEnabledReadsAccount() throws Exception {
        when(ses.getAccount(any(GetAccountRequest.class)))
                .thenReturn(GetAccountResponse.builder().sendingEnabled(true).build())
                .thenReturn(GetAccountResponse.builder().build());

        assertTrue(client.isSendingEnabled());
        assertFalse(client.isSendingEnabled());
    }

    // --- sending ---

    @Test
    void senderBuildsSimpleMessage() throws Exception {
        when(ses.sendEmail(any(SendEmailRequest.class)))
                .thenReturn(SendEmailResponse.builder().messageId("msg-1").build());
        SesEmailSender sender = new SesEmailSender(ses);

        String id = sender.send(new OutboundEmail()
                .setFrom("Acme <hello@example.com>")
                .setTo(List.of("a@example.org"))
                .setBcc(List.of("audit@example.org"))
                .setReplyTo(List.of("support@example.com"))
                .setSubject("Hi")
                .setText("plain")
                .setHeaders(Map.of("X-Campaign", "spring")));

        assertEquals("msg-1", id);
        ArgumentCaptor<SendEmailRequest> captor = ArgumentCaptor.forClass(SendEmailRequest.class);
        verify(ses).sendEmail(captor.capture());
        SendEmailRequest request = captor.getValue();
        assertEquals("Acme <hello@example.com>", request.fromEmailAddress());
        assertEquals(List.of("a@example.org"), request.destination().toAddresses());
        assertFalse(request.destination().hasCcAddresses());
        assertEquals(List.of("audit@example.org"), request.destination().bccAddresses());
        assertEquals(List.of("support@example.com"), request.replyToAddresses());
        assertEquals("Hi", request.content().simple().subject().data());
        assertEquals("plain", request.content().simple().body().text().data());
        assertNull(request.content().simple().body().html());
        assertEquals("X-Campaign", request.content().simple().headers().get(0).name());
    }

    @Test
    void senderWrapsProviderErrors() {
        when(ses.sendEmail(any(SendEmailRequest.class))).thenThrow(SdkClientException.create("MessageRejected"));
        SesEmailSender sender = new SesEmailSender(ses);

        EmailSendException e = assertThrows(EmailSendException.class, () -> sender.send(new OutboundEmail()
                .setFrom("a@example.com").setTo(List.of("b@example.org")).setSubject("s").setText("t")));
        assertTrue(e.getMessage().contains("MessageRejected"));
    }
}
