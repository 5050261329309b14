package com.selfmx.provider.ses;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.sesv2.SesV2Client;
import software.amazon.awssdk.services.sesv2.model.Body;
import software.amazon.awssdk.services.sesv2.model.Content;
import software.amazon.awssdk.services.sesv2.model.Destination;
import software.amazon.awssdk.services.sesv2.model.EmailContent;
import software.amazon.awssdk.services.sesv2.model.Message;
import software.amazon.awssdk.services.sesv2.model.MessageHeader;
import software.amazon.awssdk.services.sesv2.model.SendEmailRequest;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Sends simple (non-raw) emails through SES v2.
 */
public class SesEmailSender implements EmailSender {
    private static final Logger log = LogManager.getLogger(SesEmailSender.class);

    private final SesV2Client ses;

    public SesEmailSender(SesV2Client ses) {
        this.ses = ses;
    }

    @Override
    public String send(OutboundEmail email) throws EmailSendException {
        Destination.Builder destination = Destination.builder().toAddresses(email.getTo());
        if (!email.getCc().isEmpty()) {
            destination.ccAddresses(email.getCc());
        }
        if (!email.getBcc().isEmpty()) {
            destination.bccAddresses(email.getBcc());
        }

        Body.Builder body = Body.builder();
        if (email.getHtml() != null && !email.getHtml().isEmpty()) {
            body.html(content(email.getHtml()));
        }
        if (email.getText() != null && !email.getText().isEmpty()) {
            body.text(content(email.getText()));
        }

        Message.Builder message = Message.builder()
                .subject(content(email.getSubject()))
                .body(body.build());
        if (!email.getHeaders().isEmpty()) {
            List<MessageHeader> headers = new ArrayList<>();
            for (Map.Entry<String, String> header : email.getHeaders().entrySet()) {
                headers.add(MessageHeader.builder().name(header.getKey()).value(header.getValue()).build());
            }
            message.headers(headers);
        }

        SendEmailRequest.Builder request = SendEmailRequest.builder()
                .fromEmailAddress(email.getFrom())
                .destination(destination.build())
                .content(EmailContent.builder().simple(message.build()).build());
        if (!email.getReplyTo().isEmpty()) {
            request.replyToAddresses(email.getReplyTo());
        }

        log.info("Sending email from {} to {}, subject: {}", email.getFrom(), String.join(", ", email.getTo()), email.getSubject());
        try {
            String messageId = ses.sendEmail(request.build()).messageId();
            log.info("Email sent successfully, messageId: {}", messageId);
            return messageId;
        } catch (SdkException e) {
            throw new EmailSendException("SES send failed: " + e.getMessage(), e);
        }
    }

    private static Content content(String data) {
        return Content.builder().data(data).charset(StandardCharsets.UTF_8.name()).build();
    }
}
