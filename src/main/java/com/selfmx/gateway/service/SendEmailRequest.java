package com.selfmx.gateway.service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resend-compatible send request.
 */
public class SendEmailRequest {

    private String from;
    private List<String> to = new ArrayList<>();
    private List<String> cc = new ArrayList<>();
    private List<String> bcc = new ArrayList<>();
    private List<String> replyTo = new ArrayList<>();
    private String subject;
    private String html;
    private String text;
    private Map<String, String> headers = new LinkedHashMap<>();

    public String getFrom() {
        return from;
    }

    public SendEmailRequest setFrom(String from) {
        this.from = from;
        return this;
    }

    public List<String> getTo() {
        return to;
    }

    public SendEmailRequest setTo(List<String> to) {
        this.to = to != null ? to : new ArrayList<>();
        return this;
    }

    public List<String> getCc() {
        return cc;
    }

    public SendEmailRequest setCc(List<String> cc) {
        this.cc = cc != null ? cc : new ArrayList<>();
        return this;
    }

    public List<String> getBcc() {
        return bcc;
    }

    public SendEmailRequest setBcc(List<String> bcc) {
        this.bcc = bcc != null ? bcc : new ArrayList<>();
        return this;
    }

    public List<String> getReplyTo() {
        return replyTo;
    }

    public SendEmailRequest setReplyTo(List<String> replyTo) {
        this.replyTo = replyTo != null ? replyTo : new ArrayList<>();
        return this;
    }

    public String getSubject() {
        return subject;
    }

    public SendEmailRequest setSubject(String subject) {
        this.subject = subject;
        return this;
    }

    public String getHtml() {
        return html;
    }

    public SendEmailRequest setHtml(String html) {
        this.html = html;
        return this;
    }

    public String getText() {
        return text;
    }

    public SendEmailRequest setText(String text) {
        this.text = text;
        return this;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public SendEmailRequest setHeaders(Map<String, String> headers) {
        this.headers = headers != null ? headers : new LinkedHashMap<>();
        return this;
    }
}
