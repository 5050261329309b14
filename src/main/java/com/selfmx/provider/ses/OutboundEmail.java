package com.selfmx.provider.ses;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Email ready for the provider. {@code from} may carry a display name.
 */
public class OutboundEmail {
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

    public OutboundEmail setFrom(String from) {
        this.from = from;
        return this;
    }

    public List<String> getTo() {
        return to;
    }

    public OutboundEmail setTo(List<String> to) {
        this.to = to != null ? to : new ArrayList<>();
        return this;
    }

    public List<String> getCc() {
        return cc;
    }

    public OutboundEmail setCc(List<String> cc) {
        this.cc = cc != null ? cc : new ArrayList<>();
        return this;
    }

    public List<String> getBcc() {
        return bcc;
    }

    public OutboundEmail setBcc(List<String> bcc) {
        this.bcc = bcc != null ? bcc : new ArrayList<>();
        return this;
    }

    public List<String> getReplyTo() {
        return replyTo;
    }

    public OutboundEmail setReplyTo(List<String> replyTo) {
        this.replyTo = replyTo != null ? replyTo : new ArrayList<>();
        return this;
    }

    public String getSubject() {
        return subject;
    }

    public OutboundEmail setSubject(String subject) {
        this.subject = subject;
        return this;
    }

    public String getHtml() {
        return html;
    }

    public OutboundEmail setHtml(String html) {
        this.html = html;
        return this;
    }

    public String getText() {
        return text;
    }

    public OutboundEmail setText(String text) {
        this.text = text;
        return this;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public OutboundEmail setHeaders(Map<String, String> headers) {
        this.headers = headers != null ? headers : new LinkedHashMap<>();
        return this;
    }
}
