package com.selfmx.audit;

/**
 * Audit action names.
 */
public final class AuditActions {
    public static final String EMAIL_SEND = "email.send";
    public static final String EMAIL_BATCH = "email.batch";
    public static final String DOMAIN_CREATE = "domain.create";
    public static final String DOMAIN_DELETE = "domain.delete";
    public static final String DOMAIN_VERIFY = "domain.verify";
    public static final String DOMAIN_TEST_EMAIL = "domain.test_email";
    public static final String API_KEY_CREATE = "api_key.create";
    public static final String API_KEY_REVOKE = "api_key.revoke";
    public static final String API_KEY_ARCHIVE = "api_key.archive";
    public static final String ADMIN_LOGIN = "admin.login";
    public static final String ADMIN_LOGOUT = "admin.logout";

    private AuditActions() {
        // constants
    }
}
