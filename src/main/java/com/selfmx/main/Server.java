package com.selfmx.main;

import com.selfmx.audit.AuditLogRepository;
import com.selfmx.audit.AuditRecorder;
import com.selfmx.auth.AdminLoginService;
import com.selfmx.auth.AdminSessionStore;
import com.selfmx.auth.ApiKeyService;
import com.selfmx.auth.AuthorizationGate;
import com.selfmx.auth.ratelimit.FixedWindowRateLimiter;
import com.selfmx.auth.ratelimit.RateLimiter;
import com.selfmx.auth.ratelimit.SlidingWindowRateLimiter;
import com.selfmx.config.server.RateLimitConfig;
import com.selfmx.config.server.RetentionConfig;
import com.selfmx.config.server.ServerConfig;
import com.selfmx.config.server.VerificationConfig;
import com.selfmx.db.SchemaInitializer;
import com.selfmx.db.SharedDataSource;
import com.selfmx.endpoints.ApiEndpoint;
import com.selfmx.endpoints.ApiHandler;
import com.selfmx.endpoints.MetricsEndpoint;
import com.selfmx.gateway.cron.AdminSessionPurgeCron;
import com.selfmx.gateway.cron.CronJob;
import com.selfmx.gateway.cron.DomainVerificationCron;
import com.selfmx.gateway.cron.RevokedApiKeyCleanupCron;
import com.selfmx.gateway.cron.SentEmailCleanupCron;
import com.selfmx.gateway.endpoint.AdminHandler;
import com.selfmx.gateway.endpoint.ApiKeysHandler;
import com.selfmx.gateway.endpoint.AuditHandler;
import com.selfmx.gateway.endpoint.DomainsHandler;
import com.selfmx.gateway.endpoint.EmailsHandler;
import com.selfmx.gateway.endpoint.SystemHandler;
import com.selfmx.gateway.endpoint.TokensHandler;
import com.selfmx.gateway.repository.ApiKeyRepository;
import com.selfmx.gateway.repository.DomainRepository;
import com.selfmx.gateway.repository.SentEmailRepository;
import com.selfmx.gateway.service.DomainSetupDispatcher;
import com.selfmx.gateway.service.DomainVerificationService;
import com.selfmx.gateway.service.EmailService;
import com.selfmx.gateway.service.SentEmailCleanupService;
import com.selfmx.gateway.service.SystemStatusService;
import com.selfmx.provider.cloudflare.DnsPublisher;
import com.selfmx.provider.cloudflare.DnsPublisherFactory;
import com.selfmx.provider.dns.XBillDnsRecordResolver;
import com.selfmx.provider.ses.SesClientFactory;
import com.selfmx.provider.ses.SesEmailSender;
import com.selfmx.provider.ses.SesIdentityProviderClient;
import com.zaxxer.hikari.HikariDataSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import software.amazon.awssdk.services.sesv2.SesV2Client;

import java.io.IOException;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Gateway server.
 *
 * <p>Loads {@code server.json5}, prepares the database, builds the provider clients and
 * services, starts the background jobs and finally opens the API and metrics listeners.
 * A JVM shutdown hook stops everything in reverse order.
 *
 * <p>The server is started by calling the static {@link #run(String)} method with the path
 * to the configuration directory.
 */
public class Server {
    private static final Logger log = LogManager.getLogger(Server.class);

    private final ServerConfig config;
    private final Clock clock;
    private final List<CronJob> crons = new ArrayList<>();

    private HikariDataSource dataSource;
    private SesV2Client ses;
    private ExecutorService providerCalls;
    private ExecutorService keyUsage;
    private AuditRecorder auditRecorder;
    private DomainSetupDispatcher dispatcher;
    private ApiEndpoint apiEndpoint;
    private MetricsEndpoint metricsEndpoint;

    /**
     * Constructs a new Server.
     *
     * @param config Server configuration.
     * @param clock  Clock for services.
     */
    public Server(ServerConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    /**
     * Loads the configuration directory and starts the gateway.
     *
     * @param path Directory containing {@code server.json5}.
     * @return Running server.
     * @throws IOException If configuration cannot be read or a listener cannot bind.
     */
    public static Server run(String path) throws IOException {
        Config.initServer(path);
        Server server = new Server(Config.getServer(), Clock.systemUTC());
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Service is shutting down.");
            server.stop();
            log.info("Shutdown complete.");
        }, "shutdown-hook"));
        server.start();
        return server;
    }

    /**
     * Builds and starts every component.
     *
     * @throws IOException If a listener cannot bind.
     */
    public void start() throws IOException {
        // Metrics first so counters are registered before any service increments them.
        metricsEndpoint = new MetricsEndpoint();
        metricsEndpoint.initRegistry();

        dataSource = SharedDataSource.create(config.getDatabase(), "SelfMxPool");
        if (config.getDatabase().isInitSchema()) {
            SchemaInitializer.apply(dataSource);
        }

        DomainRepository domainRepository = new DomainRepository(dataSource);
        ApiKeyRepository apiKeyRepository = new ApiKeyRepository(dataSource);
        SentEmailRepository sentEmailRepository = new SentEmailRepository(dataSource);
        AuditLogRepository auditLogRepository = new AuditLogRepository(dataSource);

        ses = SesClientFactory.createFromConfig(config.getAws());
        SesIdentityProviderClient identityProvider = new SesIdentityProviderClient(ses);
        DnsPublisher dnsPublisher = DnsPublisherFactory.createFromConfig(config.getCloudflare());
        VerificationConfig verification = config.getVerification();
        XBillDnsRecordResolver resolver;
        try {
            resolver = new XBillDnsRecordResolver(verification.getFallbackResolver(), verification.getCallTimeout());
        } catch (UnknownHostException e) {
            throw new IOException("Invalid fallback resolver: " + verification.getFallbackResolver(), e);
        }

        auditRecorder = new AuditRecorder(auditLogRepository);
        providerCalls = daemonPool("provider-call-", Math.max(4, verification.getSetupWorkers() * 2));
        keyUsage = daemonPool("key-usage-", 1);

        DomainVerificationService domains = new DomainVerificationService(domainRepository, identityProvider,
                dnsPublisher, resolver, providerCalls, clock, verification.getTimeout(),
                verification.getPollInterval(), verification.getCallTimeout());
        ApiKeyService apiKeys = new ApiKeyService(apiKeyRepository, domainRepository, keyUsage, clock);
        EmailService emails = new EmailService(domainRepository, sentEmailRepository,
                new SesEmailSender(ses), auditRecorder, clock);
        SystemStatusService status = new SystemStatusService(dataSource, identityProvider,
                config.getAws(), config.getAdmin(), clock);

        AdminSessionStore sessions = new AdminSessionStore(
                Duration.ofDays(config.getAdmin().getSessionExpirationDays()), clock);
        AdminLoginService login = new AdminLoginService(config.getAdmin().getPasswordHash(), sessions);
        if (!login.isConfigured()) {
            log.warn("Admin password hash is not configured, admin login is disabled");
        }
        AuthorizationGate gate = new AuthorizationGate(apiKeys, sessions);

        RateLimitConfig rateLimit = config.getRateLimit();
        RateLimiter loginLimiter = new FixedWindowRateLimiter("login",
                rateLimit.getLoginPerMinute(), Duration.ofMinutes(1), clock);
        RateLimiter apiLimiter = new SlidingWindowRateLimiter("api",
                rateLimit.getApiPerMinute(), Duration.ofMinutes(1), rateLimit.getApiSegments(), clock);

        dispatcher = new DomainSetupDispatcher(domains, verification.getSetupWorkers());
        dispatcher.recoverPending();

        RetentionConfig retention = config.getRetention();
        long cleanupInterval = retention.getCleanupIntervalSeconds();
        crons.add(new DomainVerificationCron(domains, verification.getInitialDelaySeconds(),
                verification.getPollInterval().getSeconds()));
        crons.add(new SentEmailCleanupCron(new SentEmailCleanupService(sentEmailRepository, clock,
                retention.getSentEmailDays()), cleanupInterval, cleanupInterval));
        crons.add(new RevokedApiKeyCleanupCron(apiKeys, Duration.ofDays(retention.getRevokedKeyDays()),
                cleanupInterval, cleanupInterval));
        crons.add(new AdminSessionPurgeCron(sessions, 3600, 3600));
        for (CronJob cron : crons) {
            cron.start();
        }

        apiEndpoint = new ApiEndpoint(config.getBind(), new ArrayList<>());
        List<ApiHandler> handlers = List.of(
                new DomainsHandler(apiEndpoint, gate, apiLimiter, domains, dispatcher, emails, auditRecorder),
                new EmailsHandler(apiEndpoint, gate, apiLimiter, emails),
                new ApiKeysHandler(apiEndpoint, gate, apiLimiter, apiKeys, auditRecorder),
                new AuditHandler(apiEndpoint, gate, apiLimiter, auditLogRepository),
                new AdminHandler(apiEndpoint, gate, login, sessions, loginLimiter, auditRecorder,
                        config.getAdmin().isSecureCookie()),
                new TokensHandler(apiEndpoint, gate, apiLimiter),
                new SystemHandler(apiEndpoint, gate, status));
        apiEndpoint.addHandlers(handlers);
        apiEndpoint.start(config.getApi());

        try {
            metricsEndpoint.start(config.getMetrics());
        } catch (IOException e) {
            log.error("Unable to start metrics endpoint: {}", e.getMessage());
        }

        log.info("Gateway started: api port={}, domains verifying every {}s", apiEndpoint.getPort(),
                verification.getPollInterval().getSeconds());
    }

    /**
     * Stops listeners, jobs, queues and the pool. Safe to call more than once.
     */
    public synchronized void stop() {
        if (apiEndpoint != null) {
            apiEndpoint.stop(1);
            apiEndpoint = null;
        }
        if (metricsEndpoint != null) {
            metricsEndpoint.stop(0);
            metricsEndpoint = null;
        }
        for (CronJob cron : crons) {
            cron.close();
        }
        crons.clear();
        if (dispatcher != null) {
            dispatcher.close();
            dispatcher = null;
        }
        shutdown(providerCalls);
        shutdown(keyUsage);
        if (auditRecorder != null) {
            auditRecorder.close();
            auditRecorder = null;
        }
        if (ses != null) {
            ses.close();
            ses = null;
        }
        if (dataSource != null) {
            dataSource.close();
            dataSource = null;
        }
    }

    public ApiEndpoint getApiEndpoint() {
        return apiEndpoint;
    }

    private static ExecutorService daemonPool(String prefix, int threads) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    private static void shutdown(ExecutorService executor) {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
