package com.selfmx.gateway.service;

import com.selfmx.auth.Actor;
import com.selfmx.error.ApiError;
import com.selfmx.error.ApiException;
import com.selfmx.gateway.domain.DnsRecord;
import com.selfmx.gateway.domain.Domain;
import com.selfmx.gateway.domain.DomainStatus;
import com.selfmx.gateway.repository.DomainInUseException;
import com.selfmx.gateway.repository.DomainRepository;
import com.selfmx.gateway.repository.DuplicateDomainException;
import com.selfmx.metrics.GatewayMetrics;
import com.selfmx.provider.cloudflare.DnsPublishException;
import com.selfmx.provider.cloudflare.DnsPublisher;
import com.selfmx.provider.dns.DnsCheckResult;
import com.selfmx.provider.dns.DnsRecordResolver;
import com.selfmx.provider.ses.IdentityProviderClient;
import com.selfmx.provider.ses.IdentityProviderException;
import com.selfmx.provider.ses.IdentityProvisioning;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;
import java.util.regex.Pattern;

/**
 * Owns the domain verification lifecycle.
 *
 * <p>Domains move PENDING to VERIFYING once the provider identity exists and its DNS records have
 * been handed to the publisher. VERIFYING domains are polled until the provider reports them
 * verified or the verification window runs out. Direct DNS lookups only annotate the records.
 * <p>Every outcome is persisted with a single conditional UPDATE.
 */
public class DomainVerificationService {
    private static final Logger log = LogManager.getLogger(DomainVerificationService.class);

    private static final Pattern HOSTNAME = Pattern.compile(
            "^(?=.{1,253}$)([a-z0-9]([a-z0-9-]{0,61}[a-z0-9])?\\.)+[a-z]{2,63}$");

    private final DomainRepository repository;
    private final IdentityProviderClient identityProvider;
    private final DnsPublisher dnsPublisher;
    private final DnsRecordResolver dnsResolver;
    private final ExecutorService callExecutor;
    private final Clock clock;
    private final Duration timeout;
    private final Duration pollInterval;
    private final Duration callTimeout;
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    /**
     * Constructs a new DomainVerificationService.
     *
     * @param repository       Domain repository.
     * @param identityProvider Sending identity provider.
     * @param dnsPublisher     DNS publisher, possibly disabled.
     * @param dnsResolver      Direct DNS checker.
     * @param callExecutor     Executor running bounded provider and DNS calls.
     * @param clock            Clock.
     * @param timeout          Verification window after setup.
     * @param pollInterval     Interval between scheduled checks.
     * @param callTimeout      Bound for each external call during a check.
     */
    public DomainVerificationService(DomainRepository repository,
                                     IdentityProviderClient identityProvider,
                                     DnsPublisher dnsPublisher,
                                     DnsRecordResolver dnsResolver,
                                     ExecutorService callExecutor,
                                     Clock clock,
                                     Duration timeout,
                                     Duration pollInterval,
                                     Duration callTimeout) {
        this.repository = Objects.requireNonNull(repository, "repository");
        this.identityProvider = Objects.requireNonNull(identityProvider, "identityProvider");
        this.dnsPublisher = Objects.requireNonNull(dnsPublisher, "dnsPublisher");
        this.dnsResolver = Objects.requireNonNull(dnsResolver, "dnsResolver");
        this.callExecutor = Objects.requireNonNull(callExecutor, "callExecutor");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
        this.callTimeout = Objects.requireNonNull(callTimeout, "callTimeout");
    }

    /**
     * Registers a new domain in PENDING state.
     * <p>The caller is responsible for handing the id to the setup dispatcher.
     *
     * @param name Domain name as supplied by the client.
     * @return Stored domain.
     */
    public Domain createDomain(String name) {
        String normalized = normalizeName(name);
        if (!isValidHostname(normalized)) {
            throw new ApiException(ApiError.INVALID_REQUEST, "Invalid domain name");
        }

        Domain domain = new Domain();
        domain.setId(UUID.randomUUID().toString());
        domain.setName(normalized);
        domain.setStatus(DomainStatus.PENDING);
        domain.setCreatedAt(OffsetDateTime.now(clock));
        try {
            repository.insert(domain);
        } catch (DuplicateDomainException e) {
            log.info("Domain create rejected, already exists: {}", normalized);
            throw new ApiException(ApiError.DOMAIN_EXISTS);
        }
        log.info("Domain created: id={}, name={}", domain.getId(), normalized);
        return domain;
    }

    /**
     * Provisions the identity and publishes its records.
     * <p>Safe to run more than once: anything but a PENDING domain is left alone.
     *
     * @param domainId Domain id.
     * @return Domain after setup, or empty when it no longer exists.
     */
    public Optional<Domain> setup(String domainId) {
        Optional<Domain> found = repository.findById(domainId);
        if (found.isEmpty()) {
            log.warn("Setup skipped, domain {} no longer exists", domainId);
            return Optional.empty();
        }
        Domain domain = found.get();
        if (domain.getStatus() != DomainStatus.PENDING) {
            log.info("Setup skipped for {}: status is {}", domain.getName(), domain.getStatus());
            return Optional.of(domain);
        }

        ReentrantLock lock = lockFor(domainId);
        lock.lock();
        try {
            IdentityProvisioning provisioning = identityProvider.createIdentity(domain.getName());
            publishRecords(domain.getName(), provisioning.getRecords());

            domain.setProviderIdentityRef(provisioning.getIdentityRef());
            domain.setDnsRecords(new ArrayList<>(provisioning.getRecords()));
            domain.setVerificationStartedAt(OffsetDateTime.now(clock));
            transition(domain, DomainStatus.VERIFYING);
            persist(domain, DomainStatus.PENDING);
            log.info("Domain {} set up with {} records, verifying", domain.getName(), provisioning.getRecords().size());
        } catch (IdentityProviderException | RuntimeException e) {
            log.error("Setup failed for {}: {}", domain.getName(), e.getMessage());
            Domain failed = repository.findById(domainId).orElse(domain);
            if (failed.getStatus() == DomainStatus.PENDING) {
                failed.setFailureReason("Setup failed: " + e.getMessage());
                transition(failed, DomainStatus.FAILED);
                persist(failed, DomainStatus.PENDING);
            }
            domain = failed;
        } finally {
            lock.unlock();
        }
        return Optional.of(domain);
    }

    private void publishRecords(String domainName, List<DnsRecord> records) {
        if (!dnsPublisher.isEnabled()) {
            log.info("DNS publishing disabled, {} records for {} must be created manually", records.size(), domainName);
            return;
        }
        int published = 0;
        for (DnsRecord record : records) {
            try {
                String recordId = dnsPublisher.createRecord(record);
                published++;
                log.debug("Published {} as {}", record, recordId);
            } catch (DnsPublishException e) {
                GatewayMetrics.incrementDnsPublishFailure();
                log.warn("Failed to publish {} for {}: {}", record, domainName, e.getMessage());
            } catch (RuntimeException e) {
                GatewayMetrics.incrementDnsPublishFailure();
                log.error("Unexpected error publishing {} for {}: {}", record, domainName, e.getMessage(), e);
            }
        }
        log.info("Published {}/{} DNS records for {}", published, records.size(), domainName);
    }

    /**
     * Runs one verification check.
     *
     * @param domain Domain to check.
     * @return Domain after the check.
     */
    public Domain check(Domain domain) {
        ReentrantLock lock = lockFor(domain.getId());
        lock.lock();
        try {
            Optional<Domain> current = repository.findById(domain.getId());
            if (current.isEmpty()) {
                log.debug("Check skipped, domain {} no longer exists", domain.getId());
                return domain;
            }
            Domain target = current.get();
            if (target.getStatus() != DomainStatus.VERIFYING) {
                log.debug("Check skipped for {}: status is {}", target.getName(), target.getStatus());
                return target;
            }

            OffsetDateTime now = OffsetDateTime.now(clock);
            target.setLastCheckedAt(now);

            if (isExpired(target, now)) {
                target.setFailureReason("Verification timed out after " + timeout.toHours() + " hours");
                transition(target, DomainStatus.FAILED);
                log.warn("Verification timed out for {}", target.getName());
            } else if (providerVerified(target)) {
                target.setVerifiedAt(now);
                transition(target, DomainStatus.VERIFIED);
                log.info("Domain verified: {}", target.getName());
            } else {
                int live = annotateRecords(target);
                log.debug("Domain {} still verifying, {}/{} records visible in DNS",
                        target.getName(), live, sizeOf(target.getDnsRecords()));
            }

            persist(target, DomainStatus.VERIFYING);
            return target;
        } finally {
            lock.unlock();
        }
    }

    private boolean isExpired(Domain domain, OffsetDateTime now) {
        OffsetDateTime started = domain.getVerificationStartedAt();
        return started != null && Duration.between(started, now).compareTo(timeout) > 0;
    }

    private boolean providerVerified(Domain domain) {
        Boolean verified = bounded("isVerified(" + domain.getName() + ")",
                () -> identityProvider.isVerified(domain.getName()));
        return Boolean.TRUE.equals(verified);
    }

    private int annotateRecords(Domain domain) {
        List<DnsRecord> records = domain.getDnsRecords();
        if (records == null) {
            return 0;
        }
        int live = 0;
        for (DnsRecord record : records) {
            DnsCheckResult result = bounded("checkRecord(" + record.getName() + ")",
                    () -> dnsResolver.checkRecord(record.getType(), record.getName(), record.getValue()));
            record.setVerified(result != null && result.isVerified());
            if (record.isVerified()) {
                live++;
            }
        }
        return live;
    }

    /**
     * Runs an external call with the configured timeout. Errors and timeouts yield null.
     */
    private <T> T bounded(String description, Callable<T> call) {
        Future<T> future = callExecutor.submit(call);
        try {
            return future.get(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("{} timed out after {}ms", description, callTimeout.toMillis());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("{} failed: {}", description, cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            log.warn("{} interrupted", description);
        }
        return null;
    }

    /**
     * Checks every VERIFYING domain in turn.
     *
     * @param cancelled Stop flag consulted between domains.
     * @return Number of domains checked.
     */
    public int pollVerifyingDomains(BooleanSupplier cancelled) {
        List<Domain> verifying = repository.findByStatus(DomainStatus.VERIFYING);
        int checked = 0;
        for (Domain domain : verifying) {
            if (cancelled.getAsBoolean() || Thread.currentThread().isInterrupted()) {
                log.info("Verification poll cancelled after {}/{} domains", checked, verifying.size());
                break;
            }
            try {
                check(domain);
                checked++;
            } catch (RuntimeException e) {
                log.error("Verification check failed for {}: {}", domain.getName(), e.getMessage(), e);
            }
        }
        if (!verifying.isEmpty()) {
            log.info("Verification poll checked {} domains", checked);
        }
        return checked;
    }

    /**
     * Re-checks a domain on request. Domains outside VERIFYING are returned unchanged.
     *
     * @param actor    Caller.
     * @param domainId Domain id.
     * @return Domain after the check.
     */
    public Domain verifyNow(Actor actor, String domainId) {
        Domain domain = getDomain(actor, domainId);
        if (domain.getStatus() != DomainStatus.VERIFYING) {
            log.info("Manual verify ignored for {}: status is {}", domain.getName(), domain.getStatus());
            return domain;
        }
        return check(domain);
    }

    /**
     * Deletes a domain and cleans up its provider identity and published records.
     *
     * @param actor    Caller.
     * @param domainId Domain id.
     */
    public void deleteDomain(Actor actor, String domainId) {
        Domain domain = getDomain(actor, domainId);
        if (repository.countActiveKeyReferences(domainId) > 0) {
            throw new ApiException(ApiError.DOMAIN_IN_USE);
        }

        try {
            identityProvider.deleteIdentity(domain.getName());
        } catch (IdentityProviderException e) {
            log.warn("Failed to delete identity for {}: {}", domain.getName(), e.getMessage());
        }
        if (dnsPublisher.isEnabled()) {
            try {
                int removed = dnsPublisher.deleteRecordsForDomain(domain.getName());
                log.info("Removed {} DNS records for {}", removed, domain.getName());
            } catch (DnsPublishException e) {
                log.warn("Failed to remove DNS records for {}: {}", domain.getName(), e.getMessage());
            }
        }

        try {
            if (!repository.delete(domainId)) {
                throw new ApiException(ApiError.NOT_FOUND, "Domain not found");
            }
        } catch (DomainInUseException e) {
            throw new ApiException(ApiError.DOMAIN_IN_USE);
        }
        locks.remove(domainId);
        log.info("Domain deleted: id={}, name={}", domainId, domain.getName());
    }

    /**
     * Loads a domain the caller may see.
     *
     * @param actor    Caller.
     * @param domainId Domain id.
     * @return Domain.
     */
    public Domain getDomain(Actor actor, String domainId) {
        Domain domain = repository.findById(domainId)
                .orElseThrow(() -> new ApiException(ApiError.NOT_FOUND, "Domain not found"));
        if (!actor.canAccessDomain(domain.getId())) {
            throw new ApiException(ApiError.FORBIDDEN);
        }
        return domain;
    }

    public List<Domain> listDomains(Actor actor, int page, int limit) {
        return repository.findPage(actor.getDomainScope(), limit, (long) (Math.max(page, 1) - 1) * limit);
    }

    public int countDomains(Actor actor) {
        return repository.count(actor.getDomainScope());
    }

    /**
     * Ids of domains whose setup has not run yet.
     */
    public List<String> pendingDomainIds() {
        List<String> ids = new ArrayList<>();
        for (Domain domain : repository.findByStatus(DomainStatus.PENDING)) {
            ids.add(domain.getId());
        }
        return ids;
    }

    /**
     * Time of the next scheduled check, or null when the domain is not being polled.
     *
     * @param domain Domain.
     * @return Next check time.
     */
    public OffsetDateTime nextCheckAt(Domain domain) {
        if (domain.getStatus() != DomainStatus.VERIFYING) {
            return null;
        }
        OffsetDateTime base = domain.getLastCheckedAt() != null
                ? domain.getLastCheckedAt() : domain.getVerificationStartedAt();
        return base != null ? base.plus(pollInterval) : null;
    }

    /**
     * Checks a domain lifecycle move.
     *
     * @param current Current status.
     * @param target  Target status.
     */
    public static void validateTransition(DomainStatus current, DomainStatus target) {
        if (current == null || target == null) {
            throw new IllegalArgumentException("Domain statuses are required");
        }
        boolean allowed = switch (current) {
            case PENDING -> target == DomainStatus.VERIFYING || target == DomainStatus.FAILED;
            case VERIFYING -> target == DomainStatus.VERIFIED || target == DomainStatus.FAILED;
            case VERIFIED, FAILED -> false;
        };
        if (!allowed) {
            throw new IllegalStateException("Invalid domain transition: " + current + " -> " + target);
        }
    }

    static String normalizeName(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }

    static boolean isValidHostname(String name) {
        return name != null && HOSTNAME.matcher(name).matches();
    }

    private void transition(Domain domain, DomainStatus target) {
        validateTransition(domain.getStatus(), target);
        domain.setStatus(target);
        GatewayMetrics.incrementDomainTransition(target.apiName());
    }

    private void persist(Domain domain, DomainStatus expected) {
        if (!repository.updateState(domain, expected)) {
            log.warn("Domain {} changed concurrently, expected status {}", domain.getId(), expected);
        }
    }

    private ReentrantLock lockFor(String domainId) {
        return locks.computeIfAbsent(domainId, id -> new ReentrantLock());
    }

    private static int sizeOf(List<?> list) {
        return list == null ? 0 : list.size();
    }
}
