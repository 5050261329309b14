package com.selfmx.auth;

import com.selfmx.error.ApiError;
import com.selfmx.error.ApiException;
import com.selfmx.gateway.domain.ApiKey;
import com.selfmx.gateway.domain.ApiKeyState;
import com.selfmx.gateway.domain.RevokedApiKey;
import com.selfmx.gateway.repository.ApiKeyRepository;
import com.selfmx.gateway.repository.DomainRepository;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * API key issuing, validation and lifecycle.
 *
 * <p>Secrets look like {@code re_} followed by 32 URL-safe characters ({@code re_admin_} for
 * admin keys). Only {@code base64(sha256(secret + salt))} is stored; the first 11 characters
 * are kept as the lookup prefix.
 * <p>Validation always performs one hash comparison, even when no key matches the prefix.
 */
public class ApiKeyService {
    private static final Logger log = LogManager.getLogger(ApiKeyService.class);

    public static final String KEY_PREFIX = "re_";
    public static final String ADMIN_KEY_PREFIX = "re_admin_";
    public static final int PREFIX_LENGTH = 11;
    static final int SECRET_LENGTH = 32;
    static final int SALT_BYTES = 16;
    static final int MAX_NAME_LENGTH = 100;

    private static final char[] ALPHABET =
            "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789-_".toCharArray();

    private final ApiKeyRepository keys;
    private final DomainRepository domains;
    private final Executor usageExecutor;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();
    private final String dummySalt;
    private final String dummyHash;

    /**
     * Constructs a new ApiKeyService.
     *
     * @param keys          Key repository.
     * @param domains       Domain repository, used to check allow-lists.
     * @param usageExecutor Executor for last-used updates.
     * @param clock         Clock.
     */
    public ApiKeyService(ApiKeyRepository keys, DomainRepository domains, Executor usageExecutor, Clock clock) {
        this.keys = Objects.requireNonNull(keys, "keys");
        this.domains = Objects.requireNonNull(domains, "domains");
        this.usageExecutor = Objects.requireNonNull(usageExecutor, "usageExecutor");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.dummySalt = newSalt();
        this.dummyHash = hash(generateSecret(false), dummySalt);
    }

    /**
     * Creates a key and returns the plain secret once.
     *
     * @param name      Display name.
     * @param admin     Admin flag.
     * @param domainIds Allowed domain ids.
     * @return Created key with its secret.
     */
    public CreatedApiKey create(String name, boolean admin, List<String> domainIds) {
        if (name == null || name.isBlank()) {
            throw new ApiException(ApiError.INVALID_REQUEST, "Name is required");
        }
        if (name.trim().length() > MAX_NAME_LENGTH) {
            throw new ApiException(ApiError.INVALID_REQUEST, "Name must be at most " + MAX_NAME_LENGTH + " characters");
        }
        List<String> ids = new ArrayList<>(new LinkedHashSet<>(domainIds != null ? domainIds : List.of()));
        if (!admin && ids.isEmpty()) {
            throw new ApiException(ApiError.INVALID_REQUEST, "Non-admin keys must have at least one domain");
        }
        for (String domainId : ids) {
            if (domains.findById(domainId).isEmpty()) {
                throw new ApiException(ApiError.INVALID_REQUEST, "Unknown domain id: " + domainId);
            }
        }

        String secret = generateSecret(admin);
        ApiKey key = new ApiKey();
        key.setId(UUID.randomUUID().toString());
        key.setName(name.trim());
        key.setKeySalt(newSalt());
        key.setKeyHash(hash(secret, key.getKeySalt()));
        key.setKeyPrefix(secret.substring(0, PREFIX_LENGTH));
        key.setAdmin(admin);
        key.setCreatedAt(OffsetDateTime.now(clock));
        key.setAllowedDomainIds(ids);
        keys.insert(key);

        log.info("API key created: id={}, prefix={}, admin={}, domains={}", key.getId(), key.getKeyPrefix(), admin, ids.size());
        return new CreatedApiKey(key, secret);
    }

    /**
     * Resolves a presented secret to an active key.
     *
     * @param secret Presented secret.
     * @param ip     Caller address recorded as last used.
     * @return Key when valid and not revoked.
     */
    public Optional<ApiKey> validate(String secret, String ip) {
        if (secret == null || !secret.startsWith(KEY_PREFIX) || secret.length() < PREFIX_LENGTH) {
            return Optional.empty();
        }

        List<ApiKey> candidates = keys.findActiveByPrefix(secret.substring(0, PREFIX_LENGTH));
        if (candidates.isEmpty()) {
            constantTimeEquals(hash(secret, dummySalt), dummyHash);
            log.debug("API key rejected: no active key for prefix");
            return Optional.empty();
        }

        for (ApiKey candidate : candidates) {
            if (constantTimeEquals(hash(secret, candidate.getKeySalt()), candidate.getKeyHash())) {
                recordUsage(candidate.getId(), ip);
                return Optional.of(candidate);
            }
        }
        log.debug("API key rejected: hash mismatch for prefix {}", candidates.get(0).getKeyPrefix());
        return Optional.empty();
    }

    public Optional<ApiKey> get(String id) {
        return keys.findById(id);
    }

    public List<ApiKey> list(int page, int limit) {
        return keys.findPage(limit, offset(page, limit));
    }

    public int count() {
        return keys.count();
    }

    public List<RevokedApiKey> listArchived(int page, int limit) {
        return keys.findArchivedPage(limit, offset(page, limit));
    }

    private static long offset(int page, int limit) {
        return (long) (Math.max(page, 1) - 1) * limit;
    }

    public int countArchived() {
        return keys.countArchived();
    }

    /**
     * Revokes a key. Revoking an already revoked key leaves it unchanged.
     *
     * @param id Key id.
     * @return Key after revocation.
     */
    public ApiKey revoke(String id) {
        ApiKey key = keys.findById(id).orElseThrow(() -> new ApiException(ApiError.NOT_FOUND, "API key not found"));
        if (key.getState() == ApiKeyState.REVOKED) {
            log.info("API key already revoked: id={}", id);
            return key;
        }
        validateTransition(key.getState(), ApiKeyState.REVOKED);

        OffsetDateTime now = OffsetDateTime.now(clock);
        if (keys.revoke(id, now)) {
            key.setRevokedAt(now);
            log.info("API key revoked: id={}, prefix={}", id, key.getKeyPrefix());
        }
        return keys.findById(id).orElse(key);
    }

    /**
     * Archives keys revoked longer than the retention period.
     *
     * @param retention Retention after revocation.
     * @param batchSize Keys per pass.
     * @return Number of keys archived.
     */
    public int archiveRevoked(Duration retention, int batchSize) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime cutoff = now.minus(retention);
        int archived = 0;
        while (!Thread.currentThread().isInterrupted()) {
            List<ApiKey> expired = keys.findRevokedBefore(cutoff, batchSize);
            int archivedThisPass = 0;
            for (ApiKey key : expired) {
                validateTransition(key.getState(), ApiKeyState.ARCHIVED);
                if (keys.archive(RevokedApiKey.from(key, now))) {
                    archivedThisPass++;
                    log.info("API key archived: id={}, prefix={}, revokedAt={}", key.getId(), key.getKeyPrefix(), key.getRevokedAt());
                }
            }
            archived += archivedThisPass;
            if (expired.size() < batchSize || archivedThisPass == 0) {
                break;
            }
        }
        return archived;
    }

    /**
     * Checks an API key lifecycle move.
     *
     * @param current Current state.
     * @param target  Target state.
     */
    static void validateTransition(ApiKeyState current, ApiKeyState target) {
        if (current == null || target == null) {
            throw new IllegalArgumentException("API key states are required");
        }
        boolean allowed = switch (current) {
            case ACTIVE -> target == ApiKeyState.REVOKED;
            case REVOKED -> target == ApiKeyState.ARCHIVED;
            case ARCHIVED -> false;
        };
        if (!allowed) {
            throw new IllegalStateException("Invalid API key transition: " + current + " -> " + target);
        }
    }

    /**
     * Generates a new secret.
     *
     * @param admin Admin flag.
     * @return Secret.
     */
    String generateSecret(boolean admin) {
        StringBuilder sb = new StringBuilder(admin ? ADMIN_KEY_PREFIX : KEY_PREFIX);
        for (int i = 0; i < SECRET_LENGTH; i++) {
            sb.append(ALPHABET[random.nextInt(ALPHABET.length)]);
        }
        return sb.toString();
    }

    private String newSalt() {
        byte[] salt = new byte[SALT_BYTES];
        random.nextBytes(salt);
        return Base64.getEncoder().encodeToString(salt);
    }

    /**
     * Hashes a secret with its salt.
     *
     * @param secret Secret.
     * @param salt   Base64 salt.
     * @return Base64 SHA-256 digest.
     */
    static String hash(String secret, String salt) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] out = digest.digest((secret + salt).getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(out);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static boolean constantTimeEquals(String a, String b) {
        return MessageDigest.isEqual(a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));
    }

    private void recordUsage(String keyId, String ip) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        try {
            usageExecutor.execute(() -> {
                try {
                    keys.updateLastUsed(keyId, now, ip);
                } catch (RuntimeException e) {
                    log.warn("Failed to record API key usage for {}: {}", keyId, e.getMessage());
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("API key usage update skipped for {}: {}", keyId, e.getMessage());
        }
    }

    /**
     * Newly created key with the secret that is shown once.
     *
     * @param key    Stored key.
     * @param secret Plain secret.
     */
    public record CreatedApiKey(ApiKey key, String secret) {
    }
}
