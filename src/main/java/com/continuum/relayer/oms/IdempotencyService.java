package com.continuum.relayer.oms;

import com.continuum.relayer.config.RelayerProperties;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Remembers accepted submission fingerprints for the dedup window so a client retrying the
 * same request (same user, pool and nonce) is not relayed twice.
 *
 * <p>Keys are the first 16 hex chars of SHA-256(fingerprint). Entries expire lazily: an
 * expired key is treated as absent and overwritten by the next claim.
 */
@Service
public class IdempotencyService {

    private static final Logger log = LoggerFactory.getLogger(IdempotencyService.class);

    private final Map<String, Claim> claims = new ConcurrentHashMap<>();
    private final Duration dedupWindow;
    private final Clock clock;

    @Autowired
    public IdempotencyService(RelayerProperties relayerProperties, Clock clock) {
        this(relayerProperties.getIntake().getDedupWindow(), clock);
    }

    IdempotencyService(Duration dedupWindow, Clock clock) {
        this.dedupWindow = dedupWindow;
        this.clock = clock;
    }

    /**
     * Atomically records the fingerprint for the given order.
     *
     * @return empty if the fingerprint was free, otherwise the order id that already holds it
     */
    public Optional<String> claim(String fingerprint, String orderId) {
        String key = generateHash(fingerprint);
        Instant now = clock.instant();
        Claim fresh = new Claim(orderId, now.plus(dedupWindow));

        Claim winner = claims.merge(key, fresh, (existing, candidate) -> existing.isExpired(now) ? candidate : existing);

        if (winner != fresh) {
            log.debug("Duplicate submission detected: key={}, existingOrderId={}", key, winner.orderId());
            return Optional.of(winner.orderId());
        }
        return Optional.empty();
    }

    /** Frees a fingerprint whose order was never accepted (e.g. the user transaction failed to broadcast). */
    public void release(String fingerprint, String orderId) {
        String key = generateHash(fingerprint);
        claims.computeIfPresent(key, (k, existing) -> existing.orderId().equals(orderId) ? null : existing);
        log.debug("Idempotency key released: {}", key);
    }

    /** Drops expired claims. */
    @Scheduled(fixedRate = 60_000)
    public int evictExpired() {
        Instant now = clock.instant();
        int before = claims.size();
        claims.values().removeIf(claim -> claim.isExpired(now));
        int evicted = before - claims.size();
        if (evicted > 0) {
            log.debug("Expired idempotency keys evicted: count={}", evicted);
        }
        return evicted;
    }

    public String generateHash(String fingerprint) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(fingerprint.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, 16);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private record Claim(String orderId, Instant expiresAt) {

        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
