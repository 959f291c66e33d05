package com.continuum.relayer.unit.oms;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.continuum.relayer.config.RelayerProperties;
import com.continuum.relayer.oms.IdempotencyService;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for IdempotencyService covering fingerprint claims, the dedup window,
 * release of unused reservations and key generation.
 */
class IdempotencyServiceTest {

    private static final Instant T0 = Instant.parse("2025-03-01T10:00:00Z");
    private static final String FINGERPRINT = "UserA|PoolX|nonce-1";

    private Clock clock;
    private IdempotencyService idempotencyService;

    @BeforeEach
    void setUp() {
        clock = mock(Clock.class);
        when(clock.instant()).thenReturn(T0);

        RelayerProperties properties = new RelayerProperties();
        properties.getIntake().setDedupWindow(Duration.ofMinutes(5));
        idempotencyService = new IdempotencyService(properties, clock);
    }

    @Nested
    @DisplayName("Claims")
    class Claims {

        @Test
        @DisplayName("First claim of a fingerprint succeeds")
        void firstClaimSucceeds() {
            assertThat(idempotencyService.claim(FINGERPRINT, "ord_1")).isEmpty();
        }

        @Test
        @DisplayName("Second claim within the window returns the holder")
        void duplicateWithinWindow() {
            idempotencyService.claim(FINGERPRINT, "ord_1");

            when(clock.instant()).thenReturn(T0.plus(Duration.ofMinutes(4)));

            assertThat(idempotencyService.claim(FINGERPRINT, "ord_2")).contains("ord_1");
        }

        @Test
        @DisplayName("Claim after the window expires is accepted")
        void claimAfterExpiry() {
            idempotencyService.claim(FINGERPRINT, "ord_1");

            when(clock.instant()).thenReturn(T0.plus(Duration.ofMinutes(5)));

            assertThat(idempotencyService.claim(FINGERPRINT, "ord_2")).isEmpty();
            assertThat(idempotencyService.claim(FINGERPRINT, "ord_3")).contains("ord_2");
        }

        @Test
        @DisplayName("Different nonces are independent")
        void differentNoncesIndependent() {
            idempotencyService.claim(FINGERPRINT, "ord_1");

            assertThat(idempotencyService.claim("UserA|PoolX|nonce-2", "ord_2")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Release and eviction")
    class ReleaseAndEviction {

        @Test
        @DisplayName("Released fingerprint can be claimed again")
        void releaseFreesFingerprint() {
            idempotencyService.claim(FINGERPRINT, "ord_1");
            idempotencyService.release(FINGERPRINT, "ord_1");

            assertThat(idempotencyService.claim(FINGERPRINT, "ord_2")).isEmpty();
        }

        @Test
        @DisplayName("Release by a non-holder leaves the claim in place")
        void releaseByOtherOrderIgnored() {
            idempotencyService.claim(FINGERPRINT, "ord_1");
            idempotencyService.release(FINGERPRINT, "ord_other");

            assertThat(idempotencyService.claim(FINGERPRINT, "ord_2")).contains("ord_1");
        }

        @Test
        @DisplayName("evictExpired drops only expired claims")
        void evictExpired() {
            idempotencyService.claim(FINGERPRINT, "ord_1");
            when(clock.instant()).thenReturn(T0.plus(Duration.ofMinutes(3)));
            idempotencyService.claim("UserB|PoolX|n", "ord_2");

            when(clock.instant()).thenReturn(T0.plus(Duration.ofMinutes(6)));

            assertThat(idempotencyService.evictExpired()).isEqualTo(1);
            assertThat(idempotencyService.claim("UserB|PoolX|n", "ord_3")).contains("ord_2");
        }
    }

    @Test
    @DisplayName("generateHash is deterministic and 16 hex chars long")
    void hashFormat() {
        String first = idempotencyService.generateHash(FINGERPRINT);

        assertThat(first).hasSize(16).matches("[0-9a-f]{16}");
        assertThat(idempotencyService.generateHash(FINGERPRINT)).isEqualTo(first);
        assertThat(idempotencyService.generateHash("UserA|PoolX|nonce-2")).isNotEqualTo(first);
    }
}
