package com.demo.underwriting.service.profile;

import com.demo.underwriting.config.LookupExecutorConfig;
import com.demo.underwriting.model.EvidenceWarning;
import com.demo.underwriting.model.Platform;
import com.demo.underwriting.model.ProfileAnalysis;
import com.demo.underwriting.model.SocialProfileRef;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

@DisplayName("ProfileEvidenceCollector")
class ProfileEvidenceCollectorTest {

    private static final String NARRATIVE = """
            Stable employment history.

            **Positive indicators:**
            - Long-term employment
            - Strong community ties""";

    private final ThreadPoolTaskExecutor executor = LookupExecutorConfig.lookupExecutor("lookup-test-", 2, 16);

    private final SocialProfileRef linkedin = new SocialProfileRef(Platform.LINKEDIN, "Jane Doe");
    private final SocialProfileRef instagram = new SocialProfileRef(Platform.INSTAGRAM, "janedoe");
    private final SocialProfileRef twitter = new SocialProfileRef(Platform.TWITTER, "jane_d");

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    private ProfileEvidenceCollector collector(ProfileSearchPort port, long timeoutMs) {
        return new ProfileEvidenceCollector(port, new ProfileNarrativeParser(), executor, timeoutMs);
    }

    @Test
    @DisplayName("no identifiers is a valid, empty outcome")
    void noIdentifiers() {
        ProfileSearchPort port = mock(ProfileSearchPort.class);

        EvidenceCollection c = collector(port, 1_000).collect(List.of());

        assertThat(c.analyses()).isEmpty();
        assertThat(c.warnings()).isEmpty();
        assertThat(c.requested()).isZero();
        verifyNoInteractions(port);
    }

    @Test
    @DisplayName("a disabled capability yields no analyses and makes no calls")
    void disabled() {
        AtomicInteger calls = new AtomicInteger();
        ProfileSearchPort port = new DisabledProfileSearch() {
            @Override
            public String search(Platform platform, String identifier) throws ProfileSearchException {
                calls.incrementAndGet();
                return super.search(platform, identifier);
            }
        };

        EvidenceCollection c = collector(port, 1_000).collect(List.of(linkedin, twitter));

        assertThat(c.analyses()).isEmpty();
        assertThat(c.warnings()).extracting(EvidenceWarning::reason).containsOnly("profile search disabled");
        assertThat(c.requested()).isEqualTo(2);
        assertThat(calls).hasValue(0);
    }

    @Test
    @DisplayName("keeps input order even when lookups finish out of order")
    void ordering() {
        ProfileSearchPort port = (platform, identifier) -> {
            if (platform == Platform.LINKEDIN) {
                sleep(200);
            }
            return NARRATIVE;
        };

        EvidenceCollection c = collector(port, 5_000).collect(List.of(linkedin, instagram, twitter));

        assertThat(c.analyses()).extracting(ProfileAnalysis::platform)
                .containsExactly(Platform.LINKEDIN, Platform.INSTAGRAM, Platform.TWITTER);
        assertThat(c.analyses().get(0).positiveIndicators())
                .containsExactly("Long-term employment", "Strong community ties");
        assertThat(c.warnings()).isEmpty();
    }

    @Test
    @DisplayName("a failed lookup becomes a warning and does not affect its siblings")
    void partialFailure() {
        ProfileSearchPort port = (platform, identifier) -> {
            if (platform == Platform.INSTAGRAM) {
                throw new ProfileSearchException("identifier not found");
            }
            if (platform == Platform.TWITTER) {
                return "   ";
            }
            return NARRATIVE;
        };

        EvidenceCollection c = collector(port, 5_000).collect(List.of(linkedin, instagram, twitter));

        assertThat(c.analyses()).extracting(ProfileAnalysis::platform).containsExactly(Platform.LINKEDIN);
        assertThat(c.warnings()).extracting(EvidenceWarning::platform)
                .containsExactly(Platform.INSTAGRAM, Platform.TWITTER);
        assertThat(c.warnings().get(0).reason()).isEqualTo("identifier not found");
        assertThat(c.warnings().get(1).reason()).isEqualTo("empty narrative");
    }

    @Test
    @DisplayName("unexpected runtime errors are contained too")
    void runtimeFailure() {
        ProfileSearchPort port = (platform, identifier) -> {
            throw new IllegalStateException("connection reset");
        };

        EvidenceCollection c = collector(port, 5_000).collect(List.of(linkedin));

        assertThat(c.analyses()).isEmpty();
        assertThat(c.warnings()).singleElement()
                .satisfies(w -> assertThat(w.reason()).isEqualTo("connection reset"));
    }

    @Test
    @DisplayName("a slow lookup times out without delaying past its own timeout")
    void timeout() {
        ProfileSearchPort port = (platform, identifier) -> {
            if (platform == Platform.INSTAGRAM) {
                sleep(5_000);
            }
            return NARRATIVE;
        };

        long start = System.nanoTime();
        EvidenceCollection c = collector(port, 300).collect(List.of(linkedin, instagram));
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertThat(c.analyses()).extracting(ProfileAnalysis::platform).containsExactly(Platform.LINKEDIN);
        assertThat(c.warnings()).singleElement()
                .satisfies(w -> assertThat(w.reason()).contains("timed out"));
        assertThat(elapsedMs).isLessThan(3_000);
    }

    @Test
    @DisplayName("slow lookups of one assessment do not starve the lookups of another")
    void concurrentCallsAreIndependent() throws Exception {
        CountDownLatch slowStarted = new CountDownLatch(2);
        ProfileSearchPort port = (platform, identifier) -> {
            if (identifier.startsWith("slow")) {
                slowStarted.countDown();
                blockIgnoringInterrupts(1_500);
            }
            return NARRATIVE;
        };
        ProfileEvidenceCollector collector = collector(port, 300);

        // given: another assessment already holds both core threads
        CompletableFuture<EvidenceCollection> first = CompletableFuture.supplyAsync(() -> collector.collect(List.of(
                new SocialProfileRef(Platform.LINKEDIN, "slow-1"),
                new SocialProfileRef(Platform.INSTAGRAM, "slow-2"))));
        assertThat(slowStarted.await(5, TimeUnit.SECONDS)).isTrue();

        // when
        EvidenceCollection second = collector.collect(List.of(new SocialProfileRef(Platform.LINKEDIN, "fast")));

        // then
        assertThat(second.analyses()).extracting(ProfileAnalysis::identifier).containsExactly("fast");
        assertThat(second.warnings()).isEmpty();
        assertThat(first.get(5, TimeUnit.SECONDS).warnings()).hasSize(2)
                .allSatisfy(w -> assertThat(w.reason()).contains("timed out"));
    }

    @Test
    @DisplayName("a saturated executor loses the lookup at once instead of queueing it")
    void saturatedExecutorRejectsImmediately() throws Exception {
        ThreadPoolTaskExecutor single = LookupExecutorConfig.lookupExecutor("lookup-single-", 1, 1);
        try {
            CountDownLatch busy = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            single.execute(() -> {
                busy.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            assertThat(busy.await(5, TimeUnit.SECONDS)).isTrue();
            ProfileEvidenceCollector collector = new ProfileEvidenceCollector(
                    (platform, identifier) -> NARRATIVE, new ProfileNarrativeParser(), single, 5_000);

            long start = System.nanoTime();
            EvidenceCollection c = collector.collect(List.of(linkedin));
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            release.countDown();

            assertThat(c.analyses()).isEmpty();
            assertThat(c.warnings()).extracting(EvidenceWarning::reason)
                    .containsExactly(ProfileEvidenceCollector.REJECTED_REASON);
            assertThat(elapsedMs).isLessThan(1_000);
        } finally {
            single.shutdown();
        }
    }

    /** Mimics a socket read that keeps blocking when the thread is interrupted. */
    private static void blockIgnoringInterrupts(long ms) {
        long end = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(ms);
        boolean interrupted = false;
        while (System.nanoTime() < end) {
            try {
                Thread.sleep(Math.max(1L, TimeUnit.NANOSECONDS.toMillis(end - System.nanoTime())));
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private static void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
