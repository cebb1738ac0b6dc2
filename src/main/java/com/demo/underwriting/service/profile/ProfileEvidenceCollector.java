package com.demo.underwriting.service.profile;

import com.demo.underwriting.model.EvidenceWarning;
import com.demo.underwriting.model.ProfileAnalysis;
import com.demo.underwriting.model.SocialProfileRef;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Looks up every declared profile concurrently and keeps the ones that could be
 * analyzed. A lookup that fails, times out or returns garbage becomes an
 * {@link EvidenceWarning}; nothing is thrown to the caller.
 * <p>
 * Each lookup's deadline starts once it is handed to a thread, so the executor must start tasks
 * right away instead of queueing them (see
 * {@link com.demo.underwriting.config.LookupExecutorConfig}). A lookup the
 * executor refuses is lost at once rather than waiting for a free thread.
 */
@Slf4j
@Service
public class ProfileEvidenceCollector {

    static final String REJECTED_REASON = "no lookup thread available";

    private final ProfileSearchPort port;
    private final ProfileNarrativeParser parser;
    private final Executor executor;
    private final long timeoutMs;

    public ProfileEvidenceCollector(ProfileSearchPort port,
                                    ProfileNarrativeParser parser,
                                    @Qualifier("profileLookupExecutor") Executor executor,
                                    @Value("${profileSearch.lookupTimeoutMs:20000}") long lookupTimeoutMs) {
        if (lookupTimeoutMs <= 0) {
            throw new IllegalArgumentException("lookup timeout must be positive: " + lookupTimeoutMs);
        }
        this.port = port;
        this.parser = parser;
        this.executor = executor;
        this.timeoutMs = lookupTimeoutMs;
    }

    public EvidenceCollection collect(List<SocialProfileRef> refs) {
        if (refs == null || refs.isEmpty()) {
            return EvidenceCollection.empty();
        }
        List<EvidenceWarning> warnings = new ArrayList<>();
        if (!port.isEnabled()) {
            // tắt tính năng -> không gọi ra ngoài
            for (SocialProfileRef r : refs) {
                warnings.add(new EvidenceWarning(r.platform(), r.identifier(), "profile search disabled"));
            }
            return new EvidenceCollection(refs.size(), List.of(), warnings);
        }

        List<FutureTask<ProfileAnalysis>> tasks = new ArrayList<>(refs.size());
        List<Long> deadlines = new ArrayList<>(refs.size());
        for (SocialProfileRef r : refs) {
            FutureTask<ProfileAnalysis> task = new FutureTask<>(() -> lookup(r));
            try {
                executor.execute(task);
            } catch (RejectedExecutionException e) {
                log.warn("Profile lookup rejected: platform={} reason={}", r.platform(), e.getMessage());
                task = null;
            }
            tasks.add(task);
            deadlines.add(System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs));
        }

        List<ProfileAnalysis> analyses = new ArrayList<>();
        for (int i = 0; i < refs.size(); i++) {
            SocialProfileRef r = refs.get(i);
            FutureTask<ProfileAnalysis> task = tasks.get(i);
            String reason;
            if (task == null) {
                reason = REJECTED_REASON;
            } else {
                try {
                    long remaining = Math.max(0L, deadlines.get(i) - System.nanoTime());
                    analyses.add(task.get(remaining, TimeUnit.NANOSECONDS));
                    continue;
                } catch (TimeoutException e) {
                    task.cancel(true);
                    reason = "lookup timed out after " + timeoutMs + " ms";
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() == null ? e : e.getCause();
                    reason = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    task.cancel(true);
                    reason = "lookup interrupted";
                }
            }
            log.warn("Profile lookup lost: platform={} reason={}", r.platform(), reason);
            warnings.add(new EvidenceWarning(r.platform(), r.identifier(), reason));
        }
        log.info("Profile evidence collected: requested={} analyzed={}", refs.size(), analyses.size());
        return new EvidenceCollection(refs.size(), analyses, warnings);
    }

    private ProfileAnalysis lookup(SocialProfileRef r) throws ProfileSearchException {
        String narrative = port.search(r.platform(), r.identifier());
        return parser.parse(r.platform(), r.identifier(), narrative);
    }
}
