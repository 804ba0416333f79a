package io.github.drompincen.remedyguard.runtime.gate;

import io.github.drompincen.remedyguard.persistence.audit.AuditLog;
import io.github.drompincen.remedyguard.protocol.api.DecisionRecord;
import io.github.drompincen.remedyguard.protocol.api.ThreatRecord;
import io.github.drompincen.remedyguard.protocol.error.AuditWriteException;
import io.github.drompincen.remedyguard.protocol.error.ConfirmationRequiredException;
import io.github.drompincen.remedyguard.protocol.error.DecisionException;
import io.github.drompincen.remedyguard.protocol.error.DecisionFailedException;
import io.github.drompincen.remedyguard.protocol.error.GenerationException;
import io.github.drompincen.remedyguard.protocol.error.GenerationTimeoutException;
import io.github.drompincen.remedyguard.protocol.error.InputException;
import io.github.drompincen.remedyguard.runtime.classify.DestructiveClassifier;
import io.github.drompincen.remedyguard.runtime.generation.GenerationClient;
import io.github.drompincen.remedyguard.runtime.prompt.GenerationPrompt;
import io.github.drompincen.remedyguard.runtime.prompt.PromptBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Decides whether a generated remediation may proceed.
 *
 * <p>Non-destructive recommendations are approved outright. Destructive ones are approved
 * only when the caller supplied prior confirmation; otherwise they are denied, since a
 * missing confirmation counts as a refusal. Every attempt that gets past input validation
 * is written to the audit log before this class returns or throws, failures included.
 */
@Service
public class ApprovalGate {

    private static final Logger log = LoggerFactory.getLogger(ApprovalGate.class);

    static final String DENIAL_NOTE = "Destructive action denied: caller must confirm.";
    static final String CONFIRMED_NOTE = "Destructive action approved by prior confirmation.";

    private final PromptBuilder promptBuilder;
    private final GenerationClient generationClient;
    private final DestructiveClassifier classifier;
    private final AuditLog auditLog;
    private final ExecutorService generationExecutor;
    private final Duration generationTimeout;
    private final Clock clock;

    public ApprovalGate(PromptBuilder promptBuilder,
                        GenerationClient generationClient,
                        DestructiveClassifier classifier,
                        AuditLog auditLog,
                        @Qualifier("generationExecutor") ExecutorService generationExecutor,
                        @Value("${remedyguard.generation.timeout:60s}") Duration generationTimeout,
                        Clock clock) {
        if (generationTimeout == null || generationTimeout.isZero() || generationTimeout.isNegative()) {
            throw new IllegalArgumentException("Generation timeout must be positive: " + generationTimeout);
        }
        this.promptBuilder = promptBuilder;
        this.generationClient = generationClient;
        this.classifier = classifier;
        this.auditLog = auditLog;
        this.generationExecutor = generationExecutor;
        this.generationTimeout = generationTimeout;
        this.clock = clock;
    }

    /**
     * Runs one decision attempt.
     *
     * @param priorConfirmation out-of-band human approval asserted by the caller at submission time
     * @return the approved decision, as logged
     * @throws ConfirmationRequiredException if the recommendation is destructive and unconfirmed
     * @throws InputException                if the threat is malformed
     * @throws GenerationException           if the backend failed or timed out
     * @throws AuditWriteException           if the decision could not be logged
     */
    public DecisionRecord decide(ThreatRecord threat, boolean priorConfirmation) {
        if (threat == null || threat.threatId() == null || threat.threatId().isBlank()) {
            throw new InputException("threat_id is required");
        }
        String threatId = threat.threatId();

        try {
            GenerationPrompt prompt = buildPrompt(threatId, threat);
            String recommendation = generate(threatId, prompt);
            transition(threatId, DecisionState.GENERATED);

            boolean destructive = classifier.isDestructive(recommendation);
            transition(threatId, DecisionState.CLASSIFIED);

            DecisionRecord decision;
            if (!destructive) {
                transition(threatId, DecisionState.AUTO_APPROVED);
                decision = DecisionRecord.approved(threatId, recommendation, false, null, now());
            } else {
                transition(threatId, DecisionState.PENDING_CONFIRMATION);
                if (priorConfirmation) {
                    decision = DecisionRecord.approved(threatId, recommendation, true, CONFIRMED_NOTE, now());
                } else {
                    log.warn("Destructive action requested for threat {}: {}. Awaiting manual confirmation.",
                            threatId, recommendation);
                    decision = DecisionRecord.denied(threatId, recommendation, DENIAL_NOTE, now());
                }
            }
            transition(threatId, decision.approved() ? DecisionState.APPROVED : DecisionState.DENIED);

            DecisionRecord logged = record(decision);
            if (!logged.approved()) {
                throw new ConfirmationRequiredException(logged);
            }
            return logged;
        } catch (DecisionException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Unexpected error while deciding threat {}: {}", threatId, e.getMessage(), e);
            DecisionRecord failed = recordFailure(threatId, "Unexpected error: " + e.getMessage());
            throw new DecisionFailedException("Unexpected error while deciding threat " + threatId, failed, e);
        }
    }

    /**
     * Logs a failed record for an item that never reached {@link #decide}, so a caller
     * reporting it still has a matching audit entry.
     *
     * @throws AuditWriteException if the record could not be logged
     */
    public DecisionRecord recordRejected(String threatId, String notes) {
        return recordFailure(threatId, notes);
    }

    public Duration generationTimeout() {
        return generationTimeout;
    }

    private GenerationPrompt buildPrompt(String threatId, ThreatRecord threat) {
        try {
            return promptBuilder.build(threat);
        } catch (InputException e) {
            DecisionRecord failed = recordFailure(threatId, "Invalid threat data: " + e.getMessage());
            throw new InputException(e.getMessage(), failed, e);
        }
    }

    private String generate(String threatId, GenerationPrompt prompt) {
        Future<String> future = generationExecutor.submit(() -> generationClient.generate(prompt));
        try {
            return future.get(generationTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Generation for threat {} timed out after {} ms", threatId, generationTimeout.toMillis());
            DecisionRecord failed = recordFailure(threatId,
                    "Generation timed out after " + generationTimeout.toMillis() + " ms");
            throw new GenerationTimeoutException(generationTimeout, failed, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof GenerationTimeoutException clientTimeout) {
                DecisionRecord failed = recordFailure(threatId, clientTimeout.getMessage());
                throw new GenerationTimeoutException(clientTimeout.timeout(), failed, cause);
            }
            String reason = cause instanceof GenerationException
                    ? cause.getMessage()
                    : "Model generation failed: " + cause.getMessage();
            log.error("Generation for threat {} failed: {}", threatId, reason);
            DecisionRecord failed = recordFailure(threatId, "Generation failed: " + reason);
            throw new GenerationException(reason, failed, cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            DecisionRecord failed = recordFailure(threatId, "Generation failed: interrupted");
            throw new GenerationException("Generation interrupted", failed, e);
        }
    }

    private DecisionRecord recordFailure(String threatId, String notes) {
        transition(threatId, DecisionState.FAILED);
        return record(DecisionRecord.failed(threatId, notes, now()));
    }

    private DecisionRecord record(DecisionRecord decision) {
        try {
            auditLog.append(decision);
        } catch (AuditWriteException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AuditWriteException("Audit log rejected decision for threat " + decision.threatId(), e);
        }
        transition(decision.threatId(), DecisionState.LOGGED);
        log.info("Decision for threat {}: destructive={}, approved={}{}", decision.threatId(),
                decision.destructive(), decision.approved(),
                decision.notes() != null ? " (" + decision.notes() + ")" : "");
        return decision;
    }

    private void transition(String threatId, DecisionState state) {
        log.debug("Threat {} -> {}", threatId, state);
    }

    private Instant now() {
        return Instant.now(clock).truncatedTo(ChronoUnit.MILLIS);
    }
}
