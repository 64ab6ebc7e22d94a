package com.webdoc.core.state;

import com.webdoc.core.events.EventBroadcaster;
import com.webdoc.core.events.PipelineEvents;
import com.webdoc.core.metrics.PipelineMetrics;
import com.webdoc.core.model.CommandResult;
import com.webdoc.core.model.DocumentResult;
import com.webdoc.core.model.FailureReason;
import com.webdoc.core.model.PipelineConfig;
import com.webdoc.core.model.ProgressEvent;
import com.webdoc.core.model.ProgressKind;
import com.webdoc.core.model.SessionSnapshot;
import com.webdoc.core.model.SessionStage;
import com.webdoc.core.model.Topic;
import com.webdoc.core.stage.StageReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owner and sole mutator of the single pipeline session.
 *
 * <p>Every transition is looked up in {@link TransitionTable} and applied under one
 * {@link ReentrantLock}. A command whose preconditions do not hold returns a rejected
 * {@link CommandResult} immediately instead of waiting. Events describing a transition are
 * published to the {@link EventBroadcaster} while the lock is held, which gives all observers
 * one global order and lets {@link #subscribe()} hand out a snapshot with no gap or overlap.
 *
 * <p>Stage outcomes reported by executors carry the session ID they were launched for; a report
 * for a session that has since been cancelled or replaced is ignored.
 */
@Service
public class SessionStateMachine {

    private static final Logger log = LoggerFactory.getLogger(SessionStateMachine.class);

    private static final DateTimeFormatter ID_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneId.systemDefault());
    private static final AtomicInteger SESSION_COUNTER = new AtomicInteger(0);

    private final Lock lock = new ReentrantLock();
    private final EventBroadcaster broadcaster;
    private final PipelineMetrics metrics;

    private Session current;

    @Autowired
    public SessionStateMachine(EventBroadcaster broadcaster,
                               @Autowired(required = false) PipelineMetrics metrics) {
        this.broadcaster = Objects.requireNonNull(broadcaster, "broadcaster");
        this.metrics = metrics;
    }

    public SessionStateMachine(EventBroadcaster broadcaster) {
        this(broadcaster, null);
    }

    // ── Commands ─────────────────────────────────────────────────────

    /**
     * Creates a new session in {@code running_ideas}. The configuration is assumed valid.
     */
    public CommandResult start(PipelineConfig config) {
        Objects.requireNonNull(config, "config");
        lock.lock();
        try {
            SessionStage stage = currentStage();
            if (TransitionTable.next(stage, SessionEvent.START).isEmpty()) {
                return CommandResult.conflict(current.id, stage,
                        "Session " + current.id + " is " + stage.wireName() + "; cancel it or wait for it to finish");
            }
            current = new Session(generateSessionId(), config, Instant.now());
            log.info("Session {} started for pipeline '{}'", current.id, config.name());
            broadcaster.publish(PipelineEvents.stageChanged(current.id, current.stage));
            return CommandResult.accepted(current.id, current.stage);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves {@code awaiting_selection} to {@code running_docs} with the given selection.
     * Duplicate IDs are collapsed; order of first appearance is the processing order.
     */
    public CommandResult selectAndGenerate(List<Integer> selection) {
        lock.lock();
        try {
            SessionStage stage = currentStage();
            if (current == null) {
                return CommandResult.conflict(null, stage, "No active session");
            }
            if (TransitionTable.next(stage, SessionEvent.SELECT).isEmpty()) {
                return CommandResult.conflict(current.id, stage,
                        "Session is not awaiting selection; current stage: " + stage.wireName());
            }
            if (selection == null || selection.isEmpty()) {
                return CommandResult.invalid(current.id, stage, "Selection must contain at least one topic");
            }
            Set<Integer> known = new LinkedHashSet<>();
            current.topics.forEach(t -> known.add(t.id()));
            List<Integer> unknown = selection.stream()
                    .filter(id -> id == null || !known.contains(id))
                    .toList();
            if (!unknown.isEmpty()) {
                return CommandResult.invalid(current.id, stage, "Unknown topic ids: " + unknown);
            }

            current.selection = List.copyOf(new LinkedHashSet<>(selection));
            current.stage = SessionStage.RUNNING_DOCS;
            current.currentStageName = ProgressEvent.DOCS;
            log.info("Session {} selected {} of {} topics: {}", current.id,
                    current.selection.size(), current.topics.size(), current.selection);
            broadcaster.publish(PipelineEvents.stageChanged(current.id, current.stage));
            return CommandResult.accepted(current.id, current.stage);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cancels the session from any non-terminal stage. The caller is responsible for
     * signalling the active subprocess.
     */
    public CommandResult cancel() {
        lock.lock();
        try {
            SessionStage stage = currentStage();
            if (current == null) {
                return CommandResult.conflict(null, stage, "No active session");
            }
            if (TransitionTable.next(stage, SessionEvent.CANCEL).isEmpty()) {
                return CommandResult.conflict(current.id, stage,
                        "Session already " + stage.wireName());
            }
            current.cancelRequested = true;
            log.info("Session {} cancelled during {}", current.id, stage.wireName());
            finish(SessionStage.CANCELLED);
            return CommandResult.accepted(current.id, current.stage);
        } finally {
            lock.unlock();
        }
    }

    // ── Stage reports ────────────────────────────────────────────────

    /**
     * Idea stage produced topics: {@code running_ideas} to {@code awaiting_selection}.
     *
     * @return false if the session is no longer in the idea stage
     */
    public boolean ideaStageSucceeded(String sessionId, List<Topic> topics) {
        if (topics == null || topics.isEmpty()) {
            throw new IllegalArgumentException("Idea stage success requires at least one topic");
        }
        lock.lock();
        try {
            if (!applicable(sessionId, SessionEvent.IDEAS_SUCCEEDED)) {
                return false;
            }
            current.topics = List.copyOf(topics);
            current.stage = SessionStage.AWAITING_SELECTION;
            log.info("Session {} has {} topics, awaiting selection", sessionId, topics.size());
            broadcaster.publish(PipelineEvents.stageChanged(sessionId, current.stage));
            broadcaster.publish(PipelineEvents.topicsReady(sessionId, current.topics));
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Idea stage failed or timed out: {@code running_ideas} to {@code failed}.
     */
    public boolean ideaStageFailed(String sessionId, FailureReason reason, String detail) {
        lock.lock();
        try {
            if (!applicable(sessionId, SessionEvent.IDEAS_FAILED)) {
                return false;
            }
            fail(reason, detail);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Any running stage hit an unexpected error: {@code running_*} to {@code failed}.
     */
    public boolean stageFailed(String sessionId, FailureReason reason, String detail) {
        lock.lock();
        try {
            if (!applicable(sessionId, SessionEvent.STAGE_FAILED)) {
                return false;
            }
            fail(reason, detail);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records a progress observation. The published percent never decreases within a stage:
     * a lower value is dropped and its text forwarded at the current percent.
     *
     * @return false if the session is not running the event's stage or cancellation was requested
     */
    public boolean recordProgress(String sessionId, ProgressEvent event) {
        lock.lock();
        try {
            if (!isRunning(sessionId) || !current.currentStageName.equals(event.stageName())) {
                return false;
            }
            int percent = current.currentPercent(event.stageName());
            ProgressEvent effective = event.kind() == ProgressKind.PROGRESS && event.percent() >= percent
                    ? event
                    : event.asMessage(percent);
            current.latestProgress.put(effective.stageName(), effective);
            broadcaster.publish(PipelineEvents.progress(sessionId, effective));
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Appends one topic's document result. Results must arrive in selection order, one per topic.
     */
    public boolean docStageProgress(String sessionId, DocumentResult result) {
        lock.lock();
        try {
            if (!applicable(sessionId, SessionEvent.DOC_PROGRESS) || current.cancelRequested) {
                return false;
            }
            int position = current.results.size();
            if (position >= current.selection.size() || current.selection.get(position) != result.topicId()) {
                log.warn("Session {} rejected out-of-order result for topic {} (expected {})", sessionId,
                        result.topicId(), position < current.selection.size() ? current.selection.get(position) : "none");
                return false;
            }
            current.results.add(result);
            if (metrics != null) {
                metrics.recordDocumentResult(result.status().wireName());
            }
            log.info("Session {} topic {} -> {} after {} attempt(s)", sessionId,
                    result.topicId(), result.status().wireName(), result.attempts());
            broadcaster.publish(PipelineEvents.documentResult(sessionId, result));
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Document stage done: {@code running_docs} to {@code completed}, once every selected topic
     * has a result.
     */
    public boolean docStageFinished(String sessionId) {
        lock.lock();
        try {
            if (!applicable(sessionId, SessionEvent.DOCS_FINISHED)) {
                return false;
            }
            if (current.results.size() != current.selection.size()) {
                log.warn("Session {} cannot complete: {} of {} topics have results", sessionId,
                        current.results.size(), current.selection.size());
                return false;
            }
            finish(SessionStage.COMPLETED);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Fail-fast abort of the document stage: {@code running_docs} to {@code failed}.
     */
    public boolean docStageAborted(String sessionId, String detail) {
        lock.lock();
        try {
            if (!applicable(sessionId, SessionEvent.DOCS_ABORTED)) {
                return false;
            }
            fail(FailureReason.DOCUMENT_FAILED, detail);
            return true;
        } finally {
            lock.unlock();
        }
    }

    // ── Queries and observers ────────────────────────────────────────

    public SessionSnapshot snapshot() {
        lock.lock();
        try {
            return current == null ? SessionSnapshot.idle() : current.snapshot();
        } finally {
            lock.unlock();
        }
    }

    public Optional<String> currentSessionId() {
        lock.lock();
        try {
            return Optional.ofNullable(current).map(s -> s.id);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Registers an observer whose first event is a snapshot of the current session.
     */
    public EventBroadcaster.Observer subscribe() {
        lock.lock();
        try {
            SessionSnapshot snapshot = current == null ? SessionSnapshot.idle() : current.snapshot();
            return broadcaster.subscribe(PipelineEvents.snapshot(snapshot));
        } finally {
            lock.unlock();
        }
    }

    public void unsubscribe(EventBroadcaster.Observer observer) {
        broadcaster.unsubscribe(observer);
    }

    /**
     * Reporter bound to one session, handed to that session's stage executors.
     */
    public StageReporter reporterFor(String sessionId) {
        return new StageReporter() {
            @Override
            public boolean progress(ProgressEvent event) {
                return recordProgress(sessionId, event);
            }

            @Override
            public boolean documentResult(DocumentResult result) {
                return docStageProgress(sessionId, result);
            }

            @Override
            public boolean isActive() {
                lock.lock();
                try {
                    return isRunning(sessionId);
                } finally {
                    lock.unlock();
                }
            }
        };
    }

    // ── Helpers (lock held) ──────────────────────────────────────────

    private SessionStage currentStage() {
        return current == null ? SessionStage.IDLE : current.stage;
    }

    private boolean applicable(String sessionId, SessionEvent event) {
        if (current == null || !current.id.equals(sessionId)) {
            log.debug("Ignoring {} for stale session {}", event, sessionId);
            return false;
        }
        if (TransitionTable.next(current.stage, event).isEmpty()) {
            log.debug("Ignoring {} for session {} in stage {}", event, sessionId, current.stage.wireName());
            return false;
        }
        return true;
    }

    private boolean isRunning(String sessionId) {
        return current != null && current.id.equals(sessionId)
                && current.stage.isRunning() && !current.cancelRequested;
    }

    private void fail(FailureReason reason, String detail) {
        current.failureReason = reason;
        current.errorDetail = detail;
        log.warn("Session {} failed during {}: {} - {}", current.id, current.stage.wireName(),
                reason.wireName(), detail);
        broadcaster.publish(PipelineEvents.error(current.id, reason, detail));
        finish(SessionStage.FAILED);
    }

    private void finish(SessionStage terminal) {
        current.stage = terminal;
        current.endedAt = Instant.now();
        broadcaster.publish(PipelineEvents.stageChanged(current.id, terminal));
        broadcaster.publish(PipelineEvents.pipelineFinished(current.snapshot()));
        if (metrics != null) {
            metrics.recordSessionResult(terminal.wireName());
        }
    }

    private static String generateSessionId() {
        return String.format("WDOC-%s-%04d", ID_FORMAT.format(Instant.now()), SESSION_COUNTER.incrementAndGet());
    }
}
