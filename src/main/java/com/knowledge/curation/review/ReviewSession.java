package com.knowledge.curation.review;

import com.knowledge.curation.audit.DecisionPersistenceException;
import com.knowledge.curation.audit.DecisionRecord;
import com.knowledge.curation.core.model.DecisionAction;
import com.knowledge.curation.core.model.DecisionActor;
import com.knowledge.curation.core.model.Item;
import com.knowledge.curation.core.model.ReviewEntryKind;
import com.knowledge.curation.core.model.ReviewQueueEntry;
import com.knowledge.curation.decision.Bucket;
import com.knowledge.curation.logging.LogContext;
import com.knowledge.curation.merge.ConcurrentMutationConflictException;
import com.knowledge.curation.merge.DecisionContext;
import com.knowledge.curation.merge.MergeEngine;
import com.knowledge.curation.merge.MergeResult;
import com.knowledge.curation.store.ItemRepository;
import com.knowledge.curation.store.SessionState;
import com.knowledge.curation.store.SessionStateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Resumable human review of one bucket's queue.
 *
 * <p>State machine: AWAITING_INPUT &rarr; APPLYING &rarr; RECORDED &rarr; AWAITING_INPUT or DONE,
 * and SUSPENDED after {@code quit}. Mutating commands go through the {@link MergeEngine}, which
 * records the decision before touching items. The session state (queue and cursor) is
 * persisted after every decision and on quit, so {@link #resume} continues where the
 * reviewer stopped. If recording fails, nothing changes and the cursor stays put.</p>
 *
 * <p>Members are presented in id order; the first presented member is the default
 * canonical for merges.</p>
 */
public class ReviewSession {
    private static final Logger log = LoggerFactory.getLogger(ReviewSession.class);

    private final MergeEngine mergeEngine;
    private final ItemRepository itemRepository;
    private final SessionStateRepository stateRepository;
    private final ReviewCommandParser parser = new ReviewCommandParser();
    private final ItemDiffRenderer renderer = new ItemDiffRenderer();
    private final boolean dryRun;

    private SessionState state;
    private ReviewState reviewState;

    private ReviewSession(MergeEngine mergeEngine, SessionStateRepository stateRepository, SessionState state) {
        this.mergeEngine = mergeEngine;
        this.itemRepository = mergeEngine.getItemRepository();
        this.stateRepository = stateRepository;
        this.dryRun = mergeEngine.getDecisionLog().isDryRun();
        this.state = state;
        this.reviewState = ReviewState.AWAITING_INPUT;
    }

    /**
     * Starts a new session over the given queue and persists its initial state.
     */
    public static ReviewSession start(String sessionId, String category, Bucket bucket,
                                      List<ReviewQueueEntry> queue,
                                      MergeEngine mergeEngine, SessionStateRepository stateRepository) {
        int active = mergeEngine.getItemRepository().findActiveByCategory(category).size();
        SessionState initial = SessionState.newReview(sessionId, category, bucket.name(), queue, active);
        ReviewSession session = new ReviewSession(mergeEngine, stateRepository, initial);
        session.persist();
        session.skipExhausted();
        log.info("review.started sessionId={} category={} bucket={} entries={}",
                sessionId, category, bucket, queue.size());
        return session;
    }

    /**
     * Resumes a persisted session from its saved cursor.
     *
     * @throws IllegalArgumentException if no session with that id was saved
     */
    public static ReviewSession resume(String sessionId, MergeEngine mergeEngine,
                                       SessionStateRepository stateRepository) {
        SessionState saved = stateRepository.load(sessionId)
                .orElseThrow(() -> new IllegalArgumentException("No saved review session " + sessionId));
        ReviewSession session = new ReviewSession(mergeEngine, stateRepository, saved);
        session.skipExhausted();
        log.info("review.resumed sessionId={} cursor={} of={}",
                sessionId, saved.cursor(), saved.queue().size());
        return session;
    }

    /**
     * The entry awaiting a decision, or empty when the queue is exhausted.
     */
    public Optional<ReviewQueueEntry> currentEntry() {
        if (reviewState == ReviewState.DONE || !state.hasNext()) {
            return Optional.empty();
        }
        return Optional.of(state.queue().get(state.cursor()));
    }

    /**
     * Active items of the current entry in presentation order.
     */
    public List<Item> presentedItems() {
        return currentEntry().map(this::activeItems).orElse(List.of());
    }

    public String renderCurrent() {
        return currentEntry()
                .map(entry -> renderer.render(entry, activeItems(entry)))
                .orElse("Queue complete.");
    }

    /**
     * Parses and handles one line of reviewer input.
     */
    public ReviewOutcome handle(String line) {
        ReviewCommand command;
        try {
            command = parser.parse(line);
        } catch (InvalidCommandException e) {
            return ReviewOutcome.error(reviewState, e.getMessage());
        }
        return handle(command);
    }

    public ReviewOutcome handle(ReviewCommand command) {
        try (LogContext ctx = LogContext.forReview(state.sessionId(), state.bucket())) {
            if (reviewState == ReviewState.SUSPENDED) {
                return ReviewOutcome.error(reviewState, "Session is suspended; resume it to continue");
            }
            Optional<ReviewQueueEntry> current = currentEntry();
            if (command.type() == ReviewCommand.Type.HELP) {
                return ReviewOutcome.info(reviewState, ReviewCommandParser.HELP_TEXT);
            }
            if (command.type() == ReviewCommand.Type.QUIT) {
                persist();
                reviewState = current.isPresent() ? ReviewState.SUSPENDED : ReviewState.DONE;
                log.info("review.suspended sessionId={} cursor={}", state.sessionId(), state.cursor());
                return ReviewOutcome.info(reviewState, "Saved at entry " + (state.cursor() + 1)
                        + " of " + state.queue().size());
            }
            if (current.isEmpty()) {
                return ReviewOutcome.error(ReviewState.DONE, "Queue complete.");
            }
            if (command.type() == ReviewCommand.Type.DIFF) {
                return ReviewOutcome.info(reviewState, renderer.diff(activeItems(current.get())));
            }
            return apply(current.get(), command);
        }
    }

    private ReviewOutcome apply(ReviewQueueEntry entry, ReviewCommand command) {
        reviewState = ReviewState.APPLYING;
        List<String> members = activeItems(entry).stream().map(Item::getId).collect(Collectors.toList());
        try {
            DecisionRecord record;
            boolean advance = true;
            SessionState next = state;
            switch (command.type()) {
                case MERGE -> {
                    String canonical = chooseCanonical(command.targetId(), members);
                    record = requireSuccess(mergeEngine.merge(members, canonical, DecisionAction.MERGE,
                            context(entry, command.note(), "merged by reviewer")));
                }
                case MERGE_AB, MERGE_BC -> {
                    List<String> pair = triadPair(entry, command.type());
                    if (!members.containsAll(pair)) {
                        throw new IllegalArgumentException("Triad pair " + pair + " is no longer active");
                    }
                    String canonical = chooseCanonical(command.targetId(), pair);
                    record = requireSuccess(mergeEngine.merge(pair, canonical, DecisionAction.MERGE,
                            context(entry, null, "triad " + command.type().name().toLowerCase(Locale.ROOT) + " by reviewer")));
                }
                case UPDATE -> {
                    requireMember(command.targetId(), members);
                    record = requireSuccess(mergeEngine.update(command.targetId(), command.title(), command.body(),
                            context(entry, null, "updated by reviewer")));
                    advance = false;
                }
                case KEEP -> record = mergeEngine.recordOnly(members, DecisionAction.KEEP_SEPARATE,
                        context(entry, command.note(), "kept separate by reviewer"));
                case REJECT -> {
                    requireMember(command.targetId(), members);
                    if (command.note() == null || command.note().isBlank()) {
                        throw new IllegalArgumentException("A reject needs a reason");
                    }
                    record = requireSuccess(mergeEngine.reject(command.targetId(),
                            context(entry, command.note(), null)));
                    advance = false;
                }
                case SPLIT -> {
                    List<ReviewQueueEntry> subEntries = splitEntries(entry, command.groups(), members);
                    String groups = command.groups().stream()
                            .map(g -> String.join(",", g))
                            .collect(Collectors.joining(" | "));
                    record = mergeEngine.recordOnly(members, DecisionAction.SPLIT,
                            context(entry, null, "split by reviewer").withDetails(Map.of("groups", groups)));
                    next = next.withInsertedAfterCursor(subEntries);
                }
                default -> throw new IllegalStateException("Unhandled command " + command.type());
            }

            reviewState = ReviewState.RECORDED;
            if (advance) {
                next = next.withCursor(next.cursor() + 1);
            }
            state = next;
            persist();
            skipExhausted();
            if (reviewState != ReviewState.DONE) {
                reviewState = ReviewState.AWAITING_INPUT;
            }
            log.info("review.decision sessionId={} entryId={} action={} cursor={}",
                    state.sessionId(), entry.id(), record.action(), state.cursor());
            return ReviewOutcome.recorded(reviewState, record.action() + " recorded", record);
        } catch (DecisionPersistenceException e) {
            reviewState = ReviewState.AWAITING_INPUT;
            log.error("review.record-failed sessionId={} entryId={} error={}",
                    state.sessionId(), entry.id(), e.getMessage());
            return ReviewOutcome.error(reviewState, "Decision could not be recorded; nothing was changed: "
                    + e.getMessage());
        } catch (ConcurrentMutationConflictException | IllegalArgumentException | IllegalStateException e) {
            reviewState = ReviewState.AWAITING_INPUT;
            return ReviewOutcome.error(reviewState, e.getMessage());
        }
    }

    private DecisionRecord requireSuccess(MergeResult result) {
        if (result.isFailure()) {
            throw new IllegalStateException(result.errorMessage());
        }
        return result.record();
    }

    private DecisionContext context(ReviewQueueEntry entry, String note, String defaultRationale) {
        String rationale = note != null && !note.isBlank() ? note : defaultRationale;
        Map<String, String> details = new HashMap<>();
        details.put("entryId", entry.id());
        details.put("entryKind", entry.kind().name());
        if (state.bucket() != null) {
            details.put("bucket", state.bucket());
        }
        return new DecisionContext(state.sessionId(), null, DecisionActor.HUMAN, rationale, details, null);
    }

    private static String chooseCanonical(String requested, List<String> candidates) {
        if (requested == null) {
            return candidates.get(0);
        }
        requireMember(requested, candidates);
        return requested;
    }

    private static void requireMember(String id, List<String> members) {
        if (id == null || !members.contains(id)) {
            throw new IllegalArgumentException("'" + id + "' is not one of " + members);
        }
    }

    private static List<String> triadPair(ReviewQueueEntry entry, ReviewCommand.Type type) {
        if (entry.kind() != ReviewEntryKind.TRIAD) {
            throw new IllegalArgumentException(type.name().toLowerCase(Locale.ROOT) + " only applies to triads");
        }
        List<String> abc = entry.members();
        return type == ReviewCommand.Type.MERGE_AB ? List.of(abc.get(0), abc.get(1)) : List.of(abc.get(1), abc.get(2));
    }

    private List<ReviewQueueEntry> splitEntries(ReviewQueueEntry entry, List<List<String>> groups,
                                                List<String> members) {
        Set<String> seen = new HashSet<>();
        List<ReviewQueueEntry> result = new ArrayList<>();
        int index = 0;
        for (List<String> group : groups) {
            for (String id : group) {
                requireMember(id, members);
                if (!seen.add(id)) {
                    throw new IllegalArgumentException("Item " + id + " appears in two groups");
                }
            }
            index++;
            if (group.size() < 2) {
                continue;
            }
            List<String> sorted = group.stream().sorted().toList();
            Map<String, Double> scores = new HashMap<>();
            for (int i = 0; i < sorted.size(); i++) {
                for (int j = i + 1; j < sorted.size(); j++) {
                    double score = entry.scoreBetween(sorted.get(i), sorted.get(j));
                    if (score > 0) {
                        scores.put(ReviewQueueEntry.scoreKey(sorted.get(i), sorted.get(j)), score);
                    }
                }
            }
            double avg = scores.values().stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
            ReviewEntryKind kind = sorted.size() == 2 ? ReviewEntryKind.PAIR : ReviewEntryKind.COMMUNITY;
            result.add(new ReviewQueueEntry(entry.id() + "/split-" + index, kind, entry.category(),
                    sorted, avg, scores, "split from " + entry.id()));
        }
        return result;
    }

    /**
     * Active members of an entry; triads keep their A, B, C order, others are sorted by id.
     */
    private List<Item> activeItems(ReviewQueueEntry entry) {
        List<String> ids = entry.kind() == ReviewEntryKind.TRIAD
                ? entry.members()
                : entry.members().stream().sorted().toList();
        List<Item> result = new ArrayList<>();
        for (String id : ids) {
            itemRepository.findById(id).filter(Item::isActive).ifPresent(result::add);
        }
        return result;
    }

    private void skipExhausted() {
        boolean moved = false;
        while (state.hasNext() && activeItems(state.queue().get(state.cursor())).size() < 2) {
            log.debug("review.entry-skipped entryId={} reason=fewer than two active members",
                    state.queue().get(state.cursor()).id());
            state = state.withCursor(state.cursor() + 1);
            moved = true;
        }
        if (!state.hasNext()) {
            reviewState = ReviewState.DONE;
            if (!state.completed()) {
                state = state.withCompleted(true);
                moved = true;
            }
        }
        if (moved) {
            persist();
        }
    }

    private void persist() {
        if (dryRun) {
            return;
        }
        stateRepository.save(state);
    }

    public ReviewState getState() {
        return reviewState;
    }

    public SessionState getSessionState() {
        return state;
    }

    public String getSessionId() {
        return state.sessionId();
    }

    public boolean isFinished() {
        return reviewState == ReviewState.DONE;
    }
}
