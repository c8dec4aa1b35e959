package com.rfpanalytics.domain.service;

import com.rfpanalytics.domain.model.LifecycleState;
import com.rfpanalytics.domain.model.MoveEvent;
import com.rfpanalytics.domain.model.WorkItemSnapshot;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Classifies work items as submitted or declined.
 *
 * Each state is decided on its own:
 * 1. A group id on the state's allow-list classifies the item.
 * 2. Otherwise the normalized status text or group title is matched against
 *    the recognized phrasings of the state.
 * 3. Otherwise the item is unclassified for that state.
 *
 * An item can therefore count as both submitted and declined.
 *
 * The date an item entered a state comes from the latest move event into a
 * group of that state, falling back to the item's creation time.
 */
@Component
@RequiredArgsConstructor
public class LifecycleClassifier {

    private final LifecycleRules rules;
    private final EntityMatcher entityMatcher;

    public boolean isSubmitted(WorkItemSnapshot item) {
        return isIn(item, LifecycleState.SUBMITTED);
    }

    public boolean isDeclined(WorkItemSnapshot item) {
        return isIn(item, LifecycleState.DECLINED);
    }

    public boolean isIn(WorkItemSnapshot item, LifecycleState state) {
        String groupId = item.getGroupId();
        if (groupId != null && rules.groupIds(state).contains(groupId)) {
            return true;
        }
        Set<String> phrases = rules.phrases(state);
        return phrases.contains(LifecycleRules.normalize(item.getLifecycleStatusText()))
                || phrases.contains(LifecycleRules.normalize(item.getGroupTitle()));
    }

    public Set<LifecycleState> classify(WorkItemSnapshot item) {
        Set<LifecycleState> states = EnumSet.noneOf(LifecycleState.class);
        for (LifecycleState state : LifecycleState.values()) {
            if (isIn(item, state)) {
                states.add(state);
            }
        }
        return states;
    }

    /**
     * States a move's destination group belongs to: by allow-listed group id,
     * or by the destination title containing one of the state's keywords.
     */
    public Set<LifecycleState> classifyMove(MoveEvent move) {
        Set<LifecycleState> states = EnumSet.noneOf(LifecycleState.class);
        String title = move.getDestinationGroupTitle() == null
                ? ""
                : move.getDestinationGroupTitle().toLowerCase(Locale.ROOT);
        for (LifecycleState state : LifecycleState.values()) {
            boolean byId = move.getDestinationGroupId() != null
                    && rules.groupIds(state).contains(move.getDestinationGroupId());
            boolean byTitle = rules.moveKeywords(state).stream().anyMatch(title::contains);
            if (byId || byTitle) {
                states.add(state);
            }
        }
        return states;
    }

    /**
     * Latest move into each state, keyed by the moved item's id.
     */
    public MoveIndex indexMoves(List<MoveEvent> moves) {
        Map<LifecycleState, Map<String, MoveEvent>> latest = new EnumMap<>(LifecycleState.class);
        for (LifecycleState state : LifecycleState.values()) {
            latest.put(state, new HashMap<>());
        }
        for (MoveEvent move : moves) {
            if (move.getEntityId() == null || move.getOccurredAt() == null) {
                continue;
            }
            for (LifecycleState state : classifyMove(move)) {
                latest.get(state).merge(move.getEntityId(), move,
                        (existing, candidate) -> candidate.getOccurredAt().isAfter(existing.getOccurredAt())
                                ? candidate
                                : existing);
            }
        }
        return new MoveIndex(latest);
    }

    /**
     * When the item entered the given state, or empty if it never did.
     *
     * An item counts for a state when it currently sits in it or has a
     * recorded move into it. Items currently in a state but without a move
     * event are dated by their creation time.
     */
    public Optional<Instant> transitionDate(WorkItemSnapshot item, LifecycleState state, MoveIndex moves) {
        Optional<MoveEvent> move = moves.find(state, entityMatcher.identifiers(item));
        if (move.isPresent()) {
            return Optional.of(move.get().getOccurredAt());
        }
        if (isIn(item, state)) {
            return Optional.ofNullable(item.getCreatedAt());
        }
        return Optional.empty();
    }

    public static final class MoveIndex {

        private final Map<LifecycleState, Map<String, MoveEvent>> latest;

        private MoveIndex(Map<LifecycleState, Map<String, MoveEvent>> latest) {
            this.latest = latest;
        }

        public static MoveIndex empty() {
            Map<LifecycleState, Map<String, MoveEvent>> none = new EnumMap<>(LifecycleState.class);
            for (LifecycleState state : LifecycleState.values()) {
                none.put(state, Map.of());
            }
            return new MoveIndex(none);
        }

        public Optional<MoveEvent> find(LifecycleState state, List<String> itemIds) {
            Map<String, MoveEvent> byItem = latest.get(state);
            for (String id : itemIds) {
                MoveEvent move = byItem.get(id);
                if (move != null) {
                    return Optional.of(move);
                }
            }
            return Optional.empty();
        }
    }
}
