package com.rfpanalytics.domain.service;

import com.rfpanalytics.domain.model.LifecycleState;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Read-only lookup tables driving lifecycle classification. Built once at
 * startup from configuration.
 */
public final class LifecycleRules {

    private final Map<LifecycleState, Set<String>> groupIds = new EnumMap<>(LifecycleState.class);
    private final Map<LifecycleState, Set<String>> phrases = new EnumMap<>(LifecycleState.class);
    private final Map<LifecycleState, List<String>> moveKeywords = new EnumMap<>(LifecycleState.class);

    private LifecycleRules(Builder builder) {
        for (LifecycleState state : LifecycleState.values()) {
            Set<String> ids = builder.groupIds.getOrDefault(state, Set.of()).stream()
                    .filter(id -> id != null && !id.isBlank())
                    .collect(Collectors.toUnmodifiableSet());
            groupIds.put(state, ids);

            phrases.put(state, builder.phrases.getOrDefault(state, Set.of()).stream()
                    .map(LifecycleRules::normalize)
                    .filter(phrase -> !phrase.isEmpty())
                    .collect(Collectors.toUnmodifiableSet()));

            moveKeywords.put(state, builder.moveKeywords.getOrDefault(state, Set.of()).stream()
                    .map(keyword -> keyword.toLowerCase(Locale.ROOT))
                    .filter(keyword -> !keyword.isBlank())
                    .collect(Collectors.toUnmodifiableList()));
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Lowercases, turns every run of non-alphanumerics into one space and trims.
     * "Not_Pursuing -- RFPs" becomes "not pursuing rfps".
     */
    public static String normalize(String value) {
        if (value == null) {
            return "";
        }
        return value.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", " ")
                .trim();
    }

    public Set<String> groupIds(LifecycleState state) {
        return groupIds.get(state);
    }

    public Set<String> phrases(LifecycleState state) {
        return phrases.get(state);
    }

    public List<String> moveKeywords(LifecycleState state) {
        return moveKeywords.get(state);
    }

    public static final class Builder {
        private final Map<LifecycleState, Set<String>> groupIds = new EnumMap<>(LifecycleState.class);
        private final Map<LifecycleState, Set<String>> phrases = new EnumMap<>(LifecycleState.class);
        private final Map<LifecycleState, Set<String>> moveKeywords = new EnumMap<>(LifecycleState.class);

        private Builder() {
        }

        public Builder groupIds(LifecycleState state, Collection<String> values) {
            groupIds.put(state, Set.copyOf(values));
            return this;
        }

        public Builder phrases(LifecycleState state, Collection<String> values) {
            phrases.put(state, Set.copyOf(values));
            return this;
        }

        public Builder moveKeywords(LifecycleState state, Collection<String> values) {
            moveKeywords.put(state, Set.copyOf(values));
            return this;
        }

        public LifecycleRules build() {
            return new LifecycleRules(this);
        }
    }
}
