package io.engram.core.memory.query;

import io.engram.core.memory.MemoryDomain;
import io.engram.core.memory.MemoryStatus;
import io.engram.core.memory.MemoryType;
import io.engram.core.memory.TemporalLayer;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

public final class RecallPredicates {
    private final List<RecallPredicate> predicates;

    private RecallPredicates(List<RecallPredicate> predicates) {
        this.predicates = List.copyOf(predicates);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static RecallPredicates forRecall(
        long agentId,
        Instant now,
        Set<TemporalLayer> layers,
        Set<String> tags,
        MemoryType memoryType,
        MemoryDomain domain
    ) {
        Builder builder = builder()
            .add(new RecallPredicate.AgentIs(agentId))
            .add(new RecallPredicate.StatusIsNot(MemoryStatus.DELETED))
            .add(new RecallPredicate.UnexpiredAt(now))
            .add(new RecallPredicate.LayerIn(layers));
        if (tags != null && !tags.isEmpty()) {
            builder.add(new RecallPredicate.AnyTagOf(tags));
        }
        if (memoryType != null) {
            builder.add(new RecallPredicate.TypeIs(memoryType));
        }
        if (domain != null) {
            builder.add(new RecallPredicate.DomainIs(domain));
        }
        return builder.build();
    }

    public List<RecallPredicate> predicates() {
        return predicates;
    }

    public SqlClause where() {
        if (predicates.isEmpty()) {
            return new SqlClause("1 = 1", List.of());
        }
        List<String> fragments = new ArrayList<>();
        List<Object> params = new ArrayList<>();
        for (RecallPredicate predicate : predicates) {
            SqlClause clause = predicate.toClause();
            fragments.add(clause.sql());
            params.addAll(clause.params());
        }
        return new SqlClause(String.join(" AND ", fragments), params);
    }

    public static final class Builder {
        private final List<RecallPredicate> predicates = new ArrayList<>();

        private Builder() {
        }

        public Builder add(RecallPredicate predicate) {
            if (predicate != null) {
                predicates.add(predicate);
            }
            return this;
        }

        public RecallPredicates build() {
            return new RecallPredicates(predicates);
        }
    }
}
