package io.engram.core.memory.query;

import io.engram.core.memory.MemoryDomain;
import io.engram.core.memory.MemoryStatus;
import io.engram.core.memory.MemoryType;
import io.engram.core.memory.TemporalLayer;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A single typed filter over the {@code memories m} row, compiled to a parameterized SQL clause.
 */
public interface RecallPredicate {

    SqlClause toClause();

    record AgentIs(long agentId) implements RecallPredicate {
        @Override
        public SqlClause toClause() {
            return new SqlClause("m.agent_id = ?", List.of(agentId));
        }
    }

    record StatusIsNot(MemoryStatus status) implements RecallPredicate {
        public StatusIsNot {
            Objects.requireNonNull(status, "status must not be null");
        }

        @Override
        public SqlClause toClause() {
            return new SqlClause("m.status <> ?", List.of(status.wireName()));
        }
    }

    record UnexpiredAt(Instant now) implements RecallPredicate {
        public UnexpiredAt {
            Objects.requireNonNull(now, "now must not be null");
        }

        @Override
        public SqlClause toClause() {
            return new SqlClause("(m.expires_at IS NULL OR m.expires_at > ?)", List.of(now.toEpochMilli()));
        }
    }

    record LayerIn(Set<TemporalLayer> layers) implements RecallPredicate {
        public LayerIn {
            layers = layers == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(layers));
        }

        @Override
        public SqlClause toClause() {
            if (layers.isEmpty()) {
                return new SqlClause("1 = 0", List.of());
            }
            List<Object> params = new ArrayList<>();
            for (TemporalLayer layer : layers) {
                params.add(layer.wireName());
            }
            return new SqlClause("m.temporal_layer IN (" + placeholders(params.size()) + ")", params);
        }
    }

    record AnyTagOf(Set<String> tags) implements RecallPredicate {
        public AnyTagOf {
            if (tags == null || tags.isEmpty()) {
                throw new IllegalArgumentException("tag filter must name at least one tag");
            }
            tags = Collections.unmodifiableSet(new LinkedHashSet<>(tags));
        }

        @Override
        public SqlClause toClause() {
            return new SqlClause(
                "EXISTS (SELECT 1 FROM memory_tags t WHERE t.memory_id = m.id AND t.tag IN ("
                    + placeholders(tags.size()) + "))",
                new ArrayList<>(tags)
            );
        }
    }

    record TypeIs(MemoryType type) implements RecallPredicate {
        public TypeIs {
            Objects.requireNonNull(type, "type must not be null");
        }

        @Override
        public SqlClause toClause() {
            return new SqlClause("m.memory_type = ?", List.of(type.wireName()));
        }
    }

    record DomainIs(MemoryDomain domain) implements RecallPredicate {
        public DomainIs {
            Objects.requireNonNull(domain, "domain must not be null");
        }

        @Override
        public SqlClause toClause() {
            return new SqlClause("m.domain = ?", List.of(domain.wireName()));
        }
    }

    private static String placeholders(int count) {
        return String.join(", ", Collections.nCopies(count, "?"));
    }
}
