package io.engram.core.memory.query;

import java.util.List;
import java.util.Objects;

public record SqlClause(String sql, List<Object> params) {
    public SqlClause {
        Objects.requireNonNull(sql, "sql must not be null");
        params = params == null ? List.of() : List.copyOf(params);
    }
}
