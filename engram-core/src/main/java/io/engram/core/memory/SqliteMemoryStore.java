package io.engram.core.memory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.engram.core.embedding.VectorMath;
import io.engram.core.memory.query.RecallPredicates;
import io.engram.core.memory.query.SqlClause;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

public final class SqliteMemoryStore implements MemoryStore {
    private static final TypeReference<List<Double>> VECTOR = new TypeReference<>() {
    };
    private static final TypeReference<List<String>> STRINGS = new TypeReference<>() {
    };

    private static final String MEMORY_COLUMNS = """
        m.id, a.agent_name, m.layer_1_summary, m.layer_2_context, m.layer_3_details,
        m.layer_1_embedding, m.layer_2_embedding, m.tags_json, m.importance_score, m.memory_type,
        m.temporal_layer, m.status, m.expires_at, m.domain, m.source_type, m.created_at, m.updated_at,
        m.last_accessed, m.access_count
        """;

    private final String jdbcUrl;
    private final ObjectMapper mapper;

    public SqliteMemoryStore(Path dbPath) throws IOException {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        Files.createDirectories(dbPath.toAbsolutePath().getParent());
        this.jdbcUrl = "jdbc:sqlite:" + dbPath.toAbsolutePath();
        this.mapper = new ObjectMapper();
        init();
    }

    @Override
    public synchronized long upsertAgent(String agentName) throws IOException {
        String insert = "INSERT OR IGNORE INTO agents (agent_name, metadata_json, created_at) VALUES (?, '{}', ?)";
        return inTransaction("Failed to upsert agent " + agentName, connection -> {
            try (PreparedStatement statement = connection.prepareStatement(insert)) {
                statement.setString(1, agentName);
                statement.setLong(2, System.currentTimeMillis());
                statement.executeUpdate();
            }
            return agentId(connection, agentName)
                .orElseThrow(() -> new SQLException("Agent row missing after upsert: " + agentName));
        });
    }

    @Override
    public synchronized Optional<Long> findAgentId(String agentName) throws IOException {
        try (Connection connection = openConnection()) {
            return agentId(connection, agentName);
        } catch (SQLException e) {
            throw new IOException("Failed to look up agent " + agentName, e);
        }
    }

    @Override
    public synchronized Memory insert(NewMemory memory) throws IOException {
        String sql = """
            INSERT INTO memories (
                agent_id, layer_1_summary, layer_2_context, layer_3_details,
                layer_1_embedding, layer_2_embedding, tags_json, importance_score, memory_type,
                temporal_layer, status, expires_at, domain, source_type, created_at, updated_at, access_count
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, 0)
            """;
        long memoryId = inTransaction("Failed to insert memory", connection -> {
            long agentId = agentId(connection, memory.agentName())
                .orElseThrow(() -> new SQLException("Unknown agent " + memory.agentName()));
            long id;
            try (PreparedStatement statement = connection.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
                statement.setLong(1, agentId);
                statement.setString(2, memory.content().layer1());
                statement.setString(3, memory.content().layer2());
                statement.setString(4, memory.content().layer3());
                statement.setString(5, mapper.writeValueAsString(memory.layer1Embedding()));
                statement.setString(6, mapper.writeValueAsString(memory.layer2Embedding()));
                statement.setString(7, mapper.writeValueAsString(memory.tags()));
                statement.setDouble(8, memory.importanceScore());
                statement.setString(9, memory.memoryType().wireName());
                statement.setString(10, memory.temporalLayer().wireName());
                statement.setString(11, MemoryStatus.ACTIVE.wireName());
                setInstant(statement, 12, memory.expiresAt());
                statement.setString(13, memory.domain().wireName());
                statement.setString(14, memory.sourceType());
                statement.setLong(15, memory.createdAt().toEpochMilli());
                statement.setLong(16, memory.createdAt().toEpochMilli());
                statement.executeUpdate();
                try (ResultSet keys = statement.getGeneratedKeys()) {
                    if (!keys.next()) {
                        throw new SQLException("No id generated for memory");
                    }
                    id = keys.getLong(1);
                }
            }
            try (PreparedStatement tagStatement = connection.prepareStatement(
                "INSERT OR IGNORE INTO memory_tags (memory_id, tag) VALUES (?, ?)")) {
                for (String tag : new LinkedHashSet<>(memory.tags())) {
                    tagStatement.setLong(1, id);
                    tagStatement.setString(2, tag);
                    tagStatement.addBatch();
                }
                tagStatement.executeBatch();
            }
            return id;
        });
        return find(memoryId).orElseThrow(() -> new MemoryNotFoundException(memoryId));
    }

    @Override
    public synchronized Optional<Memory> find(long memoryId) throws IOException {
        String sql = "SELECT " + MEMORY_COLUMNS + " FROM memories m JOIN agents a ON a.id = m.agent_id WHERE m.id = ?";
        try (Connection connection = openConnection()) {
            return findMemory(connection, sql, memoryId);
        } catch (SQLException e) {
            throw new IOException("Failed to load memory " + memoryId, e);
        }
    }

    @Override
    public synchronized List<ScoredMemory> nearest(List<Double> queryEmbedding, RecallPredicates predicates) throws IOException {
        SqlClause where = predicates.where();
        String sql = "SELECT " + MEMORY_COLUMNS + " FROM memories m JOIN agents a ON a.id = m.agent_id WHERE " + where.sql();
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            bind(statement, where.params());
            List<ScoredMemory> scored = new ArrayList<>();
            try (ResultSet resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    Memory memory = mapMemory(resultSet);
                    scored.add(new ScoredMemory(memory, VectorMath.cosineSimilarity(queryEmbedding, memory.layer1Embedding())));
                }
            }
            scored.sort(Comparator.comparingDouble(ScoredMemory::similarity).reversed());
            return scored;
        } catch (SQLException e) {
            throw new IOException("Failed to query memories", e);
        }
    }

    @Override
    public synchronized void recordAccess(AccessLogEntry entry) throws IOException {
        String log = """
            INSERT INTO memory_access_log (memory_id, agent_id, layer_accessed, query_text, relevance_score, access_time)
            VALUES (?, ?, ?, ?, ?, ?)
            """;
        String counter = "UPDATE memories SET access_count = access_count + 1, last_accessed = ? WHERE id = ?";
        inTransaction("Failed to record access for memory " + entry.memoryId(), connection -> {
            try (PreparedStatement statement = connection.prepareStatement(log)) {
                statement.setLong(1, entry.memoryId());
                statement.setLong(2, entry.agentId());
                statement.setInt(3, entry.layerRequested());
                statement.setString(4, entry.queryText());
                statement.setDouble(5, entry.relevanceScore());
                statement.setLong(6, entry.accessedAt().toEpochMilli());
                statement.executeUpdate();
            }
            try (PreparedStatement statement = connection.prepareStatement(counter)) {
                statement.setLong(1, entry.accessedAt().toEpochMilli());
                statement.setLong(2, entry.memoryId());
                statement.executeUpdate();
            }
            return null;
        });
    }

    @Override
    public synchronized List<AccessLogEntry> accessLog(long memoryId) throws IOException {
        String sql = """
            SELECT memory_id, agent_id, layer_accessed, query_text, relevance_score, access_time
            FROM memory_access_log
            WHERE memory_id = ?
            ORDER BY id ASC
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setLong(1, memoryId);
            List<AccessLogEntry> entries = new ArrayList<>();
            try (ResultSet resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    entries.add(new AccessLogEntry(
                        resultSet.getLong("memory_id"),
                        resultSet.getLong("agent_id"),
                        resultSet.getInt("layer_accessed"),
                        resultSet.getString("query_text"),
                        resultSet.getDouble("relevance_score"),
                        Instant.ofEpochMilli(resultSet.getLong("access_time"))
                    ));
                }
            }
            return entries;
        } catch (SQLException e) {
            throw new IOException("Failed to read access log for memory " + memoryId, e);
        }
    }

    @Override
    public synchronized PendingSlice pendingReview(String agentName, Instant now, int limit) throws IOException {
        boolean scoped = agentName != null && !agentName.isBlank();
        String agentFilter = scoped ? " AND m.agent_id = (SELECT id FROM agents WHERE agent_name = ?)" : "";
        String sweep = """
            UPDATE memories SET status = 'expired', updated_at = ?
            WHERE status = 'active' AND expires_at IS NOT NULL AND expires_at <= ?
            """ + (scoped ? " AND agent_id = (SELECT id FROM agents WHERE agent_name = ?)" : "");
        String count = "SELECT COUNT(*) FROM memories m WHERE m.status IN ('expired', 'pending_review')" + agentFilter;
        String select = "SELECT " + MEMORY_COLUMNS + """
             FROM memories m JOIN agents a ON a.id = m.agent_id
            WHERE m.status IN ('expired', 'pending_review')
            """ + agentFilter + " ORDER BY COALESCE(m.expires_at, m.updated_at) ASC, m.id ASC LIMIT ?";

        return inTransaction("Failed to load pending review memories", connection -> {
            try (PreparedStatement statement = connection.prepareStatement(sweep)) {
                statement.setLong(1, now.toEpochMilli());
                statement.setLong(2, now.toEpochMilli());
                if (scoped) {
                    statement.setString(3, agentName);
                }
                statement.executeUpdate();
            }
            int total;
            try (PreparedStatement statement = connection.prepareStatement(count)) {
                if (scoped) {
                    statement.setString(1, agentName);
                }
                try (ResultSet resultSet = statement.executeQuery()) {
                    total = resultSet.next() ? resultSet.getInt(1) : 0;
                }
            }
            List<Memory> memories = new ArrayList<>();
            try (PreparedStatement statement = connection.prepareStatement(select)) {
                int index = 1;
                if (scoped) {
                    statement.setString(index++, agentName);
                }
                statement.setInt(index, Math.max(1, limit));
                try (ResultSet resultSet = statement.executeQuery()) {
                    while (resultSet.next()) {
                        memories.add(mapMemory(resultSet));
                    }
                }
            }
            return new PendingSlice(total, memories);
        });
    }

    @Override
    public synchronized MemoryTransition transition(long memoryId, Function<Memory, MemoryTransition> planner) throws IOException {
        String select = "SELECT " + MEMORY_COLUMNS + " FROM memories m JOIN agents a ON a.id = m.agent_id WHERE m.id = ?";
        String update = """
            UPDATE memories
            SET temporal_layer = ?, status = ?, expires_at = ?, importance_score = ?, updated_at = ?
            WHERE id = ?
            """;
        String log = """
            INSERT INTO review_log (memory_id, decision, old_layer, new_layer, reason, reviewed_by, reviewed_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """;
        return inTransaction("Failed to apply transition to memory " + memoryId, connection -> {
            Memory current = findMemory(connection, select, memoryId)
                .orElseThrow(() -> new MemoryNotFoundException(memoryId));
            MemoryTransition transition = planner.apply(current);
            Memory after = transition.after();
            try (PreparedStatement statement = connection.prepareStatement(update)) {
                statement.setString(1, after.temporalLayer().wireName());
                statement.setString(2, after.status().wireName());
                setInstant(statement, 3, after.expiresAt());
                statement.setDouble(4, after.importanceScore());
                statement.setLong(5, after.updatedAt().toEpochMilli());
                statement.setLong(6, memoryId);
                statement.executeUpdate();
            }
            ReviewLogEntry entry = transition.log();
            try (PreparedStatement statement = connection.prepareStatement(log)) {
                statement.setLong(1, memoryId);
                statement.setString(2, entry.decision());
                statement.setString(3, entry.oldLayer() == null ? null : entry.oldLayer().wireName());
                statement.setString(4, entry.newLayer() == null ? null : entry.newLayer().wireName());
                statement.setString(5, entry.reason());
                statement.setString(6, entry.reviewedBy());
                statement.setLong(7, entry.reviewedAt().toEpochMilli());
                statement.executeUpdate();
            }
            return transition;
        });
    }

    @Override
    public synchronized List<ReviewLogEntry> reviewLog(long memoryId) throws IOException {
        String sql = """
            SELECT memory_id, decision, old_layer, new_layer, reason, reviewed_by, reviewed_at
            FROM review_log
            WHERE memory_id = ?
            ORDER BY id ASC
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setLong(1, memoryId);
            List<ReviewLogEntry> entries = new ArrayList<>();
            try (ResultSet resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    String oldLayer = resultSet.getString("old_layer");
                    String newLayer = resultSet.getString("new_layer");
                    entries.add(new ReviewLogEntry(
                        resultSet.getLong("memory_id"),
                        resultSet.getString("decision"),
                        oldLayer == null ? null : TemporalLayer.fromWire(oldLayer),
                        newLayer == null ? null : TemporalLayer.fromWire(newLayer),
                        resultSet.getString("reason"),
                        resultSet.getString("reviewed_by"),
                        Instant.ofEpochMilli(resultSet.getLong("reviewed_at"))
                    ));
                }
            }
            return entries;
        } catch (SQLException e) {
            throw new IOException("Failed to read review log for memory " + memoryId, e);
        }
    }

    @Override
    public synchronized MemoryStats stats(String agentName) throws IOException {
        String totals = """
            SELECT COUNT(*) AS total, AVG(m.importance_score) AS avg_importance, SUM(m.access_count) AS accesses
            FROM memories m
            WHERE m.agent_id = ? AND m.status <> 'deleted'
            """;
        String layers = """
            SELECT m.temporal_layer, COUNT(*) AS total
            FROM memories m
            WHERE m.agent_id = ? AND m.status <> 'deleted'
            GROUP BY m.temporal_layer
            """;
        try (Connection connection = openConnection()) {
            Optional<Long> agentId = agentId(connection, agentName);
            if (agentId.isEmpty()) {
                return MemoryStats.empty();
            }
            int total;
            double averageImportance;
            long accesses;
            try (PreparedStatement statement = connection.prepareStatement(totals)) {
                statement.setLong(1, agentId.get());
                try (ResultSet resultSet = statement.executeQuery()) {
                    resultSet.next();
                    total = resultSet.getInt("total");
                    averageImportance = resultSet.getDouble("avg_importance");
                    accesses = resultSet.getLong("accesses");
                }
            }
            Map<TemporalLayer, Integer> byLayer = new EnumMap<>(TemporalLayer.class);
            try (PreparedStatement statement = connection.prepareStatement(layers)) {
                statement.setLong(1, agentId.get());
                try (ResultSet resultSet = statement.executeQuery()) {
                    while (resultSet.next()) {
                        byLayer.put(TemporalLayer.fromWire(resultSet.getString(1)), resultSet.getInt(2));
                    }
                }
            }
            return new MemoryStats(total, averageImportance, accesses, byLayer);
        } catch (SQLException e) {
            throw new IOException("Failed to compute stats for agent " + agentName, e);
        }
    }

    @Override
    public synchronized BacklogStats backlog(String agentName, Instant now) throws IOException {
        boolean scoped = agentName != null && !agentName.isBlank();
        String sql = """
            SELECT
                SUM(CASE WHEN m.temporal_layer = 'working' AND m.status = 'active'
                         AND (m.expires_at IS NULL OR m.expires_at > ?) THEN 1 ELSE 0 END),
                SUM(CASE WHEN m.temporal_layer = 'working' AND m.status = 'active'
                         AND m.expires_at IS NOT NULL AND m.expires_at <= ? THEN 1 ELSE 0 END),
                SUM(CASE WHEN m.status IN ('expired', 'pending_review') THEN 1 ELSE 0 END)
            FROM memories m
            """ + (scoped ? " WHERE m.agent_id = (SELECT id FROM agents WHERE agent_name = ?)" : "");
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setLong(1, now.toEpochMilli());
            statement.setLong(2, now.toEpochMilli());
            if (scoped) {
                statement.setString(3, agentName);
            }
            try (ResultSet resultSet = statement.executeQuery()) {
                if (!resultSet.next()) {
                    return new BacklogStats(0, 0, 0);
                }
                return new BacklogStats(resultSet.getInt(1), resultSet.getInt(2), resultSet.getInt(3));
            }
        } catch (SQLException e) {
            throw new IOException("Failed to compute review backlog", e);
        }
    }

    private Optional<Long> agentId(Connection connection, String agentName) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("SELECT id FROM agents WHERE agent_name = ?")) {
            statement.setString(1, agentName);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() ? Optional.of(resultSet.getLong(1)) : Optional.empty();
            }
        }
    }

    private Optional<Memory> findMemory(Connection connection, String sql, long memoryId) throws SQLException, IOException {
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setLong(1, memoryId);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() ? Optional.of(mapMemory(resultSet)) : Optional.empty();
            }
        }
    }

    private Memory mapMemory(ResultSet resultSet) throws SQLException, IOException {
        return new Memory(
            resultSet.getLong("id"),
            resultSet.getString("agent_name"),
            new LayeredContent(
                resultSet.getString("layer_1_summary"),
                resultSet.getString("layer_2_context"),
                resultSet.getString("layer_3_details")
            ),
            mapper.readValue(resultSet.getString("layer_1_embedding"), VECTOR),
            mapper.readValue(resultSet.getString("layer_2_embedding"), VECTOR),
            mapper.readValue(resultSet.getString("tags_json"), STRINGS),
            resultSet.getDouble("importance_score"),
            MemoryType.fromWire(resultSet.getString("memory_type")),
            TemporalLayer.fromWire(resultSet.getString("temporal_layer")),
            MemoryStatus.fromWire(resultSet.getString("status")),
            getInstant(resultSet, "expires_at"),
            MemoryDomain.fromWire(resultSet.getString("domain")),
            resultSet.getString("source_type"),
            getInstant(resultSet, "created_at"),
            getInstant(resultSet, "updated_at"),
            getInstant(resultSet, "last_accessed"),
            resultSet.getInt("access_count")
        );
    }

    private void bind(PreparedStatement statement, List<Object> params) throws SQLException {
        for (int i = 0; i < params.size(); i++) {
            Object param = params.get(i);
            if (param instanceof Long value) {
                statement.setLong(i + 1, value);
            } else if (param instanceof Integer value) {
                statement.setInt(i + 1, value);
            } else if (param instanceof Double value) {
                statement.setDouble(i + 1, value);
            } else {
                statement.setString(i + 1, String.valueOf(param));
            }
        }
    }

    private void setInstant(PreparedStatement statement, int index, Instant value) throws SQLException {
        if (value == null) {
            statement.setNull(index, Types.INTEGER);
        } else {
            statement.setLong(index, value.toEpochMilli());
        }
    }

    private Instant getInstant(ResultSet resultSet, String column) throws SQLException {
        long value = resultSet.getLong(column);
        return resultSet.wasNull() ? null : Instant.ofEpochMilli(value);
    }

    private <T> T inTransaction(String failure, SqlWork<T> work) throws IOException {
        try (Connection connection = openConnection()) {
            connection.setAutoCommit(false);
            try {
                T result = work.run(connection);
                connection.commit();
                return result;
            } catch (SQLException | IOException | RuntimeException e) {
                connection.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new IOException(failure, e);
        }
    }

    private Connection openConnection() throws SQLException {
        Connection connection = DriverManager.getConnection(jdbcUrl);
        try (Statement statement = connection.createStatement()) {
            statement.execute("PRAGMA journal_mode=WAL;");
            statement.execute("PRAGMA synchronous=NORMAL;");
            statement.execute("PRAGMA foreign_keys=ON;");
            statement.execute("PRAGMA busy_timeout=5000;");
        }
        return connection;
    }

    private void init() throws IOException {
        List<String> ddl = List.of(
            """
            CREATE TABLE IF NOT EXISTS agents (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                agent_name TEXT NOT NULL UNIQUE,
                metadata_json TEXT NOT NULL DEFAULT '{}',
                created_at INTEGER NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS memories (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                agent_id INTEGER NOT NULL REFERENCES agents(id) ON DELETE CASCADE,
                layer_1_summary TEXT NOT NULL,
                layer_2_context TEXT NOT NULL,
                layer_3_details TEXT NOT NULL,
                layer_1_embedding TEXT NOT NULL,
                layer_2_embedding TEXT NOT NULL,
                tags_json TEXT NOT NULL DEFAULT '[]',
                importance_score REAL NOT NULL DEFAULT 0.5,
                memory_type TEXT NOT NULL,
                temporal_layer TEXT NOT NULL
                    CHECK (temporal_layer IN ('working', 'short', 'long', 'archive')),
                status TEXT NOT NULL DEFAULT 'active'
                    CHECK (status IN ('active', 'expired', 'pending_review', 'archived', 'deleted')),
                expires_at INTEGER,
                domain TEXT NOT NULL DEFAULT 'general',
                source_type TEXT,
                created_at INTEGER NOT NULL,
                updated_at INTEGER NOT NULL,
                last_accessed INTEGER,
                access_count INTEGER NOT NULL DEFAULT 0
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS memory_tags (
                memory_id INTEGER NOT NULL REFERENCES memories(id) ON DELETE CASCADE,
                tag TEXT NOT NULL,
                PRIMARY KEY (memory_id, tag)
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS memory_access_log (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                memory_id INTEGER NOT NULL REFERENCES memories(id) ON DELETE CASCADE,
                agent_id INTEGER NOT NULL REFERENCES agents(id) ON DELETE CASCADE,
                layer_accessed INTEGER NOT NULL,
                query_text TEXT,
                relevance_score REAL,
                access_time INTEGER NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS review_log (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                memory_id INTEGER NOT NULL REFERENCES memories(id) ON DELETE CASCADE,
                decision TEXT NOT NULL,
                old_layer TEXT,
                new_layer TEXT,
                reason TEXT,
                reviewed_by TEXT NOT NULL DEFAULT 'agent',
                reviewed_at INTEGER NOT NULL
            )
            """,
            "CREATE INDEX IF NOT EXISTS idx_memories_agent ON memories(agent_id)",
            "CREATE INDEX IF NOT EXISTS idx_memories_status ON memories(status)",
            "CREATE INDEX IF NOT EXISTS idx_memories_layer ON memories(temporal_layer)",
            "CREATE INDEX IF NOT EXISTS idx_memories_expires ON memories(expires_at)",
            "CREATE INDEX IF NOT EXISTS idx_memory_tags_tag ON memory_tags(tag)",
            "CREATE INDEX IF NOT EXISTS idx_review_log_memory ON review_log(memory_id)"
        );
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            for (String sql : ddl) {
                statement.execute(sql);
            }
        } catch (SQLException e) {
            throw new IOException("Failed to initialize SQLite memory store", e);
        }
    }

    @FunctionalInterface
    private interface SqlWork<T> {
        T run(Connection connection) throws SQLException, IOException;
    }
}
