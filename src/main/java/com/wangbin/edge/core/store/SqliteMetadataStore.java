package com.wangbin.edge.core.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.wangbin.edge.common.domain.dto.meta.StoreStats;
import com.wangbin.edge.common.domain.entity.Asset;
import com.wangbin.edge.common.domain.entity.AssetRelation;
import com.wangbin.edge.common.domain.enums.RelationType;
import com.wangbin.edge.common.exception.AssetNotFoundException;
import com.wangbin.edge.common.exception.BusinessException;
import com.wangbin.edge.common.exception.DuplicateAssetException;
import com.wangbin.edge.common.exception.DuplicateRelationException;
import com.wangbin.edge.common.exception.MetadataStoreException;
import com.wangbin.edge.common.exception.RelationNotFoundException;
import com.wangbin.edge.common.utils.JsonUtil;
import lombok.extern.slf4j.Slf4j;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;
import org.sqlite.SQLiteDataSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 基于SQLite的元数据存储实现。
 *
 * 每次调用独立获取连接，写操作在单个事务内完成；外键开启，删除资产时关系级联删除。
 * created_at 以纪元纳秒整数存储，读回的时间与写入完全一致。
 * 创建关系时端点存在性检查与插入处于同一事务。
 */
@Slf4j
public class SqliteMetadataStore implements MetadataStore {

    private static final TypeReference<List<String>> LABELS_TYPE = new TypeReference<>() {};
    private static final TypeReference<Map<String, String>> METADATA_TYPE = new TypeReference<>() {};

    private static final String[] SCHEMA = {
            "CREATE TABLE IF NOT EXISTS assets ("
                    + " id TEXT PRIMARY KEY,"
                    + " name TEXT UNIQUE NOT NULL,"
                    + " template_name TEXT,"
                    + " labels TEXT,"
                    + " created_at INTEGER NOT NULL)",
            "CREATE INDEX IF NOT EXISTS idx_assets_template ON assets(template_name)",
            "CREATE INDEX IF NOT EXISTS idx_assets_created ON assets(created_at)",
            "CREATE TABLE IF NOT EXISTS asset_relations ("
                    + " id TEXT PRIMARY KEY,"
                    + " source_asset_id TEXT NOT NULL,"
                    + " target_asset_id TEXT NOT NULL,"
                    + " relation_type TEXT NOT NULL,"
                    + " created_at INTEGER NOT NULL,"
                    + " metadata TEXT,"
                    + " FOREIGN KEY (source_asset_id) REFERENCES assets(id) ON DELETE CASCADE,"
                    + " FOREIGN KEY (target_asset_id) REFERENCES assets(id) ON DELETE CASCADE,"
                    + " UNIQUE (source_asset_id, target_asset_id, relation_type))",
            "CREATE INDEX IF NOT EXISTS idx_relations_source ON asset_relations(source_asset_id)",
            "CREATE INDEX IF NOT EXISTS idx_relations_target ON asset_relations(target_asset_id)",
            "CREATE INDEX IF NOT EXISTS idx_relations_type ON asset_relations(relation_type)"
    };

    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    private static final String ASSET_COLUMNS = "id, name, template_name, labels, created_at";
    private static final String RELATION_COLUMNS =
            "id, source_asset_id, target_asset_id, relation_type, created_at, metadata";

    private final String dbPath;
    private final SQLiteDataSource dataSource;
    private volatile boolean closed;

    public SqliteMetadataStore(String dbPath) {
        this(dbPath, 5000);
    }

    public SqliteMetadataStore(String dbPath, int busyTimeoutMs) {
        this.dbPath = dbPath;
        ensureParentDirectory(dbPath);

        SQLiteConfig config = new SQLiteConfig();
        config.enforceForeignKeys(true);
        config.setBusyTimeout(busyTimeoutMs);
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);

        this.dataSource = new SQLiteDataSource(config);
        this.dataSource.setUrl("jdbc:sqlite:" + dbPath);

        initSchema();
        log.info("SqliteMetadataStore 初始化完成: {}", dbPath);
    }

    // ==================== 资产 ====================

    @Override
    public void createAsset(Asset asset) {
        String labels = writeJson(asset.getLabels() != null ? asset.getLabels() : List.of(), "asset labels");
        inTransaction(conn -> {
            String sql = "INSERT INTO assets (" + ASSET_COLUMNS + ") VALUES (?, ?, ?, ?, ?)";
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, asset.getId());
                stmt.setString(2, asset.getName());
                setNullableString(stmt, 3, asset.getTemplateName());
                stmt.setString(4, labels);
                stmt.setLong(5, toEpochNanos(asset.getCreatedAt()));
                stmt.executeUpdate();
            } catch (SQLException e) {
                throw translateAssetInsertError(conn, asset, e);
            }
            return null;
        });
        log.debug("资产已写入: {} ({})", asset.getName(), asset.getId());
    }

    @Override
    public Optional<Asset> getAsset(String id) {
        return queryOne("SELECT " + ASSET_COLUMNS + " FROM assets WHERE id = ?", id, this::mapAsset,
                "failed to get asset");
    }

    @Override
    public Optional<Asset> getAssetByName(String name) {
        return queryOne("SELECT " + ASSET_COLUMNS + " FROM assets WHERE name = ?", name, this::mapAsset,
                "failed to get asset");
    }

    @Override
    public List<Asset> listAssets() {
        return queryList("SELECT " + ASSET_COLUMNS + " FROM assets ORDER BY created_at DESC, rowid DESC",
                null, this::mapAsset, "failed to list assets");
    }

    @Override
    public void deleteAsset(String id) {
        int removedRelations = inTransaction(conn -> {
            int relations;
            try (PreparedStatement stmt = conn.prepareStatement(
                    "DELETE FROM asset_relations WHERE source_asset_id = ? OR target_asset_id = ?")) {
                stmt.setString(1, id);
                stmt.setString(2, id);
                relations = stmt.executeUpdate();
            }
            try (PreparedStatement stmt = conn.prepareStatement("DELETE FROM assets WHERE id = ?")) {
                stmt.setString(1, id);
                if (stmt.executeUpdate() == 0) {
                    throw AssetNotFoundException.of(id);
                }
            }
            return relations;
        });
        log.debug("资产已删除: {}, 级联删除关系 {} 条", id, removedRelations);
    }

    @Override
    public boolean assetExists(String id) {
        return withConnection(conn -> exists(conn, "SELECT 1 FROM assets WHERE id = ?", id),
                "failed to check asset");
    }

    @Override
    public void updateAssetTemplate(String id, String templateName) {
        inTransaction(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement("UPDATE assets SET template_name = ? WHERE id = ?")) {
                setNullableString(stmt, 1, templateName);
                stmt.setString(2, id);
                if (stmt.executeUpdate() == 0) {
                    throw AssetNotFoundException.of(id);
                }
            }
            return null;
        });
    }

    @Override
    public long countAssets() {
        return withConnection(conn -> count(conn, "SELECT COUNT(*) FROM assets"), "failed to count assets");
    }

    // ==================== 关系 ====================

    @Override
    public void createRelation(AssetRelation relation) {
        String metadata = relation.getMetadata() != null ? writeJson(relation.getMetadata(), "relation metadata") : null;
        inTransaction(conn -> {
            if (!exists(conn, "SELECT 1 FROM assets WHERE id = ?", relation.getSourceAssetId())) {
                throw AssetNotFoundException.source(relation.getSourceAssetId());
            }
            if (!exists(conn, "SELECT 1 FROM assets WHERE id = ?", relation.getTargetAssetId())) {
                throw AssetNotFoundException.target(relation.getTargetAssetId());
            }

            String sql = "INSERT INTO asset_relations (" + RELATION_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?)";
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, relation.getId());
                stmt.setString(2, relation.getSourceAssetId());
                stmt.setString(3, relation.getTargetAssetId());
                stmt.setString(4, relation.getRelationType().getValue());
                stmt.setLong(5, toEpochNanos(relation.getCreatedAt()));
                setNullableString(stmt, 6, metadata);
                stmt.executeUpdate();
            } catch (SQLException e) {
                throw translateRelationInsertError(conn, relation, e);
            }
            return null;
        });
        log.debug("关系已写入: {} ({} -[{}]-> {})", relation.getId(), relation.getSourceAssetId(),
                relation.getRelationType().getValue(), relation.getTargetAssetId());
    }

    @Override
    public Optional<AssetRelation> getRelation(String id) {
        return queryOne("SELECT " + RELATION_COLUMNS + " FROM asset_relations WHERE id = ?", id,
                this::mapRelation, "failed to get relation");
    }

    @Override
    public List<AssetRelation> getRelationsBySource(String assetId) {
        return queryList("SELECT " + RELATION_COLUMNS + " FROM asset_relations WHERE source_asset_id = ?"
                + " ORDER BY created_at DESC, rowid DESC", assetId, this::mapRelation, "failed to query relations");
    }

    @Override
    public List<AssetRelation> getRelationsByTarget(String assetId) {
        return queryList("SELECT " + RELATION_COLUMNS + " FROM asset_relations WHERE target_asset_id = ?"
                + " ORDER BY created_at DESC, rowid DESC", assetId, this::mapRelation, "failed to query relations");
    }

    @Override
    public void deleteRelation(String id) {
        inTransaction(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement("DELETE FROM asset_relations WHERE id = ?")) {
                stmt.setString(1, id);
                if (stmt.executeUpdate() == 0) {
                    throw new RelationNotFoundException(id);
                }
            }
            return null;
        });
    }

    @Override
    public StoreStats getStats() {
        return withConnection(conn -> new StoreStats(
                count(conn, "SELECT COUNT(*) FROM assets"),
                count(conn, "SELECT COUNT(*) FROM asset_relations"),
                Instant.now()), "failed to collect store stats");
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            log.info("SqliteMetadataStore 已关闭: {}", dbPath);
        }
    }

    // ==================== 行映射 ====================

    private Asset mapAsset(ResultSet rs) throws SQLException {
        String id = rs.getString("id");
        return Asset.builder()
                .id(id)
                .name(rs.getString("name"))
                .templateName(rs.getString("template_name"))
                .labels(readLabels(id, rs.getString("labels")))
                .createdAt(fromEpochNanos(rs.getLong("created_at")))
                .build();
    }

    private AssetRelation mapRelation(ResultSet rs) throws SQLException {
        String id = rs.getString("id");
        String type = rs.getString("relation_type");
        RelationType relationType = RelationType.fromValue(type);
        if (relationType == null) {
            throw new MetadataStoreException("unknown relation_type in relation " + id + ": " + type);
        }
        return AssetRelation.builder()
                .id(id)
                .sourceAssetId(rs.getString("source_asset_id"))
                .targetAssetId(rs.getString("target_asset_id"))
                .relationType(relationType)
                .createdAt(fromEpochNanos(rs.getLong("created_at")))
                .metadata(readMetadata(id, rs.getString("metadata")))
                .build();
    }

    private List<String> readLabels(String assetId, String json) {
        if (json == null || json.isEmpty()) {
            return new ArrayList<>();
        }
        try {
            List<String> labels = JsonUtil.mapper().readValue(json, LABELS_TYPE);
            return labels != null ? labels : new ArrayList<>();
        } catch (JsonProcessingException e) {
            throw new MetadataStoreException("failed to unmarshal asset labels: " + assetId, e);
        }
    }

    private Map<String, String> readMetadata(String relationId, String json) {
        if (json == null || json.isEmpty()) {
            return null;
        }
        try {
            return JsonUtil.mapper().readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            throw new MetadataStoreException("failed to unmarshal relation metadata: " + relationId, e);
        }
    }

    private String writeJson(Object value, String what) {
        try {
            return JsonUtil.mapper().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new MetadataStoreException("failed to marshal " + what, e);
        }
    }

    // ==================== 错误转换 ====================

    private BusinessException translateAssetInsertError(Connection conn, Asset asset, SQLException e)
            throws SQLException {
        switch (resultCode(e)) {
            case SQLITE_CONSTRAINT_PRIMARYKEY:
                return DuplicateAssetException.ofId(asset.getId());
            case SQLITE_CONSTRAINT_UNIQUE:
                return DuplicateAssetException.ofName(asset.getName());
            case SQLITE_CONSTRAINT:
                // 未开启扩展错误码时只能按现有数据判断
                return exists(conn, "SELECT 1 FROM assets WHERE id = ?", asset.getId())
                        ? DuplicateAssetException.ofId(asset.getId())
                        : DuplicateAssetException.ofName(asset.getName());
            default:
                return new MetadataStoreException("failed to create asset: " + e.getMessage(), e);
        }
    }

    private BusinessException translateRelationInsertError(Connection conn, AssetRelation relation, SQLException e)
            throws SQLException {
        switch (resultCode(e)) {
            case SQLITE_CONSTRAINT_PRIMARYKEY:
                return new DuplicateRelationException("relation id already exists: " + relation.getId());
            case SQLITE_CONSTRAINT_UNIQUE:
                return DuplicateRelationException.of(relation.getSourceAssetId(), relation.getTargetAssetId(),
                        relation.getRelationType());
            case SQLITE_CONSTRAINT_FOREIGNKEY:
                // 同事务内已检查过端点，此处仅作兜底
                return AssetNotFoundException.source(relation.getSourceAssetId());
            case SQLITE_CONSTRAINT:
                return exists(conn, "SELECT 1 FROM asset_relations WHERE id = ?", relation.getId())
                        ? new DuplicateRelationException("relation id already exists: " + relation.getId())
                        : DuplicateRelationException.of(relation.getSourceAssetId(), relation.getTargetAssetId(),
                                relation.getRelationType());
            default:
                return new MetadataStoreException("failed to create relation: " + e.getMessage(), e);
        }
    }

    private static SQLiteErrorCode resultCode(SQLException e) {
        if (e instanceof SQLiteException sqliteException) {
            return sqliteException.getResultCode();
        }
        return SQLiteErrorCode.UNKNOWN_ERROR;
    }

    // ==================== JDBC 辅助 ====================

    @FunctionalInterface
    private interface SqlWork<T> {
        T apply(Connection conn) throws SQLException;
    }

    @FunctionalInterface
    private interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }

    private void initSchema() {
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            for (String ddl : SCHEMA) {
                stmt.executeUpdate(ddl);
            }
        } catch (SQLException e) {
            throw new MetadataStoreException("failed to initialize DB: " + dbPath, e);
        }
    }

    private Connection openConnection() throws SQLException {
        if (closed) {
            throw new MetadataStoreException("metadata store is closed");
        }
        return dataSource.getConnection();
    }

    private <T> T withConnection(SqlWork<T> work, String errorMessage) {
        try (Connection conn = openConnection()) {
            return work.apply(conn);
        } catch (SQLException e) {
            throw new MetadataStoreException(errorMessage + ": " + e.getMessage(), e);
        }
    }

    private <T> T inTransaction(SqlWork<T> work) {
        try (Connection conn = openConnection()) {
            conn.setAutoCommit(false);
            try {
                T result = work.apply(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                rollbackQuietly(conn, e);
                throw e;
            }
        } catch (SQLException e) {
            throw new MetadataStoreException("transaction failed: " + e.getMessage(), e);
        }
    }

    private void rollbackQuietly(Connection conn, Exception cause) {
        try {
            conn.rollback();
        } catch (SQLException rollbackError) {
            cause.addSuppressed(rollbackError);
            log.error("事务回滚失败: {}", dbPath, rollbackError);
        }
    }

    private <T> Optional<T> queryOne(String sql, String param, RowMapper<T> mapper, String errorMessage) {
        return withConnection(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, param);
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next() ? Optional.of(mapper.map(rs)) : Optional.<T>empty();
                }
            }
        }, errorMessage);
    }

    private <T> List<T> queryList(String sql, String param, RowMapper<T> mapper, String errorMessage) {
        return withConnection(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                if (param != null) {
                    stmt.setString(1, param);
                }
                List<T> result = new ArrayList<>();
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        result.add(mapper.map(rs));
                    }
                }
                return result;
            }
        }, errorMessage);
    }

    private boolean exists(Connection conn, String sql, String param) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, param);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next();
            }
        }
    }

    private long count(Connection conn, String sql) throws SQLException {
        try (Statement stmt = conn.createStatement(); ResultSet rs = stmt.executeQuery(sql)) {
            return rs.next() ? rs.getLong(1) : 0L;
        }
    }

    private static void setNullableString(PreparedStatement stmt, int index, String value) throws SQLException {
        if (value == null || value.isEmpty()) {
            stmt.setNull(index, Types.VARCHAR);
        } else {
            stmt.setString(index, value);
        }
    }

    private static long toEpochNanos(Instant instant) {
        Instant value = instant != null ? instant : Instant.now();
        return Math.addExact(Math.multiplyExact(value.getEpochSecond(), NANOS_PER_SECOND), value.getNano());
    }

    private static Instant fromEpochNanos(long nanos) {
        return Instant.ofEpochSecond(Math.floorDiv(nanos, NANOS_PER_SECOND), Math.floorMod(nanos, NANOS_PER_SECOND));
    }

    private static void ensureParentDirectory(String dbPath) {
        Path parent = Path.of(dbPath).toAbsolutePath().getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new MetadataStoreException("failed to create data directory: " + parent, e);
        }
    }
}
