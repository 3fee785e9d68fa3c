package com.wangbin.edge.core.store;

import com.wangbin.edge.common.domain.dto.meta.StoreStats;
import com.wangbin.edge.common.domain.entity.Asset;
import com.wangbin.edge.common.domain.entity.AssetRelation;
import com.wangbin.edge.common.domain.enums.RelationType;
import com.wangbin.edge.common.exception.AssetNotFoundException;
import com.wangbin.edge.common.exception.DuplicateAssetException;
import com.wangbin.edge.common.exception.DuplicateRelationException;
import com.wangbin.edge.common.exception.MetadataStoreException;
import com.wangbin.edge.common.exception.RelationNotFoundException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class SqliteMetadataStoreTest {

    @TempDir
    Path dir;

    private Path dbFile;
    private SqliteMetadataStore store;

    @BeforeEach
    void setUp() {
        dbFile = dir.resolve("data").resolve("metadata.db");
        store = new SqliteMetadataStore(dbFile.toString());
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void createdAssetReadsBackEqual() {
        Asset asset = asset("a1", "s1", 1000L);
        asset.setTemplateName("tpl");
        asset.setLabels(List.of("floor-1", "hvac"));

        store.createAsset(asset);

        assertEquals(asset, store.getAsset("a1").orElseThrow());
        assertEquals(asset, store.getAssetByName("s1").orElseThrow());
        assertTrue(store.assetExists("a1"));
        assertFalse(store.assetExists("a2"));
    }

    @Test
    void createdAtKeepsNanosecondPrecision() {
        Instant createdAt = Instant.parse("2023-11-14T22:13:20.123456789Z");
        Asset asset = Asset.builder().id("a1").name("s1").createdAt(createdAt).build();
        store.createAsset(asset);
        store.createAsset(Asset.builder().id("a0").name("s0")
                .createdAt(Instant.parse("1969-12-31T23:59:59.999999999Z")).build());
        store.createAsset(asset("a2", "s2", 2000L));
        AssetRelation relation = relation("r1", "a1", "a2", RelationType.PART_OF);
        relation.setCreatedAt(createdAt.plusNanos(1));
        store.createRelation(relation);

        assertEquals(asset, store.getAsset("a1").orElseThrow());
        assertEquals(Instant.parse("1969-12-31T23:59:59.999999999Z"), store.getAsset("a0").orElseThrow().getCreatedAt());
        assertEquals(relation, store.getRelation("r1").orElseThrow());
        assertEquals(List.of("a1", "a2", "a0"),
                store.listAssets().stream().map(Asset::getId).collect(Collectors.toList()));
    }

    @Test
    void deletingTargetRemovesIncomingRelations() {
        store.createAsset(asset("a1", "s1", 1000L));
        store.createAsset(asset("a2", "s2", 2000L));
        store.createAsset(asset("a3", "s3", 3000L));
        store.createRelation(relation("r1", "a1", "a2", RelationType.PART_OF));
        store.createRelation(relation("r2", "a3", "a2", RelationType.LOCATED_IN));
        store.createRelation(relation("r3", "a1", "a3", RelationType.CONNECTED_TO));

        store.deleteAsset("a2");

        assertTrue(store.getRelation("r1").isEmpty());
        assertTrue(store.getRelation("r2").isEmpty());
        assertTrue(store.getRelationsBySource("a1").stream().noneMatch(r -> "a2".equals(r.getTargetAssetId())));
        assertTrue(store.getRelation("r3").isPresent());
        assertEquals(1, store.getStats().getTotalRelations());
    }

    @Test
    void missingAssetIsEmptyNotError() {
        assertTrue(store.getAsset("nope").isEmpty());
        assertTrue(store.getAssetByName("nope").isEmpty());
        assertTrue(store.getRelation("nope").isEmpty());
    }

    @Test
    void duplicateNameFailsAndLeavesStoreUnchanged() {
        store.createAsset(asset("a1", "s1", 1000L));

        DuplicateAssetException e = assertThrows(DuplicateAssetException.class,
                () -> store.createAsset(asset("a2", "s1", 2000L)));
        assertEquals("asset name already exists: s1", e.getMessage());
        assertEquals(1, store.countAssets());
        assertTrue(store.getAsset("a2").isEmpty());
    }

    @Test
    void duplicateIdIsReportedAsSuch() {
        store.createAsset(asset("a1", "s1", 1000L));
        store.createAsset(asset("a2", "s2", 2000L));
        store.createRelation(relation("r1", "a1", "a2", RelationType.PART_OF));

        DuplicateAssetException duplicateAsset = assertThrows(DuplicateAssetException.class,
                () -> store.createAsset(asset("a1", "other", 3000L)));
        assertEquals("asset id already exists: a1", duplicateAsset.getMessage());

        DuplicateRelationException duplicateId = assertThrows(DuplicateRelationException.class,
                () -> store.createRelation(relation("r1", "a2", "a1", RelationType.CONNECTED_TO)));
        assertEquals("relation id already exists: r1", duplicateId.getMessage());

        DuplicateRelationException triple = assertThrows(DuplicateRelationException.class,
                () -> store.createRelation(relation("r2", "a1", "a2", RelationType.PART_OF)));
        assertTrue(triple.getMessage().startsWith("relation already exists"));
    }

    @Test
    void listsNewestFirst() {
        store.createAsset(asset("a1", "s1", 1000L));
        store.createAsset(asset("a3", "s3", 3000L));
        store.createAsset(asset("a2", "s2", 2000L));

        List<String> ids = store.listAssets().stream().map(Asset::getId).collect(Collectors.toList());
        assertEquals(List.of("a3", "a2", "a1"), ids);
    }

    @Test
    void deleteMissingAssetFails() {
        assertThrows(AssetNotFoundException.class, () -> store.deleteAsset("nope"));
    }

    @Test
    void relationLifecycleWithCascade() {
        store.createAsset(asset("a1", "s1", 1000L));
        store.createAsset(asset("a2", "s2", 2000L));
        AssetRelation relation = relation("r1", "a1", "a2", RelationType.PART_OF);
        relation.setMetadata(Map.of("port", "3"));

        store.createRelation(relation);

        assertEquals(relation, store.getRelation("r1").orElseThrow());
        assertEquals(1, store.getRelationsBySource("a1").size());
        assertEquals(1, store.getRelationsByTarget("a2").size());
        assertTrue(store.getRelationsBySource("a2").isEmpty());

        assertThrows(DuplicateRelationException.class,
                () -> store.createRelation(relation("r2", "a1", "a2", RelationType.PART_OF)));
        // 同一对资产的其他类型不算重复
        store.createRelation(relation("r3", "a1", "a2", RelationType.CONNECTED_TO));

        store.deleteAsset("a1");

        assertTrue(store.getAsset("a1").isEmpty());
        assertTrue(store.getRelation("r1").isEmpty());
        assertTrue(store.getRelation("r3").isEmpty());
        assertTrue(store.getRelationsByTarget("a2").isEmpty());
        assertEquals(0, store.getStats().getTotalRelations());
    }

    @Test
    void relationRequiresBothEndpoints() {
        store.createAsset(asset("a1", "s1", 1000L));

        AssetNotFoundException missingSource = assertThrows(AssetNotFoundException.class,
                () -> store.createRelation(relation("r1", "x", "a1", RelationType.LOCATED_IN)));
        assertEquals(AssetNotFoundException.Role.SOURCE, missingSource.getRole());

        AssetNotFoundException missingTarget = assertThrows(AssetNotFoundException.class,
                () -> store.createRelation(relation("r1", "a1", "y", RelationType.LOCATED_IN)));
        assertEquals(AssetNotFoundException.Role.TARGET, missingTarget.getRole());
        assertEquals("y", missingTarget.getAssetId());
    }

    @Test
    void deleteRelation() {
        store.createAsset(asset("a1", "s1", 1000L));
        store.createAsset(asset("a2", "s2", 2000L));
        store.createRelation(relation("r1", "a1", "a2", RelationType.CONNECTED_TO));

        store.deleteRelation("r1");

        assertTrue(store.getRelation("r1").isEmpty());
        assertThrows(RelationNotFoundException.class, () -> store.deleteRelation("r1"));
    }

    @Test
    void updateTemplate() {
        store.createAsset(asset("a1", "s1", 1000L));

        store.updateAssetTemplate("a1", "tpl");
        assertEquals("tpl", store.getAsset("a1").orElseThrow().getTemplateName());

        store.updateAssetTemplate("a1", "");
        assertNull(store.getAsset("a1").orElseThrow().getTemplateName());

        assertThrows(AssetNotFoundException.class, () -> store.updateAssetTemplate("nope", "tpl"));
    }

    @Test
    void corruptedLabelsSurfaceAsStoreError() throws SQLException {
        store.createAsset(asset("a1", "s1", 1000L));
        store.createAsset(asset("a2", "s2", 2000L));
        execute("UPDATE assets SET labels = ? WHERE id = ?", "{not json", "a1");

        MetadataStoreException e = assertThrows(MetadataStoreException.class, () -> store.getAsset("a1"));
        assertTrue(e.getMessage().contains("a1"));
        assertThrows(MetadataStoreException.class, () -> store.listAssets());
        assertTrue(store.getAsset("a2").isPresent());
    }

    @Test
    void corruptedMetadataSurfacesAsStoreError() throws SQLException {
        store.createAsset(asset("a1", "s1", 1000L));
        store.createAsset(asset("a2", "s2", 2000L));
        store.createRelation(relation("r1", "a1", "a2", RelationType.PART_OF));
        execute("UPDATE asset_relations SET metadata = ? WHERE id = ?", "[1,2", "r1");

        assertThrows(MetadataStoreException.class, () -> store.getRelation("r1"));
        assertThrows(MetadataStoreException.class, () -> store.getRelationsBySource("a1"));
    }

    @Test
    void statsAndClose() {
        store.createAsset(asset("a1", "s1", 1000L));

        StoreStats stats = store.getStats();
        assertEquals(1, stats.getTotalAssets());
        assertEquals(0, stats.getTotalRelations());
        assertNotNull(stats.getLastUpdated());

        store.close();
        assertThrows(MetadataStoreException.class, () -> store.countAssets());
    }

    @Test
    void reopenKeepsData() {
        store.createAsset(asset("a1", "s1", 1000L));
        store.close();

        store = new SqliteMetadataStore(dbFile.toString());

        assertTrue(store.assetExists("a1"));
    }

    private void execute(String sql, String value, String id) throws SQLException {
        try (Connection conn = DriverManager.getConnection("jdbc:sqlite:" + dbFile);
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, value);
            stmt.setString(2, id);
            assertEquals(1, stmt.executeUpdate());
        }
    }

    private static Asset asset(String id, String name, long createdAt) {
        return Asset.builder()
                .id(id)
                .name(name)
                .createdAt(Instant.ofEpochMilli(createdAt))
                .build();
    }

    private static AssetRelation relation(String id, String source, String target, RelationType type) {
        return AssetRelation.builder()
                .id(id)
                .sourceAssetId(source)
                .targetAssetId(target)
                .relationType(type)
                .createdAt(Instant.ofEpochMilli(5000L))
                .build();
    }
}
