package com.wangbin.edge.core.store;

import com.wangbin.edge.common.domain.dto.meta.StoreStats;
import com.wangbin.edge.common.domain.entity.Asset;
import com.wangbin.edge.common.domain.entity.AssetRelation;

import java.util.List;
import java.util.Optional;

/**
 * 资产与资产关系的元数据存储
 *
 * 每个写操作是一个独立事务；查询未命中返回 {@link Optional#empty()}，不视为错误。
 * 持久化的 labels / metadata 无法解析时抛出 {@link com.wangbin.edge.common.exception.MetadataStoreException}，
 * 列表查询中任一行失败则整批失败。
 */
public interface MetadataStore extends AutoCloseable {

    // ==================== 资产 ====================

    /**
     * @throws com.wangbin.edge.common.exception.DuplicateAssetException 名称或ID已存在
     */
    void createAsset(Asset asset);

    Optional<Asset> getAsset(String id);

    Optional<Asset> getAssetByName(String name);

    /**
     * 按创建时间倒序
     */
    List<Asset> listAssets();

    /**
     * 删除资产，并级联删除以其为源或目标的全部关系
     *
     * @throws com.wangbin.edge.common.exception.AssetNotFoundException 资产不存在
     */
    void deleteAsset(String id);

    boolean assetExists(String id);

    /**
     * @throws com.wangbin.edge.common.exception.AssetNotFoundException 资产不存在
     */
    void updateAssetTemplate(String id, String templateName);

    long countAssets();

    // ==================== 关系 ====================

    /**
     * @throws com.wangbin.edge.common.exception.AssetNotFoundException     源或目标资产不存在
     * @throws com.wangbin.edge.common.exception.DuplicateRelationException (source, target, type) 已存在
     */
    void createRelation(AssetRelation relation);

    Optional<AssetRelation> getRelation(String id);

    List<AssetRelation> getRelationsBySource(String assetId);

    List<AssetRelation> getRelationsByTarget(String assetId);

    /**
     * @throws com.wangbin.edge.common.exception.RelationNotFoundException 关系不存在
     */
    void deleteRelation(String id);

    StoreStats getStats();

    @Override
    void close();
}
