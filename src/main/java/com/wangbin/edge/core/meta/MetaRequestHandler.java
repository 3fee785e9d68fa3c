package com.wangbin.edge.core.meta;

import com.wangbin.edge.common.constant.TopicConstant;
import com.wangbin.edge.common.domain.dto.meta.CreateAssetRequest;
import com.wangbin.edge.common.domain.dto.meta.CreateRelationRequest;
import com.wangbin.edge.common.domain.dto.meta.GetAssetRequest;
import com.wangbin.edge.common.domain.dto.meta.IdRequest;
import com.wangbin.edge.common.domain.dto.meta.ListRelationsRequest;
import com.wangbin.edge.common.domain.dto.meta.MetaResponse;
import com.wangbin.edge.common.domain.dto.meta.StoreStats;
import com.wangbin.edge.common.domain.dto.meta.UpdateAssetTemplateRequest;
import com.wangbin.edge.common.domain.entity.Asset;
import com.wangbin.edge.common.domain.entity.AssetRelation;
import com.wangbin.edge.common.domain.enums.RelationDirection;
import com.wangbin.edge.common.domain.enums.RelationType;
import com.wangbin.edge.common.exception.BusinessException;
import com.wangbin.edge.common.utils.IdGenerator;
import com.wangbin.edge.common.utils.JsonUtil;
import com.wangbin.edge.core.ingest.IngestionPipeline;
import com.wangbin.edge.core.store.MetadataStore;
import com.wangbin.edge.core.template.TemplateRegistry;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * 元数据管理接口
 *
 * 每个操作一个处理器，同步处理请求并返回 {success, data?, error?}。
 * 领域错误以失败应答返回，不向外抛出。
 */
@Slf4j
public class MetaRequestHandler {

    static final String INVALID_REQUEST = "invalid request format";
    static final String INTERNAL_ERROR = "internal error";

    private static final byte[] FALLBACK_RESPONSE = ("{\"success\":false,\"error\":\""
            + MetaResponse.MARSHAL_FAILED + "\"}").getBytes(StandardCharsets.UTF_8);

    private final MetadataStore store;
    private final TemplateRegistry templateRegistry;
    private final IngestionPipeline pipeline;
    private final Map<String, Function<byte[], MetaResponse>> handlers = new LinkedHashMap<>();

    public MetaRequestHandler(MetadataStore store, TemplateRegistry templateRegistry) {
        this(store, templateRegistry, null);
    }

    /**
     * @param pipeline 可为空，仅用于 meta.stats 中的接入计数
     */
    public MetaRequestHandler(MetadataStore store, TemplateRegistry templateRegistry, IngestionPipeline pipeline) {
        this.store = store;
        this.templateRegistry = templateRegistry;
        this.pipeline = pipeline;

        handlers.put(TopicConstant.OP_ASSET_CREATE, this::handleAssetCreate);
        handlers.put(TopicConstant.OP_ASSET_GET, this::handleAssetGet);
        handlers.put(TopicConstant.OP_ASSET_LIST, this::handleAssetList);
        handlers.put(TopicConstant.OP_ASSET_DELETE, this::handleAssetDelete);
        handlers.put(TopicConstant.OP_ASSET_UPDATE, this::handleAssetUpdate);
        handlers.put(TopicConstant.OP_TEMPLATE_LIST, this::handleTemplateList);
        handlers.put(TopicConstant.OP_RELATION_CREATE, this::handleRelationCreate);
        handlers.put(TopicConstant.OP_RELATION_GET, this::handleRelationGet);
        handlers.put(TopicConstant.OP_RELATION_LIST, this::handleRelationList);
        handlers.put(TopicConstant.OP_RELATION_DELETE, this::handleRelationDelete);
        handlers.put(TopicConstant.OP_STATS, this::handleStats);
    }

    /**
     * 支持的操作名
     */
    public Set<String> operations() {
        return Collections.unmodifiableSet(handlers.keySet());
    }

    /**
     * 处理一次请求并返回序列化后的应答
     */
    public byte[] handle(String operation, byte[] payload) {
        return marshalResponse(dispatch(operation, payload));
    }

    /**
     * 处理一次请求，返回未序列化的应答
     */
    public MetaResponse dispatch(String operation, byte[] payload) {
        Function<byte[], MetaResponse> handler = handlers.get(operation);
        if (handler == null) {
            return MetaResponse.fail("unknown operation: " + operation);
        }
        try {
            return handler.apply(payload);
        } catch (BusinessException e) {
            log.debug("请求处理失败: {} - {}", operation, e.getMessage());
            return MetaResponse.fail(e.getMessage());
        } catch (RuntimeException e) {
            log.error("请求处理异常: {}", operation, e);
            return MetaResponse.fail(INTERNAL_ERROR);
        }
    }

    /**
     * 序列化应答，失败时返回固定的兜底应答
     */
    byte[] marshalResponse(MetaResponse response) {
        byte[] data = JsonUtil.toJsonBytes(response);
        if (data == null) {
            log.error("应答序列化失败，返回兜底应答");
            return FALLBACK_RESPONSE.clone();
        }
        return data;
    }

    // ==================== 资产 ====================

    private MetaResponse handleAssetCreate(byte[] payload) {
        CreateAssetRequest req = JsonUtil.parseObject(payload, CreateAssetRequest.class);
        if (req == null) {
            return MetaResponse.fail(INVALID_REQUEST);
        }
        if (isEmpty(req.getName())) {
            return MetaResponse.fail("name is required");
        }
        if (store.getAssetByName(req.getName()).isPresent()) {
            return MetaResponse.fail("asset name already exists");
        }
        if (!isEmpty(req.getTemplateName()) && !templateRegistry.exists(req.getTemplateName())) {
            return MetaResponse.fail("template not found");
        }

        Asset asset = Asset.builder()
                .id(IdGenerator.generateUuidWithDash())
                .name(req.getName())
                .templateName(isEmpty(req.getTemplateName()) ? null : req.getTemplateName())
                .labels(req.getLabels() != null ? new ArrayList<>(req.getLabels()) : new ArrayList<>())
                .createdAt(Instant.now())
                .build();
        store.createAsset(asset);

        log.info("资产已创建: {} ({})", asset.getName(), asset.getId());
        return MetaResponse.ok(asset);
    }

    private MetaResponse handleAssetGet(byte[] payload) {
        GetAssetRequest req = JsonUtil.parseObject(payload, GetAssetRequest.class);
        if (req == null) {
            return MetaResponse.fail(INVALID_REQUEST);
        }

        Optional<Asset> asset;
        if (!isEmpty(req.getId())) {
            asset = store.getAsset(req.getId());
        } else if (!isEmpty(req.getName())) {
            asset = store.getAssetByName(req.getName());
        } else {
            return MetaResponse.fail("id or name is required");
        }

        return asset.map(MetaResponse::ok).orElseGet(() -> MetaResponse.fail("asset not found"));
    }

    private MetaResponse handleAssetList(byte[] payload) {
        return MetaResponse.ok(store.listAssets());
    }

    private MetaResponse handleAssetDelete(byte[] payload) {
        IdRequest req = JsonUtil.parseObject(payload, IdRequest.class);
        if (req == null) {
            return MetaResponse.fail(INVALID_REQUEST);
        }
        if (isEmpty(req.getId())) {
            return MetaResponse.fail("id is required");
        }

        store.deleteAsset(req.getId());
        log.info("资产已删除: {}", req.getId());
        return MetaResponse.ok();
    }

    private MetaResponse handleAssetUpdate(byte[] payload) {
        UpdateAssetTemplateRequest req = JsonUtil.parseObject(payload, UpdateAssetTemplateRequest.class);
        if (req == null) {
            return MetaResponse.fail(INVALID_REQUEST);
        }
        if (isEmpty(req.getId())) {
            return MetaResponse.fail("id is required");
        }
        String templateName = isEmpty(req.getTemplateName()) ? null : req.getTemplateName();
        if (templateName != null && !templateRegistry.exists(templateName)) {
            return MetaResponse.fail("template not found");
        }

        store.updateAssetTemplate(req.getId(), templateName);
        log.info("资产模板已更新: {} -> {}", req.getId(), templateName);
        return store.getAsset(req.getId())
                .map(MetaResponse::ok)
                .orElseGet(() -> MetaResponse.fail("asset not found"));
    }

    private MetaResponse handleTemplateList(byte[] payload) {
        return MetaResponse.ok(templateRegistry.list());
    }

    // ==================== 关系 ====================

    private MetaResponse handleRelationCreate(byte[] payload) {
        CreateRelationRequest req = JsonUtil.parseObject(payload, CreateRelationRequest.class);
        if (req == null) {
            return MetaResponse.fail(INVALID_REQUEST);
        }
        if (isEmpty(req.getSourceAssetId())) {
            return MetaResponse.fail("source_asset_id is required");
        }
        if (isEmpty(req.getTargetAssetId())) {
            return MetaResponse.fail("target_asset_id is required");
        }
        if (isEmpty(req.getRelationType())) {
            return MetaResponse.fail("relation_type is required");
        }
        RelationType relationType = RelationType.fromValue(req.getRelationType());
        if (relationType == null) {
            return MetaResponse.fail("invalid relation_type");
        }

        AssetRelation relation = AssetRelation.builder()
                .id(IdGenerator.generateUuidWithDash())
                .sourceAssetId(req.getSourceAssetId())
                .targetAssetId(req.getTargetAssetId())
                .relationType(relationType)
                .createdAt(Instant.now())
                .metadata(req.getMetadata())
                .build();
        store.createRelation(relation);

        log.info("关系已创建: {} ({} -> {}, type: {})", relation.getId(), relation.getSourceAssetId(),
                relation.getTargetAssetId(), relationType.getValue());
        return MetaResponse.ok(relation);
    }

    private MetaResponse handleRelationGet(byte[] payload) {
        IdRequest req = JsonUtil.parseObject(payload, IdRequest.class);
        if (req == null) {
            return MetaResponse.fail(INVALID_REQUEST);
        }
        if (isEmpty(req.getId())) {
            return MetaResponse.fail("id is required");
        }

        return store.getRelation(req.getId())
                .map(MetaResponse::ok)
                .orElseGet(() -> MetaResponse.fail("relation not found"));
    }

    private MetaResponse handleRelationList(byte[] payload) {
        ListRelationsRequest req = JsonUtil.parseObject(payload, ListRelationsRequest.class);
        if (req == null) {
            return MetaResponse.fail(INVALID_REQUEST);
        }
        if (isEmpty(req.getAssetId())) {
            return MetaResponse.fail("asset_id is required");
        }
        RelationDirection direction = RelationDirection.fromText(req.getDirection());
        if (direction == null) {
            return MetaResponse.fail("invalid direction (use: outgoing, incoming, both)");
        }
        RelationType typeFilter = null;
        if (!isEmpty(req.getRelationType())) {
            typeFilter = RelationType.fromValue(req.getRelationType());
            if (typeFilter == null) {
                return MetaResponse.fail("invalid relation_type");
            }
        }

        List<AssetRelation> relations = new ArrayList<>();
        switch (direction) {
            case OUTGOING:
                relations.addAll(store.getRelationsBySource(req.getAssetId()));
                break;
            case INCOMING:
                relations.addAll(store.getRelationsByTarget(req.getAssetId()));
                break;
            case BOTH:
                // 不去重，自环关系会出现两次
                relations.addAll(store.getRelationsBySource(req.getAssetId()));
                relations.addAll(store.getRelationsByTarget(req.getAssetId()));
                break;
            default:
                throw new IllegalStateException("unexpected direction: " + direction);
        }

        if (typeFilter != null) {
            RelationType expected = typeFilter;
            relations.removeIf(relation -> relation.getRelationType() != expected);
        }
        return MetaResponse.ok(relations);
    }

    private MetaResponse handleRelationDelete(byte[] payload) {
        IdRequest req = JsonUtil.parseObject(payload, IdRequest.class);
        if (req == null) {
            return MetaResponse.fail(INVALID_REQUEST);
        }
        if (isEmpty(req.getId())) {
            return MetaResponse.fail("id is required");
        }

        store.deleteRelation(req.getId());
        log.info("关系已删除: {}", req.getId());
        return MetaResponse.ok();
    }

    // ==================== 统计 ====================

    private MetaResponse handleStats(byte[] payload) {
        return MetaResponse.ok(collectStats());
    }

    /**
     * 存储统计 + 模板数量 + 接入计数
     */
    public Map<String, Object> collectStats() {
        StoreStats stats = store.getStats();
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("total_assets", stats.getTotalAssets());
        result.put("total_relations", stats.getTotalRelations());
        result.put("total_templates", templateRegistry.count());
        if (pipeline != null) {
            result.put("readings_processed", pipeline.getDataCount());
            result.put("readings_invalid", pipeline.getInvalidCount());
        }
        result.put("last_updated", stats.getLastUpdated());
        return result;
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }
}
