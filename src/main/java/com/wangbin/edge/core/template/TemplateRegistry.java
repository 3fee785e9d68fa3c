package com.wangbin.edge.core.template;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.wangbin.edge.common.domain.dto.message.AssetData;
import com.wangbin.edge.common.domain.dto.message.TagValue;
import com.wangbin.edge.common.domain.entity.AssetResource;
import com.wangbin.edge.common.domain.entity.AssetTemplate;
import com.wangbin.edge.common.exception.TemplateLoadException;
import com.wangbin.edge.common.exception.TemplateValidationException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 资产模板注册表
 *
 * 启动时从目录加载模板定义（YAML 或 JSON，按扩展名选择解析器，一个文件一个模板），运行期只读。
 * 同名模板后加载的覆盖先加载的。
 */
@Slf4j
public class TemplateRegistry {

    private static final Set<String> TEMPLATE_EXTENSIONS = Set.of(".yaml", ".yml", ".json");

    private final ObjectMapper yamlMapper = YAMLMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private final ObjectMapper jsonMapper = JsonMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private final Map<String, AssetTemplate> templates = new ConcurrentHashMap<>();

    /**
     * 加载目录下全部模板文件，任一文件失败则整体失败；失败前已加载的模板保留。
     */
    public void load(Path directory) {
        if (directory == null || !Files.isDirectory(directory)) {
            throw new TemplateLoadException("failed to read directory: " + directory);
        }

        List<Path> files;
        try (Stream<Path> stream = Files.list(directory)) {
            files = stream.filter(Files::isRegularFile)
                    .filter(this::isTemplateFile)
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new TemplateLoadException("failed to read directory: " + directory, e);
        }

        for (Path file : files) {
            try {
                loadFile(file);
            } catch (TemplateLoadException e) {
                throw new TemplateLoadException("failed to load template (" + file + "): " + e.getMessage(), e);
            }
        }
        log.info("模板目录加载完成: {}, 文件数: {}, 当前模板总数: {}", directory, files.size(), templates.size());
    }

    /**
     * 加载单个模板文件
     */
    public AssetTemplate loadFile(Path file) {
        byte[] content;
        try {
            content = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new TemplateLoadException("failed to read file: " + file, e);
        }

        AssetTemplate template;
        try {
            template = mapperFor(file).readValue(content, AssetTemplate.class);
        } catch (JsonProcessingException e) {
            throw new TemplateLoadException("failed to parse template: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new TemplateLoadException("failed to parse template: " + e.getMessage(), e);
        }

        if (template == null || template.getName() == null || template.getName().isBlank()) {
            throw new TemplateLoadException("template name is missing: " + file);
        }
        if (template.getResources() == null) {
            template.setResources(new ArrayList<>());
        }
        register(template);
        log.debug("加载模板: {} ({} 个资源) <- {}", template.getName(), template.getResources().size(), file);
        return template;
    }

    /**
     * 直接注册模板，同名覆盖
     */
    public void register(AssetTemplate template) {
        AssetTemplate previous = templates.put(template.getName(), template);
        if (previous != null) {
            log.warn("模板 {} 已存在，被新定义覆盖", template.getName());
        }
    }

    public Optional<AssetTemplate> get(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(templates.get(name));
    }

    /**
     * 当前模板快照，按名称排序
     */
    public List<AssetTemplate> list() {
        List<AssetTemplate> snapshot = new ArrayList<>(templates.values());
        snapshot.sort(Comparator.comparing(AssetTemplate::getName));
        return snapshot;
    }

    public boolean exists(String name) {
        return name != null && templates.containsKey(name);
    }

    public int count() {
        return templates.size();
    }

    /**
     * 按模板校验上报数据。
     * 模板不存在时跳过校验；模板未声明的点位直接放行。
     *
     * @throws TemplateValidationException 点位值类型与声明不一致
     */
    public void validate(String templateName, AssetData data) {
        Optional<AssetTemplate> template = get(templateName);
        if (template.isEmpty() || data == null || data.getValues() == null) {
            return;
        }

        Map<String, AssetResource> resourceMap = new HashMap<>();
        for (AssetResource resource : template.get().getResources()) {
            resourceMap.put(resource.getName(), resource);
        }

        for (TagValue tagValue : data.getValues()) {
            AssetResource resource = resourceMap.get(tagValue.getName());
            if (resource == null || resource.getValueType() == null) {
                continue;
            }
            if (tagValue.getValueType() != resource.getValueType()) {
                throw new TemplateValidationException(templateName, tagValue.getName(), resource.getValueType());
            }
        }
    }

    private ObjectMapper mapperFor(Path file) {
        String fileName = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return fileName.endsWith(".json") ? jsonMapper : yamlMapper;
    }

    private boolean isTemplateFile(Path path) {
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = fileName.lastIndexOf('.');
        return dot >= 0 && TEMPLATE_EXTENSIONS.contains(fileName.substring(dot));
    }
}
