package com.wangbin.edge.core.template;

import com.wangbin.edge.common.domain.dto.message.AssetData;
import com.wangbin.edge.common.domain.dto.message.TagValue;
import com.wangbin.edge.common.domain.entity.AssetTemplate;
import com.wangbin.edge.common.domain.enums.ValueType;
import com.wangbin.edge.common.exception.TemplateLoadException;
import com.wangbin.edge.common.exception.TemplateValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class TemplateRegistryTest {

    @TempDir
    Path dir;

    @Test
    void loadsYamlAndJsonFilesOnly() throws IOException {
        write("b-meter.yaml", "name: meter\nresources:\n  - name: power\n    valueType: NUMBER\n    unit: kW\n");
        write("a-sensor.json", "{\"name\":\"sensor\",\"resources\":[{\"name\":\"ok\",\"valueType\":\"FLAG\"}]}");
        write("notes.txt", "not a template");
        Files.createDirectory(dir.resolve("nested.yaml"));

        TemplateRegistry registry = new TemplateRegistry();
        registry.load(dir);

        assertEquals(2, registry.count());
        assertTrue(registry.exists("meter"));
        assertTrue(registry.exists("sensor"));
        assertFalse(registry.exists("notes"));
        assertEquals(List.of("meter", "sensor"),
                registry.list().stream().map(AssetTemplate::getName).collect(Collectors.toList()));

        AssetTemplate meter = registry.get("meter").orElseThrow();
        assertEquals(ValueType.NUMBER, meter.getResources().get(0).getValueType());
        assertEquals("kW", meter.getResources().get(0).getUnit());
    }

    @Test
    void jsonFilesUseStrictJsonParsing() throws IOException {
        write("tabbed.json", "{\n\t\"name\": \"tabbed\",\n\t\"resources\": [\n\t\t{\"name\": \"t\", \"valueType\": \"NUMBER\"}\n\t]\n}\n");
        write("escaped.json", "{\"name\":\"escaped\",\"resources\":[{\"name\":\"speed\",\"valueType\":\"NUMBER\",\"unit\":\"m\\/s\"}]}");

        TemplateRegistry registry = new TemplateRegistry();
        registry.load(dir);

        assertEquals(2, registry.count());
        assertEquals(ValueType.NUMBER, registry.get("tabbed").orElseThrow().getResources().get(0).getValueType());
        assertEquals("m/s", registry.get("escaped").orElseThrow().getResources().get(0).getUnit());
    }

    @Test
    void getUnknownIsEmpty() {
        TemplateRegistry registry = new TemplateRegistry();

        assertTrue(registry.get("missing").isEmpty());
        assertTrue(registry.get(null).isEmpty());
    }

    @Test
    void missingNameAbortsLoad() throws IOException {
        write("a.yaml", "name: first\nresources: []\n");
        write("b.yaml", "resources:\n  - name: t\n    valueType: NUMBER\n");
        write("c.yaml", "name: third\n");

        TemplateRegistry registry = new TemplateRegistry();

        TemplateLoadException e = assertThrows(TemplateLoadException.class, () -> registry.load(dir));
        assertTrue(e.getMessage().contains("template name is missing"));
        // 失败前已加载的保留，失败后的不再加载
        assertTrue(registry.exists("first"));
        assertFalse(registry.exists("third"));
    }

    @Test
    void unparseableFileAbortsLoad() throws IOException {
        write("bad.json", "{\"name\": \"broken\", \"resources\": [");

        TemplateRegistry registry = new TemplateRegistry();

        assertThrows(TemplateLoadException.class, () -> registry.load(dir));
        assertEquals(0, registry.count());
    }

    @Test
    void missingDirectoryFails() {
        TemplateRegistry registry = new TemplateRegistry();

        assertThrows(TemplateLoadException.class, () -> registry.load(dir.resolve("absent")));
    }

    @Test
    void laterDefinitionReplacesEarlier() throws IOException {
        write("a.yaml", "name: tpl\nresources:\n  - name: t\n    valueType: NUMBER\n");
        write("b.yaml", "name: tpl\nresources:\n  - name: t\n    valueType: TEXT\n");

        TemplateRegistry registry = new TemplateRegistry();
        registry.load(dir);

        assertEquals(1, registry.count());
        assertEquals(ValueType.TEXT, registry.get("tpl").orElseThrow().getResources().get(0).getValueType());
    }

    @Test
    void validateChecksDeclaredType() throws IOException {
        Path file = write("tpl.yaml", "name: tpl\nresources:\n  - name: t\n    valueType: NUMBER\n");
        TemplateRegistry registry = new TemplateRegistry();
        registry.loadFile(file);

        TemplateValidationException e = assertThrows(TemplateValidationException.class,
                () -> registry.validate("tpl", reading(TagValue.ofText("t", "x"))));
        assertEquals("t", e.getTagName());
        assertEquals(ValueType.NUMBER, e.getExpectedType());

        assertDoesNotThrow(() -> registry.validate("tpl", reading(TagValue.ofNumber("t", 1))));
    }

    @Test
    void validateIgnoresUndeclaredTagsAndUnknownTemplates() throws IOException {
        Path file = write("tpl.yaml", "name: tpl\nresources:\n  - name: t\n    valueType: NUMBER\n");
        TemplateRegistry registry = new TemplateRegistry();
        registry.loadFile(file);

        assertDoesNotThrow(() -> registry.validate("tpl", reading(TagValue.ofFlag("extra", true))));
        assertDoesNotThrow(() -> registry.validate("other", reading(TagValue.ofText("t", "x"))));
    }

    private Path write(String name, String content) throws IOException {
        return Files.writeString(dir.resolve(name), content);
    }

    private static AssetData reading(TagValue... values) {
        AssetData data = new AssetData();
        data.setAssetId("a1");
        data.setValues(new ArrayList<>(List.of(values)));
        return data;
    }
}
