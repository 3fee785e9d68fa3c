package com.wangbin.edge.common.utils;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;

/**
 * JSON工具类
 *
 * parse/toJson 系列方法失败时记录日志并返回null，由调用方决定如何兜底；
 * 需要把失败当作错误处理的场景直接使用 {@link #mapper()}。
 */
@Slf4j
public class JsonUtil {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private JsonUtil() {
        // 工具类，防止实例化
    }

    public static ObjectMapper mapper() {
        return OBJECT_MAPPER;
    }

    /**
     * 对象转JSON字节
     */
    public static byte[] toJsonBytes(Object object) {
        try {
            return OBJECT_MAPPER.writeValueAsBytes(object);
        } catch (Exception e) {
            log.error("对象转JSON失败: {}", object != null ? object.getClass().getSimpleName() : null, e);
            return null;
        }
    }

    /**
     * 对象转JSON字符串
     */
    public static String toJsonString(Object object) {
        byte[] bytes = toJsonBytes(object);
        return bytes != null ? new String(bytes, StandardCharsets.UTF_8) : null;
    }

    /**
     * JSON字节转对象
     */
    public static <T> T parseObject(byte[] json, Class<T> clazz) {
        if (json == null || json.length == 0) {
            log.debug("JSON内容为空, 目标类型: {}", clazz.getSimpleName());
            return null;
        }
        try {
            return OBJECT_MAPPER.readValue(json, clazz);
        } catch (Exception e) {
            log.debug("JSON转对象失败: {}, 原因: {}", clazz.getSimpleName(), e.getMessage());
            return null;
        }
    }
}
