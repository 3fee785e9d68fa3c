package com.wangbin.edge.common.domain.dto.message;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.wangbin.edge.common.domain.enums.ValueType;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * 单个点位值
 *
 * 线上格式为 {name, number|text|flag, unit?, quality?}，三个值字段恰好出现一个。
 * 内部以 {@link Value} 的三个变体表示，消费方按变体分支处理。
 */
@Getter
@ToString
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class TagValue {

    private final String name;

    @JsonIgnore
    private final Value value;

    private final String unit;

    private final String quality;

    private TagValue(String name, Value value, String unit, String quality) {
        this.name = name;
        this.value = Objects.requireNonNull(value, "value");
        this.unit = unit;
        this.quality = quality;
    }

    public static TagValue ofNumber(String name, double number) {
        return new TagValue(name, new NumberValue(number), null, null);
    }

    public static TagValue ofText(String name, String text) {
        return new TagValue(name, new TextValue(text), null, null);
    }

    public static TagValue ofFlag(String name, boolean flag) {
        return new TagValue(name, new FlagValue(flag), null, null);
    }

    public TagValue withQuality(String quality) {
        return new TagValue(name, value, unit, quality);
    }

    @JsonCreator
    static TagValue fromJson(@JsonProperty("name") String name,
                             @JsonProperty("number") Double number,
                             @JsonProperty("text") String text,
                             @JsonProperty("flag") Boolean flag,
                             @JsonProperty("unit") String unit,
                             @JsonProperty("quality") String quality) {
        int populated = (number != null ? 1 : 0) + (text != null ? 1 : 0) + (flag != null ? 1 : 0);
        if (populated != 1) {
            throw new IllegalArgumentException(String.format(
                    "tag '%s' must carry exactly one of number/text/flag, found %d", name, populated));
        }
        Value value;
        if (number != null) {
            value = new NumberValue(number);
        } else if (text != null) {
            value = new TextValue(text);
        } else {
            value = new FlagValue(flag);
        }
        return new TagValue(name, value, unit, quality);
    }

    @JsonProperty("number")
    public Double getNumber() {
        return value instanceof NumberValue numberValue ? numberValue.number() : null;
    }

    @JsonProperty("text")
    public String getText() {
        return value instanceof TextValue textValue ? textValue.text() : null;
    }

    @JsonProperty("flag")
    public Boolean getFlag() {
        return value instanceof FlagValue flagValue ? flagValue.flag() : null;
    }

    /**
     * 当前值对应的类型
     */
    @JsonIgnore
    public ValueType getValueType() {
        return value.type();
    }

    /**
     * 点位值变体
     */
    public sealed interface Value permits NumberValue, TextValue, FlagValue {
        ValueType type();
    }

    public record NumberValue(double number) implements Value {
        @Override
        public ValueType type() {
            return ValueType.NUMBER;
        }
    }

    public record TextValue(String text) implements Value {
        public TextValue {
            Objects.requireNonNull(text, "text");
        }

        @Override
        public ValueType type() {
            return ValueType.TEXT;
        }
    }

    public record FlagValue(boolean flag) implements Value {
        @Override
        public ValueType type() {
            return ValueType.FLAG;
        }
    }
}
