package org.stackup.json;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 解析结果：要么是通过校验的值，要么是全部错误列表（二者互斥）。
 * <p>
 * 外部数据只有经过 {@link #orElseThrow(String)} 或 {@link #isOk()} 判定后才能进入分析器。
 */
public record ParseResult<T>(T value, List<ParseError> errors) {

    public ParseResult {
        errors = (errors == null) ? List.of() : List.copyOf(errors);
    }

    public static <T> ParseResult<T> ok(T value) {
        return new ParseResult<>(value, List.of());
    }

    public static <T> ParseResult<T> failed(List<ParseError> errors) {
        if (errors == null || errors.isEmpty()) {
            throw new IllegalArgumentException("failed 结果必须至少包含一条错误");
        }
        return new ParseResult<>(null, errors);
    }

    public boolean isOk() {
        return errors.isEmpty();
    }

    /**
     * 成功时返回值；失败时抛出 {@link IllegalArgumentException}，消息中列出所有错误。
     */
    public T orElseThrow(String context) {
        if (isOk()) {
            return value;
        }
        String detail = errors.stream().map(ParseError::toString).collect(Collectors.joining("；"));
        throw new IllegalArgumentException(context + " 格式错误：" + detail);
    }
}
