package org.stackup.persist;

/**
 * 有序键值对：文档里用 {@code [{key, value}]} 列表代替 JSON 对象，保证读回时顺序不变。
 */
public record KeyedEntry<T>(String key, T value) {
}
