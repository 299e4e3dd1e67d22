package org.stackup.json;

/**
 * 外部 JSON 解析错误。
 *
 * @param path    出错位置（例如 {@code links[2].nominal}）
 * @param message 错误说明
 */
public record ParseError(String path, String message) {

    @Override
    public String toString() {
        return path + "：" + message;
    }
}
