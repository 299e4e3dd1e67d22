package org.stackup.dto.assembly;

import org.stackup.assembly.MatingInterface;

import java.util.List;

/**
 * {@code assembly_detect_interfaces} 的返回结果。
 *
 * @param partCount     零件数
 * @param interfaces    识别出的配合界面
 * @param junctionParts 出现在多个界面中的零件 id
 * @param warnings      非致命提示
 */
public record InterfaceDetectionResult(
        int partCount,
        List<MatingInterface> interfaces,
        List<String> junctionParts,
        List<String> warnings
) {
}
