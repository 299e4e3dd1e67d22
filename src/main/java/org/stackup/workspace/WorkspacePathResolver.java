package org.stackup.workspace;

import org.stackup.config.StackupProperties;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * 装配文档路径解析器：把调用方传入的路径解析成受控的绝对路径，并确保它不会逃逸出
 * {@code app.stackup.roots} 白名单。
 * <p>
 * 规则：
 * <ul>
 *   <li>相对路径从 rootId 指定的根目录解析（缺省为 root0）；绝对路径匹配层级最深的根目录。</li>
 *   <li>拒绝 {@code ../} 造成的越界。</li>
 *   <li>对根目录到目标路径的每一级已存在目录做 realPath 校验，阻止符号链接/junction 逃逸。</li>
 *   <li>写入目标可以尚不存在，只校验已存在的父级链路。</li>
 * </ul>
 */
public class WorkspacePathResolver {

    private final boolean allowSymlink;
    private final List<Root> roots;

    public WorkspacePathResolver(StackupProperties properties) {
        this(properties.getRoots(), properties.isAllowSymlink());
    }

    public WorkspacePathResolver(List<String> configuredRoots, boolean allowSymlink) {
        this.allowSymlink = allowSymlink;
        this.roots = normalizeRoots(configuredRoots);
    }

    public List<String> rootIds() {
        List<String> ids = new ArrayList<>(roots.size());
        for (Root root : roots) {
            ids.add(root.id());
        }
        return ids;
    }

    public ResolvedPath resolveForRead(String rootId, String inputPath) {
        if (inputPath == null || inputPath.isBlank()) {
            throw new IllegalArgumentException("path 不能为空");
        }
        ResolvedPath resolved = resolve(rootId, inputPath, true);
        if (!Files.isRegularFile(resolved.absolutePath())) {
            throw new IllegalArgumentException("不是文件：" + resolved.displayPath());
        }
        return resolved;
    }

    public ResolvedPath resolveForWrite(String rootId, String inputPath) {
        if (inputPath == null || inputPath.isBlank()) {
            throw new IllegalArgumentException("path 不能为空");
        }
        ResolvedPath resolved = resolve(rootId, inputPath, false);
        if (Files.isDirectory(resolved.absolutePath(), LinkOption.NOFOLLOW_LINKS)) {
            throw new IllegalArgumentException("目标是目录，不能写入：" + resolved.displayPath());
        }
        return resolved;
    }

    ResolvedPath resolve(String rootId, String inputPath, boolean requireExists) {
        if (roots.isEmpty()) {
            throw new IllegalStateException("未配置允许访问的根目录（app.stackup.roots）");
        }

        Path rawPath = Path.of(inputPath);
        Root selectedRoot;
        Path absolute;
        if (rawPath.isAbsolute()) {
            absolute = rawPath.toAbsolutePath().normalize();
            selectedRoot = (rootId == null || rootId.isBlank()) ? findBestRootForAbsolute(absolute) : findRootById(rootId);
        } else {
            selectedRoot = (rootId == null || rootId.isBlank()) ? roots.get(0) : findRootById(rootId);
            absolute = selectedRoot.rootPath().resolve(rawPath).normalize();
        }

        if (!absolute.startsWith(selectedRoot.rootPath())) {
            throw new IllegalArgumentException("路径不在允许访问的根目录范围内：" + inputPath);
        }

        validateWithinRoot(selectedRoot, absolute, requireExists);
        return new ResolvedPath(selectedRoot.id(), absolute, selectedRoot.rootPath().relativize(absolute).toString());
    }

    private void validateWithinRoot(Root root, Path absolute, boolean requireExists) {
        Path rootReal;
        try {
            rootReal = root.rootPath().toRealPath();
        } catch (IOException e) {
            throw new IllegalStateException("根目录不存在或无法解析：" + root.rootPath(), e);
        }

        if (requireExists && !Files.exists(absolute, LinkOption.NOFOLLOW_LINKS)) {
            throw new IllegalArgumentException("路径不存在：" + absolute);
        }

        Path current = root.rootPath();
        for (Path segment : root.rootPath().relativize(absolute)) {
            current = current.resolve(segment);
            if (!Files.exists(current, LinkOption.NOFOLLOW_LINKS)) {
                break;
            }
            if (!allowSymlink && Files.isSymbolicLink(current)) {
                throw new IllegalArgumentException("不允许访问符号链接路径：" + current);
            }
            try {
                if (!current.toRealPath().startsWith(rootReal)) {
                    throw new IllegalArgumentException("路径通过链接/junction 逃逸出根目录：" + current);
                }
            } catch (IOException e) {
                throw new IllegalArgumentException("路径无法解析：" + current, e);
            }
        }
    }

    private Root findRootById(String rootId) {
        for (Root root : roots) {
            if (root.id().equals(rootId)) {
                return root;
            }
        }
        throw new IllegalArgumentException("未知的 rootId：" + rootId);
    }

    private Root findBestRootForAbsolute(Path absolute) {
        return roots.stream()
                .filter(r -> absolute.startsWith(r.rootPath()))
                .max(Comparator.comparingInt(r -> r.rootPath().getNameCount()))
                .orElseThrow(() -> new IllegalArgumentException("路径不在允许访问的根目录范围内：" + absolute));
    }

    private static List<Root> normalizeRoots(List<String> configured) {
        if (configured == null || configured.isEmpty()) {
            return List.of();
        }
        List<Root> result = new ArrayList<>(configured.size());
        for (int i = 0; i < configured.size(); i++) {
            String value = Objects.requireNonNull(configured.get(i), "配置项 app.stackup.roots[" + i + "] 不能为空");
            result.add(new Root("root" + i, Path.of(value).toAbsolutePath().normalize()));
        }
        return result;
    }

    private record Root(String id, Path rootPath) {
    }

    /**
     * @param rootId       命中的根目录 id
     * @param absolutePath 规范化后的绝对路径
     * @param displayPath  相对根目录的展示路径
     */
    public record ResolvedPath(String rootId, Path absolutePath, String displayPath) {
    }
}
