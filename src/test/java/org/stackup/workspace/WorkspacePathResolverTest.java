package org.stackup.workspace;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkspacePathResolverTest {

    @TempDir
    Path root;

    @TempDir
    Path outside;

    @Test
    void resolveForWrite_relativePathStaysInDefaultRoot() {
        WorkspacePathResolver resolver = new WorkspacePathResolver(List.of(root.toString()), false);

        WorkspacePathResolver.ResolvedPath resolved = resolver.resolveForWrite(null, "assemblies/gearbox.json");

        assertThat(resolved.rootId()).isEqualTo("root0");
        assertThat(resolved.absolutePath()).isEqualTo(root.toAbsolutePath().normalize().resolve("assemblies/gearbox.json"));
        assertThat(resolved.displayPath().replace('\\', '/')).isEqualTo("assemblies/gearbox.json");
    }

    @Test
    void resolve_rejectsTraversalOutsideRoot() {
        WorkspacePathResolver resolver = new WorkspacePathResolver(List.of(root.toString()), false);

        assertThatThrownBy(() -> resolver.resolveForWrite(null, "../escape.json"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("根目录范围");
        assertThatThrownBy(() -> resolver.resolveForWrite(null, outside.resolve("x.json").toString()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void resolve_absolutePathPicksMatchingRoot() throws Exception {
        WorkspacePathResolver resolver = new WorkspacePathResolver(List.of(outside.toString(), root.toString()), false);
        Path file = Files.writeString(root.resolve("a.json"), "{}");

        WorkspacePathResolver.ResolvedPath resolved = resolver.resolveForRead(null, file.toString());

        assertThat(resolved.rootId()).isEqualTo("root1");
        assertThat(resolver.rootIds()).containsExactly("root0", "root1");
    }

    @Test
    void resolveForRead_requiresExistingFile() throws Exception {
        WorkspacePathResolver resolver = new WorkspacePathResolver(List.of(root.toString()), false);
        Files.createDirectories(root.resolve("dir"));

        assertThatThrownBy(() -> resolver.resolveForRead(null, "missing.json"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("不存在");
        assertThatThrownBy(() -> resolver.resolveForRead(null, "dir"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("不是文件");
        assertThatThrownBy(() -> resolver.resolveForWrite(null, "dir"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("目录");
        assertThatThrownBy(() -> resolver.resolveForRead("root7", "a.json"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("rootId");
    }

    @Test
    void resolve_blocksSymlinkEscape() throws Exception {
        Files.writeString(outside.resolve("secret.json"), "{}");
        Files.createSymbolicLink(root.resolve("link"), outside);

        WorkspacePathResolver strict = new WorkspacePathResolver(List.of(root.toString()), false);
        WorkspacePathResolver lenient = new WorkspacePathResolver(List.of(root.toString()), true);

        assertThatThrownBy(() -> strict.resolveForRead(null, "link/secret.json"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("符号链接");
        assertThatThrownBy(() -> lenient.resolveForRead(null, "link/secret.json"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("逃逸");
    }

    @Test
    void resolve_withoutRootsIsConfigurationError() {
        WorkspacePathResolver resolver = new WorkspacePathResolver(List.of(), false);

        assertThatThrownBy(() -> resolver.resolveForWrite(null, "a.json")).isInstanceOf(IllegalStateException.class);
    }
}
