package org.stackup.persist;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.stackup.assembly.AssemblyGraph;
import org.stackup.tolerance.ToleranceChain;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 装配图 / 公差链的 JSON 文档编解码。
 * <p>
 * 约定：
 * <ul>
 *   <li>顶层带 {@code schemaVersion}；读取比 {@link #SCHEMA_VERSION} 新的文档直接拒绝，旧版本按当前结构读取。</li>
 *   <li>Map 一律写成有序的 {@code [{key, value}]} 列表，读回后插入顺序不变（BFS 结果依赖邻接顺序）。</li>
 *   <li>同一版本内出现的未知字段忽略。</li>
 * </ul>
 * 文件路径的白名单校验由调用方（{@link org.stackup.workspace.WorkspacePathResolver}）负责。
 */
public class StackupDocumentCodec {

    public static final int SCHEMA_VERSION = 1;

    private final ObjectMapper objectMapper;

    public StackupDocumentCodec() {
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String writeGraph(AssemblyGraph graph) {
        GraphDocument doc = new GraphDocument(
                SCHEMA_VERSION,
                toEntries(graph.parts()),
                toEntries(graph.interfaces()),
                toEntries(graph.chains()),
                toEntries(graph.partAdjacency())
        );
        return write(doc);
    }

    public AssemblyGraph readGraph(String json) {
        JsonNode root = readVersioned(json);
        GraphDocument doc = convert(root, GraphDocument.class);
        return new AssemblyGraph(
                toMap(doc.parts()),
                toMap(doc.interfaces()),
                toMap(doc.chains()),
                toMap(doc.partAdjacency())
        );
    }

    public String writeChain(ToleranceChain chain) {
        return write(new ChainDocument(SCHEMA_VERSION, chain));
    }

    public ToleranceChain readChain(String json) {
        JsonNode root = readVersioned(json);
        ChainDocument doc = convert(root, ChainDocument.class);
        if (doc.chain() == null) {
            throw new IllegalArgumentException("文档缺少 chain 字段");
        }
        return doc.chain();
    }

    /**
     * 写入装配图文档，返回写入字节数。
     */
    public long saveGraph(Path file, AssemblyGraph graph, boolean overwrite) throws IOException {
        return writeAtomically(file, writeGraph(graph).getBytes(StandardCharsets.UTF_8), overwrite);
    }

    public AssemblyGraph loadGraph(Path file) throws IOException {
        return readGraph(Files.readString(file, StandardCharsets.UTF_8));
    }

    public long saveChain(Path file, ToleranceChain chain, boolean overwrite) throws IOException {
        return writeAtomically(file, writeChain(chain).getBytes(StandardCharsets.UTF_8), overwrite);
    }

    public ToleranceChain loadChain(Path file) throws IOException {
        return readChain(Files.readString(file, StandardCharsets.UTF_8));
    }

    private String write(Object doc) {
        try {
            return objectMapper.writeValueAsString(doc);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("文档序列化失败：" + e.getOriginalMessage(), e);
        }
    }

    private JsonNode readVersioned(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("文档内容为空");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("文档不是合法的 JSON：" + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("文档顶层必须是 JSON 对象");
        }
        JsonNode version = root.get("schemaVersion");
        if (version == null || !version.canConvertToInt()) {
            throw new IllegalArgumentException("文档缺少 schemaVersion");
        }
        if (version.asInt() > SCHEMA_VERSION) {
            throw new IllegalArgumentException("文档版本过新：schemaVersion=" + version.asInt() + "（当前支持 " + SCHEMA_VERSION + "）");
        }
        return root;
    }

    private <T> T convert(JsonNode root, Class<T> type) {
        try {
            return objectMapper.treeToValue(root, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("文档结构不合法：" + e.getOriginalMessage(), e);
        }
    }

    private static long writeAtomically(Path target, byte[] bytes, boolean overwrite) throws IOException {
        // 先写同目录临时文件，再 move 到目标路径；文件系统不支持 ATOMIC_MOVE 时降级为普通 move
        Path parent = target.toAbsolutePath().getParent();
        if (parent == null) {
            throw new IllegalArgumentException("目标路径无效：" + target);
        }
        if (!overwrite && Files.exists(target)) {
            throw new IllegalArgumentException("目标文件已存在（如需覆盖请设置 overwrite=true）：" + target);
        }
        Files.createDirectories(parent);
        Path tmp = Files.createTempFile(parent, "stackup-", ".tmp");
        try {
            Files.write(tmp, bytes);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
        return bytes.length;
    }

    private static <T> List<KeyedEntry<T>> toEntries(Map<String, T> map) {
        List<KeyedEntry<T>> entries = new ArrayList<>(map.size());
        for (Map.Entry<String, T> e : map.entrySet()) {
            entries.add(new KeyedEntry<>(e.getKey(), e.getValue()));
        }
        return entries;
    }

    private static <T> Map<String, T> toMap(List<KeyedEntry<T>> entries) {
        Map<String, T> map = new LinkedHashMap<>();
        if (entries == null) {
            return map;
        }
        for (KeyedEntry<T> e : entries) {
            if (e.key() == null) {
                throw new IllegalArgumentException("文档中存在缺少 key 的条目");
            }
            map.put(e.key(), e.value());
        }
        return map;
    }
}
