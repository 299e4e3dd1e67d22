package org.stackup.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.stackup.assembly.AssemblyPart;
import org.stackup.assembly.FaceType;
import org.stackup.assembly.PartBoundingBox;
import org.stackup.assembly.PartFace;
import org.stackup.geometry.Transforms;
import org.stackup.geometry.Vec3;
import org.stackup.tolerance.ChainLink;
import org.stackup.tolerance.ContributionDirection;
import org.stackup.tolerance.DistributionType;
import org.stackup.tolerance.LinkType;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * 把调用方传入的 JSON（公差链环节、装配零件）解析为强类型对象。
 * <p>
 * 只做结构/类型校验并补默认值；数值取值范围（非负公差、正 sigma 等）由
 * {@link org.stackup.tolerance.ChainValidator} 在计算入口统一校验。
 * 所有错误一次性收集，不在第一个错误处中止。
 */
public final class StackupJsonParser {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private StackupJsonParser() {
    }

    /**
     * 解析环节数组，例如：
     * {@code [{"id":"a","name":"壳体","nominal":25,"plusTolerance":0.1,"minusTolerance":0.1,"direction":"positive","distribution":"normal","sigma":3}]}
     * <p>
     * 缺省值：id 为 {@code link-<序号>}，type 为 part_dimension，name 同 id，direction 为 positive，
     * distribution 为 normal，sigma 为 3。nominal/plusTolerance/minusTolerance 必填。
     */
    public static ParseResult<List<ChainLink>> parseLinks(String json) {
        List<ParseError> errors = new ArrayList<>();
        JsonNode root = readArray(json, "links", errors);
        if (root == null) {
            return ParseResult.failed(errors);
        }

        List<ChainLink> links = new ArrayList<>(root.size());
        for (int i = 0; i < root.size(); i++) {
            JsonNode node = root.get(i);
            String path = "links[" + i + "]";
            if (node == null || !node.isObject()) {
                errors.add(new ParseError(path, "必须是 JSON 对象"));
                continue;
            }
            int before = errors.size();
            String id = optionalText(node, "id");
            if (id == null) {
                id = "link-" + i;
            }
            String name = optionalText(node, "name");

            LinkType type = optionalEnum(node, "type", path, LinkType.PART_DIMENSION, LinkType::fromWireName, errors);
            ContributionDirection direction = optionalEnum(node, "direction", path, ContributionDirection.POSITIVE,
                    ContributionDirection::fromWireName, errors);
            DistributionType distribution = optionalEnum(node, "distribution", path, DistributionType.NORMAL,
                    DistributionType::fromWireName, errors);

            double nominal = requiredNumber(node, "nominal", path, errors);
            double plus = requiredNumber(node, "plusTolerance", path, errors);
            double minus = requiredNumber(node, "minusTolerance", path, errors);
            double sigma = optionalNumber(node, "sigma", path, ChainLink.DEFAULT_SIGMA, errors);

            if (errors.size() == before) {
                links.add(new ChainLink(
                        id,
                        type,
                        name == null ? id : name,
                        optionalText(node, "partId"),
                        optionalText(node, "interfaceId"),
                        optionalText(node, "faceId"),
                        nominal,
                        plus,
                        minus,
                        direction,
                        distribution,
                        sigma
                ));
            }
        }
        return errors.isEmpty() ? ParseResult.ok(links) : ParseResult.failed(errors);
    }

    /**
     * 解析零件数组（几何前端输出），例如：
     * {@code [{"id":"p1","name":"底座","transform":[16 个数],"boundingBox":{"min":[0,0,0],"max":[10,10,10]},
     * "faces":[{"id":1,"faceType":"planar","normal":[0,0,1],"center":[5,5,10],"area":100}]}]}
     * <p>
     * transform 缺省为单位阵；boundingBox、color、radius、axis 可缺省。零件 id 必须唯一。
     */
    public static ParseResult<List<AssemblyPart>> parseParts(String json) {
        List<ParseError> errors = new ArrayList<>();
        JsonNode root = readArray(json, "parts", errors);
        if (root == null) {
            return ParseResult.failed(errors);
        }

        Set<String> seenIds = new HashSet<>();
        List<AssemblyPart> parts = new ArrayList<>(root.size());
        for (int i = 0; i < root.size(); i++) {
            JsonNode node = root.get(i);
            String path = "parts[" + i + "]";
            if (node == null || !node.isObject()) {
                errors.add(new ParseError(path, "必须是 JSON 对象"));
                continue;
            }
            int before = errors.size();

            String id = optionalText(node, "id");
            if (id == null) {
                errors.add(new ParseError(path + ".id", "缺少零件 id"));
            } else if (!seenIds.add(id)) {
                errors.add(new ParseError(path + ".id", "零件 id 重复：" + id));
            }
            String name = optionalText(node, "name");
            long stepEntityId = (long) optionalNumber(node, "stepEntityId", path, 0, errors);

            double[] transform = Transforms.identity();
            JsonNode t = node.get("transform");
            if (t != null && !t.isNull()) {
                transform = numberArray(t, Transforms.MATRIX_SIZE, path + ".transform", errors);
            }

            PartBoundingBox bbox = null;
            JsonNode b = node.get("boundingBox");
            if (b != null && !b.isNull()) {
                Vec3 min = requiredVec3(b, "min", path + ".boundingBox", errors);
                Vec3 max = requiredVec3(b, "max", path + ".boundingBox", errors);
                if (min != null && max != null) {
                    bbox = PartBoundingBox.of(min, max);
                }
            }

            Vec3 color = optionalVec3(node, "color", path, errors);
            List<PartFace> faces = parseFaces(node.get("faces"), id, path + ".faces", errors);

            if (errors.size() == before) {
                parts.add(new AssemblyPart(id, name == null ? id : name, stepEntityId, transform, bbox, faces, color));
            }
        }
        return errors.isEmpty() ? ParseResult.ok(parts) : ParseResult.failed(errors);
    }

    private static List<PartFace> parseFaces(JsonNode facesNode, String partId, String path, List<ParseError> errors) {
        List<PartFace> faces = new ArrayList<>();
        if (facesNode == null || facesNode.isNull()) {
            return faces;
        }
        if (!facesNode.isArray()) {
            errors.add(new ParseError(path, "必须是 JSON 数组"));
            return faces;
        }
        for (int j = 0; j < facesNode.size(); j++) {
            JsonNode f = facesNode.get(j);
            String facePath = path + "[" + j + "]";
            if (f == null || !f.isObject()) {
                errors.add(new ParseError(facePath, "必须是 JSON 对象"));
                continue;
            }
            int before = errors.size();
            int faceId = (int) requiredNumber(f, "id", facePath, errors);
            FaceType faceType = requiredEnum(f, "faceType", facePath, FaceType::fromWireName, errors);
            Vec3 normal = requiredVec3(f, "normal", facePath, errors);
            Vec3 center = requiredVec3(f, "center", facePath, errors);
            double area = optionalNumber(f, "area", facePath, 0, errors);
            Double radius = null;
            JsonNode r = f.get("radius");
            if (r != null && !r.isNull()) {
                radius = requiredNumber(f, "radius", facePath, errors);
            }
            Vec3 axis = optionalVec3(f, "axis", facePath, errors);
            if (errors.size() == before) {
                faces.add(PartFace.of(partId, faceId, faceType, normal, center, area, radius, axis));
            }
        }
        return faces;
    }

    private static JsonNode readArray(String json, String label, List<ParseError> errors) {
        if (json == null || json.isBlank()) {
            errors.add(new ParseError(label, "不能为空"));
            return null;
        }
        JsonNode root;
        try {
            root = OBJECT_MAPPER.readTree(json);
        } catch (Exception e) {
            errors.add(new ParseError(label, "不是合法的 JSON：" + e.getMessage()));
            return null;
        }
        if (root == null || !root.isArray()) {
            errors.add(new ParseError(label, "必须是 JSON 数组"));
            return null;
        }
        return root;
    }

    private static String optionalText(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) {
            return null;
        }
        String text = v.asText();
        return (text == null || text.isBlank()) ? null : text;
    }

    private static double requiredNumber(JsonNode node, String field, String path, List<ParseError> errors) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) {
            errors.add(new ParseError(path + "." + field, "缺少必填数值字段"));
            return 0;
        }
        if (!v.isNumber()) {
            errors.add(new ParseError(path + "." + field, "必须是数值"));
            return 0;
        }
        return v.asDouble();
    }

    private static double optionalNumber(JsonNode node, String field, String path, double defaultValue, List<ParseError> errors) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) {
            return defaultValue;
        }
        if (!v.isNumber()) {
            errors.add(new ParseError(path + "." + field, "必须是数值"));
            return defaultValue;
        }
        return v.asDouble();
    }

    private static <E> E optionalEnum(JsonNode node, String field, String path, E defaultValue,
                                      Function<String, E> lookup, List<ParseError> errors) {
        String text = optionalText(node, field);
        if (text == null) {
            return defaultValue;
        }
        E value = lookup.apply(text);
        if (value == null) {
            errors.add(new ParseError(path + "." + field, "不支持的取值：" + text));
            return defaultValue;
        }
        return value;
    }

    private static <E> E requiredEnum(JsonNode node, String field, String path,
                                      Function<String, E> lookup, List<ParseError> errors) {
        String text = optionalText(node, field);
        if (text == null) {
            errors.add(new ParseError(path + "." + field, "缺少必填字段"));
            return null;
        }
        E value = lookup.apply(text);
        if (value == null) {
            errors.add(new ParseError(path + "." + field, "不支持的取值：" + text));
        }
        return value;
    }

    private static Vec3 requiredVec3(JsonNode node, String field, String path, List<ParseError> errors) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) {
            errors.add(new ParseError(path + "." + field, "缺少必填向量字段"));
            return null;
        }
        double[] xyz = numberArray(v, 3, path + "." + field, errors);
        return xyz == null ? null : new Vec3(xyz[0], xyz[1], xyz[2]);
    }

    private static Vec3 optionalVec3(JsonNode node, String field, String path, List<ParseError> errors) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) {
            return null;
        }
        double[] xyz = numberArray(v, 3, path + "." + field, errors);
        return xyz == null ? null : new Vec3(xyz[0], xyz[1], xyz[2]);
    }

    private static double[] numberArray(JsonNode v, int size, String path, List<ParseError> errors) {
        if (!v.isArray() || v.size() != size) {
            errors.add(new ParseError(path, "必须是长度为 " + size + " 的数值数组"));
            return null;
        }
        double[] values = new double[size];
        for (int k = 0; k < size; k++) {
            JsonNode item = v.get(k);
            if (item == null || !item.isNumber()) {
                errors.add(new ParseError(path + "[" + k + "]", "必须是数值"));
                return null;
            }
            values[k] = item.asDouble();
        }
        return values;
    }
}
