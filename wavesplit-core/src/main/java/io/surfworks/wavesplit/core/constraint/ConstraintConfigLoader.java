package io.surfworks.wavesplit.core.constraint;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.surfworks.wavesplit.core.ConfigurationException;
import io.surfworks.wavesplit.core.symbolic.IndexExpr;
import io.surfworks.wavesplit.core.symbolic.IndexSymbol;
import io.surfworks.wavesplit.core.symbolic.IndexingContext;

/**
 * Loads a {@link ConstraintConfig} from JSON.
 *
 * <p>Format:
 * <pre>{@code
 * {
 *   "bindings": { "M": 1024, "BLOCK_M": 64, "BLOCK_K": 32 },
 *   "constraints": [
 *     { "type": "workgroup", "dim": "M", "tileSize": "BLOCK_M", "workgroupDim": 0 },
 *     { "type": "tiling",    "dim": "K", "tileSize": "BLOCK_K" },
 *     { "type": "wave",      "dim": "M", "tileSize": "BLOCK_M/2" },
 *     { "type": "hardware",  "threadsPerWave": 64, "wavesPerBlock": [2, 1, 1],
 *       "vectorShapes": { "M": 16, "K": 16 } },
 *     { "type": "alias",     "source": "M2", "target": "M", "scale": 2 }
 *   ]
 * }
 * }</pre>
 *
 * <p>Tile sizes are integers, symbol names, or {@code SYMBOL/INT} and
 * {@code SYMBOL*INT} forms. Constraint order is preserved.
 */
public final class ConstraintConfigLoader {

    private static final ObjectMapper JSON = new ObjectMapper();

    private static final int DEFAULT_THREADS_PER_WAVE = 64;

    private ConstraintConfigLoader() {
    }

    /**
     * Loads a configuration file.
     *
     * @param configFile path to the JSON document
     * @return the loaded configuration
     * @throws IOException if the file cannot be read
     * @throws ConfigurationException if the document is malformed
     */
    public static ConstraintConfig load(Path configFile) throws IOException {
        return parse(Files.readString(configFile));
    }

    /**
     * Parses a configuration document.
     *
     * @throws ConfigurationException if the document is malformed
     */
    public static ConstraintConfig parse(String json) {
        JsonNode root;
        try {
            root = JSON.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Invalid constraint configuration: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ConfigurationException("Constraint configuration must be a JSON object");
        }

        IndexingContext bindings = new IndexingContext();
        if (root.has("bindings")) {
            JsonNode bindingsNode = root.get("bindings");
            Iterator<Map.Entry<String, JsonNode>> fields = bindingsNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (!field.getValue().canConvertToLong()) {
                    throw new ConfigurationException(field.getKey(), "binding must be an integer, got " + field.getValue());
                }
                bindings.bind(new IndexSymbol(field.getKey()), field.getValue().asLong());
            }
        }

        List<Constraint> constraints = new ArrayList<>();
        JsonNode constraintsNode = root.path("constraints");
        if (!constraintsNode.isArray()) {
            throw new ConfigurationException("Constraint configuration needs a \"constraints\" array");
        }
        for (JsonNode node : constraintsNode) {
            constraints.add(parseConstraint(node));
        }
        return new ConstraintConfig(new ConstraintSet(constraints), bindings);
    }

    private static Constraint parseConstraint(JsonNode node) {
        String type = requireText(node, "type");
        switch (type) {
            case "workgroup":
                return new WorkgroupConstraint(
                        symbol(node, "dim"),
                        expr(node, "tileSize"),
                        requireInt(node, "workgroupDim"),
                        !node.has("primary") || node.get("primary").asBoolean());
            case "tiling":
                return new TilingConstraint(symbol(node, "dim"), expr(node, "tileSize"));
            case "wave":
                return new WaveConstraint(symbol(node, "dim"), expr(node, "tileSize"));
            case "hardware":
                return parseHardware(node);
            case "alias":
                IndexSymbol target = symbol(node, "target");
                IndexExpr sourceFromTarget = node.has("scale")
                        ? target.times(IndexExpr.constant(requireInt(node, "scale")))
                        : target;
                return new SymbolicAlias(symbol(node, "source"), target, sourceFromTarget);
            default:
                throw new ConfigurationException(type, "unknown constraint type");
        }
    }

    private static HardwareConstraint parseHardware(JsonNode node) {
        int threadsPerWave = node.has("threadsPerWave") ? requireInt(node, "threadsPerWave") : DEFAULT_THREADS_PER_WAVE;

        int[] wavesPerBlock = null;
        if (node.has("wavesPerBlock")) {
            JsonNode waves = node.get("wavesPerBlock");
            if (!waves.isArray()) {
                throw new ConfigurationException("wavesPerBlock", "must be an array");
            }
            wavesPerBlock = new int[waves.size()];
            for (int i = 0; i < waves.size(); i++) {
                wavesPerBlock[i] = waves.get(i).asInt();
            }
        }

        Map<IndexSymbol, Integer> vectorShapes = null;
        if (node.has("vectorShapes")) {
            vectorShapes = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.get("vectorShapes").fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                vectorShapes.put(new IndexSymbol(field.getKey()), field.getValue().asInt());
            }
        }

        try {
            return new HardwareConstraint(threadsPerWave, wavesPerBlock, vectorShapes);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("hardware", e.getMessage());
        }
    }

    static IndexExpr parseExpr(String text) {
        String trimmed = text.trim();
        int div = trimmed.indexOf('/');
        if (div > 0) {
            return parseAtom(trimmed.substring(0, div)).div(parseAtom(trimmed.substring(div + 1)));
        }
        int mul = trimmed.indexOf('*');
        if (mul > 0) {
            return parseAtom(trimmed.substring(0, mul)).times(parseAtom(trimmed.substring(mul + 1)));
        }
        return parseAtom(trimmed);
    }

    private static IndexExpr parseAtom(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            throw new ConfigurationException("Empty operand in expression");
        }
        try {
            return IndexExpr.constant(Long.parseLong(trimmed));
        } catch (NumberFormatException e) {
            return new IndexSymbol(trimmed);
        }
    }

    private static IndexExpr expr(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null) {
            throw new ConfigurationException(field, "missing in " + node);
        }
        if (value.canConvertToLong()) {
            return IndexExpr.constant(value.asLong());
        }
        return parseExpr(value.asText());
    }

    private static IndexSymbol symbol(JsonNode node, String field) {
        return new IndexSymbol(requireText(node, field));
    }

    private static String requireText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new ConfigurationException(field, "missing or not a string in " + node);
        }
        return value.asText();
    }

    private static int requireInt(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.canConvertToInt()) {
            throw new ConfigurationException(field, "missing or not an integer in " + node);
        }
        return value.asInt();
    }
}
