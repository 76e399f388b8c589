package com.archsketch.core.io;

import com.archsketch.core.model.Position;
import com.archsketch.core.model.Span;
import com.archsketch.core.model.SyntaxNode;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Converts JSON syntax-tree documents into {@link SyntaxNode}s.
 *
 * <p>Two shapes are accepted and may be mixed within one tree:
 * <pre>{@code
 * {"kind": "identifier", "text": "PE", "span": {"start": {"row": 1, "column": 4}, "end": {...}}, "children": []}
 * {"type": "identifier", "text": "PE", "start_point": [1, 4], "end_point": [1, 6], "children": []}
 * }</pre>
 *
 * <p>Missing fields yield empty values, never errors. Conversion is iterative and the JSON
 * nesting limit is raised, so tree depth is bounded by heap only.
 */
public class SyntaxTreeReader {

    /**
     * Maximum JSON nesting accepted when parsing tree documents.
     */
    public static final int MAX_NESTING_DEPTH = 1_000_000;

    private final ObjectMapper objectMapper;

    public SyntaxTreeReader() {
        this(createObjectMapper());
    }

    public SyntaxTreeReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Creates a mapper able to read very deep tree documents.
     *
     * @return object mapper with raised nesting limits
     */
    public static ObjectMapper createObjectMapper() {
        JsonFactory factory = JsonFactory.builder()
            .streamReadConstraints(StreamReadConstraints.builder()
                .maxNestingDepth(MAX_NESTING_DEPTH)
                .build())
            .build();
        return new ObjectMapper(factory);
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }

    /**
     * Reads a tree document from a file.
     *
     * @param file JSON file holding one tree
     * @return root node
     * @throws IOException if the file cannot be read or is not valid JSON
     */
    public SyntaxNode read(Path file) throws IOException {
        return toSyntaxNode(objectMapper.readTree(file.toFile()));
    }

    /**
     * Reads a tree document from a JSON string.
     *
     * @param json JSON text holding one tree
     * @return root node
     * @throws IOException if the text is not valid JSON
     */
    public SyntaxNode read(String json) throws IOException {
        return toSyntaxNode(objectMapper.readTree(json));
    }

    /**
     * Converts an already parsed JSON tree.
     *
     * @param root JSON object of the root node
     * @return root node
     */
    public SyntaxNode toSyntaxNode(JsonNode root) {
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(root == null ? MissingNode.getInstance() : root));
        SyntaxNode result = null;

        while (!stack.isEmpty()) {
            Frame top = stack.peek();
            if (top.hasPendingChild()) {
                stack.push(new Frame(top.nextChild()));
                continue;
            }
            stack.pop();
            SyntaxNode built = top.build();
            if (stack.isEmpty()) {
                result = built;
            } else {
                stack.peek().children.add(built);
            }
        }
        return result;
    }

    private static String kindOf(JsonNode json) {
        JsonNode kind = json.hasNonNull("kind") ? json.get("kind") : json.get("type");
        return kind != null && kind.isValueNode() ? kind.asText() : "";
    }

    private static String textOf(JsonNode json) {
        JsonNode text = json.get("text");
        return text != null && text.isValueNode() && !text.isNull() ? text.asText() : null;
    }

    private static Span spanOf(JsonNode json) {
        JsonNode span = json.get("span");
        if (span != null && span.isObject()) {
            return new Span(positionOf(span.get("start")), positionOf(span.get("end")));
        }
        if (json.has("start_point") || json.has("end_point")) {
            return new Span(positionOf(json.get("start_point")), positionOf(json.get("end_point")));
        }
        if (json.has("start") || json.has("end")) {
            return new Span(positionOf(json.get("start")), positionOf(json.get("end")));
        }
        return Span.EMPTY;
    }

    private static Position positionOf(JsonNode json) {
        if (json == null) {
            return Position.ORIGIN;
        }
        if (json.isArray()) {
            return new Position(json.path(0).asInt(0), json.path(1).asInt(0));
        }
        int row = json.has("row") ? json.path("row").asInt(0) : json.path("line").asInt(0);
        return new Position(row, json.path("column").asInt(0));
    }

    private static final class Frame {
        private final JsonNode json;
        private final JsonNode childJson;
        private final List<SyntaxNode> children = new ArrayList<>();
        private int next;

        Frame(JsonNode json) {
            this.json = json;
            JsonNode raw = json.get("children");
            this.childJson = raw != null && raw.isArray() ? raw : MissingNode.getInstance();
        }

        boolean hasPendingChild() {
            return next < childJson.size();
        }

        JsonNode nextChild() {
            return childJson.get(next++);
        }

        SyntaxNode build() {
            if (!json.isObject()) {
                return new SyntaxNode("", null, List.of(), Span.EMPTY);
            }
            return new SyntaxNode(kindOf(json), textOf(json), children, spanOf(json));
        }
    }
}
