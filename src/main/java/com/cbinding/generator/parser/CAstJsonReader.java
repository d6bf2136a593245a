package com.cbinding.generator.parser;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cbinding.generator.model.ArrayDecl;
import com.cbinding.generator.model.CExpression;
import com.cbinding.generator.model.CNode;
import com.cbinding.generator.model.Coord;
import com.cbinding.generator.model.Decl;
import com.cbinding.generator.model.EllipsisParam;
import com.cbinding.generator.model.EnumSpec;
import com.cbinding.generator.model.Enumerator;
import com.cbinding.generator.model.FileAst;
import com.cbinding.generator.model.FuncDecl;
import com.cbinding.generator.model.IdentifierType;
import com.cbinding.generator.model.PtrDecl;
import com.cbinding.generator.model.Struct;
import com.cbinding.generator.model.TypeDecl;
import com.cbinding.generator.model.Typedef;
import com.cbinding.generator.model.Union;
import com.cbinding.generator.parser.exception.AstFormatException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads a preprocessed header's declaration tree from the JSON layout written by
 * pycparser's {@code c_json} example: every node is an object with a {@code _nodetype}
 * member, a {@code coord} string and one member per child or attribute.
 *
 * Function bodies ({@code FuncDef}) are skipped; only declarations are read.
 */
public class CAstJsonReader {
    private static final Logger log = LoggerFactory.getLogger(CAstJsonReader.class);

    private static final String NODE_TYPE = "_nodetype";
    private static final Pattern COORD = Pattern.compile("^(.*):(\\d+)(?::(\\d+))?$");

    private final ObjectMapper objectMapper;

    public CAstJsonReader() {
        this(new ObjectMapper());
    }

    public CAstJsonReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public FileAst read(Path astFile) throws IOException {
        log.debug("Reading declaration tree from {}", astFile);
        return read(Files.readString(astFile, StandardCharsets.UTF_8));
    }

    public FileAst read(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new AstFormatException("Declaration tree is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || root.isMissingNode() || !"FileAST".equals(nodeType(root))) {
            throw new AstFormatException("Expected a FileAST root node, found: " + (root == null ? "nothing" : nodeType(root)));
        }

        List<CNode> ext = new ArrayList<>();
        for (JsonNode item : array(root, "ext")) {
            String kind = nodeType(item);
            switch (kind) {
                case "Decl" -> ext.add(readDecl(item));
                case "Typedef" -> ext.add(readTypedef(item));
                case "FuncDef", "Pragma", "StaticAssert" ->
                        log.debug("Skipping top-level {} at {}", kind, readCoord(item));
                default -> throw new AstFormatException("Unexpected top-level node " + kind + " at " + readCoord(item));
            }
        }
        log.debug("Read {} top-level declarations", ext.size());
        return new FileAst(List.copyOf(ext));
    }

    private CNode readDeclarator(JsonNode node) {
        String kind = nodeType(node);
        Coord coord = readCoord(node);
        return switch (kind) {
            case "Decl", "Typename" -> readDecl(node);
            case "Typedef" -> readTypedef(node);
            case "TypeDecl" -> new TypeDecl(text(node, "declname"), readDeclarator(required(node, "type")), coord);
            case "PtrDecl" -> new PtrDecl(readDeclarator(required(node, "type")), coord);
            case "ArrayDecl" -> new ArrayDecl(readDeclarator(required(node, "type")), readExpression(node.get("dim")), coord);
            case "FuncDecl" -> new FuncDecl(readParams(node.get("args")), readDeclarator(required(node, "type")), coord);
            case "IdentifierType" -> new IdentifierType(readNames(node), coord);
            case "Struct" -> new Struct(text(node, "name"), readFields(node), coord);
            case "Union" -> new Union(text(node, "name"), readFields(node), coord);
            case "Enum" -> new EnumSpec(text(node, "name"), readEnumerators(node.get("values")), coord);
            case "EllipsisParam" -> new EllipsisParam(coord);
            default -> throw new AstFormatException("Unsupported declarator node " + kind + " at " + coord);
        };
    }

    private Decl readDecl(JsonNode node) {
        return new Decl(text(node, "name"), readDeclarator(required(node, "type")), readCoord(node));
    }

    private Typedef readTypedef(JsonNode node) {
        return new Typedef(text(node, "name"), readDeclarator(required(node, "type")), readCoord(node));
    }

    private List<CNode> readParams(JsonNode args) {
        if (isAbsent(args)) {
            return List.of();
        }
        List<CNode> params = new ArrayList<>();
        for (JsonNode param : array(args, "params")) {
            params.add(readDeclarator(param));
        }
        return params;
    }

    private List<Decl> readFields(JsonNode node) {
        JsonNode decls = node.get("decls");
        if (isAbsent(decls)) {
            return null;
        }
        List<Decl> fields = new ArrayList<>();
        for (JsonNode field : decls) {
            if (!"Decl".equals(nodeType(field))) {
                log.debug("Skipping {} inside {} at {}", nodeType(field), nodeType(node), readCoord(field));
                continue;
            }
            fields.add(readDecl(field));
        }
        return fields;
    }

    private List<Enumerator> readEnumerators(JsonNode values) {
        if (isAbsent(values)) {
            return null;
        }
        List<Enumerator> enumerators = new ArrayList<>();
        for (JsonNode item : array(values, "enumerators")) {
            enumerators.add(new Enumerator(required(item, "name").asText(), readExpression(item.get("value"))));
        }
        return enumerators;
    }

    private CExpression readExpression(JsonNode node) {
        if (isAbsent(node)) {
            return null;
        }
        String kind = nodeType(node);
        return switch (kind) {
            case "Constant" -> new CExpression.Constant(text(node, "type"), required(node, "value").asText());
            case "ID" -> new CExpression.IdRef(required(node, "name").asText());
            default -> new CExpression.OpaqueExpr(kind);
        };
    }

    private static List<String> readNames(JsonNode node) {
        List<String> names = new ArrayList<>();
        for (JsonNode name : array(node, "names")) {
            names.add(name.asText());
        }
        return names;
    }

    static Coord readCoord(JsonNode node) {
        JsonNode coord = node.get("coord");
        if (isAbsent(coord)) {
            return null;
        }
        Matcher m = COORD.matcher(coord.asText());
        if (!m.matches()) {
            return new Coord(coord.asText(), 0, 0);
        }
        int column = m.group(3) != null ? Integer.parseInt(m.group(3)) : 0;
        return new Coord(m.group(1), Integer.parseInt(m.group(2)), column);
    }

    private static String nodeType(JsonNode node) {
        JsonNode type = node.get(NODE_TYPE);
        if (isAbsent(type)) {
            throw new AstFormatException("Node without " + NODE_TYPE + ": " + abbreviate(node));
        }
        return type.asText();
    }

    private static JsonNode required(JsonNode node, String member) {
        JsonNode value = node.get(member);
        if (isAbsent(value)) {
            throw new AstFormatException(nodeType(node) + " at " + readCoord(node) + " is missing '" + member + "'");
        }
        return value;
    }

    private static JsonNode array(JsonNode node, String member) {
        JsonNode value = required(node, member);
        if (!value.isArray()) {
            throw new AstFormatException(nodeType(node) + "." + member + " must be an array");
        }
        return value;
    }

    private static String text(JsonNode node, String member) {
        JsonNode value = node.get(member);
        return isAbsent(value) ? null : value.asText();
    }

    private static boolean isAbsent(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }

    private static String abbreviate(JsonNode node) {
        String text = node.toString();
        return text.length() > 80 ? text.substring(0, 80) + "..." : text;
    }
}
