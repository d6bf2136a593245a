package com.cbinding.generator.parser;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;

import com.cbinding.generator.model.ArrayDecl;
import com.cbinding.generator.model.CExpression;
import com.cbinding.generator.model.Decl;
import com.cbinding.generator.model.EllipsisParam;
import com.cbinding.generator.model.EnumSpec;
import com.cbinding.generator.model.FileAst;
import com.cbinding.generator.model.FuncDecl;
import com.cbinding.generator.model.PtrDecl;
import com.cbinding.generator.model.Struct;
import com.cbinding.generator.model.TypeDecl;
import com.cbinding.generator.model.Typedef;
import com.cbinding.generator.parser.exception.AstFormatException;

import static com.cbinding.generator.model.CAst.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for CAstJsonReader.
 */
class CAstJsonReaderTest {

    private final CAstJsonReader reader = new CAstJsonReader();

    @Test
    void testReadSimpleDeclaration() {
        FileAst ast = reader.read("""
                {"_nodetype": "FileAST", "coord": null, "ext": [
                  {"_nodetype": "Decl", "name": "count", "quals": [], "storage": ["extern"],
                   "coord": "demo.h:3:12", "init": null, "bitsize": null,
                   "type": {"_nodetype": "TypeDecl", "declname": "count", "quals": [], "coord": "demo.h:3:12",
                            "type": {"_nodetype": "IdentifierType", "names": ["unsigned", "long"], "coord": "demo.h:3:8"}}}
                ]}
                """);

        assertThat(ast.getExt()).containsExactly(var("count", "unsigned", "long"));
        Decl decl = (Decl) ast.getExt().get(0);
        assertThat(decl.getCoord().getFile()).isEqualTo("demo.h");
        assertThat(decl.getCoord().getLine()).isEqualTo(3);
        assertThat(decl.getCoord().getColumn()).isEqualTo(12);
    }

    @Test
    void testReadFunctionWithParameters() {
        FileAst ast = reader.read("""
                {"_nodetype": "FileAST", "ext": [
                  {"_nodetype": "Decl", "name": "log", "coord": "demo.h:5",
                   "type": {"_nodetype": "FuncDecl", "coord": "demo.h:5",
                     "args": {"_nodetype": "ParamList", "params": [
                        {"_nodetype": "Typename", "name": null, "quals": [],
                         "type": {"_nodetype": "PtrDecl", "quals": [],
                                  "type": {"_nodetype": "TypeDecl", "declname": null,
                                           "type": {"_nodetype": "IdentifierType", "names": ["char"]}}}},
                        {"_nodetype": "EllipsisParam", "coord": "demo.h:5"}
                     ]},
                     "type": {"_nodetype": "TypeDecl", "declname": "log",
                              "type": {"_nodetype": "IdentifierType", "names": ["void"]}}}}
                ]}
                """);

        Decl decl = (Decl) ast.getExt().get(0);
        FuncDecl func = (FuncDecl) decl.getType();
        assertThat(func.getParams()).hasSize(2);
        assertThat(func.getParams().get(0)).isEqualTo(decl(null, ptr(typeDecl(null, id("char")))));
        assertThat(func.getParams().get(1)).isInstanceOf(EllipsisParam.class);
        assertThat(decl.getCoord().getColumn()).isZero();
    }

    @Test
    void testReadAggregatesAndEnums() {
        FileAst ast = reader.read("""
                {"_nodetype": "FileAST", "ext": [
                  {"_nodetype": "Typedef", "name": "node_t", "coord": "demo.h:1:1",
                   "type": {"_nodetype": "TypeDecl", "declname": "node_t",
                            "type": {"_nodetype": "Struct", "name": "node", "decls": [
                              {"_nodetype": "Decl", "name": "next",
                               "type": {"_nodetype": "PtrDecl",
                                        "type": {"_nodetype": "TypeDecl", "declname": "next",
                                                 "type": {"_nodetype": "Struct", "name": "node", "decls": null}}}},
                              {"_nodetype": "Decl", "name": "tags", "bitsize": null,
                               "type": {"_nodetype": "ArrayDecl", "dim": {"_nodetype": "ID", "name": "N"},
                                        "type": {"_nodetype": "TypeDecl", "declname": "tags",
                                                 "type": {"_nodetype": "IdentifierType", "names": ["int"]}}}}
                            ]}}},
                  {"_nodetype": "Decl", "name": null,
                   "type": {"_nodetype": "Enum", "name": "mode", "values": {"_nodetype": "EnumeratorList", "enumerators": [
                     {"_nodetype": "Enumerator", "name": "OFF", "value": null},
                     {"_nodetype": "Enumerator", "name": "ON", "value": {"_nodetype": "Constant", "type": "int", "value": "0x1"}},
                     {"_nodetype": "Enumerator", "name": "AUTO", "value": {"_nodetype": "BinaryOp", "op": "+"}}
                   ]}}}
                ]}
                """);

        Typedef typedef = (Typedef) ast.getExt().get(0);
        Struct node = (Struct) ((TypeDecl) typedef.getType()).getType();
        assertThat(node.getName()).isEqualTo("node");
        assertThat(node.getDecls()).hasSize(2);
        PtrDecl next = (PtrDecl) node.getDecls().get(0).getType();
        assertThat(((Struct) ((TypeDecl) next.getType()).getType()).getDecls()).isNull();
        ArrayDecl tags = (ArrayDecl) node.getDecls().get(1).getType();
        assertThat(tags.getDim()).isEqualTo(new CExpression.IdRef("N"));

        EnumSpec mode = (EnumSpec) ((Decl) ast.getExt().get(1)).getType();
        assertThat(mode.getValues()).extracting("name").containsExactly("OFF", "ON", "AUTO");
        assertThat(mode.getValues().get(0).getValue()).isNull();
        assertThat(mode.getValues().get(1).getValue()).isEqualTo(new CExpression.Constant("int", "0x1"));
        assertThat(mode.getValues().get(2).getValue()).isEqualTo(new CExpression.OpaqueExpr("BinaryOp"));
    }

    @Test
    void testFunctionDefinitionsAreSkipped() {
        FileAst ast = reader.read("""
                {"_nodetype": "FileAST", "ext": [
                  {"_nodetype": "FuncDef", "coord": "demo.c:9", "decl": {}, "body": {}}
                ]}
                """);

        assertThat(ast.getExt()).isEmpty();
    }

    @Test
    void testInvalidJsonIsRejected() {
        assertThatThrownBy(() -> reader.read("{ not json"))
                .isInstanceOf(AstFormatException.class)
                .hasMessageContaining("not valid JSON");
    }

    @Test
    void testWrongRootIsRejected() {
        assertThatThrownBy(() -> reader.read("{\"_nodetype\": \"Decl\"}"))
                .isInstanceOf(AstFormatException.class)
                .hasMessageContaining("FileAST");
    }

    @Test
    void testUnknownDeclaratorIsRejected() {
        assertThatThrownBy(() -> reader.read("""
                {"_nodetype": "FileAST", "ext": [
                  {"_nodetype": "Decl", "name": "x", "type": {"_nodetype": "Mystery"}}
                ]}
                """))
                .isInstanceOf(AstFormatException.class)
                .hasMessageContaining("Mystery");
    }

    @Test
    void testMissingMemberIsRejected() {
        assertThatThrownBy(() -> reader.read("""
                {"_nodetype": "FileAST", "ext": [
                  {"_nodetype": "Decl", "name": "x", "coord": "demo.h:2"}
                ]}
                """))
                .isInstanceOf(AstFormatException.class)
                .hasMessageContaining("missing 'type'");
    }

    @Test
    void testReadFixtureFile() throws IOException, URISyntaxException {
        Path fixture = Path.of(getClass().getResource("/fixtures/sample.h.json").toURI());

        FileAst ast = reader.read(fixture);

        assertThat(ast.getExt()).hasSize(8);
        assertThat(ast.getExt().get(0).getCoord().getFile()).isEqualTo("/usr/share/fake_libc/_fake_typedefs.h");
        assertThat(ast.getExt()).extracting(node -> node.getDeclaredName())
                .containsExactly("uint32_t", null, "item_t", "visit_fn", null, null, "registry_add", "registry_clear");
    }
}
