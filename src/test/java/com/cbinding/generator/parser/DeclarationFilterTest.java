package com.cbinding.generator.parser;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.cbinding.generator.codegen.context.ToolDiagnostics;
import com.cbinding.generator.model.CNode;
import com.cbinding.generator.model.Decl;
import com.cbinding.generator.model.FileAst;
import com.cbinding.generator.model.Typedef;

import static com.cbinding.generator.model.CAst.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for DeclarationFilter.
 */
class DeclarationFilterTest {

    private static final String FAKE_LIBC = "/usr/share/fake_libc/_fake_typedefs.h";

    private final CNode sizeT = new Typedef("size_t", typeDecl("size_t", id("unsigned", "long")), coord(FAKE_LIBC, 1));
    private final CNode uint32 = new Typedef("uint32_t", typeDecl("uint32_t", id("unsigned", "int")), coord(FAKE_LIBC, 2));
    private final CNode widget = new Decl("widget_count", typeDecl("widget_count", id("int")), coord("widget.h", 4));
    private final CNode anonymous = new Decl(null, struct("gadget", var("x", "int")), coord("gadget.h", 7));

    private final FileAst ast = new FileAst(List.of(sizeT, uint32, widget, anonymous));

    @Test
    void testBuiltinIgnoresDropLibcTypedefs() {
        ToolDiagnostics diagnostics = new ToolDiagnostics();

        FileAst filtered = new DeclarationFilter(true, List.of()).apply(ast, diagnostics);

        assertThat(filtered.getExt()).containsExactly(widget, anonymous);
        assertThat(diagnostics.getInfos()).containsExactly("Dropped 2 built-in declaration(s)");
    }

    @Test
    void testBuiltinIgnoresCanBeDisabled() {
        FileAst filtered = new DeclarationFilter(false, null).apply(ast, new ToolDiagnostics());

        assertThat(filtered.getExt()).containsExactly(sizeT, uint32, widget, anonymous);
    }

    @Test
    void testWhitelistKeepsOnlyListedFiles() {
        ToolDiagnostics diagnostics = new ToolDiagnostics();

        FileAst filtered = new DeclarationFilter(true, List.of("widget.h")).apply(ast, diagnostics);

        assertThat(filtered.getExt()).containsExactly(widget);
        assertThat(diagnostics.getInfos()).contains("Dropped 1 declaration(s) outside the whitelist");
        assertThat(diagnostics.hasWarnings()).isFalse();
    }

    @Test
    void testWhitelistWithoutMatchesWarns() {
        ToolDiagnostics diagnostics = new ToolDiagnostics();

        FileAst filtered = new DeclarationFilter(true, List.of("other.h")).apply(ast, diagnostics);

        assertThat(filtered.getExt()).isEmpty();
        assertThat(diagnostics.getWarnings()).hasSize(1);
    }

    @Test
    void testBuiltinListCoversStdintNames() {
        assertThat(DeclarationFilter.BUILTIN_IGNORES).contains("uint8_t", "uintmax_t", "FILE", "va_list", "pthread_t");
    }
}
