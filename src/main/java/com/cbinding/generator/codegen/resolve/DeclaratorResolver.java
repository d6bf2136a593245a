package com.cbinding.generator.codegen.resolve;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.function.BiFunction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cbinding.generator.codegen.ConstantTable;
import com.cbinding.generator.codegen.exception.DeclaratorShapeException;
import com.cbinding.generator.codegen.model.AggregateBlock;
import com.cbinding.generator.codegen.model.AggregateKind;
import com.cbinding.generator.codegen.model.Array;
import com.cbinding.generator.codegen.model.ArrayDimension;
import com.cbinding.generator.codegen.model.DeclarationStatement;
import com.cbinding.generator.codegen.model.Declarator;
import com.cbinding.generator.codegen.model.EnumBlock;
import com.cbinding.generator.codegen.model.FunctionSignature;
import com.cbinding.generator.codegen.model.NamedType;
import com.cbinding.generator.codegen.model.Pointer;
import com.cbinding.generator.codegen.model.PxdNode;
import com.cbinding.generator.codegen.model.TypeAlias;
import com.cbinding.generator.codegen.naming.NamingContext;
import com.cbinding.generator.codegen.util.IntegerLiteralParser;
import com.cbinding.generator.codegen.util.StdintImportManager;
import com.cbinding.generator.model.AggregateSpec;
import com.cbinding.generator.model.ArrayDecl;
import com.cbinding.generator.model.CExpression;
import com.cbinding.generator.model.CNode;
import com.cbinding.generator.model.CNodeVisitor;
import com.cbinding.generator.model.Decl;
import com.cbinding.generator.model.EllipsisParam;
import com.cbinding.generator.model.EnumSpec;
import com.cbinding.generator.model.FuncDecl;
import com.cbinding.generator.model.IdentifierType;
import com.cbinding.generator.model.PtrDecl;
import com.cbinding.generator.model.Struct;
import com.cbinding.generator.model.TypeDecl;
import com.cbinding.generator.model.Typedef;
import com.cbinding.generator.model.Union;

/**
 * Walks the declarator chain of each declaration and rebuilds it as .pxd nodes.
 *
 * C nests declarators inside out ({@code int (*f)(void)} is a declaration of a pointer
 * to a function returning int); the walk composes the result bottom-up:
 * <ul>
 *   <li>type declarators turn base type text into a named declaration,</li>
 *   <li>pointers and arrays wrap what their inner declarator produced,</li>
 *   <li>function pointers outside a typedef are hoisted to a {@code ctypedef} alias,</li>
 *   <li>struct/union/enum bodies are hoisted to the top level and referenced by name.</li>
 * </ul>
 *
 * An empty result means the node produced nothing at its call site (for example a
 * struct body that was hoisted while no declarator refers to it).
 *
 * Not thread-safe: one instance per translation run.
 */
public class DeclaratorResolver implements CNodeVisitor<Optional<Resolution>, Enclosing> {

    private static final Logger log = LoggerFactory.getLogger(DeclaratorResolver.class);

    private final NamingContext naming;
    private final ConstantTable constants;
    private final StdintImportManager stdintImports;
    private final TopLevelAccumulator topLevel;

    public DeclaratorResolver(NamingContext naming, ConstantTable constants,
                              StdintImportManager stdintImports, TopLevelAccumulator topLevel) {
        this.naming = naming;
        this.constants = constants;
        this.stdintImports = stdintImports;
        this.topLevel = topLevel;
    }

    /**
     * Resolves one top-level declaration; whatever it produces, hoisted types first,
     * is appended to the top-level accumulator.
     */
    public void resolveTopLevel(CNode declaration) {
        resolve(declaration, Enclosing.NONE)
                .ifPresent(resolution -> topLevel.add(resolution.named(null)));
    }

    private Optional<Resolution> resolve(CNode node, Enclosing enclosing) {
        naming.enter(node.getDeclaredName());
        try {
            return node.accept(this, enclosing);
        } finally {
            naming.exit();
        }
    }

    private Resolution resolveSingle(CNode node, Enclosing enclosing, String role) {
        if (node == null) {
            throw new DeclaratorShapeException("Missing " + role + " declarator");
        }
        return resolve(node, enclosing).orElseThrow(() -> new DeclaratorShapeException(
                "Expected exactly one result for the " + role + " declarator, got none: " + node));
    }

    // ---- declarations ----

    @Override
    public Optional<Resolution> visit(Decl decl, Enclosing enclosing) {
        return resolve(decl.getType(), Enclosing.DECLARATION)
                .map(inner -> new Resolution.Shaped(inner.named(decl.getName())));
    }

    @Override
    public Optional<Resolution> visit(Typedef typedef, Enclosing enclosing) {
        Optional<Resolution> inner = resolve(typedef.getType(), Enclosing.TYPEDEF);
        if (inner.isEmpty()) {
            // anonymous aggregate: the ctypedef block already carries this name
            return Optional.empty();
        }
        Declarator alias = inner.get().named(typedef.getName());
        if (alias.isSelfAlias()) {
            log.debug("Dropping self-referential typedef {}", typedef.getName());
            return Optional.empty();
        }
        topLevel.add(new TypeAlias(alias));
        return Optional.empty();
    }

    // ---- declarators ----

    @Override
    public Optional<Resolution> visit(TypeDecl typeDecl, Enclosing enclosing) {
        Enclosing inner = enclosing == Enclosing.TYPEDEF ? Enclosing.TYPEDEF_TARGET : Enclosing.TYPE_DECL;
        return resolve(typeDecl.getType(), inner)
                .map(resolution -> new Resolution.Shaped(resolution.named(typeDecl.getDeclname())));
    }

    @Override
    public Optional<Resolution> visit(PtrDecl ptrDecl, Enclosing enclosing) {
        Enclosing inner = enclosing == Enclosing.TYPEDEF ? Enclosing.TYPEDEF_POINTER : Enclosing.POINTER;
        Resolution target = resolveSingle(ptrDecl.getType(), inner, "pointer target");
        if (inner == Enclosing.POINTER && ptrDecl.getType().isFunctionDeclarator()) {
            // the hoisted function-pointer alias already is the pointer type
            return Optional.of(target);
        }
        return Optional.of(target.pointer());
    }

    @Override
    public Optional<Resolution> visit(ArrayDecl arrayDecl, Enclosing enclosing) {
        List<ArrayDimension> dimensions = new ArrayList<>();
        CNode element = arrayDecl;
        while (element instanceof ArrayDecl array) {
            dimensions.add(dimensionOf(array.getDim()));
            element = array.getType();
        }
        Resolution resolved = resolveSingle(element, Enclosing.ARRAY, "array element");
        return Optional.of(new Resolution.Shaped(new Array(resolved.named(null), dimensions)));
    }

    private ArrayDimension dimensionOf(CExpression dim) {
        if (dim == null) {
            return ArrayDimension.unknown();
        }
        OptionalLong value = OptionalLong.empty();
        if (dim instanceof CExpression.Constant constant) {
            value = IntegerLiteralParser.parse(constant.value());
        } else if (dim instanceof CExpression.IdRef ref) {
            value = constants.lookup(ref.name());
        }
        if (value.isEmpty() || value.getAsLong() < 0) {
            log.debug("Array dimension {} cannot be resolved, leaving it empty", dim);
            return ArrayDimension.unknown();
        }
        return ArrayDimension.of(value.getAsLong());
    }

    @Override
    public Optional<Resolution> visit(FuncDecl funcDecl, Enclosing enclosing) {
        List<Declarator> params = new ArrayList<>();
        for (CNode param : funcDecl.getParams()) {
            params.add(resolveSingle(param, Enclosing.FUNCTION, "parameter").named(null));
        }
        if (params.size() == 1 && "void".equals(params.get(0).getTypeText())) {
            params = List.of();
        }

        Declarator returns = resolveSingle(funcDecl.getType(), Enclosing.FUNCTION, "return type").named(null);

        if (enclosing == Enclosing.POINTER) {
            String alias = naming.currentPathName(NamingContext.FUNCTION_TYPE_TAG);
            log.debug("Hoisting function pointer type {}", alias);
            topLevel.add(new TypeAlias(new Pointer(new FunctionSignature(returns.getTypeText(), alias, params))));
            return Optional.of(new Resolution.Bare(alias));
        }
        return Optional.of(new Resolution.Shaped(
                new FunctionSignature(returns.getTypeText(), returns.getName(), params)));
    }

    @Override
    public Optional<Resolution> visit(EllipsisParam ellipsisParam, Enclosing enclosing) {
        return Optional.of(new Resolution.Shaped(new NamedType(null, "...")));
    }

    // ---- base types ----

    @Override
    public Optional<Resolution> visit(IdentifierType identifierType, Enclosing enclosing) {
        stdintImports.addImports(identifierType.getNames());
        return Optional.of(new Resolution.Bare(identifierType.getTypeText()));
    }

    @Override
    public Optional<Resolution> visit(Struct struct, Enclosing enclosing) {
        return resolveAggregate(struct, AggregateKind.STRUCT, enclosing);
    }

    @Override
    public Optional<Resolution> visit(Union union, Enclosing enclosing) {
        return resolveAggregate(union, AggregateKind.UNION, enclosing);
    }

    @Override
    public Optional<Resolution> visit(EnumSpec enumSpec, Enclosing enclosing) {
        return hoist(enumSpec.getName(), enumSpec.hasBody(), NamingContext.ENUM_TAG, true, enclosing,
                (name, statement) -> new EnumBlock(name, constants.recordEnumerators(enumSpec.getValues()), statement));
    }

    private Optional<Resolution> resolveAggregate(AggregateSpec spec, AggregateKind kind, Enclosing enclosing) {
        return hoist(spec.getName(), spec.hasBody(), kind.getTag(), false, enclosing,
                (name, statement) -> new AggregateBlock(name, kind, resolveFields(spec), statement));
    }

    private List<PxdNode> resolveFields(AggregateSpec spec) {
        List<PxdNode> fields = new ArrayList<>();
        for (Decl field : spec.getDecls()) {
            resolve(field, Enclosing.DECLARATION).ifPresent(resolution -> fields.add(resolution.named(null)));
        }
        return fields;
    }

    /**
     * Shared struct/union/enum policy. A bodied type is appended to the top level
     * under its own or a synthesized name; wherever a type declarator refers to it,
     * that name is left at the call site. The anonymous target of a typedef becomes
     * the {@code ctypedef} block itself and leaves nothing behind.
     * <p>
     * An anonymous body declared on its own at file scope has no path to name it
     * after. It is emitted without a name when {@code namelessAllowed} (enums, whose
     * constants are still wanted) and dropped otherwise.
     */
    private Optional<Resolution> hoist(String ownName, boolean hasBody, String tag, boolean namelessAllowed,
                                       Enclosing enclosing,
                                       BiFunction<String, DeclarationStatement, PxdNode> blockFactory) {
        boolean typedefTarget = enclosing == Enclosing.TYPEDEF_TARGET;
        if (hasBody && ownName == null && !typedefTarget && !enclosing.isTypeDecl()
                && naming.currentPathName().isEmpty()) {
            if (namelessAllowed) {
                topLevel.add(blockFactory.apply(null, DeclarationStatement.CDEF));
            } else {
                log.debug("Dropping anonymous {} body declared without a declarator", tag);
            }
            return Optional.empty();
        }
        String name;
        if (ownName != null) {
            name = ownName;
        } else if (typedefTarget) {
            name = naming.currentPathName();
        } else {
            name = naming.currentPathName(tag);
        }

        if (!hasBody) {
            return enclosing.isTypeDecl() ? Optional.of(new Resolution.Bare(name)) : Optional.empty();
        }

        if (typedefTarget && ownName == null) {
            topLevel.add(blockFactory.apply(name, DeclarationStatement.CTYPEDEF));
            return Optional.empty();
        }
        topLevel.add(blockFactory.apply(name, DeclarationStatement.CDEF));
        return enclosing.isTypeDecl() ? Optional.of(new Resolution.Bare(name)) : Optional.empty();
    }
}
