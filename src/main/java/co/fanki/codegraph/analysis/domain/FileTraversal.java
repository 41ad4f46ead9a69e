package co.fanki.codegraph.analysis.domain;

import co.fanki.codegraph.graph.domain.EdgeType;
import co.fanki.codegraph.graph.domain.GraphNode;
import co.fanki.codegraph.graph.domain.NodeType;
import co.fanki.codegraph.graph.domain.ScopeContext;
import co.fanki.codegraph.graph.domain.nodes.CallNode;
import co.fanki.codegraph.graph.domain.nodes.ClassNode;
import co.fanki.codegraph.graph.domain.nodes.FunctionNode;
import co.fanki.codegraph.graph.domain.nodes.ImportNode;
import co.fanki.codegraph.graph.domain.nodes.NodeFactory;
import co.fanki.codegraph.graph.domain.nodes.ParameterNode;
import co.fanki.codegraph.graph.domain.nodes.VariableNode;

import org.treesitter.TSNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One forward pass over the syntax tree of a file.
 *
 * <p>Instances are single use and not thread safe. Nodes are created on
 * entry to the construct that declares them; function nodes are replaced
 * on exit once their control flow is known.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
final class FileTraversal {

    private static final Set<String> LOGICAL_OPERATORS = Set.of(
            "&&", "||", "??");

    private static final int MAX_CALLEE_LENGTH = 64;

    /** A pending owner for a value node that has not been visited yet. */
    private record ValueOwner(String ownerId, EdgeType edgeType,
            Map<String, Object> metadata) {
    }

    /** Counter key for repeated names in one scope. */
    private record ScopeKey(NodeType type, ScopeContext scope, String name) {
    }

    private record ClassScope(String id, String name) {
    }

    private record ParameterSpec(String name, TSNode node, boolean rest,
            boolean hasDefault) {
    }

    private final String file;
    private final SourceText text;
    private final ImportResolver resolver;

    private final Deque<FunctionFrame> frames = new ArrayDeque<>();
    private final Deque<ScopeContext> scopes = new ArrayDeque<>();
    private final Deque<ClassScope> classes = new ArrayDeque<>();
    private final Map<ScopeKey, Integer> discriminators = new HashMap<>();
    private final Map<String, FunctionFrame.PromiseExecutor> executors =
            new HashMap<>();
    private final Map<String, ValueOwner> valueOwners = new HashMap<>();
    private final Set<String> thrownConstructions = new HashSet<>();

    private final Map<String, ContainedNode> nodes = new LinkedHashMap<>();
    private final List<ClassDeclarationInfo> classDeclarations =
            new ArrayList<>();
    private final List<CallSiteInfo> callSites = new ArrayList<>();
    private final List<ConstructorCallInfo> constructorCalls =
            new ArrayList<>();
    private final List<ImportInfo> imports = new ArrayList<>();
    private final List<RejectionPattern> rejectionPatterns = new ArrayList<>();
    private final List<ThrowPattern> throwPatterns = new ArrayList<>();
    private final List<PromiseResolutionInfo> promiseResolutions =
            new ArrayList<>();
    private final List<CatchesFromInfo> catchesFrom = new ArrayList<>();
    private final List<ValueBinding> valueBindings = new ArrayList<>();

    private GraphNode module;

    FileTraversal(final SourceFile source, final ImportResolver theResolver) {
        file = source.path();
        text = new SourceText(source.content());
        resolver = theResolver;
    }

    ModuleCollections run(final TSNode root, final int lineCount) {
        module = NodeFactory.createModule(file, lineCount);
        frames.push(FunctionFrame.module(module.id()));
        scopes.push(ScopeContext.global(file));
        visitChildren(root);
        return new ModuleCollections(file, module,
                new ArrayList<>(nodes.values()), classDeclarations, callSites,
                constructorCalls, imports, rejectionPatterns, throwPatterns,
                promiseResolutions, catchesFrom, valueBindings);
    }

    private void visit(final TSNode node) {
        final SyntaxKind kind = SyntaxKind.of(node.getType());
        final boolean descend = switch (kind) {
            case FUNCTION_DECLARATION, FUNCTION_EXPRESSION, ARROW_FUNCTION,
                    METHOD_DEFINITION -> visitFunction(node, kind);
            case CLASS -> visitClass(node);
            case CALL_EXPRESSION -> visitCall(node);
            case NEW_EXPRESSION -> visitNew(node);
            case THROW_STATEMENT -> visitThrow(node);
            case TRY_STATEMENT -> visitTry(node);
            case IF_STATEMENT -> visitIf(node);
            case SWITCH_STATEMENT -> visitSwitch(node);
            case SWITCH_CASE -> {
                frame().switchCase();
                yield true;
            }
            case TERNARY_EXPRESSION -> {
                frame().branch();
                yield true;
            }
            case BINARY_EXPRESSION -> visitBinary(node);
            case LOOP -> visitLoop(node);
            case RETURN_STATEMENT -> visitReturn(node);
            case VARIABLE_DECLARATION -> visitDeclaration(node);
            case ASSIGNMENT_EXPRESSION -> visitAssignment(node);
            case IMPORT_STATEMENT -> visitImport(node);
            case OBJECT -> visitObject(node);
            case ARRAY -> visitArray(node);
            case LITERAL -> visitLiteral(node, false);
            case TEMPLATE_STRING -> visitLiteral(node, true);
            case IDENTIFIER, WRAPPER, OTHER -> true;
        };
        if (descend) {
            visitChildren(node);
        }
    }

    private void visitChildren(final TSNode node) {
        final int count = node.getNamedChildCount();
        for (int i = 0; i < count; i++) {
            visit(node.getNamedChild(i));
        }
    }

    // -- declarations --

    private boolean visitFunction(final TSNode node, final SyntaxKind kind) {
        final FunctionFrame outer = frame();
        final ScopeContext scope = scopes.peek();
        final boolean method = kind == SyntaxKind.METHOD_DEFINITION
                && "class_body".equals(typeOf(node.getParent()));
        final boolean classMember = method || isClassField(node.getParent());
        final ClassScope owningClass = classMember ? classes.peek() : null;

        final String declaredName = functionName(node);
        final String name = declaredName == null ? "anonymous" : declaredName;
        final int discriminator = discriminator(NodeType.FUNCTION, scope, name);
        final List<ParameterSpec> parameters = parameters(node);
        final List<String> parameterNames = new ArrayList<>();
        parameters.forEach(p -> parameterNames.add(p.name()));

        final boolean async = hasToken(node, "async");
        final Position position = Position.of(node);
        final GraphNode function = NodeFactory.createFunctionWithContext(name,
                scope, position.line(), position.column(),
                new FunctionNode.Options(async,
                        hasToken(node, "*")
                                || node.getType().startsWith("generator"),
                        kind == SyntaxKind.ARROW_FUNCTION, method,
                        owningClass == null ? null : owningClass.name(),
                        parameterNames, discriminator));
        final String parentId = owningClass == null
                ? outer.ownerId() : owningClass.id();
        contain(function, parentId);
        bindOwner(node, function.id());

        final String thisClass;
        if (owningClass != null) {
            thisClass = owningClass.name();
        } else if (kind == SyntaxKind.ARROW_FUNCTION) {
            thisClass = outer.thisClassName();
        } else {
            thisClass = null;
        }
        final TSNode body = field(node, "body");
        final FunctionFrame frame = new FunctionFrame(function.id(),
                function.id(), async, thisClass,
                body == null ? null : key(body), executors.get(key(node)));
        final ScopeContext inner = scope.enter(discriminator == 0
                ? name : name + "[" + discriminator + "]");

        for (int i = 0; i < parameters.size(); i++) {
            final ParameterSpec spec = parameters.get(i);
            final Position at = Position.of(spec.node());
            contain(NodeFactory.createParameterWithContext(spec.name(), inner,
                    at.line(), at.column(), new ParameterNode.Options(i,
                            spec.rest(), spec.hasDefault())), function.id());
            frame.bindings().put(spec.name(), AliasBinding.PARAMETER);
        }

        frames.push(frame);
        scopes.push(inner);
        if (body != null) {
            visit(body);
        }
        scopes.pop();
        frames.pop();

        nodes.put(function.id(), new ContainedNode(
                function.withControlFlow(frame.controlFlow()), parentId));
        return false;
    }

    private boolean visitClass(final TSNode node) {
        final FunctionFrame frame = frame();
        final ScopeContext scope = scopes.peek();
        final TSNode nameNode = field(node, "name");
        String name = nameNode == null ? null : text.of(nameNode);
        if (name == null) {
            name = bindingNameOf(node.getParent());
        }
        if (name == null) {
            name = "AnonymousClass";
        }
        final String superClass = superClassOf(node);
        final int discriminator = discriminator(NodeType.CLASS, scope, name);
        final Position position = Position.of(node);
        final GraphNode classNode = NodeFactory.createClassWithContext(name,
                scope, position.line(), position.column(),
                new ClassNode.Options(superClass,
                        "export_statement".equals(typeOf(node.getParent())),
                        discriminator));
        contain(classNode, frame.ownerId());
        bindOwner(node, classNode.id());
        classDeclarations.add(new ClassDeclarationInfo(classNode.id(), name,
                superClass));

        final TSNode body = field(node, "body");
        if (body != null) {
            classes.push(new ClassScope(classNode.id(), name));
            scopes.push(scope.enter(discriminator == 0
                    ? name : name + "[" + discriminator + "]"));
            visit(body);
            scopes.pop();
            classes.pop();
        }
        return false;
    }

    private boolean visitDeclaration(final TSNode node) {
        final FunctionFrame frame = frame();
        final String keyword = node.getChildCount() > 0
                ? node.getChild(0).getType() : "var";
        final int count = node.getNamedChildCount();
        for (int i = 0; i < count; i++) {
            final TSNode declarator = node.getNamedChild(i);
            if (!"variable_declarator".equals(declarator.getType())) {
                continue;
            }
            final TSNode nameNode = field(declarator, "name");
            if (nameNode == null || !"identifier".equals(nameNode.getType())) {
                continue;
            }
            final String name = text.of(nameNode);
            final TSNode value = unwrap(field(declarator, "value"), true);
            frame.bindings().put(name, classify(value));
            if (value != null) {
                final SyntaxKind valueKind = SyntaxKind.of(value.getType());
                if (valueKind.isFunction() || valueKind == SyntaxKind.CLASS) {
                    continue;
                }
            }
            final ScopeContext scope = scopes.peek();
            final Position position = Position.of(nameNode);
            final GraphNode variable = NodeFactory.createVariableWithContext(
                    name, scope, position.line(), position.column(),
                    new VariableNode.Options(keyword,
                            discriminator(NodeType.VARIABLE, scope, name)));
            contain(variable, frame.ownerId());
            if (value != null) {
                valueOwners.put(key(value), new ValueOwner(variable.id(),
                        EdgeType.ASSIGNED_FROM, Map.of()));
            }
        }
        return true;
    }

    private boolean visitAssignment(final TSNode node) {
        final TSNode left = field(node, "left");
        if (left == null || !"identifier".equals(left.getType())) {
            return true;
        }
        final String name = text.of(left);
        final AliasBinding binding = classify(unwrap(field(node, "right"),
                true));
        for (FunctionFrame frame : frames) {
            if (frame.bindings().containsKey(name)) {
                frame.bindings().put(name, binding);
                return true;
            }
        }
        frame().bindings().put(name, binding);
        return true;
    }

    private boolean visitImport(final TSNode node) {
        final TSNode sourceNode = field(node, "source");
        if (sourceNode == null) {
            return false;
        }
        final String specifier = unquote(text.of(sourceNode));
        final String resolved = resolver.resolve(file, specifier);
        final int count = node.getNamedChildCount();
        for (int i = 0; i < count; i++) {
            final TSNode clause = node.getNamedChild(i);
            if (!"import_clause".equals(clause.getType())) {
                continue;
            }
            final int clauseCount = clause.getNamedChildCount();
            for (int j = 0; j < clauseCount; j++) {
                final TSNode part = clause.getNamedChild(j);
                switch (part.getType()) {
                    case "identifier" -> addImport(part, text.of(part),
                            "default", specifier, resolved);
                    case "namespace_import" -> {
                        final TSNode alias = firstNamedChild(part);
                        if (alias != null) {
                            addImport(part, text.of(alias), "*", specifier,
                                    resolved);
                        }
                    }
                    case "named_imports" -> {
                        final int specCount = part.getNamedChildCount();
                        for (int k = 0; k < specCount; k++) {
                            final TSNode spec = part.getNamedChild(k);
                            final TSNode imported = field(spec, "name");
                            if (imported == null) {
                                continue;
                            }
                            final TSNode alias = field(spec, "alias");
                            addImport(spec, text.of(alias == null
                                    ? imported : alias), text.of(imported),
                                    specifier, resolved);
                        }
                    }
                    default -> {
                    }
                }
            }
        }
        return false;
    }

    private void addImport(final TSNode node, final String localName,
            final String importedName, final String specifier,
            final String resolved) {
        final Position position = Position.of(node);
        final GraphNode importNode = NodeFactory.createImportWithContext(
                localName, ScopeContext.global(file), position.line(),
                position.column(), new ImportNode.Options(specifier,
                        importedName, resolved));
        contain(importNode, module.id());
        imports.add(new ImportInfo(importNode.id(), localName, importedName,
                specifier, resolved));
        frame().bindings().put(localName, AliasBinding.OPAQUE);
    }

    // -- calls --

    private boolean visitCall(final TSNode node) {
        final FunctionFrame frame = frame();
        final TSNode callee = field(node, "function");
        final TSNode arguments = field(node, "arguments");
        String objectName = null;
        String methodName = null;
        final String calleeName;
        if (callee != null && "member_expression".equals(callee.getType())) {
            objectName = abbreviate(text.of(field(callee, "object")));
            methodName = text.of(field(callee, "property"));
            calleeName = objectName + "." + methodName;
        } else {
            final String written = abbreviate(text.of(callee));
            calleeName = written.isBlank() ? "<call>" : written;
        }
        final boolean awaited = isAwaited(node);
        final boolean insideTry = frame.insideTry();
        final Position position = Position.of(node);
        final GraphNode call = NodeFactory.createCall(calleeName, file,
                position.line(), position.column(), new CallNode.Options(
                        objectName, methodName, awaited, insideTry,
                        countArguments(arguments)));
        contain(call, frame.ownerId());
        bindOwner(node, call.id());
        callSites.add(new CallSiteInfo(call.id(), calleeName, objectName,
                methodName, awaited, insideTry, scopeOwnerIds(),
                frame.thisClassName()));
        registerArguments(arguments, call.id());
        addCatchSource(call.id(), awaited
                ? CatchSourceType.AWAITED_CALL : CatchSourceType.SYNC_CALL,
                position.line());

        final TSNode firstArgument = firstNamedChild(arguments);
        if ("Promise".equals(objectName) && "reject".equals(methodName)) {
            recordStaticReject(firstArgument, position);
        } else if (callee != null && "identifier".equals(callee.getType())) {
            recordExecutorCall(calleeName, call.id(), firstArgument, position);
        }
        return true;
    }

    private boolean visitNew(final TSNode node) {
        final FunctionFrame frame = frame();
        final String className = constructorName(node);
        final TSNode arguments = field(node, "arguments");
        final Position position = Position.of(node);
        final GraphNode construction = NodeFactory.createConstructorCall(
                className, file, position.line(), position.column(),
                countArguments(arguments));
        contain(construction, frame.ownerId());
        bindOwner(node, construction.id());
        constructorCalls.add(new ConstructorCallInfo(construction.id(),
                className));
        registerArguments(arguments, construction.id());

        if ("Promise".equals(className)) {
            final TSNode executor = unwrap(firstNamedChild(arguments), false);
            if (executor != null && SyntaxKind.of(executor.getType())
                    .isFunction()) {
                final List<ParameterSpec> params = parameters(executor);
                executors.put(key(executor), new FunctionFrame.PromiseExecutor(
                        params.isEmpty() ? null : params.get(0).name(),
                        params.size() < 2 ? null : params.get(1).name(),
                        construction.id(), frame.functionId()));
            }
        }
        if (!thrownConstructions.remove(key(node))) {
            addCatchSource(construction.id(), CatchSourceType.CONSTRUCTOR_CALL,
                    position.line());
        }
        return true;
    }

    private void recordStaticReject(final TSNode argument,
            final Position position) {
        final FunctionFrame frame = frame();
        if (frame.isModule()) {
            return;
        }
        frame.rejects();
        addRejection(frame.functionId(),
                errorOrigin(argument, RejectionType.STATIC_REJECT), position);
    }

    private void recordExecutorCall(final String name, final String callId,
            final TSNode argument, final Position position) {
        for (FunctionFrame frame : frames) {
            final FunctionFrame.PromiseExecutor executor = frame.executor();
            if (executor != null) {
                final boolean reject = name.equals(executor.rejectName());
                if (reject || name.equals(executor.resolveName())) {
                    promiseResolutions.add(new PromiseResolutionInfo(callId,
                            executor.promiseId(), reject));
                    if (reject) {
                        final String target =
                                executor.creatorFunctionId() != null
                                        ? executor.creatorFunctionId()
                                        : frame.functionId();
                        frameOf(target).rejects();
                        addRejection(target, errorOrigin(argument,
                                RejectionType.REJECT_CALL), position);
                    }
                    return;
                }
            }
            if (frame.bindings().containsKey(name)) {
                return;
            }
        }
    }

    // -- control flow --

    private boolean visitThrow(final TSNode node) {
        final FunctionFrame frame = frame();
        final TSNode thrown = unwrap(firstNamedChild(node), false);
        final MicroTracer.Result origin = errorOrigin(thrown,
                RejectionType.ASYNC_THROW);
        final Position position = Position.of(node);
        final GraphNode throwNode = NodeFactory.createThrowStatement(file,
                position.line(), position.column(), origin.errorClassName(),
                frame.async());
        contain(throwNode, frame.ownerId());

        if (!frame.isModule()) {
            if (frame.async()) {
                frame.asyncThrow();
                addRejection(frame.functionId(), origin, position);
            } else {
                frame.syncThrow();
                throwPatterns.add(new ThrowPattern(frame.functionId(),
                        origin.errorClassName(), position.line(),
                        origin.tracePath()));
            }
        }
        addCatchSource(throwNode.id(), CatchSourceType.THROW_STATEMENT,
                position.line());
        if (thrown != null && "new_expression".equals(thrown.getType())) {
            thrownConstructions.add(key(thrown));
        }
        return true;
    }

    private boolean visitTry(final TSNode node) {
        final TSNode handler = field(node, "handler");
        if (handler == null) {
            return true;
        }
        final FunctionFrame frame = frame();
        final TSNode body = field(node, "body");
        final TSNode finalizer = field(node, "finalizer");
        final Position position = Position.of(node);
        final GraphNode tryNode = NodeFactory.createTryBlock(file,
                position.line(), position.column(), finalizer != null);
        contain(tryNode, frame.ownerId());

        final TSNode parameter = field(handler, "parameter");
        final String parameterName = parameter != null
                && "identifier".equals(parameter.getType())
                ? text.of(parameter) : null;
        final Position catchPosition = Position.of(handler);
        final GraphNode catchNode = NodeFactory.createCatchBlock(file,
                catchPosition.line(), catchPosition.column(), parameterName);
        contain(catchNode, tryNode.id());

        frame.enterTry(new FunctionFrame.CatchCollector(catchNode.id(),
                parameterName));
        if (body != null) {
            visit(body);
        }
        catchesFrom.add(frame.exitTry().toInfo());

        if (parameterName != null) {
            frame.bindings().put(parameterName, AliasBinding.OPAQUE);
        }
        final TSNode catchBody = field(handler, "body");
        if (catchBody != null) {
            visit(catchBody);
        }
        if (finalizer != null) {
            visit(finalizer);
        }
        return false;
    }

    private boolean visitIf(final TSNode node) {
        final FunctionFrame frame = frame();
        frame.branch();
        final Position position = Position.of(node);
        contain(NodeFactory.createBranch("if", file, position.line(),
                position.column(), 0), frame.ownerId());
        return true;
    }

    private boolean visitSwitch(final TSNode node) {
        final FunctionFrame frame = frame();
        frame.switchStatement();
        int caseCount = 0;
        final TSNode body = field(node, "body");
        if (body != null) {
            final int count = body.getNamedChildCount();
            for (int i = 0; i < count; i++) {
                if ("switch_case".equals(body.getNamedChild(i).getType())) {
                    caseCount++;
                }
            }
        }
        final Position position = Position.of(node);
        contain(NodeFactory.createBranch("switch", file, position.line(),
                position.column(), caseCount), frame.ownerId());
        return true;
    }

    private boolean visitBinary(final TSNode node) {
        final int count = node.getChildCount();
        for (int i = 0; i < count; i++) {
            if (LOGICAL_OPERATORS.contains(node.getChild(i).getType())) {
                frame().logicalOperator();
                break;
            }
        }
        return true;
    }

    private boolean visitLoop(final TSNode node) {
        final FunctionFrame frame = frame();
        frame.loop();
        final String kind = switch (node.getType()) {
            case "for_in_statement" -> hasToken(node, "of")
                    ? "for-of" : "for-in";
            case "while_statement" -> "while";
            case "do_statement" -> "do-while";
            default -> "for";
        };
        final Position position = Position.of(node);
        contain(NodeFactory.createLoop(kind, file, position.line(),
                position.column()), frame.ownerId());
        return true;
    }

    private boolean visitReturn(final TSNode node) {
        final FunctionFrame frame = frame();
        if (frame.isModule()) {
            return true;
        }
        final TSNode parent = node.getParent();
        final boolean lastInBody = parent != null && !parent.isNull()
                && key(parent).equals(frame.bodyKey())
                && isLastStatement(parent, node);
        if (!lastInBody) {
            frame.earlyReturn();
        }
        return true;
    }

    // -- values --

    private boolean visitObject(final TSNode node) {
        final ValueOwner owner = valueOwners.remove(key(node));
        if (owner == null) {
            return true;
        }
        final List<TSNode> pairs = new ArrayList<>();
        int properties = 0;
        final int count = node.getNamedChildCount();
        for (int i = 0; i < count; i++) {
            final TSNode child = node.getNamedChild(i);
            if (!"comment".equals(child.getType())) {
                properties++;
            }
            if ("pair".equals(child.getType())) {
                pairs.add(child);
            }
        }
        final Position position = Position.of(node);
        final GraphNode object = NodeFactory.createObjectLiteral(file,
                position.line(), position.column(), properties);
        materialize(object, owner);
        for (TSNode pair : pairs) {
            final TSNode value = unwrap(field(pair, "value"), true);
            if (value != null) {
                valueOwners.put(key(value), new ValueOwner(object.id(),
                        EdgeType.HAS_PROPERTY, Map.of("propertyName",
                                unquote(text.of(field(pair, "key"))))));
            }
        }
        return true;
    }

    private boolean visitArray(final TSNode node) {
        final ValueOwner owner = valueOwners.remove(key(node));
        if (owner == null) {
            return true;
        }
        final List<TSNode> elements = new ArrayList<>();
        final int count = node.getNamedChildCount();
        for (int i = 0; i < count; i++) {
            final TSNode child = node.getNamedChild(i);
            if (!"comment".equals(child.getType())) {
                elements.add(child);
            }
        }
        final Position position = Position.of(node);
        final GraphNode array = NodeFactory.createArrayLiteral(file,
                position.line(), position.column(), elements.size());
        materialize(array, owner);
        for (int i = 0; i < elements.size(); i++) {
            final TSNode element = unwrap(elements.get(i), true);
            if (element != null) {
                valueOwners.put(key(element), new ValueOwner(array.id(),
                        EdgeType.HAS_ELEMENT, Map.of("index", i)));
            }
        }
        return true;
    }

    private boolean visitLiteral(final TSNode node, final boolean template) {
        final ValueOwner owner = valueOwners.remove(key(node));
        if (owner != null) {
            final Position position = Position.of(node);
            materialize(NodeFactory.createLiteral(text.of(node), file,
                    position.line(), position.column(),
                    literalType(node.getType())), owner);
        }
        return template;
    }

    private void materialize(final GraphNode value, final ValueOwner owner) {
        contain(value, frame().ownerId());
        valueBindings.add(new ValueBinding(owner.ownerId(), value.id(),
                owner.edgeType(), owner.metadata()));
    }

    private void bindOwner(final TSNode node, final String valueId) {
        final ValueOwner owner = valueOwners.remove(key(node));
        if (owner != null) {
            valueBindings.add(new ValueBinding(owner.ownerId(), valueId,
                    owner.edgeType(), owner.metadata()));
        }
    }

    private void registerArguments(final TSNode arguments,
            final String ownerId) {
        if (arguments == null) {
            return;
        }
        int index = 0;
        final int count = arguments.getNamedChildCount();
        for (int i = 0; i < count; i++) {
            final TSNode argument = arguments.getNamedChild(i);
            if ("comment".equals(argument.getType())) {
                continue;
            }
            final TSNode value = unwrap(argument, true);
            if (value != null) {
                valueOwners.put(key(value), new ValueOwner(ownerId,
                        EdgeType.PASSES_ARGUMENT, Map.of("argIndex", index)));
            }
            index++;
        }
    }

    // -- error classes --

    private MicroTracer.Result errorOrigin(final TSNode expression,
            final RejectionType directType) {
        final TSNode value = unwrap(expression, false);
        if (value == null) {
            return new MicroTracer.Result(null,
                    RejectionType.UNRESOLVED_VARIABLE, List.of());
        }
        if ("new_expression".equals(value.getType())) {
            final String className = constructorName(value);
            return new MicroTracer.Result(className, directType,
                    List.of(className));
        }
        if ("identifier".equals(value.getType())) {
            return MicroTracer.trace(text.of(value), this::lookupBinding);
        }
        return new MicroTracer.Result(null,
                RejectionType.UNRESOLVED_VARIABLE, List.of());
    }

    private AliasBinding lookupBinding(final String name) {
        for (FunctionFrame frame : frames) {
            final AliasBinding binding = frame.bindings().get(name);
            if (binding != null) {
                return binding;
            }
        }
        return null;
    }

    private AliasBinding classify(final TSNode value) {
        if (value == null) {
            return AliasBinding.OPAQUE;
        }
        return switch (value.getType()) {
            case "new_expression" -> AliasBinding.construct(
                    constructorName(value));
            case "identifier" -> AliasBinding.alias(text.of(value));
            default -> AliasBinding.OPAQUE;
        };
    }

    private void addRejection(final String functionId,
            final MicroTracer.Result origin, final Position position) {
        rejectionPatterns.add(new RejectionPattern(functionId,
                origin.errorClassName(), origin.rejectionType(), file,
                position.line(), position.column(), origin.tracePath()));
    }

    private void addCatchSource(final String sourceId,
            final CatchSourceType type, final int line) {
        final FunctionFrame.CatchCollector collector = frame().currentCatch();
        if (collector != null) {
            collector.add(sourceId, type, line);
        }
    }

    // -- helpers --

    private FunctionFrame frame() {
        return frames.peek();
    }

    private FunctionFrame frameOf(final String functionId) {
        for (FunctionFrame frame : frames) {
            if (functionId.equals(frame.functionId())) {
                return frame;
            }
        }
        return frame();
    }

    private List<String> scopeOwnerIds() {
        final List<String> ids = new ArrayList<>();
        for (FunctionFrame frame : frames) {
            ids.add(frame.ownerId());
        }
        return ids;
    }

    private void contain(final GraphNode node, final String parentId) {
        nodes.putIfAbsent(node.id(), new ContainedNode(node, parentId));
    }

    private int discriminator(final NodeType type, final ScopeContext scope,
            final String name) {
        return discriminators.merge(new ScopeKey(type, scope, name), 1,
                Integer::sum) - 1;
    }

    private String functionName(final TSNode node) {
        final TSNode name = field(node, "name");
        if (name != null) {
            return unquote(text.of(name));
        }
        return bindingNameOf(node.getParent());
    }

    /** The name a function or class expression is bound to, or null. */
    private String bindingNameOf(final TSNode parent) {
        if (parent == null || parent.isNull()) {
            return null;
        }
        switch (parent.getType()) {
            case "variable_declarator", "public_field_definition",
                    "field_definition" -> {
                TSNode name = field(parent, "name");
                if (name == null) {
                    name = field(parent, "property");
                }
                return name == null ? null : text.of(name);
            }
            case "assignment_expression" -> {
                final TSNode left = field(parent, "left");
                if (left == null) {
                    return null;
                }
                if ("member_expression".equals(left.getType())) {
                    return text.of(field(left, "property"));
                }
                return text.of(left);
            }
            case "pair" -> {
                return unquote(text.of(field(parent, "key")));
            }
            default -> {
                return null;
            }
        }
    }

    private boolean isClassField(final TSNode parent) {
        final String type = typeOf(parent);
        return "public_field_definition".equals(type)
                || "field_definition".equals(type);
    }

    private String superClassOf(final TSNode classNode) {
        final int count = classNode.getNamedChildCount();
        for (int i = 0; i < count; i++) {
            final TSNode child = classNode.getNamedChild(i);
            if (!"class_heritage".equals(child.getType())) {
                continue;
            }
            final TSNode first = firstNamedChild(child);
            if (first == null) {
                return null;
            }
            if ("extends_clause".equals(first.getType())) {
                final TSNode value = field(first, "value");
                return text.of(value == null ? firstNamedChild(first) : value);
            }
            if ("implements_clause".equals(first.getType())) {
                return null;
            }
            return text.of(first);
        }
        return null;
    }

    private List<ParameterSpec> parameters(final TSNode function) {
        final List<ParameterSpec> specs = new ArrayList<>();
        final TSNode single = field(function, "parameter");
        if (single != null) {
            if ("identifier".equals(single.getType())) {
                specs.add(new ParameterSpec(text.of(single), single, false,
                        false));
            }
            return specs;
        }
        final TSNode list = field(function, "parameters");
        if (list == null) {
            return specs;
        }
        final int count = list.getNamedChildCount();
        for (int i = 0; i < count; i++) {
            final TSNode parameter = list.getNamedChild(i);
            TSNode target = parameter;
            boolean hasDefault = false;
            if ("required_parameter".equals(parameter.getType())
                    || "optional_parameter".equals(parameter.getType())) {
                target = field(parameter, "pattern");
                hasDefault = field(parameter, "value") != null;
            } else if ("assignment_pattern".equals(parameter.getType())) {
                target = field(parameter, "left");
                hasDefault = true;
            }
            if (target == null) {
                continue;
            }
            boolean rest = false;
            if ("rest_pattern".equals(target.getType())) {
                rest = true;
                target = firstNamedChild(target);
            }
            if (target != null && "identifier".equals(target.getType())) {
                specs.add(new ParameterSpec(text.of(target), target, rest,
                        hasDefault));
            }
        }
        return specs;
    }

    /** The constructor as written, qualified for member expressions. */
    private String constructorName(final TSNode newExpression) {
        final TSNode constructor = field(newExpression, "constructor");
        if (constructor == null) {
            return "<anonymous>";
        }
        final String name = abbreviate(text.of(constructor)
                .replaceAll("\\s+", ""));
        return name.isBlank() ? "<anonymous>" : name;
    }

    private boolean isAwaited(final TSNode node) {
        TSNode parent = node.getParent();
        while (parent != null && !parent.isNull()
                && "parenthesized_expression".equals(parent.getType())) {
            parent = parent.getParent();
        }
        return "await_expression".equals(typeOf(parent));
    }

    private boolean isLastStatement(final TSNode block, final TSNode node) {
        for (int i = block.getNamedChildCount() - 1; i >= 0; i--) {
            final TSNode child = block.getNamedChild(i);
            if (!"comment".equals(child.getType())) {
                return key(child).equals(key(node));
            }
        }
        return false;
    }

    /** Strips parentheses and type assertions, and await when asked to. */
    private static TSNode unwrap(final TSNode node, final boolean throughAwait) {
        TSNode current = node;
        while (current != null
                && SyntaxKind.of(current.getType()) == SyntaxKind.WRAPPER) {
            if (!throughAwait
                    && "await_expression".equals(current.getType())) {
                return current;
            }
            current = firstNamedChild(current);
        }
        return current;
    }

    private static TSNode field(final TSNode node, final String name) {
        if (node == null || node.isNull()) {
            return null;
        }
        final TSNode child = node.getChildByFieldName(name);
        return child == null || child.isNull() ? null : child;
    }

    private static TSNode firstNamedChild(final TSNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        final int count = node.getNamedChildCount();
        for (int i = 0; i < count; i++) {
            final TSNode child = node.getNamedChild(i);
            if (!"comment".equals(child.getType())) {
                return child;
            }
        }
        return null;
    }

    private static boolean hasToken(final TSNode node, final String token) {
        final int count = node.getChildCount();
        for (int i = 0; i < count; i++) {
            if (token.equals(node.getChild(i).getType())) {
                return true;
            }
        }
        return false;
    }

    private static int countArguments(final TSNode arguments) {
        if (arguments == null) {
            return 0;
        }
        int count = 0;
        final int children = arguments.getNamedChildCount();
        for (int i = 0; i < children; i++) {
            if (!"comment".equals(arguments.getNamedChild(i).getType())) {
                count++;
            }
        }
        return count;
    }

    private static String typeOf(final TSNode node) {
        return node == null || node.isNull() ? null : node.getType();
    }

    private static String key(final TSNode node) {
        return node.getType() + '@' + node.getStartByte() + ':'
                + node.getEndByte();
    }

    private static String literalType(final String grammarType) {
        return switch (grammarType) {
            case "true", "false" -> "boolean";
            case "template_string" -> "template";
            default -> grammarType;
        };
    }

    private static String unquote(final String value) {
        if (value.length() >= 2) {
            final char first = value.charAt(0);
            final char last = value.charAt(value.length() - 1);
            if ((first == '\'' || first == '"' || first == '`')
                    && first == last) {
                return value.substring(1, value.length() - 1);
            }
        }
        return value;
    }

    private static String abbreviate(final String value) {
        final String singleLine = value.replaceAll("\\s+", " ");
        if (singleLine.length() <= MAX_CALLEE_LENGTH) {
            return singleLine;
        }
        return singleLine.substring(0, MAX_CALLEE_LENGTH - 3) + "...";
    }

}
