package io.devguard.extract;

import io.devguard.extract.PythonLineReader.LogicalLine;
import io.devguard.model.EdgeKind;
import io.devguard.model.Language;
import io.devguard.model.Node;
import io.devguard.model.NodeKind;
import io.devguard.model.SignatureParam;
import io.devguard.model.SourceDocument;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Python adapter.
 * <p>
 * Declares module-level functions and classes, methods, schemas (pydantic models,
 * ORM models, TypedDicts, dataclasses) and endpoints declared with FastAPI or Flask
 * route decorators. References are recorded for imports, calls on imported or
 * locally declared names and on {@code self}, class bases, and type hints.
 * Functions and classes nested inside functions are folded into their enclosing
 * declaration.
 */
public class PythonSymbolExtractor implements SymbolExtractor {

    private static final Pattern DEF = Pattern.compile("^(?:async\\s+)?def\\s+([A-Za-z_]\\w*)\\s*\\(");
    private static final Pattern DEF_START = Pattern.compile("^(?:async\\s+)?def\\b");
    private static final Pattern CLASS = Pattern.compile("^class\\s+([A-Za-z_]\\w*)\\s*");
    private static final Pattern CLASS_START = Pattern.compile("^class\\b");
    private static final Pattern IMPORT = Pattern.compile("^import\\s+(.+)$");
    private static final Pattern FROM_IMPORT = Pattern.compile("^from\\s+(\\.*)\\s*([\\w.]*)\\s+import\\s+(.+)$");
    private static final Pattern IMPORT_NAME = Pattern.compile("^([\\w.]+)(?:\\s+as\\s+(\\w+))?$");
    private static final Pattern CALL = Pattern.compile(
            "(?<![\\w.])([A-Za-z_]\\w*(?:\\s*\\.\\s*[A-Za-z_]\\w*)*)\\s*\\(");
    private static final Pattern DOTTED_NAME = Pattern.compile("[A-Za-z_]\\w*(?:\\.[A-Za-z_]\\w*)*");
    private static final Pattern ANNOTATED_FIELD = Pattern.compile("^([A-Za-z_]\\w*)\\s*:(?!=)");
    private static final Pattern COLUMN_FIELD = Pattern.compile(
            "^([A-Za-z_]\\w*)\\s*=\\s*(?:[A-Za-z_]\\w*\\.)*(Column|mapped_column|relationship|Field|\\w+Field)\\s*\\(");
    private static final Pattern ROUTER = Pattern.compile(
            "^([A-Za-z_]\\w*)\\s*=\\s*(?:[A-Za-z_]\\w*\\.)*(APIRouter|Blueprint|FastAPI|Flask)\\s*\\((.*)\\)$");
    private static final Pattern ROUTER_PREFIX = Pattern.compile(
            "\\b(?:prefix|url_prefix)\\s*=\\s*[rbuf]*(['\"])(.*?)\\1");
    private static final Pattern VERB_DECORATOR = Pattern.compile(
            "^@\\s*([A-Za-z_]\\w*)\\s*\\.\\s*(get|post|put|delete|patch|head|options)\\s*\\(\\s*[rbuf]*(['\"])(.*?)\\3");
    private static final Pattern ROUTE_DECORATOR = Pattern.compile(
            "^@\\s*([A-Za-z_]\\w*)\\s*\\.\\s*route\\s*\\(\\s*[rbuf]*(['\"])(.*?)\\2(.*)$");
    private static final Pattern ROUTE_METHODS = Pattern.compile("\\bmethods\\s*=\\s*[\\[(]([^\\])]*)[\\])]");
    private static final Pattern QUOTED_WORD = Pattern.compile("['\"](\\w+)['\"]");
    private static final Pattern DECORATOR_NAME = Pattern.compile("^@\\s*([A-Za-z_]\\w*(?:\\s*\\.\\s*[A-Za-z_]\\w*)*)");

    private static final Set<String> SCHEMA_BASES = Set.of(
            "BaseModel", "Schema", "Model", "Base", "DeclarativeBase", "TypedDict", "SQLModel",
            "Document", "Serializer", "ModelSerializer");
    private static final Set<String> DATACLASS_DECORATORS = Set.of("dataclass", "dataclasses.dataclass");
    private static final Set<String> TYPING_MODULES = Set.of(
            "typing", "typing_extensions", "collections", "collections.abc", "datetime", "decimal", "uuid", "enum");

    private enum ScopeKind { CLASS, FUNCTION, NESTED }

    /**
     * An open block. NESTED scopes fold into {@code sourceId} of their enclosing declaration.
     */
    private record Scope(ScopeKind kind, int indent, String qualifiedName, String sourceId,
                         List<SignatureParam> fields) {}

    private record PendingReference(String sourceId, String chain, EdgeKind kind, int line, String classQn) {}

    private record PendingRoute(String receiver, String verb, String path, Node handler, int line) {}

    @Override
    public Set<Language> languages() {
        return Set.of(Language.PYTHON);
    }

    @Override
    public FileContribution extract(SourceDocument document) throws ParseException {
        return new Walk(document).run();
    }

    /**
     * State of one extraction; a fresh instance per document keeps the adapter thread-safe.
     */
    private static final class Walk {

        private final ContributionCollector collector;
        private final Deque<Scope> scopes = new ArrayDeque<>();
        private final Deque<Integer> indents = new ArrayDeque<>();
        private final Map<String, String> imports = new HashMap<>();
        private final Map<String, String> routers = new HashMap<>();
        private final List<PendingReference> pending = new ArrayList<>();
        private final List<PendingRoute> routes = new ArrayList<>();
        private final List<LogicalLine> decorators = new ArrayList<>();
        private final String source;
        private boolean previousOpensBlock;

        Walk(SourceDocument document) {
            this.collector = new ContributionCollector(document);
            this.source = document.content();
        }

        FileContribution run() throws ParseException {
            indents.push(0);
            List<LogicalLine> lines = PythonLineReader.read(source);
            for (LogicalLine line : lines) {
                checkIndentation(line);
                while (!scopes.isEmpty() && scopes.peek().indent() >= line.indent()) {
                    close(scopes.pop());
                }
                visit(line);
            }
            if (previousOpensBlock) {
                int last = lines.get(lines.size() - 1).endLine();
                throw new ParseException("expected an indented block", last);
            }
            while (!scopes.isEmpty()) {
                close(scopes.pop());
            }
            resolveRoutes();
            resolvePending();
            return collector.finish();
        }

        private void checkIndentation(LogicalLine line) throws ParseException {
            int current = indents.peek();
            if (line.indent() > current) {
                if (!previousOpensBlock) {
                    throw new ParseException("unexpected indent", line.startLine());
                }
                indents.push(line.indent());
            } else {
                if (previousOpensBlock) {
                    throw new ParseException("expected an indented block", line.startLine());
                }
                while (line.indent() < indents.peek()) {
                    indents.pop();
                }
                if (line.indent() != indents.peek()) {
                    throw new ParseException("unindent does not match any outer indentation level",
                            line.startLine());
                }
            }
            previousOpensBlock = line.opensBlock();
        }

        private void visit(LogicalLine line) throws ParseException {
            String masked = line.masked();
            if (masked.startsWith("@")) {
                decorators.add(line);
                return;
            }
            if (DEF_START.matcher(masked).find()) {
                visitFunction(line);
                decorators.clear();
                return;
            }
            if (CLASS_START.matcher(masked).find()) {
                visitClass(line);
                decorators.clear();
                return;
            }
            decorators.clear();

            if (visitImport(line)) {
                return;
            }
            Scope scope = scopes.peek();
            if (scope == null) {
                visitRouter(line);
            } else if (scope.kind() == ScopeKind.CLASS) {
                visitField(line, scope);
            }
            recordCalls(line, 0, sourceId(), line.startLine());
        }

        // Declarations

        private void visitFunction(LogicalLine line) throws ParseException {
            String masked = line.masked();
            String text = line.text();
            Matcher m = DEF.matcher(masked);
            if (!m.find()) {
                throw new ParseException("invalid function definition", line.startLine());
            }
            String name = m.group(1);
            int open = m.end() - 1;
            int close = Brackets.matchingClose(masked, open);
            int colon = close < 0 ? -1 : Brackets.indexOfTopLevel(masked, ':', close + 1, masked.length());
            if (colon < 0) {
                throw new ParseException("expected ':' after function signature", line.startLine());
            }
            String between = text.substring(close + 1, colon).trim();
            String returns = null;
            if (!between.isEmpty()) {
                if (!between.startsWith("->")) {
                    throw new ParseException("invalid syntax in function definition", line.startLine());
                }
                returns = between.substring(2).trim();
            }

            Scope parent = scopes.peek();
            if (parent != null && parent.kind() != ScopeKind.CLASS) {
                scopes.push(new Scope(ScopeKind.NESTED, line.indent(), parent.qualifiedName(),
                        parent.sourceId(), List.of()));
                recordCalls(line, colon + 1, parent.sourceId(), line.startLine());
                return;
            }

            boolean method = parent != null;
            String qualifiedName = method ? parent.qualifiedName() + "." + name : collector.qualify(name);
            String classQn = method ? parent.qualifiedName() : null;
            List<SignatureParam> params = parameters(line, open + 1, close, method);
            Node node = collector.declare(NodeKind.FUNCTION, qualifiedName, name, line.startLine(), params);

            for (SignatureParam param : params) {
                recordTypeReferences(node.id(), param.typeHint(), line.startLine(), classQn);
            }
            recordTypeReferences(node.id(), returns, line.startLine(), classQn);
            visitDecorators(node, classQn);

            scopes.push(new Scope(ScopeKind.FUNCTION, line.indent(), qualifiedName, node.id(), List.of()));
            recordCalls(line, colon + 1, node.id(), line.startLine());
        }

        private void visitClass(LogicalLine line) throws ParseException {
            String masked = line.masked();
            String text = line.text();
            Matcher m = CLASS.matcher(masked);
            if (!m.find()) {
                throw new ParseException("invalid class definition", line.startLine());
            }
            String name = m.group(1);
            List<String> bases = new ArrayList<>();
            int afterHeader = m.end();
            if (afterHeader < masked.length() && masked.charAt(afterHeader) == '(') {
                int close = Brackets.matchingClose(masked, afterHeader);
                if (close < 0) {
                    throw new ParseException("invalid class definition", line.startLine());
                }
                for (int[] part : Brackets.splitTopLevel(masked, afterHeader + 1, close, ",")) {
                    String base = text.substring(part[0], part[1]).trim();
                    if (!base.contains("=")) {
                        int subscript = base.indexOf('[');
                        bases.add(subscript >= 0 ? base.substring(0, subscript).trim() : base);
                    }
                }
                afterHeader = close + 1;
            }
            int colon = Brackets.indexOfTopLevel(masked, ':', afterHeader, masked.length());
            if (colon < 0 || !masked.substring(afterHeader, colon).isBlank()) {
                throw new ParseException("expected ':' after class declaration", line.startLine());
            }

            Scope parent = scopes.peek();
            if (parent != null) {
                scopes.push(new Scope(ScopeKind.NESTED, line.indent(), parent.qualifiedName(),
                        parent.sourceId(), List.of()));
                return;
            }

            boolean schema = bases.stream().anyMatch(b -> SCHEMA_BASES.contains(ContributionCollector.lastSegment(b)))
                    || decorators.stream().anyMatch(d -> DATACLASS_DECORATORS.contains(decoratorName(d)));
            String qualifiedName = collector.qualify(name);
            Node node = collector.declare(schema ? NodeKind.SCHEMA : NodeKind.CLASS, qualifiedName, name,
                    line.startLine(), List.of());
            for (String base : bases) {
                pending.add(new PendingReference(node.id(), base, EdgeKind.IMPLEMENTS, line.startLine(), null));
            }
            visitDecorators(node, null);
            scopes.push(new Scope(ScopeKind.CLASS, line.indent(), qualifiedName, node.id(), new ArrayList<>()));
        }

        private void visitField(LogicalLine line, Scope scope) {
            String masked = line.masked();
            String text = line.text();
            Matcher annotated = ANNOTATED_FIELD.matcher(masked);
            if (annotated.find()) {
                int equals = Brackets.indexOfTopLevel(masked, '=', annotated.end(), masked.length());
                String hint = text.substring(annotated.end(), equals < 0 ? text.length() : equals).trim();
                scope.fields().add(new SignatureParam(annotated.group(1), hint));
                recordTypeReferences(scope.sourceId(), hint, line.startLine(), scope.qualifiedName());
                return;
            }
            Matcher column = COLUMN_FIELD.matcher(masked);
            if (column.find()) {
                scope.fields().add(new SignatureParam(column.group(1), column.group(2)));
            }
        }

        private void close(Scope scope) {
            if (scope.kind() == ScopeKind.CLASS) {
                collector.resign(scope.qualifiedName(), scope.fields());
            }
        }

        private List<SignatureParam> parameters(LogicalLine line, int from, int to, boolean method) {
            String masked = line.masked();
            String text = line.text();
            List<SignatureParam> params = new ArrayList<>();
            boolean first = true;
            for (int[] part : Brackets.splitTopLevel(masked, from, to, ",")) {
                int equals = Brackets.indexOfTopLevel(masked, '=', part[0], part[1]);
                int end = equals < 0 ? part[1] : equals;
                int colon = Brackets.indexOfTopLevel(masked, ':', part[0], end);
                String name = text.substring(part[0], colon < 0 ? end : colon).trim().replaceFirst("^\\*{1,2}", "");
                String hint = colon < 0 ? null : text.substring(colon + 1, end).trim();
                boolean receiver = first && method && (name.equals("self") || name.equals("cls"));
                first = false;
                if (receiver || name.isEmpty() || name.equals("/") || !name.matches("[A-Za-z_]\\w*")) {
                    continue;
                }
                params.add(new SignatureParam(name, hint));
            }
            return params;
        }

        // Routes and decorators

        private void visitDecorators(Node node, String classQn) {
            for (LogicalLine decorator : decorators) {
                String text = decorator.text();
                Matcher verb = VERB_DECORATOR.matcher(text);
                if (verb.find()) {
                    routes.add(new PendingRoute(verb.group(1), verb.group(2).toUpperCase(Locale.ROOT),
                            verb.group(4), node, decorator.startLine()));
                    continue;
                }
                Matcher route = ROUTE_DECORATOR.matcher(text);
                if (route.find()) {
                    for (String method : routeMethods(route.group(4))) {
                        routes.add(new PendingRoute(route.group(1), method, route.group(3), node,
                                decorator.startLine()));
                    }
                    continue;
                }
                String name = decoratorName(decorator);
                if (!name.isEmpty() && !DATACLASS_DECORATORS.contains(name)) {
                    pending.add(new PendingReference(node.id(), name, EdgeKind.CALLS, decorator.startLine(), classQn));
                }
            }
        }

        private static List<String> routeMethods(String arguments) {
            Matcher methods = ROUTE_METHODS.matcher(arguments);
            if (!methods.find()) {
                return List.of("GET");
            }
            List<String> verbs = new ArrayList<>();
            Matcher word = QUOTED_WORD.matcher(methods.group(1));
            while (word.find()) {
                String verb = word.group(1).toUpperCase(Locale.ROOT);
                if (!verbs.contains(verb)) {
                    verbs.add(verb);
                }
            }
            return verbs.isEmpty() ? List.of("GET") : verbs;
        }

        private static String decoratorName(LogicalLine decorator) {
            Matcher m = DECORATOR_NAME.matcher(decorator.masked());
            return m.find() ? m.group(1).replaceAll("\\s+", "") : "";
        }

        private void visitRouter(LogicalLine line) {
            Matcher router = ROUTER.matcher(line.text());
            if (!router.find()) {
                return;
            }
            Matcher prefix = ROUTER_PREFIX.matcher(router.group(3));
            routers.put(router.group(1), prefix.find() ? prefix.group(2) : "");
        }

        private void resolveRoutes() {
            for (PendingRoute route : routes) {
                String path = joinRoute(routers.getOrDefault(route.receiver(), ""), route.path());
                HttpRoute httpRoute = new HttpRoute(route.verb(), path);
                Node endpoint = collector.declare(NodeKind.ENDPOINT, httpRoute.display(), httpRoute.display(),
                        route.line(), route.handler().signature(), Set.of(), httpRoute);
                collector.reference(endpoint.id(), List.of(route.handler().qualifiedName()), EdgeKind.CALLS,
                        route.line());
            }
        }

        static String joinRoute(String prefix, String path) {
            String left = prefix.endsWith("/") ? prefix.substring(0, prefix.length() - 1) : prefix;
            String right = path.isEmpty() || path.startsWith("/") ? path : "/" + path;
            String joined = left + right;
            return joined.isEmpty() ? "/" : joined;
        }

        // Imports

        private boolean visitImport(LogicalLine line) {
            String text = line.text();
            String fileId = collector.fileNode().id();
            Matcher plain = IMPORT.matcher(text);
            if (plain.find()) {
                for (String part : plain.group(1).split(",")) {
                    Matcher name = IMPORT_NAME.matcher(part.trim());
                    if (!name.find()) {
                        continue;
                    }
                    String module = name.group(1);
                    collector.reference(fileId, List.of(module), EdgeKind.IMPORTS, line.startLine());
                    if (name.group(2) != null) {
                        imports.put(name.group(2), module);
                    } else {
                        String head = module.contains(".") ? module.substring(0, module.indexOf('.')) : module;
                        imports.putIfAbsent(head, head);
                    }
                }
                return true;
            }
            Matcher from = FROM_IMPORT.matcher(text);
            if (!from.find()) {
                return false;
            }
            int level = from.group(1).length();
            String module = level > 0
                    ? ModuleNames.resolvePythonRelative(collector.path(), level, from.group(2))
                    : from.group(2);
            if (module == null || module.isEmpty()) {
                collector.reference(fileId, List.of(from.group(1) + from.group(2)), EdgeKind.IMPORTS,
                        line.startLine());
                return true;
            }
            String names = from.group(3).trim();
            if (names.startsWith("(") && names.endsWith(")")) {
                names = names.substring(1, names.length() - 1);
            }
            for (String part : names.split(",")) {
                String trimmed = part.trim();
                if (trimmed.isEmpty()) {
                    continue;
                }
                if (trimmed.equals("*")) {
                    collector.reference(fileId, List.of(module), EdgeKind.IMPORTS, line.startLine());
                    continue;
                }
                Matcher name = IMPORT_NAME.matcher(trimmed);
                if (!name.find()) {
                    continue;
                }
                String target = module + "." + name.group(1);
                collector.reference(fileId, List.of(target, module), EdgeKind.IMPORTS, line.startLine());
                imports.put(name.group(2) != null ? name.group(2) : name.group(1), target);
            }
            return true;
        }

        // Calls and type hints

        private void recordCalls(LogicalLine line, int from, String sourceId, int lineNumber) {
            if (from >= line.masked().length()) {
                return;
            }
            Matcher call = CALL.matcher(line.masked());
            call.region(from, line.masked().length());
            String classQn = enclosingClass();
            while (call.find()) {
                String chain = call.group(1).replaceAll("\\s+", "");
                pending.add(new PendingReference(sourceId, chain, EdgeKind.CALLS, lineNumber, classQn));
            }
        }

        private void recordTypeReferences(String sourceId, String hint, int line, String classQn) {
            if (hint == null || hint.isEmpty()) {
                return;
            }
            Matcher name = DOTTED_NAME.matcher(hint.replace('"', ' ').replace('\'', ' '));
            while (name.find()) {
                pending.add(new PendingReference(sourceId, name.group(), EdgeKind.REFERENCES_SCHEMA, line, classQn));
            }
        }

        private void resolvePending() {
            for (PendingReference ref : pending) {
                List<String> candidates = candidates(ref.chain(), ref.classQn());
                if (candidates.isEmpty()) {
                    continue;
                }
                if (ref.kind() == EdgeKind.REFERENCES_SCHEMA && isTypingName(candidates.get(0))) {
                    continue;
                }
                collector.reference(ref.sourceId(), candidates, ref.kind(), ref.line());
            }
        }

        /**
         * Qualified names a dotted chain may denote, longest first. Chains whose head is
         * neither imported nor declared here (locals, builtins) yield nothing.
         */
        private List<String> candidates(String chain, String classQn) {
            String[] segments = chain.split("\\.");
            String head = segments[0];
            if (head.equals("self") || head.equals("cls")) {
                if (classQn != null && segments.length == 2) {
                    return List.of(classQn + "." + segments[1]);
                }
                return List.of();
            }
            String base;
            if (imports.containsKey(head)) {
                base = imports.get(head);
            } else if (collector.isDeclared(collector.qualify(head))) {
                base = collector.qualify(head);
            } else {
                return List.of();
            }
            List<String> result = new ArrayList<>();
            for (int length = segments.length; length >= 1; length--) {
                String rest = String.join(".", Arrays.copyOfRange(segments, 1, length));
                result.add(rest.isEmpty() ? base : base + "." + rest);
            }
            return result;
        }

        private static boolean isTypingName(String qualifiedName) {
            int dot = qualifiedName.lastIndexOf('.');
            String module = dot >= 0 ? qualifiedName.substring(0, dot) : qualifiedName;
            return TYPING_MODULES.contains(module) || TYPING_MODULES.contains(qualifiedName);
        }

        private String sourceId() {
            Scope scope = scopes.peek();
            return scope != null ? scope.sourceId() : collector.fileNode().id();
        }

        private String enclosingClass() {
            for (Scope scope : scopes) {
                if (scope.kind() == ScopeKind.CLASS) {
                    return scope.qualifiedName();
                }
            }
            return null;
        }
    }
}
