package io.devguard.extract;

import io.devguard.model.EdgeKind;
import io.devguard.model.Language;
import io.devguard.model.Node;
import io.devguard.model.NodeKind;
import io.devguard.model.SignatureParam;
import io.devguard.model.SourceDocument;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * JavaScript and TypeScript adapter.
 * <p>
 * Works on masked source (see {@link EcmaScriptSource}) and declares top-level
 * functions, arrow-function constants, classes with their methods, React components,
 * TypeScript interfaces and object type aliases (as schemas) and Express routes.
 * References are recorded for ES module imports, {@code require}, calls and JSX
 * usage of imported or locally declared names, class heritage and type annotations.
 * Frontend HTTP calls ({@code fetch} and {@code client.get('/path')} style) are
 * recorded for endpoint binding.
 */
public class EcmaScriptSymbolExtractor implements SymbolExtractor {

    private static final String IDENT = "[A-Za-z_$][\\w$]*";

    private static final Pattern FUNCTION_DECL = Pattern.compile(
            "\\b(export\\s+)?(default\\s+)?(?:async\\s+)?function\\b\\s*\\*?\\s*(" + IDENT + ")?\\s*(?:<[^>(]*>)?\\s*\\(");
    private static final Pattern VARIABLE_DECL = Pattern.compile(
            "\\b(export\\s+)?(?:const|let|var)\\s+(" + IDENT + ")\\s*(?::\\s*[^=;]+?)?=(?![=>])\\s*");
    private static final Pattern CLASS_DECL = Pattern.compile(
            "\\b(export\\s+)?(default\\s+)?(?:abstract\\s+)?class\\s+(" + IDENT + ")");
    private static final Pattern INTERFACE_DECL = Pattern.compile(
            "\\b(?:export\\s+)?interface\\s+(" + IDENT + ")");
    private static final Pattern TYPE_OBJECT_DECL = Pattern.compile(
            "\\b(?:export\\s+)?type\\s+(" + IDENT + ")\\s*(?:<[^=]*>)?\\s*=\\s*\\{");
    private static final Pattern EXTENDS = Pattern.compile("\\bextends\\s+(" + IDENT + "(?:\\s*\\.\\s*" + IDENT + ")*)");
    private static final Pattern INTERFACE_EXTENDS = Pattern.compile("\\bextends\\s+([^{]+)");
    private static final Pattern IMPLEMENTS = Pattern.compile("\\bimplements\\s+([^{]+)");
    private static final Pattern METHOD = Pattern.compile(
            "(?m)^[ \\t]*(?:(?:public|private|protected|static|async|readonly|override|get|set)\\s+)*\\*?("
                    + IDENT + ")\\s*(?:<[^>(]*>)?\\s*\\(");
    private static final Pattern PROPERTY = Pattern.compile(
            "(?m)^[ \\t]*(?:(?:public|private|protected|static|readonly)\\s+)*(" + IDENT + ")\\s*(?::[^=\\n]+)?=(?![=>])\\s*");
    private static final Pattern MEMBER = Pattern.compile("^\\s*(?:readonly\\s+)?(" + IDENT + ")\\s*\\??\\s*([:(])");
    private static final Pattern DEFAULT_EXPORT_NAME = Pattern.compile(
            "\\bexport\\s+default\\s+(" + IDENT + ")\\s*(?:;|\\n|$)");

    private static final Pattern ASYNC = Pattern.compile("async\\s+");
    private static final Pattern ARROW = Pattern.compile("\\s*(?::\\s*([^=;{]+?))?\\s*=>\\s*");
    private static final Pattern IDENT_ARROW = Pattern.compile("(" + IDENT + ")\\s*=>\\s*");
    private static final Pattern WRAPPER = Pattern.compile(
            "(?:React\\s*\\.\\s*)?(?:memo|forwardRef)\\s*(?:<[^>(]*>)?\\s*\\(");
    private static final Pattern JSX_RETURN = Pattern.compile("(?:return|=>)\\s*\\(?\\s*<[A-Za-z>]");

    private static final Pattern IMPORT_FROM = Pattern.compile(
            "\\bimport\\s+(?:type\\s+)?([\\w$*{}\\s,]+?)\\s*\\bfrom\\s*(['\"])");
    private static final Pattern IMPORT_BARE = Pattern.compile("\\bimport\\s*(['\"])");
    private static final Pattern IMPORT_DYNAMIC = Pattern.compile("\\bimport\\s*\\(\\s*(['\"`])");
    private static final Pattern EXPORT_FROM = Pattern.compile(
            "\\bexport\\s+(?:type\\s+)?(?:\\*(?:\\s+as\\s+" + IDENT + ")?|\\{[^}]*})\\s*from\\s*(['\"])");
    private static final Pattern REQUIRE = Pattern.compile(
            "(?:\\b(?:const|let|var)\\s+(" + IDENT + "|\\{[^}]*})\\s*=\\s*)?(?<![\\w$.])require\\s*\\(\\s*(['\"])");
    private static final Pattern NAMED_IMPORTS = Pattern.compile("\\{([^}]*)}");
    private static final Pattern NAMESPACE_IMPORT = Pattern.compile("\\*\\s*as\\s+(" + IDENT + ")");
    private static final Pattern DEFAULT_IMPORT = Pattern.compile("^\\s*(" + IDENT + ")\\s*(?:,|$)");
    private static final Pattern IMPORT_SPECIFIER = Pattern.compile(
            "^(?:type\\s+)?(" + IDENT + ")(?:\\s*(?:as|:)\\s*(" + IDENT + "))?$");

    private static final Pattern CALL = Pattern.compile(
            "(?<![\\w$.])(" + IDENT + "(?:\\s*\\.\\s*" + IDENT + ")*)\\s*(?:<[^<>()]*>)?\\s*\\(");
    private static final Pattern JSX_TAG = Pattern.compile("<([A-Z][\\w$]*(?:\\.[A-Za-z_$][\\w$]*)*)(?=[\\s/>])");
    private static final Pattern TYPE_NAME = Pattern.compile(IDENT + "(?:\\." + IDENT + ")*");

    private static final Pattern FETCH = Pattern.compile("(?<![\\w$.])fetch\\s*\\(");
    private static final Pattern CLIENT_CALL = Pattern.compile(
            "(?<![\\w$.])(" + IDENT + ")\\s*\\.\\s*(get|post|put|delete|patch|head|options)\\s*(?:<[^<>()]*>)?\\s*\\(");
    private static final Pattern FETCH_METHOD = Pattern.compile("\\bmethod\\s*:\\s*(['\"`])(\\w+)\\1");
    private static final Pattern EXPRESS_ROUTER = Pattern.compile(
            "\\b(?:const|let|var)\\s+(" + IDENT + ")\\s*=\\s*(?:express\\s*\\(\\s*\\)|(?:express\\s*\\.\\s*)?Router\\s*\\(\\s*\\))");

    private static final Set<String> COMPONENT_BASES = Set.of("Component", "PureComponent");
    private static final Set<String> METHOD_KEYWORDS = Set.of(
            "if", "for", "while", "switch", "catch", "return", "function", "super", "with");
    private static final Set<String> JSX_EXTENSIONS = Set.of("jsx", "tsx");
    private static final Set<String> JSX_KEYWORDS = Set.of("return", "yield", "await", "default");

    /**
     * A local name bound by an import.
     *
     * @param target   qualified name the local name stands for
     * @param fallback name tried when the target does not resolve, usually the module itself
     * @param external bound from a bare package specifier such as {@code react}
     */
    private record Binding(String target, String fallback, boolean external) {}

    /**
     * Source span attributed to a declared node.
     */
    private record Span(int start, int end, String sourceId, String classQn) {

        boolean contains(int offset) {
            return offset >= start && offset < end;
        }
    }

    /**
     * Parameter list and body of a function-like declaration.
     */
    private record Shape(int paramsFrom, int paramsTo, int bodyStart, int bodyEnd, String returns) {}

    private record PendingReference(String sourceId, String chain, EdgeKind kind, int line, String classQn) {}

    @Override
    public Set<Language> languages() {
        return Set.of(Language.JAVASCRIPT, Language.TYPESCRIPT);
    }

    @Override
    public FileContribution extract(SourceDocument document) throws ParseException {
        return new Walk(document).run();
    }

    private static final class Walk {

        private final SourceDocument document;
        private final ContributionCollector collector;
        private final String extension;
        private final Map<String, Binding> bindings = new HashMap<>();
        private final List<Span> spans = new ArrayList<>();
        private final Set<Integer> declarationSites = new HashSet<>();
        private final Set<String> routers = new HashSet<>();
        private final Set<Integer> routeSites = new HashSet<>();
        private final List<PendingReference> pending = new ArrayList<>();
        private EcmaScriptSource source;
        private String masked;

        Walk(SourceDocument document) {
            this.document = document;
            this.collector = new ContributionCollector(document);
            String path = document.path();
            this.extension = path.substring(path.lastIndexOf('.') + 1).toLowerCase(Locale.ROOT);
        }

        FileContribution run() throws ParseException {
            source = EcmaScriptSource.parse(document.content(), !extension.equals("ts"));
            masked = source.masked();

            collectImports();
            collectFunctions();
            collectVariables();
            collectClasses();
            collectSchemas();
            collectDefaultExports();
            collectExpressRoutes();
            collectCalls();
            if (!extension.equals("ts")) {
                collectJsxUsage();
            }
            collectHttpCalls();
            resolvePending();
            return collector.finish();
        }

        // Imports

        private void collectImports() {
            String fileId = collector.fileNode().id();

            Matcher m = IMPORT_FROM.matcher(masked);
            while (m.find()) {
                String specifier = literal(m.start(2));
                if (specifier == null) {
                    continue;
                }
                int line = source.lineAt(m.start());
                String module = moduleOf(specifier);
                boolean external = isBare(specifier);
                String clause = m.group(1);

                Matcher named = NAMED_IMPORTS.matcher(clause);
                if (named.find()) {
                    for (String part : named.group(1).split(",")) {
                        Matcher spec = IMPORT_SPECIFIER.matcher(part.trim());
                        if (!spec.find()) {
                            continue;
                        }
                        String target = module + "." + spec.group(1);
                        collector.reference(fileId, List.of(target, module), EdgeKind.IMPORTS, line);
                        String local = spec.group(2) != null ? spec.group(2) : spec.group(1);
                        bindings.put(local, new Binding(target, module, external));
                    }
                }
                Matcher namespace = NAMESPACE_IMPORT.matcher(clause);
                if (namespace.find()) {
                    collector.reference(fileId, List.of(module), EdgeKind.IMPORTS, line);
                    bindings.put(namespace.group(1), new Binding(module, null, external));
                }
                Matcher defaultImport = DEFAULT_IMPORT.matcher(clause);
                if (defaultImport.find()) {
                    String target = module + ".default";
                    collector.reference(fileId, List.of(target, module), EdgeKind.IMPORTS, line);
                    // Usages must hit the default export itself, not the importing module
                    bindings.put(defaultImport.group(1), new Binding(target, null, external));
                }
            }

            importModules(IMPORT_BARE.matcher(masked), 1, fileId);
            importModules(EXPORT_FROM.matcher(masked), 1, fileId);
            importModules(IMPORT_DYNAMIC.matcher(masked), 1, fileId);

            Matcher require = REQUIRE.matcher(masked);
            while (require.find()) {
                String specifier = literal(require.start(2));
                if (specifier == null) {
                    continue;
                }
                String module = moduleOf(specifier);
                boolean external = isBare(specifier);
                collector.reference(fileId, List.of(module), EdgeKind.IMPORTS, source.lineAt(require.start()));
                String binding = require.group(1);
                if (binding == null) {
                    continue;
                }
                if (binding.startsWith("{")) {
                    for (String part : binding.substring(1, binding.length() - 1).split(",")) {
                        Matcher spec = IMPORT_SPECIFIER.matcher(part.trim());
                        if (spec.find()) {
                            String local = spec.group(2) != null ? spec.group(2) : spec.group(1);
                            bindings.put(local, new Binding(module + "." + spec.group(1), module, external));
                        }
                    }
                } else {
                    bindings.put(binding, new Binding(module, null, external));
                }
            }
        }

        private void importModules(Matcher m, int quoteGroup, String fileId) {
            while (m.find()) {
                String specifier = literal(m.start(quoteGroup));
                if (specifier != null && !specifier.contains("{param}")) {
                    collector.reference(fileId, List.of(moduleOf(specifier)), EdgeKind.IMPORTS,
                            source.lineAt(m.start()));
                }
            }
        }

        private String moduleOf(String specifier) {
            String module = ModuleNames.resolveEcmaScriptSpecifier(collector.path(), specifier);
            return module != null ? module : specifier;
        }

        private static boolean isBare(String specifier) {
            return !specifier.startsWith(".") && !specifier.startsWith("@/") && !specifier.startsWith("~/");
        }

        // Declarations

        private void collectFunctions() {
            Matcher m = FUNCTION_DECL.matcher(masked);
            while (m.find()) {
                if (source.braceDepthAt(m.start()) != 0) {
                    continue;
                }
                boolean isDefault = m.group(2) != null;
                String name = m.group(3) != null ? m.group(3) : (isDefault ? "default" : null);
                if (name == null) {
                    continue;
                }
                Shape shape = functionShape(m.end() - 1);
                if (shape == null) {
                    continue;
                }
                declareFunction(name, m.start(), m.group(3) != null ? m.start(3) : m.start(), shape, isDefault);
            }
        }

        private void collectVariables() {
            Matcher m = VARIABLE_DECL.matcher(masked);
            while (m.find()) {
                if (source.braceDepthAt(m.start()) != 0) {
                    continue;
                }
                Shape shape = shapeAt(m.end());
                if (shape != null) {
                    declareFunction(m.group(2), m.start(), m.start(2), shape, false);
                }
            }
        }

        private Node declareFunction(String name, int start, int nameOffset, Shape shape, boolean isDefault) {
            List<SignatureParam> params = parameters(shape.paramsFrom(), shape.paramsTo());
            String qualifiedName = collector.qualify(name);
            NodeKind kind = isComponent(name, shape) ? NodeKind.COMPONENT : NodeKind.FUNCTION;
            Node node = collector.declare(kind, qualifiedName, name, source.lineAt(start), params);
            if (isDefault && !name.equals("default")) {
                collector.alias(qualifiedName, collector.qualify("default"));
            }
            declarationSites.add(nameOffset);
            spans.add(new Span(start, shape.bodyEnd() + 1, node.id(), null));
            recordSignatureTypes(node.id(), params, shape.returns(), source.lineAt(start));
            return node;
        }

        private boolean isComponent(String name, Shape shape) {
            if (!Character.isUpperCase(name.charAt(0))) {
                return false;
            }
            if (JSX_EXTENSIONS.contains(extension)) {
                return true;
            }
            int end = Math.min(shape.bodyEnd() + 1, masked.length());
            return JSX_RETURN.matcher(masked.substring(shape.bodyStart(), end)).find();
        }

        private void collectClasses() {
            Matcher m = CLASS_DECL.matcher(masked);
            while (m.find()) {
                if (source.braceDepthAt(m.start()) != 0) {
                    continue;
                }
                int brace = masked.indexOf('{', m.end());
                if (brace < 0) {
                    continue;
                }
                int end = source.matchingClose(brace);
                if (end < 0) {
                    continue;
                }
                String name = m.group(3);
                String header = masked.substring(m.end(), brace);
                Matcher extendsMatch = EXTENDS.matcher(header);
                String superclass = extendsMatch.find() ? extendsMatch.group(1).replaceAll("\\s+", "") : null;
                boolean component = superclass != null
                        && COMPONENT_BASES.contains(ContributionCollector.lastSegment(superclass));

                String qualifiedName = collector.qualify(name);
                int line = source.lineAt(m.start());
                Node node = collector.declare(component ? NodeKind.COMPONENT : NodeKind.CLASS, qualifiedName, name,
                        line, List.of());
                if (m.group(2) != null) {
                    collector.alias(qualifiedName, collector.qualify("default"));
                }
                declarationSites.add(m.start(3));
                spans.add(new Span(m.start(), end + 1, node.id(), qualifiedName));

                if (superclass != null) {
                    pending.add(new PendingReference(node.id(), superclass, EdgeKind.IMPLEMENTS, line, null));
                }
                Matcher implementsMatch = IMPLEMENTS.matcher(header);
                if (implementsMatch.find()) {
                    for (String iface : implementsMatch.group(1).split(",")) {
                        String chain = stripTypeArguments(iface);
                        if (!chain.isEmpty()) {
                            pending.add(new PendingReference(node.id(), chain, EdgeKind.IMPLEMENTS, line, null));
                        }
                    }
                }
                collectMethods(qualifiedName, brace, end);
            }
        }

        private void collectMethods(String classQn, int brace, int end) {
            int memberDepth = source.braceDepthAt(brace) + 1;

            Matcher method = METHOD.matcher(masked);
            method.region(brace + 1, end);
            while (method.find()) {
                String name = method.group(1);
                if (source.braceDepthAt(method.start(1)) != memberDepth || METHOD_KEYWORDS.contains(name)) {
                    continue;
                }
                Shape shape = functionShape(method.end() - 1);
                if (shape != null && shape.bodyEnd() <= end) {
                    declareMember(classQn, name, method.start(1), shape);
                }
            }

            Matcher property = PROPERTY.matcher(masked);
            property.region(brace + 1, end);
            while (property.find()) {
                if (source.braceDepthAt(property.start(1)) != memberDepth) {
                    continue;
                }
                Shape shape = shapeAt(property.end());
                if (shape != null && shape.bodyEnd() <= end) {
                    declareMember(classQn, property.group(1), property.start(1), shape);
                }
            }
        }

        private void declareMember(String classQn, String name, int offset, Shape shape) {
            List<SignatureParam> params = parameters(shape.paramsFrom(), shape.paramsTo());
            int line = source.lineAt(offset);
            Node node = collector.declare(NodeKind.FUNCTION, classQn + "." + name, name, line, params);
            declarationSites.add(offset);
            spans.add(new Span(offset, shape.bodyEnd() + 1, node.id(), classQn));
            recordSignatureTypes(node.id(), params, shape.returns(), line);
        }

        private void collectSchemas() {
            Matcher iface = INTERFACE_DECL.matcher(masked);
            while (iface.find()) {
                if (source.braceDepthAt(iface.start()) != 0) {
                    continue;
                }
                int brace = masked.indexOf('{', iface.end());
                if (brace < 0) {
                    continue;
                }
                Node node = declareSchema(iface.group(1), iface.start(), iface.start(1), brace);
                if (node == null) {
                    continue;
                }
                Matcher parents = INTERFACE_EXTENDS.matcher(masked.substring(iface.end(), brace));
                if (parents.find()) {
                    for (String parent : parents.group(1).split(",")) {
                        String chain = stripTypeArguments(parent);
                        if (!chain.isEmpty()) {
                            pending.add(new PendingReference(node.id(), chain, EdgeKind.IMPLEMENTS,
                                    node.line(), null));
                        }
                    }
                }
            }

            Matcher alias = TYPE_OBJECT_DECL.matcher(masked);
            while (alias.find()) {
                if (source.braceDepthAt(alias.start()) == 0) {
                    declareSchema(alias.group(1), alias.start(), alias.start(1), alias.end() - 1);
                }
            }
        }

        private Node declareSchema(String name, int start, int nameOffset, int brace) {
            int end = source.matchingClose(brace);
            if (end < 0) {
                return null;
            }
            String text = source.text();
            List<SignatureParam> fields = new ArrayList<>();
            List<String> hints = new ArrayList<>();
            for (int[] part : Brackets.splitTopLevel(masked, brace + 1, end, ";,\n")) {
                Matcher member = MEMBER.matcher(masked.substring(part[0], part[1]));
                if (!member.find()) {
                    continue;
                }
                int hintStart = part[0] + member.start(2) + (member.group(2).equals(":") ? 1 : 0);
                String hint = text.substring(hintStart, part[1]).trim();
                fields.add(new SignatureParam(member.group(1), hint));
                hints.add(hint);
            }
            int line = source.lineAt(start);
            Node node = collector.declare(NodeKind.SCHEMA, collector.qualify(name), name, line, fields);
            declarationSites.add(nameOffset);
            spans.add(new Span(start, end + 1, node.id(), null));
            for (String hint : hints) {
                recordTypeReferences(node.id(), hint, line);
            }
            return node;
        }

        private void collectDefaultExports() {
            Matcher m = DEFAULT_EXPORT_NAME.matcher(masked);
            while (m.find()) {
                String qualifiedName = collector.qualify(m.group(1));
                if (collector.isDeclared(qualifiedName)) {
                    collector.alias(qualifiedName, collector.qualify("default"));
                }
            }
        }

        // Function shapes

        /**
         * Shape of a {@code function} whose parameter list opens at {@code open}.
         */
        private Shape functionShape(int open) {
            int close = source.matchingClose(open);
            if (close < 0) {
                return null;
            }
            int after = source.skipWhitespace(close + 1);
            if (after >= masked.length()) {
                return null;
            }
            String returns = null;
            int brace;
            if (masked.charAt(after) == ':') {
                brace = source.indexOfTopLevel('{', after + 1, masked.length());
                if (brace < 0 || masked.substring(after, brace).contains(";")) {
                    return null;
                }
                returns = source.text().substring(after + 1, brace).trim();
            } else if (masked.charAt(after) == '{') {
                brace = after;
            } else {
                return null;
            }
            int end = source.matchingClose(brace);
            return end < 0 ? null : new Shape(open + 1, close, brace, end, returns);
        }

        /**
         * Shape of a function expression, arrow function or memo/forwardRef wrapper starting
         * at {@code start}, or null if the expression there is not function-like.
         */
        private Shape shapeAt(int start) {
            int p = source.skipWhitespace(start);
            Matcher async = ASYNC.matcher(masked).region(p, masked.length());
            if (async.lookingAt()) {
                p = async.end();
            }
            if (p >= masked.length()) {
                return null;
            }
            if (masked.startsWith("function", p)) {
                int open = masked.indexOf('(', p);
                return open < 0 ? null : functionShape(open);
            }
            if (masked.charAt(p) == '(') {
                int close = source.matchingClose(p);
                if (close < 0) {
                    return null;
                }
                Matcher arrow = ARROW.matcher(masked).region(close + 1, masked.length());
                if (!arrow.lookingAt()) {
                    return null;
                }
                String returns = arrow.group(1) != null ? source.text().substring(arrow.start(1), arrow.end(1)) : null;
                return arrowShape(p + 1, close, arrow.end(), returns);
            }
            Matcher identArrow = IDENT_ARROW.matcher(masked).region(p, masked.length());
            if (identArrow.lookingAt()) {
                return arrowShape(identArrow.start(1), identArrow.end(1), identArrow.end(), null);
            }
            Matcher wrapper = WRAPPER.matcher(masked).region(p, masked.length());
            if (wrapper.lookingAt()) {
                int open = wrapper.end() - 1;
                int close = source.matchingClose(open);
                if (close < 0) {
                    return null;
                }
                Shape inner = shapeAt(open + 1);
                return inner != null
                        ? new Shape(inner.paramsFrom(), inner.paramsTo(), open, close, inner.returns())
                        : new Shape(open + 1, open + 1, open, close, null);
            }
            return null;
        }

        private Shape arrowShape(int paramsFrom, int paramsTo, int bodyFrom, String returns) {
            int body = source.skipWhitespace(bodyFrom);
            if (body >= masked.length()) {
                return null;
            }
            char c = masked.charAt(body);
            int end = c == '{' || c == '(' ? source.matchingClose(body) : source.statementEnd(body) - 1;
            if (end < body) {
                end = body;
            }
            return new Shape(paramsFrom, paramsTo, body, end, returns);
        }

        private List<SignatureParam> parameters(int from, int to) {
            List<SignatureParam> params = new ArrayList<>();
            if (to <= from) {
                return params;
            }
            String text = source.text();
            for (int[] part : Brackets.splitTopLevel(masked, from, to, ",")) {
                int equals = Brackets.indexOfTopLevel(masked, '=', part[0], part[1]);
                int end = equals < 0 ? part[1] : equals;
                int colon = Brackets.indexOfTopLevel(masked, ':', part[0], end);
                String name = text.substring(part[0], colon < 0 ? end : colon).trim()
                        .replaceAll("\\s+", " ")
                        .replaceFirst("^\\.\\.\\.", "");
                if (name.endsWith("?")) {
                    name = name.substring(0, name.length() - 1).trim();
                }
                if (name.isEmpty()) {
                    continue;
                }
                String hint = colon < 0 ? null : text.substring(colon + 1, end).trim();
                params.add(new SignatureParam(name, hint));
            }
            return params;
        }

        // Express routes

        private void collectExpressRoutes() {
            Matcher router = EXPRESS_ROUTER.matcher(masked);
            while (router.find()) {
                routers.add(router.group(1));
            }
            if (routers.isEmpty()) {
                return;
            }
            Matcher call = CLIENT_CALL.matcher(masked);
            while (call.find()) {
                if (!routers.contains(call.group(1))) {
                    continue;
                }
                int quote = source.skipWhitespace(call.end());
                String path = source.literalAt(quote);
                if (path == null) {
                    continue;
                }
                routeSites.add(call.start());
                int line = source.lineAt(call.start());
                HttpRoute route = new HttpRoute(call.group(2).toUpperCase(Locale.ROOT), path);
                Node endpoint = collector.declare(NodeKind.ENDPOINT, route.display(), route.display(), line,
                        List.of(), Set.of(), route);

                int close = source.matchingClose(call.end() - 1);
                int literalEnd = source.literalEnd(quote);
                if (close < 0 || literalEnd < 0) {
                    continue;
                }
                List<int[]> args = Brackets.splitTopLevel(masked, literalEnd + 1, close, ",");
                if (args.isEmpty()) {
                    continue;
                }
                int[] handler = args.get(args.size() - 1);
                String chain = masked.substring(handler[0], handler[1]).trim().replaceAll("\\s+", "");
                if (TYPE_NAME.matcher(chain).matches()) {
                    pending.add(new PendingReference(endpoint.id(), chain, EdgeKind.CALLS, line, null));
                } else {
                    spans.add(new Span(handler[0], handler[1], endpoint.id(), null));
                }
            }
        }

        // Calls, JSX and HTTP

        private void collectCalls() {
            Matcher m = CALL.matcher(masked);
            while (m.find()) {
                if (declarationSites.contains(m.start(1)) || precededByFunctionKeyword(m.start(1))) {
                    continue;
                }
                String chain = m.group(1).replaceAll("\\s+", "");
                Span span = spanAt(m.start());
                pending.add(new PendingReference(sourceIdOf(span), chain, EdgeKind.CALLS,
                        source.lineAt(m.start()), span != null ? span.classQn() : null));
            }
        }

        private void collectJsxUsage() {
            Matcher m = JSX_TAG.matcher(masked);
            while (m.find()) {
                int prev = m.start() - 1;
                while (prev >= 0 && Character.isWhitespace(masked.charAt(prev))) {
                    prev--;
                }
                if (prev >= 0) {
                    char c = masked.charAt(prev);
                    if (Character.isJavaIdentifierPart(c) && !JSX_KEYWORDS.contains(wordEndingAt(prev))) {
                        continue;
                    }
                    if (c == ')' || c == ']' || c == '.') {
                        continue;
                    }
                }
                Span span = spanAt(m.start());
                pending.add(new PendingReference(sourceIdOf(span), m.group(1), EdgeKind.CALLS,
                        source.lineAt(m.start()), null));
            }
        }

        private void collectHttpCalls() {
            Matcher fetch = FETCH.matcher(masked);
            while (fetch.find()) {
                int open = fetch.end() - 1;
                String url = urlArgument(fetch.end());
                if (url == null) {
                    continue;
                }
                int close = source.matchingClose(open);
                String verb = "GET";
                if (close > 0) {
                    Matcher method = FETCH_METHOD.matcher(source.text().substring(open, close));
                    if (method.find()) {
                        verb = method.group(2).toUpperCase(Locale.ROOT);
                    }
                }
                recordHttpCall(fetch.start(), verb, url);
            }

            Matcher client = CLIENT_CALL.matcher(masked);
            while (client.find()) {
                if (routeSites.contains(client.start()) || routers.contains(client.group(1))) {
                    continue;
                }
                String url = urlArgument(client.end());
                if (url != null && looksLikeUrl(url)) {
                    recordHttpCall(client.start(), client.group(2).toUpperCase(Locale.ROOT), url);
                }
            }
        }

        private String urlArgument(int from) {
            int quote = source.skipWhitespace(from);
            String url = source.literalAt(quote);
            if (url == null) {
                return null;
            }
            int after = source.skipWhitespace(source.literalEnd(quote) + 1);
            if (after < masked.length() && masked.charAt(after) == '+') {
                url = url + "{param}";
            }
            return url;
        }

        private static boolean looksLikeUrl(String url) {
            return url.startsWith("/") || url.startsWith("http://") || url.startsWith("https://")
                    || url.startsWith("{param}/");
        }

        private void recordHttpCall(int offset, String verb, String url) {
            collector.httpCall(sourceIdOf(spanAt(offset)), verb, url, source.lineAt(offset));
        }

        // Resolution

        private void recordSignatureTypes(String sourceId, List<SignatureParam> params, String returns, int line) {
            for (SignatureParam param : params) {
                recordTypeReferences(sourceId, param.typeHint(), line);
            }
            recordTypeReferences(sourceId, returns, line);
        }

        private void recordTypeReferences(String sourceId, String hint, int line) {
            if (hint == null || hint.isEmpty()) {
                return;
            }
            String withoutStrings = hint.replaceAll("(['\"`]).*?\\1", " ");
            Matcher name = TYPE_NAME.matcher(withoutStrings);
            while (name.find()) {
                pending.add(new PendingReference(sourceId, name.group(), EdgeKind.REFERENCES_SCHEMA, line, null));
            }
        }

        private void resolvePending() {
            for (PendingReference ref : pending) {
                String head = ref.chain().contains(".")
                        ? ref.chain().substring(0, ref.chain().indexOf('.'))
                        : ref.chain();
                Binding binding = bindings.get(head);
                if (ref.kind() == EdgeKind.REFERENCES_SCHEMA && binding != null && binding.external()) {
                    continue;
                }
                collector.reference(ref.sourceId(), candidates(ref.chain(), ref.classQn()), ref.kind(), ref.line());
            }
        }

        private List<String> candidates(String chain, String classQn) {
            String[] segments = chain.split("\\.");
            String head = segments[0];
            if (head.equals("this")) {
                if (classQn != null && segments.length == 2) {
                    return List.of(classQn + "." + segments[1]);
                }
                return List.of();
            }
            String base;
            String fallback = null;
            Binding binding = bindings.get(head);
            if (binding != null) {
                base = binding.target();
                fallback = binding.fallback();
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
            if (fallback != null && !result.contains(fallback)) {
                result.add(fallback);
            }
            return result;
        }

        private Span spanAt(int offset) {
            Span best = null;
            for (Span span : spans) {
                if (span.contains(offset) && (best == null || span.end() - span.start() < best.end() - best.start())) {
                    best = span;
                }
            }
            return best;
        }

        private String sourceIdOf(Span span) {
            return span != null ? span.sourceId() : collector.fileNode().id();
        }

        private String wordEndingAt(int end) {
            int start = end;
            while (start > 0 && Character.isJavaIdentifierPart(masked.charAt(start - 1))) {
                start--;
            }
            return masked.substring(start, end + 1);
        }

        private boolean precededByFunctionKeyword(int offset) {
            int i = offset - 1;
            while (i >= 0 && (Character.isWhitespace(masked.charAt(i)) || masked.charAt(i) == '*')) {
                i--;
            }
            return i >= 7 && masked.startsWith("function", i - 7)
                    && (i - 8 < 0 || !Character.isJavaIdentifierPart(masked.charAt(i - 8)));
        }

        private String literal(int quote) {
            return source.literalAt(quote);
        }

        private static String stripTypeArguments(String type) {
            String trimmed = type.trim();
            int angle = trimmed.indexOf('<');
            return (angle >= 0 ? trimmed.substring(0, angle) : trimmed).replaceAll("\\s+", "");
        }
    }
}
