package org.csu.svrf2pxl.target;

import lombok.extern.slf4j.Slf4j;
import org.csu.svrf2pxl.codegen.OperationKey;
import org.csu.svrf2pxl.codegen.OperationTable;
import org.csu.svrf2pxl.codegen.PxlCodeGenerator;
import org.csu.svrf2pxl.common.diagnostic.Diagnostic;
import org.csu.svrf2pxl.common.diagnostic.DiagnosticKind;
import org.csu.svrf2pxl.compiler.ir.IrBuildResult;
import org.csu.svrf2pxl.compiler.ir.IrGraph;
import org.csu.svrf2pxl.compiler.ir.node.CheckNode;
import org.csu.svrf2pxl.compiler.ir.node.Comparator;
import org.csu.svrf2pxl.compiler.ir.node.DerivedNode;
import org.csu.svrf2pxl.compiler.ir.node.ExternalNode;
import org.csu.svrf2pxl.compiler.ir.node.IrNode;
import org.csu.svrf2pxl.compiler.ir.node.LayerNode;
import org.csu.svrf2pxl.compiler.ir.node.Measurement;
import org.csu.svrf2pxl.compiler.ir.node.OpaqueNode;
import org.csu.svrf2pxl.compiler.ir.node.Operation;
import org.csu.svrf2pxl.compiler.lexer.Lexer;
import org.csu.svrf2pxl.compiler.lexer.Token;
import org.csu.svrf2pxl.compiler.lexer.TokenType;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * @description: 读取已有的 PXL 规则文件
 *
 * Reads a hand-written or previously generated PXL deck into an {@link IrGraph} so it can be
 * compared with a translated SVRF deck. Statements are recognized by matching them against
 * the operation table's templates, the same table the generator writes with.
 * <p>
 * Names the deck uses without defining (typically from an {@code #include}) become
 * {@link ExternalNode}s. Statements that fit no template are kept as {@link OpaqueNode}s.
 * A derived layer named {@code <owner>_t<n>} that only {@code <owner>} reads is taken to be a
 * hoisted temporary and marked synthetic, as the translator marks its own.
 */
@Slf4j
public class PxlDeckReader {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern TEMPORARY = Pattern.compile("(.+)_t\\d+");
    private static final Set<String> MEASUREMENTS = Arrays.stream(Measurement.values())
            .map(Enum::name).collect(Collectors.toSet());
    private static final Set<String> OPERATIONS = Arrays.stream(Operation.values())
            .map(Enum::name).collect(Collectors.toSet());

    private final OperationTable table;

    public PxlDeckReader(OperationTable table) {
        this.table = table;
    }

    public IrBuildResult read(Path file) throws IOException {
        return read(Files.readString(file, StandardCharsets.UTF_8));
    }

    /**
     * @throws org.csu.svrf2pxl.common.exception.LexException if the text cannot be tokenized
     * @throws org.csu.svrf2pxl.common.exception.CyclicDefinitionException if definitions are circular
     */
    public IrBuildResult read(String text) {
        List<List<Token>> statements = split(new Lexer(text).tokenize());
        List<Diagnostic> diagnostics = new ArrayList<>();

        // 第一遍: 收集 drc_deck 注册, 用于给检查和派生层加上规则名
        Map<String, Registration> registrations = new LinkedHashMap<>();
        List<List<Token>> definitions = new ArrayList<>();
        for (List<Token> statement : statements) {
            if (statement.size() >= 3 && statement.get(0).type().isWord()
                    && statement.get(1).type() == TokenType.ASSIGN) {
                definitions.add(statement);
                continue;
            }
            Optional<Registration> registration = registration(statement);
            if (registration.isPresent()) {
                registrations.putIfAbsent(registration.get().symbol(), registration.get());
            } else {
                diagnostics.add(Diagnostic.of(DiagnosticKind.UNSUPPORTED_CONSTRUCT, statement.get(0).line(), null,
                        "Unrecognized statement skipped: " + render(statement)));
            }
        }

        Map<String, IrNode> nodes = new LinkedHashMap<>();
        for (List<Token> statement : definitions) {
            String name = statement.get(0).lexeme();
            int line = statement.get(0).line();
            if (nodes.containsKey(name)) {
                diagnostics.add(Diagnostic.of(DiagnosticKind.UNSUPPORTED_CONSTRUCT, line, name,
                        "Redefinition of '" + name + "' ignored; the first definition is kept."));
                continue;
            }
            IrNode node = definition(name, line, statement.subList(2, statement.size()), registrations.get(name));
            if (node instanceof OpaqueNode opaque) {
                diagnostics.add(Diagnostic.of(DiagnosticKind.UNSUPPORTED_CONSTRUCT, line, name, opaque.getReason()));
            }
            nodes.put(name, node);
        }

        markTemporaries(nodes);

        for (Registration registration : registrations.values()) {
            if (!nodes.containsKey(registration.symbol())) {
                diagnostics.add(Diagnostic.of(DiagnosticKind.UNRESOLVED_REFERENCE, registration.line(),
                        registration.symbol(), "Rule " + registration.rule() + " reports undefined '"
                                + registration.symbol() + "'."));
            }
        }

        Map<String, IrNode> external = new LinkedHashMap<>();
        for (IrNode node : nodes.values()) {
            for (String dependency : node.getDependencies()) {
                if (!nodes.containsKey(dependency) && !external.containsKey(dependency)) {
                    external.put(dependency, new ExternalNode(dependency));
                    diagnostics.add(Diagnostic.of(DiagnosticKind.UNRESOLVED_REFERENCE, node.getLine(), dependency,
                            "'" + dependency + "' is used by '" + node.getSymbol()
                                    + "' but not defined in this deck."));
                }
            }
        }
        List<IrNode> all = new ArrayList<>(external.values());
        all.addAll(nodes.values());
        IrGraph graph = new IrGraph(all);
        log.debug("Read PXL deck: {} definitions, {} registrations, {} external names",
                nodes.size(), registrations.size(), external.size());
        return new IrBuildResult(graph, List.copyOf(diagnostics), Set.of(), List.of());
    }

    private static void markTemporaries(Map<String, IrNode> nodes) {
        Map<String, Set<String>> readers = new HashMap<>();
        for (IrNode node : nodes.values()) {
            for (String dependency : node.getDependencies()) {
                readers.computeIfAbsent(dependency, k -> new HashSet<>()).add(node.getSymbol());
            }
        }
        for (Map.Entry<String, IrNode> entry : nodes.entrySet()) {
            Matcher matcher = TEMPORARY.matcher(entry.getKey());
            if (!(entry.getValue() instanceof DerivedNode derived) || !matcher.matches()) {
                continue;
            }
            String owner = matcher.group(1);
            Set<String> users = readers.getOrDefault(entry.getKey(), Set.of());
            // a temporary may feed a later temporary of the same owner
            boolean ownedOnly = nodes.containsKey(owner) && !users.isEmpty()
                    && users.stream().allMatch(user -> user.equals(owner) || isTemporaryOf(user, owner));
            if (ownedOnly) {
                entry.setValue(new DerivedNode(derived.getSymbol(), derived.getLine(), true, derived.getOperation(),
                        derived.getOperands(), derived.getParameters(), derived.getFunctionName(),
                        derived.getRuleName(), derived.getMessage()));
            }
        }
    }

    private static boolean isTemporaryOf(String symbol, String owner) {
        Matcher matcher = TEMPORARY.matcher(symbol);
        return matcher.matches() && matcher.group(1).equals(owner);
    }

    private Optional<Registration> registration(List<Token> statement) {
        Optional<String> template = table.lookup(PxlCodeGenerator.REPORT_KIND, 1);
        if (template.isEmpty()) {
            return Optional.empty();
        }
        return OperationTable.match(template.get(), render(statement))
                .filter(args -> args.size() >= 3 && isIdentifier(args.get(0)))
                .map(args -> new Registration(args.get(0), args.get(1), args.get(2), statement.get(0).line()));
    }

    private IrNode definition(String name, int line, List<Token> rhs, Registration registration) {
        String rhsText = render(rhs);
        int comparator = topLevelComparator(rhs);
        if (comparator > 0) {
            return check(name, line, rhs, comparator, registration);
        }

        Optional<DerivedNode> chain = infixChain(name, line, rhs, registration);
        if (chain.isPresent()) {
            return chain.get();
        }

        Optional<String> layerTemplate = table.lookup(PxlCodeGenerator.LAYER_KIND, 0);
        if (layerTemplate.isPresent()) {
            Optional<List<String>> args = OperationTable.match(layerTemplate.get(), rhsText);
            if (args.isPresent() && args.get().size() == 2) {
                try {
                    return new LayerNode(name, line, Integer.parseInt(args.get().get(0)),
                            Integer.parseInt(args.get().get(1)));
                } catch (NumberFormatException e) {
                    return new OpaqueNode(name, line, false, rhsText, "Layer numbers are not integers: " + rhsText);
                }
            }
        }

        for (Map.Entry<OperationKey, String> entry : table.getTemplates().entrySet()) {
            if (!OPERATIONS.contains(entry.getKey().kind())) {
                continue;
            }
            Optional<Bound> bound = bind(entry.getKey(), entry.getValue(), rhsText);
            if (bound.isPresent()) {
                Operation operation = Operation.valueOf(entry.getKey().kind());
                return derived(name, line, operation, bound.get(), null, registration);
            }
        }

        if (rhs.size() >= 3 && rhs.get(0).type().isWord() && rhs.get(1).type() == TokenType.LPAREN
                && rhs.get(rhs.size() - 1).type() == TokenType.RPAREN) {
            String inside = render(rhs.subList(2, rhs.size() - 1));
            List<String> operands = new ArrayList<>();
            List<String> parameters = new ArrayList<>();
            for (String argument : OperationTable.splitArguments(inside)) {
                (isIdentifier(argument) ? operands : parameters).add(argument);
            }
            return derived(name, line, Operation.EXTERNAL_FUNCTION, new Bound(operands, parameters),
                    rhs.get(0).lexeme(), registration);
        }
        return new OpaqueNode(name, line, false, rhsText, "Unrecognized expression: " + rhsText);
    }

    private IrNode check(String name, int line, List<Token> rhs, int comparatorIndex, Registration registration) {
        String rhsText = render(rhs);
        List<Token> value = rhs.subList(comparatorIndex + 1, rhs.size());
        Optional<Comparator> comparator = Comparator.fromSymbol(rhs.get(comparatorIndex).lexeme());
        if (value.size() != 1 || value.get(0).type() != TokenType.NUMBER || comparator.isEmpty()) {
            return new OpaqueNode(name, line, false, rhsText, "Unrecognized check: " + rhsText);
        }
        String measured = render(rhs.subList(0, comparatorIndex));
        for (Map.Entry<OperationKey, String> entry : table.getTemplates().entrySet()) {
            if (!MEASUREMENTS.contains(entry.getKey().kind())) {
                continue;
            }
            Optional<Bound> bound = bind(entry.getKey(), entry.getValue(), measured);
            if (bound.isEmpty()) {
                continue;
            }
            Measurement measurement = Measurement.valueOf(entry.getKey().kind());
            double threshold = toMicrons(value.get(0).lexeme());
            String rule = registration != null ? registration.rule() : name;
            String message = registration != null ? registration.message()
                    : CheckNode.defaultMessage(measurement, comparator.get(), threshold);
            return new CheckNode(name, line, measurement, bound.get().operands(), bound.get().parameters(),
                    comparator.get(), threshold, rule, message);
        }
        return new OpaqueNode(name, line, false, rhsText, "Unrecognized measurement in check: " + measured);
    }

    /**
     * {@code a and b and c} style chains of one infix operator word.
     */
    private Optional<DerivedNode> infixChain(String name, int line, List<Token> rhs, Registration registration) {
        for (Map.Entry<String, OperationKey> entry : table.infixIndex().entrySet()) {
            if (!OPERATIONS.contains(entry.getValue().kind())) {
                continue;
            }
            Operation operation = Operation.valueOf(entry.getValue().kind());
            List<String> parts = new ArrayList<>();
            boolean atoms = true;
            int start = 0;
            for (int i = 0; i <= rhs.size(); i++) {
                if (i == rhs.size() || rhs.get(i).lexeme().equalsIgnoreCase(entry.getKey())) {
                    List<Token> part = rhs.subList(start, i);
                    if (part.size() != 1 || !isIdentifier(part.get(0).lexeme())) {
                        atoms = false;
                        break;
                    }
                    parts.add(part.get(0).lexeme());
                    start = i + 1;
                }
            }
            if (atoms && (parts.size() == 2 || (parts.size() > 2 && operation.isAssociative()))) {
                return Optional.of(derived(name, line, operation, new Bound(parts, List.of()), null, registration));
            }
        }
        return Optional.empty();
    }

    /**
     * Matches {@code text} against one template and splits the bound arguments into layer
     * operands and trailing parameters.
     */
    private Optional<Bound> bind(OperationKey key, String template, String text) {
        Optional<List<String>> matched = OperationTable.match(template, text);
        if (matched.isEmpty()) {
            return Optional.empty();
        }
        List<String> args = matched.get();
        int operands;
        if (key.arity() != OperationKey.ANY_ARITY) {
            operands = key.arity();
        } else if (template.contains("{args}")) {
            operands = (int) args.stream().takeWhile(PxlDeckReader::isIdentifier).count();
        } else {
            operands = OperationTable.placeholderCount(template);
        }
        if (operands == 0 || operands > args.size()
                || !args.subList(0, operands).stream().allMatch(PxlDeckReader::isIdentifier)) {
            return Optional.empty();
        }
        return Optional.of(new Bound(args.subList(0, operands), args.subList(operands, args.size())));
    }

    private static DerivedNode derived(String name, int line, Operation operation, Bound bound,
                                       String functionName, Registration registration) {
        return new DerivedNode(name, line, false, operation, bound.operands(), bound.parameters(), functionName,
                registration != null ? registration.rule() : null,
                registration != null ? registration.message() : null);
    }

    private static int topLevelComparator(List<Token> tokens) {
        int depth = 0;
        for (int i = 0; i < tokens.size(); i++) {
            TokenType type = tokens.get(i).type();
            if (type == TokenType.LPAREN) {
                depth++;
            } else if (type == TokenType.RPAREN) {
                depth--;
            } else if (depth == 0 && type.isComparator()) {
                return i;
            }
        }
        return -1;
    }

    private static List<List<Token>> split(List<Token> tokens) {
        List<List<Token>> statements = new ArrayList<>();
        List<Token> current = new ArrayList<>();
        for (Token token : tokens) {
            switch (token.type()) {
                case COMMENT, DIRECTIVE, DESCRIPTION -> {
                    // not statements
                }
                case SEMICOLON, EOF -> {
                    if (!current.isEmpty()) {
                        statements.add(current);
                        current = new ArrayList<>();
                    }
                }
                default -> current.add(token);
            }
        }
        return statements;
    }

    /**
     * Re-renders tokens in the spacing the generator uses, quoting strings again.
     */
    static String render(List<Token> tokens) {
        StringBuilder sb = new StringBuilder();
        Token previous = null;
        for (Token token : tokens) {
            if (previous != null && spaced(previous, token)) {
                sb.append(' ');
            }
            if (token.type() == TokenType.STRING) {
                sb.append('"').append(token.lexeme().replace("\\", "\\\\").replace("\"", "\\\"")).append('"');
            } else {
                sb.append(token.lexeme());
            }
            previous = token;
        }
        return sb.toString();
    }

    private static boolean spaced(Token previous, Token token) {
        TokenType type = token.type();
        if (type == TokenType.RPAREN || type == TokenType.COMMA || previous.type() == TokenType.LPAREN) {
            return false;
        }
        if (type == TokenType.LPAREN && previous.type().isWord()) {
            return false;
        }
        return !(previous.type() == TokenType.OPERATOR && type == TokenType.OPERATOR);
    }

    private static double toMicrons(String lexeme) {
        String lower = lexeme.toLowerCase();
        if (lower.endsWith("nm")) {
            return new BigDecimal(lexeme.substring(0, lexeme.length() - 2)).movePointLeft(3).doubleValue();
        }
        if (lower.endsWith("um")) {
            return new BigDecimal(lexeme.substring(0, lexeme.length() - 2)).doubleValue();
        }
        return new BigDecimal(lexeme).doubleValue();
    }

    private static boolean isIdentifier(String text) {
        return IDENTIFIER.matcher(text).matches();
    }

    private record Registration(String symbol, String rule, String message, int line) {
    }

    private record Bound(List<String> operands, List<String> parameters) {
    }
}
