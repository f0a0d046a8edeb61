package org.csu.svrf2pxl.codegen;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * @description: 操作映射表
 *
 * Maps each IR operation and measurement to a target-language template. The table is
 * supplied by the caller; the generator knows no target function names of its own.
 * Templates use {@code {0}}, {@code {1}}, ... for the node's operands followed by its
 * parameters, and {@code {args}} for all of them joined with {@code ", "}.
 */
@Getter
public class OperationTable {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\d+)}");
    private static final Pattern TEMPLATE_TOKEN = Pattern.compile("\\{(\\d+|args)}");
    private static final Pattern INFIX = Pattern.compile("^\\s*\\{0}\\s+([A-Za-z_][A-Za-z0-9_]*)\\s+\\{1}\\s*$");

    private final String name;
    private final List<String> header;
    private final List<String> footer;
    private final Map<OperationKey, String> templates;

    public OperationTable(String name, List<String> header, List<String> footer, Map<OperationKey, String> templates) {
        this.name = name;
        this.header = List.copyOf(header);
        this.footer = List.copyOf(footer);
        this.templates = Collections.unmodifiableMap(new LinkedHashMap<>(templates));
    }

    /**
     * Finds the template for {@code kind} with exactly {@code arity} operands, falling back to
     * the arity-free entry.
     */
    public Optional<String> lookup(String kind, int arity) {
        String exact = templates.get(new OperationKey(kind, arity));
        if (exact != null) {
            return Optional.of(exact);
        }
        return Optional.ofNullable(templates.get(OperationKey.any(kind)));
    }

    /**
     * Fills a template's placeholders in one pass, so argument text is never substituted again.
     *
     * @throws IllegalArgumentException if the template asks for more arguments than given
     */
    public static String render(String template, List<String> arguments) {
        Matcher matcher = TEMPLATE_TOKEN.matcher(template);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String token = matcher.group(1);
            String value;
            if (token.equals("args")) {
                value = String.join(", ", arguments);
            } else {
                int index = Integer.parseInt(token);
                if (index >= arguments.size()) {
                    throw new IllegalArgumentException("Template '" + template + "' needs argument {" + index
                            + "} but only " + arguments.size() + " given");
                }
                value = arguments.get(index);
            }
            matcher.appendReplacement(sb, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    /**
     * Number of positional arguments a template consumes, i.e. highest placeholder + 1.
     */
    public static int placeholderCount(String template) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        int max = -1;
        while (matcher.find()) {
            max = Math.max(max, Integer.parseInt(matcher.group(1)));
        }
        return max + 1;
    }

    /**
     * Inverse of {@link #render}: matches target text against a template and returns the
     * argument bound to each placeholder index, or empty when the text has another shape.
     * A placeholder repeated in the template must bind the same text each time.
     */
    public static Optional<List<String>> match(String template, String text) {
        boolean variadic = template.contains("{args}");
        Matcher matcher = compile(template).matcher(text);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        if (variadic) {
            return Optional.of(splitArguments(matcher.group("args")));
        }
        List<String> arguments = new ArrayList<>();
        for (int i = 0; i < placeholderCount(template); i++) {
            String value = matcher.group("a" + i);
            arguments.add(value == null ? "" : value.replace("\\\"", "\"").replace("\\\\", "\\"));
        }
        return Optional.of(arguments);
    }

    /**
     * Splits {@code a, f(b, c), "x, y"} at top-level commas.
     */
    public static List<String> splitArguments(String text) {
        List<String> parts = new ArrayList<>();
        if (text.isBlank()) {
            return parts;
        }
        int depth = 0;
        boolean quoted = false;
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"' && (i == 0 || text.charAt(i - 1) != '\\')) {
                quoted = !quoted;
            } else if (!quoted && c == '(') {
                depth++;
            } else if (!quoted && c == ')') {
                depth--;
            } else if (!quoted && depth == 0 && c == ',') {
                parts.add(current.toString().trim());
                current.setLength(0);
                continue;
            }
            current.append(c);
        }
        parts.add(current.toString().trim());
        return parts;
    }

    private static Pattern compile(String template) {
        StringBuilder regex = new StringBuilder("\\s*");
        Matcher matcher = TEMPLATE_TOKEN.matcher(template);
        Set<String> bound = new HashSet<>();
        int last = 0;
        while (matcher.find()) {
            String literal = template.substring(last, matcher.start());
            appendLiteral(regex, literal, template, last);
            String index = matcher.group(1);
            if (index.equals("args")) {
                regex.append("(?<args>.*?)");
            } else if (!bound.add(index)) {
                regex.append("\\k<a").append(index).append('>');
            } else if (literal.endsWith("\"")) {
                regex.append("(?<a").append(index).append(">(?:[^\"\\\\]|\\\\.)*)");
            } else {
                regex.append("(?<a").append(index).append(">\"(?:[^\"\\\\]|\\\\.)*\"|[^\\s,()\"]+)");
            }
            last = matcher.end();
        }
        appendLiteral(regex, template.substring(last), template, last);
        return Pattern.compile(regex.append("\\s*").toString());
    }

    private static void appendLiteral(StringBuilder regex, String literal, String template, int offset) {
        int i = 0;
        while (i < literal.length()) {
            char c = literal.charAt(i);
            if (Character.isWhitespace(c)) {
                int end = i;
                while (end < literal.length() && Character.isWhitespace(literal.charAt(end))) {
                    end++;
                }
                char before = offset + i > 0 ? template.charAt(offset + i - 1) : ' ';
                char after = offset + end < template.length() ? template.charAt(offset + end) : ' ';
                // a word operator needs real separation from its operands
                boolean word = Character.isLetterOrDigit(before) || Character.isLetterOrDigit(after);
                regex.append(word ? "\\s+" : "\\s*");
                i = end;
                continue;
            }
            if (Character.isLetterOrDigit(c) || c == '_' || c == '"') {
                regex.append(Pattern.quote(String.valueOf(c)));
            } else {
                regex.append("\\s*").append(Pattern.quote(String.valueOf(c))).append("\\s*");
            }
            i++;
        }
    }

    /**
     * Reverse index from infix operator word (e.g. {@code and}) to the kind using it.
     */
    public Map<String, OperationKey> infixIndex() {
        Map<String, OperationKey> index = new LinkedHashMap<>();
        templates.forEach((key, template) -> {
            Matcher matcher = INFIX.matcher(template);
            if (matcher.matches()) {
                index.putIfAbsent(matcher.group(1).toLowerCase(), key);
            }
        });
        return index;
    }
}
