package io.ailang.core.parse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.ailang.core.error.TaskSyntaxException;
import io.ailang.core.model.Action;
import io.ailang.core.model.ComparisonOp;
import io.ailang.core.model.Condition;
import io.ailang.core.model.ConditionalAction;
import io.ailang.core.model.EdgeDecl;
import io.ailang.core.model.Expression;
import io.ailang.core.model.ModelSpec;
import io.ailang.core.model.NodeDecl;
import io.ailang.core.model.Statement;
import io.ailang.core.model.TaskProgram;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses AILang task source into a {@link TaskProgram}.
 *
 * <p>The grammar is line-oriented: after the mandatory {@code @id:} header every significant line
 * is one statement, classified by its prefix:
 *
 * <pre>
 * %in:            input block (JSON, may span lines up to the next directive)
 * %model:type{k=v,...}
 * %out: name
 * +name:type[range]
 * ->from=>to
 * ?lhs [op rhs]
 * !if cond then (emit name | log "msg" | set name=value)
 * let name = expr
 * </pre>
 *
 * <p>Blank lines and lines starting with {@code #} are skipped. The first error aborts parsing with
 * a {@link TaskSyntaxException} naming the line.
 *
 * <p>Thread-safe: each {@link #parse(String)} call works on its own cursor.
 */
public final class TaskParser {

    private static final ObjectMapper JSON = new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private static final String IDENT = "[A-Za-z_][\\w-]*";

    private static final Pattern SKIPPABLE = Pattern.compile("^\\s*(#.*)?$");
    private static final Pattern TASK_HEADER = Pattern.compile("^@(" + IDENT + "):\\s*$");
    private static final Pattern DIRECTIVE = Pattern.compile("^(%in:|%model:|%out:|@|\\+|->|\\?|!|let\\b)");
    private static final Pattern MODEL = Pattern.compile("^%model:(" + IDENT + ")\\s*(\\{.*\\})?\\s*$");
    private static final Pattern OUT = Pattern.compile("^%out:\\s*(" + IDENT + ")\\s*$");
    private static final Pattern NODE = Pattern.compile("^\\+(" + IDENT + "):(" + IDENT + ")(\\[(.+?)\\])?\\s*$");
    private static final Pattern EDGE = Pattern.compile("^->\\s*(" + IDENT + ")\\s*=>\\s*(" + IDENT + ")\\s*$");
    private static final Pattern CONDITION =
            Pattern.compile("^(" + IDENT + ")(?:\\s*(==|=|>=|<=|>|<)\\s*(.+))?$");
    private static final Pattern ACTION_LINE = Pattern.compile("^!\\s*if\\s+(.+?)\\s+then\\s+(.+?)\\s*$");
    private static final Pattern EMIT = Pattern.compile("^emit\\s+(" + IDENT + ")\\s*$");
    private static final Pattern LOG = Pattern.compile("^log\\s+(\"[^\"]*\"|'[^']*')\\s*$");
    private static final Pattern SET = Pattern.compile("^set\\s+(" + IDENT + ")\\s*=\\s*(.+?)\\s*$");
    private static final Pattern LET = Pattern.compile("^let\\s+(" + IDENT + ")\\s*=\\s*(.+?)\\s*$");

    /**
     * Parses task source text.
     *
     * @param source the full source text
     * @return the parsed program
     * @throws TaskSyntaxException on the first malformed or duplicate statement
     */
    public TaskProgram parse(String source) {
        Objects.requireNonNull(source, "source must not be null");
        return new Cursor(source).parseProgram();
    }

    /** Per-call scanning state. */
    private static final class Cursor {

        private final String[] lines;
        private int index;
        private String taskId;

        private JsonNode input;
        private ModelSpec model;
        private String out;
        private final List<NodeDecl> nodes = new ArrayList<>();
        private final List<EdgeDecl> edges = new ArrayList<>();
        private final List<Condition> conditions = new ArrayList<>();
        private final List<ConditionalAction> actions = new ArrayList<>();
        private final List<Statement> sourceOrder = new ArrayList<>();

        Cursor(String source) {
            this.lines = source.replace("\r\n", "\n").split("\n", -1);
        }

        TaskProgram parseProgram() {
            skipInsignificant();
            if (index >= lines.length || !lines[index].strip().startsWith("@")) {
                int lineNumber = Math.min(index, lines.length - 1) + 1;
                throw error("Expected task declaration like \"@task_id:\"", lineNumber, currentOrNull());
            }
            String header = lines[index].strip();
            Matcher m = TASK_HEADER.matcher(header);
            if (!m.matches()) {
                throw error("Invalid task declaration", index + 1, lines[index]);
            }
            taskId = m.group(1);
            index++;

            while (true) {
                skipInsignificant();
                if (index >= lines.length) {
                    break;
                }
                parseStatement();
            }

            return new TaskProgram(taskId, input, model, out, nodes, edges, conditions, actions, sourceOrder);
        }

        private void parseStatement() {
            int lineNumber = index + 1;
            String raw = lines[index];
            String t = raw.strip();

            if (t.startsWith("%in:")) {
                index++;
                JsonNode payload = readInputPayload(t.substring("%in:".length()), lineNumber, raw);
                if (input != null) {
                    throw error("Duplicate %in block", lineNumber, raw);
                }
                input = payload;
                sourceOrder.add(new Statement.Input(lineNumber, payload));
                return;
            }
            index++;
            if (t.startsWith("%model:")) {
                ModelSpec spec = parseModel(t, lineNumber, raw);
                if (model != null) {
                    throw error("Duplicate %model block", lineNumber, raw);
                }
                model = spec;
                sourceOrder.add(new Statement.Model(lineNumber, spec));
            } else if (t.startsWith("%out:")) {
                Matcher m = OUT.matcher(t);
                if (!m.matches()) {
                    throw error("Invalid out block", lineNumber, raw);
                }
                if (out != null) {
                    throw error("Duplicate %out block", lineNumber, raw);
                }
                out = m.group(1);
                sourceOrder.add(new Statement.Out(lineNumber, out));
            } else if (t.startsWith("+")) {
                Matcher m = NODE.matcher(t);
                if (!m.matches()) {
                    throw error("Invalid node declaration: " + t, lineNumber, raw);
                }
                NodeDecl node = new NodeDecl(m.group(1), m.group(2), m.group(4));
                nodes.add(node);
                sourceOrder.add(new Statement.Node(lineNumber, node));
            } else if (t.startsWith("->")) {
                Matcher m = EDGE.matcher(t);
                if (!m.matches()) {
                    throw error("Invalid edge declaration: " + t, lineNumber, raw);
                }
                EdgeDecl edge = new EdgeDecl(m.group(1), m.group(2));
                edges.add(edge);
                sourceOrder.add(new Statement.Edge(lineNumber, edge));
            } else if (t.startsWith("?")) {
                Condition condition = parseCondition(t.substring(1).strip(), lineNumber, raw);
                conditions.add(condition);
                sourceOrder.add(new Statement.Cond(lineNumber, condition));
            } else if (t.startsWith("!")) {
                Matcher m = ACTION_LINE.matcher(t);
                if (!m.matches()) {
                    throw error("Invalid action statement: " + t, lineNumber, raw);
                }
                Condition condition = parseCondition(m.group(1).strip(), lineNumber, raw);
                Action action = parseAction(m.group(2).strip(), lineNumber, raw);
                ConditionalAction conditional = new ConditionalAction(condition, action);
                actions.add(conditional);
                sourceOrder.add(new Statement.Conditional(lineNumber, conditional));
            } else if (t.startsWith("let ")) {
                Matcher m = LET.matcher(t);
                if (!m.matches()) {
                    throw error("Invalid let statement: " + t, lineNumber, raw);
                }
                Expression expression;
                try {
                    expression = ExpressionParser.parse(m.group(2));
                } catch (TaskSyntaxException e) {
                    throw new TaskSyntaxException(e.getMessage() + " (line " + lineNumber + ")", e, taskId, lineNumber, raw);
                }
                sourceOrder.add(new Statement.Let(lineNumber, m.group(1), expression));
            } else {
                throw error("Unknown statement: " + t, lineNumber, raw);
            }
        }

        /**
         * Reads the {@code %in} payload: text after the colon on the opening line plus every
         * following line up to the next directive. Comment lines inside the block are dropped.
         */
        private JsonNode readInputPayload(String inline, int lineNumber, String raw) {
            StringBuilder buf = new StringBuilder(inline);
            while (index < lines.length) {
                String t = lines[index].strip();
                if (DIRECTIVE.matcher(t).find()) {
                    break;
                }
                if (!t.startsWith("#")) {
                    buf.append('\n').append(lines[index]);
                }
                index++;
            }
            String payload = buf.toString().strip();
            if (payload.isEmpty()) {
                throw error("Empty %in block", lineNumber, raw);
            }
            try {
                return JSON.readTree(payload);
            } catch (JsonProcessingException e) {
                throw new TaskSyntaxException("Invalid %in JSON payload (line " + lineNumber + ")", e, taskId, lineNumber, raw);
            }
        }

        private ModelSpec parseModel(String t, int lineNumber, String raw) {
            Matcher m = MODEL.matcher(t);
            if (!m.matches()) {
                throw error("Invalid model block", lineNumber, raw);
            }
            Map<String, JsonNode> args = new LinkedHashMap<>();
            String block = m.group(2);
            if (block != null) {
                String inner = block.substring(1, block.length() - 1).strip();
                if (!inner.isEmpty()) {
                    for (String kv : splitTopLevel(inner)) {
                        int eq = kv.indexOf('=');
                        if (eq < 0 || kv.substring(0, eq).isBlank()) {
                            throw error("Invalid model arg: " + kv, lineNumber, raw);
                        }
                        args.put(kv.substring(0, eq).strip(), Scalars.parse(kv.substring(eq + 1)));
                    }
                }
            }
            return new ModelSpec(m.group(1), args);
        }

        private Condition parseCondition(String text, int lineNumber, String raw) {
            Matcher m = CONDITION.matcher(text);
            if (!m.matches()) {
                throw error("Invalid condition: " + text, lineNumber, raw);
            }
            if (m.group(2) == null) {
                return Condition.truthy(m.group(1));
            }
            return new Condition(m.group(1), ComparisonOp.fromSymbol(m.group(2)), Scalars.parse(m.group(3)));
        }

        private Action parseAction(String text, int lineNumber, String raw) {
            Matcher m = EMIT.matcher(text);
            if (m.matches()) {
                return new Action.Emit(m.group(1));
            }
            m = LOG.matcher(text);
            if (m.matches()) {
                return new Action.Log(Scalars.stripQuotes(m.group(1)));
            }
            m = SET.matcher(text);
            if (m.matches()) {
                return new Action.Set(m.group(1), Scalars.parse(m.group(2)));
            }
            throw error("Unknown action: " + text, lineNumber, raw);
        }

        private void skipInsignificant() {
            while (index < lines.length && SKIPPABLE.matcher(lines[index]).matches()) {
                index++;
            }
        }

        private String currentOrNull() {
            return index < lines.length ? lines[index] : null;
        }

        private TaskSyntaxException error(String message, int lineNumber, String line) {
            return new TaskSyntaxException(message + " (line " + lineNumber + ")", taskId, lineNumber, line);
        }
    }

    /**
     * Splits model arguments on commas that are outside quotes and not nested in braces, brackets
     * or parentheses. Empty trailing segments are dropped.
     */
    static List<String> splitTopLevel(String s) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int depth = 0;
        char quote = 0;
        for (int i = 0; i < s.length(); i++) {
            char ch = s.charAt(i);
            if (quote != 0) {
                if (ch == quote) {
                    quote = 0;
                }
            } else if (ch == '"' || ch == '\'') {
                quote = ch;
            } else if (ch == '{' || ch == '[' || ch == '(') {
                depth++;
            } else if (ch == '}' || ch == ']' || ch == ')') {
                depth--;
            } else if (ch == ',' && depth == 0) {
                parts.add(current.toString().strip());
                current.setLength(0);
                continue;
            }
            current.append(ch);
        }
        if (!current.toString().isBlank()) {
            parts.add(current.toString().strip());
        }
        return parts;
    }
}
