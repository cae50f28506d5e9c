package com.flowgraph.adapter.ir;

import com.flowgraph.engine.ir.IrModel.IrBlock;
import com.flowgraph.engine.ir.IrModel.IrFunction;
import com.flowgraph.engine.ir.IrModel.IrOperand;
import com.flowgraph.engine.ir.IrModel.IrPlace;
import com.flowgraph.engine.ir.IrModel.IrRvalue;
import com.flowgraph.engine.ir.IrModel.IrStatement;
import com.flowgraph.engine.ir.IrModel.IrTerminator;
import com.flowgraph.engine.ir.IrModel.IrUnit;
import com.flowgraph.engine.ir.IrModel.OperandKind;
import com.flowgraph.engine.ir.IrModel.RvalueKind;
import com.flowgraph.engine.ir.IrModel.StatementKind;
import com.flowgraph.engine.ir.IrModel.TerminatorKind;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the textual MIR printed by {@code rustc -Zunpretty=mir} into an {@link IrUnit}.
 *
 * Only {@code fn} bodies are read; promoted constants, statics and the {@code let}/{@code debug}/
 * {@code scope} preamble of each body are skipped. Each line inside a {@code bbN: { ... }} block is
 * one statement, except the block's last instruction, which must be a terminator.
 */
public class MirTextParser {

    public static class MirParseException extends RuntimeException {
        public MirParseException(String msg) { super(msg); }
    }

    private static final Pattern FN_HEADER = Pattern.compile("^\\s*fn\\s+");
    private static final Pattern BLOCK_START = Pattern.compile("^bb(\\d+)\\s*(\\(cleanup\\))?\\s*:\\s*\\{$");
    private static final Pattern SCOPE_START = Pattern.compile("^scope\\s+\\d+.*\\{$");
    private static final Pattern LOCAL = Pattern.compile("(?<![\\w])_(\\d+)");
    private static final Pattern BLOCK_REF = Pattern.compile("\\bbb(\\d+)\\b");
    private static final Pattern CALL_LIKE = Pattern.compile("^([A-Z][A-Za-z]*)\\((.*)\\)$");
    // Terminators that carry successors end with "-> bbN;", "-> [..];" or "-> unwind ...;".
    private static final Pattern JUMP_TAIL = Pattern.compile(".*->\\s*(\\[.*]|bb\\d+|unwind\\s+\\w+)\\s*;$");

    private static final Set<String> BINARY_OPS = Set.of(
            "Add", "Sub", "Mul", "Div", "Rem", "BitXor", "BitAnd", "BitOr", "Shl", "Shr",
            "Eq", "Lt", "Le", "Ne", "Ge", "Gt", "Cmp", "Offset",
            "AddUnchecked", "SubUnchecked", "MulUnchecked", "ShlUnchecked", "ShrUnchecked");
    private static final Set<String> UNARY_OPS = Set.of("Not", "Neg", "PtrMetadata");
    private static final Set<String> NULLARY_OPS = Set.of("SizeOf", "AlignOf", "OffsetOf", "UbChecks");

    private enum State { OUTSIDE, HEADER, IN_FN, IN_BLOCK }

    /**
     * @param text MIR text of a whole crate
     * @param unitName recorded as {@link IrUnit#unit}
     * @throws MirParseException if a block has no terminator, a block id repeats within a function,
     *         or the text ends inside a function body
     */
    public IrUnit parse(String text, String unitName) {
        IrUnit unit = new IrUnit();
        unit.unit = unitName;

        State state = State.OUTSIDE;
        IrFunction function = null;
        IrBlock block = null;
        Set<Integer> blockIds = new HashSet<>();
        int scopeDepth = 0;
        int lineNo = 0;

        for (String raw : text.split("\r?\n", -1)) {
            lineNo++;
            String line = stripComment(raw.trim());

            switch (state) {
                case OUTSIDE -> {
                    Matcher m = FN_HEADER.matcher(line);
                    if (m.find()) {
                        function = new IrFunction();
                        function.name = functionName(line, m.end());
                        blockIds.clear();
                        scopeDepth = 0;
                        state = line.endsWith("{") ? State.IN_FN : State.HEADER;
                    }
                }
                case HEADER -> {
                    if (line.endsWith("{")) state = State.IN_FN;
                }
                case IN_FN -> {
                    Matcher bm = BLOCK_START.matcher(line);
                    if (bm.matches()) {
                        block = new IrBlock();
                        block.id = Integer.parseInt(bm.group(1));
                        block.cleanup = bm.group(2) != null;
                        block.statements = new ArrayList<>();
                        if (!blockIds.add(block.id)) {
                            throw new MirParseException("Duplicate block bb" + block.id + " in " + function.name
                                    + " (line " + lineNo + ")");
                        }
                        state = State.IN_BLOCK;
                    } else if (SCOPE_START.matcher(line).matches()) {
                        scopeDepth++;
                    } else if (line.equals("}")) {
                        if (scopeDepth > 0) {
                            scopeDepth--;
                        } else {
                            unit.functions.add(function);
                            function = null;
                            state = State.OUTSIDE;
                        }
                    }
                    // let / debug / blank lines: skipped
                }
                case IN_BLOCK -> {
                    if (line.equals("}")) {
                        if (block.terminator == null) {
                            throw new MirParseException("Block bb" + block.id + " of " + function.name
                                    + " has no terminator (line " + lineNo + ")");
                        }
                        function.blocks.add(block);
                        block = null;
                        state = State.IN_FN;
                    } else if (!line.isEmpty()) {
                        if (block.terminator != null) {
                            throw new MirParseException("Instruction after terminator in bb" + block.id + " of "
                                    + function.name + " (line " + lineNo + ")");
                        }
                        if (isTerminator(line)) {
                            block.terminator = parseTerminator(line);
                        } else {
                            block.statements.add(parseStatement(line));
                        }
                    }
                }
            }
        }

        if (state != State.OUTSIDE) {
            throw new MirParseException("MIR text ended inside " + (function != null ? function.name : "a function"));
        }
        return unit;
    }

    // -----------------------------------------------------------------------
    // Statements
    // -----------------------------------------------------------------------

    IrStatement parseStatement(String line) {
        IrStatement statement = new IrStatement();
        statement.text = line;
        String body = withoutSemicolon(line);

        if (body.startsWith("StorageLive(")) {
            statement.kind = StatementKind.STORAGE_LIVE;
        } else if (body.startsWith("StorageDead(")) {
            statement.kind = StatementKind.STORAGE_DEAD;
        } else if (body.startsWith("FakeRead(")) {
            statement.kind = StatementKind.FAKE_READ;
        } else if (body.startsWith("Retag(")) {
            statement.kind = StatementKind.RETAG;
        } else if (body.startsWith("PlaceMention(")) {
            statement.kind = StatementKind.PLACE_MENTION;
        } else if (body.equals("nop")) {
            statement.kind = StatementKind.NOP;
        } else if (body.startsWith("discriminant(") && body.contains(") = ")) {
            statement.kind = StatementKind.SET_DISCRIMINANT;
            statement.place = parsePlace(body.substring("discriminant(".length(), body.indexOf(") = ")));
        } else {
            int eq = body.indexOf(" = ");
            IrPlace place = eq > 0 ? parsePlace(body.substring(0, eq)) : null;
            if (place != null) {
                statement.kind = StatementKind.ASSIGN;
                statement.place = place;
                statement.rvalue = parseRvalue(body.substring(eq + 3).trim());
            } else {
                statement.kind = StatementKind.OTHER;
            }
        }
        return statement;
    }

    IrRvalue parseRvalue(String rhs) {
        IrRvalue rvalue = new IrRvalue();
        rvalue.operands = new ArrayList<>();

        if (isOperand(rhs) && rhs.contains(" as ") && rhs.endsWith(")")) {
            rvalue.kind = RvalueKind.CAST;
            rvalue.operands.add(parseOperand(rhs.substring(0, rhs.indexOf(" as "))));
        } else if (isOperand(rhs)) {
            rvalue.kind = RvalueKind.USE;
            rvalue.operands.add(parseOperand(rhs));
        } else if (rhs.startsWith("&raw ")) {
            rvalue.kind = RvalueKind.RAW_PTR;
        } else if (rhs.startsWith("&")) {
            rvalue.kind = RvalueKind.REF;
        } else if (rhs.startsWith("discriminant(")) {
            rvalue.kind = RvalueKind.DISCRIMINANT;
        } else if (rhs.startsWith("[") && rhs.endsWith("]")) {
            List<String> parts = splitTopLevel(rhs.substring(1, rhs.length() - 1), ';');
            if (parts.size() == 2) {
                rvalue.kind = RvalueKind.REPEAT;
                rvalue.operands.add(parseOperand(parts.get(0)));
            } else {
                rvalue.kind = RvalueKind.AGGREGATE;
                addOperands(rvalue, rhs.substring(1, rhs.length() - 1));
            }
        } else if (rhs.startsWith("(") && rhs.endsWith(")")) {
            rvalue.kind = RvalueKind.AGGREGATE;
            addOperands(rvalue, rhs.substring(1, rhs.length() - 1));
        } else {
            Matcher call = CALL_LIKE.matcher(rhs);
            if (call.matches()) {
                classifyOperator(rvalue, call.group(1), call.group(2));
            } else if (rhs.endsWith("}") || rhs.endsWith(")")) {
                // Struct, variant or closure aggregate: Foo { a: x }, Option::<T>::Some(x)
                char close = rhs.charAt(rhs.length() - 1);
                int open = matchingOpen(rhs, close == '}' ? '{' : '(', close);
                rvalue.kind = RvalueKind.AGGREGATE;
                if (open >= 0) {
                    addOperands(rvalue, rhs.substring(open + 1, rhs.length() - 1));
                }
            } else {
                rvalue.kind = RvalueKind.OTHER;
            }
        }
        return rvalue;
    }

    private void classifyOperator(IrRvalue rvalue, String name, String args) {
        rvalue.operator = name;
        if (BINARY_OPS.contains(name)) {
            rvalue.kind = RvalueKind.BINARY_OP;
        } else if (name.startsWith("Checked") || name.endsWith("WithOverflow")) {
            rvalue.kind = RvalueKind.CHECKED_BINARY_OP;
        } else if (UNARY_OPS.contains(name)) {
            rvalue.kind = RvalueKind.UNARY_OP;
        } else if (name.equals("CopyForDeref")) {
            rvalue.kind = RvalueKind.COPY_FOR_DEREF;
            // The argument is a bare place, read like a copy.
            IrPlace place = parsePlace(args);
            if (place != null) {
                IrOperand operand = new IrOperand();
                operand.kind = OperandKind.COPY;
                operand.place = place;
                operand.text = args.trim();
                rvalue.operands.add(operand);
            }
            return;
        } else if (name.equals("Len")) {
            rvalue.kind = RvalueKind.LEN;
            return;
        } else if (NULLARY_OPS.contains(name)) {
            rvalue.kind = RvalueKind.NULLARY_OP;
            return;
        } else {
            rvalue.kind = RvalueKind.AGGREGATE;
        }
        addOperands(rvalue, args);
    }

    private void addOperands(IrRvalue rvalue, String list) {
        for (String part : splitTopLevel(list, ',')) {
            String operand = part.trim();
            if (operand.isEmpty()) continue;
            // Struct fields are printed as "name: operand".
            int colon = fieldSeparator(operand);
            if (colon > 0) operand = operand.substring(colon + 2).trim();
            rvalue.operands.add(parseOperand(operand));
        }
    }

    private static int fieldSeparator(String operand) {
        if (isOperand(operand)) return -1;
        int colon = operand.indexOf(": ");
        return colon > 0 && operand.substring(0, colon).matches("\\w+") ? colon : -1;
    }

    // -----------------------------------------------------------------------
    // Terminators
    // -----------------------------------------------------------------------

    static boolean isTerminator(String line) {
        String body = withoutSemicolon(line);
        return body.equals("return") || body.equals("unreachable") || body.equals("resume")
                || body.equals("UnwindResume") || body.equals("abort") || body.startsWith("UnwindTerminate")
                || body.startsWith("goto ") || body.startsWith("switchInt(")
                || body.startsWith("drop(") || body.startsWith("assert(")
                || body.startsWith("falseEdge") || body.startsWith("falseUnwind")
                || JUMP_TAIL.matcher(line).matches();
    }

    IrTerminator parseTerminator(String line) {
        IrTerminator terminator = new IrTerminator();
        terminator.text = line;
        terminator.successors = successorsOf(line);
        terminator.args = new ArrayList<>();
        String body = withoutSemicolon(line);
        int arrow = body.lastIndexOf("->");
        String head = (arrow >= 0 ? body.substring(0, arrow) : body).trim();

        if (head.equals("return")) {
            terminator.kind = TerminatorKind.RETURN;
        } else if (head.equals("unreachable")) {
            terminator.kind = TerminatorKind.UNREACHABLE;
        } else if (head.equals("resume") || head.equals("UnwindResume")) {
            terminator.kind = TerminatorKind.RESUME;
        } else if (head.equals("abort") || head.startsWith("UnwindTerminate")) {
            terminator.kind = TerminatorKind.ABORT;
        } else if (head.equals("goto")) {
            terminator.kind = TerminatorKind.GOTO;
        } else if (head.startsWith("switchInt(")) {
            terminator.kind = TerminatorKind.SWITCH_INT;
            terminator.discriminant = parseOperand(head.substring("switchInt(".length(), head.length() - 1));
        } else if (head.startsWith("drop(")) {
            terminator.kind = TerminatorKind.DROP;
        } else if (head.startsWith("assert(")) {
            terminator.kind = TerminatorKind.ASSERT;
        } else if (head.startsWith("falseEdge")) {
            terminator.kind = TerminatorKind.FALSE_EDGE;
        } else if (head.startsWith("falseUnwind")) {
            terminator.kind = TerminatorKind.FALSE_UNWIND;
        } else if (head.endsWith(")")) {
            parseCall(terminator, head);
        } else {
            terminator.kind = TerminatorKind.OTHER;
        }
        return terminator;
    }

    /** {@code [dest = ]callee(args)} */
    private void parseCall(IrTerminator terminator, String head) {
        terminator.kind = TerminatorKind.CALL;
        String call = head;
        int eq = head.indexOf(" = ");
        if (eq > 0) {
            IrPlace destination = parsePlace(head.substring(0, eq));
            if (destination != null) {
                terminator.destination = destination;
                call = head.substring(eq + 3).trim();
            }
        }
        int open = matchingOpen(call, '(', ')');
        if (open < 0) {
            terminator.func = call;
            return;
        }
        terminator.func = call.substring(0, open).trim();
        for (String arg : splitTopLevel(call.substring(open + 1, call.length() - 1), ',')) {
            if (!arg.isBlank()) terminator.args.add(parseOperand(arg.trim()));
        }
    }

    private static List<Integer> successorsOf(String line) {
        List<Integer> successors = new ArrayList<>();
        int arrow = line.lastIndexOf("->");
        if (arrow < 0) return successors;
        Matcher m = BLOCK_REF.matcher(line.substring(arrow + 2));
        while (m.find()) {
            successors.add(Integer.parseInt(m.group(1)));
        }
        return successors;
    }

    // -----------------------------------------------------------------------
    // Operands and places
    // -----------------------------------------------------------------------

    private static boolean isOperand(String text) {
        return text.startsWith("copy ") || text.startsWith("move ") || text.startsWith("const ");
    }

    IrOperand parseOperand(String text) {
        String t = text.trim();
        IrOperand operand = new IrOperand();
        operand.text = t;
        if (t.startsWith("copy ")) {
            operand.kind = OperandKind.COPY;
            operand.place = parsePlace(t.substring(5));
        } else if (t.startsWith("move ")) {
            operand.kind = OperandKind.MOVE;
            operand.place = parsePlace(t.substring(5));
        } else if (t.startsWith("_") && parsePlace(t) != null) {
            // Older compilers print copies of Copy types as a bare place.
            operand.kind = OperandKind.COPY;
            operand.place = parsePlace(t);
        } else {
            operand.kind = OperandKind.CONSTANT;
        }
        return operand;
    }

    /** The root local of a place expression such as {@code _3}, {@code (*_5)} or {@code (_2.0: u64)}. */
    static IrPlace parsePlace(String text) {
        String t = text.trim();
        Matcher m = LOCAL.matcher(t);
        if (!m.find()) return null;
        // A place starts with its local, possibly behind parentheses and derefs.
        String prefix = t.substring(0, m.start()).replace("(", "").replace("*", "").trim();
        if (!prefix.isEmpty()) return null;
        return new IrPlace(Integer.parseInt(m.group(1)), t);
    }

    // -----------------------------------------------------------------------
    // Text helpers
    // -----------------------------------------------------------------------

    private static String withoutSemicolon(String line) {
        return line.endsWith(";") ? line.substring(0, line.length() - 1).trim() : line;
    }

    /**
     * The function path of a {@code fn} header, up to the parameter list. rustc prints impl
     * methods as {@code <impl at src/lib.rs:3:1: 3:11>::deposit}, so a {@code (} or space
     * inside angle brackets belongs to the name.
     */
    static String functionName(String header, int start) {
        int depth = 0;
        for (int i = start; i < header.length(); i++) {
            char c = header.charAt(i);
            if (c == '<') {
                depth++;
            } else if (c == '>' && depth > 0) {
                depth--;
            } else if (depth == 0 && c == '(') {
                return header.substring(start, i).trim();
            }
        }
        return header.substring(start).trim();
    }

    /** Drops a trailing {@code // ...} comment that is not inside a string constant. */
    static String stripComment(String line) {
        boolean inString = false;
        for (int i = 0; i < line.length() - 1; i++) {
            char c = line.charAt(i);
            if (c == '\\' && inString) {
                i++;
            } else if (c == '"') {
                inString = !inString;
            } else if (!inString && c == '/' && line.charAt(i + 1) == '/') {
                return line.substring(0, i).trim();
            }
        }
        return line;
    }

    /** Splits on {@code separator} outside brackets, braces, parentheses, generics and strings. */
    static List<String> splitTopLevel(String text, char separator) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        boolean inString = false;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (c == '\\') i++;
                else if (c == '"') inString = false;
                continue;
            }
            switch (c) {
                case '"' -> inString = true;
                case '(', '[', '{', '<' -> depth++;
                case ')', ']', '}' -> depth--;
                case '>' -> {
                    if (i == 0 || text.charAt(i - 1) != '-') depth--;
                }
                default -> {
                    if (c == separator && depth == 0) {
                        parts.add(text.substring(start, i));
                        start = i + 1;
                    }
                }
            }
        }
        if (start < text.length() || !parts.isEmpty()) {
            parts.add(text.substring(start));
        }
        return parts;
    }

    /** Index of the bracket that opens the one closing {@code text}, or -1. */
    private static int matchingOpen(String text, char open, char close) {
        int depth = 0;
        for (int i = text.length() - 1; i >= 0; i--) {
            char c = text.charAt(i);
            if (c == close) depth++;
            else if (c == open && --depth == 0) return i;
        }
        return -1;
    }
}
