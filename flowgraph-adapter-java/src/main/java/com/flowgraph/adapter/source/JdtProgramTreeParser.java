package com.flowgraph.adapter.source;

import com.flowgraph.engine.tree.ProgramNode;
import org.eclipse.jdt.core.JavaCore;
import org.eclipse.jdt.core.compiler.IProblem;
import org.eclipse.jdt.core.dom.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses Java source into a {@link ProgramNode} tree using Eclipse JDT's ASTParser.
 *
 * Only the shape the CFG builder dispatches on is kept: types, methods, blocks and the
 * structured statements. Expression and declaration statements become leaves; lambdas and
 * anonymous classes inside them are not descended into. Parsing is syntax-only (no bindings)
 * and recovers from errors, so a file with syntax problems still yields a tree.
 */
public class JdtProgramTreeParser implements ProgramTreeParser {

    public static class SourceParseException extends RuntimeException {
        public SourceParseException(String msg) { super(msg); }
        public SourceParseException(String msg, Throwable cause) { super(msg, cause); }
    }

    @Override
    public ProgramNode parseFile(Path file) {
        String source;
        try {
            source = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SourceParseException("Could not read source file " + file + ": " + e.getMessage(), e);
        }
        CompilationUnit unit = parseUnit(source);
        int errors = countErrors(unit);
        if (errors > 0) {
            System.err.println("[flowgraph] WARNING: " + errors + " syntax problem(s) in " + file
                    + ", tree built from recovered AST");
        }
        return new Converter(source).compilationUnit(unit);
    }

    /** Parses an in-memory compilation unit. */
    public ProgramNode parse(String source) {
        return new Converter(source).compilationUnit(parseUnit(source));
    }

    private static CompilationUnit parseUnit(String source) {
        ASTParser parser = ASTParser.newParser(AST.JLS17);
        parser.setKind(ASTParser.K_COMPILATION_UNIT);
        Map<String, String> options = new HashMap<>();
        JavaCore.setComplianceOptions(JavaCore.VERSION_17, options);
        parser.setCompilerOptions(options);
        parser.setResolveBindings(false);
        parser.setStatementsRecovery(true);
        parser.setSource(source.toCharArray());
        return (CompilationUnit) parser.createAST(null);
    }

    private static int countErrors(CompilationUnit unit) {
        int errors = 0;
        for (IProblem problem : unit.getProblems()) {
            if (problem.isError()) errors++;
        }
        return errors;
    }

    /** Builds the tree bottom-up; offsets are translated from UTF-16 indices to UTF-8 bytes. */
    private static final class Converter {

        private final String source;
        private final int[] byteOffsets;

        Converter(String source) {
            this.source = source;
            this.byteOffsets = utf8Offsets(source);
        }

        ProgramNode compilationUnit(CompilationUnit unit) {
            List<ProgramNode> children = new ArrayList<>();
            for (Object type : unit.types()) {
                children.add(typeDeclaration((AbstractTypeDeclaration) type));
            }
            return new ProgramNode("compilation_unit", source, 0, byteOffsets[source.length()], children);
        }

        // --- Declarations ---

        private ProgramNode typeDeclaration(AbstractTypeDeclaration type) {
            List<ProgramNode> children = new ArrayList<>();
            children.add(node("identifier", type.getName(), List.of()));
            for (Object decl : type.bodyDeclarations()) {
                ProgramNode member = bodyDeclaration((BodyDeclaration) decl);
                if (member != null) children.add(member);
            }
            return node(typeKind(type), type, children);
        }

        private static String typeKind(AbstractTypeDeclaration type) {
            if (type instanceof TypeDeclaration) {
                return ((TypeDeclaration) type).isInterface() ? "interface_declaration" : "class_declaration";
            }
            if (type instanceof EnumDeclaration) return "enum_declaration";
            if (type instanceof RecordDeclaration) return "record_declaration";
            return "annotation_declaration";
        }

        private ProgramNode bodyDeclaration(BodyDeclaration decl) {
            if (decl instanceof MethodDeclaration) {
                return method((MethodDeclaration) decl);
            }
            if (decl instanceof AbstractTypeDeclaration) {
                return typeDeclaration((AbstractTypeDeclaration) decl);
            }
            if (decl instanceof FieldDeclaration) {
                return node("field_declaration", decl, List.of());
            }
            if (decl instanceof Initializer) {
                return node("initializer", decl, List.of(block(((Initializer) decl).getBody())));
            }
            return null;
        }

        private ProgramNode method(MethodDeclaration method) {
            List<ProgramNode> children = new ArrayList<>();
            children.add(node("identifier", method.getName(), List.of()));
            if (method.getBody() != null) {
                children.add(block(method.getBody()));
            }
            return node(method.isConstructor() ? "constructor_declaration" : "method_declaration", method, children);
        }

        // --- Statements ---

        private ProgramNode block(Block block) {
            List<ProgramNode> children = new ArrayList<>();
            for (Object s : block.statements()) {
                addStatement(children, (Statement) s);
            }
            return node("block", block, children);
        }

        /** Loop bodies are always a block so the loop-body slot finds them. */
        private ProgramNode asBlock(Statement body) {
            if (body instanceof Block) {
                return block((Block) body);
            }
            List<ProgramNode> children = new ArrayList<>();
            addStatement(children, body);
            return node("block", body, children);
        }

        private void addStatement(List<ProgramNode> out, Statement statement) {
            ProgramNode converted = statement(statement);
            if (converted != null) out.add(converted);
        }

        private ProgramNode statement(Statement s) {
            switch (s.getNodeType()) {
                case ASTNode.BLOCK:
                    return block((Block) s);
                case ASTNode.IF_STATEMENT:
                    return ifStatement((IfStatement) s);
                case ASTNode.WHILE_STATEMENT: {
                    WhileStatement w = (WhileStatement) s;
                    return node("while_statement", s, List.of(
                            node("condition", w.getExpression(), List.of()),
                            asBlock(w.getBody())));
                }
                case ASTNode.DO_STATEMENT: {
                    DoStatement d = (DoStatement) s;
                    return node("do_statement", s, List.of(
                            asBlock(d.getBody()),
                            node("condition", d.getExpression(), List.of())));
                }
                case ASTNode.FOR_STATEMENT: {
                    ForStatement f = (ForStatement) s;
                    List<ProgramNode> children = new ArrayList<>();
                    if (f.getExpression() != null) {
                        children.add(node("condition", f.getExpression(), List.of()));
                    }
                    children.add(asBlock(f.getBody()));
                    return node("for_statement", s, children);
                }
                case ASTNode.ENHANCED_FOR_STATEMENT:
                    return node("enhanced_for_statement", s,
                            List.of(asBlock(((EnhancedForStatement) s).getBody())));
                case ASTNode.RETURN_STATEMENT:
                    return node("return_statement", s, List.of());
                case ASTNode.BREAK_STATEMENT:
                    return node("break_statement", s, List.of());
                case ASTNode.CONTINUE_STATEMENT:
                    return node("continue_statement", s, List.of());
                case ASTNode.THROW_STATEMENT:
                    return node("throw_statement", s, List.of());
                case ASTNode.EXPRESSION_STATEMENT:
                    return node("expression_statement", s, List.of());
                case ASTNode.VARIABLE_DECLARATION_STATEMENT:
                    return node("local_variable_declaration", s, List.of());
                case ASTNode.ASSERT_STATEMENT:
                    return node("assert_statement", s, List.of());
                case ASTNode.YIELD_STATEMENT:
                    return node("yield_statement", s, List.of());
                case ASTNode.CONSTRUCTOR_INVOCATION:
                case ASTNode.SUPER_CONSTRUCTOR_INVOCATION:
                    return node("constructor_invocation_statement", s, List.of());
                case ASTNode.TYPE_DECLARATION_STATEMENT:
                    return typeDeclaration(((TypeDeclarationStatement) s).getDeclaration());
                case ASTNode.TRY_STATEMENT:
                    return tryStatement((TryStatement) s);
                case ASTNode.SWITCH_STATEMENT:
                    return switchStatement((SwitchStatement) s);
                case ASTNode.SYNCHRONIZED_STATEMENT:
                    return node("synchronized_construct", s,
                            List.of(block(((SynchronizedStatement) s).getBody())));
                case ASTNode.LABELED_STATEMENT: {
                    ProgramNode body = statement(((LabeledStatement) s).getBody());
                    return node("labeled_construct", s, body != null ? List.of(body) : List.of());
                }
                case ASTNode.EMPTY_STATEMENT:
                    return null;
                default:
                    return node("other_statement", s, List.of());
            }
        }

        private ProgramNode ifStatement(IfStatement s) {
            List<ProgramNode> children = new ArrayList<>();
            children.add(node("condition", s.getExpression(), List.of()));
            children.add(wrapper("consequence", s.getThenStatement()));
            if (s.getElseStatement() != null) {
                children.add(wrapper("alternative", s.getElseStatement()));
            }
            return node("if_statement", s, children);
        }

        private ProgramNode wrapper(String kind, Statement branch) {
            ProgramNode inner = statement(branch);
            return node(kind, branch, inner != null ? List.of(inner) : List.of());
        }

        private ProgramNode tryStatement(TryStatement s) {
            List<ProgramNode> children = new ArrayList<>();
            children.add(block(s.getBody()));
            for (Object c : s.catchClauses()) {
                CatchClause clause = (CatchClause) c;
                children.add(node("catch_clause", clause, List.of(block(clause.getBody()))));
            }
            if (s.getFinally() != null) {
                children.add(node("finally_clause", s.getFinally(), List.of(block(s.getFinally()))));
            }
            return node("try_construct", s, children);
        }

        /** Groups the flat statement list of a switch under the case label that precedes it. */
        private ProgramNode switchStatement(SwitchStatement s) {
            List<ProgramNode> cases = new ArrayList<>();
            SwitchCase currentCase = null;
            List<ProgramNode> caseBody = new ArrayList<>();
            for (Object o : s.statements()) {
                Statement st = (Statement) o;
                if (st instanceof SwitchCase) {
                    if (currentCase != null) {
                        cases.add(node("switch_case", currentCase, caseBody));
                    }
                    currentCase = (SwitchCase) st;
                    caseBody = new ArrayList<>();
                } else {
                    addStatement(caseBody, st);
                }
            }
            if (currentCase != null) {
                cases.add(node("switch_case", currentCase, caseBody));
            }
            List<ProgramNode> children = new ArrayList<>();
            children.add(node("condition", s.getExpression(), List.of()));
            children.addAll(cases);
            return node("switch_construct", s, children);
        }

        // --- Node construction ---

        private ProgramNode node(String kind, ASTNode astNode, List<ProgramNode> children) {
            int start = astNode.getStartPosition();
            int end = start + astNode.getLength();
            return new ProgramNode(kind, source.substring(start, end), byteOffsets[start], byteOffsets[end], children);
        }

        private static int[] utf8Offsets(String text) {
            int[] offsets = new int[text.length() + 1];
            int bytes = 0;
            for (int i = 0; i < text.length(); i++) {
                offsets[i] = bytes;
                char c = text.charAt(i);
                if (c < 0x80) {
                    bytes += 1;
                } else if (c < 0x800) {
                    bytes += 2;
                } else if (Character.isHighSurrogate(c)) {
                    bytes += 4;
                } else if (!Character.isLowSurrogate(c)) {
                    bytes += 3;
                }
            }
            offsets[text.length()] = bytes;
            return offsets;
        }
    }
}
