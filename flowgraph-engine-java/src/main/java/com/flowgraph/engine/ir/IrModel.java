package com.flowgraph.engine.ir;

import com.google.gson.annotations.SerializedName;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * POJOs for the per-function IR consumed by the CPG builder: basic blocks of flat
 * statements, each block closed by exactly one terminator.
 * Field names use @SerializedName for JSON snake_case mapping.
 *
 * Enum constants that a document spells differently deserialize to null; consumers treat a
 * null kind as "unrecognized shape".
 */
public final class IrModel {

    private IrModel() {}

    public static class IrUnit {
        @SerializedName("unit")      public String unit;
        @SerializedName("target")    public String target;     // nullable
        @SerializedName("functions") public List<IrFunction> functions = new ArrayList<>();

        public List<IrFunction> getFunctions() {
            return functions != null ? functions : Collections.emptyList();
        }
    }

    public static class IrFunction {
        @SerializedName("name")   public String name;
        @SerializedName("blocks") public List<IrBlock> blocks = new ArrayList<>();

        public List<IrBlock> getBlocks() {
            return blocks != null ? blocks : Collections.emptyList();
        }
    }

    public static class IrBlock {
        @SerializedName("id")         public int id;
        @SerializedName("cleanup")    public boolean cleanup;
        @SerializedName("statements") public List<IrStatement> statements = new ArrayList<>();
        @SerializedName("terminator") public IrTerminator terminator;

        public List<IrStatement> getStatements() {
            return statements != null ? statements : Collections.emptyList();
        }
    }

    public enum StatementKind {
        @SerializedName("assign")            ASSIGN,
        @SerializedName("storage_live")      STORAGE_LIVE,
        @SerializedName("storage_dead")      STORAGE_DEAD,
        @SerializedName("fake_read")         FAKE_READ,
        @SerializedName("set_discriminant")  SET_DISCRIMINANT,
        @SerializedName("retag")             RETAG,
        @SerializedName("place_mention")     PLACE_MENTION,
        @SerializedName("nop")               NOP,
        @SerializedName("other")             OTHER
    }

    public static class IrStatement {
        @SerializedName("kind")   public StatementKind kind;
        @SerializedName("text")   public String text;
        @SerializedName("place")  public IrPlace place;    // assignment target, nullable
        @SerializedName("rvalue") public IrRvalue rvalue;  // assignment source, nullable
    }

    /** A memory location rooted at a local variable, e.g. {@code (_3.0: u64)} is local 3. */
    public static class IrPlace {
        @SerializedName("local") public int local;
        @SerializedName("text")  public String text;

        public IrPlace() {}

        public IrPlace(int local, String text) {
            this.local = local;
            this.text = text;
        }
    }

    public enum OperandKind {
        @SerializedName("copy")     COPY,
        @SerializedName("move")     MOVE,
        @SerializedName("constant") CONSTANT
    }

    public static class IrOperand {
        @SerializedName("kind")  public OperandKind kind;
        @SerializedName("place") public IrPlace place;  // null for constants
        @SerializedName("text")  public String text;
    }

    public enum RvalueKind {
        @SerializedName("use")                USE,
        @SerializedName("copy_for_deref")     COPY_FOR_DEREF,
        @SerializedName("binary_op")          BINARY_OP,
        @SerializedName("checked_binary_op")  CHECKED_BINARY_OP,
        @SerializedName("unary_op")           UNARY_OP,
        @SerializedName("aggregate")          AGGREGATE,
        @SerializedName("ref")                REF,
        @SerializedName("raw_ptr")            RAW_PTR,
        @SerializedName("cast")               CAST,
        @SerializedName("discriminant")       DISCRIMINANT,
        @SerializedName("len")                LEN,
        @SerializedName("repeat")             REPEAT,
        @SerializedName("nullary_op")         NULLARY_OP,
        @SerializedName("other")              OTHER
    }

    public static class IrRvalue {
        @SerializedName("kind")     public RvalueKind kind;
        @SerializedName("operator") public String operator;  // e.g. Add, Not; nullable
        @SerializedName("operands") public List<IrOperand> operands = new ArrayList<>();

        public List<IrOperand> getOperands() {
            return operands != null ? operands : Collections.emptyList();
        }
    }

    public enum TerminatorKind {
        @SerializedName("goto")          GOTO,
        @SerializedName("switch_int")    SWITCH_INT,
        @SerializedName("return")        RETURN,
        @SerializedName("unreachable")   UNREACHABLE,
        @SerializedName("resume")        RESUME,
        @SerializedName("abort")         ABORT,
        @SerializedName("drop")          DROP,
        @SerializedName("call")          CALL,
        @SerializedName("assert")        ASSERT,
        @SerializedName("false_edge")    FALSE_EDGE,
        @SerializedName("false_unwind")  FALSE_UNWIND,
        @SerializedName("other")         OTHER
    }

    public static class IrTerminator {
        @SerializedName("kind")         public TerminatorKind kind;
        @SerializedName("text")         public String text;
        @SerializedName("func")         public String func;          // callee, calls only
        @SerializedName("args")         public List<IrOperand> args = new ArrayList<>();
        @SerializedName("discriminant") public IrOperand discriminant; // switch_int only
        @SerializedName("destination")  public IrPlace destination;   // calls only, informational
        @SerializedName("successors")   public List<Integer> successors = new ArrayList<>();

        public List<IrOperand> getArgs() {
            return args != null ? args : Collections.emptyList();
        }

        public List<Integer> getSuccessors() {
            return successors != null ? successors : Collections.emptyList();
        }
    }
}
