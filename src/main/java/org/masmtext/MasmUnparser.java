package org.masmtext;

/** x86 goes through {@link ExpressionUnparser}; anything else through the generic unparser. */
public class MasmUnparser {
    private final ExpressionUnparser x86;
    private final GenericUnparser generic;

    public MasmUnparser(ExpressionUnparser x86, GenericUnparser generic) {
        this.x86 = x86;
        this.generic = generic;
    }

    public MasmUnparser(RegisterDictionary registers) {
        this(new ExpressionUnparser(registers), GenericUnparser.NONE);
    }

    public String unparseExpression(Instruction insn, Expr expr, LabelMap labels) {
        if (insn.isX86()) {
            return x86.unparse(expr, insn.isLea(), labels);
        }
        return generic.unparseExpression(insn, expr, labels);
    }

    public GenericUnparser getGeneric() { return generic; }
}
