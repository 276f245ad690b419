package org.masmtext;

/** Renders instructions of architectures other than x86. */
public interface GenericUnparser {

    String unparseExpression(Instruction insn, Expr expr, LabelMap labels);

    /** Whole instruction text: mnemonic and operands. */
    String unparseInstruction(Instruction insn);

    /** Rejects every instruction; used when only x86 listings are expected. */
    GenericUnparser NONE = new GenericUnparser() {
        @Override
        public String unparseExpression(Instruction insn, Expr expr, LabelMap labels) {
            throw new UnparseException("no unparser for architecture " + insn.arch);
        }

        @Override
        public String unparseInstruction(Instruction insn) {
            throw new UnparseException("no unparser for architecture " + insn.arch);
        }
    };
}
