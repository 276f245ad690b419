package org.masmtext;

/** MASM size keyword for a memory access type ({@code dword} in {@code dword ptr [...]}). */
public final class PtrSizeNames {
    private static final System.Logger LOGGER = System.getLogger(PtrSizeNames.class.getName());

    private static final AsmType DQWORD = AsmType.vector(2, AsmType.integer(64));

    private PtrSizeNames() {}

    public static String of(AsmType ty) {
        if (ty == null) {
            LOGGER.log(System.Logger.Level.ERROR, "size name lookup: null type");
            throw new UnparseException("null type in size name lookup");
        }
        if (ty instanceof AsmType.IntegerType) {
            switch (((AsmType.IntegerType) ty).nBits) {
                case 8: return "byte";
                case 16: return "word";
                case 32: return "dword";
                case 64: return "qword";
            }
        } else if (ty instanceof AsmType.FloatType) {
            switch (((AsmType.FloatType) ty).nBits) {
                case 32: return "float";
                case 64: return "double";
                case 80: return "ldouble";
            }
        } else if (DQWORD.equals(ty)) {
            return "dqword";
        } else if (ty instanceof AsmType.VectorType) {
            AsmType.VectorType vt = (AsmType.VectorType) ty;
            return "V" + vt.nElements + of(vt.element);
        }
        throw new UnparseException("unhandled type: " + ty);
    }
}
