package org.masmtext;

import java.util.*;

/** Collects rendering failures over a run and prints them grouped by cause. */
public class Diagnosis {
    private final Map<String, List<String>> failuresByCause = new LinkedHashMap<>();
    private final Set<String> unknownKinds = new TreeSet<>();
    private int failureCount;

    public void record(String listingName, Instruction insn, Exception e) {
        String msg = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        String where = String.format("%s @ %X (%s)", listingName, insn.address, insn.mnemonic);
        failuresByCause.computeIfAbsent(causeOf(msg), k -> new ArrayList<>()).add(where);
        if (msg.startsWith("unhandled expression kind ")) {
            unknownKinds.add(msg.substring("unhandled expression kind ".length()));
        }
        failureCount++;
    }

    static String causeOf(String msg) {
        if (msg.startsWith("unhandled expression kind")) return "Unhandled expression kind";
        if (msg.startsWith("unsupported integer width")) return "Unsupported integer width";
        if (msg.startsWith("no ") && msg.contains(" register for descriptor")) return "Unknown register";
        if (msg.startsWith("no unparser for architecture")) return "Unsupported architecture";
        if (msg.startsWith("expression nested deeper")) return "Expression too deep";
        return "Other";
    }

    public boolean hasFailures() { return failureCount > 0; }

    public int getFailureCount() { return failureCount; }

    public Set<String> getUnknownKinds() { return unknownKinds; }

    public Map<String, List<String>> getFailuresByCause() { return failuresByCause; }

    public void printReport() {
        System.out.println("\n" + "=".repeat(20) + " DIAGNOSIS REPORT " + "=".repeat(20));

        if (failuresByCause.isEmpty()) {
            System.out.println("Every operand rendered.");
        }
        for (Map.Entry<String, List<String>> e : failuresByCause.entrySet()) {
            System.out.println("[" + e.getKey() + "] " + e.getValue().size() + " instruction(s)");
            for (String where : e.getValue()) {
                System.out.println("    * " + where);
            }
        }
        if (!unknownKinds.isEmpty()) {
            System.out.println("  - Expression kinds with no text form: " + unknownKinds);
            System.out.println("  - Action: teach ExpressionUnparser these kinds before trusting the listing.");
        }

        System.out.println("=".repeat(58) + "\n");
    }
}
