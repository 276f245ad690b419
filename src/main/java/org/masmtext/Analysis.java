package org.masmtext;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/** One pass over listing files: render, print the debug listing, export JSON. */
public class Analysis {
    private final ListingReader reader;
    private final InstructionDebugPrinter printer;
    private final LabelMap labels;
    private final Options options;
    private final Diagnosis diagnosis;

    public static class Options {
        public int maxBytes = 8;
        public boolean basicBlockLines;
        public boolean showReasons;
        public boolean printListing = true;
        public Path outDir;   // null: no JSON export
    }

    public Analysis(ListingReader reader, InstructionDebugPrinter printer, LabelMap labels,
                    Options options, Diagnosis diagnosis) {
        this.reader = reader;
        this.printer = printer;
        this.labels = labels;
        this.options = options;
        this.diagnosis = diagnosis;
    }

    /** @return number of listings rendered without a single failed instruction */
    public int run(List<Path> files) {
        int successCount = 0;
        int failCount = 0;

        for (Path file : files) {
            try {
                Listing listing = reader.read(file);
                List<InstructionInfo> rendered = new ArrayList<>();
                int before = diagnosis.getFailureCount();

                String text = printer.debugFunction(listing.blocks, options.basicBlockLines, options.showReasons,
                        insn -> {
                            InstructionInfo info = renderOne(listing, insn);
                            rendered.add(info);
                            return info.label();
                        });
                if (options.printListing) {
                    System.out.println("; " + listing.name);
                    System.out.print(text);
                }

                if (options.outDir != null) {
                    Files.createDirectories(options.outDir);
                    String safeFileName = listing.name.replaceAll("[^A-Za-z0-9._-]", "_") + ".json";
                    JsonExporter.export(listing, rendered, options.outDir.resolve(safeFileName));
                }

                int failedHere = diagnosis.getFailureCount() - before;
                if (failedHere > 0) {
                    failCount++;
                    System.out.println("[RESULT] FAIL      : " + listing.name + " ( " + failedHere + " instruction(s) )");
                } else {
                    successCount++;
                    System.out.println("[RESULT] SUCCESS   : " + listing.name);
                }
            } catch (Exception ex) {
                // unreadable listing
                failCount++;
                System.err.println("[RESULT] FAIL      : " + file.getFileName() + " ( Error: " + ex.getMessage() + " )");
            }
        }

        System.out.println("\n" + "=".repeat(40));
        System.out.println(">>> Pass Finished Summary");
        System.out.println("  - Success   : " + successCount);
        System.out.println("  - Fail      : " + failCount);
        System.out.println("=".repeat(40));

        return successCount;
    }

    private InstructionInfo renderOne(Listing listing, Instruction insn) {
        try {
            return printer.render(insn, options.maxBytes, labels);
        } catch (UnparseException e) {
            diagnosis.record(listing.name, insn, e);
            return InstructionInfo.failed(insn, e.getMessage());
        }
    }
}
