package org.masmtext;

import java.io.IOException;
import java.nio.file.*;
import java.util.*;

public class Main {
    private static final String USAGE =
            "Usage: java -jar masmtext.jar <listing.json|dir> [--labels labels.json] [--max-bytes N]"
                    + " [--out DIR] [--no-out] [--blocks] [--reasons]";

    public static void main(String[] args) throws Exception {
        System.exit(run(args));
    }

    static int run(String[] args) throws IOException {
        if (args.length < 1) {
            System.err.println(USAGE);
            return 1;
        }

        // 1) options
        Path input = null;
        Path labelsFile = null;
        Analysis.Options options = new Analysis.Options();
        options.outDir = Paths.get("out");
        try {
            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case "--labels": labelsFile = Paths.get(value(args, ++i)); break;
                    case "--max-bytes": options.maxBytes = Integer.parseInt(value(args, ++i)); break;
                    case "--out": options.outDir = Paths.get(value(args, ++i)); break;
                    case "--no-out": options.outDir = null; break;
                    case "--blocks": options.basicBlockLines = true; break;
                    case "--reasons": options.showReasons = true; break;
                    default:
                        if (args[i].startsWith("--") || input != null)
                            throw new IllegalArgumentException("unexpected argument: " + args[i]);
                        input = Paths.get(args[i]).toAbsolutePath();
                }
            }
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(USAGE);
            return 1;
        }
        if (input == null || options.maxBytes < 0) {
            System.err.println(USAGE);
            return 1;
        }
        if (!Files.exists(input)) {
            System.err.println("Input not found: " + input);
            return 2;
        }

        // 2) label map, built once and read-only from here on
        LabelMap labels = LabelMap.empty();
        if (labelsFile != null) {
            try {
                labels = LabelMapLoader.load(labelsFile);
            } catch (IOException | IllegalArgumentException e) {
                System.err.println("Cannot read labels " + labelsFile + ": " + e.getMessage());
                return 2;
            }
            System.out.println("Labels: " + labels.size() + " from " + labelsFile);
        }

        // 3) listing files
        List<Path> files = new ArrayList<>();
        if (Files.isDirectory(input)) {
            try (var stream = Files.walk(input)) {
                stream.filter(p -> p.toString().endsWith(".json")).sorted().forEach(files::add);
            }
        } else {
            files.add(input);
        }

        // 4) render
        RegisterDictionary registers = RegisterDictionary.x86_64();
        InstructionDebugPrinter printer = new InstructionDebugPrinter(new MasmUnparser(registers));
        Diagnosis diagnosis = new Diagnosis();
        Analysis analysis = new Analysis(new ListingReader(registers), printer, labels, options, diagnosis);
        int ok = analysis.run(files);

        if (diagnosis.hasFailures()) diagnosis.printReport();
        return ok == files.size() ? 0 : 3;
    }

    private static String value(String[] args, int i) {
        if (i >= args.length) throw new IllegalArgumentException("missing value for " + args[i - 1]);
        return args[i];
    }
}
