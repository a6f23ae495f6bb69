package com.allocsafe;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.allocsafe.refactor.FixOrchestrator;
import com.allocsafe.refactor.RefactorEngine;

public class AllocSafeFixer {

    static final String USAGE = String.join("\n",
            "Usage: java -jar alloc-safe.jar fix <input.c> <output.c> [options]",
            "       java -jar alloc-safe.jar fix <file-or-dir> --in-place [options]",
            "       java -jar alloc-safe.jar report <file.c>",
            "Options:",
            "  --plan <plan.json>     apply an explicit refactor plan instead of whole-file analysis",
            "  --patch <file.patch>   also write a unified diff of every change",
            "  --error-code <CODE>    value returned when an allocation fails (default ENOMEM)",
            "  --verbose              print warnings");

    static class Options {
        String command;
        Path input;
        Path output;
        boolean inPlace;
        Path plan;
        Path patch;
        String errorCode;
        boolean verbose;
    }

    public static void main(String[] args) {
        int rc = run(args);
        if (rc != 0) {
            System.exit(rc);
        }
    }

    public static int run(String[] args) {
        Options opts = parseArgs(args);
        if (opts == null) {
            System.err.println(USAGE);
            return 1;
        }
        FixerConfig.Builder cfg = FixerConfig.builder().printWarnings(opts.verbose);
        if (opts.errorCode != null) {
            cfg.errorCode(opts.errorCode);
        }
        try {
            if (opts.command.equals("report")) {
                return report(opts, cfg.build());
            }
            return fix(opts, cfg);
        } catch (IOException | FixerException e) {
            System.err.println("❌ " + e.getMessage());
            return 1;
        }
    }

    static Options parseArgs(String[] args) {
        if (args.length < 2) {
            return null;
        }
        Options o = new Options();
        o.command = args[0];
        if (!o.command.equals("fix") && !o.command.equals("report")) {
            return null;
        }
        List<String> positional = new ArrayList<>();
        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--in-place":
                    o.inPlace = true;
                    break;
                case "--verbose":
                    o.verbose = true;
                    break;
                case "--plan":
                case "--patch":
                case "--error-code":
                    if (i + 1 >= args.length) {
                        return null;
                    }
                    String value = args[++i];
                    if (args[i - 1].equals("--plan")) {
                        o.plan = Paths.get(value);
                    } else if (args[i - 1].equals("--patch")) {
                        o.patch = Paths.get(value);
                    } else {
                        o.errorCode = value;
                    }
                    break;
                default:
                    if (args[i].startsWith("--")) {
                        return null;
                    }
                    positional.add(args[i]);
            }
        }
        if (positional.isEmpty() || positional.size() > 2) {
            return null;
        }
        o.input = Paths.get(positional.get(0));
        if (positional.size() == 2) {
            o.output = Paths.get(positional.get(1));
        }
        if (o.command.equals("fix") && (o.inPlace == (o.output != null))) {
            // exactly one of <output.c> and --in-place
            return null;
        }
        return o;
    }

    private static int report(Options opts, FixerConfig config) throws IOException {
        String source = Files.readString(opts.input);
        AllocationReport report = AllocationReport.build(opts.input.toString(), source, config);
        System.out.println(report.toJson());
        return 0;
    }

    private static int fix(Options opts, FixerConfig.Builder cfg) throws IOException {
        RefactorPlan plan = null;
        if (opts.plan != null) {
            plan = PlanParser.parse(Files.readString(opts.plan));
            if (plan.errorCode != null && opts.errorCode == null) {
                cfg.errorCode(plan.errorCode);
            }
            System.out.println("✅ Parsed plan with " + plan.functions.size() + " function(s)");
        }
        FixerConfig config = cfg.build();

        if (opts.patch != null) {
            // Remove existing patch to avoid confusion
            Files.deleteIfExists(opts.patch);
        }

        List<Path> files;
        boolean directory = Files.isDirectory(opts.input);
        if (directory) {
            if (!opts.inPlace) {
                System.err.println("❌ Directory input requires --in-place");
                return 1;
            }
            try (Stream<Path> walk = Files.walk(opts.input)) {
                files = walk.filter(Files::isRegularFile)
                        .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".c"))
                        .sorted()
                        .collect(Collectors.toList());
            }
        } else {
            files = List.of(opts.input);
        }

        int failures = 0;
        for (Path file : files) {
            Path target = opts.inPlace ? file : opts.output;
            // diff headers name the file relative to what the user passed
            String name = directory ? opts.input.relativize(file).toString() : file.getFileName().toString();
            try {
                fixFile(file, target, name, plan, opts.patch, config);
            } catch (IOException | FixerException e) {
                System.err.println("❌ Refactoring failed for " + file + ": " + e.getMessage());
                failures++;
            }
        }
        if (failures > 0) {
            System.err.println("❌ " + failures + " of " + files.size() + " file(s) failed");
            return 1;
        }
        return 0;
    }

    static void fixFile(Path in, Path out, String name, RefactorPlan plan, Path patchFile, FixerConfig config)
            throws IOException {
        String source = Files.readString(in);
        String fixed;
        if (plan != null) {
            fixed = RefactorEngine.applyRefactoringToString(plan.toContext(), source, config);
        } else {
            FixOrchestrator.FixResult result = FixOrchestrator.fix(source, config);
            fixed = result.text();
            if (!result.refactored().isEmpty()) {
                System.out.println("  Refactored in " + in + ": " + String.join(", ", result.refactored()));
            }
        }
        Files.writeString(out, fixed);
        if (patchFile != null) {
            PatchFileWriter.writePatch(patchFile, PatchFileWriter.diff(name, source, fixed));
        }
        System.out.println("✅ Fixed: " + out);
    }
}
