package com.flowgraph.adapter;

import com.flowgraph.adapter.config.ConfigReader;
import com.flowgraph.adapter.config.PipelineConfig;
import com.flowgraph.adapter.stage.AstStage;
import com.flowgraph.adapter.stage.CfgStage;
import com.flowgraph.adapter.stage.CpgStage;
import com.flowgraph.adapter.stage.StageReport;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Entry point for the flowgraph pipeline.
 *
 * Usage:
 *   java -jar flowgraph-adapter-java.jar ast --input <src-dir> --output <ast-dir> [--config <file>]
 *   java -jar flowgraph-adapter-java.jar cfg --input <ast-dir> --output <cfg-dir> [--config <file>]
 *   java -jar flowgraph-adapter-java.jar cpg --unit <crate-root|x.mir|x.ir.json> --output <dir>
 *       [--target <triple>] [--cfg <flag>]... [--config <file>]
 */
public class FlowgraphMain {

    private static final String USAGE =
            "Usage: java -jar flowgraph-adapter-java.jar <ast|cfg> --input <dir> --output <dir> [--config <file>]\n"
          + "       java -jar flowgraph-adapter-java.jar cpg --unit <path> --output <dir> "
          + "[--target <triple>] [--cfg <flag>]... [--config <file>]";

    public static void main(String[] args) {
        try {
            run(args);
            System.exit(0);
        } catch (UsageException e) {
            System.err.println("[flowgraph] ERROR: " + e.getMessage());
            System.err.println(USAGE);
            System.exit(2);
        } catch (Exception e) {
            System.err.println("[flowgraph] FATAL: " + e.getMessage());
            System.exit(1);
        }
    }

    static StageReport run(String[] args) {
        if (args.length == 0) {
            throw new UsageException("No subcommand specified");
        }
        String command = args[0];
        if (!command.equals("ast") && !command.equals("cfg") && !command.equals("cpg")) {
            throw new UsageException("Unknown subcommand: " + command);
        }

        // Parse flags
        String input = null;
        String output = null;
        String configPath = null;
        String unit = null;
        String target = null;
        List<String> cfgFlags = new ArrayList<>();

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--input"  -> input      = requireNext(args, i++, "--input");
                case "--output" -> output     = requireNext(args, i++, "--output");
                case "--config" -> configPath = requireNext(args, i++, "--config");
                case "--unit"   -> unit       = requireNext(args, i++, "--unit");
                case "--target" -> target     = requireNext(args, i++, "--target");
                case "--cfg"    -> cfgFlags.add(requireNext(args, i++, "--cfg"));
                default -> throw new UsageException("Unknown flag: " + args[i]);
            }
        }

        if (output == null) throw new UsageException("--output is required");
        if (command.equals("cpg")) {
            if (unit == null)  throw new UsageException("--unit is required for cpg");
            if (input != null) throw new UsageException("--input is not valid for cpg; use --unit");
        } else {
            if (input == null) throw new UsageException("--input is required for " + command);
            if (unit != null || target != null || !cfgFlags.isEmpty()) {
                throw new UsageException("--unit, --target and --cfg are only valid for cpg");
            }
        }

        // Configuration file, then command-line overrides
        PipelineConfig config;
        if (configPath != null) {
            System.err.println("[flowgraph] Reading config: " + configPath);
            config = new ConfigReader().read(Paths.get(configPath));
        } else {
            config = PipelineConfig.defaults();
        }
        if (target != null) config.setTarget(target);
        if (!cfgFlags.isEmpty()) config.setCfgFlags(cfgFlags);

        Path outputRoot = Paths.get(output);
        StageReport report;
        if (command.equals("ast")) {
            report = new AstStage(config).run(requireInputRoot(Paths.get(input)), outputRoot);
        } else if (command.equals("cfg")) {
            report = new CfgStage(config).run(requireInputRoot(Paths.get(input)), outputRoot);
        } else {
            report = new CpgStage(config).run(Paths.get(unit), outputRoot);
        }

        System.err.println("[flowgraph] Done.");
        return report;
    }

    /** The input root must exist and be a directory before any processing starts. */
    static Path requireInputRoot(Path inputRoot) {
        if (!Files.exists(inputRoot)) {
            throw new InputValidationException("Input root does not exist: " + inputRoot);
        }
        if (!Files.isDirectory(inputRoot)) {
            throw new InputValidationException("Input root is not a directory: " + inputRoot);
        }
        return inputRoot;
    }

    private static String requireNext(String[] args, int i, String flag) {
        if (i + 1 >= args.length) {
            throw new UsageException(flag + " requires an argument");
        }
        return args[i + 1];
    }

    static class UsageException extends RuntimeException {
        UsageException(String msg) { super(msg); }
    }

    static class InputValidationException extends RuntimeException {
        InputValidationException(String msg) { super(msg); }
    }
}
