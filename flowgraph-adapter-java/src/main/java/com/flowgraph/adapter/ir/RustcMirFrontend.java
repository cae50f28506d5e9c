package com.flowgraph.adapter.ir;

import com.flowgraph.adapter.config.PipelineConfig;
import com.flowgraph.engine.ir.IrModel.IrUnit;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Compiles a crate root with {@code rustc -Zunpretty=mir} and parses the printed MIR.
 * The sysroot is queried from the same executable first so the compiler finds its standard library.
 */
public class RustcMirFrontend implements IrFrontend {

    private final String rustc;
    private final String crateType;
    private final String target;
    private final List<String> cfgFlags;
    private final List<String> extraArgs;
    private final MirTextParser parser = new MirTextParser();

    public RustcMirFrontend(PipelineConfig config) {
        this(config.getRustc(), config.getCrateType(), config.getTarget(),
             config.getCfgFlags(), config.getExtraCompilerArgs());
    }

    public RustcMirFrontend(String rustc, String crateType, String target,
                            List<String> cfgFlags, List<String> extraArgs) {
        this.rustc = rustc;
        this.crateType = crateType;
        this.target = target;
        this.cfgFlags = List.copyOf(cfgFlags);
        this.extraArgs = List.copyOf(extraArgs);
    }

    @Override
    public IrUnit load(Path unit) {
        if (!Files.isRegularFile(unit)) {
            throw new IrFrontendException("Crate root not found: " + unit);
        }
        Path workDir = unit.toAbsolutePath().getParent();

        String sysroot = run(List.of(rustc, "--print", "sysroot"), workDir).trim();
        System.err.println("[flowgraph] Using sysroot: " + sysroot);

        List<String> command = buildCommand(unit, sysroot);
        System.err.println("[flowgraph] Compiler command: " + String.join(" ", command));
        String mir = run(command, workDir);

        try {
            return IrValidator.validate(parser.parse(mir, unit.getFileName().toString()), unit.toString());
        } catch (MirTextParser.MirParseException e) {
            throw new IrFrontendException("Could not parse MIR printed for " + unit + ": " + e.getMessage(), e);
        }
    }

    List<String> buildCommand(Path unit, String sysroot) {
        List<String> command = new ArrayList<>();
        command.add(rustc);
        command.add("-Zunpretty=mir");
        command.add("--crate-type");
        command.add(crateType);
        command.add("--sysroot=" + sysroot);
        if (target != null && !target.isBlank()) {
            command.add("--target=" + target);
        }
        for (String flag : cfgFlags) {
            command.add("--cfg");
            command.add(flag);
        }
        command.addAll(extraArgs);
        command.add(unit.toString());
        return command;
    }

    /** Runs {@code command} and returns its standard output; compiler diagnostics go to a log file. */
    private String run(List<String> command, Path workDir) {
        Path errorLog;
        try {
            errorLog = Files.createTempFile("flowgraph-rustc", ".log");
        } catch (IOException e) {
            throw new IrFrontendException("Could not create compiler log file: " + e.getMessage(), e);
        }
        ProcessBuilder pb = new ProcessBuilder(command)
                .directory(workDir.toFile())
                .redirectError(errorLog.toFile());

        StringBuilder output = new StringBuilder();
        try {
            Process process = pb.start();
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    output.append(line).append('\n');
                }
            }
            int exitCode = process.waitFor();
            if (exitCode != 0) {
                throw new IrFrontendException(command.get(0) + " failed (exit " + exitCode + "):\n"
                        + Files.readString(errorLog, StandardCharsets.UTF_8));
            }
        } catch (IOException e) {
            throw new IrFrontendException("Failed to run " + command.get(0) + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IrFrontendException("Compiler interrupted", e);
        } finally {
            try {
                Files.deleteIfExists(errorLog);
            } catch (IOException e) {
                System.err.println("[flowgraph] WARNING: could not delete " + errorLog + ": " + e.getMessage());
            }
        }
        return output.toString();
    }
}
