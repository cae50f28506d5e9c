package com.flowgraph.adapter.stage;

import com.flowgraph.adapter.config.PipelineConfig;
import com.flowgraph.adapter.output.GraphSerializer;
import com.flowgraph.adapter.output.GraphSerializer.GraphIoException;
import com.flowgraph.adapter.source.JdtProgramTreeParser;
import com.flowgraph.adapter.source.JdtProgramTreeParser.SourceParseException;
import com.flowgraph.adapter.source.ProgramTreeParser;
import com.flowgraph.adapter.source.SourceWalker;
import com.flowgraph.engine.tree.ProgramNode;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parses every source file under an input root and writes its program tree as JSON,
 * mirroring the input layout under the output root.
 */
public class AstStage {

    private final PipelineConfig config;
    private final GraphSerializer serializer;
    private final Map<String, ProgramTreeParser> parsers;
    private final SourceWalker walker = new SourceWalker();

    public AstStage(PipelineConfig config) {
        this(config, new GraphSerializer(), Map.of("java", new JdtProgramTreeParser()));
    }

    /** @param parsers parser per lower-case file extension */
    public AstStage(PipelineConfig config, GraphSerializer serializer, Map<String, ProgramTreeParser> parsers) {
        this.config = config;
        this.serializer = serializer;
        this.parsers = parsers;
    }

    public StageReport run(Path inputRoot, Path outputRoot) {
        StageReport report = new StageReport("ast");
        serializer.createDirectory(outputRoot);
        List<Path> files = walker.walk(inputRoot,
                p -> config.isSourceExtension(SourceWalker.extensionOf(p.getFileName().toString())));
        System.err.println("[flowgraph] AST stage: " + files.size() + " source files under " + inputRoot);

        for (Path file : files) {
            String relative = inputRoot.relativize(file).toString();
            String extension = SourceWalker.extensionOf(file.getFileName().toString()).toLowerCase(Locale.ROOT);
            ProgramTreeParser parser = parsers.get(extension);
            if (parser == null) {
                System.err.println("[flowgraph] WARNING: no parser for ." + extension + " files, skipping " + relative);
                report.unitSkipped();
                continue;
            }
            try {
                ProgramNode tree = parser.parseFile(file);
                Path out = outputRoot.resolve(relative + config.getAstSuffix());
                serializer.writeProgramTree(tree, out);
                report.artifactWritten(out);
                report.unitSucceeded();
                System.err.println("[flowgraph] Parsed " + relative);
            } catch (SourceParseException | GraphIoException e) {
                report.unitFailed(relative, e.getMessage());
            } catch (RuntimeException e) {
                report.unitFailed(relative, e.getClass().getSimpleName() + ": " + e.getMessage());
            }
        }

        System.err.println("[flowgraph] " + report.summary());
        return report;
    }
}
