package com.flowgraph.adapter.stage;

import com.flowgraph.adapter.config.PipelineConfig;
import com.flowgraph.adapter.output.ArtifactNamer;
import com.flowgraph.adapter.output.DotRenderer;
import com.flowgraph.adapter.output.GraphSerializer;
import com.flowgraph.adapter.output.GraphSerializer.GraphIoException;
import com.flowgraph.adapter.source.SourceWalker;
import com.flowgraph.engine.cfg.ControlFlowGraph;
import com.flowgraph.engine.discovery.DiscoveredFunction;
import com.flowgraph.engine.discovery.FunctionDiscovery;
import com.flowgraph.engine.tree.GrammarProfile;
import com.flowgraph.engine.tree.ProgramNode;

import java.nio.file.Path;
import java.util.List;

/**
 * Loads every program tree under an input root, builds one CFG per function and writes
 * {@code <stem>.<function>.cfg.dot} and {@code <stem>.<function>.cfg.json} under the output root,
 * where the stem is the tree's relative path without the input suffix.
 */
public class CfgStage {

    private final PipelineConfig config;
    private final GraphSerializer serializer;
    private final DotRenderer renderer;
    private final SourceWalker walker = new SourceWalker();

    public CfgStage(PipelineConfig config) {
        this(config, new GraphSerializer(), new DotRenderer());
    }

    public CfgStage(PipelineConfig config, GraphSerializer serializer, DotRenderer renderer) {
        this.config = config;
        this.serializer = serializer;
        this.renderer = renderer;
    }

    public StageReport run(Path inputRoot, Path outputRoot) {
        StageReport report = new StageReport("cfg");
        serializer.createDirectory(outputRoot);
        String suffix = config.getCfgInputSuffix();
        List<Path> files = walker.walk(inputRoot, p -> {
            String name = p.getFileName().toString();
            return name.endsWith(suffix) && name.length() > suffix.length();
        });
        System.err.println("[flowgraph] CFG stage: " + files.size() + " program trees under " + inputRoot);

        for (Path file : files) {
            String relative = inputRoot.relativize(file).toString();
            String stem = relative.substring(0, relative.length() - suffix.length());
            String sourceName = file.getFileName().toString();
            sourceName = sourceName.substring(0, sourceName.length() - suffix.length());
            GrammarProfile profile = config.profileFor(SourceWalker.extensionOf(sourceName));

            try {
                ProgramNode tree = serializer.readProgramTree(file);
                FunctionDiscovery discovery = new FunctionDiscovery(profile);
                ArtifactNamer namer = new ArtifactNamer();
                List<DiscoveredFunction> functions = discovery.discover(tree);
                for (DiscoveredFunction function : functions) {
                    ControlFlowGraph cfg = discovery.buildControlFlowGraph(function);
                    String base = stem + "." + namer.uniqueStem(function.name());
                    writeArtifacts(report, function.name(), sourceName, cfg, outputRoot, base);
                    report.functionBuilt();
                }
                report.unitSucceeded();
                System.err.println("[flowgraph] " + relative + ": " + functions.size()
                        + " functions (" + profile.getName() + " grammar)");
            } catch (GraphIoException e) {
                report.unitFailed(relative, e.getMessage());
            } catch (RuntimeException e) {
                // One unreadable tree must not stop the rest of the batch.
                report.unitFailed(relative, e.getClass().getSimpleName() + ": " + e.getMessage());
            }
        }

        System.err.println("[flowgraph] " + report.summary());
        return report;
    }

    private void writeArtifacts(StageReport report, String function, String source,
                                ControlFlowGraph cfg, Path outputRoot, String base) {
        if (config.isWriteDot()) {
            Path dot = outputRoot.resolve(base + ".cfg.dot");
            serializer.writeText(renderer.renderCfg(function, cfg), dot);
            report.artifactWritten(dot);
        }
        if (config.isWriteJson()) {
            Path json = outputRoot.resolve(base + ".cfg.json");
            serializer.writeCfg(function, source, cfg, json);
            report.artifactWritten(json);
        }
    }
}
