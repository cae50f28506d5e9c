package com.flowgraph.adapter.stage;

import com.flowgraph.adapter.config.PipelineConfig;
import com.flowgraph.adapter.ir.IrFrontend;
import com.flowgraph.adapter.ir.IrFrontends;
import com.flowgraph.adapter.output.ArtifactNamer;
import com.flowgraph.adapter.output.DotRenderer;
import com.flowgraph.adapter.output.GraphSerializer;
import com.flowgraph.adapter.output.GraphSerializer.GraphIoException;
import com.flowgraph.engine.cpg.CodePropertyGraph;
import com.flowgraph.engine.cpg.CpgBuilder;
import com.flowgraph.engine.cpg.EdgeKind;
import com.flowgraph.engine.ir.IrModel.IrFunction;
import com.flowgraph.engine.ir.IrModel.IrUnit;

import java.nio.file.Path;

/**
 * Obtains the IR of one unit and writes a code property graph per function as
 * {@code <unit stem>.<function>.cpg.dot} and {@code .cpg.json}.
 *
 * A frontend failure propagates: without IR there is nothing to continue with.
 */
public class CpgStage {

    private final PipelineConfig config;
    private final GraphSerializer serializer;
    private final DotRenderer renderer;
    private final CpgBuilder builder = new CpgBuilder();

    public CpgStage(PipelineConfig config) {
        this(config, new GraphSerializer(), new DotRenderer());
    }

    public CpgStage(PipelineConfig config, GraphSerializer serializer, DotRenderer renderer) {
        this.config = config;
        this.serializer = serializer;
        this.renderer = renderer;
    }

    public StageReport run(Path unit, Path outputRoot) {
        return run(unit, outputRoot, IrFrontends.forUnit(unit, config));
    }

    public StageReport run(Path unit, Path outputRoot, IrFrontend frontend) {
        StageReport report = new StageReport("cpg");
        serializer.createDirectory(outputRoot);
        System.err.println("[flowgraph] Loading IR for " + unit + " via " + frontend.getClass().getSimpleName());
        IrUnit ir = frontend.load(unit);
        String stem = IrFrontends.unitStem(unit);
        String unitName = ir.unit != null ? ir.unit : unit.getFileName().toString();
        ArtifactNamer namer = new ArtifactNamer();

        for (IrFunction function : ir.getFunctions()) {
            String base = stem + "." + namer.uniqueStem(function.name);
            try {
                CodePropertyGraph cpg = builder.build(function);
                if (config.isWriteDot()) {
                    Path dot = outputRoot.resolve(base + ".cpg.dot");
                    serializer.writeText(renderer.renderCpg(function.name, cpg), dot);
                    report.artifactWritten(dot);
                }
                if (config.isWriteJson()) {
                    Path json = outputRoot.resolve(base + ".cpg.json");
                    serializer.writeCpg(function.name, unitName, cpg, json);
                    report.artifactWritten(json);
                }
                report.functionBuilt();
                report.unitSucceeded();
                System.err.println("[flowgraph] " + function.name + ": " + cpg.nodeCount() + " nodes, "
                        + cpg.edgesOfKind(EdgeKind.CONTROL_FLOW).size() + " control-flow edges, "
                        + cpg.edgesOfKind(EdgeKind.DATA_FLOW).size() + " data-flow edges");
            } catch (GraphIoException e) {
                report.unitFailed(function.name, e.getMessage());
            }
        }

        System.err.println("[flowgraph] " + report.summary());
        return report;
    }
}
