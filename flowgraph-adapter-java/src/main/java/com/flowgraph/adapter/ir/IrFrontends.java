package com.flowgraph.adapter.ir;

import com.flowgraph.adapter.config.PipelineConfig;

import java.nio.file.Path;

/** Picks the frontend for a unit from its file name. */
public final class IrFrontends {

    private IrFrontends() {}

    public static IrFrontend forUnit(Path unit, PipelineConfig config) {
        String name = unit.getFileName().toString();
        if (name.endsWith(".ir.json")) {
            return new IrJsonFrontend();
        }
        if (name.endsWith(".mir")) {
            return new MirFileFrontend();
        }
        return new RustcMirFrontend(config);
    }

    /** File name of the unit without its IR or source extension: {@code vault.ir.json} becomes {@code vault}. */
    public static String unitStem(Path unit) {
        String name = unit.getFileName().toString();
        if (name.endsWith(".ir.json")) {
            return name.substring(0, name.length() - ".ir.json".length());
        }
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
