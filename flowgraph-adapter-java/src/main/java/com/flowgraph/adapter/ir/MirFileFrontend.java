package com.flowgraph.adapter.ir;

import com.flowgraph.engine.ir.IrModel.IrUnit;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/** Reads a MIR text dump saved to disk ({@code *.mir}). */
public class MirFileFrontend implements IrFrontend {

    private final MirTextParser parser = new MirTextParser();

    @Override
    public IrUnit load(Path unit) {
        String text;
        try {
            text = Files.readString(unit, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IrFrontendException("Failed to read MIR dump " + unit + ": " + e.getMessage(), e);
        }
        try {
            return IrValidator.validate(parser.parse(text, unit.getFileName().toString()), unit.toString());
        } catch (MirTextParser.MirParseException e) {
            throw new IrFrontendException("Malformed MIR in " + unit + ": " + e.getMessage(), e);
        }
    }
}
