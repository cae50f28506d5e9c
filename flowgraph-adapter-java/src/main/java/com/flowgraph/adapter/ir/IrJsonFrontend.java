package com.flowgraph.adapter.ir;

import com.flowgraph.engine.ir.IrModel.IrUnit;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.FileReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/** Reads IR already dumped as a JSON document ({@code *.ir.json}). */
public class IrJsonFrontend implements IrFrontend {

    private static final Gson GSON = new Gson();

    @Override
    public IrUnit load(Path unit) {
        if (!Files.isRegularFile(unit)) {
            throw new IrFrontendException("IR document not found: " + unit);
        }
        IrUnit ir;
        try (FileReader reader = new FileReader(unit.toFile(), StandardCharsets.UTF_8)) {
            ir = GSON.fromJson(reader, IrUnit.class);
        } catch (JsonParseException e) {
            throw new IrFrontendException("Malformed IR document " + unit + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new IrFrontendException("Failed to read IR document " + unit + ": " + e.getMessage(), e);
        }
        if (ir != null && ir.unit == null) {
            ir.unit = unit.getFileName().toString();
        }
        return IrValidator.validate(ir, unit.toString());
    }
}
