package com.flowgraph.adapter.ir;

import com.flowgraph.adapter.ir.IrFrontend.IrFrontendException;
import com.flowgraph.engine.ir.IrModel.IrBlock;
import com.flowgraph.engine.ir.IrModel.IrFunction;
import com.flowgraph.engine.ir.IrModel.IrUnit;

import java.util.HashSet;
import java.util.Set;

/**
 * Checks the shape the CPG builder relies on: every block has a terminator, block ids are
 * unique within a function, and every successor names a block of the same function.
 */
public final class IrValidator {

    private IrValidator() {}

    public static IrUnit validate(IrUnit unit, String source) {
        if (unit == null) {
            throw new IrFrontendException("No IR in " + source);
        }
        for (IrFunction function : unit.getFunctions()) {
            if (function.name == null || function.name.isBlank()) {
                throw new IrFrontendException("Function without a name in " + source);
            }
            Set<Integer> ids = new HashSet<>();
            for (IrBlock block : function.getBlocks()) {
                if (!ids.add(block.id)) {
                    throw new IrFrontendException("Duplicate block bb" + block.id + " in " + function.name);
                }
                if (block.terminator == null) {
                    throw new IrFrontendException("Block bb" + block.id + " of " + function.name + " has no terminator");
                }
            }
            for (IrBlock block : function.getBlocks()) {
                for (int successor : block.terminator.getSuccessors()) {
                    if (!ids.contains(successor)) {
                        throw new IrFrontendException("Block bb" + block.id + " of " + function.name
                                + " jumps to missing block bb" + successor);
                    }
                }
            }
        }
        return unit;
    }
}
