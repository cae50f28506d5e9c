package com.flowgraph.adapter.ir;

import com.flowgraph.engine.ir.IrModel.IrUnit;

import java.nio.file.Path;

/**
 * Obtains the IR of one compilation unit. IR is obtained once per invocation, so a frontend
 * failure is fatal for the whole CPG run.
 */
public interface IrFrontend {

    /**
     * @throws IrFrontendException if no IR can be produced for {@code unit}
     */
    IrUnit load(Path unit);

    class IrFrontendException extends RuntimeException {
        public IrFrontendException(String msg) { super(msg); }
        public IrFrontendException(String msg, Throwable cause) { super(msg, cause); }
    }
}
