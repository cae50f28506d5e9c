package com.flowgraph.adapter.stage;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of one stage run. Per-unit failures are collected here instead of aborting the run;
 * they never change the exit status.
 */
public class StageReport {

    public record Failure(String unit, String message) {}

    private final String stage;
    private int succeeded;
    private int skipped;
    private int functions;
    private final List<Failure> failures = new ArrayList<>();
    private final List<Path> artifacts = new ArrayList<>();

    public StageReport(String stage) {
        this.stage = stage;
    }

    void unitSucceeded()              { succeeded++; }
    void unitSkipped()                { skipped++; }
    void functionBuilt()              { functions++; }
    void artifactWritten(Path path)   { artifacts.add(path); }

    void unitFailed(String unit, String message) {
        failures.add(new Failure(unit, message));
        System.err.println("[flowgraph] ERROR: " + unit + ": " + message);
    }

    public String getStage()          { return stage; }
    public int getSucceeded()         { return succeeded; }
    public int getSkipped()           { return skipped; }
    public int getFunctions()         { return functions; }
    public int getProcessed()         { return succeeded + failures.size(); }
    public List<Failure> getFailures() { return Collections.unmodifiableList(failures); }
    public List<Path> getArtifacts()  { return Collections.unmodifiableList(artifacts); }

    public String summary() {
        return stage + ": " + getProcessed() + " units processed, " + failures.size() + " failed, "
                + functions + " functions, " + artifacts.size() + " artifacts";
    }
}
