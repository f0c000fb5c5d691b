package org.structura.cli.commands;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.structura.cli.CommandLineInterface;
import org.structura.cli.rendering.SnapshotJson;
import org.structura.runtime.ExecutionEngine;
import org.structura.runtime.StateTransitionResult;
import org.structura.runtime.api.ConfigurationException;
import org.structura.runtime.api.SchemaException;
import org.structura.runtime.plan.ExecutionPlan;
import org.structura.runtime.plan.PlanReader;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.PrintWriter;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(name = "run", description = "Executes a plan step by step and prints every snapshot as JSON.")
public class RunCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(RunCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Parameters(index = "0", paramLabel = "PLAN", description = "The plan JSON document.")
    private File planFile;

    @Option(names = "--until", paramLabel = "N", description = "Stop after applying step N.")
    private Integer until;

    @Option(names = "--pretty", description = "Pretty-print the JSON output.")
    private boolean pretty;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        SnapshotJson json = new SnapshotJson(pretty);

        ExecutionEngine engine;
        ExecutionPlan plan;
        try {
            engine = new ExecutionEngine(parent.getEngineOptions());
            plan = new PlanReader().read(planFile.toPath());
            engine.initialize(plan);
        } catch (SchemaException | ConfigurationException e) {
            err.println(e.getMessage());
            return CommandLineInterface.EXIT_INVALID_INPUT;
        }
        out.println(json.write(json.snapshot(engine.getCurrentState())));

        int last = until != null ? Math.min(until, plan.size() - 1) : plan.size() - 1;
        while (engine.nextStepIndex() <= last) {
            Optional<StateTransitionResult> result = engine.applyNext();
            if (result.isEmpty()) {
                break;
            }
            out.println(json.write(json.result(result.get())));
            if (!result.get().success()) {
                LOG.debug("Stopping plan '{}' at rejected step {}", plan.planId(), result.get().stepIndex());
                return CommandLineInterface.EXIT_REJECTED;
            }
        }
        out.flush();
        return CommandLineInterface.EXIT_OK;
    }
}
