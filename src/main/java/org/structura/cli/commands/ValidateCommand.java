package org.structura.cli.commands;

import org.structura.cli.CommandLineInterface;
import org.structura.runtime.EngineOptions;
import org.structura.runtime.api.ConfigurationException;
import org.structura.runtime.api.SchemaException;
import org.structura.runtime.model.StructureFactory;
import org.structura.runtime.plan.ExecutionPlan;
import org.structura.runtime.plan.PlanReader;
import org.structura.runtime.plan.PlanSchemaValidator;
import org.structura.runtime.validation.InvariantValidator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.util.concurrent.Callable;

@Command(name = "validate", description = "Checks a plan document and its initial configuration without running it.")
public class ValidateCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Parameters(index = "0", paramLabel = "PLAN", description = "The plan JSON document.")
    private File planFile;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        try {
            EngineOptions options = parent.getEngineOptions();
            ExecutionPlan plan = new PlanReader().read(planFile.toPath());
            new PlanSchemaValidator(options).validate(plan);
            new StructureFactory(options, new InvariantValidator()).build(plan.initialConfiguration());
            spec.commandLine().getOut().println("Plan '" + plan.planId() + "' is valid: "
                    + plan.initialConfiguration().variant() + ", " + plan.size() + " step(s)");
            return CommandLineInterface.EXIT_OK;
        } catch (SchemaException | ConfigurationException e) {
            spec.commandLine().getErr().println(e.getMessage());
            return CommandLineInterface.EXIT_INVALID_INPUT;
        }
    }
}
