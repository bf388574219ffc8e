package dev.sfc.cli;

import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.sfc.engine.L5xLoader;
import dev.sfc.engine.SfcChart;
import dev.sfc.model.LoadOptions;
import dev.sfc.model.Step;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import picocli.CommandLine.Model.CommandSpec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI entry point: load an L5X file and print its resolved SFC.
 */
@Command(
    name = "sfc-graph",
    mixinStandardHelpOptions = true,
    description = "Print the resolved step/transition graph of an SFC routine."
)
public class SfcGraphCli implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "L5X file, or a file holding a bare SFCContent element")
    private Path file;

    @Option(names = "--program", description = "Program to read (default: first with an SFC routine)")
    private String program;

    @Option(names = "--routine", description = "SFC routine to read (default: first in the program)")
    private String routine;

    @Option(names = "--no-presets", description = "Do not read step presets from program tags")
    private boolean noPresets;

    @Option(names = "--json", description = "Print JSON instead of text")
    private boolean json;

    @Option(names = "--actions", description = "Print steps grouped by action text")
    private boolean actions;

    @Option(names = "--step", description = "Only report the step with this ID, its adjacent transitions and its action group")
    private String stepId;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        LoadOptions options = LoadOptions.defaults().withProgram(program).withRoutine(routine);
        if (noPresets) {
            options = options.withoutPresets();
        }

        SfcChart chart;
        try {
            chart = L5xLoader.loadFromFile(file, options);
        } catch (IOException | IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }

        List<Step> steps = chart.steps();
        boolean filtered = stepId != null;
        if (filtered) {
            Optional<Step> step = chart.step(stepId);
            if (step.isEmpty()) {
                err.println("Error: no step with ID " + stepId);
                return 1;
            }
            steps = List.of(step.get());
        }

        if (actions) {
            out.print(ChartReport.actions(chart, steps));
        } else if (json) {
            ObjectNode root = filtered ? ChartReport.json(chart, steps) : ChartReport.json(chart);
            out.println(ChartReport.jsonString(root));
        } else {
            out.print(ChartReport.text(chart, steps));
        }
        out.flush();
        return 0;
    }
}
