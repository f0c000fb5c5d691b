package org.structura.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.structura.junit.extensions.logging.ExpectLog;
import org.structura.junit.extensions.logging.LogLevel;
import org.structura.junit.extensions.logging.LogWatchExtension;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class CommandLineInterfaceTest {

    private static final String PLANS = "src/test/resources/plans/";

    private final ObjectMapper mapper = new ObjectMapper();
    private StringWriter out;
    private StringWriter err;
    private CommandLine commandLine;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
        commandLine = CommandLineInterface.newCommandLine();
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
    }

    private List<JsonNode> outputLines() throws Exception {
        List<JsonNode> nodes = new ArrayList<>();
        for (String line : out.toString().split("\\R")) {
            if (!line.isBlank()) {
                nodes.add(mapper.readTree(line));
            }
        }
        return nodes;
    }

    @Test
    void commandNameAndSubcommands() {
        assertThat(commandLine.getCommandName()).isEqualTo("structura");
        assertThat(commandLine.getSubcommands()).containsKeys("run", "validate", "help");
    }

    @Test
    void runPrintsInitialSnapshotAndOneResultPerStep() throws Exception {
        int exitCode = commandLine.execute("run", PLANS + "list-insert.json");

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_OK);
        List<JsonNode> lines = outputLines();
        assertThat(lines).hasSize(3);
        assertThat(lines.get(0).get("stepIndex").asInt()).isZero();
        assertThat(lines.get(0).get("variant").asText()).isEqualTo("SINGLY_LINKED");
        assertThat(lines.get(1).get("success").asBoolean()).isTrue();
        assertThat(lines.get(1).get("state").get("values"))
                .extracting(JsonNode::asText)
                .containsExactly("A", "C", "B");
        assertThat(lines.get(2).get("operation").asText()).isEqualTo("TRAVERSE");
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, loggerPattern = "org\\.structura\\.runtime\\.ExecutionEngine",
            messagePattern = ".*'stack-overflow' step 1 \\(PUSH\\) rejected.*")
    void runStopsAtTheFirstRejectionWithExitCodeOne() throws Exception {
        int exitCode = commandLine.execute("run", PLANS + "stack-overflow.json");

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_REJECTED);
        List<JsonNode> lines = outputLines();
        assertThat(lines).hasSize(3);
        JsonNode rejection = lines.get(2);
        assertThat(rejection.get("success").asBoolean()).isFalse();
        assertThat(rejection.get("edgeCase").asText()).isEqualTo("OVERFLOW");
        assertThat(rejection.get("errors")).isNotEmpty();
        assertThat(rejection.has("state")).isFalse();
    }

    @Test
    void runUntilStopsBeforeTheRejectedStep() throws Exception {
        int exitCode = commandLine.execute("run", "--until", "0", PLANS + "stack-overflow.json");

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(outputLines()).hasSize(2);
    }

    @Test
    void runReportsMalformedPlanOnStderr() {
        int exitCode = commandLine.execute("run", PLANS + "malformed-steps.json");

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_INVALID_INPUT);
        assertThat(out.toString()).isEmpty();
        assertThat(err.toString()).isNotBlank();
    }

    @Test
    void validateAcceptsAWellFormedPlan() {
        int exitCode = commandLine.execute("validate", PLANS + "list-insert.json");

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(out.toString()).contains("Plan 'list-insert' is valid: SINGLY_LINKED, 2 step(s)");
    }

    @Test
    void validateRejectsABadInitialConfiguration() {
        assertThat(commandLine.execute("validate", PLANS + "bad-capacity.json"))
                .isEqualTo(CommandLineInterface.EXIT_INVALID_INPUT);
        assertThat(err.toString()).isNotBlank();
    }

    @Test
    void validateRejectsAnUnknownVariant() {
        assertThat(commandLine.execute("validate", PLANS + "not-a-plan.json"))
                .isEqualTo(CommandLineInterface.EXIT_INVALID_INPUT);
    }

    @Test
    void validateRejectsAMissingFile(@TempDir Path dir) {
        assertThat(commandLine.execute("validate", dir.resolve("absent.json").toString()))
                .isEqualTo(CommandLineInterface.EXIT_INVALID_INPUT);
    }

    @Test
    void configFileLimitsArePassedToTheEngine(@TempDir Path dir) throws Exception {
        Path conf = dir.resolve("tight.conf");
        Files.writeString(conf, "structura.engine.max-plan-steps = 1\n");

        int exitCode = commandLine.execute("-c", conf.toString(), "validate", PLANS + "list-insert.json");

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_INVALID_INPUT);
        assertThat(err.toString()).isNotBlank();
    }

    @Test
    void missingConfigFileIsInvalidInput(@TempDir Path dir) {
        int exitCode = commandLine.execute("-c", dir.resolve("nope.conf").toString(), "validate", PLANS + "list-insert.json");

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_INVALID_INPUT);
        assertThat(err.toString()).contains("nope.conf");
    }
}
