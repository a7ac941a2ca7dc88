package io.lemma.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;

import io.lemma.core.engine.EngineFactory;
import io.lemma.core.engine.spi.EngineProvider;
import io.lemma.kernel.KernelEngineProvider;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

@DisplayName("ReplCommand")
class ReplCommandTest {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final StringWriter err = new StringWriter();

    private int run(String input, EngineFactory factory, String... args) {
        ReplCommand command =
                new ReplCommand(
                        new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)),
                        out,
                        factory);
        CommandLine commandLine = new CommandLine(command);
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }

    private int run(String input, String... args) {
        return run(input, null, args);
    }

    private List<String> responses() {
        return out.toString(StandardCharsets.UTF_8).lines().toList();
    }

    private static String lines(String... requests) {
        return String.join("\n", requests) + "\n";
    }

    @Nested
    @DisplayName("session")
    class Session {

        @Test
        @DisplayName("proves a goal and exits 0 on commit")
        void shouldExitZeroOnCommit() {
            // Given
            String input =
                    lines(
                            "{\"id\":1,\"method\":\"newState\",\"params\":"
                                    + "{\"goals\":[{\"name\":\"g\",\"type\":\"Nat -> Nat\"}]}}",
                            "{\"id\":2,\"method\":\"applyStep\","
                                    + "\"params\":{\"sid\":1,\"step\":\"intro h; exact h\"}}",
                            "{\"id\":3,\"method\":\"queryState\",\"params\":{\"sid\":2}}",
                            "{\"id\":4,\"method\":\"commit\",\"params\":{\"sid\":2}}",
                            "{\"id\":5,\"method\":\"position\"}");

            // When
            int exitCode = run(input);

            // Then
            assertThat(exitCode).isEqualTo(ReplCommand.EXIT_COMMITTED);
            assertThat(responses())
                    .containsExactly(
                            "{\"id\":1,\"result\":1}",
                            "{\"id\":2,\"result\":2}",
                            "{\"id\":3,\"result\":[]}",
                            "{\"id\":4,\"result\":null}");
        }

        @Test
        @DisplayName("exits 1 when input ends without commit")
        void shouldExitOneAtEndOfInput() {
            String input = lines("{\"id\":1,\"method\":\"queryMessages\",\"params\":{\"sid\":0}}");

            int exitCode = run(input);

            assertThat(exitCode).isEqualTo(ReplCommand.EXIT_END_OF_INPUT);
            assertThat(responses()).containsExactly("{\"id\":1,\"result\":[]}");
        }

        @Test
        @DisplayName("applies the configured default budget")
        void shouldApplyDefaultBudget() {
            String input =
                    lines(
                            "{\"id\":1,\"method\":\"newState\","
                                    + "\"params\":{\"goals\":[{\"name\":\"\",\"type\":\"Nat\"}]}}",
                            "{\"id\":2,\"method\":\"applyStep\","
                                    + "\"params\":{\"sid\":1,\"step\":\"repeat skip\"}}");

            run(input, "--budget", "5");

            assertThat(responses().get(1))
                    .isEqualTo(
                            "{\"id\":2,\"error\":{\"code\":1,"
                                    + "\"message\":\"maximum step budget of 5 exceeded\","
                                    + "\"data\":[\"maximum step budget of 5 exceeded\"]}}");
        }

        @Test
        @DisplayName("answers a deeply nested step with a parse error and keeps serving")
        void shouldSurviveDeeplyNestedStep() {
            // Given
            String step = "exact " + "(".repeat(100_000) + "x" + ")".repeat(100_000);
            String input =
                    lines(
                            "{\"id\":1,\"method\":\"applyStep\","
                                    + "\"params\":{\"sid\":0,\"step\":\""
                                    + step
                                    + "\"}}",
                            "{\"id\":2,\"method\":\"queryState\",\"params\":{\"sid\":0}}");

            // When
            int exitCode = run(input);

            // Then
            assertThat(exitCode).isEqualTo(ReplCommand.EXIT_END_OF_INPUT);
            List<String> responses = responses();
            assertThat(responses).hasSize(2);
            assertThat(responses.get(0))
                    .startsWith("{\"id\":1,\"error\":{\"code\":0,")
                    .contains("expression nested too deeply");
            assertThat(responses.get(1)).isEqualTo("{\"id\":2,\"result\":[]}");
        }

        @Test
        @DisplayName("exits 5 when the request stream fails mid-session")
        void shouldExitFiveOnStreamFailure() {
            // Given
            byte[] first =
                    lines("{\"id\":1,\"method\":\"queryMessages\",\"params\":{\"sid\":0}}")
                            .getBytes(StandardCharsets.UTF_8);
            InputStream failing =
                    new InputStream() {
                        private int index;

                        @Override
                        public int read() throws IOException {
                            if (index < first.length) {
                                return first[index++] & 0xFF;
                            }
                            throw new IOException("connection reset");
                        }
                    };
            ReplCommand command = new ReplCommand(failing, out, null);
            CommandLine commandLine = new CommandLine(command);
            commandLine.setErr(new PrintWriter(err, true));

            // When
            int exitCode = commandLine.execute();

            // Then
            assertThat(exitCode).isEqualTo(ReplCommand.EXIT_IO_FAILURE);
            assertThat(err.toString()).contains("I/O failure: connection reset");
            assertThat(responses()).containsExactly("{\"id\":1,\"result\":[]}");
        }

        @Test
        @DisplayName("reports the ambient position given on the command line")
        void shouldReportPosition() {
            String input = lines("{\"id\":1,\"method\":\"position\"}");

            run(input, "--file", "Basic.lean", "--line", "7");

            assertThat(responses())
                    .containsExactly(
                            "{\"id\":1,\"result\":"
                                    + "{\"file\":\"Basic.lean\",\"line\":7,\"column\":0}}");
        }
    }

    @Nested
    @DisplayName("configuration")
    class Configuration {

        @Test
        @DisplayName("reads settings from a properties file")
        void shouldReadConfigFile(@TempDir Path dir) throws Exception {
            // Given
            Path config = dir.resolve("lemma.properties");
            Files.writeString(config, "lemma.namespaces=Bool\nlemma.position.line=3\n");
            String input =
                    lines(
                            "{\"id\":1,\"method\":\"resolveName\","
                                    + "\"params\":{\"sid\":0,\"name\":\"true\"}}",
                            "{\"id\":2,\"method\":\"position\"}");

            // When
            run(input, "--config", config.toString(), "--column", "5");

            // Then
            assertThat(responses())
                    .containsExactly(
                            "{\"id\":1,\"result\":[{\"name\":\"Bool.true\",\"fields\":[]},"
                                    + "{\"name\":\"Bool\",\"fields\":[\"true\"]}]}",
                            "{\"id\":2,\"result\":{\"line\":3,\"column\":5}}");
        }

        @Test
        @DisplayName("exits 4 when the configured engine does not exist")
        void shouldFailForUnknownEngine() {
            int exitCode = run("", "--engine", "missing");

            assertThat(exitCode).isEqualTo(ReplCommand.EXIT_STARTUP_FAILURE);
            assertThat(err.toString()).contains("No engine provider named 'missing'");
            assertThat(responses()).isEmpty();
        }

        @Test
        @DisplayName("uses an explicitly supplied engine factory")
        void shouldUseSuppliedFactory() {
            EngineFactory factory =
                    new EngineFactory(List.<EngineProvider>of(new KernelEngineProvider()));

            String input = lines("{\"id\":1,\"method\":\"commit\",\"params\":{\"sid\":0}}");

            int exitCode = run(input, factory);

            assertThat(exitCode).isEqualTo(ReplCommand.EXIT_COMMITTED);
        }
    }
}
