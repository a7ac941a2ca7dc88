package io.lemma.cli.commands;

import io.lemma.core.engine.EngineFactory;
import io.lemma.core.engine.spi.EngineProvider;
import java.io.PrintWriter;
import java.util.Comparator;
import java.util.List;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/// Lists the engine providers discovered on the class path, highest priority first.
///
/// ### Usage
/// ```bash
/// lemma engines
/// ```
@Command(name = "engines", description = "List available proof engines")
public class EnginesCommand extends LemmaCommand {

    @Spec private CommandSpec spec;

    private final EngineFactory engineFactory;

    public EnginesCommand() {
        this(null);
    }

    EnginesCommand(EngineFactory engineFactory) {
        this.engineFactory = engineFactory;
    }

    @Override
    protected int execute() {
        EngineFactory factory = engineFactory != null ? engineFactory : new EngineFactory();
        PrintWriter out = spec.commandLine().getOut();

        List<EngineProvider> providers =
                factory.getProviders().stream()
                        .sorted(Comparator.comparingInt(EngineProvider::getPriority).reversed())
                        .toList();
        if (providers.isEmpty()) {
            spec.commandLine().getErr().println("No engine providers found");
            return 1;
        }
        for (EngineProvider provider : providers) {
            out.printf("%-16s priority %d%n", provider.getName(), provider.getPriority());
        }
        out.flush();
        return 0;
    }
}
