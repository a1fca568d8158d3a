package io.markwise.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "serve", description = "Start the HTTP gateway")
public final class ServeCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"--port"}, description = "Gateway port (defaults to gateway.port)")
    Integer port;

    @Option(names = {"--host"}, description = "Bind address (defaults to gateway.host)")
    String host;

    public ServeCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            return context.serveRunner().run(port, host);
        } catch (Exception e) {
            System.err.println("Serve command failed: " + e.getMessage());
            return 1;
        }
    }
}
