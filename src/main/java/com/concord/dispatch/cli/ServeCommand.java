package com.concord.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;

/**
 * CLI command: concord serve
 * <p>
 * Serve mode is decided before Spring starts, from {@link #requested}; the web server
 * then keeps the JVM alive and picocli never runs. The endpoint list is printed once
 * the server reports its port.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Concord HTTP server (REST API and SSE event streams)")
@Component
public class ServeCommand implements Runnable {

    static final String NAME = "serve";

    @Value("${server.port:8080}")
    private int configuredPort = 8080;

    /**
     * True when {@code serve} is the subcommand. Only the first argument counts, so an
     * objective such as {@code plan "serve the docs"} stays a CLI run.
     */
    public static boolean requested(String... args) {
        return args.length > 0 && NAME.equals(args[0]);
    }

    @Override
    public void run() {
        // picocli only gets here without a web server, so list where it would listen
        printEndpoints(configuredPort);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        ConsoleOutput.printBanner();
        printEndpoints(event.getWebServer().getPort());
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }

    private static void printEndpoints(int port) {
        ConsoleOutput.info("Concord server on port " + port);
        endpoints(port).forEach(line -> System.out.println("  " + line));
    }

    static List<String> endpoints(int port) {
        String base = "http://localhost:" + port + "/api/v1";
        return List.of(
                "Plans:   " + base + "/plans",
                "Events:  " + base + "/plans/{id}/events",
                "Agents:  " + base + "/agents",
                "Health:  " + base + "/health");
    }
}
