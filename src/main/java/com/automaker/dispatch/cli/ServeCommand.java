package com.automaker.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: automaker serve
 * <p>
 * The web server is switched on by {@link com.automaker.AutomakerApplication#main} seeing
 * "serve" in the arguments, and {@link CliRunner} skips picocli in that mode. The banner is
 * printed once the server is listening.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Automaker HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Automaker server running on port " + port);
        System.out.println();
        System.out.println("  API:     http://localhost:" + port + "/api/v1/auto-mode");
        System.out.println("  Events:  http://localhost:" + port + "/api/v1/auto-mode/events");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
