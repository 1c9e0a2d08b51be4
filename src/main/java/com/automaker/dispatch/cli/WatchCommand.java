package com.automaker.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.net.ConnectException;
import java.net.http.HttpResponse;
import java.util.concurrent.Callable;
import java.util.stream.Stream;

/**
 * CLI command: automaker watch &lt;projectPath&gt;
 * <p>
 * Streams a project's auto-mode events from a running server over SSE.
 */
@Command(name = "watch", mixinStandardHelpOptions = true, description = "Stream auto mode events for a project")
@Component
public class WatchCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Project path")
    private String projectPath;

    @Option(names = {"--port"}, description = "Server port (default: ${DEFAULT-VALUE})", defaultValue = "8080")
    private int port;

    private final ServerClient client;

    public WatchCommand(ServerClient client) {
        this.client = client;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Watching " + projectPath + " (connecting to localhost:" + port + ")...");
        System.out.println();
        try {
            HttpResponse<Stream<String>> response = client.streamEvents(port, projectPath);
            if (response.statusCode() != 200) {
                ConsoleOutput.error("Server returned HTTP " + response.statusCode());
                return 1;
            }
            final String[] currentEventType = {""};
            response.body().forEach(line -> {
                if (line.startsWith("event:")) {
                    currentEventType[0] = line.substring(6).trim();
                } else if (line.startsWith("data:")) {
                    String eventType = currentEventType[0].isEmpty() ? "message" : currentEventType[0];
                    ConsoleOutput.watchEvent(eventType, line.substring(5).trim());
                    currentEventType[0] = "";
                }
            });
            System.out.println();
            ConsoleOutput.info("Stream ended.");
            return 0;
        } catch (ConnectException e) {
            ConsoleOutput.serverUnavailable(port);
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.info("Watch interrupted.");
            return 1;
        } catch (Exception e) {
            ConsoleOutput.error("Watch failed: " + e.getMessage());
            return 1;
        }
    }
}
