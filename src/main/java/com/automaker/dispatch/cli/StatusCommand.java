package com.automaker.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.net.ConnectException;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: automaker status &lt;projectPath&gt;
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show auto mode status for a project")
@Component
public class StatusCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Project path")
    private String projectPath;

    @Option(names = {"--port"}, description = "Server port (default: ${DEFAULT-VALUE})", defaultValue = "8080")
    private int port;

    private final ServerClient client;

    public StatusCommand(ServerClient client) {
        this.client = client;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        try {
            ServerClient.JsonResponse response =
                    client.get(port, "/status?projectPath=" + ServerClient.encode(projectPath));
            if (!response.ok()) {
                ConsoleOutput.error(response.error());
                return 1;
            }
            var status = response.body();
            System.out.println();
            System.out.println("PROJECT " + projectPath);
            if (Boolean.TRUE.equals(status.get("isAutoLoopRunning"))) {
                ConsoleOutput.success("Auto mode: running (max " + status.get("maxConcurrency") + " concurrent)");
            } else if (Boolean.TRUE.equals(status.get("paused"))) {
                ConsoleOutput.error("Auto mode: paused after failures");
            } else {
                ConsoleOutput.info("Auto mode: stopped");
            }
            ConsoleOutput.info("Running features: " + status.get("runningCount"));
            if (status.get("runningFeatures") instanceof List<?> ids) {
                for (Object id : ids) {
                    System.out.println("  - " + id);
                }
            }
            return 0;
        } catch (ConnectException e) {
            ConsoleOutput.serverUnavailable(port);
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return 1;
        } catch (Exception e) {
            ConsoleOutput.error("Status failed: " + e.getMessage());
            return 1;
        }
    }
}
