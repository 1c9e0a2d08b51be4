package com.automaker.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.net.ConnectException;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: automaker approve &lt;featureId&gt; [--reject] [--feedback text]
 * <p>
 * Rejecting with feedback asks the agent for a revised plan; rejecting without feedback
 * cancels the run.
 */
@Command(name = "approve", mixinStandardHelpOptions = true, description = "Approve or reject a generated plan")
@Component
public class ApproveCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Feature ID")
    private String featureId;

    @Option(names = {"--reject"}, description = "Reject the plan instead of approving it")
    private boolean reject;

    @Option(names = {"--feedback", "-f"}, description = "Feedback for the agent")
    private String feedback;

    @Option(names = {"--project", "-p"}, description = "Project path, needed when the server restarted since the plan was generated")
    private String projectPath;

    @Option(names = {"--port"}, description = "Server port (default: ${DEFAULT-VALUE})", defaultValue = "8080")
    private int port;

    private final ServerClient client;

    public ApproveCommand(ServerClient client) {
        this.client = client;
    }

    @Override
    public Integer call() {
        Map<String, Object> body = new HashMap<>();
        body.put("featureId", featureId);
        body.put("approved", !reject);
        body.put("feedback", feedback);
        body.put("projectPath", projectPath);
        try {
            ServerClient.JsonResponse response = client.post(port, "/approve-plan", body);
            if (!response.ok()) {
                ConsoleOutput.error(response.error());
                return 1;
            }
            if (reject) {
                ConsoleOutput.info("Plan rejected for " + featureId
                        + (feedback != null ? " - revision requested" : " - run cancelled"));
            } else {
                ConsoleOutput.success("Plan approved for " + featureId);
            }
            return 0;
        } catch (ConnectException e) {
            ConsoleOutput.serverUnavailable(port);
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return 1;
        } catch (Exception e) {
            ConsoleOutput.error("Approve failed: " + e.getMessage());
            return 1;
        }
    }
}
