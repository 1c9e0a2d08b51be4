package com.automaker.core.workspace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs external commands ({@code git}, build scripts) in a working directory and captures
 * their combined output.
 */
@Component
public class ProcessRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessRunner.class);

    public record Result(int exitCode, String output) {
        public boolean succeeded() {
            return exitCode == 0;
        }
    }

    public Result run(Path workDir, long timeoutSeconds, List<String> command) {
        log.debug("Running in {}: {}", workDir, String.join(" ", command));
        try {
            Process process = new ProcessBuilder(command)
                    .directory(workDir.toFile())
                    .redirectErrorStream(true)
                    .start();

            StringBuilder output = new StringBuilder();
            try (var reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    output.append(line).append('\n');
                }
            }

            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                return new Result(-1, output + "\nTimed out after " + timeoutSeconds + "s");
            }
            return new Result(process.exitValue(), output.toString());
        } catch (IOException e) {
            log.warn("Command failed to start: {}: {}", String.join(" ", command), e.getMessage());
            return new Result(-1, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new Result(-1, "Interrupted");
        }
    }

    /** Runs a shell command line through {@code sh -c}. */
    public Result runShell(Path workDir, long timeoutSeconds, String commandLine) {
        return run(workDir, timeoutSeconds, List.of("sh", "-c", commandLine));
    }
}
