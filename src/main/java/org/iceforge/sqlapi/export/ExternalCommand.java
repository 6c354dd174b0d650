package org.iceforge.sqlapi.export;

import org.iceforge.sqlapi.error.ExportFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external program to completion, failing on a non-zero exit.
 * Arguments are passed as a list, never through a shell.
 */
public class ExternalCommand {
    private static final Logger log = LoggerFactory.getLogger(ExternalCommand.class);

    private final Duration timeout;

    public ExternalCommand(Duration timeout) {
        this.timeout = timeout;
    }

    /**
     * @return the combined stdout/stderr output
     * @throws ExportFailedException on a non-zero exit, a timeout, or when the program cannot be started
     */
    public String run(List<String> command, Path workDir) {
        String program = command.isEmpty() ? "" : command.get(0);
        // output goes to a file outside workDir so the wait below is bounded by the timeout alone
        Path outputFile;
        try {
            outputFile = Files.createTempFile("sqlapi-cmd-", ".log");
        } catch (IOException e) {
            throw new ExportFailedException("Could not create output file for " + program + ": " + e.getMessage(), e);
        }

        try {
            Process process;
            try {
                process = new ProcessBuilder(command)
                        .directory(workDir.toFile())
                        .redirectErrorStream(true)
                        .redirectOutput(outputFile.toFile())
                        .start();
            } catch (IOException e) {
                throw new ExportFailedException("Could not start " + program + ": " + e.getMessage(), e);
            }
            return await(process, program, outputFile);
        } finally {
            ExportCoalescer.delete(outputFile);
        }
    }

    private String await(Process process, String program, Path outputFile) {
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new ExportFailedException(program + " timed out after " + timeout);
            }
            String output = Files.readString(outputFile, StandardCharsets.UTF_8).strip();
            int exit = process.exitValue();
            if (exit != 0) {
                throw new ExportFailedException(output.isEmpty()
                        ? program + " failed with exit code " + exit
                        : output);
            }
            if (!output.isEmpty()) log.debug("{}: {}", program, output);
            return output;
        } catch (IOException e) {
            throw new ExportFailedException("Failed reading output of " + program + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new ExportFailedException(program + " was interrupted", e);
        }
    }
}
