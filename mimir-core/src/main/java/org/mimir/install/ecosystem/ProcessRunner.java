package org.mimir.install.ecosystem;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs an external command with a hard timeout. Output (stdout and stderr merged) goes to a
 * temp file so a chatty tool can never block on a full pipe.
 */
public class ProcessRunner {

    private static final int MAX_OUTPUT_CHARS = 4000;

    public record Result(int exitCode, String output) {
        public boolean ok() {
            return exitCode == 0;
        }
    }

    public Result run(List<String> command, Path workDir, Duration timeout)
            throws IOException, InterruptedException, TimeoutException {
        Path out = Files.createTempFile("mimir-proc-", ".log");
        try {
            ProcessBuilder pb = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .redirectOutput(out.toFile());
            if (workDir != null) {
                Files.createDirectories(workDir);
                pb.directory(workDir.toFile());
            }
            Process process = pb.start();
            boolean exited;
            try {
                exited = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                process.destroyForcibly();
                throw e;
            }
            if (!exited) {
                process.destroyForcibly();
                throw new TimeoutException(String.join(" ", command) + " timed out after " + timeout);
            }
            return new Result(process.exitValue(), tail(Files.readString(out, StandardCharsets.UTF_8)));
        } finally {
            Files.deleteIfExists(out);
        }
    }

    private static String tail(String s) {
        String t = s.strip();
        return t.length() <= MAX_OUTPUT_CHARS ? t : "..." + t.substring(t.length() - MAX_OUTPUT_CHARS);
    }
}
