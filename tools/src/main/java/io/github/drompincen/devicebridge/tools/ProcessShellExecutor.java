package io.github.drompincen.devicebridge.tools;

import io.github.drompincen.devicebridge.runtime.shell.ShellExecutor;
import io.github.drompincen.devicebridge.runtime.shell.ShellResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Runs commands through the platform shell: PowerShell on Windows, {@code sh -c} elsewhere.
 * A command that outlives the timeout is killed and reported with exit code -1.
 */
public class ProcessShellExecutor implements ShellExecutor {

    private static final Logger log = LoggerFactory.getLogger(ProcessShellExecutor.class);

    public static final int TIMED_OUT = -1;

    private final Duration timeout;
    private final Path workingDirectory;
    private final boolean windows;

    public ProcessShellExecutor(Duration timeout, Path workingDirectory) {
        this(timeout, workingDirectory, isWindows());
    }

    ProcessShellExecutor(Duration timeout, Path workingDirectory, boolean windows) {
        this.timeout = timeout;
        this.workingDirectory = workingDirectory;
        this.windows = windows;
    }

    public static boolean isWindows() {
        return System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows");
    }

    @Override
    public ShellResult execute(String command) throws IOException, InterruptedException {
        return run(commandLine(command));
    }

    /** Runs a multi-line PowerShell script, passed base64 encoded so no quoting is needed. */
    public ShellResult runPowerShellScript(String script) throws IOException, InterruptedException {
        String encoded = Base64.getEncoder().encodeToString(script.getBytes(StandardCharsets.UTF_16LE));
        return run(List.of("powershell.exe", "-NoProfile", "-NonInteractive", "-EncodedCommand", encoded));
    }

    List<String> commandLine(String command) {
        if (windows) {
            return List.of("powershell.exe", "-NoProfile", "-NonInteractive", "-Command", command);
        }
        return List.of("sh", "-c", command);
    }

    private ShellResult run(List<String> argv) throws IOException, InterruptedException {
        ProcessBuilder pb = new ProcessBuilder(argv).redirectErrorStream(false);
        if (workingDirectory != null) {
            pb.directory(workingDirectory.toFile());
        }
        Process process = pb.start();

        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();
        Thread stdoutThread = drain(process.getInputStream(), stdout, "stdout");
        Thread stderrThread = drain(process.getErrorStream(), stderr, "stderr");

        boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (!finished) {
            process.destroyForcibly();
            stdoutThread.join(1000);
            stderrThread.join(1000);
            log.warn("Command timed out after {}s: {}", timeout.toSeconds(), argv.get(0));
            stderr.append("Command timed out after ").append(timeout.toSeconds()).append(" seconds\n");
            return new ShellResult(snapshot(stdout), snapshot(stderr), TIMED_OUT);
        }

        stdoutThread.join(1000);
        stderrThread.join(1000);
        return new ShellResult(snapshot(stdout), snapshot(stderr), process.exitValue());
    }

    private static Thread drain(InputStream in, StringBuilder sink, String name) {
        Thread thread = new Thread(() -> {
            try (var reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    synchronized (sink) {
                        sink.append(line).append("\n");
                    }
                }
            } catch (IOException e) {
                log.debug("Stopped reading {}: {}", name, e.getMessage());
            }
        }, "shell-" + name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    private static String snapshot(StringBuilder sink) {
        synchronized (sink) {
            return sink.toString();
        }
    }
}
