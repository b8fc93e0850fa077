package io.github.drompincen.devicebridge.runtime.shell;

import java.io.IOException;

/** Runs one command string and returns its output. Never retries. */
public interface ShellExecutor {

    ShellResult execute(String command) throws IOException, InterruptedException;
}
