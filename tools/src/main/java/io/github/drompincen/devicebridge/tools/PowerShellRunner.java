package io.github.drompincen.devicebridge.tools;

import io.github.drompincen.devicebridge.runtime.shell.ShellResult;

import java.io.IOException;

@FunctionalInterface
public interface PowerShellRunner {

    ShellResult run(String script) throws IOException, InterruptedException;
}
