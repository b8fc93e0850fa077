package io.github.drompincen.devicebridge.runtime.shell;

public record ShellResult(String stdout, String stderr, int exitCode) {}
