package io.github.drompincen.devicebridge.runtime.desktop;

public enum ScrollDirection { UP, DOWN }
