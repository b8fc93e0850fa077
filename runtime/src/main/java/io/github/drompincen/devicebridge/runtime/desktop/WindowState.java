package io.github.drompincen.devicebridge.runtime.desktop;

public enum WindowState { MINIMIZED, MAXIMIZED, RESTORED }
