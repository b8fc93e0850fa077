package io.github.drompincen.devicebridge.runtime.desktop;

public enum MouseButton { LEFT, RIGHT, MIDDLE }
