package io.github.drompincen.devicebridge.runtime.perception;

import java.util.List;

/** Parsed accessibility tree. Width and height come from the {@code Window: WxH} header line. */
public record AccessibilityTree(int width, int height, List<AccessibilityElement> elements, String text) {

    public boolean hasDimensions() {
        return width > 0 && height > 0;
    }

    public long interactiveCount() {
        return elements.stream().filter(AccessibilityElement::isInteractive).count();
    }

    public long namedInteractiveCount() {
        return elements.stream().filter(e -> e.isInteractive() && e.isNamed()).count();
    }
}
