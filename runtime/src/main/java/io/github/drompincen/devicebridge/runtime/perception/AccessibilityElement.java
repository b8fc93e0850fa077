package io.github.drompincen.devicebridge.runtime.perception;

import java.util.List;
import java.util.Set;

/**
 * One line of an accessibility tree. Bounds are in the window's own pixel space and may be
 * absent for off-screen elements.
 */
public record AccessibilityElement(
        String controlType,
        String name,
        String value,
        Bounds bounds,
        List<String> patterns
) {
    private static final Set<String> INTERACTIVE_TYPES = Set.of(
            "Button", "SplitButton", "MenuItem", "CheckBox", "RadioButton", "ComboBox", "Edit",
            "Hyperlink", "ListItem", "TabItem", "TreeItem", "Slider", "Spinner", "DataItem");

    public record Bounds(int left, int top, int right, int bottom) {
        public Point center() {
            return new Point((left + right) / 2, (top + bottom) / 2);
        }
    }

    public boolean isInteractive() {
        return INTERACTIVE_TYPES.contains(controlType);
    }

    public boolean isNamed() {
        return name != null && !name.isBlank();
    }

    /** Center on the 0-999 grid of a window of the given size, or null without bounds. */
    public Point normalizedCenter(int windowWidth, int windowHeight) {
        if (bounds == null) return null;
        Point c = bounds.center();
        return CoordinateMapper.normalize(
                Math.max(0, Math.min(windowWidth - 1, c.x())),
                Math.max(0, Math.min(windowHeight - 1, c.y())),
                windowWidth, windowHeight);
    }
}
