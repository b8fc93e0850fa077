package io.github.drompincen.devicebridge.runtime.perception;

/**
 * Decides whether an accessibility tree is usable instead of a screenshot. A tree is rejected
 * when it has fewer than three elements, or when it has three or more interactive elements and
 * not one of them is named.
 */
public record TreeAcceptance(boolean accepted, String reason) {

    static final int MIN_ELEMENTS = 3;

    public static TreeAcceptance evaluate(AccessibilityTree tree) {
        int count = tree.elements().size();
        long interactive = tree.interactiveCount();
        long named = tree.namedInteractiveCount();

        if (count < MIN_ELEMENTS) {
            return new TreeAcceptance(false, "tree has only " + count + " recognizable element(s)");
        }
        if (interactive >= MIN_ELEMENTS && named == 0) {
            return new TreeAcceptance(false, interactive + " interactive elements but none has a name");
        }
        if (!tree.hasDimensions()) {
            return new TreeAcceptance(false, "tree has no Window: WxH header");
        }
        return new TreeAcceptance(true,
                count + " elements, " + interactive + " interactive (" + named + " named)");
    }
}
