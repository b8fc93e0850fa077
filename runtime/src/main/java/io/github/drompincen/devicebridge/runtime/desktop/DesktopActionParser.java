package io.github.drompincen.devicebridge.runtime.desktop;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.devicebridge.runtime.perception.PerceptionMode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns the model's untyped desktop arguments into a {@link DesktopAction}, checking the
 * fields each action requires. Range checks on grid coordinates happen later, against the
 * current screen state.
 */
public final class DesktopActionParser {

    private DesktopActionParser() {}

    public static DesktopAction parse(JsonNode args) throws InvalidToolArgumentsException {
        if (args == null || !args.isObject()) {
            throw new InvalidToolArgumentsException("arguments must be a JSON object");
        }
        String rawAction = text(args, "action");
        if (rawAction == null) {
            throw new InvalidToolArgumentsException("action is required");
        }
        ActionAliases.Resolved resolved = ActionAliases.resolve(rawAction);
        if (resolved == null) {
            throw new InvalidToolArgumentsException("Unknown action: " + rawAction);
        }

        switch (resolved.action()) {
            case "click": {
                Integer[] xy = optionalPoint(args);
                MouseButton button = resolved.button() != null ? resolved.button() : button(args);
                boolean doubleClick = resolved.doubleClick() || args.path("doubleClick").asBoolean(false);
                return new DesktopAction.Click(xy[0], xy[1], button, doubleClick);
            }
            case "mouse_move": {
                Integer[] xy = optionalPoint(args);
                if (xy[0] == null) throw new InvalidToolArgumentsException("x and y are required for mouse_move");
                return new DesktopAction.MouseMove(xy[0], xy[1]);
            }
            case "type": {
                String text = rawText(args, "text");
                if (text == null) throw new InvalidToolArgumentsException("text is required for type");
                return new DesktopAction.TypeText(text);
            }
            case "key_press": {
                String key = text(args, "key");
                if (key == null) throw new InvalidToolArgumentsException("key is required for key_press");
                return new DesktopAction.KeyPress(key, modifiers(args));
            }
            case "scroll": {
                Integer[] xy = optionalPoint(args);
                return new DesktopAction.Scroll(xy[0], xy[1], direction(args), amount(args));
            }
            case "list_windows":
                return new DesktopAction.ListWindows();
            case "focus_window": {
                Long handle = handle(args);
                String title = text(args, "title");
                if (handle == null && title == null) throw new InvalidToolArgumentsException("Provide handle or title");
                return new DesktopAction.FocusWindow(handle, title);
            }
            case "resize_window":
                return new DesktopAction.ResizeWindow(requireHandle(args),
                        integer(args, "x"), integer(args, "y"), integer(args, "width"), integer(args, "height"));
            case "minimize_window":
                return new DesktopAction.ChangeWindowState(requireHandle(args), WindowState.MINIMIZED);
            case "maximize_window":
                return new DesktopAction.ChangeWindowState(requireHandle(args), WindowState.MAXIMIZED);
            case "restore_window":
                return new DesktopAction.ChangeWindowState(requireHandle(args), WindowState.RESTORED);
            case "window_screenshot":
                return new DesktopAction.WindowScreenshot(requireHandle(args), mode(args));
            case "screenshot":
                return new DesktopAction.Screenshot();
            default:
                throw new InvalidToolArgumentsException("Unknown action: " + rawAction);
        }
    }

    private static Integer[] optionalPoint(JsonNode args) throws InvalidToolArgumentsException {
        Integer x = integer(args, "x");
        Integer y = integer(args, "y");
        if ((x == null) != (y == null)) {
            throw new InvalidToolArgumentsException("x and y must be given together");
        }
        return new Integer[] {x, y};
    }

    private static Integer integer(JsonNode args, String field) throws InvalidToolArgumentsException {
        JsonNode node = args.get(field);
        if (node == null || node.isNull()) return null;
        if (node.isIntegralNumber()) {
            if (!node.canConvertToInt()) throw new InvalidToolArgumentsException(field + " is out of range: " + node.asText());
            return node.intValue();
        }
        if (node.isNumber()) return wholeNumber(field, node.doubleValue(), node.asText());
        if (node.isTextual()) {
            double value;
            try {
                value = Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                throw new InvalidToolArgumentsException(field + " must be a number, got \"" + node.asText() + "\"");
            }
            return wholeNumber(field, value, node.asText());
        }
        throw new InvalidToolArgumentsException(field + " must be a number");
    }

    /** Accepts only finite whole values that fit an int; nothing is rounded or narrowed. */
    private static int wholeNumber(String field, double value, String raw) throws InvalidToolArgumentsException {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new InvalidToolArgumentsException(field + " must be a finite number, got \"" + raw + "\"");
        }
        if (value != Math.rint(value)) {
            throw new InvalidToolArgumentsException(field + " must be a whole number, got " + raw);
        }
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new InvalidToolArgumentsException(field + " is out of range: " + raw);
        }
        return (int) value;
    }

    private static Long handle(JsonNode args) throws InvalidToolArgumentsException {
        JsonNode node = args.get("handle");
        if (node == null || node.isNull()) return null;
        if (node.isIntegralNumber()) return node.asLong();
        if (node.isTextual()) {
            try {
                return Long.parseLong(node.asText().trim());
            } catch (NumberFormatException e) {
                throw new InvalidToolArgumentsException("handle must be an integer, got \"" + node.asText() + "\"");
            }
        }
        throw new InvalidToolArgumentsException("handle must be an integer");
    }

    private static long requireHandle(JsonNode args) throws InvalidToolArgumentsException {
        Long handle = handle(args);
        if (handle == null) throw new InvalidToolArgumentsException("handle is required");
        return handle;
    }

    private static MouseButton button(JsonNode args) throws InvalidToolArgumentsException {
        String value = text(args, "button");
        if (value == null) return MouseButton.LEFT;
        try {
            return MouseButton.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidToolArgumentsException("button must be left, right or middle");
        }
    }

    private static ScrollDirection direction(JsonNode args) throws InvalidToolArgumentsException {
        String value = text(args, "direction");
        if (value == null) return ScrollDirection.DOWN;
        try {
            return ScrollDirection.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidToolArgumentsException("direction must be up or down");
        }
    }

    private static int amount(JsonNode args) throws InvalidToolArgumentsException {
        Integer amount = integer(args, "amount");
        if (amount == null) return 3;
        if (amount < 1) throw new InvalidToolArgumentsException("amount must be at least 1");
        return amount;
    }

    private static PerceptionMode mode(JsonNode args) throws InvalidToolArgumentsException {
        try {
            return PerceptionMode.fromName(text(args, "mode"));
        } catch (IllegalArgumentException e) {
            throw new InvalidToolArgumentsException("mode must be auto, accessibility or pixel");
        }
    }

    private static List<String> modifiers(JsonNode args) {
        JsonNode node = args.get("modifiers");
        List<String> modifiers = new ArrayList<>();
        if (node == null || node.isNull()) return modifiers;
        if (node.isArray()) {
            node.forEach(m -> modifiers.add(m.asText().trim().toLowerCase(Locale.ROOT)));
        } else {
            for (String m : node.asText().split("[+,]")) {
                if (!m.isBlank()) modifiers.add(m.trim().toLowerCase(Locale.ROOT));
            }
        }
        return modifiers;
    }

    private static String text(JsonNode args, String field) {
        String value = rawText(args, field);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static String rawText(JsonNode args, String field) {
        JsonNode node = args.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }
}
