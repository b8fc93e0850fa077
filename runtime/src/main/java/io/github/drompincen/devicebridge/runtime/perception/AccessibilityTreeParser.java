package io.github.drompincen.devicebridge.runtime.perception;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses tree text of the form:
 * <pre>
 * Window: 1280x800
 *   [Button] Name="OK" Value="" bounds=[10,20][110,50] &lt;Invoke&gt;
 * </pre>
 * Lines that do not start with a bracketed control type are ignored.
 */
public final class AccessibilityTreeParser {

    private static final Pattern HEADER = Pattern.compile("^\\s*Window:\\s*(\\d+)\\s*x\\s*(\\d+)");
    private static final Pattern TYPE = Pattern.compile("^\\s*\\[([A-Za-z][\\w ]*)]");
    private static final Pattern NAME = Pattern.compile("\\bName=\"((?:[^\"\\\\]|\\\\.)*)\"");
    private static final Pattern VALUE = Pattern.compile("\\bValue=\"((?:[^\"\\\\]|\\\\.)*)\"");
    private static final Pattern BOUNDS = Pattern.compile("bounds=\\[(-?\\d+),(-?\\d+)]\\[(-?\\d+),(-?\\d+)]");
    private static final Pattern PATTERNS = Pattern.compile("<([^>]*)>\\s*$");

    private AccessibilityTreeParser() {}

    public static AccessibilityTree parse(String text) {
        if (text == null) return new AccessibilityTree(0, 0, List.of(), "");
        int width = 0;
        int height = 0;
        List<AccessibilityElement> elements = new ArrayList<>();
        for (String line : text.split("\\R")) {
            Matcher header = HEADER.matcher(line);
            if (header.find()) {
                width = Integer.parseInt(header.group(1));
                height = Integer.parseInt(header.group(2));
                continue;
            }
            AccessibilityElement element = parseLine(line);
            if (element != null) elements.add(element);
        }
        return new AccessibilityTree(width, height, List.copyOf(elements), text);
    }

    static AccessibilityElement parseLine(String line) {
        Matcher type = TYPE.matcher(line);
        if (!type.find()) return null;
        String rest = line.substring(type.end());
        return new AccessibilityElement(
                type.group(1).trim(),
                group(NAME, rest),
                group(VALUE, rest),
                bounds(rest),
                patterns(rest));
    }

    private static String group(Pattern pattern, String s) {
        Matcher m = pattern.matcher(s);
        return m.find() ? m.group(1).replace("\\\"", "\"") : null;
    }

    private static AccessibilityElement.Bounds bounds(String s) {
        Matcher m = BOUNDS.matcher(s);
        if (!m.find()) return null;
        return new AccessibilityElement.Bounds(
                Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)),
                Integer.parseInt(m.group(3)), Integer.parseInt(m.group(4)));
    }

    private static List<String> patterns(String s) {
        Matcher m = PATTERNS.matcher(s);
        if (!m.find() || m.group(1).isBlank()) return List.of();
        return Arrays.stream(m.group(1).split(","))
                .map(String::trim)
                .filter(p -> !p.isEmpty())
                .toList();
    }
}
