package io.github.drompincen.devicebridge.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.devicebridge.runtime.desktop.AutomationException;
import io.github.drompincen.devicebridge.runtime.desktop.WindowInfo;
import io.github.drompincen.devicebridge.runtime.desktop.WindowState;
import io.github.drompincen.devicebridge.runtime.perception.TreeSnapshot;
import io.github.drompincen.devicebridge.runtime.shell.ShellResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Rectangle;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Windows window management through PowerShell scripts calling user32 and UI Automation.
 * Scripts live under {@code /scripts} on the classpath and take {@code {{NAME}}} placeholders.
 */
public class PowerShellWindowControl implements WindowControl {

    private static final Logger log = LoggerFactory.getLogger(PowerShellWindowControl.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private static final Pattern ORIGIN = Pattern.compile("^Origin:\\s*(-?\\d+)\\s*,\\s*(-?\\d+)\\s*$");

    static final int MAX_TREE_DEPTH = 12;
    static final int MAX_TREE_ELEMENTS = 400;

    private final PowerShellRunner runner;
    private final Map<String, String> scripts = new ConcurrentHashMap<>();

    public PowerShellWindowControl(PowerShellRunner runner) {
        this.runner = runner;
    }

    @Override
    public List<WindowInfo> listWindows() throws AutomationException {
        String json = run("list-windows", Map.of()).trim();
        if (json.isEmpty()) return List.of();
        try {
            JsonNode root = MAPPER.readTree(json);
            List<WindowInfo> windows = new ArrayList<>();
            if (root.isArray()) {
                for (JsonNode node : root) windows.add(MAPPER.treeToValue(node, WindowInfo.class));
            } else if (root.isObject()) {
                windows.add(MAPPER.treeToValue(root, WindowInfo.class));
            }
            return windows;
        } catch (JsonProcessingException e) {
            throw new AutomationException("Unreadable window list: " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public long focus(Long handle, String title) throws AutomationException {
        String out = run("focus-window", Map.of(
                "HANDLE", handle == null ? "0" : Long.toString(handle),
                "TITLE", title == null ? "" : quote(title))).trim();
        try {
            return Long.parseLong(lastLine(out));
        } catch (NumberFormatException e) {
            throw new AutomationException("Unexpected focus output: " + out, e);
        }
    }

    @Override
    public void resize(long handle, Integer x, Integer y, Integer width, Integer height) throws AutomationException {
        run("resize-window", Map.of(
                "HANDLE", Long.toString(handle),
                "X", orDefault(x, -1),
                "Y", orDefault(y, -1),
                "WIDTH", orDefault(width, 0),
                "HEIGHT", orDefault(height, 0)));
    }

    @Override
    public void setState(long handle, WindowState state) throws AutomationException {
        run("window-state", Map.of("HANDLE", Long.toString(handle), "SHOW_CMD", Integer.toString(showCommand(state))));
    }

    @Override
    public Rectangle bounds(long handle) throws AutomationException {
        String out = lastLine(run("window-bounds", Map.of("HANDLE", Long.toString(handle))));
        String[] parts = out.split(",");
        if (parts.length != 4) {
            throw new AutomationException("Unexpected bounds output: " + out);
        }
        try {
            return new Rectangle(Integer.parseInt(parts[0].trim()), Integer.parseInt(parts[1].trim()),
                    Integer.parseInt(parts[2].trim()), Integer.parseInt(parts[3].trim()));
        } catch (NumberFormatException e) {
            throw new AutomationException("Unexpected bounds output: " + out, e);
        }
    }

    @Override
    public TreeSnapshot accessibilityTree(long handle) throws AutomationException {
        String out = run("window-tree", Map.of(
                "HANDLE", Long.toString(handle),
                "MAX_DEPTH", Integer.toString(MAX_TREE_DEPTH),
                "MAX_ELEMENTS", Integer.toString(MAX_TREE_ELEMENTS)));
        return parseTree(out);
    }

    /** Splits the leading origin line off the tree text. */
    static TreeSnapshot parseTree(String out) throws AutomationException {
        int left = 0;
        int top = 0;
        boolean sawOrigin = false;
        StringBuilder tree = new StringBuilder();
        for (String line : out.split("\\R")) {
            Matcher m = ORIGIN.matcher(line);
            if (!sawOrigin && m.matches()) {
                left = Integer.parseInt(m.group(1));
                top = Integer.parseInt(m.group(2));
                sawOrigin = true;
                continue;
            }
            if (!line.isBlank()) tree.append(line).append('\n');
        }
        if (!sawOrigin) {
            throw new AutomationException("Accessibility capture returned no window origin");
        }
        return new TreeSnapshot(tree.toString(), left, top);
    }

    static int showCommand(WindowState state) {
        switch (state) {
            case MINIMIZED: return 6;
            case MAXIMIZED: return 3;
            default: return 9;
        }
    }

    String render(String name, Map<String, String> params) {
        String script = script("win32") + "\n" + script(name);
        for (Map.Entry<String, String> e : params.entrySet()) {
            script = script.replace("{{" + e.getKey() + "}}", e.getValue());
        }
        return script;
    }

    private String run(String name, Map<String, String> params) throws AutomationException {
        ShellResult result;
        try {
            result = runner.run(render(name, params));
        } catch (IOException e) {
            throw new AutomationException("PowerShell unavailable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AutomationException("Interrupted while running " + name);
        }
        if (result.exitCode() != 0) {
            String error = result.stderr().isBlank() ? "exit code " + result.exitCode() : result.stderr().trim();
            log.debug("[windows] {} failed: {}", name, error);
            throw new AutomationException(error);
        }
        return result.stdout();
    }

    private String script(String name) {
        return scripts.computeIfAbsent(name, n -> {
            try (InputStream in = PowerShellWindowControl.class.getResourceAsStream("/scripts/" + n + ".ps1")) {
                if (in == null) throw new IllegalStateException("Missing script resource: " + n);
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
    }

    /** Escapes for a single-quoted PowerShell literal, which also closes on typographic quotes. */
    static String quote(String value) {
        return value.replace("'", "''")
                .replace("\u2018", "\u2018\u2018")
                .replace("\u2019", "\u2019\u2019")
                .replace("\u201A", "\u201A\u201A")
                .replace("\u201B", "\u201B\u201B");
    }

    private static String orDefault(Integer value, int fallback) {
        return Integer.toString(value == null ? fallback : value);
    }

    private static String lastLine(String out) {
        String[] lines = out.trim().split("\\R");
        return lines[lines.length - 1].trim();
    }
}
