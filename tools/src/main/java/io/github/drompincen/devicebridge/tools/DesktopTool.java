package io.github.drompincen.devicebridge.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.devicebridge.runtime.agent.AgentProperties;
import io.github.drompincen.devicebridge.runtime.desktop.AutomationDriver;
import io.github.drompincen.devicebridge.runtime.desktop.AutomationException;
import io.github.drompincen.devicebridge.runtime.desktop.AutomationResult;
import io.github.drompincen.devicebridge.runtime.desktop.DesktopAction;
import io.github.drompincen.devicebridge.runtime.desktop.DesktopActionParser;
import io.github.drompincen.devicebridge.runtime.desktop.InvalidToolArgumentsException;
import io.github.drompincen.devicebridge.runtime.desktop.WindowInfo;
import io.github.drompincen.devicebridge.runtime.perception.CoordinateMapper;
import io.github.drompincen.devicebridge.runtime.perception.CoordinateRangeException;
import io.github.drompincen.devicebridge.runtime.perception.PerceptionMode;
import io.github.drompincen.devicebridge.runtime.perception.Point;
import io.github.drompincen.devicebridge.runtime.perception.ScreenCapture;
import io.github.drompincen.devicebridge.runtime.perception.ScreenState;
import io.github.drompincen.devicebridge.runtime.perception.ScreenStateHolder;
import io.github.drompincen.devicebridge.runtime.perception.WindowPerception;
import io.github.drompincen.devicebridge.runtime.tools.Tool;
import io.github.drompincen.devicebridge.runtime.tools.ToolBindings;
import io.github.drompincen.devicebridge.runtime.tools.ToolContext;
import io.github.drompincen.devicebridge.runtime.tools.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * Mouse, keyboard and window control for the model. Pointer coordinates arrive on the 0-999
 * grid and are mapped against the last capture; actions that change the screen are followed
 * by a fresh capture of the same scope.
 */
public class DesktopTool implements Tool {

    private static final Logger log = LoggerFactory.getLogger(DesktopTool.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String NO_CAPTURE_YET =
            "No screen captured yet. Call screenshot or window_screenshot before using coordinates.";

    private AutomationDriver driver;
    private Duration settleDelay;

    public DesktopTool() {
        this(new AgentProperties().getSettleDelay());
    }

    public DesktopTool(Duration settleDelay) {
        this.settleDelay = settleDelay;
    }

    public void setAutomationDriver(AutomationDriver driver) {
        this.driver = driver;
    }

    public void setAgentProperties(AgentProperties properties) {
        this.settleDelay = properties.getSettleDelay();
    }

    @Override
    public void bind(ToolBindings bindings) {
        bindings.automation().ifPresent(this::setAutomationDriver);
        bindings.agent().ifPresent(this::setAgentProperties);
    }

    @Override public String name() { return "desktop"; }

    @Override public String description() {
        return "Control the desktop: click, mouse_move, type, key_press, scroll, list_windows, "
                + "focus_window, resize_window, minimize_window, maximize_window, restore_window, "
                + "window_screenshot and screenshot. x and y are on a 0-999 grid over the last "
                + "screenshot or accessibility tree (0,0 top-left, 999,999 bottom-right). "
                + "Actions that change the screen return an updated capture automatically.";
    }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        ArrayNode actions = props.putObject("action").put("type", "string")
                .put("description", "Action to perform").putArray("enum");
        List.of("click", "mouse_move", "type", "key_press", "scroll", "list_windows", "focus_window",
                "resize_window", "minimize_window", "maximize_window", "restore_window",
                "window_screenshot", "screenshot").forEach(actions::add);
        props.putObject("x").put("type", "integer").put("description", "Horizontal grid position 0-999");
        props.putObject("y").put("type", "integer").put("description", "Vertical grid position 0-999");
        props.putObject("text").put("type", "string").put("description", "Text to type");
        props.putObject("key").put("type", "string").put("description", "Key name, e.g. enter, tab, f5, a");
        props.putObject("modifiers").put("type", "array").put("description", "ctrl, alt, shift, win")
                .putObject("items").put("type", "string");
        ObjectNode button = props.putObject("button").put("type", "string");
        button.putArray("enum").add("left").add("right").add("middle");
        props.putObject("doubleClick").put("type", "boolean");
        ObjectNode direction = props.putObject("direction").put("type", "string");
        direction.putArray("enum").add("up").add("down");
        props.putObject("amount").put("type", "integer").put("description", "Scroll notches (default 3)");
        props.putObject("handle").put("type", "integer").put("description", "Window handle from list_windows");
        props.putObject("title").put("type", "string").put("description", "Window title substring");
        props.putObject("width").put("type", "integer").put("description", "Window width in pixels");
        props.putObject("height").put("type", "integer").put("description", "Window height in pixels");
        ObjectNode mode = props.putObject("mode").put("type", "string")
                .put("description", "window_screenshot perception: auto prefers the accessibility tree");
        mode.putArray("enum").add("auto").add("accessibility").add("pixel");
        schema.putArray("required").add("action");
        return schema;
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        if (driver == null) {
            return ToolResult.failure("No automation driver configured");
        }
        DesktopAction action;
        try {
            action = DesktopActionParser.parse(input);
        } catch (InvalidToolArgumentsException e) {
            return ToolResult.failure(e.getMessage());
        }
        try {
            return perform(ctx, action);
        } catch (CoordinateRangeException e) {
            ctx.log("desktop: " + action.actionName() + " rejected: " + e.getMessage());
            return ToolResult.failure(format(action, AutomationResult.failure(e.getMessage())), e.getMessage());
        } catch (AutomationException e) {
            log.warn("[desktop] {} failed: {}", action.actionName(), e.getMessage());
            return ToolResult.failure(format(action, AutomationResult.failure(e.getMessage())), e.getMessage());
        }
    }

    private ToolResult perform(ToolContext ctx, DesktopAction action)
            throws CoordinateRangeException, AutomationException {
        ScreenStateHolder screen = ctx.screen();
        AutomationResult result;
        if (action instanceof DesktopAction.Click click) {
            if (click.x() == null) {
                result = driver.click(null, null, click.button(), click.doubleClick());
                ctx.log("desktop: click at pointer -> " + status(result));
            } else {
                Point p = toDesktop(click.x(), click.y(), screen.current());
                result = driver.click(p.x(), p.y(), click.button(), click.doubleClick());
                logPointer(ctx, "click", click.x(), click.y(), p, result);
            }
        } else if (action instanceof DesktopAction.MouseMove move) {
            Point p = toDesktop(move.x(), move.y(), screen.current());
            result = driver.moveMouse(p.x(), p.y());
            logPointer(ctx, "mouse_move", move.x(), move.y(), p, result);
        } else if (action instanceof DesktopAction.Scroll scroll) {
            if (scroll.x() == null) {
                result = driver.scroll(null, null, scroll.direction(), scroll.amount());
            } else {
                Point p = toDesktop(scroll.x(), scroll.y(), screen.current());
                result = driver.scroll(p.x(), p.y(), scroll.direction(), scroll.amount());
                logPointer(ctx, "scroll", scroll.x(), scroll.y(), p, result);
            }
        } else if (action instanceof DesktopAction.TypeText type) {
            result = driver.typeText(type.text());
        } else if (action instanceof DesktopAction.KeyPress key) {
            result = driver.pressKey(key.key(), key.modifiers());
        } else if (action instanceof DesktopAction.ListWindows) {
            return listWindows();
        } else if (action instanceof DesktopAction.FocusWindow focus) {
            result = driver.focusWindow(focus.handle(), focus.title());
            if (result.success() && focus.handle() != null) {
                screen.update(screen.current().scopedTo(focus.handle()));
            }
        } else if (action instanceof DesktopAction.ResizeWindow resize) {
            result = driver.resizeWindow(resize.handle(), resize.x(), resize.y(), resize.width(), resize.height());
        } else if (action instanceof DesktopAction.ChangeWindowState change) {
            result = driver.setWindowState(change.handle(), change.state());
        } else if (action instanceof DesktopAction.WindowScreenshot shot) {
            ScreenCapture capture = new WindowPerception(driver).capture(shot.handle(), shot.mode());
            return captured(ctx, capture, false, "Captured " + capture.describe());
        } else if (action instanceof DesktopAction.Screenshot) {
            ScreenCapture capture = ScreenCapture.desktopRaster(driver.captureDesktop());
            return captured(ctx, capture, false, "Captured " + capture.describe());
        } else {
            throw new IllegalStateException("Unhandled action " + action.actionName());
        }

        String text = format(action, result);
        if (!result.success()) {
            return ToolResult.failure(text, result.error());
        }
        if (!action.triggersAutoCapture()) {
            return ToolResult.success(text);
        }
        return autoCapture(ctx, text);
    }

    private Point toDesktop(int x, int y, ScreenState state) throws CoordinateRangeException, AutomationException {
        CoordinateMapper.checkRange(x, y);
        if (!state.hasDimensions()) {
            throw new AutomationException(NO_CAPTURE_YET);
        }
        return CoordinateMapper.toDesktop(x, y, state);
    }

    private ToolResult autoCapture(ToolContext ctx, String text) {
        if (!settle()) {
            return ToolResult.success(text);
        }
        ScreenState state = ctx.screen().current();
        try {
            ScreenCapture capture;
            if (state.windowScoped() && state.windowHandle() != null) {
                capture = new WindowPerception(driver).capture(state.windowHandle(), PerceptionMode.AUTO);
            } else {
                capture = ScreenCapture.desktopRaster(driver.captureDesktop());
            }
            return captured(ctx, capture, true, text);
        } catch (AutomationException e) {
            log.warn("[desktop] auto-capture failed: {}", e.getMessage());
            return ToolResult.success(text + "\nAuto-capture failed: " + e.getMessage());
        }
    }

    private ToolResult captured(ToolContext ctx, ScreenCapture capture, boolean auto, String text) {
        ctx.screen().update(ScreenState.of(capture));
        StringBuilder sb = new StringBuilder(text);
        if (auto) {
            sb.append("\nUpdated ").append(capture.describe());
        }
        if (capture.diagnostic() != null) {
            sb.append("\nPerception: ").append(capture.diagnostic());
        }
        return ToolResult.success(sb.toString(), capture, auto);
    }

    private boolean settle() {
        if (settleDelay == null || settleDelay.isZero() || settleDelay.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(settleDelay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("[desktop] interrupted while settling, skipping auto-capture");
            return false;
        }
    }

    private ToolResult listWindows() throws AutomationException {
        List<WindowInfo> windows = driver.listWindows();
        try {
            return ToolResult.success(MAPPER.writeValueAsString(windows));
        } catch (JsonProcessingException e) {
            throw new AutomationException("Cannot serialize window list: " + e.getMessage(), e);
        }
    }

    private static void logPointer(ToolContext ctx, String action, int x, int y, Point p, AutomationResult result) {
        ctx.log("desktop: " + action + " grid(" + x + "," + y + ") -> pixel(" + p.x() + "," + p.y() + ") -> "
                + status(result));
    }

    private static String status(AutomationResult result) {
        return result.success() ? "success" : "failed: " + result.error();
    }

    static String format(DesktopAction action, AutomationResult result) {
        StringBuilder sb = new StringBuilder();
        sb.append("Action: ").append(action.actionName()).append(" | Success: ").append(result.success());
        if (result.error() != null) {
            sb.append("\nError: ").append(result.error());
        }
        if (result.message() != null) {
            sb.append("\n").append(result.message());
        }
        return sb.toString();
    }
}
