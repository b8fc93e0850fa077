package io.github.drompincen.devicebridge.runtime.desktop;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.devicebridge.runtime.perception.PerceptionMode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DesktopActionParserTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private DesktopAction parse(String json) throws Exception {
        return DesktopActionParser.parse(mapper.readTree(json));
    }

    @Test
    void parsesClickWithDefaults() throws Exception {
        DesktopAction action = parse("{\"action\":\"click\",\"x\":500,\"y\":250}");

        assertThat(action).isEqualTo(new DesktopAction.Click(500, 250, MouseButton.LEFT, false));
        assertThat(action.triggersAutoCapture()).isTrue();
    }

    @Test
    void doubleClickAliasSetsFlag() throws Exception {
        DesktopAction action = parse("{\"action\":\"double_click\",\"x\":1,\"y\":2,\"button\":\"right\"}");

        assertThat(action).isEqualTo(new DesktopAction.Click(1, 2, MouseButton.RIGHT, true));
    }

    @Test
    void coordinatesMayBeNumericStringsOrWholeDecimals() throws Exception {
        DesktopAction action = parse("{\"action\":\"move\",\"x\":\"10\",\"y\":20.0}");

        assertThat(action).isEqualTo(new DesktopAction.MouseMove(10, 20));
    }

    @ParameterizedTest
    @ValueSource(strings = {"4294967796", "\"4294967796\"", "\"NaN\"", "\"-Infinity\"", "999.4", "-0.4", "\"12.5\""})
    void coordinatesThatWouldNeedNarrowingAreRejected(String x) {
        assertThatThrownBy(() -> parse("{\"action\":\"click\",\"x\":" + x + ",\"y\":10}"))
                .isInstanceOf(InvalidToolArgumentsException.class)
                .hasMessageStartingWith("x ");
    }

    @Test
    void outOfRangeCoordinatesPassParsing() throws Exception {
        // range is checked against the screen state, not here
        assertThat(parse("{\"action\":\"click\",\"x\":1005,\"y\":10}"))
                .isEqualTo(new DesktopAction.Click(1005, 10, MouseButton.LEFT, false));
    }

    @Test
    void clickWithoutCoordinatesUsesCurrentPosition() throws Exception {
        assertThat(parse("{\"action\":\"click\"}")).isEqualTo(new DesktopAction.Click(null, null, MouseButton.LEFT, false));
    }

    @Test
    void halfAPointIsRejected() {
        assertThatThrownBy(() -> parse("{\"action\":\"click\",\"x\":5}"))
                .isInstanceOf(InvalidToolArgumentsException.class)
                .hasMessageContaining("together");
    }

    @Test
    void keyPressCollectsModifiers() throws Exception {
        DesktopAction action = parse("{\"action\":\"press_key\",\"key\":\"s\",\"modifiers\":[\"Ctrl\",\"shift\"]}");

        assertThat(action).isInstanceOf(DesktopAction.KeyPress.class);
        DesktopAction.KeyPress keyPress = (DesktopAction.KeyPress) action;
        assertThat(keyPress.key()).isEqualTo("s");
        assertThat(keyPress.modifiers()).containsExactly("ctrl", "shift");
    }

    @Test
    void scrollDefaultsToThreeNotchesDown() throws Exception {
        assertThat(parse("{\"action\":\"scroll\"}"))
                .isEqualTo(new DesktopAction.Scroll(null, null, ScrollDirection.DOWN, 3));
    }

    @Test
    void focusWindowNeedsHandleOrTitle() {
        assertThatThrownBy(() -> parse("{\"action\":\"focus_window\"}"))
                .isInstanceOf(InvalidToolArgumentsException.class)
                .hasMessage("Provide handle or title");
    }

    @Test
    void windowActionsNeedHandle() {
        assertThatThrownBy(() -> parse("{\"action\":\"maximize_window\"}"))
                .isInstanceOf(InvalidToolArgumentsException.class)
                .hasMessage("handle is required");
    }

    @Test
    void handleMayBeString() throws Exception {
        DesktopAction action = parse("{\"action\":\"window_screenshot\",\"handle\":\"132456\",\"mode\":\"pixel\"}");

        assertThat(action).isEqualTo(new DesktopAction.WindowScreenshot(132456L, PerceptionMode.PIXEL));
        assertThat(action.triggersAutoCapture()).isFalse();
    }

    @Test
    void windowStateVariantsNameThemselves() throws Exception {
        assertThat(parse("{\"action\":\"restore\",\"handle\":1}").actionName()).isEqualTo("restore_window");
        assertThat(parse("{\"action\":\"minimize_window\",\"handle\":1}").triggersAutoCapture()).isFalse();
    }

    @Test
    void unknownActionAndModeAreRejected() {
        assertThatThrownBy(() -> parse("{\"action\":\"fly\"}"))
                .hasMessage("Unknown action: fly");
        assertThatThrownBy(() -> parse("{\"action\":\"window_screenshot\",\"handle\":1,\"mode\":\"xray\"}"))
                .hasMessageContaining("mode must be");
    }

    @Test
    void nonObjectArgumentsAreRejected() {
        JsonNode array = mapper.createArrayNode();

        assertThatThrownBy(() -> DesktopActionParser.parse(array))
                .isInstanceOf(InvalidToolArgumentsException.class);
        assertThatThrownBy(() -> parse("{}"))
                .hasMessage("action is required");
    }
}
