package io.github.drompincen.devicebridge.runtime.desktop;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class ActionAliasesTest {

    @ParameterizedTest
    @CsvSource({
            "press_key,key_press",
            "Press-Key,key_press",
            "move,mouse_move",
            "activate,focus_window",
            "type_text,type",
            "maximize,maximize_window",
            "capture_window,window_screenshot",
            "click,click",
            "window_screenshot,window_screenshot"
    })
    void resolvesToCanonicalName(String alias, String canonical) {
        assertThat(ActionAliases.resolve(alias).action()).isEqualTo(canonical);
    }

    @Test
    void doubleClickAliasesImplyDoubleClick() {
        ActionAliases.Resolved resolved = ActionAliases.resolve("double_click");

        assertThat(resolved.action()).isEqualTo("click");
        assertThat(resolved.doubleClick()).isTrue();
        assertThat(ActionAliases.resolve("dblclick").doubleClick()).isTrue();
    }

    @Test
    void rightClickAliasImpliesButton() {
        assertThat(ActionAliases.resolve("right_click").button()).isEqualTo(MouseButton.RIGHT);
    }

    @Test
    void unknownNameResolvesToNull() {
        assertThat(ActionAliases.resolve("launch_missiles")).isNull();
        assertThat(ActionAliases.resolve(null)).isNull();
    }
}
