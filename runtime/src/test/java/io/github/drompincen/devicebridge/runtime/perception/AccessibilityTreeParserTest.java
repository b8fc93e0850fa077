package io.github.drompincen.devicebridge.runtime.perception;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AccessibilityTreeParserTest {

    private static final String TREE = """
            Window: 1000x500
            [Window] Name="Settings" Value="" bounds=[0,0][1000,500]
              [Button] Name="OK" Value="" bounds=[800,440][900,480] <Invoke>
              [Edit] Name="Search" Value="wifi \\"home\\"" bounds=[10,10][310,40] <Value,Text>
              [Text] Name="" bounds=[10,60][200,80]
            not an element line
            """;

    @Test
    void parsesHeaderDimensions() {
        AccessibilityTree tree = AccessibilityTreeParser.parse(TREE);

        assertThat(tree.width()).isEqualTo(1000);
        assertThat(tree.height()).isEqualTo(500);
        assertThat(tree.text()).isEqualTo(TREE);
    }

    @Test
    void parsesElementLines() {
        AccessibilityTree tree = AccessibilityTreeParser.parse(TREE);

        assertThat(tree.elements()).hasSize(4);
        AccessibilityElement ok = tree.elements().get(1);
        assertThat(ok.controlType()).isEqualTo("Button");
        assertThat(ok.name()).isEqualTo("OK");
        assertThat(ok.bounds()).isEqualTo(new AccessibilityElement.Bounds(800, 440, 900, 480));
        assertThat(ok.patterns()).containsExactly("Invoke");
        assertThat(ok.isInteractive()).isTrue();
    }

    @Test
    void unescapesQuotedValues() {
        AccessibilityElement edit = AccessibilityTreeParser.parse(TREE).elements().get(2);

        assertThat(edit.value()).isEqualTo("wifi \"home\"");
        assertThat(edit.patterns()).containsExactly("Value", "Text");
    }

    @Test
    void elementWithoutValueOrPatterns() {
        AccessibilityElement text = AccessibilityTreeParser.parse(TREE).elements().get(3);

        assertThat(text.isNamed()).isFalse();
        assertThat(text.value()).isNull();
        assertThat(text.patterns()).isEmpty();
    }

    @Test
    void centerIsMidpointAndNormalizesAgainstWindowSize() {
        AccessibilityElement ok = AccessibilityTreeParser.parse(TREE).elements().get(1);

        assertThat(ok.bounds().center()).isEqualTo(new Point(850, 460));
        assertThat(ok.normalizedCenter(1000, 500)).isEqualTo(new Point(850, 920));
    }

    @Test
    void nullTextGivesEmptyTree() {
        AccessibilityTree tree = AccessibilityTreeParser.parse(null);

        assertThat(tree.elements()).isEmpty();
        assertThat(tree.hasDimensions()).isFalse();
    }
}
