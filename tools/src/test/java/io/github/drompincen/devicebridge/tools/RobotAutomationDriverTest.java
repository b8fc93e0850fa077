package io.github.drompincen.devicebridge.tools;

import io.github.drompincen.devicebridge.runtime.desktop.AutomationException;
import io.github.drompincen.devicebridge.runtime.desktop.AutomationResult;
import io.github.drompincen.devicebridge.runtime.desktop.WindowState;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.awt.Robot;
import java.awt.event.KeyEvent;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

class RobotAutomationDriverTest {

    private final WindowControl windows = mock(WindowControl.class);
    private final RobotAutomationDriver driver = new RobotAutomationDriver(windows);

    @Test
    void unknownKeyFailsWithoutTouchingTheRobot() {
        AutomationResult result = driver.pressKey("hyperspace", List.of());

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("Unknown key: hyperspace");
    }

    @Test
    void unknownModifierIsReportedFirst() {
        AutomationResult result = driver.pressKey("hyperspace", List.of("super"));

        assertThat(result.error()).isEqualTo("Unknown modifier: super");
    }

    @Test
    void modifiersAreReleasedWhenTheKeyIsRejected() {
        Robot robot = mock(Robot.class);
        doThrow(new IllegalArgumentException("Invalid key code")).when(robot).keyPress(KeyEvent.VK_F5);
        RobotAutomationDriver withRobot = new RobotAutomationDriver(windows, robot);

        AutomationResult result = withRobot.pressKey("f5", List.of("ctrl", "shift"));

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("Key not supported on this keyboard: f5");
        InOrder order = inOrder(robot);
        order.verify(robot).keyPress(KeyEvent.VK_CONTROL);
        order.verify(robot).keyPress(KeyEvent.VK_SHIFT);
        order.verify(robot).keyRelease(KeyEvent.VK_SHIFT);
        order.verify(robot).keyRelease(KeyEvent.VK_CONTROL);
        verify(robot, never()).keyRelease(KeyEvent.VK_F5);
    }

    @Test
    void chordPressesModifiersAroundTheKey() {
        Robot robot = mock(Robot.class);
        RobotAutomationDriver withRobot = new RobotAutomationDriver(windows, robot);

        assertThat(withRobot.pressKey("c", List.of("ctrl")).success()).isTrue();

        InOrder order = inOrder(robot);
        order.verify(robot).keyPress(KeyEvent.VK_CONTROL);
        order.verify(robot).keyPress(KeyEvent.VK_C);
        order.verify(robot).keyRelease(KeyEvent.VK_C);
        order.verify(robot).keyRelease(KeyEvent.VK_CONTROL);
    }

    @Test
    void windowOperationFailuresBecomeResults() throws AutomationException {
        doThrow(new AutomationException("Window 9 not found")).when(windows).setState(9L, WindowState.MAXIMIZED);

        AutomationResult result = driver.setWindowState(9L, WindowState.MAXIMIZED);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("Window 9 not found");
    }

    @Test
    void focusReportsTheFocusedHandle() throws AutomationException {
        when(windows.focus(null, "Notepad")).thenReturn(42L);

        assertThat(driver.focusWindow(null, "Notepad").message()).isEqualTo("Focused window 42");
    }

    @Test
    void unsupportedPlatformRefusesWindowManagement() {
        RobotAutomationDriver linux = new RobotAutomationDriver(WindowControl.unsupported("Linux"));

        assertThatThrownBy(linux::listWindows)
                .isInstanceOf(AutomationException.class)
                .hasMessage("Window management is not available on Linux");
        assertThat(linux.resizeWindow(1L, null, null, 10, 10).success()).isFalse();
    }
}
