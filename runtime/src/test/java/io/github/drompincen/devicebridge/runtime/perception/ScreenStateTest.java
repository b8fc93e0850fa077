package io.github.drompincen.devicebridge.runtime.perception;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ScreenStateTest {

    @Test
    void desktopCaptureHasNoOffset() {
        ScreenState state = ScreenState.of(ScreenCapture.desktopRaster(new RasterImage("AA==", 1920, 1080, 0, 0)));

        assertThat(state.kind()).isEqualTo(ScreenState.Kind.RASTER);
        assertThat(state.windowScoped()).isFalse();
        assertThat(state.windowHandle()).isNull();
        assertThat(state.offsetLeft()).isZero();
        assertThat(state.hasDimensions()).isTrue();
    }

    @Test
    void windowCaptureKeepsOriginAndHandle() {
        ScreenState state = ScreenState.of(
                ScreenCapture.windowRaster(42L, new RasterImage("AA==", 800, 600, 100, 50), null));

        assertThat(state.windowScoped()).isTrue();
        assertThat(state.windowHandle()).isEqualTo(42L);
        assertThat(state.offsetLeft()).isEqualTo(100);
        assertThat(state.offsetTop()).isEqualTo(50);
    }

    @Test
    void scopingKeepsDimensions() {
        ScreenState scoped = ScreenState.desktop(ScreenState.Kind.RASTER, 1920, 1080).scopedTo(7L);

        assertThat(scoped.windowScoped()).isTrue();
        assertThat(scoped.windowHandle()).isEqualTo(7L);
        assertThat(scoped.width()).isEqualTo(1920);
    }

    @Test
    void holderStartsEmptyAndClears() {
        ScreenStateHolder holder = new ScreenStateHolder();
        assertThat(holder.current().hasDimensions()).isFalse();

        holder.update(ScreenState.desktop(ScreenState.Kind.TREE, 640, 480));
        assertThat(holder.current().height()).isEqualTo(480);

        holder.clear();
        assertThat(holder.current()).isEqualTo(ScreenState.EMPTY);
    }
}
