package com.hartwig.minijd.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;

import org.junit.jupiter.api.Test;

class EnvironmentOverlayTest {
    private static final Map<String, String> HOST = Map.of("PATH", "/usr/bin", "HOME", "/home/render");

    @Test
    void framesApplyBottomToTop() {
        var overlay = EnvironmentOverlay.empty()
                .push("Conda", Map.of("PATH", "/opt/conda/bin", "CONDA", "1"))
                .push("Renderer", Map.of("PATH", "/opt/renderer/bin"));
        var environment = overlay.resolve(HOST);
        assertThat(environment).containsEntry("PATH", "/opt/renderer/bin").containsEntry("CONDA", "1").containsEntry("HOME", "/home/render");
        assertThat(overlay.depth()).isEqualTo(2);
        assertThat(overlay.topEnvironmentName()).contains("Renderer");
    }

    @Test
    void popRestoresLowerFrames() {
        var lower = EnvironmentOverlay.empty().push("Conda", Map.of("PATH", "/opt/conda/bin"));
        var upper = lower.push("Renderer", Map.of("PATH", "/opt/renderer/bin"));
        assertThat(upper.pop().resolve(HOST)).isEqualTo(lower.resolve(HOST));
        assertThat(upper.pop().pop().resolve(HOST)).isEqualTo(HOST);
        assertThat(EnvironmentOverlay.empty().topEnvironmentName()).isEmpty();
    }

    @Test
    void unsetHidesInheritedValues() {
        var overlay = EnvironmentOverlay.empty().push("Clean", Map.of()).unset("HOME").set("TMPDIR", "/scratch");
        assertThat(overlay.resolve(HOST)).doesNotContainKey("HOME").containsEntry("TMPDIR", "/scratch");
        assertThat(overlay.pop().resolve(HOST)).containsEntry("HOME", "/home/render");
    }

    @Test
    void latestChangeWins() {
        var overlay = EnvironmentOverlay.empty().push("Env", Map.of("A", "1")).unset("A").set("A", "2");
        assertThat(overlay.resolve(Map.of())).containsEntry("A", "2");
        assertThat(overlay.set("A", "3").unset("A").resolve(Map.of())).doesNotContainKey("A");
    }

    @Test
    void changesLeaveEarlierSnapshotsAlone() {
        var snapshot = EnvironmentOverlay.empty().push("Env", Map.of("A", "1"));
        snapshot.set("A", "2");
        assertThat(snapshot.resolve(Map.of())).containsEntry("A", "1");
    }

    @Test
    void changesNeedAnEnteredEnvironment() {
        assertThrows(IllegalStateException.class, () -> EnvironmentOverlay.empty().pop());
        assertThrows(IllegalStateException.class, () -> EnvironmentOverlay.empty().set("A", "1"));
        assertThrows(IllegalStateException.class, () -> EnvironmentOverlay.empty().unset("A"));
    }
}
