package club.ppmc.transpiler.service;

import static org.assertj.core.api.Assertions.assertThat;

import club.ppmc.transpiler.model.TranspilerSettings;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SettingsServiceTest {

    @TempDir
    Path tempDir;

    @Test
    void callersCannotChangeSharedSettings() {
        SettingsService service = SettingsFixtures.defaults();

        TranspilerSettings settings = service.getSettings();
        settings.setMaxTreeDepth(1);
        settings.setDefaultServerUrl("http://changed.local");

        assertThat(service.getSettings().getMaxTreeDepth()).isEqualTo(50);
        assertThat(service.getSettings().getDefaultServerUrl()).isNull();
    }

    @Test
    void overlayFileOverridesDefaults() throws IOException {
        Path file = Files.writeString(tempDir.resolve("settings.json"), "{\"maxTreeDepth\": 7, \"minCodeLength\": 3}");

        TranspilerSettings settings = withSettingsFile(file.toString()).getSettings();

        assertThat(settings.getMaxTreeDepth()).isEqualTo(7);
        assertThat(settings.getMinCodeLength()).isEqualTo(3);
        assertThat(settings.getMaxChildren()).isEqualTo(20);
    }

    @Test
    void malformedOverlayLeavesDefaultsUntouched() throws IOException {
        Path file = Files.writeString(tempDir.resolve("settings.json"), "{\"maxTreeDepth\": 7, \"maxChildren\": ");

        TranspilerSettings settings = withSettingsFile(file.toString()).getSettings();

        assertThat(settings.getMaxTreeDepth()).isEqualTo(50);
        assertThat(settings.getMaxChildren()).isEqualTo(20);
    }

    @Test
    void missingOverlayFileKeepsDefaults() {
        TranspilerSettings settings = withSettingsFile(tempDir.resolve("absent.json").toString()).getSettings();

        assertThat(settings.getMaxTreeDepth()).isEqualTo(50);
        assertThat(settings.getAllowedOrigins()).isEqualTo("*");
    }

    private static SettingsService withSettingsFile(String settingsFile) {
        return new SettingsService(50, 20, 100, 50, 10, 30_000, 10_000, "", "", "*", settingsFile);
    }
}
