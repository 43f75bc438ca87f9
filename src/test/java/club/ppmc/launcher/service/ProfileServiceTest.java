package club.ppmc.launcher.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import club.ppmc.launcher.exception.InvalidConfigException;
import club.ppmc.launcher.exception.ProfileNotFoundException;
import club.ppmc.launcher.model.RunConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ProfileServiceTest {

    @TempDir
    Path dataDir;

    ProfileService profileService;

    @BeforeEach
    void setUp() {
        profileService = new ProfileService(dataDir.toString(), 5000);
        profileService.init();
    }

    @Test
    void init_createsDefaultProfiles() throws IOException {
        assertThat(profileService.getProfilesFilePath()).exists();
        assertThat(profileService.getProfiles()).containsOnlyKeys("default", "test");
        assertThat(profileService.findProfile("default").orElseThrow().getEnvironmentFile()).isEqualTo("config.json");
    }

    @Test
    void resolve_unknownProfile_throwsProfileNotFound() {
        assertThatThrownBy(() -> profileService.resolve("missing"))
                .isInstanceOf(ProfileNotFoundException.class)
                .isInstanceOf(InvalidConfigException.class);
    }

    @Test
    void resolve_missingRequiredFile_isInvalid() {
        assertThatThrownBy(() -> profileService.resolve("test"))
                .isInstanceOfSatisfying(InvalidConfigException.class,
                        e -> assertThat(e.getViolations()).singleElement().asString().contains("test_log.py"));
    }

    @Test
    void resolve_defaultTestProfile_buildsRunConfig() throws IOException {
        Files.writeString(dataDir.resolve("test_log.py"), "print('INFO: ok')\n");

        RunConfig config = profileService.resolve("test");

        assertThat(config.profile()).isEqualTo("test");
        assertThat(config.command()).containsExactly("python3", "-u", "test_log.py");
        assertThat(config.environment())
                .containsEntry("PYTHONIOENCODING", "utf-8")
                .containsEntry("PYTHONUNBUFFERED", "1");
        assertThat(config.workingDirectory()).isEqualTo(profileService.getDataDir());
        assertThat(config.gracePeriod()).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    void resolve_environmentFile_convertsValues() throws IOException {
        writeProfiles("""
                {"job": {"command": ["sh", "run.sh"], "environment": {"MODE": "profile", "LEVEL": "1"},
                         "environmentFile": "env.json", "gracePeriodSeconds": 2}}
                """);
        Files.writeString(dataDir.resolve("env.json"), """
                {"MODE": "file", "HEADLESS": true, "RETRIES": 3, "RATIO": 0.5,
                 "EMPTY": null, "PROXY": {"host": "127.0.0.1", "port": 7890}}
                """);

        Map<String, String> environment = profileService.resolve("job").environment();

        assertThat(environment)
                .containsEntry("MODE", "file")
                .containsEntry("LEVEL", "1")
                .containsEntry("HEADLESS", "true")
                .containsEntry("RETRIES", "3")
                .containsEntry("RATIO", "0.5")
                .containsEntry("PROXY", "{\"host\":\"127.0.0.1\",\"port\":7890}")
                .doesNotContainKey("EMPTY");
    }

    @Test
    void resolve_missingEnvironmentFile_isAllowed() throws IOException {
        writeProfiles("""
                {"job": {"command": ["sh", "run.sh"], "environmentFile": "absent.json"}}
                """);

        assertThat(profileService.resolve("job").environment()).isEmpty();
    }

    @Test
    void resolve_environmentFileNotAnObject_isInvalid() throws IOException {
        writeProfiles("""
                {"job": {"command": ["sh", "run.sh"], "environmentFile": "env.json"}}
                """);
        Files.writeString(dataDir.resolve("env.json"), "[1, 2]");

        assertThatThrownBy(() -> profileService.resolve("job")).isInstanceOf(InvalidConfigException.class);
    }

    @Test
    void resolve_emptyJsonRequiredFile_isInvalid() throws IOException {
        writeProfiles("""
                {"job": {"command": ["sh", "run.sh"], "requiredFiles": ["accounts.json", "run.sh"]}}
                """);
        Files.writeString(dataDir.resolve("accounts.json"), "[]");
        Files.writeString(dataDir.resolve("run.sh"), "");

        assertThatThrownBy(() -> profileService.resolve("job"))
                .isInstanceOfSatisfying(InvalidConfigException.class,
                        e -> assertThat(e.getViolations()).hasSize(2));
    }

    @Test
    void resolve_rereadsFileSoEditsApplyToNextRun() throws IOException {
        writeProfiles("""
                {"job": {"command": ["sh", "first.sh"]}}
                """);
        RunConfig first = profileService.resolve("job");

        writeProfiles("""
                {"job": {"command": ["sh", "second.sh"]}}
                """);
        RunConfig second = profileService.resolve("job");

        assertThat(first.command()).containsExactly("sh", "first.sh");
        assertThat(second.command()).containsExactly("sh", "second.sh");
    }

    @Test
    void putEnvironmentValue_appliesConversionRules() {
        Map<String, String> environment = new HashMap<>();

        profileService.putEnvironmentValue(environment, "FLAG", false);
        profileService.putEnvironmentValue(environment, "COUNT", 42);
        profileService.putEnvironmentValue(environment, "NOTHING", null);

        assertThat(environment).containsOnly(Map.entry("FLAG", "false"), Map.entry("COUNT", "42"));
    }

    private void writeProfiles(String json) throws IOException {
        Files.writeString(profileService.getProfilesFilePath(), json);
    }
}
