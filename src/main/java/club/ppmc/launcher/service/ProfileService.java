/**
 * ProfileService.java
 *
 * 该服务是运行配置的读取入口，负责管理外部配置文件中的运行档案。
 * 档案以JSON格式存储在数据目录下的 profiles.json 中，首次启动时会创建包含默认档案的文件。
 * 每次启动运行时都会重新读取文件，并把选中的档案解析为一个不可变的 RunConfig 快照，
 * 因此外部对文件的修改只会影响下一次运行。本服务从不写回运行中的配置。
 */
package club.ppmc.launcher.service;

import club.ppmc.launcher.exception.InvalidConfigException;
import club.ppmc.launcher.exception.ProfileNotFoundException;
import club.ppmc.launcher.model.RunConfig;
import club.ppmc.launcher.model.ScriptProfile;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
public class ProfileService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProfileService.class);
    private static final String PROFILES_FILE_NAME = "profiles.json";
    private static final TypeReference<LinkedHashMap<String, ScriptProfile>> PROFILES_TYPE =
            new TypeReference<>() {};

    private final Path dataDir;
    private final Path profilesFilePath;
    private final ObjectMapper objectMapper;
    private final Duration defaultGracePeriod;

    public ProfileService(
            @Value("${app.data-dir:./data}") String dataDir,
            @Value("${app.supervisor.grace-period-ms:5000}") long defaultGracePeriodMs) {
        this.dataDir = Paths.get(dataDir).toAbsolutePath().normalize();
        this.profilesFilePath = this.dataDir.resolve(PROFILES_FILE_NAME);
        this.defaultGracePeriod = Duration.ofMillis(defaultGracePeriodMs);
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    @PostConstruct
    public void init() {
        try {
            if (Files.notExists(dataDir)) {
                Files.createDirectories(dataDir);
            }
            if (Files.exists(profilesFilePath)) {
                LOGGER.info("使用已有的运行档案文件 {}", profilesFilePath);
            } else {
                createDefaultProfilesFile();
            }
        } catch (IOException e) {
            LOGGER.error("初始化运行档案文件失败。启动请求将在读取档案时报告错误。", e);
        }
    }

    /**
     * 读取全部运行档案。每次调用都会重新读取文件。
     */
    public Map<String, ScriptProfile> getProfiles() throws IOException {
        if (Files.notExists(profilesFilePath)) {
            return Collections.emptyMap();
        }
        byte[] jsonData = Files.readAllBytes(profilesFilePath);
        Map<String, ScriptProfile> profiles = objectMapper.readValue(jsonData, PROFILES_TYPE);
        return profiles != null ? profiles : Collections.emptyMap();
    }

    public Optional<ScriptProfile> findProfile(String name) throws IOException {
        return Optional.ofNullable(getProfiles().get(name));
    }

    /**
     * 将指定档案解析为一次运行的配置快照。
     *
     * @param configRef 档案名称。
     * @return 不可变的运行配置。
     * @throws ProfileNotFoundException 档案不存在。
     * @throws InvalidConfigException   档案文件无法读取、环境变量文件格式错误或必需文件缺失。
     */
    public RunConfig resolve(String configRef) {
        ScriptProfile profile;
        try {
            profile = findProfile(configRef).orElseThrow(() -> new ProfileNotFoundException(configRef));
        } catch (IOException e) {
            LOGGER.error("读取运行档案文件 {} 失败", profilesFilePath, e);
            throw new InvalidConfigException(List.of("运行档案文件无法读取: " + e.getMessage()));
        }

        List<String> violations = new ArrayList<>();
        Map<String, String> environment = new LinkedHashMap<>();
        if (profile.getEnvironment() != null) {
            profile.getEnvironment().forEach((key, value) -> putEnvironmentValue(environment, key, value));
        }
        if (StringUtils.hasText(profile.getEnvironmentFile())) {
            readEnvironmentFile(resolvePath(profile.getEnvironmentFile()), environment, violations);
        }
        if (profile.getRequiredFiles() != null) {
            for (String requiredFile : profile.getRequiredFiles()) {
                checkRequiredFile(requiredFile, violations);
            }
        }
        if (!violations.isEmpty()) {
            LOGGER.warn("运行档案 '{}' 未通过检查: {}", configRef, violations);
            throw new InvalidConfigException(violations);
        }

        Path workingDirectory = StringUtils.hasText(profile.getWorkingDirectory())
                ? resolvePath(profile.getWorkingDirectory())
                : dataDir;
        Duration gracePeriod = profile.getGracePeriodSeconds() != null
                ? Duration.ofSeconds(profile.getGracePeriodSeconds())
                : defaultGracePeriod;
        List<String> command = profile.getCommand() != null
                ? Collections.unmodifiableList(new ArrayList<>(profile.getCommand()))
                : List.of();

        return new RunConfig(
                configRef, command, Collections.unmodifiableMap(environment), workingDirectory, gracePeriod);
    }

    /**
     * 按原脚本管理端的规则把配置值转换为环境变量：布尔值转为 true/false，数字转为十进制字符串，
     * null 值跳过，嵌套结构以JSON文本注入。
     */
    void putEnvironmentValue(Map<String, String> environment, String key, Object value) {
        if (value == null) {
            return;
        }
        if (value instanceof Boolean bool) {
            environment.put(key, bool ? "true" : "false");
        } else if (value instanceof Number || value instanceof String) {
            environment.put(key, value.toString());
        } else if (value instanceof JsonNode node && node.isValueNode()) {
            if (!node.isNull()) {
                environment.put(key, node.asText());
            }
        } else {
            try {
                environment.put(key, objectMapper.writer()
                        .without(SerializationFeature.INDENT_OUTPUT)
                        .writeValueAsString(value));
            } catch (JsonProcessingException e) {
                LOGGER.warn("环境变量 {} 的值无法序列化，已跳过: {}", key, e.getMessage());
            }
        }
    }

    private void readEnvironmentFile(Path file, Map<String, String> environment, List<String> violations) {
        if (Files.notExists(file)) {
            LOGGER.info("环境变量文件 {} 不存在，将不注入额外的环境变量。", file);
            return;
        }
        try {
            JsonNode root = objectMapper.readTree(file.toFile());
            if (root == null || root.isNull() || root.isMissingNode()) {
                return;
            }
            if (!root.isObject()) {
                violations.add("环境变量文件必须是JSON对象: " + file);
                return;
            }
            root.fields().forEachRemaining(entry -> putEnvironmentValue(environment, entry.getKey(), entry.getValue()));
        } catch (IOException e) {
            violations.add("环境变量文件无法解析: " + file + " (" + e.getMessage() + ")");
        }
    }

    private void checkRequiredFile(String requiredFile, List<String> violations) {
        Path file = resolvePath(requiredFile);
        try {
            if (Files.notExists(file)) {
                violations.add("必需的文件不存在: " + requiredFile);
            } else if (Files.size(file) == 0) {
                violations.add("必需的文件为空: " + requiredFile);
            } else if (requiredFile.endsWith(".json")) {
                JsonNode root = objectMapper.readTree(file.toFile());
                if (root != null && root.isContainerNode() && root.isEmpty()) {
                    violations.add("必需的文件不包含任何条目: " + requiredFile);
                }
            }
        } catch (IOException e) {
            violations.add("必需的文件无法读取: " + requiredFile + " (" + e.getMessage() + ")");
        }
    }

    private Path resolvePath(String path) {
        return dataDir.resolve(path).normalize();
    }

    private void createDefaultProfilesFile() throws IOException {
        Map<String, ScriptProfile> defaults = new LinkedHashMap<>();
        defaults.put("default", defaultProfile("launcher.py", "config.json", List.of("launcher.py", "accounts.json")));
        defaults.put("test", defaultProfile("test_log.py", null, List.of("test_log.py")));
        Files.write(profilesFilePath, objectMapper.writeValueAsBytes(defaults));
        LOGGER.info("未找到运行档案文件。已在 {} 创建了包含默认档案的新文件。", profilesFilePath);
    }

    private ScriptProfile defaultProfile(String script, String environmentFile, List<String> requiredFiles) {
        var profile = new ScriptProfile();
        profile.setCommand(new ArrayList<>(List.of("python3", "-u", script)));
        profile.setWorkingDirectory(".");
        // 保证脚本以UTF-8无缓冲输出，日志才能实时到达
        profile.getEnvironment().put("PYTHONIOENCODING", "utf-8");
        profile.getEnvironment().put("PYTHONUNBUFFERED", "1");
        profile.setEnvironmentFile(environmentFile);
        profile.setRequiredFiles(new ArrayList<>(requiredFiles));
        profile.setGracePeriodSeconds((int) Math.max(1, defaultGracePeriod.toSeconds()));
        return profile;
    }

    public Path getDataDir() {
        return dataDir;
    }

    public Path getProfilesFilePath() {
        return profilesFilePath;
    }
}
