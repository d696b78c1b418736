package org.schemadiff.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.schemadiff.options.SchemaDiffOptions;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

@Slf4j
public class ConfigurationLoader {

    private static final String CONFIG_FILE_NAME = SchemaDiffOptions.Profile.CONFIG_FILE;
    private static final String DEFAULT_PROFILE = SchemaDiffOptions.Profile.DEFAULT;
    private static final String PROFILE_ENV_VAR = SchemaDiffOptions.Profile.ENV_VAR;

    private final ObjectMapper yamlMapper;
    private final Path startDirectory;
    private final Function<String, String> environment;

    public ConfigurationLoader() {
        this(Paths.get("").toAbsolutePath());
    }

    public ConfigurationLoader(Path startDirectory) {
        this(startDirectory, System::getenv);
    }

    ConfigurationLoader(Path startDirectory, Function<String, String> environment) {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.startDirectory = startDirectory;
        this.environment = environment;
    }

    /**
     * 설정을 로드하고 지정된 프로파일을 적용
     *
     * 우선순위: CLI 프로파일 > 환경변수 > 기본값(dev)
     *
     * @param cliProfile CLI에서 지정된 프로파일 (null 가능)
     * @return 해석된 설정 맵
     */
    public Map<String, String> loadConfiguration(String cliProfile) {
        String activeProfile = resolveActiveProfile(cliProfile);

        Optional<SchemaDiffConfiguration> config = findAndLoadConfiguration();
        if (config.isEmpty()) {
            // 설정 파일이 없으면 기본값 사용
            return createDefaultConfiguration();
        }

        return extractConfigurationForProfile(config.get(), activeProfile);
    }

    public AnalysisPolicy loadPolicy(String cliProfile) {
        return AnalysisPolicy.fromOptions(loadConfiguration(cliProfile));
    }

    private String resolveActiveProfile(String cliProfile) {
        if (cliProfile != null && !cliProfile.trim().isEmpty()) {
            return cliProfile;
        }

        String envProfile = environment.apply(PROFILE_ENV_VAR);
        if (envProfile != null && !envProfile.trim().isEmpty()) {
            return envProfile;
        }

        return DEFAULT_PROFILE;
    }

    /**
     * 시작 디렉토리부터 상위 디렉토리로 올라가며 schemadiff.yaml을 찾습니다.
     */
    private Optional<SchemaDiffConfiguration> findAndLoadConfiguration() {
        Path currentDir = startDirectory;

        while (currentDir != null) {
            Path configFile = currentDir.resolve(CONFIG_FILE_NAME);
            if (Files.exists(configFile)) {
                try {
                    return Optional.ofNullable(yamlMapper.readValue(configFile.toFile(), SchemaDiffConfiguration.class));
                } catch (IOException e) {
                    log.warn("Failed to parse {}: {}", configFile, e.getMessage());
                    return Optional.empty();
                }
            }
            currentDir = currentDir.getParent();
        }

        return Optional.empty();
    }

    private Map<String, String> extractConfigurationForProfile(SchemaDiffConfiguration config, String profile) {
        var profileConfig = config.getProfiles().get(profile);
        if (profileConfig == null) {
            log.warn("Profile '{}' not found in configuration. Using defaults.", profile);
            return createDefaultConfiguration();
        }

        var configMap = new HashMap<>(createDefaultConfiguration());

        var score = profileConfig.getScore();
        if (score != null) {
            putIfPresent(configMap, SchemaDiffOptions.Score.THRESHOLD_KEY, score.getThreshold());
            putIfPresent(configMap, SchemaDiffOptions.Score.BREAKING_PENALTY_KEY, score.getBreakingPenalty());
            putIfPresent(configMap, SchemaDiffOptions.Score.WARNING_PENALTY_KEY, score.getWarningPenalty());
            putIfPresent(configMap, SchemaDiffOptions.Score.INFO_PENALTY_KEY, score.getInfoPenalty());
            putIfPresent(configMap, SchemaDiffOptions.Score.REPEAT_DECAY_KEY, score.getRepeatDecay());
        }

        if (profileConfig.getDiff() != null) {
            putIfPresent(configMap, SchemaDiffOptions.Diff.MAX_DEPTH_KEY, profileConfig.getDiff().getMaxDepth());
        }

        if (profileConfig.getThresholds() != null) {
            profileConfig.getThresholds().forEach((format, value) ->
                    putIfPresent(configMap, SchemaDiffOptions.Threshold.keyFor(format), value));
        }

        return configMap;
    }

    private static void putIfPresent(Map<String, String> target, String key, Object value) {
        if (value != null) {
            target.put(key, String.valueOf(value));
        }
    }

    private Map<String, String> createDefaultConfiguration() {
        return Map.of(
                SchemaDiffOptions.Score.THRESHOLD_KEY, String.valueOf(SchemaDiffOptions.Score.THRESHOLD_DEFAULT),
                SchemaDiffOptions.Score.BREAKING_PENALTY_KEY, String.valueOf(SchemaDiffOptions.Score.BREAKING_PENALTY_DEFAULT),
                SchemaDiffOptions.Score.WARNING_PENALTY_KEY, String.valueOf(SchemaDiffOptions.Score.WARNING_PENALTY_DEFAULT),
                SchemaDiffOptions.Score.INFO_PENALTY_KEY, String.valueOf(SchemaDiffOptions.Score.INFO_PENALTY_DEFAULT),
                SchemaDiffOptions.Score.REPEAT_DECAY_KEY, String.valueOf(SchemaDiffOptions.Score.REPEAT_DECAY_DEFAULT),
                SchemaDiffOptions.Diff.MAX_DEPTH_KEY, String.valueOf(SchemaDiffOptions.Diff.MAX_DEPTH_DEFAULT)
        );
    }
}
