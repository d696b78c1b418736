package org.schemadiff.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.schemadiff.model.SchemaFormat;
import org.schemadiff.options.SchemaDiffOptions;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ConfigurationLoaderTest {

    private static final String YAML = """
            profiles:
              dev:
                score:
                  threshold: 60
              prod:
                score:
                  threshold: 90
                  repeatDecay: 1.0
                diff:
                  maxDepth: 16
                thresholds:
                  protobuf: 95
            """;

    @Test
    @DisplayName("설정 파일이 없으면 기본값을 반환한다")
    void loadConfiguration_noFile_returnsDefaults(@TempDir Path tempDir) {
        // given
        ConfigurationLoader loader = new ConfigurationLoader(tempDir, name -> null);

        // when
        Map<String, String> config = loader.loadConfiguration("dev");

        // then
        assertEquals(String.valueOf(SchemaDiffOptions.Score.THRESHOLD_DEFAULT),
                config.get(SchemaDiffOptions.Score.THRESHOLD_KEY));
        assertEquals(String.valueOf(SchemaDiffOptions.Diff.MAX_DEPTH_DEFAULT),
                config.get(SchemaDiffOptions.Diff.MAX_DEPTH_KEY));
    }

    @Test
    @DisplayName("설정 파일에서 지정된 프로파일의 값을 로드한다")
    void loadConfiguration_withProfile_loadsCorrectValues(@TempDir Path tempDir) throws IOException {
        // given
        Files.writeString(tempDir.resolve("schemadiff.yaml"), YAML);
        ConfigurationLoader loader = new ConfigurationLoader(tempDir, name -> null);

        // when - dev 프로파일
        Map<String, String> devConfig = loader.loadConfiguration("dev");

        // then - dev 프로파일
        assertEquals("60", devConfig.get(SchemaDiffOptions.Score.THRESHOLD_KEY));

        // when - prod 프로파일
        Map<String, String> prodConfig = loader.loadConfiguration("prod");

        // then - prod 프로파일
        assertEquals("90", prodConfig.get(SchemaDiffOptions.Score.THRESHOLD_KEY));
        assertEquals("16", prodConfig.get(SchemaDiffOptions.Diff.MAX_DEPTH_KEY));
        assertEquals("95", prodConfig.get(SchemaDiffOptions.Threshold.keyFor("protobuf")));
    }

    @Test
    @DisplayName("존재하지 않는 프로파일을 요청하면 기본값을 반환한다")
    void loadConfiguration_nonExistentProfile_returnsDefaults(@TempDir Path tempDir) throws IOException {
        Files.writeString(tempDir.resolve("schemadiff.yaml"), YAML);
        ConfigurationLoader loader = new ConfigurationLoader(tempDir, name -> null);

        Map<String, String> config = loader.loadConfiguration("staging");

        assertEquals(String.valueOf(SchemaDiffOptions.Score.THRESHOLD_DEFAULT),
                config.get(SchemaDiffOptions.Score.THRESHOLD_KEY));
    }

    @Test
    @DisplayName("환경변수로 프로파일을 지정할 수 있다")
    void loadConfiguration_envVariable_usesCorrectProfile(@TempDir Path tempDir) throws IOException {
        Files.writeString(tempDir.resolve("schemadiff.yaml"), YAML);
        ConfigurationLoader loader = new ConfigurationLoader(tempDir,
                name -> SchemaDiffOptions.Profile.ENV_VAR.equals(name) ? "prod" : null);

        // CLI 프로파일이 없으면 환경변수를 따른다
        assertEquals("90", loader.loadConfiguration(null).get(SchemaDiffOptions.Score.THRESHOLD_KEY));
        // CLI 프로파일이 우선한다
        assertEquals("60", loader.loadConfiguration("dev").get(SchemaDiffOptions.Score.THRESHOLD_KEY));
    }

    @Test
    @DisplayName("상위 디렉토리의 설정 파일을 찾는다")
    void loadConfiguration_searchesParentDirectories(@TempDir Path tempDir) throws IOException {
        Files.writeString(tempDir.resolve("schemadiff.yaml"), YAML);
        Path nested = Files.createDirectories(tempDir.resolve("a").resolve("b"));
        ConfigurationLoader loader = new ConfigurationLoader(nested, name -> null);

        assertEquals("60", loader.loadConfiguration("dev").get(SchemaDiffOptions.Score.THRESHOLD_KEY));
    }

    @Test
    void loadConfiguration_malformedYaml_returnsDefaults(@TempDir Path tempDir) throws IOException {
        Files.writeString(tempDir.resolve("schemadiff.yaml"), "profiles: [unclosed");
        ConfigurationLoader loader = new ConfigurationLoader(tempDir, name -> null);

        assertEquals(String.valueOf(SchemaDiffOptions.Score.THRESHOLD_DEFAULT),
                loader.loadConfiguration("dev").get(SchemaDiffOptions.Score.THRESHOLD_KEY));
    }

    @Test
    void loadPolicy_appliesProfile(@TempDir Path tempDir) throws IOException {
        Files.writeString(tempDir.resolve("schemadiff.yaml"), YAML);
        ConfigurationLoader loader = new ConfigurationLoader(tempDir, name -> null);

        AnalysisPolicy policy = loader.loadPolicy("prod");

        assertEquals(16, policy.getMaxDepth());
        assertEquals(90, policy.thresholdFor(SchemaFormat.JSON_SCHEMA));
        assertEquals(95, policy.thresholdFor(SchemaFormat.PROTOBUF));
        assertEquals(1.0, policy.getScoring().getRepeatDecay());
    }
}
