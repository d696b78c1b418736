package org.schemadiff.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.HashMap;
import java.util.Map;

@Data
public class SchemaDiffConfiguration {

    /**
     * 프로파일별 설정 맵
     */
    @JsonProperty("profiles")
    private Map<String, ProfileConfiguration> profiles = new HashMap<>();

    /**
     * 개별 프로파일 설정
     */
    @Data
    public static class ProfileConfiguration {

        @JsonProperty("score")
        private ScoreConfiguration score;

        @JsonProperty("diff")
        private DiffConfiguration diff;

        /**
         * 포맷 id(json-schema, openapi, protobuf, sql)별 호환성 임계값
         */
        @JsonProperty("thresholds")
        private Map<String, Integer> thresholds = new HashMap<>();
    }

    /**
     * 점수 계산 관련 설정
     */
    @Data
    public static class ScoreConfiguration {

        @JsonProperty("threshold")
        private Integer threshold;

        @JsonProperty("breakingPenalty")
        private Double breakingPenalty;

        @JsonProperty("warningPenalty")
        private Double warningPenalty;

        @JsonProperty("infoPenalty")
        private Double infoPenalty;

        @JsonProperty("repeatDecay")
        private Double repeatDecay;
    }

    /**
     * diff 엔진 관련 설정
     */
    @Data
    public static class DiffConfiguration {

        @JsonProperty("maxDepth")
        private Integer maxDepth;
    }
}
