package com.eainde.analysis.config;

import com.eainde.analysis.stage.ConsistencyPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Everything under {@code analysis.*} in {@code application.yml}.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "analysis")
public class AnalysisProperties {

    @Valid
    private Capability capability = new Capability();

    @Valid
    private Pipeline pipeline = new Pipeline();

    @Valid
    private Consistency consistency = new Consistency();

    @Valid
    private Cache cache = new Cache();

    @Valid
    private Snapshots snapshots = new Snapshots();

    @Valid
    private Source source = new Source();

    @Getter
    @Setter
    public static class Capability {
        @NotBlank
        private String baseUrl = "https://openrouter.ai/api/v1";
        private String apiKey;
        @NotBlank
        private String defaultExtractionModel = "openai/gpt-4o-mini";
        @NotBlank
        private String defaultAnalysisModel = "openai/gpt-4o";
        @DecimalMin("0.0")
        private Double temperature = 0.0;
        @Min(1)
        private Integer maxOutputTokens = 8000;
        private boolean jsonSchemaMode = false;
    }

    @Getter
    @Setter
    public static class Pipeline {
        @NotNull
        private Duration stageTimeout = Duration.ofMinutes(3);
        @Min(1)
        private int runThreads = 4;
        @Valid
        private AutoRetry autoRetry = new AutoRetry();
    }

    @Getter
    @Setter
    public static class AutoRetry {
        @Min(0)
        private int maxAttempts = 0;
    }

    @Getter
    @Setter
    public static class Consistency {
        @DecimalMin("0.0")
        private double warningTolerance = 0.01;
        @DecimalMin("0.0")
        private double contradictionTolerance = 0.10;
        @DecimalMin("0.0")
        private double absoluteFallback = 1000;

        @AssertTrue(message = "contradiction-tolerance must not be narrower than warning-tolerance")
        public boolean isBandOrdered() {
            return contradictionTolerance >= warningTolerance;
        }

        public ConsistencyPolicy toPolicy() {
            return new ConsistencyPolicy(warningTolerance, contradictionTolerance, absoluteFallback);
        }
    }

    @Getter
    @Setter
    public static class Cache {
        @NotBlank
        private String directory = "data/results";
        // unset means entries never expire
        private Duration ttl;
    }

    @Getter
    @Setter
    public static class Snapshots {
        private boolean enabled = true;
        @NotBlank
        private String directory = "data/states";
    }

    @Getter
    @Setter
    public static class Source {
        @NotBlank
        private String directory = "data/statements";
    }
}
