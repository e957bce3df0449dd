package com.example.imageenhancer.config;

import com.example.imageenhancer.model.ParameterSet;
import com.example.imageenhancer.service.stage.NoiseReductionStage;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.context.ConfigurationPropertiesAutoConfiguration;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import static org.assertj.core.api.Assertions.assertThat;

class EnhancerPropertiesTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    ConfigurationPropertiesAutoConfiguration.class, ValidationAutoConfiguration.class))
            .withUserConfiguration(PropertiesConfiguration.class);

    @Test
    void builtInDefaultsMatchParameterDefaults() {
        EnhancerProperties properties = EnhancerPropertiesFixtures.defaults();

        assertThat(properties.defaults().toParameterSet()).isEqualTo(ParameterSet.defaults());
        assertThat(properties.noiseReduction().toSettings()).isEqualTo(NoiseReductionStage.Settings.defaults());
    }

    @Test
    void unboundNamespaceFallsBackToDefaults() {
        contextRunner.run(context -> {
            EnhancerProperties properties = context.getBean(EnhancerProperties.class);

            assertThat(properties).isEqualTo(EnhancerPropertiesFixtures.defaults());
        });
    }

    @Test
    void rejectsNonPositiveSharpeningSigma() {
        contextRunner.withPropertyValues("enhancer.sharpening.sigma=0")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void rejectsBlankFilePrefix() {
        contextRunner.withPropertyValues("enhancer.output.file-prefix= ")
                .run(context -> assertThat(context).hasFailed());
    }

    @Configuration(proxyBeanMethods = false)
    @EnableConfigurationProperties(EnhancerProperties.class)
    static class PropertiesConfiguration {
    }
}
