package dev.minutes.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Properties;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.config.YamlPropertiesFactoryBean;
import org.springframework.core.io.ClassPathResource;
import org.springframework.util.PropertyPlaceholderHelper;

/** Checks the shipped defaults of application.yml with no environment overrides. */
class ApplicationDefaultsTest {

  private static final PropertyPlaceholderHelper PLACEHOLDERS =
      new PropertyPlaceholderHelper("${", "}", ":", true);

  private static Properties defaults;

  @BeforeAll
  static void loadDefaults() {
    YamlPropertiesFactoryBean yaml = new YamlPropertiesFactoryBean();
    yaml.setResources(new ClassPathResource("application.yml"));
    defaults = yaml.getObject();
  }

  private static String resolved(String key) {
    return PLACEHOLDERS.replacePlaceholders(defaults.getProperty(key), name -> null);
  }

  @Test
  void summarizerModelIsServedByTheDefaultEndpoint() {
    assertThat(resolved("minutes.summarizer.base-url")).isEqualTo("https://api.openai.com/v1");
    assertThat(resolved("minutes.summarizer.model-name")).startsWith("gpt-");
  }

  @Test
  void leaseOutlastsTheSlowestTranscodeCall() {
    long lease = Long.parseLong(resolved("minutes.pipeline.lease-ms"));
    long transcodeCall =
        Long.parseLong(resolved("minutes.transcoder.connect-timeout-ms"))
            + Long.parseLong(resolved("minutes.transcoder.read-timeout-ms"));

    assertThat(lease).isGreaterThan(transcodeCall * 3);
  }
}
