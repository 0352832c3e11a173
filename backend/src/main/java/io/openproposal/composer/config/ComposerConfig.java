package io.openproposal.composer.config;

import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ComposerProperties.class)
public class ComposerConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
