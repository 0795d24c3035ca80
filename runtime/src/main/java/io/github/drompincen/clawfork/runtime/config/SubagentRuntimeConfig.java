package io.github.drompincen.clawfork.runtime.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(SubagentProperties.class)
public class SubagentRuntimeConfig {
}
