package com.foodvision.backend.scan.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ScanProperties.class)
public class PropertiesConfig {
}
