package com.traffic.anomaly.config;

import com.traffic.anomaly.model.PromQLRule;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Rules registered at startup. Runtime changes through the API are not written back.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "detection")
public class DetectionRulesConfig {

    private List<PromQLRule> rules = new ArrayList<>();
}
