package com.yuzhi.dts.iac.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(IacProperties.class)
public class IacConfiguration {}
