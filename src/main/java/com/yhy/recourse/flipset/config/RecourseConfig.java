package com.yhy.recourse.flipset.config;

import com.yhy.recourse.mip.MipParameters;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(RecourseProperties.class)
public class RecourseConfig {

    @Bean
    public MipParameters mipParameters(RecourseProperties properties) {
        return properties.toMipParameters();
    }
}
