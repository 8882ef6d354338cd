package com.clinic.scheduling.config;

import com.clinic.scheduling.auth.CallerIdentityArgumentResolver;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.List;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final CallerIdentityArgumentResolver callerIdentityArgumentResolver;

    public WebConfig(CallerIdentityArgumentResolver callerIdentityArgumentResolver) {
        this.callerIdentityArgumentResolver = callerIdentityArgumentResolver;
    }

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(callerIdentityArgumentResolver);
    }
}
