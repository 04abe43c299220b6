package com.herzen.planner.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.nio.charset.Charset;

@ConfigurationProperties("planner")
public record PlannerProperties(@DefaultValue(",") char delimiter,
                                @DefaultValue("UTF-8") Charset charset,
                                @DefaultValue Shell shell) {

    public record Shell(@DefaultValue("true") boolean enabled) {}
}
