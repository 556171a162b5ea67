package com.bbthechange.bridge.config;

import com.bbthechange.bridge.util.DisplaynameFormatter;
import com.bbthechange.bridge.util.MxidTemplate;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Wires the immutable puppet helpers from the bound configuration.
 */
@Configuration
public class PuppetConfig {

    @Bean
    public MxidTemplate mxidTemplate(BridgeProperties bridgeProperties, HomeserverProperties homeserverProperties) {
        return new MxidTemplate(bridgeProperties.getUsernameTemplate(), homeserverProperties.getDomain());
    }

    @Bean
    public DisplaynameFormatter displaynameFormatter(BridgeProperties bridgeProperties) {
        return new DisplaynameFormatter(bridgeProperties.getDisplaynamePreference(),
                bridgeProperties.getDisplaynameTemplate());
    }

    /**
     * Runs the per-puppet double puppeting start tasks at startup.
     */
    @Bean("puppetStartExecutor")
    public ThreadPoolTaskExecutor puppetStartExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("puppet-start-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }
}
