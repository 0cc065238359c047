package com.propertyintel.gap.config;

import com.propertyintel.gap.browser.Pacer;
import com.propertyintel.gap.service.GapPolicy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Random;

@Configuration(proxyBeanMethods = false)
public class CollectorConfiguration {

    @Bean
    public Pacer pacer() {
        return Pacer.sleeping();
    }

    /** Picks the coarse zoom level used while recentering. */
    @Bean
    public Random navigationRandom() {
        return new Random();
    }

    @Bean
    public GapPolicy gapPolicy() {
        return GapPolicy.previousLeaseCoversSale();
    }
}
