package com.tenacy.logscope.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MetricsConfig {

    @Bean
    public Counter ingestedLogsCounter(MeterRegistry registry) {
        return Counter.builder("logscope.logs.ingested")
                .description("수집된 로그 수")
                .register(registry);
    }

    @Bean
    public Counter simpleQueryCounter(MeterRegistry registry) {
        return Counter.builder("logscope.query.simple")
                .description("저장소 위임 조회 수")
                .register(registry);
    }

    @Bean
    public Counter scanQueryCounter(MeterRegistry registry) {
        return Counter.builder("logscope.query.scan")
                .description("스캔 후 필터링 조회 수")
                .register(registry);
    }

    @Bean
    public Timer scanQueryTimer(MeterRegistry registry) {
        return Timer.builder("logscope.query.scan.time")
                .description("스캔 후 필터링 조회 소요 시간")
                .register(registry);
    }
}
