package common.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * 分析扫描线程池
 * 每个扫描点只读共享的船舶表 写自己的结果槽位 无需加锁
 */
@Configuration
public class AnalyticsExecutorConfig {

    @Bean(name = "analyticsExecutor", destroyMethod = "shutdown")
    public ExecutorService analyticsExecutor(FleetOptimizerProperties properties) {
        int threads = Math.max(1, properties.getAnalyticsParallelism());
        return Executors.newFixedThreadPool(threads);
    }
}
