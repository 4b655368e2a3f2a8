package common.config;

import lombok.Data;
import model.bo.Scenario;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * 选船与求解配置
 * 这里只提供缺省值 调用方省略的场景字段才会用到 核心计算始终接收显式的 Scenario
 *
 * 可通过 Spring 配置文件覆盖：
 *
 * fleet.optimizer.default-safety-floor
 * fleet.optimizer.cargo-requirement-dwt
 * fleet.optimizer.analytics-parallelism
 */
@Configuration
@ConfigurationProperties(prefix = "fleet.optimizer")
@Data
public class FleetOptimizerProperties {

    /**
     * 船队平均安全分下限
     */
    private double defaultSafetyFloor = Scenario.DEFAULT_SAFETY_FLOOR;

    /**
     * 月度运力需求 (吨) 年度加注量 54.92 百万吨 / 12
     */
    private double cargoRequirementDwt = Scenario.MONTHLY_CARGO_REQUIREMENT_DWT;

    /**
     * 缺省碳价 (美元/吨 CO2当量)
     */
    private double defaultCarbonPrice = Scenario.DEFAULT_CARBON_PRICE;

    /**
     * 平均安全分比较的容差
     */
    private double safetyTolerance = 1e-9;

    /**
     * LP 松弛解判定为整数的容差
     */
    private double integralityTolerance = 1e-6;

    /**
     * 分析扫描的并行线程数 1 表示顺序执行
     */
    private int analyticsParallelism = 1;

    /**
     * 支配搜索的安全分步长
     */
    private double dominationStep = 0.1;

    /**
     * 单次支配搜索最多求解的阈值个数
     */
    private int maxDominationProbes = 200;

    /**
     * 审计日志保留条数
     */
    private int auditCapacity = 500;
}
