package service.selection;

import common.config.FleetOptimizerProperties;
import common.consts.ErrorCodes;
import common.exception.MalformedInputException;
import lombok.extern.slf4j.Slf4j;
import model.bo.FleetSelection;
import model.bo.Scenario;
import model.bo.VesselTable;
import model.dto.request.ScenarioReq;
import model.dto.response.ComparisonResp;
import org.springframework.stereotype.Service;
import service.algorithm.FleetSelectionAlgorithm;
import service.algorithm.impl.SelectionAuditLog;
import service.analytics.ScenarioAnalyticsService;
import service.provider.VesselMetricsProvider;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 选船服务
 * 负责连接 Controller 和 选船算法: 请求 -> 场景 -> 船舶表 -> 算法 -> 审计
 */
@Service
@Slf4j
public class FleetSelectionService {

    private final Map<String, FleetSelectionAlgorithm> algorithms = new LinkedHashMap<>();
    private final VesselMetricsProvider vesselMetricsProvider;
    private final ScenarioAnalyticsService analyticsService;
    private final SelectionAuditLog auditLog;
    private final FleetOptimizerProperties properties;

    public FleetSelectionService(List<FleetSelectionAlgorithm> algorithms,
                                 VesselMetricsProvider vesselMetricsProvider,
                                 ScenarioAnalyticsService analyticsService,
                                 SelectionAuditLog auditLog,
                                 FleetOptimizerProperties properties) {
        for (FleetSelectionAlgorithm algorithm : algorithms) {
            this.algorithms.put(algorithm.getName(), algorithm);
        }
        this.vesselMetricsProvider = vesselMetricsProvider;
        this.analyticsService = analyticsService;
        this.auditLog = auditLog;
        this.properties = properties;
    }

    /**
     * 请求参数转为不可变场景 省略的字段取配置缺省值
     */
    public Scenario resolveScenario(ScenarioReq req) {
        Scenario.ScenarioBuilder builder = Scenario.builder()
                .safetyFloor(properties.getDefaultSafetyFloor())
                .cargoRequirementDwt(properties.getCargoRequirementDwt())
                .carbonPrice(properties.getDefaultCarbonPrice());
        if (req == null) {
            return builder.build();
        }
        if (req.getLabel() != null && !req.getLabel().isBlank()) builder.label(req.getLabel());
        if (req.getSafetyFloor() != null) builder.safetyFloor(req.getSafetyFloor());
        if (req.getCargoRequirementDwt() != null) builder.cargoRequirementDwt(req.getCargoRequirementDwt());
        if (req.getCarbonPrice() != null) builder.carbonPrice(req.getCarbonPrice());
        if (req.getRequiredFuelTypes() != null && !req.getRequiredFuelTypes().isEmpty()) {
            if (req.getRequiredFuelTypes().contains(null)) {
                throw new MalformedInputException("无法识别的燃料类型");
            }
            builder.requiredFuelTypes(EnumSet.copyOf(req.getRequiredFuelTypes()));
        }
        Scenario scenario = builder.build();
        if (!Double.isFinite(scenario.getSafetyFloor())) {
            throw new MalformedInputException(ErrorCodes.INVALID_SAFETY_FLOOR);
        }
        if (!Double.isFinite(scenario.getCargoRequirementDwt()) || scenario.getCargoRequirementDwt() <= 0) {
            throw new MalformedInputException(ErrorCodes.INVALID_CARGO_REQUIREMENT);
        }
        return scenario;
    }

    public VesselTable loadTable(Scenario scenario) {
        return vesselMetricsProvider.loadVessels(scenario);
    }

    /**
     * 用指定算法选船 带失败标签的结果写入审计日志
     */
    public FleetSelection select(String algorithmName, ScenarioReq req) {
        FleetSelectionAlgorithm algorithm = algorithms.get(algorithmName);
        if (algorithm == null) {
            throw new MalformedInputException(String.format(ErrorCodes.UNKNOWN_ALGORITHM, algorithmName));
        }
        Scenario scenario = resolveScenario(req);
        VesselTable table = loadTable(scenario);
        log.info("场景 {}: 使用 {} 算法选船, 候选船 {} 艘", scenario.getLabel(), algorithmName, table.size());
        FleetSelection selection = algorithm.select(table, scenario);
        auditLog.recordSelection(selection);
        return selection;
    }

    public ComparisonResp compare(ScenarioReq req) {
        Scenario scenario = resolveScenario(req);
        ComparisonResp resp = analyticsService.compare(loadTable(scenario), scenario);
        auditLog.recordSelection(resp.getGreedy());
        auditLog.recordSelection(resp.getExact());
        return resp;
    }

    public List<String> algorithmNames() {
        return List.copyOf(algorithms.keySet());
    }
}
