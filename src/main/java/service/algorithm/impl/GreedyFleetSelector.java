package service.algorithm.impl;

import common.config.FleetOptimizerProperties;
import common.consts.FuelTypeEnum;
import common.consts.SelectionOutcomeEnum;
import common.consts.SelectionPhaseEnum;
import engine.FeasibilityModel;
import lombok.extern.slf4j.Slf4j;
import model.bo.ConstraintCheck;
import model.bo.Fleet;
import model.bo.FleetMetrics;
import model.bo.FleetSelection;
import model.bo.Scenario;
import model.bo.SelectionLogEntry;
import model.bo.VesselTable;
import model.entity.Vessel;
import org.springframework.stereotype.Component;
import service.algorithm.FleetSelectionAlgorithm;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 两阶段贪心选船
 * 1. 播种: 每种要求的燃料类型选单位DWT成本最低的一艘
 * 2. 补足: 其余船按单位DWT成本升序加入 直到总DWT达标
 * 安全分只在补足结束后检查 不达标时报告 CONSTRAINT_UNSATISFIED 而不是另找方案
 */
@Slf4j
@Component
public class GreedyFleetSelector implements FleetSelectionAlgorithm {

    public static final String NAME = "greedy";

    // 单位DWT成本升序 相同时按船舶ID
    static final Comparator<Vessel> COST_PER_DWT_ORDER =
            Comparator.comparingDouble(Vessel::getCostPerDwt).thenComparing(Vessel::getVesselId);

    private final double safetyTolerance;

    public GreedyFleetSelector(FleetOptimizerProperties properties) {
        this.safetyTolerance = properties.getSafetyTolerance();
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public FleetSelection select(VesselTable table, Scenario scenario) {
        FleetSelection.FleetSelectionBuilder result = FleetSelection.builder()
                .algorithm(NAME)
                .scenarioLabel(scenario.getLabel());

        // 阶段1: 播种
        log.info("场景 {}: 播种阶段, 要求燃料类型 {} 种", scenario.getLabel(), scenario.getRequiredFuelTypes().size());
        Set<String> selected = new LinkedHashSet<>();
        List<FuelTypeEnum> missing = new ArrayList<>();
        double dwt = 0.0;
        int rank = 0;
        for (FuelTypeEnum fuel : scenario.getRequiredFuelTypes()) {
            Vessel seed = table.byFuelType(fuel).stream().min(COST_PER_DWT_ORDER).orElse(null);
            if (seed == null) {
                missing.add(fuel);
                continue;
            }
            selected.add(seed.getVesselId());
            dwt += seed.getDwt();
            result.logEntry(new SelectionLogEntry(seed.getVesselId(), SelectionPhaseEnum.SEED, ++rank,
                    String.format("%s 代表, costPerDwt=%.4f, safety=%.2f, dwt=%.0f",
                            fuel.getDesc(), seed.getCostPerDwt(), seed.getSafetyScore(), seed.getDwt())));
        }
        if (!missing.isEmpty()) {
            log.warn("场景 {}: 燃料类型 {} 没有任何候选船", scenario.getLabel(), missing);
            return result.outcome(SelectionOutcomeEnum.INFEASIBLE_SCENARIO)
                    .clearSelectionLog()
                    .message("以下燃料类型没有候选船: " + missing)
                    .build();
        }

        // 阶段2: 补足运力
        List<Vessel> remaining = new ArrayList<>();
        for (Vessel v : table.getVessels()) {
            if (!selected.contains(v.getVesselId())) remaining.add(v);
        }
        remaining.sort(COST_PER_DWT_ORDER);
        for (Vessel v : remaining) {
            if (dwt >= scenario.getCargoRequirementDwt()) break;
            selected.add(v.getVesselId());
            dwt += v.getDwt();
            result.logEntry(new SelectionLogEntry(v.getVesselId(), SelectionPhaseEnum.FILL, ++rank,
                    String.format("costPerDwt=%.4f, 累计DWT=%.0f/%.0f",
                            v.getCostPerDwt(), dwt, scenario.getCargoRequirementDwt())));
        }
        if (dwt < scenario.getCargoRequirementDwt()) {
            log.warn("场景 {}: 全部船舶DWT {} 仍低于需求 {}", scenario.getLabel(), dwt, scenario.getCargoRequirementDwt());
            return result.outcome(SelectionOutcomeEnum.INFEASIBLE_SCENARIO)
                    .clearSelectionLog()
                    .message(String.format("候选船总DWT %.0f 低于需求 %.0f", dwt, scenario.getCargoRequirementDwt()))
                    .build();
        }

        // 阶段3: 事后校验
        Fleet fleet = Fleet.of(selected);
        FleetMetrics metrics = FeasibilityModel.metrics(fleet, table);
        ConstraintCheck check = FeasibilityModel.check(metrics, scenario, safetyTolerance);
        result.fleet(fleet).metrics(metrics).constraintCheck(check);

        log.info("场景 {}: 贪心选船完成, 船数={}, DWT={}, 成本={}, 平均安全分={}",
                scenario.getLabel(), fleet.size(), metrics.getTotalDwt(), metrics.getTotalCost(), metrics.getAvgSafety());
        if (!check.isSafetyMet()) {
            log.warn("场景 {}: 平均安全分 {} 低于下限 {}", scenario.getLabel(), metrics.getAvgSafety(), scenario.getSafetyFloor());
            return result.outcome(SelectionOutcomeEnum.CONSTRAINT_UNSATISFIED)
                    .message(String.format("平均安全分 %.2f 低于下限 %.2f, 建议改用精确求解",
                            metrics.getAvgSafety(), scenario.getSafetyFloor()))
                    .build();
        }
        return result.outcome(SelectionOutcomeEnum.SATISFIED).build();
    }
}
