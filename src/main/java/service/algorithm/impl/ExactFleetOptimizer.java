package service.algorithm.impl;

import common.config.FleetOptimizerProperties;
import common.consts.SelectionOutcomeEnum;
import common.consts.SelectionPhaseEnum;
import engine.BranchAndBoundSolver;
import engine.FeasibilityModel;
import lombok.extern.slf4j.Slf4j;
import model.bo.FleetSelection;
import model.bo.OptimizationQuery;
import model.bo.Scenario;
import model.bo.SelectionLogEntry;
import model.bo.SolveResult;
import model.bo.VesselTable;
import model.entity.Vessel;
import org.springframework.stereotype.Component;
import service.algorithm.ExactOptimizer;
import service.algorithm.FleetSelectionAlgorithm;

/**
 * 精确选船: 在全部约束下求最小成本船队
 * 同时作为分析层的 ExactOptimizer 使用
 */
@Slf4j
@Component
public class ExactFleetOptimizer implements FleetSelectionAlgorithm, ExactOptimizer {

    public static final String NAME = "exact";

    private final BranchAndBoundSolver solver;
    private final double safetyTolerance;

    public ExactFleetOptimizer(FleetOptimizerProperties properties) {
        this.solver = new BranchAndBoundSolver(properties.getSafetyTolerance(), properties.getIntegralityTolerance());
        this.safetyTolerance = properties.getSafetyTolerance();
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public SolveResult solve(VesselTable table, OptimizationQuery query) {
        return solver.solve(table, query);
    }

    @Override
    public FleetSelection select(VesselTable table, Scenario scenario) {
        SolveResult solved = solve(table, OptimizationQuery.fromScenario(scenario).build());
        FleetSelection.FleetSelectionBuilder result = FleetSelection.builder()
                .algorithm(NAME)
                .scenarioLabel(scenario.getLabel())
                .certificate(solved.getCertificate())
                .message(solved.getMessage());

        switch (solved.getStatus()) {
            case OPTIMAL:
            case FEASIBLE:
                int rank = 0;
                for (String id : solved.getFleet().getVesselIds()) {
                    Vessel v = table.get(id);
                    result.logEntry(new SelectionLogEntry(id, SelectionPhaseEnum.OPTIMIZER, ++rank,
                            String.format("%s, costPerDwt=%.4f, safety=%.2f",
                                    v.getMainFuelType().getDesc(), v.getCostPerDwt(), v.getSafetyScore())));
                }
                return result.outcome(SelectionOutcomeEnum.SATISFIED)
                        .fleet(solved.getFleet())
                        .metrics(solved.getMetrics())
                        .constraintCheck(FeasibilityModel.check(solved.getMetrics(), scenario, safetyTolerance))
                        .build();
            case INFEASIBLE:
                log.warn("场景 {}: 精确求解判定不可行", scenario.getLabel());
                return result.outcome(SelectionOutcomeEnum.INFEASIBLE_SCENARIO).build();
            case ERROR:
            default:
                log.error("场景 {}: 精确求解失败 {}", scenario.getLabel(), solved.getMessage());
                return result.outcome(SelectionOutcomeEnum.SOLVER_ERROR).build();
        }
    }
}
