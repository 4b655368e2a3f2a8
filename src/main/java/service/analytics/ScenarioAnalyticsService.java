package service.analytics;

import common.config.FleetOptimizerProperties;
import common.consts.ErrorCodes;
import common.consts.FailureReasonEnum;
import common.consts.ObjectiveEnum;
import common.exception.BusinessException;
import common.exception.MalformedInputException;
import engine.FeasibilityModel;
import lombok.extern.slf4j.Slf4j;
import model.bo.Fleet;
import model.bo.FleetMetrics;
import model.bo.FleetSelection;
import model.bo.OptimizationQuery;
import model.bo.Scenario;
import model.bo.SolveResult;
import model.bo.VesselTable;
import model.dto.response.AnalyticsRow;
import model.dto.response.ClaimCheckResp;
import model.dto.response.ComparisonResp;
import model.dto.response.DominationResp;
import model.dto.response.MarginalCostRow;
import model.dto.response.SensitivityRow;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import service.algorithm.ExactOptimizer;
import service.algorithm.FleetSelectionAlgorithm;
import service.algorithm.impl.ExactFleetOptimizer;
import service.algorithm.impl.GreedyFleetSelector;
import service.provider.VesselMetricsProvider;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * 场景与分析
 * 所有结果都由相互独立的精确求解调用拼出 本类不保存跨调用状态
 */
@Slf4j
@Service
public class ScenarioAnalyticsService {

    public static final String PARAM_FLEET_SIZE = "fleetSize";
    public static final String PARAM_SAFETY_THRESHOLD = "safetyThreshold";

    // 安全分量表上限
    public static final double MAX_SAFETY_SCORE = 5.0;

    // "严格高于基准安全分" 的最小增量
    static final double STRICT_SAFETY_MARGIN = 1e-6;

    private final ExactOptimizer exactOptimizer;
    private final FleetSelectionAlgorithm exactSelector;
    private final FleetSelectionAlgorithm greedySelector;
    private final VesselMetricsProvider vesselMetricsProvider;
    private final FleetOptimizerProperties properties;
    private final ExecutorService analyticsExecutor;

    public ScenarioAnalyticsService(ExactFleetOptimizer exactOptimizer,
                                    GreedyFleetSelector greedySelector,
                                    VesselMetricsProvider vesselMetricsProvider,
                                    FleetOptimizerProperties properties,
                                    @Qualifier("analyticsExecutor") ExecutorService analyticsExecutor) {
        this.exactOptimizer = exactOptimizer;
        this.exactSelector = exactOptimizer;
        this.greedySelector = greedySelector;
        this.vesselMetricsProvider = vesselMetricsProvider;
        this.properties = properties;
        this.analyticsExecutor = analyticsExecutor;
    }

    /**
     * 船队规模扫描: 对每个 N 求 Σx = N 下的最小成本
     * 超过船舶表大小的 N 必然不可行 不再求解 结果只到 min(maxSize, 表大小)
     */
    public List<AnalyticsRow> fleetSizeSweep(VesselTable table, Scenario scenario, int minSize, int maxSize) {
        if (minSize <= 0 || maxSize < minSize) {
            throw new MalformedInputException(String.format(ErrorCodes.INVALID_SIZE_RANGE, minSize, maxSize));
        }
        int upper = Math.min(maxSize, table.size());
        log.info("场景 {}: 船队规模扫描 [{}, {}]", scenario.getLabel(), minSize, upper);
        List<Callable<AnalyticsRow>> tasks = new ArrayList<>();
        for (int n = minSize; n <= upper; n++) {
            final int size = n;
            OptimizationQuery query = OptimizationQuery.fromScenario(scenario)
                    .label(scenario.getLabel() + "@size=" + size)
                    .fixedFleetSize(size)
                    .build();
            tasks.add(() -> AnalyticsRow.of(PARAM_FLEET_SIZE, (double) size, exactOptimizer.solve(table, query)));
        }
        return runAll(tasks);
    }

    /**
     * 帕累托前沿: 每个安全分阈值下的最小成本
     * @param fixedSize 为空时船数不限
     */
    public List<AnalyticsRow> paretoFrontier(VesselTable table, Scenario scenario, List<Double> thresholds,
                                             Integer fixedSize) {
        if (thresholds == null || thresholds.isEmpty()) {
            throw new MalformedInputException(ErrorCodes.EMPTY_SAFETY_LEVELS);
        }
        log.info("场景 {}: 帕累托扫描 {} 个阈值, fixedSize={}", scenario.getLabel(), thresholds.size(), fixedSize);
        List<Callable<AnalyticsRow>> tasks = new ArrayList<>();
        for (Double t : thresholds) {
            if (t == null || !Double.isFinite(t)) {
                throw new MalformedInputException(ErrorCodes.INVALID_SAFETY_FLOOR);
            }
            OptimizationQuery query = OptimizationQuery.fromScenario(scenario)
                    .label(scenario.getLabel() + "@safety=" + t)
                    .safetyFloor(t)
                    .fixedFleetSize(fixedSize)
                    .build();
            tasks.add(() -> AnalyticsRow.of(PARAM_SAFETY_THRESHOLD, t, exactOptimizer.solve(table, query)));
        }
        return runAll(tasks);
    }

    /**
     * 边际成本: 阈值升序后 相邻两个可行点之间 Δcost / Δthreshold
     */
    public List<MarginalCostRow> marginalCost(VesselTable table, Scenario scenario, List<Double> thresholds,
                                              Integer fixedSize) {
        if (thresholds == null || thresholds.isEmpty()) {
            throw new MalformedInputException(ErrorCodes.EMPTY_SAFETY_LEVELS);
        }
        List<Double> sorted = new ArrayList<>(new TreeSet<>(thresholds));
        List<AnalyticsRow> frontier = paretoFrontier(table, scenario, sorted, fixedSize);

        List<MarginalCostRow> rows = new ArrayList<>();
        AnalyticsRow previous = null;
        for (AnalyticsRow point : frontier) {
            if (!point.isFeasible()) continue;
            if (previous != null) {
                MarginalCostRow row = new MarginalCostRow();
                row.setFromThreshold(previous.getValue());
                row.setToThreshold(point.getValue());
                row.setFromCost(previous.getCost());
                row.setToCost(point.getCost());
                row.setDeltaCost(point.getCost() - previous.getCost());
                row.setDeltaThreshold(point.getValue() - previous.getValue());
                row.setMarginalCost(row.getDeltaCost() / row.getDeltaThreshold());
                rows.add(row);
            }
            previous = point;
        }
        return rows;
    }

    /**
     * 支配搜索
     * 在成本 <= C0 的前提下逐步抬高安全分阈值 取最高可行阈值对应的船队
     * @param baselineIds 基准船队 为空时使用贪心结果
     * @param step        阈值步长 为空时用配置值
     */
    public DominationResp dominationSearch(VesselTable table, Scenario scenario, List<String> baselineIds,
                                           Double step) {
        double increment = step == null ? properties.getDominationStep() : step;
        if (!Double.isFinite(increment) || increment <= 0) {
            throw new MalformedInputException(ErrorCodes.INVALID_STEP);
        }
        DominationResp resp = new DominationResp();
        Fleet baseline;
        if (baselineIds == null || baselineIds.isEmpty()) {
            FleetSelection greedy = greedySelector.select(table, scenario);
            if (greedy.getFleet() == null) {
                resp.setDominated(false);
                resp.setProbes(new ArrayList<>());
                resp.setMessage("贪心基准不可行: " + greedy.getMessage());
                return resp;
            }
            baseline = greedy.getFleet();
        } else {
            baseline = Fleet.of(baselineIds);
        }
        FleetMetrics base = FeasibilityModel.metrics(baseline, table);
        double c0 = base.getTotalCost();
        double s0 = base.getAvgSafety();
        double tol = properties.getSafetyTolerance();
        double costEps = FeasibilityModel.costEpsilon(c0);
        resp.setBaselineVesselIds(new ArrayList<>(baseline.getVesselIds()));
        resp.setBaselineCost(c0);
        resp.setBaselineSafety(s0);

        // S0 处只比成本 之后每个阈值都严格高于 S0
        List<Double> thresholds = new ArrayList<>();
        thresholds.add(s0);
        double upper = Math.min(MAX_SAFETY_SCORE, table.maxSafetyScore());
        if (s0 + STRICT_SAFETY_MARGIN <= upper) {
            thresholds.add(s0 + STRICT_SAFETY_MARGIN);
        }
        double steps = Math.max(0.0, Math.floor((upper + tol - s0) / increment));
        if (steps + thresholds.size() > properties.getMaxDominationProbes()) {
            throw new MalformedInputException(String.format(ErrorCodes.TOO_MANY_PROBES,
                    (long) (steps + thresholds.size()), properties.getMaxDominationProbes()));
        }
        for (int k = 1; k <= steps; k++) {
            thresholds.add(s0 + k * increment);
        }
        log.info("支配搜索: C0={}, S0={}, 探测 {} 个阈值", c0, s0, thresholds.size());

        List<Callable<AnalyticsRow>> tasks = new ArrayList<>();
        for (Double t : thresholds) {
            OptimizationQuery query = OptimizationQuery.fromScenario(scenario)
                    .label(scenario.getLabel() + "@dominate=" + t)
                    .safetyFloor(t)
                    .costCeiling(c0)
                    .build();
            tasks.add(() -> AnalyticsRow.of(PARAM_SAFETY_THRESHOLD, t, exactOptimizer.solve(table, query)));
        }
        List<AnalyticsRow> probes = runAll(tasks);
        resp.setProbes(probes);

        AnalyticsRow best = null;
        for (int i = 1; i < probes.size(); i++) {
            AnalyticsRow probe = probes.get(i);
            if (probe.isFeasible() && (best == null || probe.getValue() > best.getValue())) {
                best = probe;
            }
        }
        if (best == null && probes.get(0).isFeasible() && probes.get(0).getCost() < c0 - costEps) {
            best = probes.get(0);
        }
        boolean dominated = best != null
                && best.getCost() <= c0 + costEps
                && best.getAvgSafety() >= s0 - tol
                && (best.getCost() < c0 - costEps || best.getAvgSafety() > s0 + tol);
        resp.setDominated(dominated);
        if (dominated) {
            resp.setBest(best);
            resp.setCostSaving(c0 - best.getCost());
            resp.setSafetyGain(best.getAvgSafety() - s0);
            resp.setMessage(String.format("找到支配船队: 成本 %.2f <= %.2f, 安全分 %.4f >= %.4f",
                    best.getCost(), c0, best.getAvgSafety(), s0));
            log.info("支配搜索: 基准被支配, 最高可行阈值 {}", best.getValue());
        } else {
            resp.setMessage("不存在支配基准的船队");
            log.info("支配搜索: 基准未被支配");
        }
        return resp;
    }

    /**
     * 声明核验: 只判定 (船数, 安全分, 成本上限) 能否同时满足
     * 不可行时给出去掉成本上限后的最小成本 作为与声明的差距
     */
    public ClaimCheckResp checkClaim(VesselTable table, Scenario scenario, int fleetSize, double safetyFloor,
                                     double costCeiling) {
        OptimizationQuery claim = OptimizationQuery.fromScenario(scenario)
                .label(scenario.getLabel() + "@claim")
                .fixedFleetSize(fleetSize)
                .safetyFloor(safetyFloor)
                .costCeiling(costCeiling)
                .objective(ObjectiveEnum.FEASIBILITY)
                .build();
        OptimizationQuery atSizeAndSafety = claim.toBuilder()
                .label(scenario.getLabel() + "@claim-size-safety")
                .costCeiling(null)
                .objective(ObjectiveEnum.MIN_COST)
                .build();
        OptimizationQuery atSafety = atSizeAndSafety.toBuilder()
                .label(scenario.getLabel() + "@claim-safety")
                .fixedFleetSize(null)
                .build();

        List<Callable<AnalyticsRow>> tasks = new ArrayList<>();
        tasks.add(() -> AnalyticsRow.of(PARAM_FLEET_SIZE, (double) fleetSize, exactOptimizer.solve(table, claim)));
        tasks.add(() -> AnalyticsRow.of(PARAM_FLEET_SIZE, (double) fleetSize,
                exactOptimizer.solve(table, atSizeAndSafety)));
        tasks.add(() -> AnalyticsRow.of(PARAM_SAFETY_THRESHOLD, safetyFloor, exactOptimizer.solve(table, atSafety)));
        List<AnalyticsRow> rows = runAll(tasks);

        ClaimCheckResp resp = new ClaimCheckResp();
        resp.setClaimedFleetSize(fleetSize);
        resp.setClaimedSafetyFloor(safetyFloor);
        resp.setClaimedCostCeiling(costCeiling);
        resp.setClaim(rows.get(0));
        resp.setMinCostAtSizeAndSafety(rows.get(1));
        resp.setMinCostAtSafety(rows.get(2));
        resp.setFeasible(rows.get(0).isFeasible());

        if (resp.isFeasible()) {
            resp.setVerdict("声明可行");
        } else if (rows.get(1).isFeasible()) {
            double gap = rows.get(1).getCost() - costCeiling;
            resp.setGap(gap);
            if (costCeiling > 0) {
                resp.setGapPct(gap / costCeiling * 100.0);
            }
            resp.setVerdict(String.format("声明不可行: %d 艘船、安全分 >= %.2f 的最小成本为 %.2f, 超出声明 %.2f",
                    fleetSize, safetyFloor, rows.get(1).getCost(), gap));
        } else {
            resp.setVerdict(String.format("声明不可行: 不存在 %d 艘船且安全分 >= %.2f 的船队", fleetSize, safetyFloor));
        }
        log.info("声明核验 (N={}, S={}, C={}): {}", fleetSize, safetyFloor, costCeiling, resp.getVerdict());
        return resp;
    }

    /**
     * 同一场景下贪心与精确求解的对比
     */
    public ComparisonResp compare(VesselTable table, Scenario scenario) {
        FleetSelection greedy = greedySelector.select(table, scenario);
        FleetSelection exact = exactSelector.select(table, scenario);
        ComparisonResp resp = new ComparisonResp();
        resp.setScenarioLabel(scenario.getLabel());
        resp.setGreedy(greedy);
        resp.setExact(exact);
        if (greedy.getFleet() != null && exact.getFleet() != null) {
            double greedyCost = greedy.getMetrics().getTotalCost();
            double savings = greedyCost - exact.getMetrics().getTotalCost();
            resp.setSavings(savings);
            if (greedyCost > 0) {
                resp.setSavingsPct(savings / greedyCost * 100.0);
            }
            resp.setSafetyDelta(exact.getMetrics().getAvgSafety() - greedy.getMetrics().getAvgSafety());
        }
        return resp;
    }

    /**
     * 场景敏感性: 每个场景用自己碳价下的船舶表 分别跑贪心和精确求解
     */
    public List<SensitivityRow> sensitivity(List<Scenario> scenarios) {
        if (scenarios == null || scenarios.isEmpty()) {
            throw new MalformedInputException(ErrorCodes.SCENARIO_REQUIRED);
        }
        List<Callable<SensitivityRow>> tasks = new ArrayList<>();
        for (Scenario scenario : scenarios) {
            VesselTable table = vesselMetricsProvider.loadVessels(scenario);
            tasks.add(() -> toSensitivityRow(scenario, compare(table, scenario)));
        }
        return runAll(tasks);
    }

    private static SensitivityRow toSensitivityRow(Scenario scenario, ComparisonResp comparison) {
        SensitivityRow row = new SensitivityRow();
        row.setScenarioLabel(scenario.getLabel());
        row.setCarbonPrice(scenario.getCarbonPrice());
        row.setSafetyFloor(scenario.getSafetyFloor());
        FleetSelection greedy = comparison.getGreedy();
        row.setGreedyOutcome(greedy.getOutcome());
        if (greedy.getMetrics() != null) {
            row.setGreedyCost(greedy.getMetrics().getTotalCost());
            row.setGreedySafety(greedy.getMetrics().getAvgSafety());
            row.setGreedyFleetSize(greedy.getMetrics().getFleetSize());
        }
        FleetSelection exact = comparison.getExact();
        row.setExactOutcome(exact.getOutcome());
        if (exact.getMetrics() != null) {
            row.setExactCost(exact.getMetrics().getTotalCost());
            row.setExactSafety(exact.getMetrics().getAvgSafety());
            row.setExactFleetSize(exact.getMetrics().getFleetSize());
        }
        row.setSavings(comparison.getSavings());
        return row;
    }

    /**
     * 执行一组相互独立的扫描点 结果按提交顺序返回
     */
    private <T> List<T> runAll(List<Callable<T>> tasks) {
        List<T> results = new ArrayList<>(tasks.size());
        if (analyticsExecutor == null || properties.getAnalyticsParallelism() <= 1 || tasks.size() <= 1) {
            for (Callable<T> task : tasks) {
                results.add(call(task));
            }
            return results;
        }
        List<Future<T>> futures = new ArrayList<>(tasks.size());
        for (Callable<T> task : tasks) {
            futures.add(analyticsExecutor.submit(task));
        }
        for (Future<T> f : futures) {
            try {
                results.add(f.get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(other -> other.cancel(true));
                throw new BusinessException(FailureReasonEnum.SOLVER_ERROR, "分析扫描被中断");
            } catch (ExecutionException e) {
                futures.forEach(other -> other.cancel(true));
                if (e.getCause() instanceof RuntimeException) {
                    throw (RuntimeException) e.getCause();
                }
                throw new BusinessException(FailureReasonEnum.SOLVER_ERROR, "分析扫描失败: " + e.getCause());
            }
        }
        return results;
    }

    private static <T> T call(Callable<T> task) {
        try {
            return task.call();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new BusinessException(FailureReasonEnum.SOLVER_ERROR, "分析扫描失败: " + e.getMessage());
        }
    }
}
