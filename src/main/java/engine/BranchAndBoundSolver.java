package engine;

import common.consts.FuelTypeEnum;
import common.consts.ObjectiveEnum;
import common.consts.SolveStatusEnum;
import lombok.extern.slf4j.Slf4j;
import model.bo.Fleet;
import model.bo.FleetMetrics;
import model.bo.OptimalityCertificate;
import model.bo.OptimizationQuery;
import model.bo.SolveResult;
import model.bo.VesselTable;
import model.entity.Vessel;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 0-1 整数规划的分支定界求解器
 * <p>
 * 深度优先搜索 每个节点用 LP 松弛求下界:
 * <ul>
 *     <li>节点只由固定变量描述 节点评估是 (节点, 当前上界) 的纯函数</li>
 *     <li>分支变量取最不整的变量 并列时取船舶ID最小者 先展开 x=1 子节点</li>
 *     <li>只有严格更优的整数解才替换当前最优 因此重复运行结果完全一致</li>
 * </ul>
 * 求解器本身无状态 可以在多个线程上对不同查询并行调用
 */
@Slf4j
public class BranchAndBoundSolver {

    private final double safetyTolerance;
    private final double integralityTolerance;

    public BranchAndBoundSolver(double safetyTolerance, double integralityTolerance) {
        this.safetyTolerance = safetyTolerance;
        this.integralityTolerance = integralityTolerance;
    }

    public SolveResult solve(VesselTable table, OptimizationQuery query) {
        query.validate();
        long start = System.currentTimeMillis();
        List<Vessel> vessels = table.getVessels();
        LpRelaxation relaxation = new LpRelaxation(vessels, query);
        boolean feasibilityOnly = query.getObjective() == ObjectiveEnum.FEASIBILITY;

        Deque<SearchNode> stack = new ArrayDeque<>();
        stack.push(SearchNode.root(vessels.size()));

        Fleet bestFleet = null;
        FleetMetrics bestMetrics = null;
        double bestCost = Double.POSITIVE_INFINITY;
        Double rootBound = null;
        long explored = 0;
        long prunedByBound = 0;
        long infeasible = 0;
        long updates = 0;
        long failures = 0;

        while (!stack.isEmpty()) {
            SearchNode node = stack.pop();
            // 入栈后当前最优可能已经改进 先用父节点下界复查
            if (bestFleet != null && !improves(node.getParentBound(), bestCost)) {
                prunedByBound++;
                continue;
            }
            explored++;

            NodeEvaluation eval = evaluate(node, vessels, relaxation, query);
            if (node.isRoot() && eval.kind != EvaluationKind.INFEASIBLE && eval.kind != EvaluationKind.FAILED) {
                rootBound = eval.bound;
            }

            switch (eval.kind) {
                case INFEASIBLE:
                    infeasible++;
                    break;
                case FAILED:
                    failures++;
                    log.warn("LP 松弛求解失败: query={}, depth={}, state={}", query.getLabel(), node.getDepth(), eval.detail);
                    break;
                case FRACTIONAL:
                    if (bestFleet != null && !improves(eval.bound, bestCost)) {
                        prunedByBound++;
                    } else {
                        // 后入栈的 x=1 子节点先被展开
                        stack.push(node.branch(eval.branchIndex, 0, eval.bound));
                        stack.push(node.branch(eval.branchIndex, 1, eval.bound));
                    }
                    break;
                case INTEGRAL:
                    Fleet candidate = toFleet(eval.selected, vessels);
                    FleetMetrics metrics = FeasibilityModel.metrics(candidate, table);
                    if (!FeasibilityModel.satisfies(metrics, query, safetyTolerance)) {
                        // 数值上取整后不满足约束 子树里仍可能有可行解 继续分支
                        int free = firstFree(node);
                        if (free >= 0) {
                            stack.push(node.branch(free, 0, eval.bound));
                            stack.push(node.branch(free, 1, eval.bound));
                        } else {
                            infeasible++;
                        }
                    } else if (bestFleet == null || improves(metrics.getTotalCost(), bestCost)) {
                        bestFleet = candidate;
                        bestMetrics = metrics;
                        bestCost = metrics.getTotalCost();
                        updates++;
                        log.debug("新的最优解: query={}, cost={}, size={}, nodes={}",
                                query.getLabel(), bestCost, candidate.size(), explored);
                    }
                    break;
                default:
                    throw new IllegalStateException("未知的节点评估结果: " + eval.kind);
            }

            if (feasibilityOnly && bestFleet != null) {
                break;
            }
        }

        boolean exhausted = stack.isEmpty() && failures == 0;
        OptimalityCertificate certificate = OptimalityCertificate.builder()
                .rootBound(rootBound)
                .nodesExplored(explored)
                .nodesPrunedByBound(prunedByBound)
                .nodesInfeasible(infeasible)
                .incumbentUpdates(updates)
                .exhausted(exhausted)
                .build();

        SolveResult.SolveResultBuilder result = SolveResult.builder()
                .label(query.getLabel())
                .certificate(certificate);
        long elapsed = System.currentTimeMillis() - start;

        if (failures > 0) {
            log.warn("求解 {} 不完整: {} 个节点 LP 失败, 耗时 {}ms", query.getLabel(), failures, elapsed);
            return result.status(SolveStatusEnum.ERROR)
                    .fleet(bestFleet)
                    .metrics(bestMetrics)
                    .objectiveValue(bestFleet == null ? null : bestCost)
                    .message("LP 松弛求解失败 " + failures + " 次, 结果未经最优性证明")
                    .build();
        }
        if (bestFleet == null) {
            log.info("求解 {}: 不可行, nodes={}, 耗时 {}ms", query.getLabel(), explored, elapsed);
            return result.status(SolveStatusEnum.INFEASIBLE)
                    .message("约束系统不存在整数解")
                    .build();
        }
        SolveStatusEnum status = feasibilityOnly ? SolveStatusEnum.FEASIBLE : SolveStatusEnum.OPTIMAL;
        log.info("求解 {}: {}, cost={}, safety={}, size={}, dwt={}, nodes={}, 耗时 {}ms",
                query.getLabel(), status, bestCost, bestMetrics.getAvgSafety(), bestFleet.size(),
                bestMetrics.getTotalDwt(), explored, elapsed);
        return result.status(status)
                .fleet(bestFleet)
                .metrics(bestMetrics)
                .objectiveValue(bestCost)
                .build();
    }

    /**
     * 节点评估: 先做组合必要条件筛查 再解 LP 松弛
     */
    private NodeEvaluation evaluate(SearchNode node, List<Vessel> vessels, LpRelaxation relaxation,
                                    OptimizationQuery query) {
        if (!mayBeFeasible(node, vessels, query)) {
            return NodeEvaluation.infeasible();
        }
        if (node.freeCount() == 0) {
            boolean[] selected = new boolean[vessels.size()];
            double cost = 0.0;
            for (int i = 0; i < selected.length; i++) {
                selected[i] = node.fixingOf(i) == 1;
                if (selected[i]) cost += vessels.get(i).getAdjustedCost();
            }
            return NodeEvaluation.integral(cost, selected);
        }

        LpRelaxation.Solution lp = relaxation.solve(node);
        if (lp.kind == LpRelaxation.Kind.INFEASIBLE) {
            return NodeEvaluation.infeasible();
        }
        if (lp.kind == LpRelaxation.Kind.FAILED) {
            return NodeEvaluation.failed(String.valueOf(lp.state));
        }

        int branchIndex = -1;
        double worstGap = integralityTolerance;
        boolean[] selected = new boolean[vessels.size()];
        for (int i = 0; i < selected.length; i++) {
            double value = lp.values[i];
            selected[i] = value > 0.5;
            if (!node.isFree(i)) continue;
            double gap = Math.min(value, 1.0 - value);
            if (gap > worstGap) {
                worstGap = gap;
                branchIndex = i;
            }
        }
        if (branchIndex >= 0) {
            return NodeEvaluation.fractional(lp.objective, branchIndex);
        }
        return NodeEvaluation.integral(lp.objective, selected);
    }

    /**
     * 组合必要条件: 把全部自由变量取到最有利的值仍不满足某条约束 则节点不可行
     */
    private boolean mayBeFeasible(SearchNode node, List<Vessel> vessels, OptimizationQuery query) {
        int ones = 0;
        int free = 0;
        double reachableDwt = 0.0;
        double fixedCost = 0.0;
        double safetyMargin = 0.0;
        boolean[] fuelReachable = new boolean[FuelTypeEnum.values().length];
        for (int i = 0; i < vessels.size(); i++) {
            int fixing = node.fixingOf(i);
            if (fixing == 0) continue;
            Vessel v = vessels.get(i);
            double margin = v.getSafetyScore() - query.getSafetyFloor();
            reachableDwt += v.getDwt();
            fuelReachable[v.getMainFuelType().ordinal()] = true;
            if (fixing == 1) {
                ones++;
                fixedCost += v.getAdjustedCost();
                safetyMargin += margin;
            } else {
                free++;
                safetyMargin += Math.max(0.0, margin);
            }
        }
        if (reachableDwt < query.getCargoRequirementDwt()) return false;
        for (FuelTypeEnum fuel : query.getRequiredFuelTypes()) {
            if (!fuelReachable[fuel.ordinal()]) return false;
        }
        if (safetyMargin < -safetyTolerance * Math.max(1, ones + free)) return false;
        if (query.getFixedFleetSize() != null) {
            if (ones > query.getFixedFleetSize() || ones + free < query.getFixedFleetSize()) return false;
        } else if (query.getMaxFleetSize() != null && ones > query.getMaxFleetSize()) {
            return false;
        }
        return query.getCostCeiling() == null
                || fixedCost <= query.getCostCeiling() + FeasibilityModel.costEpsilon(query.getCostCeiling());
    }

    private static boolean improves(double candidate, double incumbent) {
        return candidate < incumbent - FeasibilityModel.costEpsilon(incumbent);
    }

    private static int firstFree(SearchNode node) {
        for (int i = 0; i < node.size(); i++) {
            if (node.isFree(i)) return i;
        }
        return -1;
    }

    private static Fleet toFleet(boolean[] selected, List<Vessel> vessels) {
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < selected.length; i++) {
            if (selected[i]) ids.add(vessels.get(i).getVesselId());
        }
        return Fleet.of(ids);
    }

    private enum EvaluationKind {
        INFEASIBLE,
        FAILED,
        FRACTIONAL,
        INTEGRAL
    }

    private static final class NodeEvaluation {
        final EvaluationKind kind;
        final double bound;
        final int branchIndex;
        final boolean[] selected;
        final String detail;

        private NodeEvaluation(EvaluationKind kind, double bound, int branchIndex, boolean[] selected, String detail) {
            this.kind = kind;
            this.bound = bound;
            this.branchIndex = branchIndex;
            this.selected = selected;
            this.detail = detail;
        }

        static NodeEvaluation infeasible() {
            return new NodeEvaluation(EvaluationKind.INFEASIBLE, Double.NaN, -1, null, null);
        }

        static NodeEvaluation failed(String state) {
            return new NodeEvaluation(EvaluationKind.FAILED, Double.NaN, -1, null, state);
        }

        static NodeEvaluation fractional(double bound, int branchIndex) {
            return new NodeEvaluation(EvaluationKind.FRACTIONAL, bound, branchIndex, null, null);
        }

        static NodeEvaluation integral(double bound, boolean[] selected) {
            return new NodeEvaluation(EvaluationKind.INTEGRAL, bound, -1, selected, null);
        }
    }
}
