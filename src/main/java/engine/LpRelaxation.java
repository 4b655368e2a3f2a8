package engine;

import common.consts.FuelTypeEnum;
import model.bo.OptimizationQuery;
import model.entity.Vessel;
import org.ojalgo.optimisation.Expression;
import org.ojalgo.optimisation.ExpressionsBasedModel;
import org.ojalgo.optimisation.Optimisation;
import org.ojalgo.optimisation.Variable;

import java.math.BigDecimal;
import java.util.List;

import static java.math.BigDecimal.ONE;
import static java.math.BigDecimal.ZERO;

/**
 * 选船整数规划在某个搜索节点上的 LP 松弛 (ojAlgo)
 * 每次求解都新建模型 不在线程间共享任何求解器状态
 *
 * min Σ cost_v·x_v
 * s.t. Σ dwt_v·x_v >= D
 *      Σ (safety_v - floor)·x_v >= 0
 *      Σ_{fuel(v)=f} x_v >= 1        对每个要求的燃料类型 f
 *      Σ x_v = N  或  Σ x_v <= N      (可选)
 *      Σ cost_v·x_v <= C             (可选)
 *      0 <= x_v <= 1  固定变量取 0 或 1
 */
final class LpRelaxation {

    private final List<Vessel> vessels;
    private final OptimizationQuery query;

    LpRelaxation(List<Vessel> vessels, OptimizationQuery query) {
        this.vessels = vessels;
        this.query = query;
    }

    Solution solve(SearchNode node) {
        int n = vessels.size();
        ExpressionsBasedModel model = new ExpressionsBasedModel();
        Variable[] x = new Variable[n];
        for (int i = 0; i < n; i++) {
            Vessel v = vessels.get(i);
            x[i] = model.newVariable("x_" + i)
                    .weight(BigDecimal.valueOf(v.getAdjustedCost()))
                    .lower(ZERO)
                    .upper(ONE);
            if (!node.isFree(i)) {
                x[i].level(BigDecimal.valueOf(node.fixingOf(i)));
            }
        }

        Expression capacity = model.newExpression("capacity")
                .lower(BigDecimal.valueOf(query.getCargoRequirementDwt()));
        for (int i = 0; i < n; i++) {
            capacity.set(x[i], BigDecimal.valueOf(vessels.get(i).getDwt()));
        }

        // 平均安全分线性化: Σ (safety - floor)·x >= 0
        // 所有系数为 0 时约束恒成立 不建行
        Expression safety = null;
        for (int i = 0; i < n; i++) {
            double margin = vessels.get(i).getSafetyScore() - query.getSafetyFloor();
            if (margin != 0.0) {
                if (safety == null) {
                    safety = model.newExpression("safety").lower(ZERO);
                }
                safety.set(x[i], BigDecimal.valueOf(margin));
            }
        }

        for (FuelTypeEnum fuel : query.getRequiredFuelTypes()) {
            Expression coverage = model.newExpression("fuel_" + fuel.name()).lower(ONE);
            for (int i = 0; i < n; i++) {
                if (vessels.get(i).getMainFuelType() == fuel) {
                    coverage.set(x[i], ONE);
                }
            }
        }

        if (query.getFixedFleetSize() != null || query.getMaxFleetSize() != null) {
            Expression size = model.newExpression("fleet_size");
            if (query.getFixedFleetSize() != null) {
                size.level(BigDecimal.valueOf(query.getFixedFleetSize()));
            } else {
                size.upper(BigDecimal.valueOf(query.getMaxFleetSize()));
            }
            for (int i = 0; i < n; i++) {
                size.set(x[i], ONE);
            }
        }

        if (query.getCostCeiling() != null) {
            Expression ceiling = model.newExpression("cost_ceiling")
                    .upper(BigDecimal.valueOf(query.getCostCeiling()));
            for (int i = 0; i < n; i++) {
                ceiling.set(x[i], BigDecimal.valueOf(vessels.get(i).getAdjustedCost()));
            }
        }

        Optimisation.Result result = model.minimise();
        Optimisation.State state = result.getState();
        Kind kind = classify(state);
        if (kind == Kind.SOLVED) {
            double[] values = new double[n];
            for (int i = 0; i < n; i++) {
                values[i] = result.get(i).doubleValue();
            }
            return new Solution(Kind.SOLVED, result.getValue(), values, state);
        }
        return new Solution(kind, Double.NaN, null, state);
    }

    /**
     * 只有 INFEASIBLE 可以剪枝 INVALID 说明模型本身有问题 按求解失败处理
     */
    static Kind classify(Optimisation.State state) {
        if (state == Optimisation.State.OPTIMAL || state == Optimisation.State.DISTINCT) {
            return Kind.SOLVED;
        }
        if (state == Optimisation.State.INFEASIBLE) {
            return Kind.INFEASIBLE;
        }
        return Kind.FAILED;
    }

    enum Kind {
        SOLVED,
        INFEASIBLE,
        FAILED
    }

    static final class Solution {
        final Kind kind;
        final double objective;
        final double[] values;
        final Optimisation.State state;

        Solution(Kind kind, double objective, double[] values, Optimisation.State state) {
            this.kind = kind;
            this.objective = objective;
            this.values = values;
            this.state = state;
        }
    }
}
