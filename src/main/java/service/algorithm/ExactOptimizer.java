package service.algorithm;

import model.bo.OptimizationQuery;
import model.bo.SolveResult;
import model.bo.VesselTable;

/**
 * 精确求解接口 分析层的所有查询都通过它完成
 * 每次调用独立且无状态
 */
public interface ExactOptimizer {

    SolveResult solve(VesselTable table, OptimizationQuery query);
}
