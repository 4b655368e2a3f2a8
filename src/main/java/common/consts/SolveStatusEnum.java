package common.consts;

/**
 * 精确求解器返回状态
 */
public enum SolveStatusEnum {
    OPTIMAL,     // 证明最优
    FEASIBLE,    // 仅可行性查询 找到一个可行船队
    INFEASIBLE,  // 约束系统无整数解 属于正常结果
    ERROR        // LP 求解失败 搜索不完整
}
