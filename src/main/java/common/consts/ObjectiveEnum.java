package common.consts;

/**
 * 优化目标
 */
public enum ObjectiveEnum {
    MIN_COST,     // 最小化总调整成本
    FEASIBILITY   // 只判断可行性 找到第一个可行船队即停止
}
