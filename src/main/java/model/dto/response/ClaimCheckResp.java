package model.dto.response;

import lombok.Data;

/**
 * 第三方声明核验结果
 * 声明: 船数 = N, 平均安全分 >= S, 总成本 <= C
 */
@Data
public class ClaimCheckResp {
    private int claimedFleetSize;
    private double claimedSafetyFloor;
    private double claimedCostCeiling;
    private boolean feasible;
    private AnalyticsRow claim;                 // 三个约束同时施加的可行性查询
    private AnalyticsRow minCostAtSizeAndSafety;// 去掉成本上限后的最小成本
    private AnalyticsRow minCostAtSafety;       // 只保留安全分约束 船数不限
    private Double gap;                         // 最小可达成本 - 声明成本上限 可行时为空
    private Double gapPct;
    private String verdict;
}
