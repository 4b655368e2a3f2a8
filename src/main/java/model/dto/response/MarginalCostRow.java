package model.dto.response;

import lombok.Data;

/**
 * 帕累托前沿相邻两点之间的边际成本
 */
@Data
public class MarginalCostRow {
    private double fromThreshold;
    private double toThreshold;
    private double fromCost;
    private double toCost;
    private double deltaCost;
    private double deltaThreshold;
    private double marginalCost;   // deltaCost / deltaThreshold 每单位安全分的追加成本
}
