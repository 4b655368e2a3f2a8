package model.dto.response;

import common.consts.SolveStatusEnum;
import lombok.Data;
import model.bo.SolveResult;

import java.util.ArrayList;
import java.util.List;

/**
 * 分析报表的一行: (参数, 是否可行, 成本, 安全分, 船数, DWT)
 */
@Data
public class AnalyticsRow {
    private String parameter;       // 扫描参数名 如 fleetSize / safetyThreshold
    private Double value;           // 参数取值
    private boolean feasible;
    private SolveStatusEnum status;
    private Double cost;            // 不可行时为空
    private Double avgSafety;
    private Integer fleetSize;
    private Double totalDwt;
    private List<String> vesselIds; // 入选船舶 按ID排序
    private String message;

    public static AnalyticsRow of(String parameter, Double value, SolveResult result) {
        AnalyticsRow row = new AnalyticsRow();
        row.setParameter(parameter);
        row.setValue(value);
        row.setStatus(result.getStatus());
        row.setFeasible(result.hasFleet());
        row.setMessage(result.getMessage());
        if (result.hasFleet()) {
            row.setCost(result.getMetrics().getTotalCost());
            row.setAvgSafety(result.getMetrics().getAvgSafety());
            row.setFleetSize(result.getMetrics().getFleetSize());
            row.setTotalDwt(result.getMetrics().getTotalDwt());
            row.setVesselIds(new ArrayList<>(result.getFleet().getVesselIds()));
        }
        return row;
    }
}
