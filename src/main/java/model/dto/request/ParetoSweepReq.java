package model.dto.request;

import lombok.Data;

import java.util.List;

/**
 * 安全分阈值扫描 (帕累托前沿 / 边际成本共用)
 */
@Data
public class ParetoSweepReq {
    private ScenarioReq scenario;
    private List<Double> thresholds;
    private Integer fixedFleetSize; // 为空时船数不限
}
