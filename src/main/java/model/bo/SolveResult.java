package model.bo;

import common.consts.SolveStatusEnum;
import lombok.Builder;
import lombok.Value;

/**
 * 精确求解结果
 */
@Value
@Builder
public class SolveResult {
    String label;
    SolveStatusEnum status;
    Fleet fleet;
    FleetMetrics metrics;
    Double objectiveValue;
    OptimalityCertificate certificate;
    String message;

    public boolean hasFleet() {
        return fleet != null && (status == SolveStatusEnum.OPTIMAL || status == SolveStatusEnum.FEASIBLE);
    }
}
