package model.bo;

import common.consts.FuelTypeEnum;
import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * 船队实现指标 (对应提交模板的各项汇总)
 */
@Value
@Builder
public class FleetMetrics {
    int fleetSize;
    double totalDwt;
    double avgSafety;        // 不加权的算术平均
    double totalCost;
    Set<FuelTypeEnum> fuelTypes;
    int uniqueFuelTypeCount;
    double totalCo2Eq;
    double totalFuel;
}
