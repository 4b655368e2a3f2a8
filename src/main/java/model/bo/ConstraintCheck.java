package model.bo;

import common.consts.FuelTypeEnum;
import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * 三项硬约束的校验结果
 */
@Value
@Builder
public class ConstraintCheck {
    boolean dwtMet;
    boolean safetyMet;
    boolean fuelCoverageMet;
    Set<FuelTypeEnum> missingFuelTypes;

    public boolean isAllMet() {
        return dwtMet && safetyMet && fuelCoverageMet;
    }
}
