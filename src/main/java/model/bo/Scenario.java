package model.bo;

import common.consts.FuelTypeEnum;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * 选船场景 (不可变)
 * 由调用方创建并整体传入 核心计算从不修改
 */
@Value
@Builder(toBuilder = true)
public class Scenario {

    public static final double DEFAULT_SAFETY_FLOOR = 3.0;
    public static final double MONTHLY_CARGO_REQUIREMENT_DWT = 54.92e6 / 12;
    public static final double DEFAULT_CARBON_PRICE = 80.0;

    @Builder.Default
    String label = "base";

    @Builder.Default
    double safetyFloor = DEFAULT_SAFETY_FLOOR;

    @Builder.Default
    double cargoRequirementDwt = MONTHLY_CARGO_REQUIREMENT_DWT;

    @Builder.Default
    Set<FuelTypeEnum> requiredFuelTypes = allFuelTypes();

    // 只影响上游提供的 adjustedCost 核心内不重新计算
    @Builder.Default
    double carbonPrice = DEFAULT_CARBON_PRICE;

    /**
     * 按枚举顺序返回只读副本 调用方传入的可变集合不会被共享
     */
    public Set<FuelTypeEnum> getRequiredFuelTypes() {
        if (requiredFuelTypes == null || requiredFuelTypes.isEmpty()) {
            return Collections.emptySet();
        }
        return Collections.unmodifiableSet(EnumSet.copyOf(requiredFuelTypes));
    }

    public static Set<FuelTypeEnum> allFuelTypes() {
        return Collections.unmodifiableSet(EnumSet.allOf(FuelTypeEnum.class));
    }

    public static Set<FuelTypeEnum> fuelTypes(FuelTypeEnum first, FuelTypeEnum... rest) {
        return Collections.unmodifiableSet(EnumSet.of(first, rest));
    }
}
