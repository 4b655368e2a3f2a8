package model.bo;

import common.consts.ErrorCodes;
import common.consts.FuelTypeEnum;
import common.consts.ObjectiveEnum;
import common.exception.MalformedInputException;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 一次精确求解的完整约束描述 (不可变)
 * 分析层每个扫描点都构造一个独立的查询
 */
@Value
@Builder(toBuilder = true)
public class OptimizationQuery {
    String label;
    double cargoRequirementDwt;
    double safetyFloor;
    Set<FuelTypeEnum> requiredFuelTypes;
    Integer fixedFleetSize;   // Σx = N
    Integer maxFleetSize;     // Σx <= N 与 fixedFleetSize 同时给出时以后者为准
    Double costCeiling;       // Σcost·x <= C
    @Builder.Default
    ObjectiveEnum objective = ObjectiveEnum.MIN_COST;

    public static OptimizationQueryBuilder fromScenario(Scenario scenario) {
        return OptimizationQuery.builder()
                .label(scenario.getLabel())
                .cargoRequirementDwt(scenario.getCargoRequirementDwt())
                .safetyFloor(scenario.getSafetyFloor())
                .requiredFuelTypes(scenario.getRequiredFuelTypes());
    }

    public void validate() {
        List<String> problems = new ArrayList<>();
        if (!Double.isFinite(safetyFloor)) problems.add(ErrorCodes.INVALID_SAFETY_FLOOR);
        if (!Double.isFinite(cargoRequirementDwt) || cargoRequirementDwt <= 0) {
            problems.add(ErrorCodes.INVALID_CARGO_REQUIREMENT);
        }
        if (fixedFleetSize != null && fixedFleetSize <= 0) problems.add(ErrorCodes.INVALID_FLEET_SIZE);
        if (maxFleetSize != null && maxFleetSize <= 0) problems.add(ErrorCodes.INVALID_FLEET_SIZE);
        if (costCeiling != null && (!Double.isFinite(costCeiling) || costCeiling < 0)) {
            problems.add(ErrorCodes.INVALID_COST_CEILING);
        }
        if (!problems.isEmpty()) {
            throw new MalformedInputException(problems);
        }
    }
}
