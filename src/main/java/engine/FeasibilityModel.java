package engine;

import common.consts.ErrorCodes;
import common.consts.FuelTypeEnum;
import common.exception.MalformedInputException;
import model.bo.ConstraintCheck;
import model.bo.Fleet;
import model.bo.FleetMetrics;
import model.bo.OptimizationQuery;
import model.bo.Scenario;
import model.bo.VesselTable;
import model.entity.Vessel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * 可行性模型: 候选船队上的纯指标与判定函数
 * 贪心、精确求解和分析层共用
 */
public final class FeasibilityModel {

    public static final double DEFAULT_SAFETY_TOLERANCE = 1e-9;

    private FeasibilityModel() {
    }

    public static double totalDwt(Fleet fleet, VesselTable table) {
        double sum = 0.0;
        for (Vessel v : resolve(fleet, table)) {
            sum += v.getDwt();
        }
        return sum;
    }

    /**
     * 平均安全分 (不按 DWT 加权) 空船队记 0
     */
    public static double avgSafety(Fleet fleet, VesselTable table) {
        List<Vessel> vessels = resolve(fleet, table);
        if (vessels.isEmpty()) return 0.0;
        double sum = 0.0;
        for (Vessel v : vessels) {
            sum += v.getSafetyScore();
        }
        return sum / vessels.size();
    }

    public static Set<FuelTypeEnum> fuelCoverage(Fleet fleet, VesselTable table) {
        Set<FuelTypeEnum> covered = EnumSet.noneOf(FuelTypeEnum.class);
        for (Vessel v : resolve(fleet, table)) {
            covered.add(v.getMainFuelType());
        }
        return covered;
    }

    public static double totalCost(Fleet fleet, VesselTable table) {
        double sum = 0.0;
        for (Vessel v : resolve(fleet, table)) {
            sum += v.getAdjustedCost();
        }
        return sum;
    }

    /**
     * 一次遍历算出全部实现指标
     */
    public static FleetMetrics metrics(Fleet fleet, VesselTable table) {
        List<Vessel> vessels = resolve(fleet, table);
        double dwt = 0.0;
        double safety = 0.0;
        double cost = 0.0;
        double co2 = 0.0;
        double fuel = 0.0;
        Set<FuelTypeEnum> fuelTypes = EnumSet.noneOf(FuelTypeEnum.class);
        for (Vessel v : vessels) {
            dwt += v.getDwt();
            safety += v.getSafetyScore();
            cost += v.getAdjustedCost();
            co2 += v.getCo2EqOrZero();
            fuel += v.getFuelTotalOrZero();
            fuelTypes.add(v.getMainFuelType());
        }
        return FleetMetrics.builder()
                .fleetSize(vessels.size())
                .totalDwt(dwt)
                .avgSafety(vessels.isEmpty() ? 0.0 : safety / vessels.size())
                .totalCost(cost)
                .fuelTypes(Collections.unmodifiableSet(fuelTypes))
                .uniqueFuelTypeCount(fuelTypes.size())
                .totalCo2Eq(co2)
                .totalFuel(fuel)
                .build();
    }

    public static ConstraintCheck check(FleetMetrics metrics, Scenario scenario, double safetyTolerance) {
        return check(metrics, scenario.getCargoRequirementDwt(), scenario.getSafetyFloor(),
                scenario.getRequiredFuelTypes(), safetyTolerance);
    }

    public static ConstraintCheck check(FleetMetrics metrics,
                                        double cargoRequirementDwt,
                                        double safetyFloor,
                                        Set<FuelTypeEnum> requiredFuelTypes,
                                        double safetyTolerance) {
        Set<FuelTypeEnum> missing = EnumSet.noneOf(FuelTypeEnum.class);
        for (FuelTypeEnum fuel : requiredFuelTypes) {
            if (!metrics.getFuelTypes().contains(fuel)) {
                missing.add(fuel);
            }
        }
        return ConstraintCheck.builder()
                .dwtMet(metrics.getTotalDwt() >= cargoRequirementDwt)
                .safetyMet(metrics.getFleetSize() > 0 && metrics.getAvgSafety() >= safetyFloor - safetyTolerance)
                .fuelCoverageMet(missing.isEmpty())
                .missingFuelTypes(Collections.unmodifiableSet(missing))
                .build();
    }

    public static boolean isFeasible(Fleet fleet, VesselTable table, Scenario scenario) {
        return check(metrics(fleet, table), scenario, DEFAULT_SAFETY_TOLERANCE).isAllMet();
    }

    /**
     * 在三项硬约束之外 还校验查询里的规模与成本上限
     */
    public static boolean satisfies(FleetMetrics metrics, OptimizationQuery query, double safetyTolerance) {
        ConstraintCheck hard = check(metrics, query.getCargoRequirementDwt(), query.getSafetyFloor(),
                query.getRequiredFuelTypes(), safetyTolerance);
        if (!hard.isAllMet()) return false;
        if (query.getFixedFleetSize() != null) {
            if (metrics.getFleetSize() != query.getFixedFleetSize()) return false;
        } else if (query.getMaxFleetSize() != null && metrics.getFleetSize() > query.getMaxFleetSize()) {
            return false;
        }
        return query.getCostCeiling() == null
                || metrics.getTotalCost() <= query.getCostCeiling() + costEpsilon(query.getCostCeiling());
    }

    /**
     * 成本比较的相对容差
     */
    public static double costEpsilon(double reference) {
        return 1e-9 * Math.max(1.0, Math.abs(reference));
    }

    private static List<Vessel> resolve(Fleet fleet, VesselTable table) {
        List<Vessel> vessels = new ArrayList<>(fleet.size());
        for (String id : fleet.getVesselIds()) {
            Vessel v = table.get(id);
            if (v == null) {
                throw new MalformedInputException(String.format(ErrorCodes.VESSEL_NOT_IN_TABLE, id));
            }
            vessels.add(v);
        }
        return vessels;
    }
}
