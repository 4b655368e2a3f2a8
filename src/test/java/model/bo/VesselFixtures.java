package model.bo;

import common.consts.FuelTypeEnum;
import engine.FeasibilityModel;
import model.entity.Vessel;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * 测试用船舶表
 */
public final class VesselFixtures {

    public static final FuelTypeEnum FUEL_A = FuelTypeEnum.DISTILLATE_FUEL;
    public static final FuelTypeEnum FUEL_B = FuelTypeEnum.LNG;

    private VesselFixtures() {
    }

    public static Vessel vessel(String id, FuelTypeEnum fuel, double dwt, double cost, double safety) {
        return Vessel.builder()
                .vesselId(id)
                .mainFuelType(fuel)
                .dwt(dwt)
                .adjustedCost(cost)
                .safetyScore(safety)
                .co2Eq(cost / 10)
                .fuelTotal(dwt / 10)
                .build();
    }

    /**
     * 10 艘船 A 类燃料 V01~V05 (DWT 20) B 类燃料 V06~V10 (DWT 15)
     * V01 / V06 分别是本类单位DWT成本最低的船
     */
    public static List<Vessel> syntheticVessels() {
        List<Vessel> vessels = new ArrayList<>();
        vessels.add(vessel("V01", FUEL_A, 20, 20, 3));
        vessels.add(vessel("V02", FUEL_A, 20, 24, 4));
        vessels.add(vessel("V03", FUEL_A, 20, 30, 2));
        vessels.add(vessel("V04", FUEL_A, 20, 36, 5));
        vessels.add(vessel("V05", FUEL_A, 20, 40, 3));
        vessels.add(vessel("V06", FUEL_B, 15, 15, 3));
        vessels.add(vessel("V07", FUEL_B, 15, 21, 2));
        vessels.add(vessel("V08", FUEL_B, 15, 24, 4));
        vessels.add(vessel("V09", FUEL_B, 15, 27, 3));
        vessels.add(vessel("V10", FUEL_B, 15, 33, 5));
        return vessels;
    }

    public static VesselTable syntheticTable() {
        return VesselTable.of(syntheticVessels());
    }

    public static Scenario syntheticScenario() {
        return Scenario.builder()
                .label("synthetic")
                .cargoRequirementDwt(100)
                .safetyFloor(3.0)
                .requiredFuelTypes(Scenario.fuelTypes(FUEL_A, FUEL_B))
                .build();
    }

    /**
     * 贪心选 {G1, G2, G3} (成本 31 安全分 3.0)
     * saferAlternative=true 时 G4 与 G3 单位成本相同但安全分为 5 {G1, G2, G4} 支配贪心结果
     */
    public static VesselTable dominationTable(boolean saferAlternative) {
        List<Vessel> vessels = new ArrayList<>();
        vessels.add(vessel("G1", FUEL_A, 10, 10, 3));
        vessels.add(vessel("G2", FUEL_B, 10, 10, 3));
        vessels.add(vessel("G3", FUEL_A, 10, 11, 3));
        vessels.add(vessel("G4", FUEL_B, 10, 11, saferAlternative ? 5 : 3));
        return VesselTable.of(vessels);
    }

    public static Scenario dominationScenario() {
        return Scenario.builder()
                .label("domination")
                .cargoRequirementDwt(30)
                .safetyFloor(3.0)
                .requiredFuelTypes(Scenario.fuelTypes(FUEL_A, FUEL_B))
                .build();
    }

    /**
     * 随机小表 成本与DWT取整数 三种燃料类型都有船
     */
    public static VesselTable randomTable(Random random, int size) {
        FuelTypeEnum[] fuels = {FuelTypeEnum.DISTILLATE_FUEL, FuelTypeEnum.LNG, FuelTypeEnum.METHANOL};
        List<Vessel> vessels = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            FuelTypeEnum fuel = fuels[i % fuels.length];
            double dwt = 5 + random.nextInt(26);
            double cost = 10 + random.nextInt(91);
            double safety = 1 + random.nextInt(9) * 0.5;
            vessels.add(vessel(String.format("R%02d", i), fuel, dwt, cost, safety));
        }
        return VesselTable.of(vessels);
    }

    /**
     * 穷举全部子集 返回满足查询的最小成本 不可行时返回 null
     */
    public static Double bruteForceMinCost(VesselTable table, OptimizationQuery query) {
        List<Vessel> vessels = table.getVessels();
        int n = vessels.size();
        Double best = null;
        for (int mask = 1; mask < (1 << n); mask++) {
            List<String> ids = new ArrayList<>();
            for (int i = 0; i < n; i++) {
                if ((mask & (1 << i)) != 0) ids.add(vessels.get(i).getVesselId());
            }
            FleetMetrics metrics = FeasibilityModel.metrics(Fleet.of(ids), table);
            if (FeasibilityModel.satisfies(metrics, query, FeasibilityModel.DEFAULT_SAFETY_TOLERANCE)
                    && (best == null || metrics.getTotalCost() < best)) {
                best = metrics.getTotalCost();
            }
        }
        return best;
    }
}
