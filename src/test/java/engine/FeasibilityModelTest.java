package engine;

import common.consts.FuelTypeEnum;
import common.exception.MalformedInputException;
import model.bo.ConstraintCheck;
import model.bo.Fleet;
import model.bo.FleetMetrics;
import model.bo.OptimizationQuery;
import model.bo.Scenario;
import model.bo.VesselFixtures;
import model.bo.VesselTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("可行性模型测试")
class FeasibilityModelTest {

    private final VesselTable table = VesselFixtures.syntheticTable();
    private final Scenario scenario = VesselFixtures.syntheticScenario();

    @Test
    @DisplayName("指标计算: DWT 求和 安全分不加权平均 燃料覆盖 成本求和")
    void testMetrics() {
        // V01(20, 3) + V04(20, 5) + V06(15, 3)
        Fleet fleet = Fleet.of(List.of("V01", "V04", "V06"));
        FleetMetrics metrics = FeasibilityModel.metrics(fleet, table);

        assertEquals(3, metrics.getFleetSize());
        assertEquals(55.0, metrics.getTotalDwt(), 1e-9);
        assertEquals(11.0 / 3, metrics.getAvgSafety(), 1e-9, "安全分应为算术平均 不按DWT加权");
        assertEquals(71.0, metrics.getTotalCost(), 1e-9);
        assertEquals(2, metrics.getUniqueFuelTypeCount());
        assertTrue(metrics.getFuelTypes().contains(FuelTypeEnum.DISTILLATE_FUEL));
        assertTrue(metrics.getFuelTypes().contains(FuelTypeEnum.LNG));
        assertEquals(7.1, metrics.getTotalCo2Eq(), 1e-9);

        assertEquals(metrics.getTotalDwt(), FeasibilityModel.totalDwt(fleet, table), 1e-9);
        assertEquals(metrics.getAvgSafety(), FeasibilityModel.avgSafety(fleet, table), 1e-9);
        assertEquals(metrics.getTotalCost(), FeasibilityModel.totalCost(fleet, table), 1e-9);
        assertEquals(metrics.getFuelTypes(), FeasibilityModel.fuelCoverage(fleet, table));
    }

    @Test
    @DisplayName("三项约束都满足时判定可行")
    void testFeasibleFleet() {
        // DWT 20*3 + 15*3 = 105, 安全分 (3+4+5+3+4+5)/6 = 4
        Fleet fleet = Fleet.of(List.of("V01", "V02", "V04", "V06", "V08", "V10"));
        assertTrue(FeasibilityModel.isFeasible(fleet, table, scenario));
    }

    @Test
    @DisplayName("任一约束不满足都判定不可行")
    void testRejectsEachViolation() {
        // DWT 不足: 20 + 15 = 35
        ConstraintCheck lowDwt = FeasibilityModel.check(
                FeasibilityModel.metrics(Fleet.of(List.of("V01", "V06")), table), scenario, 1e-9);
        assertFalse(lowDwt.isDwtMet());
        assertTrue(lowDwt.isSafetyMet());
        assertFalse(lowDwt.isAllMet());

        // 缺少 B 类燃料: 5 艘 A 类 DWT 100
        ConstraintCheck noFuelB = FeasibilityModel.check(
                FeasibilityModel.metrics(Fleet.of(List.of("V01", "V02", "V03", "V04", "V05")), table), scenario, 1e-9);
        assertTrue(noFuelB.isDwtMet());
        assertFalse(noFuelB.isFuelCoverageMet());
        assertEquals(1, noFuelB.getMissingFuelTypes().size());
        assertTrue(noFuelB.getMissingFuelTypes().contains(FuelTypeEnum.LNG));

        // 安全分不足: (2+2+3+3+2+3)/6 < 3
        ConstraintCheck lowSafety = FeasibilityModel.check(FeasibilityModel.metrics(
                Fleet.of(List.of("V01", "V03", "V05", "V06", "V07", "V09")), table), scenario, 1e-9);
        assertTrue(lowSafety.isDwtMet());
        assertTrue(lowSafety.isFuelCoverageMet());
        assertFalse(lowSafety.isSafetyMet());
        assertFalse(lowSafety.isAllMet());
    }

    @Test
    @DisplayName("安全分恰好等于下限视为满足")
    void testSafetyBoundaryInclusive() {
        // 贪心结果 {V01, V02, V03, V06, V07, V08} 安全分恰好为 3.0
        Fleet fleet = Fleet.of(List.of("V01", "V02", "V03", "V06", "V07", "V08"));
        assertEquals(3.0, FeasibilityModel.avgSafety(fleet, table), 1e-12);
        assertTrue(FeasibilityModel.isFeasible(fleet, table, scenario));
    }

    @Test
    @DisplayName("空船队不满足安全分约束")
    void testEmptyFleet() {
        FleetMetrics metrics = FeasibilityModel.metrics(Fleet.of(List.of()), table);
        assertEquals(0, metrics.getFleetSize());
        assertEquals(0.0, metrics.getAvgSafety());
        ConstraintCheck check = FeasibilityModel.check(metrics, scenario.toBuilder().safetyFloor(-1).build(), 1e-9);
        assertFalse(check.isSafetyMet());
    }

    @Test
    @DisplayName("船队引用不存在的船舶时报输入错误")
    void testUnknownVessel() {
        Fleet fleet = Fleet.of(List.of("V01", "NOPE"));
        assertThrows(MalformedInputException.class, () -> FeasibilityModel.metrics(fleet, table));
    }

    @Test
    @DisplayName("查询附加约束: 固定船数 / 最大船数 / 成本上限")
    void testQueryConstraints() {
        Fleet fleet = Fleet.of(List.of("V01", "V02", "V04", "V06", "V08", "V10"));
        FleetMetrics metrics = FeasibilityModel.metrics(fleet, table);
        OptimizationQuery base = OptimizationQuery.fromScenario(scenario).build();

        assertTrue(FeasibilityModel.satisfies(metrics, base, 1e-9));
        assertTrue(FeasibilityModel.satisfies(metrics, base.toBuilder().fixedFleetSize(6).build(), 1e-9));
        assertFalse(FeasibilityModel.satisfies(metrics, base.toBuilder().fixedFleetSize(7).build(), 1e-9));
        assertFalse(FeasibilityModel.satisfies(metrics, base.toBuilder().maxFleetSize(5).build(), 1e-9));
        // 成本 20+24+36+15+24+33 = 152
        assertTrue(FeasibilityModel.satisfies(metrics, base.toBuilder().costCeiling(152.0).build(), 1e-9));
        assertFalse(FeasibilityModel.satisfies(metrics, base.toBuilder().costCeiling(151.0).build(), 1e-9));
    }
}
