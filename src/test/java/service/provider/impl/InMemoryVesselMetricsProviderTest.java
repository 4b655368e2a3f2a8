package service.provider.impl;

import common.consts.FailureReasonEnum;
import common.consts.FuelTypeEnum;
import common.exception.BusinessException;
import common.exception.MalformedInputException;
import model.bo.Scenario;
import model.bo.VesselFixtures;
import model.bo.VesselTable;
import model.entity.Vessel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("内存船舶指标提供者测试")
class InMemoryVesselMetricsProviderTest {

    private final InMemoryVesselMetricsProvider provider = new InMemoryVesselMetricsProvider();

    @Test
    @DisplayName("按场景碳价取对应的船舶表")
    void testLoadByCarbonPrice() {
        provider.register(80.0, VesselFixtures.syntheticVessels());
        provider.register(160.0, VesselFixtures.syntheticVessels().subList(0, 5));

        VesselTable base = provider.loadVessels(Scenario.builder().carbonPrice(80.0).build());
        VesselTable doubled = provider.loadVessels(Scenario.builder().carbonPrice(160.0).build());

        assertEquals(10, base.size());
        assertEquals(5, doubled.size());
        assertEquals(List.of(80.0, 160.0), new ArrayList<>(provider.availableCarbonPrices()));
    }

    @Test
    @DisplayName("未登记的碳价报 DATASET_NOT_FOUND")
    void testDatasetNotFound() {
        BusinessException e = assertThrows(BusinessException.class,
                () -> provider.loadVessels(Scenario.builder().carbonPrice(42.0).build()));
        assertEquals(FailureReasonEnum.DATASET_NOT_FOUND, e.getReason());
    }

    @Test
    @DisplayName("登记时校验 DWT 非正 成本为负 ID 重复 缺燃料类型")
    void testRejectsMalformedRows() {
        List<Vessel> rows = new ArrayList<>(VesselFixtures.syntheticVessels());
        rows.add(VesselFixtures.vessel("X1", VesselFixtures.FUEL_A, 0, 10, 3));
        rows.add(VesselFixtures.vessel("X2", VesselFixtures.FUEL_A, 10, -1, 3).toBuilder().co2Eq(null).build());
        rows.add(VesselFixtures.vessel("V01", VesselFixtures.FUEL_A, 10, 10, 3));
        rows.add(VesselFixtures.vessel("X3", null, 10, 10, 3));

        MalformedInputException e = assertThrows(MalformedInputException.class,
                () -> provider.register(80.0, rows));
        assertEquals(4, e.getProblems().size());
        assertEquals(FailureReasonEnum.MALFORMED_INPUT, e.getReason());
        assertTrue(provider.availableCarbonPrices().isEmpty(), "校验失败的数据不能登记");
    }

    @Test
    @DisplayName("空表报输入错误")
    void testEmptyTable() {
        assertThrows(MalformedInputException.class, () -> provider.register(80.0, List.of()));
    }

    @Test
    @DisplayName("船舶表按ID排序 并能按燃料类型分组")
    void testTableOrdering() {
        List<Vessel> rows = new ArrayList<>(VesselFixtures.syntheticVessels());
        Collections.reverse(rows);
        VesselTable table = provider.register(80.0, rows);

        assertEquals("V01", table.getVessels().get(0).getVesselId());
        assertEquals("V10", table.getVessels().get(9).getVesselId());
        assertEquals(5, table.byFuelType(VesselFixtures.FUEL_A).size());
        assertTrue(table.byFuelType(FuelTypeEnum.HYDROGEN).isEmpty());
        assertEquals(5.0, table.maxSafetyScore());
    }

    @Test
    @DisplayName("重置后所有数据清空")
    void testReset() {
        provider.register(80.0, VesselFixtures.syntheticVessels());
        provider.reset();
        assertTrue(provider.availableCarbonPrices().isEmpty());
    }
}
