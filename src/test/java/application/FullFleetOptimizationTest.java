package application;

import com.fasterxml.jackson.databind.ObjectMapper;
import common.consts.FailureReasonEnum;
import common.consts.FuelTypeEnum;
import common.consts.SelectionOutcomeEnum;
import common.exception.MalformedInputException;
import model.bo.FleetSelection;
import model.bo.Scenario;
import model.bo.VesselFixtures;
import model.dto.request.ClaimCheckReq;
import model.dto.request.ScenarioReq;
import model.dto.request.VesselTableLoadReq;
import model.dto.response.ComparisonResp;
import model.entity.Vessel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import service.algorithm.impl.SelectionAuditLog;
import service.provider.VesselMetricsProvider;
import service.selection.FleetSelectionService;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * 完整选船流程测试
 * 提供者 -> 选船算法 -> 分析 -> 接口 -> 审计
 */
@SpringBootTest(classes = FleetOptApplication.class)
@AutoConfigureMockMvc
@DisplayName("完整选船流程测试")
@Timeout(120)
class FullFleetOptimizationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private VesselMetricsProvider vesselMetricsProvider;

    @Autowired
    private FleetSelectionService fleetSelectionService;

    @Autowired
    private SelectionAuditLog auditLog;

    @BeforeEach
    void setUp() {
        vesselMetricsProvider.reset();
        auditLog.clear();
        vesselMetricsProvider.register(80.0, VesselFixtures.syntheticVessels());
    }

    private static ScenarioReq syntheticReq() {
        ScenarioReq req = new ScenarioReq();
        req.setLabel("synthetic");
        req.setCargoRequirementDwt(100.0);
        req.setSafetyFloor(3.0);
        req.setRequiredFuelTypes(List.of(FuelTypeEnum.DISTILLATE_FUEL, FuelTypeEnum.LNG));
        req.setCarbonPrice(80.0);
        return req;
    }

    /**
     * 测试1: 服务层贪心与精确对比
     */
    @Test
    @DisplayName("服务层: 贪心与精确求解都满足约束 精确成本不高于贪心")
    void testCompareThroughService() {
        ComparisonResp resp = fleetSelectionService.compare(syntheticReq());

        assertEquals(SelectionOutcomeEnum.SATISFIED, resp.getGreedy().getOutcome());
        assertEquals(SelectionOutcomeEnum.SATISFIED, resp.getExact().getOutcome());
        assertTrue(resp.getSavings() >= -1e-9);
        assertTrue(auditLog.listAll().isEmpty(), "满足约束的结果不写审计");
    }

    @Test
    @DisplayName("服务层: 省略的场景字段取配置缺省值")
    void testScenarioDefaults() {
        ScenarioReq req = new ScenarioReq();
        req.setSafetyFloor(3.5);

        Scenario scenario = fleetSelectionService.resolveScenario(req);

        assertEquals(3.5, scenario.getSafetyFloor());
        assertEquals(54.92e6 / 12, scenario.getCargoRequirementDwt(), 1e-6);
        assertEquals(80.0, scenario.getCarbonPrice());
        assertEquals(8, scenario.getRequiredFuelTypes().size());
    }

    /**
     * 测试2: 约束未满足经接口返回带标签的失败 并写入审计
     */
    @Test
    @DisplayName("接口: 贪心约束未满足返回 422 并写入审计日志")
    void testConstraintUnsatisfiedThroughRest() throws Exception {
        ScenarioReq req = syntheticReq();
        req.setSafetyFloor(3.5);

        mockMvc.perform(post("/fleet/select/greedy")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(req)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(422))
                .andExpect(jsonPath("$.reason").value("CONSTRAINT_UNSATISFIED"))
                .andExpect(jsonPath("$.data.fleet.vesselIds.length()").value(6));

        mockMvc.perform(post("/fleet/select/exact")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(req)))
                .andExpect(jsonPath("$.code").value(200))
                .andExpect(jsonPath("$.data.outcome").value("SATISFIED"))
                .andExpect(jsonPath("$.data.certificate.exhausted").value(true));

        List<SelectionAuditLog.AuditEntry> entries = auditLog.listSince(null, FailureReasonEnum.CONSTRAINT_UNSATISFIED);
        assertEquals(1, entries.size());
        assertEquals("greedy", entries.get(0).getAlgorithm());

        mockMvc.perform(get("/fleet/audit/all"))
                .andExpect(jsonPath("$.data.length()").value(1))
                .andExpect(jsonPath("$.data[0].reason").value("CONSTRAINT_UNSATISFIED"));
    }

    @Test
    @DisplayName("接口: 未登记碳价返回 DATASET_NOT_FOUND")
    void testDatasetNotFoundThroughRest() throws Exception {
        ScenarioReq req = syntheticReq();
        req.setCarbonPrice(999.0);

        mockMvc.perform(post("/fleet/select/exact")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(req)))
                .andExpect(jsonPath("$.code").value(404))
                .andExpect(jsonPath("$.reason").value("DATASET_NOT_FOUND"));
        assertEquals(1, auditLog.listSince(null, FailureReasonEnum.DATASET_NOT_FOUND).size());
    }

    @Test
    @DisplayName("接口: 登记不合法的船舶数据返回问题列表")
    void testMalformedLoadThroughRest() throws Exception {
        List<Vessel> rows = new ArrayList<>(VesselFixtures.syntheticVessels());
        rows.add(VesselFixtures.vessel("BAD", FuelTypeEnum.LNG, -5, 10, 3).toBuilder().fuelTotal(null).build());
        VesselTableLoadReq load = new VesselTableLoadReq();
        load.setCarbonPrice(120.0);
        load.setVessels(rows);

        mockMvc.perform(post("/vessels/load")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(load)))
                .andExpect(jsonPath("$.code").value(400))
                .andExpect(jsonPath("$.reason").value("MALFORMED_INPUT"))
                .andExpect(jsonPath("$.data.length()").value(1));

        mockMvc.perform(get("/vessels/carbon-prices"))
                .andExpect(jsonPath("$.data.length()").value(1));
    }

    @Test
    @DisplayName("接口: 登记船舶数据后可按碳价查询 燃料类型按展示名解析")
    void testLoadThroughRest() throws Exception {
        String body = "{\"carbonPrice\": 160, \"vessels\": ["
                + "{\"vesselId\": \"A1\", \"dwt\": 50, \"mainFuelType\": \"DISTILLATE FUEL\","
                + " \"safetyScore\": 4, \"adjustedCost\": 100},"
                + "{\"vesselId\": \"B1\", \"dwt\": 60, \"mainFuelType\": \"LNG\","
                + " \"safetyScore\": 3, \"adjustedCost\": 90}]}";

        mockMvc.perform(post("/vessels/load").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(jsonPath("$.code").value(200))
                .andExpect(jsonPath("$.data.vesselCount").value(2));

        mockMvc.perform(get("/vessels").param("carbonPrice", "160"))
                .andExpect(jsonPath("$.data.length()").value(2))
                .andExpect(jsonPath("$.data[0].mainFuelType").value("DISTILLATE_FUEL"));
    }

    /**
     * 测试3: 分析接口
     */
    @Test
    @DisplayName("接口: 声明核验与帕累托扫描")
    void testAnalyticsThroughRest() throws Exception {
        ClaimCheckReq claim = new ClaimCheckReq();
        claim.setScenario(syntheticReq());
        claim.setFleetSize(3);
        claim.setSafetyFloor(3.0);
        claim.setCostCeiling(50.0);

        mockMvc.perform(post("/analytics/claim-check")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(claim)))
                .andExpect(jsonPath("$.code").value(200))
                .andExpect(jsonPath("$.data.feasible").value(false));

        String pareto = "{\"scenario\": " + objectMapper.writeValueAsString(syntheticReq())
                + ", \"thresholds\": [3.0, 4.0, 5.0]}";
        mockMvc.perform(post("/analytics/pareto").contentType(MediaType.APPLICATION_JSON).content(pareto))
                .andExpect(jsonPath("$.data.length()").value(3))
                .andExpect(jsonPath("$.data[0].feasible").value(true))
                .andExpect(jsonPath("$.data[2].feasible").value(false));
    }

    @Test
    @DisplayName("服务层: 未知算法名报输入错误")
    void testUnknownAlgorithm() {
        assertThrows(MalformedInputException.class,
                () -> fleetSelectionService.select("simulated-annealing", syntheticReq()));
        FleetSelection greedy = fleetSelectionService.select("greedy", syntheticReq());
        assertTrue(greedy.isSatisfied());
    }
}
