package controller;

import common.Result;
import common.consts.ErrorCodes;
import common.exception.MalformedInputException;
import model.bo.Scenario;
import model.dto.request.ClaimCheckReq;
import model.dto.request.DominationReq;
import model.dto.request.FleetSizeSweepReq;
import model.dto.request.ParetoSweepReq;
import model.dto.request.ScenarioReq;
import model.dto.request.SensitivityReq;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import service.analytics.ScenarioAnalyticsService;
import service.selection.FleetSelectionService;

import java.util.ArrayList;
import java.util.List;

/**
 * 场景分析接口
 */
@RestController
@RequestMapping("/analytics")
public class AnalyticsController {

    private final ScenarioAnalyticsService analyticsService;
    private final FleetSelectionService fleetSelectionService;

    public AnalyticsController(ScenarioAnalyticsService analyticsService,
                               FleetSelectionService fleetSelectionService) {
        this.analyticsService = analyticsService;
        this.fleetSelectionService = fleetSelectionService;
    }

    @PostMapping("/fleet-size-sweep")
    public Result fleetSizeSweep(@RequestBody FleetSizeSweepReq req) {
        if (req.getMinSize() == null || req.getMaxSize() == null) {
            throw new MalformedInputException(ErrorCodes.INVALID_FLEET_SIZE);
        }
        Scenario scenario = fleetSelectionService.resolveScenario(req.getScenario());
        return Result.success(analyticsService.fleetSizeSweep(
                fleetSelectionService.loadTable(scenario), scenario, req.getMinSize(), req.getMaxSize()));
    }

    @PostMapping("/pareto")
    public Result pareto(@RequestBody ParetoSweepReq req) {
        Scenario scenario = fleetSelectionService.resolveScenario(req.getScenario());
        return Result.success(analyticsService.paretoFrontier(
                fleetSelectionService.loadTable(scenario), scenario, req.getThresholds(), req.getFixedFleetSize()));
    }

    @PostMapping("/marginal-cost")
    public Result marginalCost(@RequestBody ParetoSweepReq req) {
        Scenario scenario = fleetSelectionService.resolveScenario(req.getScenario());
        return Result.success(analyticsService.marginalCost(
                fleetSelectionService.loadTable(scenario), scenario, req.getThresholds(), req.getFixedFleetSize()));
    }

    @PostMapping("/domination")
    public Result domination(@RequestBody(required = false) DominationReq req) {
        DominationReq body = req == null ? new DominationReq() : req;
        Scenario scenario = fleetSelectionService.resolveScenario(body.getScenario());
        return Result.success(analyticsService.dominationSearch(
                fleetSelectionService.loadTable(scenario), scenario, body.getBaselineVesselIds(), body.getStep()));
    }

    @PostMapping("/claim-check")
    public Result claimCheck(@RequestBody ClaimCheckReq req) {
        if (req.getFleetSize() == null || req.getSafetyFloor() == null || req.getCostCeiling() == null) {
            throw new MalformedInputException("声明必须包含船数、安全分下限和成本上限");
        }
        Scenario scenario = fleetSelectionService.resolveScenario(req.getScenario());
        return Result.success(analyticsService.checkClaim(fleetSelectionService.loadTable(scenario), scenario,
                req.getFleetSize(), req.getSafetyFloor(), req.getCostCeiling()));
    }

    @PostMapping("/sensitivity")
    public Result sensitivity(@RequestBody SensitivityReq req) {
        if (req.getScenarios() == null || req.getScenarios().isEmpty()) {
            throw new MalformedInputException(ErrorCodes.SCENARIO_REQUIRED);
        }
        List<Scenario> scenarios = new ArrayList<>();
        for (ScenarioReq s : req.getScenarios()) {
            scenarios.add(fleetSelectionService.resolveScenario(s));
        }
        return Result.success(analyticsService.sensitivity(scenarios));
    }
}
