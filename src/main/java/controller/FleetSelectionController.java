package controller;

import common.Result;
import model.bo.FleetSelection;
import model.dto.request.ScenarioReq;
import model.dto.response.ComparisonResp;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import service.algorithm.impl.ExactFleetOptimizer;
import service.algorithm.impl.GreedyFleetSelector;
import service.selection.FleetSelectionService;

/**
 * 选船接口
 * 不可行 / 约束未满足 以带标签的失败返回 同时附带船队供参考
 */
@RestController
@RequestMapping("/fleet")
public class FleetSelectionController {

    private final FleetSelectionService fleetSelectionService;

    public FleetSelectionController(FleetSelectionService fleetSelectionService) {
        this.fleetSelectionService = fleetSelectionService;
    }

    // POST /fleet/select/greedy
    @PostMapping("/select/greedy")
    public Result selectGreedy(@RequestBody(required = false) ScenarioReq req) {
        return toResult(fleetSelectionService.select(GreedyFleetSelector.NAME, req));
    }

    // POST /fleet/select/exact
    @PostMapping("/select/exact")
    public Result selectExact(@RequestBody(required = false) ScenarioReq req) {
        return toResult(fleetSelectionService.select(ExactFleetOptimizer.NAME, req));
    }

    // POST /fleet/compare
    @PostMapping("/compare")
    public Result compare(@RequestBody(required = false) ScenarioReq req) {
        ComparisonResp resp = fleetSelectionService.compare(req);
        return Result.success("对比完成", resp);
    }

    @GetMapping("/algorithms")
    public Result algorithms() {
        return Result.success(fleetSelectionService.algorithmNames());
    }

    private static Result toResult(FleetSelection selection) {
        if (selection.isSatisfied()) {
            return Result.success("选船完成", selection);
        }
        return Result.failure(selection.getOutcome().getFailureReason(), selection.getMessage(), selection);
    }
}
