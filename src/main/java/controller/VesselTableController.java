package controller;

import common.Result;
import common.config.FleetOptimizerProperties;
import model.bo.Scenario;
import model.bo.VesselTable;
import model.dto.request.VesselTableLoadReq;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import service.provider.VesselMetricsProvider;

import java.util.HashMap;
import java.util.Map;

/**
 * 船舶指标数据接口
 */
@RestController
@RequestMapping("/vessels")
public class VesselTableController {

    private final VesselMetricsProvider vesselMetricsProvider;
    private final FleetOptimizerProperties properties;

    public VesselTableController(VesselMetricsProvider vesselMetricsProvider, FleetOptimizerProperties properties) {
        this.vesselMetricsProvider = vesselMetricsProvider;
        this.properties = properties;
    }

    // POST /vessels/load 同一碳价重复登记时覆盖
    @PostMapping("/load")
    public Result load(@RequestBody VesselTableLoadReq req) {
        double carbonPrice = req.getCarbonPrice() == null ? properties.getDefaultCarbonPrice() : req.getCarbonPrice();
        VesselTable table = vesselMetricsProvider.register(carbonPrice, req.getVessels());
        Map<String, Object> result = new HashMap<>();
        result.put("carbonPrice", carbonPrice);
        result.put("vesselCount", table.size());
        result.put("fuelTypes", table.fuelTypes());
        return Result.success("登记成功", result);
    }

    @GetMapping
    public Result list(@RequestParam(name = "carbonPrice", required = false) Double carbonPrice) {
        double price = carbonPrice == null ? properties.getDefaultCarbonPrice() : carbonPrice;
        Scenario scenario = Scenario.builder().carbonPrice(price).build();
        return Result.success("查询成功", vesselMetricsProvider.loadVessels(scenario).getVessels());
    }

    @GetMapping("/carbon-prices")
    public Result carbonPrices() {
        return Result.success(vesselMetricsProvider.availableCarbonPrices());
    }

    @PostMapping("/reset")
    public Result reset() {
        vesselMetricsProvider.reset();
        return Result.success();
    }
}
