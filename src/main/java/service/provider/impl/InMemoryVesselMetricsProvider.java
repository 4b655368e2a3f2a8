package service.provider.impl;

import common.consts.ErrorCodes;
import common.consts.FailureReasonEnum;
import common.exception.BusinessException;
import lombok.extern.slf4j.Slf4j;
import model.bo.Scenario;
import model.bo.VesselTable;
import model.entity.Vessel;
import org.springframework.stereotype.Service;
import service.provider.VesselMetricsProvider;

import java.util.Collection;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 内存版船舶指标提供者
 * 每个碳价一份不可变船舶表 读多写少
 */
@Slf4j
@Service
public class InMemoryVesselMetricsProvider implements VesselMetricsProvider {

    private final Map<Double, VesselTable> tables = new ConcurrentHashMap<>();

    @Override
    public VesselTable loadVessels(Scenario scenario) {
        VesselTable table = tables.get(scenario.getCarbonPrice());
        if (table == null) {
            throw new BusinessException(FailureReasonEnum.DATASET_NOT_FOUND,
                    String.format(ErrorCodes.DATASET_NOT_FOUND, scenario.getCarbonPrice()));
        }
        return table;
    }

    @Override
    public VesselTable register(double carbonPrice, Collection<Vessel> vessels) {
        VesselTable table = VesselTable.of(vessels);
        tables.put(carbonPrice, table);
        log.info("登记船舶数据: 碳价={}, 船数={}, 燃料类型={}", carbonPrice, table.size(), table.fuelTypes().size());
        return table;
    }

    @Override
    public SortedSet<Double> availableCarbonPrices() {
        return new TreeSet<>(tables.keySet());
    }

    @Override
    public void reset() {
        tables.clear();
        log.info("船舶数据已清空");
    }
}
