package service.provider;

import model.bo.Scenario;
import model.bo.VesselTable;
import model.entity.Vessel;

import java.util.Collection;
import java.util.SortedSet;

/**
 * 船舶指标提供者
 * 上游 (AIS 解析 / 排放 / 成本分解) 的输出 按碳价给出每艘船的一行指标
 */
public interface VesselMetricsProvider {

    /**
     * 取场景碳价对应的船舶表
     * @throws common.exception.BusinessException 该碳价没有数据时 (DATASET_NOT_FOUND)
     */
    VesselTable loadVessels(Scenario scenario);

    /**
     * 登记某个碳价下的船舶数据 会先做校验 同一碳价重复登记时覆盖
     */
    VesselTable register(double carbonPrice, Collection<Vessel> vessels);

    SortedSet<Double> availableCarbonPrices();

    void reset();
}
