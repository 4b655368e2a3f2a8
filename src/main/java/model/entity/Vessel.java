package model.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import common.consts.FuelTypeEnum;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 候选船舶 (上游成本模型按场景碳价输出的一行)
 * 在一次选船/分析运行内只读
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Vessel {
    String vesselId;            // 船舶ID
    Double dwt;                 // 载重吨
    FuelTypeEnum mainFuelType;  // 主机燃料类型
    Double safetyScore;         // 安全分 (通常 1~5)
    Double adjustedCost;        // 调整后月度成本 (美元)
    Double co2Eq;               // CO2当量排放 (吨)
    Double fuelTotal;           // 燃料消耗 (吨)

    /**
     * 单位DWT成本 随场景的调整成本变化
     */
    public double getCostPerDwt() {
        return adjustedCost / dwt;
    }

    @JsonIgnore
    public double getCo2EqOrZero() {
        return co2Eq == null ? 0.0 : co2Eq;
    }

    @JsonIgnore
    public double getFuelTotalOrZero() {
        return fuelTotal == null ? 0.0 : fuelTotal;
    }
}
