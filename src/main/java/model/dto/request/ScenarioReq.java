package model.dto.request;

import common.consts.FuelTypeEnum;
import lombok.Data;

import java.util.List;

/**
 * 场景参数 省略的字段取配置缺省值
 */
@Data
public class ScenarioReq {
    private String label;
    private Double safetyFloor;
    private Double cargoRequirementDwt;
    private List<FuelTypeEnum> requiredFuelTypes; // 为空表示全部 8 种
    private Double carbonPrice;
}
