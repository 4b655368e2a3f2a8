package model.dto.response;

import common.consts.SelectionOutcomeEnum;
import lombok.Data;

/**
 * 场景敏感性对比的一行
 */
@Data
public class SensitivityRow {
    private String scenarioLabel;
    private double carbonPrice;
    private double safetyFloor;
    private SelectionOutcomeEnum greedyOutcome;
    private Double greedyCost;
    private Double greedySafety;
    private Integer greedyFleetSize;
    private SelectionOutcomeEnum exactOutcome;
    private Double exactCost;
    private Double exactSafety;
    private Integer exactFleetSize;
    private Double savings;
}
