package model.dto.response;

import lombok.Data;
import model.bo.FleetSelection;

/**
 * 贪心与精确求解的对比
 */
@Data
public class ComparisonResp {
    private String scenarioLabel;
    private FleetSelection greedy;
    private FleetSelection exact;
    private Double savings;       // 贪心成本 - 最优成本 两者都有船队时才有值
    private Double savingsPct;
    private Double safetyDelta;   // 最优安全分 - 贪心安全分
}
