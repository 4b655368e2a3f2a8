package model.bo;

import common.consts.SelectionOutcomeEnum;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * 一次选船算法的输出
 * 不可行时 fleet 为空 约束未满足时 fleet 保留但带标签 绝不冒充最优
 */
@Value
@Builder
public class FleetSelection {
    String algorithm;
    String scenarioLabel;
    SelectionOutcomeEnum outcome;
    Fleet fleet;
    FleetMetrics metrics;
    ConstraintCheck constraintCheck;
    @Singular("logEntry")
    List<SelectionLogEntry> selectionLog;
    OptimalityCertificate certificate;  // 仅精确求解器
    String message;

    public boolean isSatisfied() {
        return outcome == SelectionOutcomeEnum.SATISFIED;
    }
}
