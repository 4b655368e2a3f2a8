package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 选船结果标签
 */
@Getter
@AllArgsConstructor
public enum SelectionOutcomeEnum {
    SATISFIED(null),
    CONSTRAINT_UNSATISFIED(FailureReasonEnum.CONSTRAINT_UNSATISFIED),
    INFEASIBLE_SCENARIO(FailureReasonEnum.INFEASIBLE_SCENARIO),
    SOLVER_ERROR(FailureReasonEnum.SOLVER_ERROR);

    // 对应的失败原因 成功时为 null
    private final FailureReasonEnum failureReason;
}
