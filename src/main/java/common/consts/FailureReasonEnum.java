package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 失败原因分类
 * 所有失败都以带标签的结构化结果返回给调用方
 */
@Getter
@AllArgsConstructor
public enum FailureReasonEnum {
    MALFORMED_INPUT(400, "输入数据不合法"),
    DATASET_NOT_FOUND(404, "未找到对应碳价的船舶数据"),
    INFEASIBLE_SCENARIO(409, "场景不可行"),
    CONSTRAINT_UNSATISFIED(422, "启发式结果未满足约束"),
    SOLVER_ERROR(500, "求解器异常");

    private final int code;
    private final String desc;
}
