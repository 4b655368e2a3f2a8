package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 船舶入选阶段 (用于审计与可解释性)
 */
@Getter
@AllArgsConstructor
public enum SelectionPhaseEnum {
    SEED("燃料类型代表"),
    FILL("按单位DWT成本补足运力"),
    OPTIMIZER("整数规划最优解");

    private final String desc;
}
