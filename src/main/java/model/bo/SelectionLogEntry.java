package model.bo;

import common.consts.SelectionPhaseEnum;
import lombok.Value;

/**
 * 选船日志条目: 船舶 -> 阶段 -> 入选顺序
 */
@Value
public class SelectionLogEntry {
    String vesselId;
    SelectionPhaseEnum phase;
    int rank;
    String reason;
}
