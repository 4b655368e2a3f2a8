package common.exception;

import common.consts.FailureReasonEnum;
import lombok.Getter;

/**
 * 业务异常 携带失败原因标签 由全局异常处理器转为结构化结果
 */
@Getter
public class BusinessException extends RuntimeException {
    private final FailureReasonEnum reason;

    public BusinessException(FailureReasonEnum reason, String message) {
        super(message);
        this.reason = reason;
    }
}
