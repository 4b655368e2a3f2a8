package common.exception;

import common.Result;
import common.consts.ErrorCodes;
import common.consts.FailureReasonEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import service.algorithm.impl.SelectionAuditLog;

/**
 * 全局异常处理器
 * 捕获所有异常 记录日志和审计 并以带标签的结果返回
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private final SelectionAuditLog auditLog;

    public GlobalExceptionHandler(SelectionAuditLog auditLog) {
        this.auditLog = auditLog;
    }

    /**
     * 输入数据不合法 返回全部问题列表
     */
    @ExceptionHandler(MalformedInputException.class)
    public Result handleMalformedInput(MalformedInputException e) {
        log.warn("输入不合法: {}", e.getMessage());
        auditLog.recordFailure(e.getReason(), e.getMessage(), null);
        return Result.failure(e.getReason(), e.getMessage(), e.getProblems());
    }

    /**
     * 处理业务异常
     */
    @ExceptionHandler(BusinessException.class)
    public Result handleBusinessException(BusinessException e) {
        log.warn("业务异常 [{}]: {}", e.getReason(), e.getMessage());
        auditLog.recordFailure(e.getReason(), e.getMessage(), null);
        return Result.failure(e.getReason(), e.getMessage(), null);
    }

    /**
     * 请求体无法解析
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public Result handleUnreadable(HttpMessageNotReadableException e) {
        log.warn("请求体无法解析: {}", e.getMessage());
        auditLog.recordFailure(FailureReasonEnum.MALFORMED_INPUT, "请求体无法解析", e);
        return Result.failure(FailureReasonEnum.MALFORMED_INPUT, "请求体无法解析: " + e.getMostSpecificCause().getMessage(), null);
    }

    /**
     * 处理所有其他异常
     */
    @ExceptionHandler(Exception.class)
    public Result handleException(Exception e) {
        log.error("系统异常", e);
        auditLog.recordFailure(FailureReasonEnum.SOLVER_ERROR, "系统异常: " + e.getClass().getSimpleName(), e);
        return Result.error(ErrorCodes.SYSTEM_ERROR + ": " + e.getMessage());
    }
}
