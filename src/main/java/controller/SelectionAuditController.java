package controller;

import common.Result;
import common.consts.FailureReasonEnum;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import service.algorithm.impl.SelectionAuditLog;

import java.time.Instant;
import java.util.List;

/**
 * 选船审计日志查询接口
 */
@RestController
@RequestMapping("/fleet/audit")
public class SelectionAuditController {

    private final SelectionAuditLog auditLog;

    public SelectionAuditController(SelectionAuditLog auditLog) {
        this.auditLog = auditLog;
    }

    /**
     * 查询某时刻之后的记录 可按失败原因过滤
     */
    @GetMapping
    public Result list(@RequestParam(name = "since", required = false)
                       @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant since,
                       @RequestParam(name = "reason", required = false) FailureReasonEnum reason) {
        List<SelectionAuditLog.AuditEntry> entries = auditLog.listSince(since, reason);
        return Result.success("查询成功", entries);
    }

    @GetMapping("/all")
    public Result listAll() {
        return Result.success("查询成功", auditLog.listAll());
    }

    @PostMapping("/clear")
    public Result clear() {
        auditLog.clear();
        return Result.success();
    }
}
