package service.algorithm.impl;

import common.config.FleetOptimizerProperties;
import common.consts.FailureReasonEnum;
import lombok.Data;
import model.bo.FleetSelection;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 选船审计日志
 * 记录带失败标签的选船结果和接口异常 环形缓冲 供调用方查询
 */
@Component
public class SelectionAuditLog {

    private final int capacity;
    private final Deque<AuditEntry> buffer;

    public SelectionAuditLog(FleetOptimizerProperties properties) {
        this.capacity = Math.max(1, properties.getAuditCapacity());
        this.buffer = new ArrayDeque<>(capacity);
    }

    /**
     * 记录一次未满足的选船结果 满足的结果不记录
     */
    public synchronized void recordSelection(FleetSelection selection) {
        if (selection == null || selection.isSatisfied()) {
            return;
        }
        AuditEntry entry = new AuditEntry();
        entry.setReason(selection.getOutcome().getFailureReason());
        entry.setScenarioLabel(selection.getScenarioLabel());
        entry.setAlgorithm(selection.getAlgorithm());
        entry.setMessage(selection.getMessage());
        entry.setRecordedAt(Instant.now());
        addEntry(entry);
    }

    /**
     * 记录接口层异常
     */
    public synchronized void recordFailure(FailureReasonEnum reason, String message, Throwable cause) {
        AuditEntry entry = new AuditEntry();
        entry.setReason(reason);
        entry.setMessage(message);
        entry.setCause(cause != null ? cause.getClass().getSimpleName() + ": " + cause.getMessage() : null);
        entry.setRecordedAt(Instant.now());
        addEntry(entry);
    }

    private void addEntry(AuditEntry entry) {
        if (buffer.size() >= capacity) {
            buffer.removeFirst();
        }
        buffer.addLast(entry);
    }

    /**
     * 查询指定时刻之后的记录 可按失败原因过滤
     */
    public synchronized List<AuditEntry> listSince(Instant since, FailureReasonEnum reason) {
        List<AuditEntry> result = new ArrayList<>();
        for (AuditEntry entry : buffer) {
            if (since != null && entry.getRecordedAt().isBefore(since)) continue;
            if (reason != null && entry.getReason() != reason) continue;
            result.add(entry);
        }
        return result;
    }

    public synchronized List<AuditEntry> listAll() {
        return new ArrayList<>(buffer);
    }

    public synchronized void clear() {
        buffer.clear();
    }

    @Data
    public static class AuditEntry {
        private FailureReasonEnum reason;
        private String scenarioLabel;
        private String algorithm;
        private String message;
        private String cause;
        private Instant recordedAt;
    }
}
