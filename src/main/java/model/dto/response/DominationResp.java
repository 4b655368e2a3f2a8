package model.dto.response;

import lombok.Data;

import java.util.List;

/**
 * 支配搜索结果
 */
@Data
public class DominationResp {
    private List<String> baselineVesselIds;
    private double baselineCost;      // C0
    private double baselineSafety;    // S0
    private boolean dominated;        // 是否找到支配基准的船队
    private AnalyticsRow best;        // 最高可行阈值下的船队 未找到时为空
    private Double costSaving;        // C0 - 最优成本
    private Double safetyGain;        // 最优安全分 - S0
    private List<AnalyticsRow> probes;
    private String message;
}
