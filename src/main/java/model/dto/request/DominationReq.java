package model.dto.request;

import lombok.Data;

import java.util.List;

@Data
public class DominationReq {
    private ScenarioReq scenario;
    private List<String> baselineVesselIds; // 为空时以贪心结果为基准
    private Double step;
}
