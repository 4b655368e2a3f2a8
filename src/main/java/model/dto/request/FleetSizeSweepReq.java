package model.dto.request;

import lombok.Data;

@Data
public class FleetSizeSweepReq {
    private ScenarioReq scenario;
    private Integer minSize;
    private Integer maxSize;
}
