package model.dto.request;

import lombok.Data;

/**
 * 待核验的第三方声明
 */
@Data
public class ClaimCheckReq {
    private ScenarioReq scenario;
    private Integer fleetSize;
    private Double safetyFloor;
    private Double costCeiling;
}
