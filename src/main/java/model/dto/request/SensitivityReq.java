package model.dto.request;

import lombok.Data;

import java.util.List;

@Data
public class SensitivityReq {
    private List<ScenarioReq> scenarios;
}
