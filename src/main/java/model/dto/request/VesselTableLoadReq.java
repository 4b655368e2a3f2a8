package model.dto.request;

import lombok.Data;
import model.entity.Vessel;

import java.util.List;

/**
 * 登记某个碳价下的船舶指标表 (上游成本模型的输出)
 */
@Data
public class VesselTableLoadReq {
    private Double carbonPrice;
    private List<Vessel> vessels;
}
