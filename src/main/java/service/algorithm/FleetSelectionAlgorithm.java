package service.algorithm;

import model.bo.FleetSelection;
import model.bo.Scenario;
import model.bo.VesselTable;

/**
 * 选船算法接口
 * 贪心启发式与精确求解器都实现它 互相可替换
 */
public interface FleetSelectionAlgorithm {

    /**
     * 算法名 (接口路由用)
     */
    String getName();

    /**
     * 在给定场景下选出一支船队
     * @param table    场景的船舶表 (只读)
     * @param scenario 场景参数
     * @return 带结果标签的选船输出 不可行/约束未满足都不抛异常
     */
    FleetSelection select(VesselTable table, Scenario scenario);
}
