package model.bo;

import lombok.Builder;
import lombok.Value;

/**
 * 分支定界的最优性证明
 * exhausted=true 表示搜索树已穷尽 所有未展开的节点都被下界或不可行剪掉
 */
@Value
@Builder
public class OptimalityCertificate {
    Double rootBound;        // 根节点 LP 松弛下界 根节点不可行时为空
    long nodesExplored;
    long nodesPrunedByBound;
    long nodesInfeasible;
    long incumbentUpdates;
    boolean exhausted;
}
