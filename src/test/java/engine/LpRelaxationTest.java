package engine;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.ojalgo.optimisation.Optimisation;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LP 松弛测试")
class LpRelaxationTest {

    @Test
    @DisplayName("求解状态映射: 只有 INFEASIBLE 判为不可行 INVALID 判为求解失败")
    void testStateClassification() {
        assertEquals(LpRelaxation.Kind.SOLVED, LpRelaxation.classify(Optimisation.State.OPTIMAL));
        assertEquals(LpRelaxation.Kind.SOLVED, LpRelaxation.classify(Optimisation.State.DISTINCT));
        assertEquals(LpRelaxation.Kind.INFEASIBLE, LpRelaxation.classify(Optimisation.State.INFEASIBLE));
        assertEquals(LpRelaxation.Kind.FAILED, LpRelaxation.classify(Optimisation.State.INVALID));
        assertEquals(LpRelaxation.Kind.FAILED, LpRelaxation.classify(Optimisation.State.UNBOUNDED));
        assertEquals(LpRelaxation.Kind.FAILED, LpRelaxation.classify(Optimisation.State.FAILED));
        // 未证明最优的可行解不能用作下界
        assertEquals(LpRelaxation.Kind.FAILED, LpRelaxation.classify(Optimisation.State.FEASIBLE));
    }
}
