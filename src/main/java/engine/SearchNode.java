package engine;

import java.util.Arrays;

/**
 * 分支定界搜索树节点 (不可变)
 * 只记录哪些变量被固定为 0/1 以及父节点的下界 其余信息取自求解上下文
 */
public final class SearchNode {

    public static final int FREE = -1;

    private final int[] fixings;
    private final double parentBound;
    private final int depth;

    private SearchNode(int[] fixings, double parentBound, int depth) {
        this.fixings = fixings;
        this.parentBound = parentBound;
        this.depth = depth;
    }

    public static SearchNode root(int size) {
        int[] fixings = new int[size];
        Arrays.fill(fixings, FREE);
        return new SearchNode(fixings, Double.NEGATIVE_INFINITY, 0);
    }

    /**
     * 生成子节点 父节点不受影响
     */
    public SearchNode branch(int index, int value, double bound) {
        int[] copy = fixings.clone();
        copy[index] = value;
        return new SearchNode(copy, bound, depth + 1);
    }

    public int size() {
        return fixings.length;
    }

    public int fixingOf(int index) {
        return fixings[index];
    }

    public boolean isFree(int index) {
        return fixings[index] == FREE;
    }

    public int freeCount() {
        int count = 0;
        for (int f : fixings) {
            if (f == FREE) count++;
        }
        return count;
    }

    public double getParentBound() {
        return parentBound;
    }

    public int getDepth() {
        return depth;
    }

    public boolean isRoot() {
        return depth == 0;
    }
}
