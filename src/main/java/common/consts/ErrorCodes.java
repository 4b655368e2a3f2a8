package common.consts;

/**
 * 全局错误信息常量池
 */
public class ErrorCodes {
    // 基础错误
    public static final String SYSTEM_ERROR = "系统内部错误";

    // 数据错误
    public static final String EMPTY_VESSEL_TABLE = "船舶数据表为空";
    public static final String DATASET_NOT_FOUND = "未加载碳价为 %s 的船舶数据";
    public static final String VESSEL_NOT_IN_TABLE = "船队引用了不存在的船舶: %s";
    public static final String UNKNOWN_ALGORITHM = "未知的选船算法: %s";

    // 参数错误
    public static final String SCENARIO_REQUIRED = "必须提供场景参数";
    public static final String INVALID_SAFETY_FLOOR = "安全分下限必须是有限数值";
    public static final String INVALID_CARGO_REQUIREMENT = "运力需求 (DWT) 必须为正数";
    public static final String INVALID_FLEET_SIZE = "船队规模必须为正整数";
    public static final String INVALID_SIZE_RANGE = "船队规模区间不合法: [%d, %d]";
    public static final String INVALID_COST_CEILING = "成本上限必须为非负数";
    public static final String INVALID_STEP = "安全分搜索步长必须为正数";
    public static final String TOO_MANY_PROBES = "安全分搜索需要 %d 次求解 超过上限 %d, 请增大步长";
    public static final String EMPTY_SAFETY_LEVELS = "安全分扫描列表不能为空";
}
