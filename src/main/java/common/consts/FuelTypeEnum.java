package common.consts;

import com.fasterxml.jackson.annotation.JsonCreator;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 主机燃料类型枚举
 * 船队必须覆盖场景要求的全部燃料类型
 */
@Getter
@AllArgsConstructor
public enum FuelTypeEnum {
    DISTILLATE_FUEL("Distillate fuel"),
    LPG_PROPANE("LPG (Propane)"),
    LPG_BUTANE("LPG (Butane)"),
    LNG("LNG"),
    METHANOL("Methanol"),
    ETHANOL("Ethanol"),
    AMMONIA("Ammonia"),
    HYDROGEN("Hydrogen");

    private final String desc;

    /**
     * 按枚举名或展示名解析 (忽略大小写) AIS 数据里的 "DISTILLATE FUEL" 也能识别
     * 无法识别时返回 null 由数据表校验统一报告
     */
    @JsonCreator
    public static FuelTypeEnum parse(String value) {
        if (value == null) return null;
        String trimmed = value.trim();
        for (FuelTypeEnum fuel : values()) {
            if (fuel.name().equalsIgnoreCase(trimmed) || fuel.getDesc().equalsIgnoreCase(trimmed)) {
                return fuel;
            }
        }
        return null;
    }
}
