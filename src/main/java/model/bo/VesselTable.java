package model.bo;

import common.consts.ErrorCodes;
import common.consts.FuelTypeEnum;
import common.exception.MalformedInputException;
import model.entity.Vessel;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 一个场景的船舶表 (不可变 按船舶ID排序)
 * 构造时完成全部校验 之后的搜索不再检查字段
 */
public final class VesselTable {

    private final List<Vessel> vessels;
    private final Map<String, Vessel> index;
    private final Map<FuelTypeEnum, List<Vessel>> byFuelType;

    private VesselTable(List<Vessel> sorted) {
        this.vessels = Collections.unmodifiableList(sorted);
        Map<String, Vessel> idx = new LinkedHashMap<>();
        Map<FuelTypeEnum, List<Vessel>> groups = new EnumMap<>(FuelTypeEnum.class);
        for (Vessel v : sorted) {
            idx.put(v.getVesselId(), v);
            groups.computeIfAbsent(v.getMainFuelType(), k -> new ArrayList<>()).add(v);
        }
        groups.replaceAll((k, list) -> Collections.unmodifiableList(list));
        this.index = Collections.unmodifiableMap(idx);
        this.byFuelType = Collections.unmodifiableMap(groups);
    }

    /**
     * 校验并建表
     * @throws MalformedInputException 缺字段 / DWT 非正 / 成本为负 / ID 重复
     */
    public static VesselTable of(Collection<Vessel> rows) {
        if (rows == null || rows.isEmpty()) {
            throw new MalformedInputException(ErrorCodes.EMPTY_VESSEL_TABLE);
        }
        List<String> problems = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int row = 0;
        for (Vessel v : rows) {
            row++;
            if (v == null) {
                problems.add("第 " + row + " 行为空");
                continue;
            }
            String id = v.getVesselId();
            String at = "船舶 [" + (id == null ? "第" + row + "行" : id) + "] ";
            if (id == null || id.isBlank()) {
                problems.add(at + "缺少 vesselId");
            } else if (!seen.add(id)) {
                problems.add(at + "ID 重复");
            }
            if (v.getMainFuelType() == null) {
                problems.add(at + "缺少或无法识别 mainFuelType");
            }
            if (!isFinite(v.getDwt()) || v.getDwt() <= 0) {
                problems.add(at + "dwt 必须为正数: " + v.getDwt());
            }
            if (!isFinite(v.getAdjustedCost()) || v.getAdjustedCost() < 0) {
                problems.add(at + "adjustedCost 必须为非负数: " + v.getAdjustedCost());
            }
            if (!isFinite(v.getSafetyScore())) {
                problems.add(at + "缺少 safetyScore");
            }
            if (v.getCo2Eq() != null && (!isFinite(v.getCo2Eq()) || v.getCo2Eq() < 0)) {
                problems.add(at + "co2Eq 不能为负: " + v.getCo2Eq());
            }
            if (v.getFuelTotal() != null && (!isFinite(v.getFuelTotal()) || v.getFuelTotal() < 0)) {
                problems.add(at + "fuelTotal 不能为负: " + v.getFuelTotal());
            }
        }
        if (!problems.isEmpty()) {
            throw new MalformedInputException(problems);
        }
        List<Vessel> sorted = new ArrayList<>(rows);
        sorted.sort(Comparator.comparing(Vessel::getVesselId));
        return new VesselTable(sorted);
    }

    private static boolean isFinite(Double value) {
        return value != null && Double.isFinite(value);
    }

    public List<Vessel> getVessels() {
        return vessels;
    }

    public int size() {
        return vessels.size();
    }

    public Vessel get(String vesselId) {
        return index.get(vesselId);
    }

    public List<Vessel> byFuelType(FuelTypeEnum fuelType) {
        return byFuelType.getOrDefault(fuelType, List.of());
    }

    public Set<FuelTypeEnum> fuelTypes() {
        return byFuelType.isEmpty()
                ? EnumSet.noneOf(FuelTypeEnum.class)
                : EnumSet.copyOf(byFuelType.keySet());
    }

    /**
     * 表中最高的单船安全分 (平均安全分不可能超过它)
     */
    public double maxSafetyScore() {
        double max = Double.NEGATIVE_INFINITY;
        for (Vessel v : vessels) {
            max = Math.max(max, v.getSafetyScore());
        }
        return max;
    }
}
