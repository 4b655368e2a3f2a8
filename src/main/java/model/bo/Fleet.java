package model.bo;

import lombok.EqualsAndHashCode;

import java.util.Collection;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 船队: 船舶ID集合 (无重复 创建后不可变)
 */
@EqualsAndHashCode
public final class Fleet {

    private final SortedSet<String> vesselIds;

    private Fleet(SortedSet<String> vesselIds) {
        this.vesselIds = Collections.unmodifiableSortedSet(vesselIds);
    }

    public static Fleet of(Collection<String> ids) {
        return new Fleet(new TreeSet<>(ids));
    }

    public SortedSet<String> getVesselIds() {
        return vesselIds;
    }

    public int size() {
        return vesselIds.size();
    }

    @Override
    public String toString() {
        return "Fleet" + vesselIds;
    }
}
