package com.propertyintel.gap.model;

import lombok.Getter;
import lombok.ToString;

/**
 * A map pin for one complex or building, keyed by its marker id.
 * The listing count only ever grows as better counts are observed.
 */
@Getter
@ToString
public class Marker {

    private final String id;
    private final AssetType assetType;
    private String displayName;
    private int reportedCount;

    public Marker(String id, AssetType assetType, String displayName, int reportedCount) {
        this.id = id;
        this.assetType = assetType;
        this.displayName = displayName == null ? "" : displayName;
        this.reportedCount = Math.max(0, reportedCount);
    }

    /**
     * @return true if the count increased
     */
    public boolean raiseCount(int observed) {
        if (observed > reportedCount) {
            reportedCount = observed;
            return true;
        }
        return false;
    }

    public void rename(String name) {
        if (name != null && !name.isBlank()) {
            displayName = name;
        }
    }
}
