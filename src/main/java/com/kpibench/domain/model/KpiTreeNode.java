package com.kpibench.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One KPI of the catalog tree as exposed to the reporting layer.
 *
 * lineage lists the keys from the level-1 ancestor down to this KPI.
 */
@Value
@Builder
public class KpiTreeNode {

    String key;
    String name;
    int level;
    String unit;
    boolean higherIsBetter;
    boolean mapped;
    String formula;
    List<String> lineage;
    List<KpiTreeNode> children;
}
