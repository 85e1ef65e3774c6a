package org.carball.showplan.layout;

import lombok.Builder;
import lombok.Data;

/**
 * Geometry used by {@link PlanLayoutEngine}, in pixels.
 */
@Data
@Builder(toBuilder = true)
public class LayoutSettings {

    @Builder.Default
    private double nodeWidth = 150;

    @Builder.Default
    private double horizontalSpacing = 180;

    @Builder.Default
    private double verticalSpacing = 24;

    @Builder.Default
    private double padding = 40;

    // Node content rows
    @Builder.Default
    private double iconRow = 36;

    @Builder.Default
    private double primaryLine = 17;

    @Builder.Default
    private double secondaryLine = 15;

    @Builder.Default
    private double nodePadding = 12;

    @Builder.Default
    private double minNodeHeight = 90;

    public static LayoutSettings defaults() {
        return LayoutSettings.builder().build();
    }
}
