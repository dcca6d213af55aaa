package io.fabflow.serialization;

/// JSON field names of a change descriptor.
final class ChangeFields {

    static final String POLARITY = "polarity";
    static final String PRIMARY_MATERIAL = "primary_material";
    static final String AFFECTED_MATERIALS = "affected_materials";
    static final String ASPECT_RATIO = "aspect_ratio";
    static final String CONFORMALITY_SCORE = "conformality_score";
    static final String TARGET_METRIC = "target_metric";
    static final String WAFER_SIZE = "wafer_size";
    static final String ORDER_INDEX = "order_index";
    static final String PATTERNING = "patterning";
    static final String STEP_ID = "step_id";

    private ChangeFields() {}
}
