package com.skystack.pipeline.acquisition;

public enum AcquisitionState {
    SAMPLING,
    QUERYING,
    GROUPING,
    SELECTING,
    DOWNLOADING,
    NORMALIZING,
    STACKING,
    ENHANCING,
    PERSISTED
}
