package com.phillippitts.mediametric.service.orchestration;

/**
 * States of the per-asset pipeline, in the only order they are entered.
 */
public enum AssetRunState {
    CACHE_CHECK,
    VALIDATE,
    PATH_RESOLVE,
    TEARDOWN,
    OPEN_TRANSCODE,
    OPEN_TRANSFORM,
    LOG_INIT,
    COMPUTE,
    READ_RESULT,
    CACHE_SAVE,
    CLEANUP,
    DONE
}
