package com.phillippitts.mediametric.domain;

/**
 * Transcoder filters an asset may request per stream.
 *
 * <p>Declaration order is the fixed order in which the filters are applied after frame
 * selection; the scale to compute geometry is inserted right after the geometric filters.
 */
public enum FilterKey {
    CROP("crop", true),
    PAD("pad", true),
    GBLUR("gblur", false),
    EQ("eq", false),
    LUTYUV("lutyuv", false),
    YADIF("yadif", false);

    private final String filterName;
    private final boolean geometric;

    FilterKey(String filterName, boolean geometric) {
        this.filterName = filterName;
        this.geometric = geometric;
    }

    public String filterName() {
        return filterName;
    }

    /**
     * Geometric filters change the frame size, so the compute geometry must be set explicitly.
     */
    public boolean isGeometric() {
        return geometric;
    }
}
