package dev.divertscan.tickets.model;

/**
 * Fixed material taxonomy used for diversion reporting. Declaration order is significant: it is
 * the tie-break order used by the material classifier.
 */
public enum MaterialType {

    CONCRETE("concrete", "Concrete"),
    ASPHALT("asphalt", "Asphalt"),
    METAL_FERROUS("metal_ferrous", "Metal (Ferrous)"),
    METAL_NONFERROUS("metal_nonferrous", "Metal (Non-Ferrous)"),
    WOOD_CLEAN("wood_clean", "Wood (Clean)"),
    WOOD_TREATED("wood_treated", "Wood (Treated)"),
    CARDBOARD("cardboard", "Cardboard"),
    PAPER("paper", "Paper"),
    PLASTIC("plastic", "Plastic"),
    GLASS("glass", "Glass"),
    DRYWALL("drywall", "Drywall"),
    INSULATION("insulation", "Insulation"),
    ROOFING("roofing", "Roofing"),
    BRICK_MASONRY("brick_masonry", "Brick & Masonry"),
    SOIL_LAND_CLEARING("soil_land_clearing", "Soil & Land Clearing"),
    MIXED_CND("mixed_c_and_d", "Mixed C&D"),
    HAZARDOUS("hazardous", "Hazardous"),
    OTHER("other", "Other");

    private final String code;
    private final String displayName;

    MaterialType(String code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    public String code() {
        return code;
    }

    public String displayName() {
        return displayName;
    }
}
