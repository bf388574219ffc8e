package dev.sfc.model;

/**
 * Which SFC routine to pick out of an L5X document and whether to read step
 * presets from the owning program's tags.
 */
public record LoadOptions(
    String programName, // nullable, null picks the first program with an SFC routine
    String routineName, // nullable, null picks the first SFC routine of the program
    boolean loadPresets
) {
    public static final boolean DEFAULT_LOAD_PRESETS = true;

    public static LoadOptions defaults() {
        return new LoadOptions(null, null, DEFAULT_LOAD_PRESETS);
    }

    public LoadOptions withProgram(String name) {
        return new LoadOptions(name, routineName, loadPresets);
    }

    public LoadOptions withRoutine(String name) {
        return new LoadOptions(programName, name, loadPresets);
    }

    public LoadOptions withoutPresets() {
        return new LoadOptions(programName, routineName, false);
    }
}
