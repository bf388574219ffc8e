package dev.sfc.engine;

import dev.sfc.model.Step;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Optional;

/**
 * Copies timer presets from program tags onto steps. A step's tag is the tag
 * named exactly like the step's operand; its preset is the {@code PRE} member.
 */
public final class PresetLoader {

    private static final Logger log = LoggerFactory.getLogger(PresetLoader.class);

    public static final String PRESET_MEMBER = "PRE";

    private PresetLoader() {}

    /**
     * Set the preset of every step that has a tag with a usable {@code PRE}
     * value. Steps without one are left untouched.
     *
     * @return the number of steps that received a preset
     */
    public static int apply(Collection<Step> steps, TagDictionary tags) {
        int loaded = 0;
        for (Step step : steps) {
            Optional<String> raw = tags.memberValue(step.operand(), PRESET_MEMBER);
            if (raw.isEmpty()) {
                continue;
            }
            Integer preset = parsePreset(raw.get());
            if (preset == null) {
                log.debug("Ignoring preset '{}' of tag {} for step {}", raw.get(), step.operand(), step.id());
                continue;
            }
            step.setPreset(preset);
            loaded++;
        }
        return loaded;
    }

    static Integer parsePreset(String value) {
        try {
            int preset = Integer.parseInt(value.trim());
            return preset < 0 ? null : preset;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
