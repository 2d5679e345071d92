package pvcmigrator.volume;

import java.util.List;

/**
 * Resolved destination spec plus the fallbacks that were applied to reach it.
 */
public record VolumeResolution(VolumeSpec spec, List<String> warnings) {

    public VolumeResolution {
        warnings = List.copyOf(warnings);
    }
}
