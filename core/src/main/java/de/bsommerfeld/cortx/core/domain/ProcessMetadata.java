package de.bsommerfeld.cortx.core.domain;

/**
 * Informational launch metadata carried through to status events. For services
 * this is the active mode and argument preset; scripts usually carry
 * {@link #NONE}.
 *
 * @param mode      active mode name, may be {@code null}
 * @param argPreset active argument preset name, may be {@code null}
 */
public record ProcessMetadata(String mode, String argPreset) {

    public static final ProcessMetadata NONE = new ProcessMetadata(null, null);

    public static ProcessMetadata of(String mode, String argPreset) {
        if (mode == null && argPreset == null)
            return NONE;
        return new ProcessMetadata(mode, argPreset);
    }

    public boolean isEmpty() {
        return mode == null && argPreset == null;
    }
}
